package docbro.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;
import com.google.gson.reflect.TypeToken;

import docbro.errors.ValidationException;

import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON encoding for the opaque payload columns (settings, statistics, metadata)
 * and for exported snapshots.
 *
 * Integers decode as {@link Long} and fractions as {@link Double}; maps passed
 * through {@link #normalize(Map)} use the same representation, so an in-memory
 * map compares equal to the map read back from storage.
 */
public final class JsonCodec {

    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    private static final Gson GSON = new GsonBuilder()
            .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
            .serializeNulls()
            .disableHtmlEscaping()
            .create();

    private static final Gson PRETTY = GSON.newBuilder()
            .setPrettyPrinting()
            .create();

    private JsonCodec() {
    }

    public static Gson gson() {
        return GSON;
    }

    public static Gson prettyGson() {
        return PRETTY;
    }

    public static String toJson(Object value) {
        return GSON.toJson(value);
    }

    /**
     * Decode a JSON object. Null or blank input decodes to an empty map.
     *
     * @throws ValidationException if the text is not a JSON object
     */
    public static Map<String, Object> toMap(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> decoded = GSON.fromJson(json, MAP_TYPE);
            return decoded != null ? new LinkedHashMap<>(decoded) : new LinkedHashMap<>();
        } catch (JsonParseException | IllegalStateException e) {
            throw new ValidationException("Malformed JSON object: " + e.getMessage());
        }
    }

    /**
     * Deep copy with canonical number types. Null yields an empty, unmodifiable map.
     */
    public static Map<String, Object> normalize(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(toMap(toJson(values)));
    }

    /**
     * Size in bytes of the UTF-8 JSON encoding of a value.
     */
    public static long utf8Size(Object value) {
        return toJson(value).getBytes(StandardCharsets.UTF_8).length;
    }
}
