package docbro.project.settings;

import docbro.json.JsonCodec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Shared storage and validation for the settings variants.
 */
public abstract class AbstractProjectSettings implements ProjectSettings {

    private final Map<String, Object> values;

    protected AbstractProjectSettings(Map<String, ?> values) {
        this.values = JsonCodec.normalize(values);
    }

    @Override
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        for (String key : requiredKeys()) {
            if (values.get(key) == null) {
                problems.add("Missing required setting '" + key + "' for " + typeLabel() + " projects");
            }
        }
        validateRanges(problems);
        return problems;
    }

    /**
     * Append range and type problems for settings that are present.
     */
    protected abstract void validateRanges(List<String> problems);

    protected abstract ProjectSettings create(Map<String, ?> values);

    @Override
    public ProjectSettings merge(Map<String, ?> overrides) {
        Map<String, Object> merged = new LinkedHashMap<>(values);
        if (overrides != null) {
            merged.putAll(overrides);
        }
        return create(merged);
    }

    private String typeLabel() {
        return type() == null ? "untyped" : type().getValue();
    }

    // ==================== Value helpers ====================

    protected Long integerValue(String key) {
        Object value = values.get(key);
        return value instanceof Long ? (Long) value : null;
    }

    protected Number numberValue(String key) {
        Object value = values.get(key);
        return value instanceof Number ? (Number) value : null;
    }

    protected String stringValue(String key) {
        Object value = values.get(key);
        return value instanceof String ? (String) value : null;
    }

    protected Boolean booleanValue(String key) {
        Object value = values.get(key);
        return value instanceof Boolean ? (Boolean) value : null;
    }

    protected void checkIntegerRange(List<String> problems, String key, long min, long max) {
        Object value = values.get(key);
        if (value == null) {
            return;
        }
        if (!(value instanceof Long)) {
            problems.add("Setting '" + key + "' must be an integer, got " + value);
        } else if ((Long) value < min || (Long) value > max) {
            problems.add("Setting '" + key + "' must be between " + min + " and " + max + ", got " + value);
        }
    }

    protected void checkPositiveNumber(List<String> problems, String key) {
        Object value = values.get(key);
        if (value == null) {
            return;
        }
        if (!(value instanceof Number) || ((Number) value).doubleValue() <= 0) {
            problems.add("Setting '" + key + "' must be a positive number, got " + value);
        }
    }

    protected void checkBoolean(List<String> problems, String key) {
        Object value = values.get(key);
        if (value != null && !(value instanceof Boolean)) {
            problems.add("Setting '" + key + "' must be a boolean, got " + value);
        }
    }

    protected void checkNonEmptyString(List<String> problems, String key) {
        Object value = values.get(key);
        if (value == null) {
            return;
        }
        if (!(value instanceof String) || ((String) value).isBlank()) {
            problems.add("Setting '" + key + "' must be a non-empty string");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((AbstractProjectSettings) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), values);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + values;
    }
}
