package docbro.compat;

import docbro.db.Timestamps;
import docbro.errors.ValidationException;
import docbro.json.JsonCodec;
import docbro.project.ProjectStatus;
import docbro.schema.CompatibilityStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Conversions shared by the legacy shapes.
 */
abstract class LegacyRowSupport implements LegacyShape {

    protected List<String> missingRequired(Map<String, Object> row, Set<String> required,
                                           Set<String> missingFields, List<String> issues) {
        for (String field : required) {
            if (row.get(field) == null) {
                missingFields.add(field);
                issues.add("Missing required v" + generation() + " field: " + field);
            }
        }
        return issues;
    }

    /**
     * Start of a unified row: identity, lifecycle and timestamps.
     */
    protected Map<String, Object> unifiedBase(Map<String, Object> row, Instant now) {
        Instant createdAt = timestamp(row.get("created_at"));
        Instant updatedAt = timestamp(row.get("updated_at"));
        if (createdAt == null) {
            createdAt = updatedAt != null ? updatedAt : now;
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }

        Map<String, Object> unified = new LinkedHashMap<>();
        unified.put("id", row.get("id"));
        unified.put("name", row.get("name"));
        unified.put("schema_version", generation());
        unified.put("type", null);
        unified.put("status", status(row.get("status")));
        unified.put("compatibility_status", CompatibilityStatus.fromSchemaVersion(generation()).getValue());
        unified.put("created_at", Timestamps.format(createdAt));
        unified.put("updated_at", Timestamps.format(updatedAt));
        unified.put("last_operation_at", null);
        unified.put("source_url", null);
        unified.put("settings_json", "{}");
        unified.put("statistics_json", "{}");
        unified.put("metadata_json", "{}");
        return unified;
    }

    /**
     * Lifecycle values this generation no longer knows become inactive.
     */
    protected static String status(Object value) {
        if (value == null) {
            return ProjectStatus.INACTIVE.getValue();
        }
        try {
            return ProjectStatus.fromValue(value.toString()).getValue();
        } catch (ValidationException e) {
            return ProjectStatus.INACTIVE.getValue();
        }
    }

    protected static Instant timestamp(Object value) {
        return value == null ? null : Timestamps.parse(value.toString());
    }

    /**
     * Re-encode a stored JSON document, "{}" when absent.
     */
    protected static String json(Object value) {
        return JsonCodec.toJson(JsonCodec.toMap(value == null ? null : value.toString()));
    }

    protected static void putIfPresent(Map<String, Object> target, Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value != null) {
            target.put(column, value);
        }
    }
}
