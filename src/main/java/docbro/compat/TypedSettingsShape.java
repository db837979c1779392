package docbro.compat;

import docbro.json.JsonCodec;
import docbro.schema.SchemaVersionRegistry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Generation 2: typed projects with a settings document but no version
 * stamp and no statistics.
 */
public class TypedSettingsShape extends LegacyRowSupport {

    static final Set<String> REQUIRED = new LinkedHashSet<>(
            List.of("id", "name", "type", "status", "created_at", "updated_at", "settings"));

    @Override
    public int generation() {
        return SchemaVersionRegistry.TYPED_SETTINGS_VERSION;
    }

    @Override
    public String name() {
        return "typed-settings";
    }

    @Override
    public boolean matches(Set<String> columns) {
        return !columns.contains("schema_version") && columns.contains("type") && columns.contains("settings");
    }

    @Override
    public List<String> inspect(Map<String, Object> row, Set<String> missingFields) {
        List<String> issues = missingRequired(row, REQUIRED, missingFields, new ArrayList<>());
        issues.add("Version 2 typed project requires recreation to unified schema");
        return issues;
    }

    @Override
    public Map<String, Object> toUnifiedRow(Map<String, Object> row, Instant now) {
        Map<String, Object> unified = unifiedBase(row, now);
        unified.put("type", row.get("type"));

        String settings = json(row.get("settings"));
        Object sourceUrl = JsonCodec.toMap(settings).get("source_url");
        if (sourceUrl instanceof String && !((String) sourceUrl).isBlank()) {
            unified.put("source_url", sourceUrl);
        }
        unified.put("settings_json", settings);
        unified.put("metadata_json", json(row.get("metadata")));
        return unified;
    }
}
