package docbro.compat;

import docbro.db.Timestamps;
import docbro.json.JsonCodec;
import docbro.project.ProjectType;
import docbro.schema.SchemaVersionRegistry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Generation 1: flat crawler rows carrying crawl configuration and page
 * counters as columns, with no type and no settings document.
 */
public class CrawlerShape extends LegacyRowSupport {

    static final Set<String> REQUIRED = new LinkedHashSet<>(List.of("id", "name", "status", "created_at", "updated_at"));
    static final Set<String> CRAWLER_FIELDS = Set.of("source_url", "crawl_depth", "total_pages", "embedding_model");
    static final List<String> SETTINGS_COLUMNS = List.of("crawl_depth", "embedding_model", "chunk_size", "chunk_overlap");
    static final List<String> STATISTICS_COLUMNS = List.of("total_pages", "total_size_bytes", "successful_pages", "failed_pages");

    @Override
    public int generation() {
        return SchemaVersionRegistry.CRAWLER_VERSION;
    }

    @Override
    public String name() {
        return "crawler";
    }

    @Override
    public boolean matches(Set<String> columns) {
        if (columns.contains("schema_version") || columns.contains("settings")) {
            return false;
        }
        return CRAWLER_FIELDS.stream().anyMatch(columns::contains);
    }

    @Override
    public List<String> inspect(Map<String, Object> row, Set<String> missingFields) {
        List<String> issues = missingRequired(row, REQUIRED, missingFields, new ArrayList<>());
        issues.add("Version 1 crawler project requires recreation to unified schema");
        return issues;
    }

    @Override
    public Map<String, Object> toUnifiedRow(Map<String, Object> row, Instant now) {
        Map<String, Object> unified = unifiedBase(row, now);
        unified.put("type", ProjectType.CRAWLING.getValue());
        unified.put("source_url", row.get("source_url"));
        unified.put("last_operation_at", Timestamps.format(timestamp(row.get("last_crawl_at"))));

        Map<String, Object> settings = new LinkedHashMap<>();
        for (String column : SETTINGS_COLUMNS) {
            putIfPresent(settings, row, column);
        }
        Map<String, Object> statistics = new LinkedHashMap<>();
        for (String column : STATISTICS_COLUMNS) {
            putIfPresent(statistics, row, column);
        }
        unified.put("settings_json", JsonCodec.toJson(settings));
        unified.put("statistics_json", JsonCodec.toJson(statistics));
        unified.put("metadata_json", json(row.get("metadata")));
        return unified;
    }
}
