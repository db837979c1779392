package docbro.schema;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Static catalogue of project record generations.
 * Pure lookups with no I/O; safe for concurrent use.
 */
public final class SchemaVersionRegistry {

    public static final int CRAWLER_VERSION = 1;
    public static final int TYPED_SETTINGS_VERSION = 2;
    public static final int UNIFIED_VERSION = 3;

    public static final int CURRENT_VERSION = UNIFIED_VERSION;

    private static final List<SchemaVersionDescriptor> HISTORY = List.of(
            SchemaVersionDescriptor.builder(CRAWLER_VERSION, "crawler")
                    .description("Flat crawler projects with crawl configuration and counters as columns")
                    .added("id", "name", "source_url", "status", "crawl_depth", "embedding_model",
                            "chunk_size", "chunk_overlap", "total_pages", "total_size_bytes",
                            "successful_pages", "failed_pages", "last_crawl_at", "metadata")
                    .required("id", "name", "status", "created_at", "updated_at")
                    .optional("source_url", "crawl_depth", "embedding_model", "chunk_size", "chunk_overlap",
                            "last_crawl_at", "total_pages", "total_size_bytes", "successful_pages",
                            "failed_pages", "metadata")
                    .build(),
            SchemaVersionDescriptor.builder(TYPED_SETTINGS_VERSION, "typed-settings")
                    .description("Typed projects (crawling, data, storage) with settings held as one JSON document")
                    .added("type", "settings")
                    .removed("source_url", "crawl_depth", "embedding_model", "chunk_size", "chunk_overlap",
                            "total_pages", "total_size_bytes", "successful_pages", "failed_pages", "last_crawl_at")
                    .changed("status")
                    .required("id", "name", "type", "status", "created_at", "updated_at", "settings")
                    .optional("metadata")
                    .build(),
            SchemaVersionDescriptor.builder(UNIFIED_VERSION, "unified")
                    .description("Unified version-stamped projects with statistics and compatibility tracking")
                    .added("schema_version", "compatibility_status", "statistics", "last_operation_at", "source_url")
                    .changed("settings", "metadata")
                    .required("id", "name", "schema_version", "type", "status", "created_at", "updated_at",
                            "settings", "statistics", "metadata")
                    .optional("compatibility_status", "last_operation_at", "source_url")
                    .build()
    );

    private SchemaVersionRegistry() {
    }

    public static int currentVersion() {
        return CURRENT_VERSION;
    }

    /**
     * @return Every generation in ascending order
     */
    public static List<SchemaVersionDescriptor> history() {
        return HISTORY;
    }

    public static Optional<SchemaVersionDescriptor> describe(int version) {
        return HISTORY.stream().filter(d -> d.getVersion() == version).findFirst();
    }

    public static SchemaVersionDescriptor current() {
        return describe(CURRENT_VERSION).orElseThrow();
    }

    public static boolean isCurrent(int version) {
        return version == CURRENT_VERSION;
    }

    public static boolean requiresRecreation(int version) {
        return version != CURRENT_VERSION;
    }

    /**
     * Field-level upgrades are not offered; recreation is the only path to the
     * current generation. Kept as the single switch for future incremental
     * upgrades.
     */
    public static boolean canAutoMigrate(int version) {
        return false;
    }

    public static Set<String> requiredFields() {
        return current().getRequiredFields();
    }

    public static Set<String> optionalFields() {
        return current().getOptionalFields();
    }
}
