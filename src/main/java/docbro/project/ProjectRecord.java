package docbro.project;

import docbro.errors.ValidationException;
import docbro.json.JsonCodec;
import docbro.project.settings.ProjectSettings;
import docbro.schema.CompatibilityStatus;
import docbro.schema.SchemaVersionRegistry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable project record stamped with the schema generation it was
 * written under. New values are built with {@link Builder}; an existing
 * record is changed by copying it with {@link #toBuilder()}.
 */
public final class ProjectRecord {

    public static final int MAX_NAME_LENGTH = 100;
    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9\\-_ ]+$");

    public static final String STAT_TOTAL_PAGES = "total_pages";
    public static final String STAT_SUCCESSFUL_PAGES = "successful_pages";
    public static final String STAT_FAILED_PAGES = "failed_pages";

    private final String id;
    private final String name;
    private final int schemaVersion;
    private final ProjectType type;
    private final ProjectStatus status;
    private final boolean migrating;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant lastOperationAt;
    private final String sourceUrl;
    private final ProjectSettings settings;
    private final Map<String, Object> statistics;
    private final Map<String, Object> metadata;

    private ProjectRecord(Builder builder) {
        this.id = builder.id;
        this.name = builder.name;
        this.schemaVersion = builder.schemaVersion;
        this.type = builder.type;
        this.status = builder.status;
        this.migrating = builder.migrating;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.lastOperationAt = builder.lastOperationAt;
        this.sourceUrl = builder.sourceUrl;
        this.settings = builder.settings != null ? builder.settings : ProjectSettings.of(builder.type, Map.of());
        this.statistics = JsonCodec.normalize(builder.statistics);
        this.metadata = JsonCodec.normalize(builder.metadata);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .schemaVersion(schemaVersion)
                .type(type)
                .status(status)
                .migrating(migrating)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .lastOperationAt(lastOperationAt)
                .sourceUrl(sourceUrl)
                .settings(settings)
                .statistics(statistics)
                .metadata(metadata);
    }

    // ==================== Getters ====================

    public String getId() { return id; }
    public String getName() { return name; }
    public int getSchemaVersion() { return schemaVersion; }
    public ProjectType getType() { return type; }
    public ProjectStatus getStatus() { return status; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Instant getLastOperationAt() { return lastOperationAt; }
    public String getSourceUrl() { return sourceUrl; }
    public ProjectSettings getSettings() { return settings; }
    public Map<String, Object> getStatistics() { return statistics; }
    public Map<String, Object> getMetadata() { return metadata; }

    /**
     * Compatibility derived from the stamped schema version. A record being
     * recreated reads as {@link CompatibilityStatus#MIGRATING}.
     */
    public CompatibilityStatus getCompatibilityStatus() {
        return migrating
                ? CompatibilityStatus.MIGRATING
                : CompatibilityStatus.fromSchemaVersion(schemaVersion);
    }

    public boolean isMigrating() {
        return migrating;
    }

    public boolean isCompatible() {
        return getCompatibilityStatus() == CompatibilityStatus.COMPATIBLE;
    }

    public boolean allowsModification() {
        return getCompatibilityStatus().allowsModification();
    }

    public boolean needsRecreation() {
        return getCompatibilityStatus().needsRecreation();
    }

    /**
     * Names of the fields this record carries, in storage naming.
     * The schema version, its derived compatibility status, settings, statistics
     * and metadata are always present.
     */
    public Set<String> presentFields() {
        Set<String> fields = new LinkedHashSet<>();
        addIfPresent(fields, "id", id);
        addIfPresent(fields, "name", name);
        fields.add("schema_version");
        addIfPresent(fields, "type", type);
        addIfPresent(fields, "status", status);
        fields.add("compatibility_status");
        addIfPresent(fields, "created_at", createdAt);
        addIfPresent(fields, "updated_at", updatedAt);
        addIfPresent(fields, "last_operation_at", lastOperationAt);
        addIfPresent(fields, "source_url", sourceUrl);
        fields.add("settings");
        fields.add("statistics");
        fields.add("metadata");
        return fields;
    }

    private static void addIfPresent(Set<String> fields, String name, Object value) {
        if (value != null) {
            fields.add(name);
        }
    }

    /**
     * @return Statistic value as a long, or null when absent or not numeric
     */
    public Long getStatistic(String key) {
        Object value = statistics.get(key);
        return value instanceof Number ? ((Number) value).longValue() : null;
    }

    // ==================== Validation ====================

    /**
     * Validate a project name: 1 to 100 characters after trimming, letters,
     * digits, spaces, hyphens and underscores only.
     *
     * @return The trimmed name
     * @throws ValidationException if the name is not acceptable
     */
    public static String validateName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new ValidationException("Project name cannot be empty");
        }
        String trimmed = name.trim();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("Project name cannot exceed " + MAX_NAME_LENGTH + " characters");
        }
        if (!NAME_PATTERN.matcher(trimmed).matches()) {
            throw new ValidationException(
                    "Project name can only contain letters, numbers, spaces, hyphens and underscores: '" + trimmed + "'");
        }
        return trimmed;
    }

    static void validateSourceUrl(String sourceUrl) {
        if (sourceUrl != null && !(sourceUrl.startsWith("http://") || sourceUrl.startsWith("https://"))) {
            throw new ValidationException("Source URL must start with http:// or https://: '" + sourceUrl + "'");
        }
    }

    /**
     * Problems with the page counters, empty when consistent.
     */
    public static List<String> statisticsProblems(Map<String, ?> statistics) {
        List<String> problems = new ArrayList<>();
        if (statistics == null) {
            return problems;
        }
        Object total = statistics.get(STAT_TOTAL_PAGES);
        Object successful = statistics.get(STAT_SUCCESSFUL_PAGES);
        Object failed = statistics.get(STAT_FAILED_PAGES);
        if (total instanceof Number && successful instanceof Number && failed instanceof Number) {
            long sum = ((Number) successful).longValue() + ((Number) failed).longValue();
            if (sum > ((Number) total).longValue()) {
                problems.add("Successful pages (" + successful + ") + failed pages (" + failed
                        + ") cannot exceed total pages (" + total + ")");
            }
        }
        return problems;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProjectRecord that = (ProjectRecord) o;
        return schemaVersion == that.schemaVersion
                && Objects.equals(id, that.id)
                && Objects.equals(name, that.name)
                && type == that.type
                && status == that.status
                && migrating == that.migrating
                && Objects.equals(createdAt, that.createdAt)
                && Objects.equals(updatedAt, that.updatedAt)
                && Objects.equals(lastOperationAt, that.lastOperationAt)
                && Objects.equals(sourceUrl, that.sourceUrl)
                && Objects.equals(settings, that.settings)
                && Objects.equals(statistics, that.statistics)
                && Objects.equals(metadata, that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, schemaVersion);
    }

    @Override
    public String toString() {
        return "ProjectRecord{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", schemaVersion=" + schemaVersion +
                ", type=" + type +
                ", status=" + status +
                ", compatibility=" + getCompatibilityStatus() +
                '}';
    }

    // ==================== Builder ====================

    public static class Builder {
        private String id;
        private String name;
        private int schemaVersion = SchemaVersionRegistry.currentVersion();
        private ProjectType type;
        private ProjectStatus status = ProjectStatus.ACTIVE;
        private boolean migrating;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant lastOperationAt;
        private String sourceUrl;
        private ProjectSettings settings;
        private Map<String, ?> statistics;
        private Map<String, ?> metadata;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder schemaVersion(int schemaVersion) {
            this.schemaVersion = schemaVersion;
            return this;
        }

        public Builder type(ProjectType type) {
            this.type = type;
            return this;
        }

        public Builder status(ProjectStatus status) {
            this.status = status;
            return this;
        }

        public Builder migrating(boolean migrating) {
            this.migrating = migrating;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder lastOperationAt(Instant lastOperationAt) {
            this.lastOperationAt = lastOperationAt;
            return this;
        }

        public Builder sourceUrl(String sourceUrl) {
            this.sourceUrl = sourceUrl;
            return this;
        }

        public Builder settings(ProjectSettings settings) {
            this.settings = settings;
            return this;
        }

        /**
         * Settings decoded into the variant of the type set on this builder.
         * Call after {@link #type(ProjectType)}.
         */
        public Builder settings(Map<String, ?> settings) {
            this.settings = ProjectSettings.of(type, settings);
            return this;
        }

        public Builder statistics(Map<String, ?> statistics) {
            this.statistics = statistics;
            return this;
        }

        public Builder metadata(Map<String, ?> metadata) {
            this.metadata = metadata;
            return this;
        }

        /**
         * Build the record.
         *
         * @throws ValidationException if the id is missing, the name is invalid,
         *         the schema version is below 1, the source URL is not http(s)
         *         or the page counters are inconsistent
         */
        public ProjectRecord build() {
            if (id == null || id.isBlank()) {
                throw new ValidationException("Project id is required");
            }
            name = validateName(name);
            if (schemaVersion < 1) {
                throw new ValidationException("Schema version must be at least 1, got " + schemaVersion);
            }
            validateSourceUrl(sourceUrl);
            if (settings != null && settings.type() != type) {
                throw new ValidationException("Settings of type " + settings.type()
                        + " do not match project type " + type);
            }
            List<String> statisticsProblems = statisticsProblems(statistics);
            if (!statisticsProblems.isEmpty()) {
                throw new ValidationException(statisticsProblems);
            }
            return new ProjectRecord(this);
        }
    }
}
