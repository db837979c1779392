package docbro.export;

import docbro.db.Timestamps;
import docbro.errors.ValidationException;
import docbro.json.JsonCodec;
import docbro.project.ProjectType;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Portable snapshot of a project's settings and metadata, written before a
 * recreation so the project can be rebuilt by hand if needed.
 */
public final class ProjectExport {

    public static final String FORMAT_VERSION = "1.0";

    private static final DateTimeFormatter FILE_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final String projectName;
    private final ProjectType projectType;
    private final int schemaVersion;
    private final Instant exportedAt;
    private final Map<String, Object> settings;
    private final Map<String, Object> metadata;
    private final Map<String, Object> statistics;
    private final String sourceUrl;
    private final String exportVersion;
    private final String docbroVersion;
    private final ExportType exportType;

    private ProjectExport(Builder builder) {
        this.projectName = Objects.requireNonNull(builder.projectName, "projectName");
        this.projectType = builder.projectType;
        this.schemaVersion = builder.schemaVersion;
        this.exportedAt = Objects.requireNonNull(builder.exportedAt, "exportedAt");
        this.settings = JsonCodec.normalize(builder.settings);
        this.metadata = JsonCodec.normalize(builder.metadata);
        this.statistics = builder.exportType == ExportType.SETTINGS_ONLY
                ? Map.of()
                : JsonCodec.normalize(builder.statistics);
        this.sourceUrl = builder.sourceUrl;
        this.exportVersion = builder.exportVersion;
        this.docbroVersion = builder.docbroVersion;
        this.exportType = builder.exportType;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ==================== Getters ====================

    public String getProjectName() { return projectName; }
    public ProjectType getProjectType() { return projectType; }
    public int getSchemaVersion() { return schemaVersion; }
    public Instant getExportedAt() { return exportedAt; }
    public Map<String, Object> getSettings() { return settings; }
    public Map<String, Object> getMetadata() { return metadata; }
    public Map<String, Object> getStatistics() { return statistics; }
    public String getSourceUrl() { return sourceUrl; }
    public String getExportVersion() { return exportVersion; }
    public String getDocbroVersion() { return docbroVersion; }
    public ExportType getExportType() { return exportType; }

    /**
     * Suggested file name: the project name reduced to letters, digits,
     * dashes and underscores, followed by the UTC export time.
     */
    public String getFileName() {
        StringBuilder clean = new StringBuilder();
        for (char c : projectName.toCharArray()) {
            if (Character.isLetterOrDigit(c) || c == '-' || c == '_') {
                clean.append(c);
            }
        }
        return clean + "_" + FILE_TIMESTAMP.format(exportedAt) + "_export.json";
    }

    static String batchFileName(Instant createdAt) {
        return "docbro_projects_batch_" + FILE_TIMESTAMP.format(createdAt) + ".json";
    }

    // ==================== JSON ====================

    public String toJson() {
        return JsonCodec.prettyGson().toJson(toDocument());
    }

    Map<String, Object> toDocument() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("project_name", projectName);
        document.put("project_type", projectType == null ? null : projectType.getValue());
        document.put("schema_version", schemaVersion);
        document.put("exported_at", Timestamps.format(exportedAt));
        document.put("settings", settings);
        document.put("metadata", metadata);
        document.put("source_url", sourceUrl);
        document.put("statistics", statistics);
        document.put("export_version", exportVersion);
        document.put("docbro_version", docbroVersion);
        document.put("export_type", exportType.getValue());
        return document;
    }

    /**
     * @throws ValidationException if the document is not a project export
     */
    @SuppressWarnings("unchecked")
    public static ProjectExport fromJson(String json) {
        Map<String, Object> document = JsonCodec.toMap(json);
        Object name = document.get("project_name");
        if (!(name instanceof String)) {
            throw new ValidationException("Export is missing project_name");
        }
        Object version = document.get("schema_version");
        if (!(version instanceof Number)) {
            throw new ValidationException("Export is missing schema_version");
        }
        Object type = document.get("project_type");
        Object exportType = document.get("export_type");
        Object exportVersion = document.get("export_version");
        Object exportedAt = document.get("exported_at");
        if (exportedAt == null) {
            throw new ValidationException("Export is missing exported_at");
        }
        try {
            return builder()
                    .projectName((String) name)
                    .projectType(type == null ? null : ProjectType.fromValue(type.toString()))
                    .schemaVersion(((Number) version).intValue())
                    .exportedAt(Timestamps.parse(exportedAt.toString()))
                    .settings((Map<String, ?>) document.get("settings"))
                    .metadata((Map<String, ?>) document.get("metadata"))
                    .statistics((Map<String, ?>) document.get("statistics"))
                    .sourceUrl((String) document.get("source_url"))
                    .exportVersion(exportVersion == null ? FORMAT_VERSION : exportVersion.toString())
                    .docbroVersion((String) document.get("docbro_version"))
                    .exportType(exportType == null ? ExportType.FULL : ExportType.fromValue(exportType.toString()))
                    .build();
        } catch (ClassCastException e) {
            throw new ValidationException("Malformed project export: " + e.getMessage());
        }
    }

    // ==================== Builder ====================

    public static class Builder {
        private String projectName;
        private ProjectType projectType;
        private int schemaVersion;
        private Instant exportedAt;
        private Map<String, ?> settings;
        private Map<String, ?> metadata;
        private Map<String, ?> statistics;
        private String sourceUrl;
        private String exportVersion = FORMAT_VERSION;
        private String docbroVersion;
        private ExportType exportType = ExportType.FULL;

        public Builder projectName(String projectName) { this.projectName = projectName; return this; }
        public Builder projectType(ProjectType projectType) { this.projectType = projectType; return this; }
        public Builder schemaVersion(int schemaVersion) { this.schemaVersion = schemaVersion; return this; }
        public Builder exportedAt(Instant exportedAt) { this.exportedAt = exportedAt; return this; }
        public Builder settings(Map<String, ?> settings) { this.settings = settings; return this; }
        public Builder metadata(Map<String, ?> metadata) { this.metadata = metadata; return this; }
        public Builder statistics(Map<String, ?> statistics) { this.statistics = statistics; return this; }
        public Builder sourceUrl(String sourceUrl) { this.sourceUrl = sourceUrl; return this; }
        public Builder exportVersion(String exportVersion) { this.exportVersion = exportVersion; return this; }
        public Builder docbroVersion(String docbroVersion) { this.docbroVersion = docbroVersion; return this; }
        public Builder exportType(ExportType exportType) { this.exportType = exportType; return this; }

        public ProjectExport build() {
            return new ProjectExport(this);
        }
    }
}
