package docbro.export;

import docbro.db.Timestamps;
import docbro.errors.RepositoryException;
import docbro.errors.ValidationException;
import docbro.json.JsonCodec;
import docbro.project.ProjectRecord;
import docbro.project.ProjectType;
import docbro.project.settings.ProjectSettings;
import docbro.schema.SchemaVersionRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes and reads project exports.
 */
public class ProjectExportService {

    private static final Logger LOG = LoggerFactory.getLogger(ProjectExportService.class);

    static final Set<String> DEPRECATED_SETTINGS = Set.of(
            "use_legacy_parser", "old_vector_format", "deprecated_embedding_model", "legacy_chunk_strategy");
    static final int STALE_EXPORT_DAYS = 30;

    private final Clock clock;

    public ProjectExportService(Clock clock) {
        this.clock = clock;
    }

    public ProjectExport export(ProjectRecord record, ExportType exportType) {
        ProjectExport export = ProjectExport.builder()
                .projectName(record.getName())
                .projectType(record.getType())
                .schemaVersion(record.getSchemaVersion())
                .exportedAt(Timestamps.now(clock))
                .settings(record.getSettings().asMap())
                .metadata(record.getMetadata())
                .statistics(record.getStatistics())
                .sourceUrl(record.getSourceUrl())
                .docbroVersion(ProjectExportService.class.getPackage().getImplementationVersion())
                .exportType(exportType)
                .build();
        LOG.info("Exported project '{}' ({})", record.getName(), exportType);
        return export;
    }

    /**
     * Write a full export into a directory under its suggested file name.
     *
     * @return The file written
     */
    public Path exportToFile(ProjectRecord record, Path directory) {
        return exportToFile(record, directory, ExportType.FULL);
    }

    public Path exportToFile(ProjectRecord record, Path directory, ExportType exportType) {
        return write(export(record, exportType), directory);
    }

    /**
     * Full export of a stored row that may not load as a current record.
     * An unknown type is exported as missing rather than rejected.
     *
     * @param row Unified-layout row keyed by column name
     * @throws docbro.errors.ValidationException if the JSON payload columns are malformed
     */
    public ProjectExport exportRow(Map<String, Object> row) {
        ProjectType type = null;
        Object typeValue = row.get("type");
        if (typeValue != null && !typeValue.toString().isBlank()) {
            try {
                type = ProjectType.fromValue(typeValue.toString());
            } catch (ValidationException e) {
                LOG.warn("Exporting project '{}' without its unknown type '{}'", row.get("name"), typeValue);
            }
        }
        Object version = row.get("schema_version");
        Object sourceUrl = row.get("source_url");
        return ProjectExport.builder()
                .projectName(String.valueOf(row.get("name")))
                .projectType(type)
                .schemaVersion(version instanceof Number ? ((Number) version).intValue() : SchemaVersionRegistry.CRAWLER_VERSION)
                .exportedAt(Timestamps.now(clock))
                .settings(JsonCodec.toMap(text(row.get("settings_json"))))
                .metadata(JsonCodec.toMap(text(row.get("metadata_json"))))
                .statistics(JsonCodec.toMap(text(row.get("statistics_json"))))
                .sourceUrl(sourceUrl == null || sourceUrl.toString().isBlank() ? null : sourceUrl.toString())
                .docbroVersion(ProjectExportService.class.getPackage().getImplementationVersion())
                .build();
    }

    /**
     * Write an export into a directory under its suggested file name.
     */
    public Path write(ProjectExport export, Path directory) {
        Path file = directory.resolve(export.getFileName());
        try {
            Files.createDirectories(directory);
            Files.writeString(file, export.toJson(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.error("Failed to write export of '{}' to {}", export.getProjectName(), file, e);
            throw new RepositoryException("Failed to write export file " + file, e);
        }
        LOG.info("Wrote export of '{}' to {}", export.getProjectName(), file);
        return file;
    }

    // ==================== Multiple projects ====================

    /**
     * Write each export to its own file in the directory. An export that
     * cannot be written is logged and skipped.
     *
     * @return The files written, in input order
     */
    public List<Path> writeEach(List<ProjectExport> exports, Path directory) {
        List<Path> written = new ArrayList<>();
        for (ProjectExport export : exports) {
            try {
                written.add(write(export, directory));
            } catch (RepositoryException e) {
                LOG.error("Skipping export of '{}': {}", export.getProjectName(), e.getMessage());
            }
        }
        LOG.info("Wrote {} of {} project export(s) to {}", written.size(), exports.size(), directory);
        return written;
    }

    /**
     * Write all exports into one batch document named after its creation time.
     *
     * @return The batch file
     * @throws RepositoryException if the file cannot be written
     */
    public Path writeBatch(List<ProjectExport> exports, Path directory) {
        Instant createdAt = Timestamps.now(clock);
        List<Map<String, Object>> projects = new ArrayList<>();
        for (ProjectExport export : exports) {
            projects.add(export.toDocument());
        }
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("batch_export_version", ProjectExport.FORMAT_VERSION);
        document.put("created_at", Timestamps.format(createdAt));
        document.put("total_projects", exports.size());
        document.put("docbro_version", ProjectExportService.class.getPackage().getImplementationVersion());
        document.put("projects", projects);

        Path file = directory.resolve(ProjectExport.batchFileName(createdAt));
        try {
            Files.createDirectories(directory);
            Files.writeString(file, JsonCodec.prettyGson().toJson(document), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.error("Failed to write batch export to {}", file, e);
            throw new RepositoryException("Failed to write batch export file " + file, e);
        }
        LOG.info("Wrote batch export of {} project(s) to {}", exports.size(), file);
        return file;
    }

    /**
     * Read the projects back out of a batch document.
     *
     * @throws ValidationException if the file is not a batch export
     */
    @SuppressWarnings("unchecked")
    public List<ProjectExport> loadBatch(Path file) {
        Map<String, Object> document = JsonCodec.toMap(readFile(file));
        Object projects = document.get("projects");
        if (!(projects instanceof List)) {
            throw new ValidationException("Batch export " + file + " has no projects list");
        }
        List<ProjectExport> exports = new ArrayList<>();
        for (Object entry : (List<Object>) projects) {
            if (!(entry instanceof Map)) {
                throw new ValidationException("Batch export " + file + " holds a malformed project entry");
            }
            exports.add(ProjectExport.fromJson(JsonCodec.toJson(entry)));
        }
        LOG.info("Loaded {} project export(s) from batch {}", exports.size(), file);
        return exports;
    }

    public ProjectExport load(Path file) {
        ProjectExport export = ProjectExport.fromJson(readFile(file));
        LOG.info("Loaded export of '{}' from {}", export.getProjectName(), file);
        return export;
    }

    public ExportValidation validate(ProjectExport export) {
        List<String> issues = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();

        if (!ProjectExport.FORMAT_VERSION.equals(export.getExportVersion())) {
            warnings.add("Export format version " + export.getExportVersion() + " may not be fully supported");
        }

        if (export.getProjectType() == null) {
            issues.add("Project type is missing or invalid");
        } else {
            List<String> missing = new ArrayList<>();
            for (String key : ProjectSettings.of(export.getProjectType(), null).requiredKeys()) {
                if (!export.getSettings().containsKey(key)) {
                    missing.add(key);
                }
            }
            missing.sort(null);
            if (!missing.isEmpty()) {
                issues.add("Missing required settings: " + String.join(", ", missing));
            }
        }

        List<String> deprecated = new ArrayList<>();
        for (String key : export.getSettings().keySet()) {
            if (DEPRECATED_SETTINGS.contains(key)) {
                deprecated.add(key);
            }
        }
        if (!deprecated.isEmpty()) {
            warnings.add("Deprecated settings found: " + String.join(", ", deprecated));
        }

        int current = SchemaVersionRegistry.currentVersion();
        boolean versionChange = export.getSchemaVersion() != current;
        if (versionChange) {
            recommendations.add("Export is from schema version " + export.getSchemaVersion()
                    + ", recreation will use current version " + current);
        }

        long ageDays = Duration.between(export.getExportedAt(), clock.instant()).toDays();
        if (ageDays > STALE_EXPORT_DAYS) {
            warnings.add("Export is " + ageDays + " days old - settings may be outdated");
        }

        return new ExportValidation(issues, warnings, recommendations, ageDays, versionChange);
    }

    /**
     * Preview a rebuild from the export: validation plus the type's defaults
     * for any settings the export lacks. Keys are not renamed.
     */
    public RecreationPreview preview(ProjectExport export) {
        ExportValidation validation = validate(export);
        Map<String, Object> settings = new LinkedHashMap<>(export.getSettings());
        List<String> added = new ArrayList<>();
        if (export.getProjectType() != null) {
            for (Map.Entry<String, Object> entry : ProjectSettings.defaultsFor(export.getProjectType()).asMap().entrySet()) {
                if (!settings.containsKey(entry.getKey())) {
                    settings.put(entry.getKey(), entry.getValue());
                    added.add(entry.getKey());
                }
            }
        }
        added.sort(null);
        return new RecreationPreview(export, SchemaVersionRegistry.currentVersion(), settings, added, validation);
    }

    private static String readFile(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RepositoryException("Failed to read export file " + file, e);
        }
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }
}
