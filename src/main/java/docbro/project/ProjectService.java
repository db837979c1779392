package docbro.project;

import docbro.audit.MigrationRecord;
import docbro.audit.MigrationTracker;
import docbro.compat.CompatibilityChecker;
import docbro.compat.CompatibilityReport;
import docbro.compat.CompatibilitySummary;
import docbro.db.Timestamps;
import docbro.errors.AlreadyExistsException;
import docbro.errors.IncompatibleRecordException;
import docbro.errors.NotFoundException;
import docbro.errors.ValidationException;
import docbro.export.ExportType;
import docbro.export.ProjectExport;
import docbro.export.ProjectExportService;
import docbro.export.RecreationPreview;
import docbro.project.settings.ProjectSettings;
import docbro.recreate.RecreationRequest;
import docbro.recreate.RecreationResult;
import docbro.recreate.RecreationWorkflow;
import docbro.schema.SchemaVersionRegistry;
import docbro.shard.ProjectShards;
import docbro.shard.ShardStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Project operations as offered to the command line and API layers.
 *
 * <p>Writes are refused for projects stamped with an older schema
 * generation; those must be recreated first.
 */
public class ProjectService {

    private static final Logger LOG = LoggerFactory.getLogger(ProjectService.class);

    private final ProjectRepository repository;
    private final CompatibilityChecker checker;
    private final MigrationTracker tracker;
    private final ProjectExportService exportService;
    private final RecreationWorkflow workflow;
    private final ProjectShards shards;
    private final Clock clock;

    public ProjectService(ProjectRepository repository, CompatibilityChecker checker, MigrationTracker tracker,
                          ProjectExportService exportService, RecreationWorkflow workflow, ProjectShards shards,
                          Clock clock) {
        this.repository = repository;
        this.checker = checker;
        this.tracker = tracker;
        this.exportService = exportService;
        this.workflow = workflow;
        this.shards = shards;
        this.clock = clock;
    }

    // ==================== Reads ====================

    public List<ProjectRecord> list(ProjectQuery query) {
        return repository.findAll(query);
    }

    public List<ProjectRecord> list() {
        return list(ProjectQuery.all());
    }

    public Optional<ProjectRecord> find(String idOrName) {
        return repository.findByIdOrName(idOrName);
    }

    /**
     * @throws NotFoundException if no project has the given id or name
     */
    public ProjectRecord get(String idOrName) {
        return find(idOrName).orElseThrow(() -> NotFoundException.project(idOrName));
    }

    // ==================== Writes ====================

    /**
     * Create a project at the current schema version. Missing settings are
     * filled from the type's defaults.
     *
     * @throws AlreadyExistsException if the name is taken
     * @throws ValidationException if the name, source URL or settings are invalid
     */
    public ProjectRecord create(String name, ProjectType type, Map<String, ?> settings, Map<String, ?> metadata,
                                String sourceUrl) {
        if (type == null) {
            throw new ValidationException("Project type is required");
        }
        String cleanName = ProjectRecord.validateName(name);
        if (repository.existsByName(cleanName)) {
            throw new AlreadyExistsException("Project '" + cleanName + "' already exists");
        }

        ProjectSettings typedSettings = ProjectSettings.withDefaults(type, settings);
        List<String> problems = typedSettings.validate();
        if (!problems.isEmpty()) {
            throw new ValidationException(problems);
        }

        Instant now = Timestamps.now(clock);
        ProjectRecord record = ProjectRecord.builder()
                .id(UUID.randomUUID().toString())
                .name(cleanName)
                .type(type)
                .status(ProjectStatus.ACTIVE)
                .createdAt(now)
                .updatedAt(now)
                .sourceUrl(sourceUrl)
                .settings(typedSettings)
                .metadata(metadata)
                .build();
        repository.save(record);
        LOG.info("Created project '{}' (type: {})", cleanName, type);
        return record;
    }

    public ProjectRecord create(String name, ProjectType type) {
        return create(name, type, null, null, null);
    }

    /**
     * Apply a partial update.
     *
     * @throws NotFoundException if no project has the given id or name
     * @throws IncompatibleRecordException if the project must be recreated first
     *         or is being recreated; storage is not touched
     */
    public ProjectRecord update(String idOrName, ProjectUpdate update) {
        Map<String, Object> row = repository.findRawByIdOrName(idOrName)
                .orElseThrow(() -> NotFoundException.project(idOrName));
        String name = String.valueOf(row.get("name"));
        Object version = row.get("schema_version");
        int current = SchemaVersionRegistry.currentVersion();
        if (!(version instanceof Number) || ((Number) version).intValue() != current) {
            int stamped = version instanceof Number ? ((Number) version).intValue() : SchemaVersionRegistry.CRAWLER_VERSION;
            throw new IncompatibleRecordException(name, stamped, current);
        }

        ProjectRecord existing = get(String.valueOf(row.get("id")));
        if (!existing.allowsModification()) {
            throw new IncompatibleRecordException(name, "Project '" + name + "' is being recreated; try again later");
        }
        if (update.isEmpty()) {
            return existing;
        }

        ProjectRecord.Builder builder = existing.toBuilder().updatedAt(Timestamps.now(clock));
        if (update.getSettings() != null) {
            ProjectSettings merged = existing.getSettings().merge(update.getSettings());
            List<String> problems = merged.validate();
            if (!problems.isEmpty()) {
                throw new ValidationException(problems);
            }
            builder.settings(merged);
        }
        if (update.getMetadata() != null) {
            builder.metadata(mergeMaps(existing.getMetadata(), update.getMetadata()));
        }
        if (update.getStatistics() != null) {
            builder.statistics(mergeMaps(existing.getStatistics(), update.getStatistics()));
        }
        if (update.getSourceUrl() != null) {
            builder.sourceUrl(update.getSourceUrl());
        }
        if (update.getStatus() != null) {
            builder.status(update.getStatus());
        }
        ProjectRecord updated = builder.build();
        repository.save(updated);
        LOG.info("Updated project '{}'", name);
        return updated;
    }

    /**
     * Delete a project and its shard directory.
     *
     * @return false if no project has the given id or name
     */
    public boolean delete(String idOrName) {
        Optional<Map<String, Object>> row = repository.findRawByIdOrName(idOrName);
        if (row.isEmpty()) {
            return false;
        }
        String id = String.valueOf(row.get().get("id"));
        String name = String.valueOf(row.get().get("name"));
        if (repository.isMigrating(id)) {
            throw new IncompatibleRecordException(name, "Project '" + name + "' is being recreated; try again later");
        }
        boolean deleted = repository.deleteById(id);
        if (deleted) {
            shards.delete(name);
            LOG.info("Deleted project '{}' ({})", name, id);
        }
        return deleted;
    }

    // ==================== Compatibility ====================

    /**
     * Check one stored project and record the check in the audit trail.
     *
     * @throws NotFoundException if no project has the given id or name
     */
    public CompatibilityReport checkCompatibility(String idOrName) {
        Map<String, Object> row = repository.findRawByIdOrName(idOrName)
                .orElseThrow(() -> NotFoundException.project(idOrName));
        CompatibilityReport report = checker.checkDatabaseRow(row);

        MigrationRecord audit = tracker.createValidationRecord(report.getProjectId(), report.getProjectName(),
                report.getProjectVersion(), null);
        tracker.complete(audit, report.isCompatible(),
                report.isCompatible() ? null : String.join("; ", report.getIssues()), null);
        return report;
    }

    /**
     * Check every stored project, keyed by id.
     */
    public Map<String, CompatibilityReport> checkAll() {
        return checker.checkAllRows(repository.findAllRaw(ProjectQuery.all()));
    }

    public CompatibilitySummary compatibilitySummary() {
        return checker.summarize(checkAll().values());
    }

    public List<String> recreationInstructions(String idOrName) {
        Map<String, Object> row = repository.findRawByIdOrName(idOrName)
                .orElseThrow(() -> NotFoundException.project(idOrName));
        CompatibilityReport report = checker.checkDatabaseRow(row);
        return checker.recreationInstructions(report, String.valueOf(row.get("name")));
    }

    public RecreationResult recreate(RecreationRequest request) {
        return workflow.recreate(request);
    }

    // ==================== Export ====================

    /**
     * Export a stored project, including ones that need recreation.
     */
    public ProjectExport export(String idOrName, ExportType exportType) {
        Optional<ProjectRecord> record = findLoadable(idOrName);
        if (record.isPresent()) {
            return exportService.export(record.get(), exportType);
        }
        Map<String, Object> row = repository.findRawByIdOrName(idOrName)
                .orElseThrow(() -> NotFoundException.project(idOrName));
        return exportService.exportRow(row);
    }

    /**
     * @return The export file written into the directory
     */
    public Path exportToFile(String idOrName, ExportType exportType, Path directory) {
        return exportService.write(export(idOrName, exportType), directory);
    }

    /**
     * Export several projects, one file each.
     *
     * @throws NotFoundException if any of the projects does not exist
     */
    public List<Path> exportEach(List<String> idsOrNames, ExportType exportType, Path directory) {
        return exportService.writeEach(exportAll(idsOrNames, exportType), directory);
    }

    /**
     * Export several projects into a single batch file.
     *
     * @throws NotFoundException if any of the projects does not exist
     */
    public Path exportBatch(List<String> idsOrNames, ExportType exportType, Path directory) {
        return exportService.writeBatch(exportAll(idsOrNames, exportType), directory);
    }

    /**
     * Preview what recreating the project from a fresh export would produce.
     */
    public RecreationPreview previewRecreation(String idOrName) {
        return exportService.preview(export(idOrName, ExportType.FULL));
    }

    private List<ProjectExport> exportAll(List<String> idsOrNames, ExportType exportType) {
        List<ProjectExport> exports = new ArrayList<>();
        for (String idOrName : idsOrNames) {
            exports.add(export(idOrName, exportType));
        }
        return exports;
    }

    private Optional<ProjectRecord> findLoadable(String idOrName) {
        Optional<Map<String, Object>> row = repository.findRawByIdOrName(idOrName);
        if (row.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(ProjectRows.toRecord(row.get()));
        } catch (ValidationException e) {
            LOG.debug("Project '{}' does not load as a current record: {}", idOrName, e.getMessage());
            return Optional.empty();
        }
    }

    // ==================== Shards ====================

    /**
     * Per-project store of a compatible project.
     *
     * @throws IncompatibleRecordException if the project must be recreated first
     */
    public ShardStore shard(String idOrName) {
        ProjectRecord record = get(idOrName);
        if (!record.allowsModification()) {
            throw new IncompatibleRecordException(record.getName(), record.getSchemaVersion(),
                    SchemaVersionRegistry.currentVersion());
        }
        return shards.get(record.getName());
    }

    private static Map<String, Object> mergeMaps(Map<String, Object> base, Map<String, ?> overrides) {
        Map<String, Object> merged = new LinkedHashMap<>(base);
        merged.putAll(overrides);
        return merged;
    }
}
