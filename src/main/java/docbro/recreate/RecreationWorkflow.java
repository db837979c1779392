package docbro.recreate;

import docbro.audit.MigrationRecord;
import docbro.audit.MigrationTracker;
import docbro.compat.CompatibilityChecker;
import docbro.compat.CompatibilityReport;
import docbro.db.Timestamps;
import docbro.errors.IncompatibleRecordException;
import docbro.errors.NotFoundException;
import docbro.errors.ProjectRegistryException;
import docbro.errors.ValidationException;
import docbro.export.ProjectExport;
import docbro.export.ProjectExportService;
import docbro.json.JsonCodec;
import docbro.project.ProjectRecord;
import docbro.project.ProjectRepository;
import docbro.project.ProjectStatus;
import docbro.project.ProjectType;
import docbro.project.settings.ProjectSettings;
import docbro.schema.SchemaVersionRegistry;
import docbro.shard.ProjectShards;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds an incompatible project at the current schema version.
 *
 * <p>Settings, metadata and the source URL are carried over; statistics and
 * timestamps start fresh and the project's crawl sessions are archived.
 * Every attempt past the checks is recorded in the audit trail.
 */
public class RecreationWorkflow {

    private static final Logger LOG = LoggerFactory.getLogger(RecreationWorkflow.class);

    private final ProjectRepository repository;
    private final CompatibilityChecker checker;
    private final MigrationTracker tracker;
    private final ProjectExportService exportService;
    private final ProjectShards shards;
    private final Clock clock;

    public RecreationWorkflow(ProjectRepository repository, CompatibilityChecker checker, MigrationTracker tracker,
                              ProjectExportService exportService, ProjectShards shards, Clock clock) {
        this.repository = repository;
        this.checker = checker;
        this.tracker = tracker;
        this.exportService = exportService;
        this.shards = shards;
        this.clock = clock;
    }

    /**
     * Run a recreation request.
     *
     * @throws NotFoundException if no project has the given id or name
     * @throws IncompatibleRecordException if the project is already being recreated
     */
    public RecreationResult recreate(RecreationRequest request) {
        if (!request.isConfirmed()) {
            LOG.info("Recreation of '{}' not confirmed; nothing changed", request.getProjectIdOrName());
            return RecreationResult.notConfirmed();
        }

        Map<String, Object> row = repository.findRawByIdOrName(request.getProjectIdOrName())
                .orElseThrow(() -> NotFoundException.project(request.getProjectIdOrName()));
        CompatibilityReport report = checker.checkDatabaseRow(row);
        if (report.isCompatible() && !request.isForce()) {
            LOG.info("Project '{}' is already compatible; recreation not required", report.getProjectName());
            return RecreationResult.notRequired(report);
        }

        String projectId = String.valueOf(row.get("id"));
        if (!repository.markMigrating(projectId)) {
            throw new IncompatibleRecordException(report.getProjectName(),
                    "Project '" + report.getProjectName() + "' is already being recreated");
        }
        try {
            return recreateFlagged(request, projectId);
        } finally {
            repository.clearMigrating(projectId);
        }
    }

    /**
     * Re-read and re-check the row once the project is flagged, so a
     * recreation that finished in the meantime is not repeated from a stale row.
     */
    private RecreationResult recreateFlagged(RecreationRequest request, String projectId) {
        Map<String, Object> row = repository.findRawById(projectId)
                .orElseThrow(() -> NotFoundException.project(request.getProjectIdOrName()));
        CompatibilityReport report = checker.checkDatabaseRow(row);
        if (report.isCompatible() && !request.isForce()) {
            LOG.info("Project '{}' became compatible before recreation started", report.getProjectName());
            return RecreationResult.notRequired(report);
        }

        ProjectExport snapshot;
        try {
            snapshot = exportService.exportRow(row);
        } catch (ProjectRegistryException e) {
            LOG.error("Cannot read stored payload of project '{}': {}", report.getProjectName(), e.getMessage());
            return RecreationResult.failed(report, null, null, e.getMessage());
        }

        Path exportFile = null;
        if (request.getExportDirectory() != null) {
            exportFile = exportService.write(snapshot, request.getExportDirectory());
        }
        return rebuild(request, report, projectId, snapshot, exportFile);
    }

    private RecreationResult rebuild(RecreationRequest request, CompatibilityReport report, String projectId,
                                     ProjectExport snapshot, Path exportFile) {
        int currentVersion = SchemaVersionRegistry.currentVersion();
        MigrationRecord audit = tracker.createRecreationRecord(projectId, snapshot.getProjectName(),
                report.getProjectVersion(), currentVersion, snapshot.getSettings(), snapshot.getMetadata(),
                request.getInitiatingCommand());

        ProjectRecord rebuilt;
        try {
            rebuilt = buildRecord(projectId, snapshot, request.isPreserveSettings(), currentVersion);
            repository.save(rebuilt);
        } catch (RuntimeException e) {
            LOG.error("Recreation of project '{}' failed: {}", snapshot.getProjectName(), e.getMessage());
            MigrationRecord sealed = tracker.complete(audit, false, e.getMessage(), null);
            return RecreationResult.failed(report, sealed, exportFile, e.getMessage());
        }

        archiveSessions(snapshot.getProjectName());

        Map<String, Object> preserved = new LinkedHashMap<>();
        preserved.put("settings", snapshot.getSettings());
        preserved.put("metadata", snapshot.getMetadata());
        MigrationRecord sealed = tracker.complete(audit, true, null, JsonCodec.utf8Size(preserved));

        LOG.info("Recreated project '{}' at schema v{} (was v{})", rebuilt.getName(), currentVersion,
                report.getProjectVersion());
        return RecreationResult.rebuilt(report, rebuilt, sealed, exportFile);
    }

    private ProjectRecord buildRecord(String projectId, ProjectExport snapshot, boolean preserveSettings,
                                      int currentVersion) {
        ProjectType type = snapshot.getProjectType();
        if (type == null) {
            if (snapshot.getSourceUrl() == null) {
                throw new ValidationException("Project '" + snapshot.getProjectName()
                        + "' has no type and no source URL to infer one from");
            }
            type = ProjectType.CRAWLING;
        }

        ProjectSettings settings = preserveSettings
                ? ProjectSettings.of(type, snapshot.getSettings())
                : ProjectSettings.defaultsFor(type);
        List<String> problems = settings.validate();
        if (!problems.isEmpty()) {
            throw new ValidationException(problems);
        }

        Instant now = Timestamps.now(clock);
        return ProjectRecord.builder()
                .id(projectId)
                .name(snapshot.getProjectName())
                .schemaVersion(currentVersion)
                .type(type)
                .status(ProjectStatus.ACTIVE)
                .createdAt(now)
                .updatedAt(now)
                .sourceUrl(snapshot.getSourceUrl())
                .settings(settings)
                .statistics(Map.of())
                .metadata(snapshot.getMetadata())
                .build();
    }

    private void archiveSessions(String projectName) {
        if (!shards.exists(projectName)) {
            return;
        }
        try {
            int archived = shards.get(projectName).archiveAllSessions();
            LOG.debug("Archived {} crawl session(s) of '{}'", archived, projectName);
        } catch (ProjectRegistryException e) {
            LOG.warn("Could not archive crawl sessions of '{}': {}", projectName, e.getMessage());
        }
    }
}
