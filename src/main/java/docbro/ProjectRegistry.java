package docbro;

import docbro.audit.MigrationTracker;
import docbro.compat.CompatibilityChecker;
import docbro.config.RegistryConfig;
import docbro.db.SqliteDatabase;
import docbro.db.migration.DatabaseMigrator;
import docbro.db.migration.MigrationResult;
import docbro.export.ProjectExportService;
import docbro.project.ProjectRepository;
import docbro.project.ProjectService;
import docbro.recreate.RecreationWorkflow;
import docbro.shard.ProjectShards;
import docbro.shelf.ShelfRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Handle on an opened project registry.
 *
 * <p>Opening brings the registry file up to the latest schema; every
 * component shares the one registry connection. Closing the handle closes
 * the project shards and then the registry.
 */
public class ProjectRegistry implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ProjectRegistry.class);

    private final RegistryConfig config;
    private final SqliteDatabase database;
    private final MigrationResult startupMigration;
    private final ProjectRepository projects;
    private final ProjectShards shards;
    private final ShelfRepository shelves;
    private final CompatibilityChecker checker;
    private final MigrationTracker tracker;
    private final ProjectExportService exports;
    private final RecreationWorkflow recreation;
    private final ProjectService service;

    private ProjectRegistry(RegistryConfig config, SqliteDatabase database, MigrationResult startupMigration,
                            Clock clock) {
        this.config = config;
        this.database = database;
        this.startupMigration = startupMigration;
        this.projects = new ProjectRepository(database);
        this.shards = new ProjectShards(config, clock);
        this.shelves = new ShelfRepository(database, clock);
        this.checker = new CompatibilityChecker(clock);
        this.tracker = new MigrationTracker(database, clock);
        this.exports = new ProjectExportService(clock);
        this.recreation = new RecreationWorkflow(projects, checker, tracker, exports, shards, clock);
        this.service = new ProjectService(projects, checker, tracker, exports, recreation, shards, clock);
    }

    public static ProjectRegistry open() {
        return open(RegistryConfig.defaults(), Clock.systemUTC());
    }

    public static ProjectRegistry open(RegistryConfig config) {
        return open(config, Clock.systemUTC());
    }

    /**
     * Open the registry file and migrate it to the latest schema.
     *
     * @throws docbro.errors.MigrationException if a migration step fails;
     *         the registry is closed again
     */
    public static ProjectRegistry open(RegistryConfig config, Clock clock) {
        SqliteDatabase database = SqliteDatabase.open(config.getRegistryFile(), config);
        MigrationResult result;
        try {
            result = DatabaseMigrator.forRegistry(database).migrateToLatest();
        } catch (RuntimeException e) {
            LOG.error("Registry {} could not be migrated: {}", config.getRegistryFile(), e.getMessage());
            database.close();
            throw e;
        }
        LOG.info("Opened project registry {} at schema v{}", config.getRegistryFile(), result.getFinalVersion());
        return new ProjectRegistry(config, database, result, clock);
    }

    // ==================== Getters ====================

    public RegistryConfig getConfig() { return config; }
    public SqliteDatabase getDatabase() { return database; }

    /**
     * @return What the migrator did when this handle was opened
     */
    public MigrationResult getStartupMigration() { return startupMigration; }
    public ProjectService getProjectService() { return service; }
    public ProjectRepository getProjects() { return projects; }
    public ProjectShards getShards() { return shards; }
    public ShelfRepository getShelves() { return shelves; }
    public CompatibilityChecker getChecker() { return checker; }
    public MigrationTracker getTracker() { return tracker; }
    public ProjectExportService getExports() { return exports; }
    public RecreationWorkflow getRecreation() { return recreation; }

    @Override
    public void close() {
        try {
            shards.close();
        } finally {
            database.close();
        }
    }
}
