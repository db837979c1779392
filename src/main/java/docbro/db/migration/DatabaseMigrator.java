package docbro.db.migration;

import docbro.db.SqliteDatabase;
import docbro.db.TransactionManager;
import docbro.db.migration.registry.RegistryMigrations;
import docbro.db.migration.shard.ShardMigrations;
import docbro.errors.MigrationException;
import docbro.errors.ProjectRegistryException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Orchestrates schema migrations of one database file.
 * Detects the current version, applies pending migrations in ascending order,
 * each in its own transaction, and advances the version marker only once
 * every migration of the run has succeeded.
 */
public class DatabaseMigrator {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseMigrator.class);

    private final SqliteDatabase database;
    private final String label;
    private final List<SchemaMigration> migrations;

    public DatabaseMigrator(SqliteDatabase database, String label, List<SchemaMigration> migrations) {
        this.database = database;
        this.label = label;
        this.migrations = new ArrayList<>(migrations);
        this.migrations.sort(Comparator.comparingInt(SchemaMigration::getVersion));
        for (int i = 1; i < this.migrations.size(); i++) {
            if (this.migrations.get(i).getVersion() == this.migrations.get(i - 1).getVersion()) {
                throw new IllegalArgumentException("Duplicate migration version "
                        + this.migrations.get(i).getVersion() + " for " + label);
            }
        }
    }

    /**
     * Migrator for the shared registry file.
     */
    public static DatabaseMigrator forRegistry(SqliteDatabase database) {
        return new DatabaseMigrator(database, "registry", RegistryMigrations.all());
    }

    /**
     * Migrator for a per-project shard file.
     */
    public static DatabaseMigrator forShard(SqliteDatabase database) {
        return new DatabaseMigrator(database, "shard " + database.getFile().getFileName(), ShardMigrations.all());
    }

    /**
     * Get the current database version.
     *
     * @return Current version, 0 when no marker exists
     */
    public int detectVersion() {
        return database.getTransactionManager().execute(
                conn -> new SchemaVersionDetector(conn).detectVersion());
    }

    /**
     * Run all pending migrations.
     *
     * @return Applied count and the version the file ends at
     * @throws MigrationException if any migration fails; the marker is left
     *         where it was and any backup taken stays on disk
     */
    public MigrationResult migrateToLatest() {
        TransactionManager tm = database.getTransactionManager();
        try {
            return tm.execute(conn -> runMigrations(tm, conn));
        } catch (MigrationException e) {
            LOG.error("Migration of {} stopped at V{}: {}", label, e.getStepVersion(), e.getMessage());
            throw e;
        }
    }

    private MigrationResult runMigrations(TransactionManager tm, Connection connection) throws SQLException {
        SchemaVersionDetector versionDetector = new SchemaVersionDetector(connection);
        int currentVersion = versionDetector.detectVersion();
        int targetVersion = getTargetVersion();

        if (currentVersion >= targetVersion) {
            LOG.debug("Schema of {} is up to date (version {})", label, currentVersion);
            return new MigrationResult(currentVersion, currentVersion, List.of(), List.of());
        }

        LOG.info("Starting migration of {} from version {} to {}", label, currentVersion, targetVersion);

        ensureMigrationTable(connection);
        Set<Integer> recorded = readAppliedVersions(connection);

        List<Integer> applied = new ArrayList<>();
        List<Path> backups = new ArrayList<>();
        for (SchemaMigration migration : migrations) {
            if (migration.getVersion() <= currentVersion) {
                continue;
            }
            if (recorded.contains(migration.getVersion())) {
                LOG.info("Migration V{} of {} already recorded, resuming after it", migration.getVersion(), label);
                continue;
            }
            Path backup = null;
            if (migration.getKind() == MigrationKind.STRUCTURAL && migration.requiresBackup(connection)) {
                backup = backupFile(migration, connection);
                backups.add(backup);
            }
            applyMigration(tm, migration, backup);
            applied.add(migration.getVersion());
        }

        versionDetector.setUserVersion(targetVersion);
        LOG.info("Migration of {} completed, {} step(s) applied. Version: {}", label, applied.size(), targetVersion);
        return new MigrationResult(currentVersion, targetVersion, applied, backups);
    }

    /**
     * Apply a single migration in its own transaction.
     *
     * @param migration The migration to apply
     * @param backup Backup taken before it, or null
     */
    private void applyMigration(TransactionManager tm, SchemaMigration migration, Path backup) {
        LOG.info("Applying {} migration V{}: {}", migration.getKind().name().toLowerCase(),
                migration.getVersion(), migration.getDescription());
        boolean structural = migration.getKind() == MigrationKind.STRUCTURAL;
        try {
            if (structural) {
                // Dropping a rebuilt table must not cascade into tables referencing it
                setForeignKeys(tm, false);
            }
            tm.executeInTransaction(conn -> {
                migration.migrate(conn);
                migration.verify(conn);
                recordMigration(conn, migration);
                return null;
            });
        } catch (MigrationException e) {
            throw backup == null ? e : e.withBackup(backup);
        } catch (ProjectRegistryException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new MigrationException(migration.getVersion(),
                    "Migration V" + migration.getVersion() + " failed: " + cause.getMessage(), backup, cause);
        } catch (RuntimeException e) {
            throw new MigrationException(migration.getVersion(),
                    "Migration V" + migration.getVersion() + " failed: " + e.getMessage(), backup, e);
        } finally {
            if (structural) {
                setForeignKeys(tm, true);
            }
        }
        LOG.info("Migration V{} completed successfully", migration.getVersion());
    }

    private void setForeignKeys(TransactionManager tm, boolean enabled) {
        tm.execute(conn -> {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA foreign_keys = " + (enabled ? "ON" : "OFF"));
            }
            return null;
        });
    }

    /**
     * Copy the file aside before a structural migration.
     * The WAL is checkpointed first so the main file holds every committed page.
     */
    private Path backupFile(SchemaMigration migration, Connection connection) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("PRAGMA wal_checkpoint(TRUNCATE)");
        }
        Path source = database.getFile();
        Path target = getNextBackupName(source);
        try {
            Files.copy(source, target);
        } catch (IOException e) {
            throw new MigrationException(migration.getVersion(),
                    "Cannot back up " + source + " before V" + migration.getVersion() + ": " + e.getMessage(), null, e);
        }
        LOG.warn("Backed up {} to {} before structural migration V{}", source, target, migration.getVersion());
        return target;
    }

    /**
     * Get next available backup name for a file.
     *
     * @param file Original database file
     * @return Backup path (e.g., registry.db.bak or registry.db.bak_2)
     */
    static Path getNextBackupName(Path file) {
        String baseName = file.getFileName().toString() + ".bak";
        Path candidate = file.resolveSibling(baseName);
        if (!Files.exists(candidate)) {
            return candidate;
        }

        int suffix = 2;
        while (Files.exists(file.resolveSibling(baseName + "_" + suffix))) {
            suffix++;
        }
        return file.resolveSibling(baseName + "_" + suffix);
    }

    /**
     * Ensure the schema_migrations metadata table exists.
     */
    private void ensureMigrationTable(Connection connection) throws SQLException {
        String sql = "CREATE TABLE IF NOT EXISTS schema_migrations ("
                + "version INTEGER PRIMARY KEY,"
                + "description TEXT NOT NULL,"
                + "kind TEXT NOT NULL,"
                + "applied_at INTEGER NOT NULL"
                + ")";
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(sql);
        }
    }

    /**
     * Record a completed migration in the metadata table.
     *
     * @param migration The completed migration
     */
    private void recordMigration(Connection connection, SchemaMigration migration) throws SQLException {
        String sql = "INSERT OR REPLACE INTO schema_migrations (version, description, kind, applied_at) VALUES (?, ?, ?, ?)";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setInt(1, migration.getVersion());
            stmt.setString(2, migration.getDescription());
            stmt.setString(3, migration.getKind().name());
            stmt.setLong(4, System.currentTimeMillis());
            stmt.executeUpdate();
        }
    }

    private Set<Integer> readAppliedVersions(Connection connection) throws SQLException {
        Set<Integer> applied = new LinkedHashSet<>();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT version FROM schema_migrations ORDER BY version")) {
            while (rs.next()) {
                applied.add(rs.getInt("version"));
            }
        }
        return applied;
    }

    /**
     * Get the target (highest) version number.
     *
     * @return Target version
     */
    public int getTargetVersion() {
        return migrations.stream()
                .mapToInt(SchemaMigration::getVersion)
                .max()
                .orElse(0);
    }

    /**
     * Check if any migrations are pending.
     *
     * @return true if migrations need to be applied
     */
    public boolean hasPendingMigrations() {
        return detectVersion() < getTargetVersion();
    }

    /**
     * Get list of applied migrations from the metadata table.
     *
     * @return List of applied version numbers
     */
    public List<Integer> getAppliedMigrations() {
        return database.getTransactionManager().execute(conn -> {
            if (!new SchemaVersionDetector(conn).tableExists("schema_migrations")) {
                return List.<Integer>of();
            }
            return List.copyOf(readAppliedVersions(conn));
        });
    }

    public List<SchemaMigration> getMigrations() {
        return List.copyOf(migrations);
    }
}
