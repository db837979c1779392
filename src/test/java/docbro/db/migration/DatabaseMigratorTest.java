package docbro.db.migration;

import docbro.config.RegistryConfig;
import docbro.db.SqliteDatabase;
import docbro.errors.MigrationException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DatabaseMigrator")
class DatabaseMigratorTest {

    @TempDir
    Path tempDir;

    private SqliteDatabase database;

    @BeforeEach
    void setUp() {
        RegistryConfig config = RegistryConfig.builder().dataDirectory(tempDir).build();
        database = SqliteDatabase.open(config.getRegistryFile(), config);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void freshRegistryIsMigratedToTheLatestVersion() {
        DatabaseMigrator migrator = DatabaseMigrator.forRegistry(database);
        assertThat(migrator.detectVersion()).isZero();
        assertThat(migrator.hasPendingMigrations()).isTrue();

        MigrationResult result = migrator.migrateToLatest();

        assertThat(result.getStartVersion()).isZero();
        assertThat(result.getFinalVersion()).isEqualTo(migrator.getTargetVersion());
        assertThat(result.getAppliedVersions()).containsExactly(1, 2, 3, 4, 5, 6);
        assertThat(result.getBackupFiles()).isEmpty();
        assertThat(migrator.detectVersion()).isEqualTo(6);
        assertThat(migrator.getAppliedMigrations()).containsExactly(1, 2, 3, 4, 5, 6);
        assertThat(migrator.hasPendingMigrations()).isFalse();
    }

    @Test
    void freshRegistryHasExactlyOneNonDeletableDefaultShelfAndBox() throws SQLException {
        DatabaseMigrator.forRegistry(database).migrateToLatest();

        assertThat(queryLong("SELECT COUNT(*) FROM shelves WHERE is_default = 1")).isEqualTo(1);
        assertThat(queryLong("SELECT COUNT(*) FROM shelves WHERE is_default = 1 AND is_deletable = 0")).isEqualTo(1);
        assertThat(queryLong("SELECT COUNT(*) FROM boxes")).isEqualTo(1);
        assertThat(queryLong("SELECT COUNT(*) FROM boxes WHERE is_deletable = 0 AND type = 'bag'")).isEqualTo(1);
        assertThat(queryLong("SELECT COUNT(*) FROM shelf_boxes WHERE position = 1")).isEqualTo(1);
    }

    @Test
    void secondRunAppliesNothing() throws SQLException {
        DatabaseMigrator migrator = DatabaseMigrator.forRegistry(database);
        migrator.migrateToLatest();
        long shelves = queryLong("SELECT COUNT(*) FROM shelves");

        MigrationResult second = migrator.migrateToLatest();

        assertThat(second.getAppliedCount()).isZero();
        assertThat(second.getFinalVersion()).isEqualTo(6);
        assertThat(queryLong("SELECT COUNT(*) FROM shelves")).isEqualTo(shelves);
        assertThat(queryLong("SELECT COUNT(*) FROM schema_migrations")).isEqualTo(6);
    }

    @Test
    void seedingIsNotRepeatedWhenStepsRunAgain() throws SQLException {
        DatabaseMigrator migrator = DatabaseMigrator.forRegistry(database);
        migrator.migrateToLatest();

        // Simulate a crash that left the marker behind the recorded steps
        execute("PRAGMA user_version = 0", "DELETE FROM schema_migrations");
        MigrationResult rerun = migrator.migrateToLatest();

        assertThat(rerun.getAppliedCount()).isEqualTo(6);
        assertThat(queryLong("SELECT COUNT(*) FROM shelves")).isEqualTo(1);
        assertThat(queryLong("SELECT COUNT(*) FROM boxes")).isEqualTo(1);
        assertThat(queryLong("SELECT COUNT(*) FROM shelf_boxes")).isEqualTo(1);
    }

    @Test
    void failedStepLeavesTheMarkerAndResumesAfterRecordedSteps() throws SQLException {
        List<String> calls = new ArrayList<>();
        SchemaMigration first = migration(1, conn -> {
            calls.add("v1");
            execute(conn, "CREATE TABLE IF NOT EXISTS things (id INTEGER PRIMARY KEY)");
        });
        SchemaMigration broken = migration(2, conn -> {
            calls.add("v2-broken");
            execute(conn, "INSERT INTO missing_table VALUES (1)");
        });

        DatabaseMigrator failing = new DatabaseMigrator(database, "test", List.of(first, broken));
        assertThatThrownBy(failing::migrateToLatest)
                .isInstanceOf(MigrationException.class)
                .satisfies(e -> assertThat(((MigrationException) e).getStepVersion()).isEqualTo(2))
                .hasMessageContaining("Migration V2 failed");
        assertThat(failing.detectVersion()).isZero();
        assertThat(failing.getAppliedMigrations()).containsExactly(1);

        SchemaMigration fixed = migration(2, conn -> {
            calls.add("v2-fixed");
            execute(conn, "INSERT INTO things VALUES (1)");
        });
        MigrationResult result = new DatabaseMigrator(database, "test", List.of(first, fixed)).migrateToLatest();

        assertThat(result.getAppliedVersions()).containsExactly(2);
        assertThat(result.getFinalVersion()).isEqualTo(2);
        assertThat(calls).containsExactly("v1", "v2-broken", "v2-fixed");
        assertThat(queryLong("SELECT COUNT(*) FROM things")).isEqualTo(1);
    }

    @Test
    void failedStepIsRolledBack() throws SQLException {
        SchemaMigration halfDone = migration(1, conn -> {
            execute(conn, "CREATE TABLE partial (id INTEGER PRIMARY KEY)");
            execute(conn, "INSERT INTO nowhere VALUES (1)");
        });

        assertThatThrownBy(() -> new DatabaseMigrator(database, "test", List.of(halfDone)).migrateToLatest())
                .isInstanceOf(MigrationException.class);

        assertThat(queryLong("SELECT COUNT(*) FROM sqlite_master WHERE name = 'partial'")).isZero();
    }

    @Test
    void unexpectedFailureInAStructuralStepCarriesTheBackup() throws SQLException {
        execute("CREATE TABLE things (id INTEGER PRIMARY KEY)", "INSERT INTO things VALUES (1)");
        SchemaMigration restructure = new SchemaMigration() {
            @Override
            public int getVersion() {
                return 1;
            }

            @Override
            public String getDescription() {
                return "restructure things";
            }

            @Override
            public MigrationKind getKind() {
                return MigrationKind.STRUCTURAL;
            }

            @Override
            public void migrate(Connection connection) throws SQLException {
                execute(connection, "DROP TABLE things");
                throw new IllegalStateException("unexpected row shape");
            }
        };

        Path backup = tempDir.resolve("project_registry.db.bak");
        assertThatThrownBy(() -> new DatabaseMigrator(database, "test", List.of(restructure)).migrateToLatest())
                .isInstanceOfSatisfying(MigrationException.class, e -> {
                    assertThat(e.getStepVersion()).isEqualTo(1);
                    assertThat(e.getBackupFile()).isEqualTo(backup);
                    assertThat(e.getCause()).isInstanceOf(IllegalStateException.class);
                    assertThat(e.getMessage()).contains("Migration V1 failed", "unexpected row shape");
                });

        assertThat(Files.exists(backup)).isTrue();
        assertThat(queryLong("SELECT COUNT(*) FROM things")).isEqualTo(1);
        assertThat(queryLong("PRAGMA user_version")).isZero();
    }

    @Test
    void duplicateVersionsAreRejected() {
        SchemaMigration a = migration(1, conn -> { });
        SchemaMigration b = migration(1, conn -> { });

        assertThatThrownBy(() -> new DatabaseMigrator(database, "test", List.of(a, b)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate migration version 1");
    }

    @Test
    void backupNamesAreNumberedWhenTaken() throws Exception {
        Path file = tempDir.resolve("registry.db");
        assertThat(DatabaseMigrator.getNextBackupName(file)).isEqualTo(tempDir.resolve("registry.db.bak"));

        Files.createFile(tempDir.resolve("registry.db.bak"));
        assertThat(DatabaseMigrator.getNextBackupName(file)).isEqualTo(tempDir.resolve("registry.db.bak_2"));

        Files.createFile(tempDir.resolve("registry.db.bak_2"));
        assertThat(DatabaseMigrator.getNextBackupName(file)).isEqualTo(tempDir.resolve("registry.db.bak_3"));
    }

    @Test
    void shardMigrationsCreateCrawlTables() {
        Path shardFile = tempDir.resolve("projects/docs/docs.db");
        RegistryConfig config = RegistryConfig.builder().dataDirectory(tempDir).build();
        try (SqliteDatabase shard = SqliteDatabase.open(shardFile, config)) {
            MigrationResult result = DatabaseMigrator.forShard(shard).migrateToLatest();

            assertThat(result.getAppliedVersions()).containsExactly(1, 2);
            Boolean tables = shard.getTransactionManager().execute(conn -> {
                SchemaVersionDetector detector = new SchemaVersionDetector(conn);
                return detector.tableExists("crawl_sessions") && detector.tableExists("pages");
            });
            assertThat(tables).isTrue();
        }
    }

    // ==================== Helpers ====================

    @FunctionalInterface
    interface Body {
        void run(Connection conn) throws SQLException;
    }

    private static SchemaMigration migration(int version, Body body) {
        return new SchemaMigration() {
            @Override
            public int getVersion() {
                return version;
            }

            @Override
            public String getDescription() {
                return "test step " + version;
            }

            @Override
            public void migrate(Connection connection) throws SQLException {
                body.run(connection);
            }
        };
    }

    private static void execute(Connection conn, String sql) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }

    private void execute(String... statements) throws SQLException {
        try (Statement stmt = database.getConnection().createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
        }
    }

    private long queryLong(String sql) throws SQLException {
        try (Statement stmt = database.getConnection().createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getLong(1) : -1;
        }
    }
}
