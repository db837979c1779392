package docbro.db.migration;

import docbro.LegacyRegistries;
import docbro.config.RegistryConfig;
import docbro.db.SqliteDatabase;
import docbro.db.migration.registry.RegistryMigrations;
import docbro.errors.MigrationException;
import docbro.project.ProjectRecord;
import docbro.project.ProjectRepository;
import docbro.project.ProjectStatus;
import docbro.project.ProjectType;
import docbro.schema.CompatibilityStatus;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Restructuring legacy registries")
class LegacyRegistryMigrationTest {

    @TempDir
    Path tempDir;

    @Test
    void crawlerRowsAreRebuiltAndKeepTheirGeneration() throws Exception {
        RegistryConfig config = RegistryConfig.builder().dataDirectory(tempDir).build();
        LegacyRegistries.writeCrawlerRegistry(config.getRegistryFile(),
                "INSERT INTO projects VALUES ('p1', 'old-docs', 'https://docs.example.com', 'ready', 2, "
                        + "'mxbai-embed-large', 500, 50, '2024-01-01T10:00:00.123456', '2024-01-02T10:00:00', "
                        + "'2024-01-03T08:00:00', 10, 2048, 7, 3, '{\"team\":\"core\"}')",
                "INSERT INTO projects (id, name, source_url, status) VALUES ('p2', 'bare', 'https://bare.example.com', 'queued')");

        try (SqliteDatabase db = SqliteDatabase.open(config.getRegistryFile(), config)) {
            MigrationResult result = DatabaseMigrator.forRegistry(db).migrateToLatest();

            assertThat(result.getAppliedVersions()).contains(4);
            assertThat(result.getBackupFiles()).containsExactly(tempDir.resolve("project_registry.db.bak"));
            assertThat(Files.exists(tempDir.resolve("project_registry.db.bak"))).isTrue();

            ProjectRepository repository = new ProjectRepository(db);
            assertThat(repository.count()).isEqualTo(2);

            ProjectRecord oldDocs = repository.findByName("old-docs").orElseThrow();
            assertThat(oldDocs.getSchemaVersion()).isEqualTo(1);
            assertThat(oldDocs.getType()).isEqualTo(ProjectType.CRAWLING);
            assertThat(oldDocs.getStatus()).isEqualTo(ProjectStatus.READY);
            assertThat(oldDocs.getCompatibilityStatus()).isEqualTo(CompatibilityStatus.INCOMPATIBLE);
            assertThat(oldDocs.needsRecreation()).isTrue();
            assertThat(oldDocs.getSourceUrl()).isEqualTo("https://docs.example.com");
            assertThat(oldDocs.getSettings().get("crawl_depth")).isEqualTo(2L);
            assertThat(oldDocs.getSettings().get("embedding_model")).isEqualTo("mxbai-embed-large");
            assertThat(oldDocs.getStatistic(ProjectRecord.STAT_TOTAL_PAGES)).isEqualTo(10L);
            assertThat(oldDocs.getStatistic(ProjectRecord.STAT_SUCCESSFUL_PAGES)).isEqualTo(7L);
            assertThat(oldDocs.getMetadata()).containsEntry("team", "core");
            assertThat(oldDocs.getCreatedAt()).isEqualTo(Instant.parse("2024-01-01T10:00:00.123Z"));
            assertThat(oldDocs.getLastOperationAt()).isEqualTo(Instant.parse("2024-01-03T08:00:00Z"));

            Map<String, Object> bare = repository.findRawByName("bare").orElseThrow();
            assertThat(bare.get("status")).isEqualTo("inactive");
            assertThat(bare.get("created_at")).isNotNull();
            assertThat(bare.get("compatibility_status")).isEqualTo("incompatible");
        }
    }

    @Test
    void typedRowsKeepTypeSettingsAndLiftTheSourceUrl() throws Exception {
        RegistryConfig config = RegistryConfig.builder().dataDirectory(tempDir).build();
        LegacyRegistries.writeTypedRegistry(config.getRegistryFile(),
                "INSERT INTO projects VALUES ('p1', 'manuals', 'data', 'active', "
                        + "'{\"chunk_size\":800,\"embedding_model\":\"nomic\",\"source_url\":\"https://m.example.com\"}', "
                        + "'{\"owner\":\"ops\"}', '2024-03-01T00:00:00', '2024-03-02T00:00:00')");

        try (SqliteDatabase db = SqliteDatabase.open(config.getRegistryFile(), config)) {
            DatabaseMigrator.forRegistry(db).migrateToLatest();

            ProjectRecord manuals = new ProjectRepository(db).findByName("manuals").orElseThrow();
            assertThat(manuals.getSchemaVersion()).isEqualTo(2);
            assertThat(manuals.getType()).isEqualTo(ProjectType.DATA);
            assertThat(manuals.getSettings().get("chunk_size")).isEqualTo(800L);
            assertThat(manuals.getSourceUrl()).isEqualTo("https://m.example.com");
            assertThat(manuals.getStatistics()).isEmpty();
            assertThat(manuals.getMetadata()).containsEntry("owner", "ops");
        }
    }

    @Test
    void restructuredRegistryKeepsItsDefaultsAndIndexes() throws Exception {
        RegistryConfig config = RegistryConfig.builder().dataDirectory(tempDir).build();
        LegacyRegistries.writeTypedRegistry(config.getRegistryFile());

        try (SqliteDatabase db = SqliteDatabase.open(config.getRegistryFile(), config)) {
            DatabaseMigrator.forRegistry(db).migrateToLatest();

            try (Statement stmt = db.getConnection().createStatement();
                 ResultSet rs = stmt.executeQuery(
                         "SELECT COUNT(*) FROM sqlite_master WHERE type = 'index' AND name LIKE 'idx_projects_%'")) {
                rs.next();
                assertThat(rs.getInt(1)).isEqualTo(6);
            }
            Boolean unified = db.getTransactionManager().execute(
                    conn -> new SchemaVersionDetector(conn).columnExists("projects", "schema_version"));
            assertThat(unified).isTrue();
        }
    }

    @Test
    void secondLegacyUpgradeGetsANumberedBackup() throws Exception {
        RegistryConfig config = RegistryConfig.builder().dataDirectory(tempDir).build();
        Files.createDirectories(tempDir);
        Files.writeString(tempDir.resolve("project_registry.db.bak"), "older backup");
        LegacyRegistries.writeTypedRegistry(config.getRegistryFile());

        try (SqliteDatabase db = SqliteDatabase.open(config.getRegistryFile(), config)) {
            MigrationResult result = DatabaseMigrator.forRegistry(db).migrateToLatest();

            assertThat(result.getBackupFiles()).containsExactly(tempDir.resolve("project_registry.db.bak_2"));
            assertThat(Files.readString(tempDir.resolve("project_registry.db.bak"))).isEqualTo("older backup");
        }
    }

    @Test
    void unconvertibleRowAbortsTheRebuildAndLeavesTheLegacyTable() throws Exception {
        RegistryConfig config = RegistryConfig.builder().dataDirectory(tempDir).build();
        LegacyRegistries.writeTypedRegistry(config.getRegistryFile(),
                "INSERT INTO projects VALUES ('p1', 'manuals', 'data', 'active', '{\"chunk_size\":800}', "
                        + "'{}', '2024-03-01T00:00:00', '2024-03-02T00:00:00')",
                "INSERT INTO projects VALUES ('p2', 'broken', 'data', 'active', '{not json', "
                        + "'{}', '2024-03-01T00:00:00', '2024-03-02T00:00:00')");
        Path backup = tempDir.resolve("project_registry.db.bak");

        try (SqliteDatabase db = SqliteDatabase.open(config.getRegistryFile(), config)) {
            DatabaseMigrator migrator = DatabaseMigrator.forRegistry(db);

            assertThatThrownBy(migrator::migrateToLatest)
                    .isInstanceOfSatisfying(MigrationException.class, e -> {
                        assertThat(e.getStepVersion()).isEqualTo(4);
                        assertThat(e.getBackupFile()).isEqualTo(backup);
                        assertThat(e.getMessage()).contains("Cannot convert project row 'broken'");
                    });

            assertLegacyTableIntact(db, 2);
            assertThat(migrator.getAppliedMigrations()).containsExactly(1, 2, 3);
        }
        assertThat(Files.exists(backup)).isTrue();
    }

    @Test
    void failedPostConditionRollsTheRebuildBack() throws Exception {
        RegistryConfig config = RegistryConfig.builder().dataDirectory(tempDir).build();
        LegacyRegistries.writeTypedRegistry(config.getRegistryFile(),
                "INSERT INTO projects VALUES ('p1', 'manuals', 'data', 'active', '{\"chunk_size\":800}', "
                        + "'{}', '2024-03-01T00:00:00', '2024-03-02T00:00:00')");
        List<SchemaMigration> withoutSeeding = RegistryMigrations.all().stream()
                .filter(m -> m.getVersion() != 3)
                .collect(Collectors.toList());

        try (SqliteDatabase db = SqliteDatabase.open(config.getRegistryFile(), config)) {
            DatabaseMigrator migrator = new DatabaseMigrator(db, "registry", withoutSeeding);

            assertThatThrownBy(migrator::migrateToLatest)
                    .isInstanceOfSatisfying(MigrationException.class, e -> {
                        assertThat(e.getStepVersion()).isEqualTo(4);
                        assertThat(e.getBackupFile()).isEqualTo(tempDir.resolve("project_registry.db.bak"));
                        assertThat(e.getMessage()).contains("No default shelf exists after restructuring");
                    });

            assertLegacyTableIntact(db, 1);
        }
        assertThat(Files.exists(tempDir.resolve("project_registry.db.bak"))).isTrue();
    }

    private static void assertLegacyTableIntact(SqliteDatabase db, int rows) throws SQLException {
        Boolean legacyLayout = db.getTransactionManager().execute(conn -> {
            SchemaVersionDetector detector = new SchemaVersionDetector(conn);
            return detector.columnExists("projects", "settings")
                    && !detector.columnExists("projects", "schema_version")
                    && !detector.tableExists("projects_new");
        });
        assertThat(legacyLayout).isTrue();
        try (Statement stmt = db.getConnection().createStatement()) {
            try (ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM projects")) {
                rs.next();
                assertThat(rs.getInt(1)).isEqualTo(rows);
            }
            try (ResultSet rs = stmt.executeQuery("PRAGMA user_version")) {
                rs.next();
                assertThat(rs.getInt(1)).isZero();
            }
        }
    }
}
