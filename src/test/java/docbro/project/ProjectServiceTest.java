package docbro.project;

import docbro.MutableClock;
import docbro.ProjectRegistry;
import docbro.audit.MigrationOperation;
import docbro.audit.MigrationRecord;
import docbro.compat.CompatibilityReport;
import docbro.compat.CompatibilitySummary;
import docbro.config.RegistryConfig;
import docbro.errors.AlreadyExistsException;
import docbro.errors.IncompatibleRecordException;
import docbro.errors.NotFoundException;
import docbro.errors.ProjectRegistryException.ErrorCategory;
import docbro.errors.ValidationException;
import docbro.export.ExportType;
import docbro.export.ProjectExport;
import docbro.export.RecreationPreview;
import docbro.project.settings.ProjectSettings;
import docbro.schema.CompatibilityStatus;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ProjectService")
class ProjectServiceTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private ProjectRegistry registry;
    private ProjectService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-06-01T12:00:00Z");
        registry = ProjectRegistry.open(RegistryConfig.builder().dataDirectory(tempDir).build(), clock);
        service = registry.getProjectService();
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    private ProjectRecord saveLegacy(String name, int schemaVersion) {
        ProjectRecord legacy = ProjectRecord.builder()
                .id(name + "-id")
                .name(name)
                .schemaVersion(schemaVersion)
                .type(ProjectType.CRAWLING)
                .createdAt(clock.instant())
                .updatedAt(clock.instant())
                .settings(Map.of("crawl_depth", 4))
                .statistics(Map.of("total_pages", 10))
                .build();
        registry.getProjects().save(legacy);
        return legacy;
    }

    @Test
    void createFillsDefaultsAndStampsTheCurrentVersion() {
        ProjectRecord created = service.create("python docs", ProjectType.CRAWLING,
                Map.of("crawl_depth", 5), Map.of("owner", "ops"), "https://docs.python.org");

        assertThat(created.getId()).isNotBlank();
        assertThat(created.getSchemaVersion()).isEqualTo(3);
        assertThat(created.getStatus()).isEqualTo(ProjectStatus.ACTIVE);
        assertThat(created.getSettings().get("crawl_depth")).isEqualTo(5L);
        assertThat(created.getSettings().get("user_agent")).isEqualTo("DocBro/1.0");
        assertThat(created.getCreatedAt()).isEqualTo(clock.instant());
        assertThat(service.get("python docs")).isEqualTo(created);
        assertThat(service.get(created.getId())).isEqualTo(created);
    }

    @Test
    void duplicateNameIsRejected() {
        service.create("docs", ProjectType.DATA);

        assertThatThrownBy(() -> service.create("docs", ProjectType.STORAGE))
                .isInstanceOf(AlreadyExistsException.class)
                .hasMessage("Project 'docs' already exists")
                .extracting(e -> ((AlreadyExistsException) e).getCategory())
                .isEqualTo(ErrorCategory.ALREADY_EXISTS);
        assertThat(service.list()).hasSize(1);
    }

    @Test
    void invalidCreateArgumentsAreRejected() {
        assertThatThrownBy(() -> service.create("docs", null)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.create("bad/name", ProjectType.DATA)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.create("deep", ProjectType.CRAWLING, Map.of("crawl_depth", 50), null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("crawl_depth");
        assertThat(service.list()).isEmpty();
    }

    @Test
    void updateOfAnOlderGenerationIsRefusedWithoutTouchingStorage() {
        saveLegacy("legacy", 1);
        Map<String, Object> before = registry.getProjects().findRawByName("legacy").orElseThrow();

        assertThatThrownBy(() -> service.update("legacy",
                ProjectUpdate.builder().settings(Map.of("crawl_depth", 2)).build()))
                .isInstanceOfSatisfying(IncompatibleRecordException.class, e -> {
                    assertThat(e.getProjectVersion()).isEqualTo(1);
                    assertThat(e.getCurrentVersion()).isEqualTo(3);
                    assertThat(e.getMessage()).contains("docbro project --recreate legacy --confirm");
                });

        assertThat(registry.getProjects().findRawByName("legacy")).contains(before);
    }

    @Test
    void updateMergesMapsAndValidatesSettings() {
        ProjectRecord created = service.create("docs", ProjectType.CRAWLING,
                Map.of("crawl_depth", 2), Map.of("owner", "ops"), null);
        clock.advance(Duration.ofMinutes(3));

        ProjectRecord updated = service.update("docs", ProjectUpdate.builder()
                .settings(Map.of("crawl_depth", 6))
                .metadata(Map.of("team", "docs"))
                .statistics(Map.of("total_pages", 4))
                .status(ProjectStatus.READY)
                .build());

        assertThat(updated.getSettings().get("crawl_depth")).isEqualTo(6L);
        assertThat(updated.getSettings().get("user_agent")).isEqualTo("DocBro/1.0");
        assertThat(updated.getMetadata()).containsEntry("owner", "ops").containsEntry("team", "docs");
        assertThat(updated.getStatistics()).containsEntry("total_pages", 4L);
        assertThat(updated.getStatus()).isEqualTo(ProjectStatus.READY);
        assertThat(updated.getCreatedAt()).isEqualTo(created.getCreatedAt());
        assertThat(updated.getUpdatedAt()).isEqualTo(clock.instant());
        assertThat(service.get("docs")).isEqualTo(updated);

        assertThatThrownBy(() -> service.update("docs",
                ProjectUpdate.builder().settings(Map.of("crawl_depth", 0)).build()))
                .isInstanceOf(ValidationException.class);
        assertThat(service.get("docs")).isEqualTo(updated);
    }

    @Test
    void projectBeingRecreatedCannotBeUpdatedOrDeleted() {
        ProjectRecord created = service.create("docs", ProjectType.STORAGE);
        registry.getProjects().markMigrating(created.getId());

        assertThatThrownBy(() -> service.update("docs", ProjectUpdate.builder().status(ProjectStatus.ARCHIVED).build()))
                .isInstanceOf(IncompatibleRecordException.class);
        assertThatThrownBy(() -> service.delete("docs")).isInstanceOf(IncompatibleRecordException.class);
        assertThat(service.get("docs").getStatus()).isEqualTo(ProjectStatus.ACTIVE);
    }

    @Test
    void deleteRemovesTheRowAndTheShard() {
        ProjectRecord created = service.create("docs", ProjectType.CRAWLING);
        service.shard("docs").createCrawlSession(created.getId(), 2, "ua", 1.0);
        assertThat(registry.getShards().exists("docs")).isTrue();

        assertThat(service.delete("docs")).isTrue();

        assertThat(service.find("docs")).isEmpty();
        assertThat(registry.getShards().exists("docs")).isFalse();
        assertThat(Files.exists(tempDir.resolve("projects/docs"))).isFalse();
        assertThat(service.delete("docs")).isFalse();
    }

    @Test
    void unknownProjectIsNotFound() {
        assertThatThrownBy(() -> service.get("nope")).isInstanceOf(NotFoundException.class)
                .hasMessage("Project 'nope' not found");
        assertThatThrownBy(() -> service.checkCompatibility("nope")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.update("nope", ProjectUpdate.builder().build()))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void shardOfAnIncompatibleProjectIsRefused() {
        saveLegacy("legacy", 2);

        assertThatThrownBy(() -> service.shard("legacy")).isInstanceOf(IncompatibleRecordException.class);
        assertThat(registry.getShards().exists("legacy")).isFalse();
    }

    @Test
    void statusIsDerivedFromTheSchemaVersionNotTheStoredColumn() throws SQLException {
        String columns = "INSERT INTO projects (id, name, schema_version, type, status, created_at, updated_at, "
                + "settings_json";
        String stamp = "'2024-01-01T10:00:00.000Z', '2024-01-01T10:00:00.000Z', '{\"crawl_depth\": 4}'";
        try (Statement stmt = registry.getDatabase().getConnection().createStatement()) {
            stmt.executeUpdate(columns + ") VALUES ('p1', 'unstamped', 1, 'crawling', 'ready', " + stamp + ")");
            stmt.executeUpdate(columns + ", compatibility_status) VALUES ('p2', 'stale', 2, 'crawling', 'ready', "
                    + stamp + ", 'compatible')");
        }

        assertThat(service.get("unstamped").getCompatibilityStatus()).isEqualTo(CompatibilityStatus.INCOMPATIBLE);
        assertThat(service.get("stale").allowsModification()).isFalse();
        assertThatThrownBy(() -> service.shard("unstamped")).isInstanceOf(IncompatibleRecordException.class);
        assertThatThrownBy(() -> service.shard("stale")).isInstanceOf(IncompatibleRecordException.class);
        assertThat(registry.getShards().exists("unstamped")).isFalse();
        assertThat(registry.getProjects().count(CompatibilityStatus.INCOMPATIBLE)).isEqualTo(2);
        assertThat(registry.getProjects().count(CompatibilityStatus.COMPATIBLE)).isZero();
    }

    @Test
    void compatibilityCheckIsAudited() {
        ProjectRecord current = service.create("current", ProjectType.DATA);
        ProjectRecord legacy = saveLegacy("legacy", 1);

        CompatibilityReport ok = service.checkCompatibility("current");
        CompatibilityReport bad = service.checkCompatibility("legacy");

        assertThat(ok.isCompatible()).isTrue();
        assertThat(bad.isCompatible()).isFalse();

        List<MigrationRecord> okAudit = registry.getTracker().findByProject(current.getId(), null, null);
        assertThat(okAudit).singleElement().satisfies(record -> {
            assertThat(record.getOperation()).isEqualTo(MigrationOperation.VALIDATION);
            assertThat(record.isCompleted()).isTrue();
            assertThat(record.isSuccess()).isTrue();
        });
        List<MigrationRecord> badAudit = registry.getTracker().findByProject(legacy.getId(), null, null);
        assertThat(badAudit).singleElement().satisfies(record -> {
            assertThat(record.isSuccess()).isFalse();
            assertThat(record.getFromSchemaVersion()).isEqualTo(1);
            assertThat(record.getErrorMessage()).contains("older schema version 1");
        });
    }

    @Test
    void summaryAndInstructionsCoverStoredProjects() {
        service.create("current", ProjectType.DATA);
        saveLegacy("legacy", 1);

        CompatibilitySummary summary = service.compatibilitySummary();
        assertThat(summary.getTotal()).isEqualTo(2);
        assertThat(summary.getCompatible()).isEqualTo(1);
        assertThat(summary.getNeedsRecreation()).isEqualTo(1);

        assertThat(service.recreationInstructions("legacy"))
                .contains("   docbro project --recreate legacy --confirm");
        assertThat(service.checkAll()).hasSize(2);
    }

    @Test
    void exportWorksForCurrentAndLegacyProjects() {
        service.create("current", ProjectType.DATA, null, Map.of("owner", "ops"), null);
        saveLegacy("legacy", 1);

        ProjectExport current = service.export("current", ExportType.SETTINGS_ONLY);
        assertThat(current.getMetadata()).containsEntry("owner", "ops");
        assertThat(current.getStatistics()).isEmpty();

        ProjectExport legacy = service.export("legacy", ExportType.FULL);
        assertThat(legacy.getSchemaVersion()).isEqualTo(1);
        assertThat(legacy.getSettings()).containsEntry("crawl_depth", 4L);

        Path file = service.exportToFile("legacy", ExportType.FULL, tempDir.resolve("exports"));
        assertThat(file).exists();
        assertThat(registry.getExports().load(file).getProjectName()).isEqualTo("legacy");
    }

    @Test
    void severalProjectsExportToFilesOrOneBatch() {
        service.create("current", ProjectType.DATA);
        saveLegacy("legacy", 1);

        List<Path> files = service.exportEach(List.of("current", "legacy-id"), ExportType.FULL, tempDir.resolve("each"));
        assertThat(files).hasSize(2).allSatisfy(file -> assertThat(file).exists());
        assertThat(registry.getExports().load(files.get(1)).getSchemaVersion()).isEqualTo(1);

        Path batch = service.exportBatch(List.of("current", "legacy"), ExportType.SETTINGS_ONLY, tempDir.resolve("batch"));
        assertThat(registry.getExports().loadBatch(batch))
                .extracting(ProjectExport::getProjectName)
                .containsExactly("current", "legacy");

        assertThatThrownBy(() -> service.exportBatch(List.of("current", "missing"), ExportType.FULL, tempDir))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void recreationPreviewOfALegacyProject() {
        saveLegacy("legacy", 1);

        RecreationPreview preview = service.previewRecreation("legacy");

        assertThat(preview.getProjectName()).isEqualTo("legacy");
        assertThat(preview.getFromSchemaVersion()).isEqualTo(1);
        assertThat(preview.getSettings()).containsEntry("crawl_depth", 4L).containsEntry("rate_limit", 1.0);
        assertThat(preview.getAddedDefaults()).contains("rate_limit", "user_agent").doesNotContain("crawl_depth");
        assertThat(service.get("legacy").getSchemaVersion()).isEqualTo(1);
    }

    @Test
    void listFiltersByType() {
        service.create("a", ProjectType.DATA);
        service.create("b", ProjectType.CRAWLING);
        saveLegacy("c", 1);

        assertThat(service.list(ProjectQuery.builder().type(ProjectType.CRAWLING)
                        .orderBy(ProjectQuery.SortField.NAME, false).build()))
                .extracting(ProjectRecord::getName)
                .containsExactly("b", "c");
        assertThat(service.list(ProjectQuery.builder()
                        .compatibilityStatus(CompatibilityStatus.INCOMPATIBLE).build()))
                .extracting(ProjectRecord::getName)
                .containsExactly("c");
        assertThat(service.get("a").getSettings()).isEqualTo(ProjectSettings.defaultsFor(ProjectType.DATA));
    }
}
