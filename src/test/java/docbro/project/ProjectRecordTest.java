package docbro.project;

import docbro.errors.ValidationException;
import docbro.project.settings.ProjectSettings;
import docbro.schema.CompatibilityStatus;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ProjectRecord")
class ProjectRecordTest {

    private static final Instant NOW = Instant.parse("2025-01-15T10:00:00Z");

    private static ProjectRecord.Builder valid() {
        return ProjectRecord.builder()
                .id("p1")
                .name("docs")
                .type(ProjectType.CRAWLING)
                .createdAt(NOW)
                .updatedAt(NOW);
    }

    @Test
    void defaultsToCurrentVersionAndActiveStatus() {
        ProjectRecord record = valid().build();

        assertThat(record.getSchemaVersion()).isEqualTo(3);
        assertThat(record.getStatus()).isEqualTo(ProjectStatus.ACTIVE);
        assertThat(record.getCompatibilityStatus()).isEqualTo(CompatibilityStatus.COMPATIBLE);
        assertThat(record.allowsModification()).isTrue();
        assertThat(record.getSettings().type()).isEqualTo(ProjectType.CRAWLING);
        assertThat(record.getStatistics()).isEmpty();
    }

    @Test
    void olderGenerationDerivesIncompatible() {
        ProjectRecord record = valid().schemaVersion(1).build();

        assertThat(record.getCompatibilityStatus()).isEqualTo(CompatibilityStatus.INCOMPATIBLE);
        assertThat(record.needsRecreation()).isTrue();
        assertThat(record.allowsModification()).isFalse();
    }

    @Test
    void namesAreTrimmedAndRestricted() {
        assertThat(valid().name("  my docs_v2-x ").build().getName()).isEqualTo("my docs_v2-x");

        assertThatThrownBy(() -> valid().name("   ").build()).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> valid().name("docs/../etc").build()).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> valid().name("x".repeat(101)).build())
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("100");
        assertThat(valid().name("x".repeat(100)).build().getName()).hasSize(100);
    }

    @Test
    void sourceUrlMustBeHttp() {
        assertThat(valid().sourceUrl("https://docs.example.com").build().getSourceUrl())
                .isEqualTo("https://docs.example.com");
        assertThatThrownBy(() -> valid().sourceUrl("ftp://docs.example.com").build())
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void schemaVersionBelowOneIsRejected() {
        assertThatThrownBy(() -> valid().schemaVersion(0).build()).isInstanceOf(ValidationException.class);
    }

    @Test
    void pageCountersMustNotExceedTheTotal() {
        Map<String, Object> inconsistent = Map.of("total_pages", 10, "successful_pages", 8, "failed_pages", 3);

        assertThatThrownBy(() -> valid().statistics(inconsistent).build())
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("cannot exceed total pages");

        ProjectRecord ok = valid().statistics(Map.of("total_pages", 10, "successful_pages", 7, "failed_pages", 3)).build();
        assertThat(ok.getStatistic(ProjectRecord.STAT_TOTAL_PAGES)).isEqualTo(10L);
    }

    @Test
    void settingsMustMatchTheType() {
        ProjectSettings dataSettings = ProjectSettings.defaultsFor(ProjectType.DATA);

        assertThatThrownBy(() -> valid().settings(dataSettings).build())
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("do not match");
    }

    @Test
    void untypedRecordsReportTypeAsMissing() {
        ProjectRecord legacy = valid().type(null).schemaVersion(1).build();

        assertThat(legacy.getType()).isNull();
        assertThat(legacy.presentFields()).doesNotContain("type").contains("settings", "statistics", "metadata");
    }

    @Test
    void toBuilderCopiesEveryField() {
        ProjectRecord original = valid()
                .sourceUrl("https://x.example.com")
                .settings(Map.of("crawl_depth", 4))
                .metadata(Map.of("owner", "ops"))
                .lastOperationAt(NOW)
                .build();

        assertThat(original.toBuilder().build()).isEqualTo(original);
    }
}
