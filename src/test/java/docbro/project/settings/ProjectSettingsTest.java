package docbro.project.settings;

import docbro.project.ProjectType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Typed project settings")
class ProjectSettingsTest {

    @Test
    void typeSelectsTheVariant() {
        assertThat(ProjectSettings.of(ProjectType.CRAWLING, Map.of())).isInstanceOf(CrawlingSettings.class);
        assertThat(ProjectSettings.of(ProjectType.DATA, Map.of())).isInstanceOf(DataSettings.class);
        assertThat(ProjectSettings.of(ProjectType.STORAGE, Map.of())).isInstanceOf(StorageSettings.class);
        assertThat(ProjectSettings.of(null, Map.of())).isInstanceOf(UntypedSettings.class);
    }

    @Test
    void crawlDepthIsRequiredAndBounded() {
        assertThat(ProjectSettings.of(ProjectType.CRAWLING, Map.of()).validate())
                .singleElement().asString().contains("crawl_depth");
        assertThat(ProjectSettings.of(ProjectType.CRAWLING, Map.of("crawl_depth", 11)).validate())
                .singleElement().asString().contains("between 1 and 10");
        assertThat(ProjectSettings.of(ProjectType.CRAWLING, Map.of("crawl_depth", 2.5)).validate())
                .singleElement().asString().contains("must be an integer");
        assertThat(ProjectSettings.of(ProjectType.CRAWLING, Map.of("crawl_depth", 4, "rate_limit", 0)).validate())
                .singleElement().asString().contains("rate_limit");
        assertThat(ProjectSettings.of(ProjectType.CRAWLING, Map.of("crawl_depth", 4)).validate()).isEmpty();
    }

    @Test
    void dataProjectsNeedChunkSizeAndModel() {
        assertThat(ProjectSettings.of(ProjectType.DATA, Map.of()).validate()).hasSize(2);
        assertThat(ProjectSettings.of(ProjectType.DATA, Map.of("chunk_size", 50, "embedding_model", "m")).validate())
                .singleElement().asString().contains("chunk_size");
        assertThat(ProjectSettings.of(ProjectType.DATA, Map.of("chunk_size", 500, "embedding_model", " ")).validate())
                .singleElement().asString().contains("embedding_model");
    }

    @Test
    void storageCompressionMustBeBoolean() {
        assertThat(ProjectSettings.of(ProjectType.STORAGE, Map.of("enable_compression", "yes")).validate())
                .singleElement().asString().contains("boolean");
        assertThat(ProjectSettings.defaultsFor(ProjectType.STORAGE).validate()).isEmpty();
    }

    @Test
    void defaultsAreValidForEveryType() {
        for (ProjectType type : ProjectType.values()) {
            assertThat(ProjectSettings.defaultsFor(type).validate()).as(type.getValue()).isEmpty();
        }
        CrawlingSettings crawling = (CrawlingSettings) ProjectSettings.defaultsFor(ProjectType.CRAWLING);
        assertThat(crawling.getCrawlDepth()).isEqualTo(3);
        assertThat(crawling.getRateLimit()).isEqualTo(1.0);
        assertThat(crawling.getUserAgent()).isEqualTo("DocBro/1.0");
    }

    @Test
    void valuesOverrideDefaultsAndUnknownKeysSurvive() {
        ProjectSettings settings = ProjectSettings.withDefaults(ProjectType.CRAWLING,
                Map.of("crawl_depth", 5, "custom_header", "X-Docs"));

        assertThat(settings.get("crawl_depth")).isEqualTo(5L);
        assertThat(settings.get("custom_header")).isEqualTo("X-Docs");
        assertThat(settings.get("user_agent")).isEqualTo("DocBro/1.0");
    }

    @Test
    void mergeReturnsANewVariantOfTheSameType() {
        ProjectSettings original = ProjectSettings.of(ProjectType.DATA, Map.of("chunk_size", 500, "embedding_model", "m"));
        ProjectSettings merged = original.merge(Map.of("chunk_size", 800));

        assertThat(merged).isInstanceOf(DataSettings.class);
        assertThat(merged.get("chunk_size")).isEqualTo(800L);
        assertThat(original.get("chunk_size")).isEqualTo(500L);
    }

    @Test
    void equalityIsByValues() {
        assertThat(ProjectSettings.of(ProjectType.CRAWLING, Map.of("crawl_depth", 4)))
                .isEqualTo(ProjectSettings.of(ProjectType.CRAWLING, Map.of("crawl_depth", 4L)))
                .isNotEqualTo(ProjectSettings.of(null, Map.of("crawl_depth", 4)));
    }

    @Test
    void typesDeclareTheirOperations() {
        assertThat(ProjectType.CRAWLING.supports("crawl")).isTrue();
        assertThat(ProjectType.CRAWLING.supports("upload")).isFalse();
        assertThat(ProjectType.STORAGE.supports("tagging")).isTrue();
        assertThat(ProjectType.DATA.supports("document_processing")).isTrue();
    }
}
