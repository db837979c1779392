package docbro;

import docbro.config.RegistryConfig;
import docbro.project.ProjectRecord;
import docbro.project.ProjectType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ProjectRegistry")
class ProjectRegistryTest {

    @TempDir
    Path tempDir;

    @Test
    void openMigratesOnceAndKeepsDataAcrossReopen() {
        RegistryConfig config = RegistryConfig.builder().dataDirectory(tempDir).build();
        ProjectRecord created;

        try (ProjectRegistry registry = ProjectRegistry.open(config)) {
            assertThat(registry.getStartupMigration().getAppliedVersions()).containsExactly(1, 2, 3, 4, 5, 6);
            assertThat(Files.exists(config.getRegistryFile())).isTrue();
            created = registry.getProjectService().create("docs", ProjectType.CRAWLING);
            registry.getProjectService().shard("docs");
            assertThat(registry.getShards().isOpen("docs")).isTrue();
        }

        try (ProjectRegistry reopened = ProjectRegistry.open(config)) {
            assertThat(reopened.getStartupMigration().getAppliedCount()).isZero();
            assertThat(reopened.getProjectService().get("docs")).isEqualTo(created);
            assertThat(reopened.getShelves().getDefaultShelf().isDefault()).isTrue();
            assertThat(reopened.getShards().isOpen("docs")).isFalse();
        }
    }

    @Test
    void closeReleasesTheRegistryFile() {
        RegistryConfig config = RegistryConfig.builder().dataDirectory(tempDir).build();
        ProjectRegistry registry = ProjectRegistry.open(config);

        registry.close();

        assertThat(registry.getDatabase().isClosed()).isTrue();
    }
}
