package docbro.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegistryConfigTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty(RegistryConfig.DATA_DIR_PROPERTY);
    }

    @Test
    void laysOutRegistryAndShardFilesUnderTheDataDirectory() {
        Path dataDir = Paths.get("/var/lib/docbro");
        RegistryConfig config = RegistryConfig.builder().dataDirectory(dataDir).build();

        assertThat(config.getRegistryFile()).isEqualTo(dataDir.resolve("project_registry.db"));
        assertThat(config.getShardFile("docs")).isEqualTo(dataDir.resolve("projects/docs/docs.db"));
        assertThat(config.getBusyTimeoutMillis()).isEqualTo(5000);
        assertThat(config.getJournalMode()).isEqualTo("WAL");
    }

    @Test
    void systemPropertyOverridesTheDefaultDataDirectory() {
        System.setProperty(RegistryConfig.DATA_DIR_PROPERTY, "/tmp/docbro-test");

        assertThat(RegistryConfig.defaults().getDataDirectory()).isEqualTo(Paths.get("/tmp/docbro-test"));
    }

    @Test
    void negativeBusyTimeoutIsRejected() {
        assertThatThrownBy(() -> RegistryConfig.builder().busyTimeoutMillis(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
