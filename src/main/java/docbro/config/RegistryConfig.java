package docbro.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Immutable configuration for the project registry.
 * Locates the registry file and the per-project shard directory, and carries
 * the SQLite connection tuning applied to every opened file.
 */
public final class RegistryConfig {

    public static final String DATA_DIR_PROPERTY = "docbro.data.dir";
    public static final String DATA_DIR_ENV = "DOCBRO_DATA_DIR";
    public static final String DEFAULT_REGISTRY_FILE = "project_registry.db";
    public static final String DEFAULT_PROJECTS_DIR = "projects";
    public static final int DEFAULT_BUSY_TIMEOUT_MS = 5000;
    public static final String DEFAULT_JOURNAL_MODE = "WAL";

    private final Path dataDirectory;
    private final String registryFileName;
    private final String projectsDirectoryName;
    private final int busyTimeoutMillis;
    private final String journalMode;

    private RegistryConfig(Builder builder) {
        this.dataDirectory = builder.dataDirectory != null ? builder.dataDirectory : resolveDefaultDataDirectory();
        this.registryFileName = builder.registryFileName;
        this.projectsDirectoryName = builder.projectsDirectoryName;
        this.busyTimeoutMillis = builder.busyTimeoutMillis;
        this.journalMode = builder.journalMode;
    }

    /**
     * Configuration resolved entirely from the environment.
     */
    public static RegistryConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolve the data directory: system property, then environment variable,
     * then {@code ~/.local/share/docbro}.
     */
    static Path resolveDefaultDataDirectory() {
        String fromProperty = System.getProperty(DATA_DIR_PROPERTY);
        if (fromProperty != null && !fromProperty.isBlank()) {
            return Paths.get(fromProperty);
        }
        String fromEnv = System.getenv(DATA_DIR_ENV);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return Paths.get(fromEnv);
        }
        return Paths.get(System.getProperty("user.home"), ".local", "share", "docbro");
    }

    // ==================== Getters ====================

    public Path getDataDirectory() { return dataDirectory; }
    public String getRegistryFileName() { return registryFileName; }
    public String getProjectsDirectoryName() { return projectsDirectoryName; }
    public int getBusyTimeoutMillis() { return busyTimeoutMillis; }
    public String getJournalMode() { return journalMode; }

    public Path getRegistryFile() {
        return dataDirectory.resolve(registryFileName);
    }

    public Path getProjectsDirectory() {
        return dataDirectory.resolve(projectsDirectoryName);
    }

    /**
     * Shard file of one project: {@code <data-dir>/projects/<name>/<name>.db}.
     */
    public Path getShardFile(String projectName) {
        return getProjectsDirectory().resolve(projectName).resolve(projectName + ".db");
    }

    @Override
    public String toString() {
        return "RegistryConfig{dataDirectory=" + dataDirectory
                + ", registryFile=" + registryFileName
                + ", journalMode=" + journalMode
                + ", busyTimeout=" + busyTimeoutMillis + "ms}";
    }

    // ==================== Builder ====================

    public static class Builder {
        private Path dataDirectory;
        private String registryFileName = DEFAULT_REGISTRY_FILE;
        private String projectsDirectoryName = DEFAULT_PROJECTS_DIR;
        private int busyTimeoutMillis = DEFAULT_BUSY_TIMEOUT_MS;
        private String journalMode = DEFAULT_JOURNAL_MODE;

        public Builder dataDirectory(Path dataDirectory) {
            this.dataDirectory = dataDirectory;
            return this;
        }

        public Builder registryFileName(String registryFileName) {
            this.registryFileName = registryFileName;
            return this;
        }

        public Builder projectsDirectoryName(String projectsDirectoryName) {
            this.projectsDirectoryName = projectsDirectoryName;
            return this;
        }

        public Builder busyTimeoutMillis(int busyTimeoutMillis) {
            if (busyTimeoutMillis < 0) {
                throw new IllegalArgumentException("busy timeout must not be negative");
            }
            this.busyTimeoutMillis = busyTimeoutMillis;
            return this;
        }

        public Builder journalMode(String journalMode) {
            this.journalMode = journalMode;
            return this;
        }

        public RegistryConfig build() {
            return new RegistryConfig(this);
        }
    }
}
