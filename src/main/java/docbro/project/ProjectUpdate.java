package docbro.project;

import java.util.Map;

/**
 * Partial change to a project. Null fields are left as they are; maps are
 * merged key by key into the stored values.
 */
public final class ProjectUpdate {

    private final Map<String, ?> settings;
    private final Map<String, ?> metadata;
    private final Map<String, ?> statistics;
    private final String sourceUrl;
    private final ProjectStatus status;

    private ProjectUpdate(Builder builder) {
        this.settings = builder.settings;
        this.metadata = builder.metadata;
        this.statistics = builder.statistics;
        this.sourceUrl = builder.sourceUrl;
        this.status = builder.status;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, ?> getSettings() { return settings; }
    public Map<String, ?> getMetadata() { return metadata; }
    public Map<String, ?> getStatistics() { return statistics; }
    public String getSourceUrl() { return sourceUrl; }
    public ProjectStatus getStatus() { return status; }

    public boolean isEmpty() {
        return settings == null && metadata == null && statistics == null && sourceUrl == null && status == null;
    }

    public static class Builder {
        private Map<String, ?> settings;
        private Map<String, ?> metadata;
        private Map<String, ?> statistics;
        private String sourceUrl;
        private ProjectStatus status;

        public Builder settings(Map<String, ?> settings) { this.settings = settings; return this; }
        public Builder metadata(Map<String, ?> metadata) { this.metadata = metadata; return this; }
        public Builder statistics(Map<String, ?> statistics) { this.statistics = statistics; return this; }
        public Builder sourceUrl(String sourceUrl) { this.sourceUrl = sourceUrl; return this; }
        public Builder status(ProjectStatus status) { this.status = status; return this; }

        public ProjectUpdate build() {
            return new ProjectUpdate(this);
        }
    }
}
