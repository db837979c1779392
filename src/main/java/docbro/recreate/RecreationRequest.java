package docbro.recreate;

import java.nio.file.Path;
import java.util.Objects;

public final class RecreationRequest {

    private final String projectIdOrName;
    private final boolean preserveSettings;
    private final boolean confirmed;
    private final boolean force;
    private final Path exportDirectory;
    private final String initiatingCommand;

    private RecreationRequest(Builder builder) {
        this.projectIdOrName = Objects.requireNonNull(builder.projectIdOrName, "projectIdOrName");
        this.preserveSettings = builder.preserveSettings;
        this.confirmed = builder.confirmed;
        this.force = builder.force;
        this.exportDirectory = builder.exportDirectory;
        this.initiatingCommand = builder.initiatingCommand;
    }

    public static Builder builder(String projectIdOrName) {
        return new Builder().projectIdOrName(projectIdOrName);
    }

    public String getProjectIdOrName() { return projectIdOrName; }
    public boolean isPreserveSettings() { return preserveSettings; }
    public boolean isConfirmed() { return confirmed; }
    public boolean isForce() { return force; }
    public Path getExportDirectory() { return exportDirectory; }
    public String getInitiatingCommand() { return initiatingCommand; }

    public static class Builder {
        private String projectIdOrName;
        private boolean preserveSettings = true;
        private boolean confirmed;
        private boolean force;
        private Path exportDirectory;
        private String initiatingCommand;

        public Builder projectIdOrName(String projectIdOrName) { this.projectIdOrName = projectIdOrName; return this; }

        /**
         * Keep stored settings (default); otherwise the type's defaults are used.
         */
        public Builder preserveSettings(boolean preserveSettings) { this.preserveSettings = preserveSettings; return this; }
        public Builder confirmed(boolean confirmed) { this.confirmed = confirmed; return this; }

        /**
         * Rebuild even when the project is already compatible.
         */
        public Builder force(boolean force) { this.force = force; return this; }

        /**
         * Write a full export here before anything is changed.
         */
        public Builder exportDirectory(Path exportDirectory) { this.exportDirectory = exportDirectory; return this; }
        public Builder initiatingCommand(String initiatingCommand) { this.initiatingCommand = initiatingCommand; return this; }

        public RecreationRequest build() {
            return new RecreationRequest(this);
        }
    }
}
