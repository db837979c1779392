package docbro.audit;

import docbro.json.JsonCodec;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Audit entry for one recreation, upgrade or validation attempt.
 * Opened with {@code completedAt == null} and sealed once by
 * {@link MigrationTracker#complete}; never changed after sealing.
 */
public final class MigrationRecord {

    public static final String DEFAULT_RECREATE_COMMAND = "docbro project --recreate";
    public static final String DEFAULT_VALIDATE_COMMAND = "docbro project --check-compatibility";

    private final String id;
    private final String projectId;
    private final String projectName;
    private final MigrationOperation operation;
    private final int fromSchemaVersion;
    private final int toSchemaVersion;
    private final Instant startedAt;
    private final Instant completedAt;
    private final boolean success;
    private final String errorMessage;
    private final Map<String, Object> preservedSettings;
    private final Map<String, Object> preservedMetadata;
    private final long dataSizeBytes;
    private final boolean userInitiated;
    private final String initiatedByCommand;

    private MigrationRecord(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.projectId = Objects.requireNonNull(builder.projectId, "projectId");
        this.projectName = Objects.requireNonNull(builder.projectName, "projectName");
        this.operation = Objects.requireNonNull(builder.operation, "operation");
        this.fromSchemaVersion = builder.fromSchemaVersion;
        this.toSchemaVersion = builder.toSchemaVersion;
        this.startedAt = Objects.requireNonNull(builder.startedAt, "startedAt");
        this.completedAt = builder.completedAt;
        this.success = builder.success;
        this.errorMessage = builder.errorMessage;
        this.preservedSettings = JsonCodec.normalize(builder.preservedSettings);
        this.preservedMetadata = JsonCodec.normalize(builder.preservedMetadata);
        this.dataSizeBytes = builder.dataSizeBytes;
        this.userInitiated = builder.userInitiated;
        this.initiatedByCommand = builder.initiatedByCommand;
        if (operation == MigrationOperation.VALIDATION && fromSchemaVersion != toSchemaVersion) {
            throw new IllegalArgumentException("Validation records keep the schema version unchanged");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    Builder toBuilder() {
        return new Builder()
                .id(id)
                .projectId(projectId)
                .projectName(projectName)
                .operation(operation)
                .fromSchemaVersion(fromSchemaVersion)
                .toSchemaVersion(toSchemaVersion)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .success(success)
                .errorMessage(errorMessage)
                .preservedSettings(preservedSettings)
                .preservedMetadata(preservedMetadata)
                .dataSizeBytes(dataSizeBytes)
                .userInitiated(userInitiated)
                .initiatedByCommand(initiatedByCommand);
    }

    // ==================== Getters ====================

    public String getId() { return id; }
    public String getProjectId() { return projectId; }
    public String getProjectName() { return projectName; }
    public MigrationOperation getOperation() { return operation; }
    public int getFromSchemaVersion() { return fromSchemaVersion; }
    public int getToSchemaVersion() { return toSchemaVersion; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getCompletedAt() { return completedAt; }
    public boolean isSuccess() { return success; }
    public String getErrorMessage() { return errorMessage; }
    public Map<String, Object> getPreservedSettings() { return preservedSettings; }
    public Map<String, Object> getPreservedMetadata() { return preservedMetadata; }
    public long getDataSizeBytes() { return dataSizeBytes; }
    public boolean isUserInitiated() { return userInitiated; }
    public String getInitiatedByCommand() { return initiatedByCommand; }

    // ==================== Derived ====================

    public boolean isCompleted() {
        return completedAt != null;
    }

    public boolean isInProgress() {
        return completedAt == null;
    }

    /**
     * @return Milliseconds from start to completion, null while in flight
     */
    public Long getDurationMillis() {
        return completedAt == null ? null : Duration.between(startedAt, completedAt).toMillis();
    }

    public boolean isSchemaUpgrade() {
        return toSchemaVersion > fromSchemaVersion;
    }

    public boolean isSchemaDowngrade() {
        return toSchemaVersion < fromSchemaVersion;
    }

    public int getSchemaVersionChange() {
        return toSchemaVersion - fromSchemaVersion;
    }

    /**
     * Flat summary used by history exports.
     */
    public Map<String, Object> toSummary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("id", id);
        summary.put("project_name", projectName);
        summary.put("project_id", projectId);
        summary.put("operation", operation.getValue());
        summary.put("schema_change", "v" + fromSchemaVersion + " -> v" + toSchemaVersion);
        summary.put("started_at", startedAt.toString());
        summary.put("completed_at", completedAt == null ? null : completedAt.toString());
        summary.put("duration_ms", getDurationMillis());
        summary.put("success", success);
        summary.put("error_message", errorMessage);
        summary.put("data_size_bytes", dataSizeBytes);
        summary.put("user_initiated", userInitiated);
        summary.put("initiated_by_command", initiatedByCommand);
        return summary;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MigrationRecord that = (MigrationRecord) o;
        return id.equals(that.id) && Objects.equals(completedAt, that.completedAt) && success == that.success;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, completedAt, success);
    }

    @Override
    public String toString() {
        return "MigrationRecord{" +
                "id='" + id + '\'' +
                ", project='" + projectName + '\'' +
                ", operation=" + operation +
                ", v" + fromSchemaVersion + "->v" + toSchemaVersion +
                ", " + (isCompleted() ? (success ? "succeeded" : "failed") : "in progress") +
                '}';
    }

    // ==================== Builder ====================

    public static class Builder {
        private String id;
        private String projectId;
        private String projectName;
        private MigrationOperation operation;
        private int fromSchemaVersion;
        private int toSchemaVersion;
        private Instant startedAt;
        private Instant completedAt;
        private boolean success;
        private String errorMessage;
        private Map<String, ?> preservedSettings;
        private Map<String, ?> preservedMetadata;
        private long dataSizeBytes;
        private boolean userInitiated = true;
        private String initiatedByCommand = "unknown";

        public Builder id(String id) { this.id = id; return this; }
        public Builder projectId(String projectId) { this.projectId = projectId; return this; }
        public Builder projectName(String projectName) { this.projectName = projectName; return this; }
        public Builder operation(MigrationOperation operation) { this.operation = operation; return this; }
        public Builder fromSchemaVersion(int fromSchemaVersion) { this.fromSchemaVersion = fromSchemaVersion; return this; }
        public Builder toSchemaVersion(int toSchemaVersion) { this.toSchemaVersion = toSchemaVersion; return this; }
        public Builder startedAt(Instant startedAt) { this.startedAt = startedAt; return this; }
        public Builder completedAt(Instant completedAt) { this.completedAt = completedAt; return this; }
        public Builder success(boolean success) { this.success = success; return this; }
        public Builder errorMessage(String errorMessage) { this.errorMessage = errorMessage; return this; }
        public Builder preservedSettings(Map<String, ?> preservedSettings) { this.preservedSettings = preservedSettings; return this; }
        public Builder preservedMetadata(Map<String, ?> preservedMetadata) { this.preservedMetadata = preservedMetadata; return this; }
        public Builder dataSizeBytes(long dataSizeBytes) { this.dataSizeBytes = dataSizeBytes; return this; }
        public Builder userInitiated(boolean userInitiated) { this.userInitiated = userInitiated; return this; }
        public Builder initiatedByCommand(String initiatedByCommand) { this.initiatedByCommand = initiatedByCommand; return this; }

        public MigrationRecord build() {
            return new MigrationRecord(this);
        }
    }
}
