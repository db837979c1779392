package docbro.audit;

import java.time.Instant;

/**
 * Filter for audit trail listings. Results are newest first.
 */
public final class MigrationQuery {

    private final String projectId;
    private final MigrationOperation operation;
    private final Boolean success;
    private final Instant since;
    private final Integer limit;

    private MigrationQuery(Builder builder) {
        this.projectId = builder.projectId;
        this.operation = builder.operation;
        this.success = builder.success;
        this.since = builder.since;
        this.limit = builder.limit;
    }

    public static MigrationQuery all() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getProjectId() { return projectId; }
    public MigrationOperation getOperation() { return operation; }
    public Boolean getSuccess() { return success; }
    public Instant getSince() { return since; }
    public Integer getLimit() { return limit; }

    public static class Builder {
        private String projectId;
        private MigrationOperation operation;
        private Boolean success;
        private Instant since;
        private Integer limit;

        public Builder projectId(String projectId) { this.projectId = projectId; return this; }
        public Builder operation(MigrationOperation operation) { this.operation = operation; return this; }

        /**
         * Only sealed records with this outcome.
         */
        public Builder success(Boolean success) { this.success = success; return this; }
        public Builder since(Instant since) { this.since = since; return this; }
        public Builder limit(Integer limit) { this.limit = limit; return this; }

        public MigrationQuery build() {
            return new MigrationQuery(this);
        }
    }
}
