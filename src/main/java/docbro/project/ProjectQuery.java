package docbro.project;

import docbro.schema.CompatibilityStatus;

/**
 * Filter, ordering and paging for project listings.
 * The default lists everything, most recently updated first.
 */
public final class ProjectQuery {

    public enum SortField {
        NAME("name"),
        CREATED_AT("created_at"),
        UPDATED_AT("updated_at"),
        SCHEMA_VERSION("schema_version");

        private final String column;

        SortField(String column) {
            this.column = column;
        }

        String column() {
            return column;
        }
    }

    private final ProjectStatus status;
    private final ProjectType type;
    private final CompatibilityStatus compatibilityStatus;
    private final SortField sortField;
    private final boolean descending;
    private final Integer limit;
    private final int offset;

    private ProjectQuery(Builder builder) {
        this.status = builder.status;
        this.type = builder.type;
        this.compatibilityStatus = builder.compatibilityStatus;
        this.sortField = builder.sortField;
        this.descending = builder.descending;
        this.limit = builder.limit;
        this.offset = builder.offset;
    }

    public static ProjectQuery all() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public ProjectStatus getStatus() { return status; }
    public ProjectType getType() { return type; }
    public CompatibilityStatus getCompatibilityStatus() { return compatibilityStatus; }
    public SortField getSortField() { return sortField; }
    public boolean isDescending() { return descending; }
    public Integer getLimit() { return limit; }
    public int getOffset() { return offset; }

    public static class Builder {
        private ProjectStatus status;
        private ProjectType type;
        private CompatibilityStatus compatibilityStatus;
        private SortField sortField = SortField.UPDATED_AT;
        private boolean descending = true;
        private Integer limit;
        private int offset;

        public Builder status(ProjectStatus status) {
            this.status = status;
            return this;
        }

        public Builder type(ProjectType type) {
            this.type = type;
            return this;
        }

        public Builder compatibilityStatus(CompatibilityStatus compatibilityStatus) {
            this.compatibilityStatus = compatibilityStatus;
            return this;
        }

        public Builder orderBy(SortField sortField, boolean descending) {
            this.sortField = sortField;
            this.descending = descending;
            return this;
        }

        public Builder limit(Integer limit) {
            if (limit != null && limit < 0) {
                throw new IllegalArgumentException("limit must not be negative");
            }
            this.limit = limit;
            return this;
        }

        public Builder offset(int offset) {
            if (offset < 0) {
                throw new IllegalArgumentException("offset must not be negative");
            }
            this.offset = offset;
            return this;
        }

        public ProjectQuery build() {
            return new ProjectQuery(this);
        }
    }
}
