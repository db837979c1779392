package docbro.compat;

import docbro.schema.CompatibilityStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Result of one compatibility check.
 */
public final class CompatibilityReport {

    private final String projectId;
    private final String projectName;
    private final boolean compatible;
    private final CompatibilityStatus status;
    private final int currentVersion;
    private final int projectVersion;
    private final Set<String> missingFields;
    private final Set<String> extraFields;
    private final List<String> issues;
    private final boolean canBeMigrated;
    private final boolean migrationRequired;

    private CompatibilityReport(Builder builder) {
        this.projectId = builder.projectId;
        this.projectName = builder.projectName;
        this.compatible = builder.compatible;
        this.status = builder.status;
        this.currentVersion = builder.currentVersion;
        this.projectVersion = builder.projectVersion;
        this.missingFields = Collections.unmodifiableSet(new TreeSet<>(builder.missingFields));
        this.extraFields = Collections.unmodifiableSet(new TreeSet<>(builder.extraFields));
        this.issues = List.copyOf(builder.issues);
        this.canBeMigrated = builder.canBeMigrated;
        this.migrationRequired = builder.migrationRequired;
    }

    static Builder builder(int currentVersion) {
        return new Builder(currentVersion);
    }

    // ==================== Getters ====================

    public String getProjectId() { return projectId; }
    public String getProjectName() { return projectName; }
    public boolean isCompatible() { return compatible; }
    public CompatibilityStatus getStatus() { return status; }
    public int getCurrentVersion() { return currentVersion; }
    public int getProjectVersion() { return projectVersion; }
    public Set<String> getMissingFields() { return missingFields; }
    public Set<String> getExtraFields() { return extraFields; }
    public List<String> getIssues() { return issues; }
    public boolean canBeMigrated() { return canBeMigrated; }
    public boolean isMigrationRequired() { return migrationRequired; }

    public boolean needsRecreation() {
        return !compatible && !canBeMigrated;
    }

    @Override
    public String toString() {
        return "CompatibilityReport{" +
                "project=" + projectName +
                ", status=" + status +
                ", version=" + projectVersion + "/" + currentVersion +
                ", missing=" + missingFields +
                ", issues=" + issues.size() +
                '}';
    }

    static class Builder {
        private final int currentVersion;
        private String projectId;
        private String projectName;
        private boolean compatible;
        private CompatibilityStatus status = CompatibilityStatus.INCOMPATIBLE;
        private int projectVersion;
        private final Set<String> missingFields = new TreeSet<>();
        private final Set<String> extraFields = new TreeSet<>();
        private final List<String> issues = new ArrayList<>();
        private boolean canBeMigrated;
        private boolean migrationRequired;

        private Builder(int currentVersion) {
            this.currentVersion = currentVersion;
        }

        Builder project(String id, String name) {
            this.projectId = id;
            this.projectName = name;
            return this;
        }

        Builder projectVersion(int projectVersion) {
            this.projectVersion = projectVersion;
            return this;
        }

        int projectVersion() {
            return projectVersion;
        }

        int currentVersion() {
            return currentVersion;
        }

        Builder issue(String issue) {
            issues.add(issue);
            return this;
        }

        Builder issues(List<String> more) {
            issues.addAll(more);
            return this;
        }

        boolean hasIssues() {
            return !issues.isEmpty();
        }

        Builder missingField(String field) {
            missingFields.add(field);
            return this;
        }

        Set<String> missingFields() {
            return missingFields;
        }

        Builder extraField(String field) {
            extraFields.add(field);
            return this;
        }

        Builder migrationRequired(boolean migrationRequired) {
            this.migrationRequired = migrationRequired;
            return this;
        }

        Builder canBeMigrated(boolean canBeMigrated) {
            this.canBeMigrated = canBeMigrated;
            return this;
        }

        Builder compatible(boolean compatible) {
            this.compatible = compatible;
            this.status = compatible ? CompatibilityStatus.COMPATIBLE : CompatibilityStatus.INCOMPATIBLE;
            return this;
        }

        CompatibilityReport build() {
            return new CompatibilityReport(this);
        }
    }
}
