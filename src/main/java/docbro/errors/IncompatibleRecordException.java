package docbro.errors;

/**
 * Exception for modifications attempted on a record that is not compatible
 * with the current schema generation. The message names the recreate command
 * and the version delta.
 */
public class IncompatibleRecordException extends ProjectRegistryException {
    private final String projectName;
    private final int projectVersion;
    private final int currentVersion;

    public IncompatibleRecordException(String projectName, int projectVersion, int currentVersion) {
        super(ErrorCategory.INCOMPATIBLE, String.format(
                "Project '%s' uses schema v%d but the current schema is v%d; "
                        + "it is read-only until recreated with: docbro project --recreate %s --confirm",
                projectName, projectVersion, currentVersion, projectName));
        this.projectName = projectName;
        this.projectVersion = projectVersion;
        this.currentVersion = currentVersion;
    }

    public IncompatibleRecordException(String projectName, String message) {
        super(ErrorCategory.INCOMPATIBLE, message);
        this.projectName = projectName;
        this.projectVersion = -1;
        this.currentVersion = -1;
    }

    public String getProjectName() { return projectName; }
    public int getProjectVersion() { return projectVersion; }
    public int getCurrentVersion() { return currentVersion; }
}
