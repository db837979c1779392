package docbro.errors;

import java.nio.file.Path;

/**
 * Exception for a structural migration step or post-condition that failed.
 * The version marker is never advanced when this is thrown.
 */
public class MigrationException extends ProjectRegistryException {
    private final int stepVersion;
    private final Path backupFile;

    public MigrationException(int stepVersion, String message) {
        this(stepVersion, message, null, null);
    }

    public MigrationException(int stepVersion, String message, Path backupFile, Throwable cause) {
        super(ErrorCategory.MIGRATION, message, cause);
        this.stepVersion = stepVersion;
        this.backupFile = backupFile;
    }

    public int getStepVersion() { return stepVersion; }

    /**
     * @return Backup taken before the failing step, or null when none was needed
     */
    public Path getBackupFile() { return backupFile; }

    public MigrationException withBackup(Path backup) {
        return new MigrationException(stepVersion, getMessage(), backup, getCause());
    }
}
