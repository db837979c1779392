package docbro.db.migration;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of one {@link DatabaseMigrator#migrateToLatest()} run.
 */
public final class MigrationResult {

    private final int startVersion;
    private final int finalVersion;
    private final List<Integer> appliedVersions;
    private final List<Path> backupFiles;

    public MigrationResult(int startVersion, int finalVersion, List<Integer> appliedVersions, List<Path> backupFiles) {
        this.startVersion = startVersion;
        this.finalVersion = finalVersion;
        this.appliedVersions = List.copyOf(appliedVersions);
        this.backupFiles = List.copyOf(backupFiles);
    }

    public int getAppliedCount() { return appliedVersions.size(); }
    public int getStartVersion() { return startVersion; }
    public int getFinalVersion() { return finalVersion; }
    public List<Integer> getAppliedVersions() { return appliedVersions; }
    public List<Path> getBackupFiles() { return backupFiles; }

    @Override
    public String toString() {
        return "MigrationResult{from=" + startVersion + ", to=" + finalVersion
                + ", applied=" + appliedVersions + ", backups=" + backupFiles + "}";
    }
}
