package docbro.recreate;

import docbro.audit.MigrationRecord;
import docbro.compat.CompatibilityReport;
import docbro.project.ProjectRecord;

import java.nio.file.Path;

/**
 * What a recreation request did. Fields that do not apply to the state are null.
 */
public final class RecreationResult {

    private final RecreationState state;
    private final CompatibilityReport report;
    private final ProjectRecord project;
    private final MigrationRecord audit;
    private final Path exportFile;
    private final String error;

    private RecreationResult(RecreationState state, CompatibilityReport report, ProjectRecord project,
                             MigrationRecord audit, Path exportFile, String error) {
        this.state = state;
        this.report = report;
        this.project = project;
        this.audit = audit;
        this.exportFile = exportFile;
        this.error = error;
    }

    static RecreationResult notConfirmed() {
        return new RecreationResult(RecreationState.NOT_CONFIRMED, null, null, null, null,
                "Recreation requires confirmation");
    }

    static RecreationResult notRequired(CompatibilityReport report) {
        return new RecreationResult(RecreationState.NOT_REQUIRED, report, null, null, null, null);
    }

    static RecreationResult rebuilt(CompatibilityReport report, ProjectRecord project, MigrationRecord audit,
                                    Path exportFile) {
        return new RecreationResult(RecreationState.REBUILT, report, project, audit, exportFile, null);
    }

    static RecreationResult failed(CompatibilityReport report, MigrationRecord audit, Path exportFile, String error) {
        return new RecreationResult(RecreationState.FAILED, report, null, audit, exportFile, error);
    }

    public RecreationState getState() { return state; }

    /**
     * @return The compatibility verdict before recreation
     */
    public CompatibilityReport getReport() { return report; }

    /**
     * @return The rebuilt record, only in {@link RecreationState#REBUILT}
     */
    public ProjectRecord getProject() { return project; }

    /**
     * @return The sealed audit record, when one was opened
     */
    public MigrationRecord getAudit() { return audit; }
    public Path getExportFile() { return exportFile; }
    public String getError() { return error; }

    public boolean isSuccess() {
        return state == RecreationState.REBUILT;
    }

    @Override
    public String toString() {
        return "RecreationResult{state=" + state
                + (project != null ? ", project=" + project.getName() : "")
                + (error != null ? ", error='" + error + '\'' : "")
                + '}';
    }
}
