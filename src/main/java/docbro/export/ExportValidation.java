package docbro.export;

import java.util.List;

/**
 * Result of checking an export before it is used to rebuild a project.
 */
public final class ExportValidation {

    private final List<String> issues;
    private final List<String> warnings;
    private final List<String> recommendations;
    private final long exportAgeDays;
    private final boolean schemaVersionChange;

    ExportValidation(List<String> issues, List<String> warnings, List<String> recommendations,
                     long exportAgeDays, boolean schemaVersionChange) {
        this.issues = List.copyOf(issues);
        this.warnings = List.copyOf(warnings);
        this.recommendations = List.copyOf(recommendations);
        this.exportAgeDays = exportAgeDays;
        this.schemaVersionChange = schemaVersionChange;
    }

    public boolean isValid() {
        return issues.isEmpty();
    }

    public List<String> getIssues() { return issues; }
    public List<String> getWarnings() { return warnings; }
    public List<String> getRecommendations() { return recommendations; }
    public long getExportAgeDays() { return exportAgeDays; }
    public boolean isSchemaVersionChange() { return schemaVersionChange; }

    @Override
    public String toString() {
        return "ExportValidation{valid=" + isValid() + ", issues=" + issues + ", warnings=" + warnings + '}';
    }
}
