package docbro.compat;

import docbro.project.ProjectRecord;
import docbro.project.ProjectRows;
import docbro.schema.SchemaVersionDescriptor;
import docbro.schema.SchemaVersionRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a project record, or a raw stored row, is usable under the
 * current schema generation.
 *
 * Every phase runs even after an earlier one failed, so a report lists all
 * problems at once. Checks never throw: an unexpected failure becomes an
 * issue and an incompatible verdict.
 */
public class CompatibilityChecker {

    private static final Logger LOG = LoggerFactory.getLogger(CompatibilityChecker.class);

    private final Clock clock;

    public CompatibilityChecker() {
        this(Clock.systemUTC());
    }

    public CompatibilityChecker(Clock clock) {
        this.clock = clock;
    }

    public int currentVersion() {
        return SchemaVersionRegistry.currentVersion();
    }

    /**
     * Check a materialized record.
     */
    public CompatibilityReport checkProject(ProjectRecord record) {
        CompatibilityReport.Builder report = CompatibilityReport.builder(currentVersion());
        try {
            report.project(record.getId(), record.getName()).projectVersion(record.getSchemaVersion());
            checkSchemaVersion(report);
            checkFields(report, record.presentFields());
            checkDataIntegrity(report, record);
            checkTypeSpecificSettings(report, record);
            return finish(report);
        } catch (RuntimeException e) {
            return failed(report, e);
        }
    }

    /**
     * Check a raw row as read from the projects table, of any generation.
     * Rows without a version stamp are classified by the first matching
     * legacy shape, generation 1 when none matches.
     *
     * @param row Raw row keyed by lowercase column name
     */
    public CompatibilityReport checkDatabaseRow(Map<String, Object> row) {
        CompatibilityReport.Builder report = CompatibilityReport.builder(currentVersion());
        try {
            report.project(text(row.get("id")), text(row.get("name")));

            Map<String, Object> unified;
            if (row.get("schema_version") != null) {
                report.projectVersion(((Number) row.get("schema_version")).intValue());
                unified = row;
            } else {
                Optional<LegacyShape> shape = LegacyShapes.detect(row.keySet());
                report.projectVersion(shape.map(LegacyShape::generation).orElse(SchemaVersionRegistry.CRAWLER_VERSION));
                if (shape.isPresent()) {
                    report.issues(shape.get().inspect(row, report.missingFields()));
                    unified = shape.get().toUnifiedRow(row, clock.instant());
                } else {
                    report.issue("Version " + report.projectVersion() + " project format not recognized");
                    unified = null;
                }
            }

            checkSchemaVersion(report);
            checkFields(report, ProjectRows.presentFields(row));

            if (unified != null) {
                materializeAndCheck(report, unified);
            }
            return finish(report);
        } catch (RuntimeException e) {
            return failed(report, e);
        }
    }

    private void materializeAndCheck(CompatibilityReport.Builder report, Map<String, Object> unified) {
        ProjectRecord record;
        try {
            record = ProjectRows.toRecord(unified);
        } catch (RuntimeException e) {
            report.issue("Stored project cannot be loaded: " + e.getMessage());
            return;
        }
        checkDataIntegrity(report, record);
        checkTypeSpecificSettings(report, record);
    }

    // ==================== Phases ====================

    private void checkSchemaVersion(CompatibilityReport.Builder report) {
        int projectVersion = report.projectVersion();
        int current = report.currentVersion();
        if (projectVersion < current) {
            report.migrationRequired(true);
            report.issue("Project uses older schema version " + projectVersion + ", current is " + current);
        } else if (projectVersion > current) {
            report.issue("Project uses future schema version " + projectVersion + ", current is " + current);
        }
    }

    private void checkFields(CompatibilityReport.Builder report, Set<String> presentFields) {
        SchemaVersionDescriptor current = SchemaVersionRegistry.current();
        for (String field : sorted(current.getRequiredFields())) {
            if (!presentFields.contains(field) && !report.missingFields().contains(field)) {
                report.missingField(field);
                report.issue("Missing required field: " + field);
            }
        }
        for (String field : presentFields) {
            if (!current.isKnownField(field)) {
                report.extraField(field);
            }
        }
    }

    private void checkDataIntegrity(CompatibilityReport.Builder report, ProjectRecord record) {
        Instant createdAt = record.getCreatedAt();
        if (createdAt != null && record.getUpdatedAt() != null && record.getUpdatedAt().isBefore(createdAt)) {
            report.issue("Updated timestamp is before created timestamp");
        }
        if (createdAt != null && record.getLastOperationAt() != null && record.getLastOperationAt().isBefore(createdAt)) {
            report.issue("Last operation timestamp is before created timestamp");
        }
        if (!ProjectRecord.statisticsProblems(record.getStatistics()).isEmpty()) {
            report.issue("Sum of successful and failed pages exceeds total pages");
        }
    }

    private void checkTypeSpecificSettings(CompatibilityReport.Builder report, ProjectRecord record) {
        if (record.getType() == null) {
            report.issue("Project type is not specified");
            return;
        }
        for (String problem : record.getSettings().validate()) {
            report.issue("Invalid settings: " + problem);
        }
    }

    private CompatibilityReport finish(CompatibilityReport.Builder report) {
        boolean versionMatches = report.projectVersion() == report.currentVersion();
        report.compatible(versionMatches && !report.hasIssues());
        report.canBeMigrated(report.projectVersion() < report.currentVersion()
                && SchemaVersionRegistry.canAutoMigrate(report.projectVersion()));
        return report.build();
    }

    private CompatibilityReport failed(CompatibilityReport.Builder report, RuntimeException e) {
        LOG.warn("Compatibility check failed: {}", e.getMessage());
        report.issue("Compatibility check failed: " + e.getMessage());
        report.compatible(false);
        report.canBeMigrated(false);
        return report.build();
    }

    // ==================== Batch operations ====================

    /**
     * Check many records, keyed by project id in input order.
     */
    public Map<String, CompatibilityReport> checkAll(Collection<ProjectRecord> records) {
        Map<String, CompatibilityReport> reports = new LinkedHashMap<>();
        for (ProjectRecord record : records) {
            reports.put(record.getId(), checkProject(record));
        }
        return reports;
    }

    /**
     * Check many raw rows, keyed by the row's id column in input order.
     */
    public Map<String, CompatibilityReport> checkAllRows(Collection<Map<String, Object>> rows) {
        Map<String, CompatibilityReport> reports = new LinkedHashMap<>();
        int index = 0;
        for (Map<String, Object> row : rows) {
            Object id = row.get("id");
            reports.put(id != null ? id.toString() : "row-" + index, checkDatabaseRow(row));
            index++;
        }
        return reports;
    }

    public CompatibilitySummary summarize(Collection<CompatibilityReport> reports) {
        int compatible = 0;
        int needsRecreation = 0;
        int canMigrate = 0;
        Map<Integer, Integer> distribution = new LinkedHashMap<>();
        for (CompatibilityReport report : reports) {
            if (report.isCompatible()) {
                compatible++;
            }
            if (report.needsRecreation()) {
                needsRecreation++;
            }
            if (report.canBeMigrated()) {
                canMigrate++;
            }
            distribution.merge(report.getProjectVersion(), 1, Integer::sum);
        }
        return new CompatibilitySummary(reports.size(), compatible, reports.size() - compatible,
                needsRecreation, canMigrate, distribution);
    }

    /**
     * Step-by-step upgrade instructions for an incompatible project.
     */
    public List<String> recreationInstructions(CompatibilityReport report, String projectName) {
        if (report.isCompatible()) {
            return List.of("Project is already compatible - no action needed.");
        }

        List<String> instructions = new ArrayList<>(List.of(
                "Project '" + projectName + "' is incompatible with current schema version " + report.getCurrentVersion() + ".",
                "",
                "To upgrade this project:",
                "",
                "1. Export current project settings (recommended):",
                "   docbro project --export " + projectName + " > " + projectName + "-backup.json",
                "",
                "2. Recreate the project with unified schema:",
                "   docbro project --recreate " + projectName + " --confirm",
                "",
                "3. Verify the recreation was successful:",
                "   docbro project --show " + projectName + " --detailed",
                "",
                "Note: settings and metadata are preserved, statistics are reset, and crawling",
                "projects must be re-crawled."));

        if (!report.getIssues().isEmpty()) {
            instructions.add("");
            instructions.add("Compatibility issues found:");
            for (String issue : report.getIssues()) {
                instructions.add("  - " + issue);
            }
        }
        return instructions;
    }

    private static List<String> sorted(Set<String> fields) {
        List<String> list = new ArrayList<>(new LinkedHashSet<>(fields));
        list.sort(null);
        return list;
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }
}
