package docbro.db.migration.registry;

import docbro.compat.LegacyShape;
import docbro.compat.LegacyShapes;
import docbro.db.migration.MigrationKind;
import docbro.db.migration.SchemaMigration;
import docbro.db.migration.SchemaVersionDetector;
import docbro.db.migration.SqlSteps;
import docbro.errors.MigrationException;
import docbro.errors.ProjectRegistryException;
import docbro.project.ProjectRows;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Migration V4: rebuild a legacy projects table into the unified layout.
 *
 * Rows are copied into projects_new one at a time, each converted by the
 * legacy shape its non-null columns match, then the tables are swapped.
 * Converted rows keep the generation they were written under, so they read
 * as incompatible until recreated. A table already in the unified layout is
 * left alone.
 */
public class V4_UnifiedProjects implements SchemaMigration {

    private static final Logger LOG = LoggerFactory.getLogger(V4_UnifiedProjects.class);

    static final String TEMP_TABLE = "projects_new";

    @Override
    public int getVersion() {
        return 4;
    }

    @Override
    public String getDescription() {
        return "Restructure projects into the unified version-stamped layout";
    }

    @Override
    public MigrationKind getKind() {
        return MigrationKind.STRUCTURAL;
    }

    @Override
    public boolean requiresBackup(Connection connection) throws SQLException {
        return isLegacyLayout(new SchemaVersionDetector(connection));
    }

    private boolean isLegacyLayout(SchemaVersionDetector detector) throws SQLException {
        return detector.tableExists("projects") && !detector.columnExists("projects", "schema_version");
    }

    @Override
    public void migrate(Connection connection) throws SQLException {
        SchemaVersionDetector detector = new SchemaVersionDetector(connection);
        if (!isLegacyLayout(detector)) {
            LOG.debug("projects table already in unified layout");
            return;
        }

        Set<String> tableColumns = detector.getTableColumns("projects");
        LegacyShape tableShape = LegacyShapes.detect(tableColumns).orElseThrow(() ->
                new MigrationException(getVersion(), "Unrecognized layout of projects table: " + tableColumns));
        LOG.info("Rebuilding {} projects table ({} columns)", tableShape.name(), tableColumns.size());

        SqlSteps.execute(connection,
                "DROP TABLE IF EXISTS " + TEMP_TABLE,
                V1_ProjectsTable.createTableSql(TEMP_TABLE));

        long before = detector.countRows("projects");
        Instant now = Instant.now();
        int converted = 0;
        String insert = "INSERT INTO " + TEMP_TABLE + " (" + String.join(", ", ProjectRows.COLUMNS) + ") VALUES ("
                + ProjectRows.COLUMNS.stream().map(c -> "?").collect(Collectors.joining(", ")) + ")";
        try (PreparedStatement stmt = connection.prepareStatement(insert)) {
            for (Map<String, Object> row : readAll(connection)) {
                LegacyShape shape = rowShape(row, tableShape);
                Map<String, Object> unified = convert(shape, row, now);
                for (int i = 0; i < ProjectRows.COLUMNS.size(); i++) {
                    stmt.setObject(i + 1, unified.get(ProjectRows.COLUMNS.get(i)));
                }
                stmt.executeUpdate();
                converted++;
            }
        }

        long after = detector.countRows(TEMP_TABLE);
        if (after != before) {
            throw new MigrationException(getVersion(),
                    "Row count mismatch after rebuild: " + before + " legacy rows, " + after + " unified rows");
        }

        try (Statement stmt = connection.createStatement()) {
            stmt.execute("DROP TABLE projects");
            stmt.execute("ALTER TABLE " + TEMP_TABLE + " RENAME TO projects");
        }
        LOG.info("Converted {} legacy project row(s) to the unified layout", converted);
    }

    /**
     * A row matches the shape of its non-null columns when one is found,
     * otherwise the shape of the table.
     */
    private LegacyShape rowShape(Map<String, Object> row, LegacyShape tableShape) {
        Set<String> present = new LinkedHashSet<>();
        for (Map.Entry<String, Object> entry : row.entrySet()) {
            if (entry.getValue() != null) {
                present.add(entry.getKey());
            }
        }
        return LegacyShapes.detect(present).orElse(tableShape);
    }

    private Map<String, Object> convert(LegacyShape shape, Map<String, Object> row, Instant now) {
        try {
            return shape.toUnifiedRow(row, now);
        } catch (ProjectRegistryException e) {
            throw new MigrationException(getVersion(),
                    "Cannot convert project row '" + row.get("name") + "': " + e.getMessage(), null, e);
        }
    }

    private List<Map<String, Object>> readAll(Connection connection) throws SQLException {
        List<Map<String, Object>> rows = new ArrayList<>();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT * FROM projects")) {
            while (rs.next()) {
                rows.add(ProjectRows.readRow(rs));
            }
        }
        return rows;
    }

    @Override
    public void verify(Connection connection) throws SQLException {
        SchemaVersionDetector detector = new SchemaVersionDetector(connection);
        if (!detector.columnExists("projects", "schema_version")) {
            throw new MigrationException(getVersion(), "projects table is not in the unified layout after rebuild");
        }
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM shelves WHERE is_default = 1")) {
            if (!rs.next() || rs.getLong(1) < 1) {
                throw new MigrationException(getVersion(), "No default shelf exists after restructuring");
            }
        }
    }
}
