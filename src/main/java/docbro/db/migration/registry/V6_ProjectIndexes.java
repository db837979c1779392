package docbro.db.migration.registry;

import docbro.db.migration.SchemaMigration;
import docbro.db.migration.SqlSteps;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Migration V6: query indexes on the unified projects table.
 */
public class V6_ProjectIndexes implements SchemaMigration {

    private static final String[] INDEXED_COLUMNS = {
        "type", "status", "compatibility_status", "schema_version", "created_at", "updated_at"
    };

    @Override
    public int getVersion() {
        return 6;
    }

    @Override
    public String getDescription() {
        return "Add query indexes on projects";
    }

    @Override
    public void migrate(Connection connection) throws SQLException {
        for (String column : INDEXED_COLUMNS) {
            SqlSteps.executeIfAbsent(connection,
                    "CREATE INDEX idx_projects_" + column + " ON projects(" + column + ")");
        }
    }
}
