package docbro.db.migration.registry;

import docbro.db.migration.SchemaMigration;
import docbro.db.migration.SqlSteps;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Migration V1: projects table in the unified, version-stamped layout.
 * A legacy file that already has a projects table keeps it; V4 rebuilds it.
 */
public class V1_ProjectsTable implements SchemaMigration {

    @Override
    public int getVersion() {
        return 1;
    }

    @Override
    public String getDescription() {
        return "Create unified projects table";
    }

    @Override
    public void migrate(Connection connection) throws SQLException {
        SqlSteps.execute(connection, createTableSql("projects"));
    }

    /**
     * DDL of the unified projects layout under the given table name.
     */
    static String createTableSql(String tableName) {
        return "CREATE TABLE IF NOT EXISTS " + tableName + " ("
                + "id TEXT PRIMARY KEY,"
                + "name TEXT NOT NULL UNIQUE,"
                + "schema_version INTEGER NOT NULL,"
                + "type TEXT,"
                + "status TEXT NOT NULL,"
                + "compatibility_status TEXT,"
                + "created_at TEXT NOT NULL,"
                + "updated_at TEXT NOT NULL,"
                + "last_operation_at TEXT,"
                + "source_url TEXT,"
                + "settings_json TEXT NOT NULL DEFAULT '{}',"
                + "statistics_json TEXT NOT NULL DEFAULT '{}',"
                + "metadata_json TEXT NOT NULL DEFAULT '{}'"
                + ")";
    }
}
