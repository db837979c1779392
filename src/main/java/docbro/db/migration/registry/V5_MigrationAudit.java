package docbro.db.migration.registry;

import docbro.db.migration.SchemaMigration;
import docbro.db.migration.SqlSteps;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Migration V5: audit table for recreation, upgrade and validation attempts.
 */
public class V5_MigrationAudit implements SchemaMigration {

    @Override
    public int getVersion() {
        return 5;
    }

    @Override
    public String getDescription() {
        return "Create project_migrations audit table";
    }

    @Override
    public void migrate(Connection connection) throws SQLException {
        SqlSteps.execute(connection,
                "CREATE TABLE IF NOT EXISTS project_migrations ("
                        + "id TEXT PRIMARY KEY,"
                        + "project_id TEXT NOT NULL,"
                        + "project_name TEXT NOT NULL,"
                        + "operation TEXT NOT NULL,"
                        + "from_schema_version INTEGER NOT NULL,"
                        + "to_schema_version INTEGER NOT NULL,"
                        + "started_at TEXT NOT NULL,"
                        + "completed_at TEXT,"
                        + "success BOOLEAN DEFAULT FALSE,"
                        + "error_message TEXT,"
                        + "preserved_settings_json TEXT DEFAULT '{}',"
                        + "preserved_metadata_json TEXT DEFAULT '{}',"
                        + "data_size_bytes INTEGER DEFAULT 0,"
                        + "user_initiated BOOLEAN DEFAULT TRUE,"
                        + "initiated_by_command TEXT DEFAULT 'unknown'"
                        + ")",
                "CREATE INDEX IF NOT EXISTS idx_migrations_project_id ON project_migrations(project_id)",
                "CREATE INDEX IF NOT EXISTS idx_migrations_operation ON project_migrations(operation)",
                "CREATE INDEX IF NOT EXISTS idx_migrations_started_at ON project_migrations(started_at)",
                "CREATE INDEX IF NOT EXISTS idx_migrations_success ON project_migrations(success)");
    }
}
