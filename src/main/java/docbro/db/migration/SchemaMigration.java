package docbro.db.migration;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Interface for database schema migrations.
 * Each migration represents a specific schema version transition and runs in
 * its own transaction.
 */
public interface SchemaMigration {

    /**
     * Get the schema version this migration produces.
     * @return Version number (must be unique and sequential)
     */
    int getVersion();

    /**
     * Get a human-readable description of this migration.
     * @return Description of what this migration does
     */
    String getDescription();

    /**
     * @return Additive, seeding or structural
     */
    default MigrationKind getKind() {
        return MigrationKind.ADDITIVE;
    }

    /**
     * Whether the file must be copied aside before this migration mutates it.
     * Only consulted for structural migrations.
     *
     * @param connection The database connection
     * @return true if a backup is needed for the current file contents
     * @throws SQLException on database error
     */
    default boolean requiresBackup(Connection connection) throws SQLException {
        return getKind() == MigrationKind.STRUCTURAL;
    }

    /**
     * Apply the migration to the database.
     * Implementations must be safe to re-apply: the version marker only moves
     * once the whole run succeeds, so a step may run again after a crash.
     *
     * @param connection The database connection
     * @throws SQLException if migration fails
     */
    void migrate(Connection connection) throws SQLException;

    /**
     * Check post-conditions inside the migration's transaction, before commit.
     *
     * @param connection The database connection
     * @throws SQLException on database error
     * @throws docbro.errors.MigrationException if a post-condition does not hold
     */
    default void verify(Connection connection) throws SQLException {
    }
}
