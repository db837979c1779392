package docbro.db.migration;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Statement helpers shared by the additive migrations.
 */
public final class SqlSteps {

    private SqlSteps() {
    }

    public static void execute(Connection connection, String... statements) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
        }
    }

    /**
     * Run DDL that may already have been applied.
     * "already exists" errors are ignored, anything else propagates.
     */
    public static void executeIfAbsent(Connection connection, String ddl) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(ddl);
        } catch (SQLException e) {
            if (e.getMessage() == null || !e.getMessage().contains("already exists")) {
                throw e;
            }
        }
    }
}
