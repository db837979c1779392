package docbro.db.migration;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Reads and writes the version marker of a database file and answers the
 * table/column checks used by migrations and legacy-shape detection.
 */
public class SchemaVersionDetector {

    /** No marker: a fresh file or one written before versioning existed */
    public static final int VERSION_PRE_HISTORY = 0;

    private final Connection connection;

    public SchemaVersionDetector(Connection connection) {
        this.connection = connection;
    }

    /**
     * Detect the current schema version from PRAGMA user_version.
     *
     * @return Detected version number, 0 when no marker exists
     * @throws SQLException on database error
     */
    public int detectVersion() throws SQLException {
        return Math.max(getUserVersion(), VERSION_PRE_HISTORY);
    }

    /**
     * Get the PRAGMA user_version value.
     *
     * @return user_version, or 0 if not set
     * @throws SQLException on database error
     */
    public int getUserVersion() throws SQLException {
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("PRAGMA user_version")) {
            if (rs.next()) {
                return rs.getInt(1);
            }
        }
        return 0;
    }

    /**
     * Set the PRAGMA user_version value.
     *
     * @param version Version number to set
     * @throws SQLException on database error
     */
    public void setUserVersion(int version) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("PRAGMA user_version = " + version);
        }
    }

    /**
     * Check if a table exists in the database.
     *
     * @param tableName Name of the table
     * @return true if table exists
     * @throws SQLException on database error
     */
    public boolean tableExists(String tableName) throws SQLException {
        return schemaObjectExists("table", tableName);
    }

    public boolean indexExists(String indexName) throws SQLException {
        return schemaObjectExists("index", indexName);
    }

    private boolean schemaObjectExists(String type, String name) throws SQLException {
        String sql = "SELECT name FROM sqlite_master WHERE type=? AND name=?";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, type);
            stmt.setString(2, name);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    /**
     * Get the column names of a table in declaration order.
     *
     * @param tableName Name of the table
     * @return Set of column names (lowercase), empty if the table is missing
     * @throws SQLException on database error
     */
    public Set<String> getTableColumns(String tableName) throws SQLException {
        Set<String> columns = new LinkedHashSet<>();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("PRAGMA table_info(" + tableName + ")")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase());
            }
        }
        return columns;
    }

    /**
     * Check if a column exists in a table.
     *
     * @param tableName Name of the table
     * @param columnName Name of the column
     * @return true if column exists
     * @throws SQLException on database error
     */
    public boolean columnExists(String tableName, String columnName) throws SQLException {
        return getTableColumns(tableName).contains(columnName.toLowerCase());
    }

    public long countRows(String tableName) throws SQLException {
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + tableName)) {
            return rs.next() ? rs.getLong(1) : 0;
        }
    }
}
