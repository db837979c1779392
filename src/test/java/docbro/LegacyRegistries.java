package docbro;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Writes registry files the way earlier releases left them on disk.
 */
public final class LegacyRegistries {

    private LegacyRegistries() {
    }

    /**
     * Flat crawler layout, no version marker.
     */
    public static void writeCrawlerRegistry(Path file, String... inserts) throws SQLException {
        write(file, "CREATE TABLE projects ("
                + "id TEXT PRIMARY KEY,"
                + "name TEXT UNIQUE NOT NULL,"
                + "source_url TEXT,"
                + "status TEXT,"
                + "crawl_depth INTEGER,"
                + "embedding_model TEXT,"
                + "chunk_size INTEGER,"
                + "chunk_overlap INTEGER,"
                + "created_at TEXT,"
                + "updated_at TEXT,"
                + "last_crawl_at TEXT,"
                + "total_pages INTEGER,"
                + "total_size_bytes INTEGER,"
                + "successful_pages INTEGER,"
                + "failed_pages INTEGER,"
                + "metadata TEXT)", inserts);
    }

    /**
     * Typed-settings layout, no version marker.
     */
    public static void writeTypedRegistry(Path file, String... inserts) throws SQLException {
        write(file, "CREATE TABLE projects ("
                + "id TEXT PRIMARY KEY,"
                + "name TEXT UNIQUE NOT NULL,"
                + "type TEXT,"
                + "status TEXT,"
                + "settings TEXT,"
                + "metadata TEXT,"
                + "created_at TEXT,"
                + "updated_at TEXT)", inserts);
    }

    private static void write(Path file, String ddl, String... inserts) throws SQLException {
        file.getParent().toFile().mkdirs();
        try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + file.toAbsolutePath());
             Statement stmt = conn.createStatement()) {
            stmt.execute(ddl);
            for (String insert : inserts) {
                stmt.execute(insert);
            }
        }
    }
}
