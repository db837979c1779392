package docbro.db.migration.shard;

import docbro.db.migration.SchemaMigration;
import docbro.db.migration.SqlSteps;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Shard migration V1: crawl sessions and pages of one project.
 */
public class V1_CrawlTables implements SchemaMigration {

    @Override
    public int getVersion() {
        return 1;
    }

    @Override
    public String getDescription() {
        return "Create crawl_sessions and pages tables";
    }

    @Override
    public void migrate(Connection connection) throws SQLException {
        SqlSteps.execute(connection,
                "CREATE TABLE IF NOT EXISTS crawl_sessions ("
                        + "id TEXT PRIMARY KEY,"
                        + "project_id TEXT NOT NULL,"
                        + "status TEXT NOT NULL DEFAULT 'created',"
                        + "crawl_depth INTEGER NOT NULL,"
                        + "user_agent TEXT NOT NULL DEFAULT 'DocBro/1.0',"
                        + "rate_limit REAL NOT NULL DEFAULT 1.0,"
                        + "timeout INTEGER NOT NULL DEFAULT 30,"
                        + "created_at TEXT NOT NULL,"
                        + "started_at TEXT,"
                        + "completed_at TEXT,"
                        + "updated_at TEXT NOT NULL,"
                        + "pages_discovered INTEGER NOT NULL DEFAULT 0,"
                        + "pages_crawled INTEGER NOT NULL DEFAULT 0,"
                        + "pages_failed INTEGER NOT NULL DEFAULT 0,"
                        + "pages_skipped INTEGER NOT NULL DEFAULT 0,"
                        + "total_size_bytes INTEGER NOT NULL DEFAULT 0,"
                        + "error_message TEXT,"
                        + "error_count INTEGER NOT NULL DEFAULT 0,"
                        + "max_errors INTEGER NOT NULL DEFAULT 50,"
                        + "metadata TEXT,"
                        + "archived INTEGER NOT NULL DEFAULT 0"
                        + ")",
                "CREATE TABLE IF NOT EXISTS pages ("
                        + "id TEXT PRIMARY KEY,"
                        + "project_id TEXT NOT NULL,"
                        + "session_id TEXT NOT NULL,"
                        + "url TEXT NOT NULL,"
                        + "status TEXT NOT NULL DEFAULT 'discovered',"
                        + "title TEXT,"
                        + "content_text TEXT,"
                        + "content_hash TEXT,"
                        + "mime_type TEXT NOT NULL DEFAULT 'text/html',"
                        + "size_bytes INTEGER NOT NULL DEFAULT 0,"
                        + "crawl_depth INTEGER NOT NULL,"
                        + "parent_url TEXT,"
                        + "response_code INTEGER,"
                        + "discovered_at TEXT NOT NULL,"
                        + "crawled_at TEXT,"
                        + "error_message TEXT,"
                        + "retry_count INTEGER NOT NULL DEFAULT 0,"
                        + "metadata TEXT,"
                        + "FOREIGN KEY (session_id) REFERENCES crawl_sessions (id) ON DELETE CASCADE"
                        + ")");
    }
}
