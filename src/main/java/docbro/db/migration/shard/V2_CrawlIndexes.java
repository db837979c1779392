package docbro.db.migration.shard;

import docbro.db.migration.SchemaMigration;
import docbro.db.migration.SqlSteps;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Shard migration V2: lookup indexes for sessions and pages.
 */
public class V2_CrawlIndexes implements SchemaMigration {

    @Override
    public int getVersion() {
        return 2;
    }

    @Override
    public String getDescription() {
        return "Add crawl session and page indexes";
    }

    @Override
    public void migrate(Connection connection) throws SQLException {
        SqlSteps.execute(connection,
                "CREATE INDEX IF NOT EXISTS idx_sessions_status ON crawl_sessions (status)",
                "CREATE INDEX IF NOT EXISTS idx_sessions_archived ON crawl_sessions (archived)",
                "CREATE INDEX IF NOT EXISTS idx_pages_session_id ON pages (session_id)",
                "CREATE INDEX IF NOT EXISTS idx_pages_status ON pages (status)",
                "CREATE UNIQUE INDEX IF NOT EXISTS idx_pages_session_url ON pages (session_id, url)");
    }
}
