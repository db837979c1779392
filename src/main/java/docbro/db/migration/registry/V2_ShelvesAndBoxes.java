package docbro.db.migration.registry;

import docbro.db.migration.SchemaMigration;
import docbro.db.migration.SqlSteps;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Migration V2: shelves, boxes and the shelf/box junction.
 */
public class V2_ShelvesAndBoxes implements SchemaMigration {

    @Override
    public int getVersion() {
        return 2;
    }

    @Override
    public String getDescription() {
        return "Create shelves, boxes and shelf_boxes tables";
    }

    @Override
    public void migrate(Connection connection) throws SQLException {
        SqlSteps.execute(connection,
                "CREATE TABLE IF NOT EXISTS shelves ("
                        + "id TEXT PRIMARY KEY,"
                        + "name TEXT UNIQUE NOT NULL,"
                        + "is_default BOOLEAN DEFAULT FALSE,"
                        + "is_deletable BOOLEAN DEFAULT TRUE,"
                        + "created_at TEXT NOT NULL,"
                        + "updated_at TEXT NOT NULL"
                        + ")",
                "CREATE TABLE IF NOT EXISTS boxes ("
                        + "id TEXT PRIMARY KEY,"
                        + "name TEXT UNIQUE NOT NULL,"
                        + "type TEXT NOT NULL CHECK (type IN ('drag', 'rag', 'bag')),"
                        + "is_deletable BOOLEAN DEFAULT TRUE,"
                        + "url TEXT,"
                        + "max_pages INTEGER,"
                        + "rate_limit REAL,"
                        + "crawl_depth INTEGER,"
                        + "settings TEXT,"
                        + "created_at TEXT NOT NULL,"
                        + "updated_at TEXT NOT NULL"
                        + ")",
                "CREATE TABLE IF NOT EXISTS shelf_boxes ("
                        + "shelf_id TEXT NOT NULL,"
                        + "box_id TEXT NOT NULL,"
                        + "position INTEGER,"
                        + "added_at TEXT NOT NULL,"
                        + "PRIMARY KEY (shelf_id, box_id),"
                        + "FOREIGN KEY (shelf_id) REFERENCES shelves(id) ON DELETE CASCADE,"
                        + "FOREIGN KEY (box_id) REFERENCES boxes(id) ON DELETE CASCADE"
                        + ")",
                "CREATE INDEX IF NOT EXISTS idx_shelves_name ON shelves(name)",
                "CREATE INDEX IF NOT EXISTS idx_shelves_is_default ON shelves(is_default)",
                "CREATE INDEX IF NOT EXISTS idx_boxes_name ON boxes(name)",
                "CREATE INDEX IF NOT EXISTS idx_boxes_type ON boxes(type)",
                "CREATE INDEX IF NOT EXISTS idx_shelf_boxes_shelf_id ON shelf_boxes(shelf_id)",
                "CREATE INDEX IF NOT EXISTS idx_shelf_boxes_box_id ON shelf_boxes(box_id)");
    }
}
