package docbro.db.migration.registry;

import docbro.db.Timestamps;
import docbro.db.migration.MigrationKind;
import docbro.db.migration.SchemaMigration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.UUID;

/**
 * Migration V3: default shelf and box so a fresh installation is usable.
 * Defaults are looked up by name first and never inserted twice.
 */
public class V3_DefaultShelf implements SchemaMigration {

    private static final Logger LOG = LoggerFactory.getLogger(V3_DefaultShelf.class);

    public static final String DEFAULT_SHELF_NAME = "common shelf";
    public static final String DEFAULT_BOX_NAME = "new year";
    public static final String DEFAULT_BOX_TYPE = "bag";

    @Override
    public int getVersion() {
        return 3;
    }

    @Override
    public String getDescription() {
        return "Seed default shelf and box";
    }

    @Override
    public MigrationKind getKind() {
        return MigrationKind.SEEDING;
    }

    @Override
    public void migrate(Connection connection) throws SQLException {
        String now = Timestamps.format(Instant.now());

        String shelfId = findIdByName(connection, "shelves", DEFAULT_SHELF_NAME);
        if (shelfId == null) {
            shelfId = UUID.randomUUID().toString();
            String sql = "INSERT INTO shelves (id, name, is_default, is_deletable, created_at, updated_at) "
                    + "VALUES (?, ?, 1, 0, ?, ?)";
            try (PreparedStatement stmt = connection.prepareStatement(sql)) {
                stmt.setString(1, shelfId);
                stmt.setString(2, DEFAULT_SHELF_NAME);
                stmt.setString(3, now);
                stmt.setString(4, now);
                stmt.executeUpdate();
            }
            LOG.info("Created default shelf '{}'", DEFAULT_SHELF_NAME);
        }

        String boxId = findIdByName(connection, "boxes", DEFAULT_BOX_NAME);
        if (boxId == null) {
            boxId = UUID.randomUUID().toString();
            String sql = "INSERT INTO boxes (id, name, type, is_deletable, created_at, updated_at) "
                    + "VALUES (?, ?, ?, 0, ?, ?)";
            try (PreparedStatement stmt = connection.prepareStatement(sql)) {
                stmt.setString(1, boxId);
                stmt.setString(2, DEFAULT_BOX_NAME);
                stmt.setString(3, DEFAULT_BOX_TYPE);
                stmt.setString(4, now);
                stmt.setString(5, now);
                stmt.executeUpdate();
            }
            LOG.info("Created default box '{}'", DEFAULT_BOX_NAME);
        }

        String link = "INSERT OR IGNORE INTO shelf_boxes (shelf_id, box_id, position, added_at) VALUES (?, ?, 1, ?)";
        try (PreparedStatement stmt = connection.prepareStatement(link)) {
            stmt.setString(1, shelfId);
            stmt.setString(2, boxId);
            stmt.setString(3, now);
            stmt.executeUpdate();
        }
    }

    private String findIdByName(Connection connection, String table, String name) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement("SELECT id FROM " + table + " WHERE name = ?")) {
            stmt.setString(1, name);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }
}
