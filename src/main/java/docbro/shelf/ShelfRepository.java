package docbro.shelf;

import docbro.db.SqliteDatabase;
import docbro.db.Timestamps;
import docbro.db.TransactionManager;
import docbro.errors.AlreadyExistsException;
import docbro.errors.NotFoundException;
import docbro.errors.ValidationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Shelves and the boxes placed on them, stored in the registry file.
 * Seeded defaults are marked non-deletable and cannot be removed.
 */
public class ShelfRepository {

    private static final Logger LOG = LoggerFactory.getLogger(ShelfRepository.class);

    private static final String SHELF_COLUMNS = "id, name, is_default, is_deletable, created_at, updated_at";
    private static final String BOX_COLUMNS = "b.id, b.name, b.type, b.is_deletable, b.url, b.created_at, b.updated_at";

    private final TransactionManager transactionManager;
    private final Clock clock;

    public ShelfRepository(SqliteDatabase registry, Clock clock) {
        this.transactionManager = registry.getTransactionManager();
        this.clock = clock;
    }

    // ==================== Shelves ====================

    public List<Shelf> listShelves() {
        return transactionManager.execute(conn -> {
            List<Shelf> shelves = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT " + SHELF_COLUMNS + " FROM shelves ORDER BY is_default DESC, name ASC");
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    shelves.add(mapShelf(rs));
                }
            }
            return shelves;
        });
    }

    public Optional<Shelf> findShelfByName(String name) {
        return transactionManager.execute(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT " + SHELF_COLUMNS + " FROM shelves WHERE name = ?")) {
                stmt.setString(1, name);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(mapShelf(rs)) : Optional.<Shelf>empty();
                }
            }
        });
    }

    /**
     * @throws NotFoundException if no shelf is marked default
     */
    public Shelf getDefaultShelf() {
        return transactionManager.execute(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT " + SHELF_COLUMNS + " FROM shelves WHERE is_default = 1 ORDER BY created_at LIMIT 1");
                 ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw new NotFoundException("No default shelf exists");
                }
                return mapShelf(rs);
            }
        });
    }

    public Shelf createShelf(String name) {
        String cleanName = requireName(name, "Shelf");
        String now = Timestamps.format(Timestamps.now(clock));
        String id = UUID.randomUUID().toString();
        try {
            transactionManager.executeInTransaction(conn -> {
                try (PreparedStatement stmt = conn.prepareStatement(
                        "INSERT INTO shelves (" + SHELF_COLUMNS + ") VALUES (?, ?, 0, 1, ?, ?)")) {
                    stmt.setString(1, id);
                    stmt.setString(2, cleanName);
                    stmt.setString(3, now);
                    stmt.setString(4, now);
                    return stmt.executeUpdate();
                }
            });
        } catch (AlreadyExistsException e) {
            throw new AlreadyExistsException("Shelf '" + cleanName + "' already exists", e.getCause());
        }
        LOG.info("Created shelf '{}'", cleanName);
        return findShelfByName(cleanName).orElseThrow(() -> new NotFoundException("Shelf '" + cleanName + "' not found"));
    }

    /**
     * @throws ValidationException if the shelf is marked non-deletable
     */
    public boolean deleteShelf(String id) {
        return delete("shelves", "Shelf", id);
    }

    // ==================== Boxes ====================

    /**
     * Boxes on a shelf, ordered by position.
     */
    public List<Box> listBoxes(String shelfId) {
        String sql = "SELECT " + BOX_COLUMNS + ", sb.position FROM boxes b "
                + "JOIN shelf_boxes sb ON sb.box_id = b.id WHERE sb.shelf_id = ? ORDER BY sb.position ASC, b.name ASC";
        return transactionManager.execute(conn -> {
            List<Box> boxes = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, shelfId);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        boxes.add(mapBox(rs, true));
                    }
                }
            }
            return boxes;
        });
    }

    public Optional<Box> findBoxByName(String name) {
        return transactionManager.execute(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT " + BOX_COLUMNS + " FROM boxes b WHERE b.name = ?")) {
                stmt.setString(1, name);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(mapBox(rs, false)) : Optional.<Box>empty();
                }
            }
        });
    }

    /**
     * Create a box and append it to a shelf.
     *
     * @throws NotFoundException if the shelf does not exist
     * @throws AlreadyExistsException if a box has the name
     */
    public Box createBox(String name, BoxType type, String shelfId) {
        String cleanName = requireName(name, "Box");
        String now = Timestamps.format(Timestamps.now(clock));
        String id = UUID.randomUUID().toString();
        try {
            transactionManager.executeInTransaction(conn -> {
                if (!exists(conn, "shelves", shelfId)) {
                    throw new NotFoundException("Shelf '" + shelfId + "' not found");
                }
                try (PreparedStatement stmt = conn.prepareStatement(
                        "INSERT INTO boxes (id, name, type, is_deletable, created_at, updated_at) VALUES (?, ?, ?, 1, ?, ?)")) {
                    stmt.setString(1, id);
                    stmt.setString(2, cleanName);
                    stmt.setString(3, type.getValue());
                    stmt.setString(4, now);
                    stmt.setString(5, now);
                    stmt.executeUpdate();
                }
                try (PreparedStatement stmt = conn.prepareStatement(
                        "INSERT INTO shelf_boxes (shelf_id, box_id, position, added_at) "
                                + "VALUES (?, ?, (SELECT COALESCE(MAX(position), 0) + 1 FROM shelf_boxes WHERE shelf_id = ?), ?)")) {
                    stmt.setString(1, shelfId);
                    stmt.setString(2, id);
                    stmt.setString(3, shelfId);
                    stmt.setString(4, now);
                    return stmt.executeUpdate();
                }
            });
        } catch (AlreadyExistsException e) {
            throw new AlreadyExistsException("Box '" + cleanName + "' already exists", e.getCause());
        }
        LOG.info("Created {} box '{}'", type, cleanName);
        return findBoxByName(cleanName).orElseThrow(() -> new NotFoundException("Box '" + cleanName + "' not found"));
    }

    /**
     * @throws ValidationException if the box is marked non-deletable
     */
    public boolean deleteBox(String id) {
        return delete("boxes", "Box", id);
    }

    // ==================== Helpers ====================

    private boolean delete(String table, String label, String id) {
        int deleted = transactionManager.executeInTransaction(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("SELECT name, is_deletable FROM " + table + " WHERE id = ?")) {
                stmt.setString(1, id);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (!rs.next()) {
                        return 0;
                    }
                    if (!rs.getBoolean("is_deletable")) {
                        throw new ValidationException(label + " '" + rs.getString("name") + "' cannot be deleted");
                    }
                }
            }
            try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM " + table + " WHERE id = ?")) {
                stmt.setString(1, id);
                return stmt.executeUpdate();
            }
        });
        if (deleted > 0) {
            LOG.info("Deleted {} {}", label.toLowerCase(), id);
        }
        return deleted > 0;
    }

    private static boolean exists(Connection conn, String table, String id) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("SELECT 1 FROM " + table + " WHERE id = ?")) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    private static String requireName(String name, String label) {
        if (name == null || name.isBlank()) {
            throw new ValidationException(label + " name cannot be empty");
        }
        return name.trim();
    }

    private static Shelf mapShelf(ResultSet rs) throws SQLException {
        return new Shelf(
                rs.getString("id"),
                rs.getString("name"),
                rs.getBoolean("is_default"),
                rs.getBoolean("is_deletable"),
                Timestamps.parse(rs.getString("created_at")),
                Timestamps.parse(rs.getString("updated_at")));
    }

    private static Box mapBox(ResultSet rs, boolean withPosition) throws SQLException {
        Integer position = null;
        if (withPosition) {
            int value = rs.getInt("position");
            position = rs.wasNull() ? null : value;
        }
        return new Box(
                rs.getString("id"),
                rs.getString("name"),
                BoxType.fromValue(rs.getString("type")),
                rs.getBoolean("is_deletable"),
                rs.getString("url"),
                position,
                Timestamps.parse(rs.getString("created_at")),
                Timestamps.parse(rs.getString("updated_at")));
    }
}
