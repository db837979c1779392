package docbro.project;

import docbro.db.SqliteDatabase;
import docbro.db.TransactionManager;
import docbro.errors.AlreadyExistsException;
import docbro.errors.ProjectRegistryException;
import docbro.errors.RepositoryException;
import docbro.schema.CompatibilityStatus;
import docbro.schema.SchemaVersionRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Persistence of project records in the registry file.
 * Settings, statistics and metadata are stored as JSON documents next to
 * the schema version stamp; {@link #save(ProjectRecord)} is an upsert by id.
 */
public class ProjectRepository {

    private static final Logger LOG = LoggerFactory.getLogger(ProjectRepository.class);

    private static final String COLUMN_LIST = String.join(", ", ProjectRows.COLUMNS);
    private static final String SELECT = "SELECT " + COLUMN_LIST + " FROM projects";

    private static final String UPSERT = "INSERT INTO projects (" + COLUMN_LIST + ") VALUES ("
            + ProjectRows.COLUMNS.stream().map(c -> "?").collect(Collectors.joining(", ")) + ") "
            + "ON CONFLICT(id) DO UPDATE SET "
            + ProjectRows.COLUMNS.stream().filter(c -> !c.equals("id"))
                    .map(c -> c + " = excluded." + c).collect(Collectors.joining(", "));

    private final TransactionManager transactionManager;
    private final Set<String> migratingIds = ConcurrentHashMap.newKeySet();

    public ProjectRepository(SqliteDatabase registry) {
        this.transactionManager = registry.getTransactionManager();
    }

    /**
     * Insert or replace a record by id.
     *
     * @return The saved record
     * @throws AlreadyExistsException if another record already has the name
     */
    public ProjectRecord save(ProjectRecord record) {
        try {
            transactionManager.executeInTransaction(conn -> {
                try (PreparedStatement stmt = conn.prepareStatement(UPSERT)) {
                    ProjectRows.bind(stmt, record);
                    return stmt.executeUpdate();
                }
            });
        } catch (AlreadyExistsException e) {
            throw new AlreadyExistsException("Project '" + record.getName() + "' already exists", e.getCause());
        }
        LOG.debug("Saved project {} ({}) at schema v{}", record.getName(), record.getId(), record.getSchemaVersion());
        return withMigratingFlag(record);
    }

    public Optional<ProjectRecord> findById(String id) {
        return findRawById(id).map(this::materialize);
    }

    public Optional<ProjectRecord> findByName(String name) {
        return findRawByName(name).map(this::materialize);
    }

    /**
     * Look up by id first, then by name.
     */
    public Optional<ProjectRecord> findByIdOrName(String idOrName) {
        Optional<ProjectRecord> byId = findById(idOrName);
        return byId.isPresent() ? byId : findByName(idOrName);
    }

    public Optional<Map<String, Object>> findRawById(String id) {
        return findOneRaw(SELECT + " WHERE id = ?", id);
    }

    public Optional<Map<String, Object>> findRawByName(String name) {
        return findOneRaw(SELECT + " WHERE name = ?", name);
    }

    public Optional<Map<String, Object>> findRawByIdOrName(String idOrName) {
        Optional<Map<String, Object>> byId = findRawById(idOrName);
        return byId.isPresent() ? byId : findRawByName(idOrName);
    }

    private Optional<Map<String, Object>> findOneRaw(String sql, String key) {
        if (key == null) {
            return Optional.empty();
        }
        return transactionManager.execute(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, key);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(ProjectRows.readRow(rs)) : Optional.<Map<String, Object>>empty();
                }
            }
        });
    }

    /**
     * List records matching a query. Rows that cannot be materialized are
     * skipped with a warning; they remain visible through the raw finders.
     */
    public List<ProjectRecord> findAll(ProjectQuery query) {
        List<ProjectRecord> records = new ArrayList<>();
        for (Map<String, Object> row : findAllRaw(query)) {
            try {
                records.add(materialize(row));
            } catch (RepositoryException e) {
                LOG.warn("Skipping project row {}: {}", row.get("id"), e.getMessage());
            }
        }
        return records;
    }

    public List<Map<String, Object>> findAllRaw(ProjectQuery query) {
        StringBuilder sql = new StringBuilder(SELECT).append(" WHERE 1=1");
        List<Object> params = new ArrayList<>();
        if (query.getStatus() != null) {
            sql.append(" AND status = ?");
            params.add(query.getStatus().getValue());
        }
        if (query.getType() != null) {
            sql.append(" AND type = ?");
            params.add(query.getType().getValue());
        }
        if (query.getCompatibilityStatus() != null) {
            appendCompatibilityFilter(sql, params, query.getCompatibilityStatus());
        }
        sql.append(" ORDER BY ").append(query.getSortField().column())
                .append(query.isDescending() ? " DESC" : " ASC")
                .append(", id ASC");
        if (query.getLimit() != null) {
            sql.append(" LIMIT ? OFFSET ?");
            params.add(query.getLimit());
            params.add(query.getOffset());
        } else if (query.getOffset() > 0) {
            sql.append(" LIMIT -1 OFFSET ?");
            params.add(query.getOffset());
        }

        return transactionManager.execute(conn -> {
            List<Map<String, Object>> rows = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
                for (int i = 0; i < params.size(); i++) {
                    stmt.setObject(i + 1, params.get(i));
                }
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        rows.add(ProjectRows.readRow(rs));
                    }
                }
            }
            return rows;
        });
    }

    public boolean deleteById(String id) {
        return delete("DELETE FROM projects WHERE id = ?", id);
    }

    public boolean deleteByName(String name) {
        return delete("DELETE FROM projects WHERE name = ?", name);
    }

    private boolean delete(String sql, String key) {
        int deleted = transactionManager.executeInTransaction(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, key);
                return stmt.executeUpdate();
            }
        });
        return deleted > 0;
    }

    public long count() {
        return count(null);
    }

    /**
     * @param compatibilityStatus Filter, or null for every record
     */
    public long count(CompatibilityStatus compatibilityStatus) {
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM projects WHERE 1=1");
        List<Object> params = new ArrayList<>();
        if (compatibilityStatus != null) {
            appendCompatibilityFilter(sql, params, compatibilityStatus);
        }
        return transactionManager.execute(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
                for (int i = 0; i < params.size(); i++) {
                    stmt.setObject(i + 1, params.get(i));
                }
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? rs.getLong(1) : 0L;
                }
            }
        });
    }

    /**
     * Filter on the status a loaded record would report: the schema version
     * decides compatible or incompatible, the in-process flag decides migrating.
     */
    private void appendCompatibilityFilter(StringBuilder sql, List<Object> params, CompatibilityStatus status) {
        List<String> flagged = new ArrayList<>(migratingIds);
        String idList = flagged.stream().map(id -> "?").collect(Collectors.joining(", "));
        if (status == CompatibilityStatus.MIGRATING) {
            if (flagged.isEmpty()) {
                sql.append(" AND 0 = 1");
                return;
            }
            sql.append(" AND id IN (").append(idList).append(")");
            params.addAll(flagged);
            return;
        }
        sql.append(status == CompatibilityStatus.COMPATIBLE ? " AND schema_version = ?" : " AND schema_version <> ?");
        params.add(SchemaVersionRegistry.currentVersion());
        if (!flagged.isEmpty()) {
            sql.append(" AND id NOT IN (").append(idList).append(")");
            params.addAll(flagged);
        }
    }

    public boolean existsByName(String name) {
        return transactionManager.execute(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("SELECT 1 FROM projects WHERE name = ?")) {
                stmt.setString(1, name);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next();
                }
            }
        });
    }

    // ==================== Migrating flag ====================

    /**
     * Flag a project as being recreated. The flag lives in this process only,
     * so after a crash the stored record simply reads as incompatible.
     *
     * @return false if the project was already flagged
     */
    public boolean markMigrating(String id) {
        return migratingIds.add(id);
    }

    public void clearMigrating(String id) {
        migratingIds.remove(id);
    }

    public boolean isMigrating(String id) {
        return migratingIds.contains(id);
    }

    private ProjectRecord materialize(Map<String, Object> row) {
        try {
            return withMigratingFlag(ProjectRows.toRecord(row));
        } catch (ProjectRegistryException e) {
            throw new RepositoryException("Stored project '" + row.get("name")
                    + "' cannot be loaded; run a compatibility check for details: " + e.getMessage(), e);
        }
    }

    private ProjectRecord withMigratingFlag(ProjectRecord record) {
        boolean flagged = migratingIds.contains(record.getId());
        return record.isMigrating() == flagged ? record : record.toBuilder().migrating(flagged).build();
    }
}
