package docbro.audit;

import docbro.db.SqliteDatabase;
import docbro.db.Timestamps;
import docbro.db.TransactionManager;
import docbro.errors.NotFoundException;
import docbro.errors.RepositoryException;
import docbro.json.JsonCodec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Durable audit trail of recreation, upgrade and validation attempts,
 * kept in the registry's project_migrations table.
 */
public class MigrationTracker {

    private static final Logger LOG = LoggerFactory.getLogger(MigrationTracker.class);

    private static final String COLUMNS = "id, project_id, project_name, operation, from_schema_version, "
            + "to_schema_version, started_at, completed_at, success, error_message, preserved_settings_json, "
            + "preserved_metadata_json, data_size_bytes, user_initiated, initiated_by_command";

    private static final int PATTERN_LIMIT = 10;

    private final TransactionManager transactionManager;
    private final Clock clock;

    public MigrationTracker(SqliteDatabase registry, Clock clock) {
        this.transactionManager = registry.getTransactionManager();
        this.clock = clock;
    }

    // ==================== Opening records ====================

    /**
     * Open and persist a recreation record.
     *
     * @param initiatingCommand Command that started the attempt, null for the default
     */
    public MigrationRecord createRecreationRecord(String projectId, String projectName, int fromVersion, int toVersion,
                                                  Map<String, ?> preservedSettings, Map<String, ?> preservedMetadata,
                                                  String initiatingCommand) {
        return open(MigrationRecord.builder()
                .operation(MigrationOperation.RECREATION)
                .projectId(projectId)
                .projectName(projectName)
                .fromSchemaVersion(fromVersion)
                .toSchemaVersion(toVersion)
                .preservedSettings(preservedSettings)
                .preservedMetadata(preservedMetadata)
                .initiatedByCommand(initiatingCommand != null ? initiatingCommand : MigrationRecord.DEFAULT_RECREATE_COMMAND));
    }

    /**
     * Open and persist a validation record; source and target version are equal.
     */
    public MigrationRecord createValidationRecord(String projectId, String projectName, int schemaVersion,
                                                  String initiatingCommand) {
        return open(MigrationRecord.builder()
                .operation(MigrationOperation.VALIDATION)
                .projectId(projectId)
                .projectName(projectName)
                .fromSchemaVersion(schemaVersion)
                .toSchemaVersion(schemaVersion)
                .initiatedByCommand(initiatingCommand != null ? initiatingCommand : MigrationRecord.DEFAULT_VALIDATE_COMMAND));
    }

    /**
     * Open and persist an upgrade record. No in-place upgrade path exists yet;
     * reserved for incremental upgrades.
     */
    public MigrationRecord createUpgradeRecord(String projectId, String projectName, int fromVersion, int toVersion,
                                               String initiatingCommand) {
        return open(MigrationRecord.builder()
                .operation(MigrationOperation.UPGRADE)
                .projectId(projectId)
                .projectName(projectName)
                .fromSchemaVersion(fromVersion)
                .toSchemaVersion(toVersion)
                .userInitiated(initiatingCommand != null)
                .initiatedByCommand(initiatingCommand != null ? initiatingCommand : "automatic"));
    }

    private MigrationRecord open(MigrationRecord.Builder builder) {
        MigrationRecord record = builder
                .id(UUID.randomUUID().toString())
                .startedAt(Timestamps.now(clock))
                .build();
        transactionManager.executeInTransaction(conn -> insert(conn, record));
        LOG.debug("Opened {} record {} for project {}", record.getOperation(), record.getId(), record.getProjectName());
        return record;
    }

    private int insert(Connection conn, MigrationRecord record) throws SQLException {
        String sql = "INSERT INTO project_migrations (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, record.getId());
            stmt.setString(2, record.getProjectId());
            stmt.setString(3, record.getProjectName());
            stmt.setString(4, record.getOperation().getValue());
            stmt.setInt(5, record.getFromSchemaVersion());
            stmt.setInt(6, record.getToSchemaVersion());
            stmt.setString(7, Timestamps.format(record.getStartedAt()));
            stmt.setString(8, Timestamps.format(record.getCompletedAt()));
            stmt.setBoolean(9, record.isSuccess());
            stmt.setString(10, record.getErrorMessage());
            stmt.setString(11, JsonCodec.toJson(record.getPreservedSettings()));
            stmt.setString(12, JsonCodec.toJson(record.getPreservedMetadata()));
            stmt.setLong(13, record.getDataSizeBytes());
            stmt.setBoolean(14, record.isUserInitiated());
            stmt.setString(15, record.getInitiatedByCommand());
            return stmt.executeUpdate();
        }
    }

    // ==================== Sealing ====================

    /**
     * Seal a record exactly once. Sealing an already sealed record changes
     * nothing and returns the stored, first-sealed state.
     *
     * @param dataSizeBytes Size of the preserved payload, null to keep the recorded value
     * @return The sealed record as stored
     */
    public MigrationRecord complete(MigrationRecord record, boolean success, String errorMessage, Long dataSizeBytes) {
        Instant completedAt = Timestamps.now(clock);
        int updated = transactionManager.executeInTransaction(conn -> {
            String sql = "UPDATE project_migrations SET completed_at = ?, success = ?, error_message = ?, "
                    + "data_size_bytes = COALESCE(?, data_size_bytes) WHERE id = ? AND completed_at IS NULL";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, Timestamps.format(completedAt));
                stmt.setBoolean(2, success);
                stmt.setString(3, errorMessage);
                if (dataSizeBytes == null) {
                    stmt.setNull(4, java.sql.Types.INTEGER);
                } else {
                    stmt.setLong(4, dataSizeBytes);
                }
                stmt.setString(5, record.getId());
                return stmt.executeUpdate();
            }
        });

        MigrationRecord stored = findById(record.getId())
                .orElseThrow(() -> new NotFoundException("Migration record '" + record.getId() + "' not found"));
        if (updated == 0) {
            LOG.warn("Migration record {} was already sealed at {}; ignoring repeated completion",
                    record.getId(), stored.getCompletedAt());
        } else if (success) {
            LOG.info("{} of project {} succeeded (v{} -> v{})", record.getOperation(), record.getProjectName(),
                    record.getFromSchemaVersion(), record.getToSchemaVersion());
        } else {
            LOG.warn("{} of project {} failed: {}", record.getOperation(), record.getProjectName(), errorMessage);
        }
        return stored;
    }

    public MigrationRecord complete(MigrationRecord record, boolean success) {
        return complete(record, success, null, null);
    }

    // ==================== Queries ====================

    public Optional<MigrationRecord> findById(String id) {
        List<MigrationRecord> found = query("SELECT " + COLUMNS + " FROM project_migrations WHERE id = ?", List.of(id));
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    /**
     * @param limit Maximum records, null for all
     * @param operation Filter, null for every operation
     */
    public List<MigrationRecord> findByProject(String projectId, Integer limit, MigrationOperation operation) {
        return findAll(MigrationQuery.builder().projectId(projectId).limit(limit).operation(operation).build());
    }

    public List<MigrationRecord> findAll(MigrationQuery filter) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM project_migrations WHERE 1=1");
        List<Object> params = new ArrayList<>();
        if (filter.getProjectId() != null) {
            sql.append(" AND project_id = ?");
            params.add(filter.getProjectId());
        }
        if (filter.getOperation() != null) {
            sql.append(" AND operation = ?");
            params.add(filter.getOperation().getValue());
        }
        if (filter.getSuccess() != null) {
            sql.append(" AND completed_at IS NOT NULL AND success = ?");
            params.add(filter.getSuccess());
        }
        if (filter.getSince() != null) {
            sql.append(" AND started_at >= ?");
            params.add(Timestamps.format(filter.getSince()));
        }
        sql.append(" ORDER BY started_at DESC, id ASC");
        if (filter.getLimit() != null) {
            sql.append(" LIMIT ?");
            params.add(filter.getLimit());
        }
        return query(sql.toString(), params);
    }

    /**
     * Records never sealed: attempts interrupted mid-flight. Reported, never
     * resolved automatically.
     */
    public List<MigrationRecord> findUnsealed() {
        return query("SELECT " + COLUMNS + " FROM project_migrations WHERE completed_at IS NULL ORDER BY started_at ASC",
                List.of());
    }

    public List<MigrationRecord> failedSince(int days) {
        return findAll(MigrationQuery.builder().success(false).since(cutoff(days)).build());
    }

    public MigrationStatistics statistics(int days) {
        List<MigrationRecord> records = findAll(MigrationQuery.builder().since(cutoff(days)).build());
        int successful = 0;
        int failed = 0;
        int inProgress = 0;
        Map<MigrationOperation, Integer> byOperation = new LinkedHashMap<>();
        long durationTotal = 0;
        int durationCount = 0;
        Set<String> projects = new HashSet<>();
        for (MigrationRecord record : records) {
            if (record.isInProgress()) {
                inProgress++;
            } else if (record.isSuccess()) {
                successful++;
            } else {
                failed++;
            }
            byOperation.merge(record.getOperation(), 1, Integer::sum);
            if (record.getDurationMillis() != null) {
                durationTotal += record.getDurationMillis();
                durationCount++;
            }
            projects.add(record.getProjectId());
        }
        return new MigrationStatistics(days, records.size(), successful, failed, inProgress,
                byOperation.getOrDefault(MigrationOperation.RECREATION, 0),
                byOperation.getOrDefault(MigrationOperation.UPGRADE, 0),
                byOperation.getOrDefault(MigrationOperation.VALIDATION, 0),
                durationCount == 0 ? 0 : durationTotal / durationCount,
                projects.size());
    }

    /**
     * Per-day totals and recreation transitions over the last days.
     */
    public MigrationTrends trends(int days) {
        List<MigrationRecord> records = findAll(MigrationQuery.builder().since(cutoff(days)).build());
        Map<LocalDate, int[]> perDay = new TreeMap<>();
        for (MigrationRecord record : records) {
            int[] counts = perDay.computeIfAbsent(LocalDate.ofInstant(record.getStartedAt(), ZoneOffset.UTC),
                    date -> new int[3]);
            counts[0]++;
            if (record.isCompleted() && record.isSuccess()) {
                counts[1]++;
            }
            if (record.getOperation() == MigrationOperation.RECREATION) {
                counts[2]++;
            }
        }
        List<MigrationTrends.DailyCount> daily = new ArrayList<>();
        perDay.forEach((date, counts) -> daily.add(new MigrationTrends.DailyCount(date, counts[0], counts[1], counts[2])));
        return new MigrationTrends(days, daily, transitions(records, false));
    }

    /**
     * Frequent failures, repeatedly recreated projects and recreation
     * durations across the whole trail.
     */
    public MigrationPatterns patterns() {
        List<MigrationRecord> records = findAll(MigrationQuery.all());

        Map<Map.Entry<String, MigrationOperation>, Integer> errorCounts = new LinkedHashMap<>();
        Map<String, List<MigrationRecord>> recreationsByName = new LinkedHashMap<>();
        for (MigrationRecord record : records) {
            if (record.isCompleted() && !record.isSuccess() && record.getErrorMessage() != null) {
                errorCounts.merge(Map.entry(record.getErrorMessage(), record.getOperation()), 1, Integer::sum);
            }
            if (record.getOperation() == MigrationOperation.RECREATION) {
                recreationsByName.computeIfAbsent(record.getProjectName(), name -> new ArrayList<>()).add(record);
            }
        }

        List<MigrationPatterns.ErrorPattern> errors = new ArrayList<>();
        errorCounts.forEach((key, count) ->
                errors.add(new MigrationPatterns.ErrorPattern(key.getKey(), key.getValue(), count)));
        errors.sort(Comparator.comparingInt(MigrationPatterns.ErrorPattern::getFrequency).reversed()
                .thenComparing(MigrationPatterns.ErrorPattern::getErrorMessage));

        // Records arrive newest first, so the head of each list is the latest recreation
        List<MigrationPatterns.FrequentRecreation> frequent = new ArrayList<>();
        recreationsByName.forEach((name, attempts) -> {
            if (attempts.size() > 1) {
                frequent.add(new MigrationPatterns.FrequentRecreation(name, attempts.size(),
                        attempts.get(0).getStartedAt()));
            }
        });
        frequent.sort(Comparator.comparingInt(MigrationPatterns.FrequentRecreation::getRecreationCount).reversed()
                .thenComparing(MigrationPatterns.FrequentRecreation::getProjectName));

        return new MigrationPatterns(head(errors), head(frequent), transitions(records, true));
    }

    /**
     * Recreations grouped by source and target version, most frequent first.
     *
     * @param successfulOnly Count only recreations sealed as successful
     */
    private List<VersionTransition> transitions(List<MigrationRecord> records, boolean successfulOnly) {
        Map<List<Integer>, List<MigrationRecord>> grouped = new LinkedHashMap<>();
        for (MigrationRecord record : records) {
            if (record.getOperation() != MigrationOperation.RECREATION) {
                continue;
            }
            if (successfulOnly && !(record.isCompleted() && record.isSuccess())) {
                continue;
            }
            grouped.computeIfAbsent(List.of(record.getFromSchemaVersion(), record.getToSchemaVersion()),
                    key -> new ArrayList<>()).add(record);
        }
        List<VersionTransition> transitions = new ArrayList<>();
        grouped.forEach((versions, attempts) -> {
            long total = 0;
            int timed = 0;
            for (MigrationRecord attempt : attempts) {
                if (attempt.getDurationMillis() != null) {
                    total += attempt.getDurationMillis();
                    timed++;
                }
            }
            transitions.add(new VersionTransition(versions.get(0), versions.get(1), attempts.size(),
                    timed == 0 ? 0 : total / timed));
        });
        transitions.sort(Comparator.comparingInt(VersionTransition::getCount).reversed()
                .thenComparingInt(VersionTransition::getFromVersion)
                .thenComparingInt(VersionTransition::getToVersion));
        return transitions;
    }

    private static <T> List<T> head(List<T> items) {
        return items.size() > PATTERN_LIMIT ? items.subList(0, PATTERN_LIMIT) : items;
    }

    /**
     * Delete sealed records started more than the given number of days ago.
     * Unsealed records are kept regardless of age.
     *
     * @return Number of records deleted
     */
    public int cleanupOlderThan(int days) {
        String cutoff = Timestamps.format(cutoff(days));
        int deleted = transactionManager.executeInTransaction(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "DELETE FROM project_migrations WHERE started_at < ? AND completed_at IS NOT NULL")) {
                stmt.setString(1, cutoff);
                return stmt.executeUpdate();
            }
        });
        if (deleted > 0) {
            LOG.info("Cleaned up {} migration record(s) older than {} days", deleted, days);
        }
        return deleted;
    }

    /**
     * Write the history, optionally of one project, as a JSON document.
     *
     * @return Number of records exported
     */
    public int exportHistory(Path outputPath, String projectId) {
        List<MigrationRecord> records = findAll(MigrationQuery.builder().projectId(projectId).build());
        List<Map<String, Object>> migrations = new ArrayList<>();
        for (MigrationRecord record : records) {
            migrations.add(record.toSummary());
        }
        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put("project_id", projectId);

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("export_timestamp", Timestamps.format(Timestamps.now(clock)));
        document.put("total_migrations", migrations.size());
        document.put("filters", filters);
        document.put("migrations", migrations);

        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
                JsonCodec.prettyGson().toJson(document, writer);
            }
        } catch (IOException e) {
            throw new RepositoryException("Failed to export migration history to " + outputPath, e);
        }
        LOG.info("Exported {} migration record(s) to {}", migrations.size(), outputPath);
        return migrations.size();
    }

    private Instant cutoff(int days) {
        return Timestamps.now(clock).minus(Duration.ofDays(days));
    }

    private List<MigrationRecord> query(String sql, List<Object> params) {
        return transactionManager.execute(conn -> {
            List<MigrationRecord> records = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                for (int i = 0; i < params.size(); i++) {
                    stmt.setObject(i + 1, params.get(i));
                }
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        records.add(mapRecord(rs));
                    }
                }
            }
            return records;
        });
    }

    private MigrationRecord mapRecord(ResultSet rs) throws SQLException {
        return MigrationRecord.builder()
                .id(rs.getString("id"))
                .projectId(rs.getString("project_id"))
                .projectName(rs.getString("project_name"))
                .operation(MigrationOperation.fromValue(rs.getString("operation")))
                .fromSchemaVersion(rs.getInt("from_schema_version"))
                .toSchemaVersion(rs.getInt("to_schema_version"))
                .startedAt(Timestamps.parse(rs.getString("started_at")))
                .completedAt(Timestamps.parse(rs.getString("completed_at")))
                .success(rs.getBoolean("success"))
                .errorMessage(rs.getString("error_message"))
                .preservedSettings(JsonCodec.toMap(rs.getString("preserved_settings_json")))
                .preservedMetadata(JsonCodec.toMap(rs.getString("preserved_metadata_json")))
                .dataSizeBytes(rs.getLong("data_size_bytes"))
                .userInitiated(rs.getBoolean("user_initiated"))
                .initiatedByCommand(rs.getString("initiated_by_command"))
                .build();
    }
}
