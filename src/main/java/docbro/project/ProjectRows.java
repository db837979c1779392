package docbro.project;

import docbro.db.Timestamps;
import docbro.errors.ValidationException;
import docbro.json.JsonCodec;
import docbro.schema.CompatibilityStatus;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mapping between rows of the unified {@code projects} table and
 * {@link ProjectRecord} values.
 */
public final class ProjectRows {

    /** Columns of the unified layout, in insert order */
    public static final List<String> COLUMNS = List.of(
            "id", "name", "schema_version", "type", "status", "compatibility_status",
            "created_at", "updated_at", "last_operation_at", "source_url",
            "settings_json", "statistics_json", "metadata_json");

    private static final String JSON_SUFFIX = "_json";

    private ProjectRows() {
    }

    /**
     * Read the current row of a result set into a column-name keyed map.
     */
    public static Map<String, Object> readRow(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            row.put(meta.getColumnName(i).toLowerCase(), rs.getObject(i));
        }
        return row;
    }

    /**
     * Field names present in a raw row, JSON payload columns named without
     * their suffix. Null-valued columns are absent.
     */
    public static Set<String> presentFields(Map<String, Object> row) {
        Set<String> fields = new LinkedHashSet<>();
        for (Map.Entry<String, Object> entry : row.entrySet()) {
            if (entry.getValue() != null) {
                fields.add(fieldName(entry.getKey()));
            }
        }
        return fields;
    }

    static String fieldName(String column) {
        return column.endsWith(JSON_SUFFIX) ? column.substring(0, column.length() - JSON_SUFFIX.length()) : column;
    }

    /**
     * Materialize a unified-layout row. The stored compatibility_status column
     * is not read; the record derives its status from schema_version.
     *
     * @throws ValidationException if a value cannot be decoded or the record is invalid
     */
    public static ProjectRecord toRecord(Map<String, Object> row) {
        ProjectType type = blank(row.get("type")) ? null : ProjectType.fromValue(text(row.get("type")));
        ProjectRecord.Builder builder = ProjectRecord.builder()
                .id(text(row.get("id")))
                .name(text(row.get("name")))
                .schemaVersion(intValue(row.get("schema_version"), "schema_version"))
                .type(type)
                .status(blank(row.get("status")) ? null : ProjectStatus.fromValue(text(row.get("status"))))
                .createdAt(Timestamps.parse(text(row.get("created_at"))))
                .updatedAt(Timestamps.parse(text(row.get("updated_at"))))
                .lastOperationAt(Timestamps.parse(text(row.get("last_operation_at"))))
                .sourceUrl(blank(row.get("source_url")) ? null : text(row.get("source_url")))
                .settings(JsonCodec.toMap(text(row.get("settings_json"))))
                .statistics(JsonCodec.toMap(text(row.get("statistics_json"))))
                .metadata(JsonCodec.toMap(text(row.get("metadata_json"))));
        return builder.build();
    }

    /**
     * Bind every unified column of a record, in {@link #COLUMNS} order.
     * The stored compatibility status is always derived from the schema version.
     */
    public static void bind(PreparedStatement stmt, ProjectRecord record) throws SQLException {
        int i = 1;
        stmt.setString(i++, record.getId());
        stmt.setString(i++, record.getName());
        stmt.setInt(i++, record.getSchemaVersion());
        stmt.setString(i++, record.getType() == null ? null : record.getType().getValue());
        stmt.setString(i++, record.getStatus() == null ? null : record.getStatus().getValue());
        stmt.setString(i++, CompatibilityStatus.fromSchemaVersion(record.getSchemaVersion()).getValue());
        stmt.setString(i++, Timestamps.format(record.getCreatedAt()));
        stmt.setString(i++, Timestamps.format(record.getUpdatedAt()));
        stmt.setString(i++, Timestamps.format(record.getLastOperationAt()));
        stmt.setString(i++, record.getSourceUrl());
        stmt.setString(i++, JsonCodec.toJson(record.getSettings().asMap()));
        stmt.setString(i++, JsonCodec.toJson(record.getStatistics()));
        stmt.setString(i, JsonCodec.toJson(record.getMetadata()));
    }

    private static boolean blank(Object value) {
        return value == null || value.toString().isBlank();
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }

    static int intValue(Object value, String column) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new ValidationException("Column " + column + " is not an integer: '" + value + "'");
            }
        }
        throw new ValidationException("Column " + column + " is missing");
    }
}
