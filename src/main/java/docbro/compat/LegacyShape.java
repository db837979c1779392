package docbro.compat;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Detector and converter for one pre-unified layout of the projects table.
 */
public interface LegacyShape {

    /**
     * @return The schema generation rows of this shape were written under
     */
    int generation();

    String name();

    /**
     * Decide from column names alone whether a row or table has this shape.
     * Must be a pure function of its argument.
     *
     * @param columns Lowercase column names
     */
    boolean matches(Set<String> columns);

    /**
     * Shape-specific problems of one raw row, including absent fields the
     * generation required.
     *
     * @param row Raw row keyed by lowercase column name
     * @param missingFields Receives the names of absent required fields
     * @return Human-readable issues, in detection order
     */
    List<String> inspect(Map<String, Object> row, Set<String> missingFields);

    /**
     * Convert one raw row into the unified column layout, keeping the row's
     * generation as its schema version.
     *
     * @param row Raw row keyed by lowercase column name
     * @param now Fallback for absent timestamps
     * @return Unified row keyed by column name
     * @throws docbro.errors.ValidationException if a payload cannot be decoded
     */
    Map<String, Object> toUnifiedRow(Map<String, Object> row, Instant now);
}
