package docbro.db;

import docbro.errors.ValidationException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Storage format for timestamps.
 * Written as fixed-width UTC ISO-8601 with millisecond precision so that the
 * lexical order of stored strings equals their time order.
 */
public final class Timestamps {

    private static final DateTimeFormatter STORAGE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private Timestamps() {
    }

    public static String format(Instant instant) {
        return instant == null ? null : STORAGE_FORMAT.format(instant);
    }

    /**
     * Parse a stored timestamp. Accepts the storage format, any offset-bearing
     * ISO-8601 value, and legacy zone-less values which are read as UTC.
     *
     * @return The instant, or null for null/blank input
     * @throws ValidationException if the text is not a timestamp
     */
    public static Instant parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String value = text.trim().replace(' ', 'T');
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException offsetMissing) {
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                throw new ValidationException("Unparseable timestamp: '" + text + "'");
            }
        }
    }

    /**
     * Current time truncated to the stored precision.
     */
    public static Instant now(java.time.Clock clock) {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
