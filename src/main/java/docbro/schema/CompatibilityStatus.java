package docbro.schema;

import docbro.errors.ValidationException;

/**
 * Read/write permission state of a project record, derived from its stamped
 * schema generation.
 */
public enum CompatibilityStatus {
    COMPATIBLE("compatible"),
    INCOMPATIBLE("incompatible"),
    MIGRATING("migrating");

    private final String value;

    CompatibilityStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Compatible only on an exact match. Older and newer generations are both
     * incompatible; a newer stamp is never accepted optimistically.
     */
    public static CompatibilityStatus fromSchemaVersion(int stamped, int current) {
        return stamped == current ? COMPATIBLE : INCOMPATIBLE;
    }

    public static CompatibilityStatus fromSchemaVersion(int stamped) {
        return fromSchemaVersion(stamped, SchemaVersionRegistry.currentVersion());
    }

    public boolean allowsModification() {
        return this == COMPATIBLE;
    }

    public boolean needsRecreation() {
        return this == INCOMPATIBLE;
    }

    public static CompatibilityStatus fromValue(String value) {
        for (CompatibilityStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new ValidationException("Unknown compatibility status: '" + value + "'");
    }

    @Override
    public String toString() {
        return value;
    }
}
