package docbro.audit;

import docbro.errors.ValidationException;

/**
 * Kind of attempt recorded in the audit trail.
 */
public enum MigrationOperation {
    RECREATION("recreation"),
    UPGRADE("upgrade"),
    VALIDATION("validation");

    private final String value;

    MigrationOperation(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static MigrationOperation fromValue(String value) {
        for (MigrationOperation operation : values()) {
            if (operation.value.equalsIgnoreCase(value)) {
                return operation;
            }
        }
        throw new ValidationException("Unknown migration operation: '" + value + "'");
    }

    @Override
    public String toString() {
        return value;
    }
}
