package docbro.export;

import docbro.errors.ValidationException;

public enum ExportType {
    FULL("full"),
    SETTINGS_ONLY("settings-only");

    private final String value;

    ExportType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ExportType fromValue(String value) {
        for (ExportType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new ValidationException("Unknown export type: '" + value + "'");
    }

    @Override
    public String toString() {
        return value;
    }
}
