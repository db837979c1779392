package docbro.project;

import docbro.errors.ValidationException;

/**
 * Operational lifecycle state of a project, independent of compatibility.
 */
public enum ProjectStatus {
    CREATED("created"),
    CRAWLING("crawling"),
    PROCESSING("processing"),
    INDEXING("indexing"),
    READY("ready"),
    FAILED("failed"),
    ARCHIVED("archived"),
    ACTIVE("active"),
    INACTIVE("inactive"),
    ERROR("error");

    private final String value;

    ProjectStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Parse an external status string.
     *
     * @throws ValidationException for unknown values
     */
    public static ProjectStatus fromValue(String value) {
        if (value != null) {
            for (ProjectStatus status : values()) {
                if (status.value.equalsIgnoreCase(value.trim())) {
                    return status;
                }
            }
        }
        throw new ValidationException("Unknown project status: '" + value + "'");
    }

    @Override
    public String toString() {
        return value;
    }
}
