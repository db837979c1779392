package docbro.project;

import docbro.errors.ValidationException;

import java.util.Set;

/**
 * Project type discriminator; selects the settings variant and the
 * operations a project supports.
 */
public enum ProjectType {
    CRAWLING("crawling", Set.of("crawl", "search", "vector_operations")),
    DATA("data", Set.of("upload", "search", "vector_operations", "document_processing")),
    STORAGE("storage", Set.of("upload", "download", "file_management", "tagging"));

    private final String value;
    private final Set<String> operations;

    ProjectType(String value, Set<String> operations) {
        this.value = value;
        this.operations = operations;
    }

    public String getValue() {
        return value;
    }

    public Set<String> getSupportedOperations() {
        return operations;
    }

    public boolean supports(String operation) {
        return operation != null && operations.contains(operation.toLowerCase());
    }

    /**
     * Parse an external type string.
     *
     * @throws ValidationException for unknown values
     */
    public static ProjectType fromValue(String value) {
        if (value != null) {
            for (ProjectType type : values()) {
                if (type.value.equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
        }
        throw new ValidationException("Unknown project type: '" + value + "' (expected crawling, data or storage)");
    }

    @Override
    public String toString() {
        return value;
    }
}
