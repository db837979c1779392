package docbro.errors;

/**
 * Base exception for all registry errors with structured error information.
 * Front ends switch on {@link #getCategory()} rather than on message text.
 */
public class ProjectRegistryException extends RuntimeException {
    private final ErrorCategory category;

    public enum ErrorCategory {
        NOT_FOUND("Not Found", "Check the project name or id"),
        ALREADY_EXISTS("Already Exists", "Choose a different project name"),
        INCOMPATIBLE("Incompatible Project", "Recreate the project under the current schema"),
        VALIDATION("Validation Error", "Fix the offending field and retry"),
        MIGRATION("Migration Error", "Restore from the backup file and report the failure"),
        STORAGE("Storage Error", "Check the data directory and file permissions");

        private final String displayName;
        private final String description;

        ErrorCategory(String displayName, String description) {
            this.displayName = displayName;
            this.description = description;
        }

        public String getDisplayName() { return displayName; }
        public String getDescription() { return description; }
    }

    public ProjectRegistryException(ErrorCategory category, String message) {
        this(category, message, null);
    }

    public ProjectRegistryException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() { return category; }

    /**
     * Get technical details for debugging
     */
    public String getTechnicalDetails() {
        StringBuilder details = new StringBuilder();
        details.append("Category: ").append(category.getDisplayName()).append("\n");
        if (getMessage() != null) {
            details.append("Message: ").append(getMessage()).append("\n");
        }
        details.append("Hint: ").append(category.getDescription()).append("\n");
        if (getCause() != null) {
            details.append("Cause: ").append(getCause().getClass().getSimpleName())
                    .append(": ").append(getCause().getMessage()).append("\n");
        }
        return details.toString();
    }
}
