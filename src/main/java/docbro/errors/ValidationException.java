package docbro.errors;

import java.util.List;

/**
 * Exception for field-level contract violations
 */
public class ValidationException extends ProjectRegistryException {
    private final List<String> problems;

    public ValidationException(String message) {
        super(ErrorCategory.VALIDATION, message);
        this.problems = List.of(message);
    }

    public ValidationException(List<String> problems) {
        super(ErrorCategory.VALIDATION, String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() { return problems; }
}
