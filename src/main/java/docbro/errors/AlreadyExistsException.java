package docbro.errors;

/**
 * Exception for unique-name violations
 */
public class AlreadyExistsException extends ProjectRegistryException {

    public AlreadyExistsException(String message) {
        super(ErrorCategory.ALREADY_EXISTS, message);
    }

    public AlreadyExistsException(String message, Throwable cause) {
        super(ErrorCategory.ALREADY_EXISTS, message, cause);
    }
}
