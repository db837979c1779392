package docbro.errors;

/**
 * Exception wrapping storage engine failures
 */
public class RepositoryException extends ProjectRegistryException {

    public RepositoryException(String message) {
        super(ErrorCategory.STORAGE, message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(ErrorCategory.STORAGE, message, cause);
    }
}
