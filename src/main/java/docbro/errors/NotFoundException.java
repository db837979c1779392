package docbro.errors;

/**
 * Exception for lookups by id or name that matched nothing
 */
public class NotFoundException extends ProjectRegistryException {

    public NotFoundException(String message) {
        super(ErrorCategory.NOT_FOUND, message);
    }

    public static NotFoundException project(String idOrName) {
        return new NotFoundException("Project '" + idOrName + "' not found");
    }
}
