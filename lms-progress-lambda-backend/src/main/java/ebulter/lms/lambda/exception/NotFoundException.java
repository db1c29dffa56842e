package ebulter.lms.lambda.exception;

/**
 * A course, path or template the request refers to does not exist in the catalog.
 */
public class NotFoundException extends RuntimeException {
    public NotFoundException(String message) {
        super(message);
    }
}
