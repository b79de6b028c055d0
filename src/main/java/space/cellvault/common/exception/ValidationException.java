package space.cellvault.common.exception;

/**
 * Exception thrown when a request is not valid for the current state.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
