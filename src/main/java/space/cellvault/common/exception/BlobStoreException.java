package space.cellvault.common.exception;

/**
 * Exception thrown when a read or write against a backend chunk store fails.
 */
public class BlobStoreException extends RuntimeException {

    public BlobStoreException(String message) {
        super(message);
    }

    public BlobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
