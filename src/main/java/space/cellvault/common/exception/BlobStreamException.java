package space.cellvault.common.exception;

import java.io.IOException;

/**
 * Exception thrown when the client-facing source or sink of a stream fails,
 * e.g. because the peer disconnected mid-transfer.
 */
public class BlobStreamException extends RuntimeException {

    public BlobStreamException(String message, IOException cause) {
        super(message, cause);
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }
}
