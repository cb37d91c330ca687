package io.github.vishalmysore.chasm.exception;

/**
 * Root of all failures raised by the knowledge graph core.
 */
public class ChasmException extends RuntimeException {

    public ChasmException(String message) {
        super(message);
    }

    public ChasmException(String message, Throwable cause) {
        super(message, cause);
    }
}
