package io.github.vishalmysore.chasm.exception;

/**
 * Raised when a semantic linking pass cannot produce a meaningful score,
 * e.g. embeddings of different lengths or a failing embedding provider.
 */
public class LinkerException extends ChasmException {

    public LinkerException(String message) {
        super(message);
    }

    public LinkerException(String message, Throwable cause) {
        super(message, cause);
    }
}
