package io.kubecache.errors;

/**
 * The resource to be created already exists.
 */
public class ConflictException extends RuntimeException {
    public ConflictException(final String message) {
        super(message);
    }

    public ConflictException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
