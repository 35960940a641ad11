package io.kubecache.errors;

/**
 * The requested resource (object, cluster, resource class, ...) does not exist.
 */
public class MissingResourceException extends RuntimeException {
    public MissingResourceException(final String message) {
        super(message);
    }

    public MissingResourceException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
