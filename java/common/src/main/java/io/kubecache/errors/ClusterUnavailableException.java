package io.kubecache.errors;

/**
 * The API endpoint of a cluster could not be reached.
 */
public class ClusterUnavailableException extends RuntimeException {
    public ClusterUnavailableException(final String message) {
        super(message);
    }

    public ClusterUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
