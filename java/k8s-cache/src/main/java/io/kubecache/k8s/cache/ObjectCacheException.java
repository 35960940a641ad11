package io.kubecache.k8s.cache;

/**
 * The cache storage failed.
 */
public class ObjectCacheException extends RuntimeException {
    public ObjectCacheException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
