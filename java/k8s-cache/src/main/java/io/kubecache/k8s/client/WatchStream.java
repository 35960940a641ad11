package io.kubecache.k8s.client;

import java.io.Closeable;

import io.kubecache.k8s.model.WatchEvent;

/**
 * A long-lived subscription to the changes of one kind.
 * <p>
 * Iteration blocks until the next event arrives and ends when the server closes the stream or after {@link #close()}.
 * An ended stream is the normal way of a watch to finish, callers re-subscribe.
 */
public interface WatchStream extends Iterable<WatchEvent>, Closeable {
    @Override
    void close();
}
