package io.kubecache.k8s.watch;

import javax.annotation.concurrent.GuardedBy;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

import io.kubecache.k8s.model.WatchEvent;

/**
 * Per cluster bookkeeping of full syncs. While a full sync runs, watch events of the cluster are queued
 * and applied once it completed.
 */
final class ClusterSyncState {
    static final class DeferredEvent {
        final TrackedKind kind;
        final WatchEvent event;

        DeferredEvent(final TrackedKind kind, final WatchEvent event) {
            this.kind = kind;
            this.event = event;
        }
    }

    final Object lock = new Object();

    @GuardedBy("lock")
    boolean syncing;

    @GuardedBy("lock")
    final Deque<DeferredEvent> deferred = new ArrayDeque<>();

    volatile Instant lastFullSync;
}
