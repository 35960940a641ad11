package io.kubecache.k8s.watch;

import javax.annotation.Nullable;
import javax.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.google.common.util.concurrent.AbstractIdleService;
import io.kubecache.k8s.cache.ObjectCache;
import io.kubecache.k8s.cache.ObjectCacheException;
import io.kubecache.k8s.client.Cluster;
import io.kubecache.k8s.client.ClusterRegistry;
import io.kubecache.k8s.client.UncheckedApiException;
import io.kubecache.k8s.client.WatchStream;
import io.kubecache.k8s.model.ClusterId;
import io.kubecache.k8s.model.EventType;
import io.kubecache.k8s.model.K8sObject;
import io.kubecache.k8s.model.K8sObjectFilter;
import io.kubecache.k8s.model.ObjectKey;
import io.kubecache.k8s.model.WatchEvent;
import io.kubecache.slf4j.MDC;
import io.kubecache.task.SupervisedTask;
import io.kubecache.task.TaskJoin;
import io.kubecache.task.TaskSupervisor;
import io.kubernetes.client.openapi.ApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mirrors the tracked kinds of every cluster into the {@link ObjectCache}.
 * <p>
 * Per cluster, a supervised task runs a full sync whenever the sync period elapsed, and once the first full
 * sync succeeded keeps one supervised watch task per kind running. Watch events are applied to the cache and
 * handed to the {@link K8sEventHandler} together with the previously cached object. Events arriving while a
 * full sync of their cluster runs are held back until it finished. Events older than the cached state are
 * dropped, whether they were held back or arrived after the full sync stored a newer version.
 */
public class K8sWatcher extends AbstractIdleService {
    private static final Logger logger = LoggerFactory.getLogger(K8sWatcher.class);

    private final ClusterRegistry clusters;
    private final ObjectCache cache;
    private final K8sEventHandler handler;
    private final TaskSupervisor supervisor;
    private final WatcherConfig config;
    private final Clock clock;

    private final Map<ClusterId, ClusterSyncState> syncStates = new ConcurrentHashMap<>();

    @Inject
    public K8sWatcher(final ClusterRegistry clusters,
                      final ObjectCache cache,
                      final K8sEventHandler handler,
                      final TaskSupervisor supervisor,
                      final WatcherConfig config) {
        this(clusters, cache, handler, supervisor, config, Clock.systemUTC());
    }

    public K8sWatcher(final ClusterRegistry clusters,
                      final ObjectCache cache,
                      final K8sEventHandler handler,
                      final TaskSupervisor supervisor,
                      final WatcherConfig config,
                      final Clock clock) {
        this.clusters = clusters;
        this.cache = cache;
        this.handler = handler;
        this.supervisor = supervisor;
        this.config = config;
        this.clock = clock;
    }

    static String fullSyncTaskName(final ClusterId cluster) {
        return "k8s-full-sync:" + cluster;
    }

    static String watchTaskName(final ClusterId cluster, final TrackedKind kind) {
        return "k8s-watch:" + cluster + ":" + kind.gvk;
    }

    @Override
    protected void startUp() throws Exception {
        for (final Cluster cluster : clusters.clusters()) {
            logger.info("Watching {} in cluster {} (namespace {}).", config.kinds, cluster.id, cluster.namespace);

            supervisor.start(fullSyncTaskName(cluster.id), () -> new PeriodicSyncTask(cluster));
        }
    }

    @Override
    protected void shutDown() throws Exception {
        final List<TaskJoin> joins = new ArrayList<>();

        for (final Cluster cluster : clusters.clusters()) {
            supervisor.cancel(fullSyncTaskName(cluster.id)).ifPresent(joins::add);

            for (final TrackedKind kind : config.kinds) {
                supervisor.cancel(watchTaskName(cluster.id, kind)).ifPresent(joins::add);
            }
        }

        final long deadline = System.nanoTime() + config.stopTimeout.toNanos();

        for (final TaskJoin join : joins) {
            try {
                join.join(Duration.ofNanos(Math.max(deadline - System.nanoTime(), 1)));

            } catch (final TimeoutException e) {
                logger.error("Timeout waiting for watcher task {} to stop.", join.name());
            }
        }
    }

    private ClusterSyncState syncState(final ClusterId cluster) {
        return syncStates.computeIfAbsent(cluster, id -> new ClusterSyncState());
    }

    boolean isSyncing(final ClusterId cluster) {
        final ClusterSyncState state = syncState(cluster);

        synchronized (state.lock) {
            return state.syncing;
        }
    }

    public Optional<Instant> lastFullSync(final ClusterId cluster) {
        return Optional.ofNullable(syncState(cluster).lastFullSync);
    }

    /**
     * Runs a full sync of the cluster if none completed within the sync period.
     *
     * @return whether a full sync ran
     */
    public boolean fullSyncIfDue(final Cluster cluster) throws ApiException {
        final Instant lastFullSync = syncState(cluster.id).lastFullSync;

        if (lastFullSync != null && Duration.between(lastFullSync, clock.instant()).compareTo(config.syncPeriod) < 0) {
            return false;
        }

        fullSync(cluster);
        return true;
    }

    /**
     * Lists every tracked kind of the cluster, stores what was listed and evicts cached objects that no longer exist.
     * <p>
     * Listing errors fail the sync for the default cluster. For other clusters the kind is only partially
     * refreshed: listed objects are stored, nothing is evicted.
     */
    public void fullSync(final Cluster cluster) throws ApiException {
        final ClusterSyncState state = syncState(cluster.id);

        synchronized (state.lock) {
            state.syncing = true;
        }

        final List<AppliedEvent> drained;

        try (@SuppressWarnings("unused") final MDC.MDCCloseable _clusterMDC = MDC.put("Cluster", cluster.id)) {
            try {
                for (final TrackedKind kind : config.kinds) {
                    syncKind(cluster, kind);
                }

                state.lastFullSync = clock.instant();

            } finally {
                drained = drainDeferred(cluster, state);
            }
        }

        drained.forEach(applied -> notifyHandler(cluster, applied));
    }

    private void syncKind(final Cluster cluster, final TrackedKind kind) throws ApiException {
        try (@SuppressWarnings("unused") final MDC.MDCCloseable _kindMDC = MDC.put("Kind", kind.gvk)) {
            logger.info("Starting full sync of {} in cluster {}.", kind.gvk, cluster.id);

            final boolean raiseOnError = cluster.id.isDefault();
            final K8sObjectFilter filter = K8sObjectFilter.builder(kind.gvk)
                    .cluster(cluster.id)
                    .namespace(cluster.namespaceFor(kind.namespaced))
                    .build();

            final Set<ObjectKey> listed = new HashSet<>();

            try {
                for (final K8sObject object : cluster.connection.list(filter, raiseOnError)) {
                    final Optional<String> userId = kind.userIdOf(object);

                    if (!userId.isPresent()) {
                        logger.warn("Skipping {}, it has no {} label.", object.meta, kind.ownerLabel);
                        continue;
                    }

                    cache.upsert(object.withUserId(userId.get()));
                    listed.add(object.meta.key());
                }

            } catch (final ApiException | UncheckedApiException e) {
                if (raiseOnError) {
                    throw e;
                }

                logger.error("Failed to list {} in cluster {}. Keeping cached objects until the next full sync.", kind.gvk, cluster.id, e);
                return;
            }

            int evicted = 0;

            for (final K8sObject cached : cache.list(filter)) {
                if (!listed.contains(cached.meta.key())) {
                    logger.debug("Evicting {}, it no longer exists.", cached.meta);
                    cache.delete(cached.meta);
                    evicted++;
                }
            }

            logger.info("Finished full sync of {} in cluster {}: {} objects, {} evicted.", kind.gvk, cluster.id, listed.size(), evicted);
        }
    }

    private List<AppliedEvent> drainDeferred(final Cluster cluster, final ClusterSyncState state) {
        final List<AppliedEvent> applied = new ArrayList<>();

        synchronized (state.lock) {
            try {
                if (!state.deferred.isEmpty()) {
                    logger.info("Applying {} watch events received during the full sync of cluster {}.", state.deferred.size(), cluster.id);
                }

                while (!state.deferred.isEmpty()) {
                    final ClusterSyncState.DeferredEvent deferred = state.deferred.poll();
                    apply(cluster, deferred.kind, deferred.event).ifPresent(applied::add);
                }

            } finally {
                state.deferred.clear();
                state.syncing = false;
            }
        }

        return applied;
    }

    /**
     * Applies a watch event to the cache, or queues it while a full sync of the cluster runs.
     */
    void onWatchEvent(final Cluster cluster, final TrackedKind kind, final WatchEvent event) {
        final ClusterSyncState state = syncState(cluster.id);
        final Optional<AppliedEvent> applied;

        synchronized (state.lock) {
            if (state.syncing) {
                logger.debug("Deferring {} of {} until the full sync of cluster {} completes.", event.type, event.object.meta.name, cluster.id);
                state.deferred.add(new ClusterSyncState.DeferredEvent(kind, event));
                return;
            }

            applied = apply(cluster, kind, event);
        }

        applied.ifPresent(a -> notifyHandler(cluster, a));
    }

    private Optional<AppliedEvent> apply(final Cluster cluster, final TrackedKind kind, final WatchEvent event) {
        final Optional<String> userId = kind.userIdOf(event.object);

        if (!userId.isPresent()) {
            logger.warn("Ignoring {} of {}, it has no {} label.", event.type, event.object.meta, kind.ownerLabel);
            return Optional.empty();
        }

        final K8sObject object = event.object.withUserId(userId.get());

        try (@SuppressWarnings("unused") final MDC.MDCCloseable _objectMDC = MDC.put("Object", object.meta.name)) {
            final K8sObject previous = cache.get(object.meta).orElse(null);

            // a full sync may have stored a newer state than an event still in flight
            if (previous != null && ResourceVersions.isOlder(object.resourceVersion(), previous.resourceVersion())) {
                logger.debug("Dropping {} event with resource version {}, the cache already has {}.", event.type, object.resourceVersion(), previous.resourceVersion());
                return Optional.empty();
            }

            if (event.type == EventType.DELETED || object.isBeingDeleted()) {
                cache.delete(object.meta);
                return Optional.of(new AppliedEvent(previous, object, EventType.DELETED));
            }

            cache.upsert(object);
            return Optional.of(new AppliedEvent(previous, object, event.type));
        }
    }

    private void notifyHandler(final Cluster cluster, final AppliedEvent applied) {
        try {
            handler.handle(applied.previous, applied.current, cluster, applied.eventType);

        } catch (final RuntimeException e) {
            logger.error("Event handler failed on {} of {}.", applied.eventType, applied.current.meta, e);
        }
    }

    private static final class AppliedEvent {
        @Nullable
        final K8sObject previous;
        final K8sObject current;
        final EventType eventType;

        AppliedEvent(@Nullable final K8sObject previous, final K8sObject current, final EventType eventType) {
            this.previous = previous;
            this.current = current;
            this.eventType = eventType;
        }
    }

    /**
     * Full sync whenever due, then makes sure the watch tasks of the cluster run.
     */
    private class PeriodicSyncTask implements SupervisedTask {
        private final Cluster cluster;

        PeriodicSyncTask(final Cluster cluster) {
            this.cluster = cluster;
        }

        @Override
        public void run() throws Exception {
            while (true) {
                fullSyncIfDue(cluster);
                startWatches();

                TimeUnit.MILLISECONDS.sleep(config.pollInterval().toMillis());
            }
        }

        private void startWatches() {
            for (final TrackedKind kind : config.kinds) {
                final String name = watchTaskName(cluster.id, kind);

                if (!supervisor.isRunning(name)) {
                    supervisor.start(name, () -> new WatchTask(cluster, kind));
                }
            }
        }
    }

    /**
     * Follows the watch stream of one kind, reconnecting after a fixed delay whenever the stream ends.
     * Cache failures end the task, the supervisor restarts it.
     */
    private class WatchTask implements SupervisedTask {
        private final Cluster cluster;
        private final TrackedKind kind;

        private volatile boolean cancelled;
        private volatile WatchStream currentStream;

        WatchTask(final Cluster cluster, final TrackedKind kind) {
            this.cluster = cluster;
            this.kind = kind;
        }

        @Override
        public void run() throws InterruptedException {
            try (@SuppressWarnings("unused") final MDC.MDCCloseable _watchMDC = MDC.put("Cluster", cluster.id).andPut("Kind", kind.gvk)) {
                while (!cancelled) {
                    watchOnce();

                    if (cancelled || Thread.currentThread().isInterrupted()) {
                        return;
                    }

                    TimeUnit.MILLISECONDS.sleep(config.reconnectDelay.toMillis());
                }
            }
        }

        private void watchOnce() {
            logger.debug("Opening watch of {} in cluster {}.", kind.gvk, cluster.id);

            try (final WatchStream stream = cluster.connection.watch(kind.gvk, cluster.namespaceFor(kind.namespaced))) {
                currentStream = stream;

                if (cancelled) {
                    return;
                }

                for (final WatchEvent event : stream) {
                    onWatchEvent(cluster, kind, event);
                }

                logger.debug("Watch of {} in cluster {} ended. Reconnecting in {}.", kind.gvk, cluster.id, config.reconnectDelay);

            } catch (final ObjectCacheException e) {
                throw e;

            } catch (final ApiException | RuntimeException e) {
                if (!cancelled) {
                    logger.warn("Watch of {} in cluster {} failed. Reconnecting in {}.", kind.gvk, cluster.id, config.reconnectDelay, e);
                }

            } finally {
                currentStream = null;
            }
        }

        @Override
        public void triggerCancel() {
            cancelled = true;

            final WatchStream stream = currentStream;

            if (stream != null) {
                stream.close();
            }
        }
    }
}
