package io.kubecache.k8s.client;

import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import io.kubecache.errors.ClusterUnavailableException;
import io.kubecache.errors.MissingResourceException;
import io.kubecache.k8s.model.ClusterId;
import io.kubecache.k8s.model.EventType;
import io.kubecache.k8s.model.GVK;
import io.kubecache.k8s.model.K8sObject;
import io.kubecache.k8s.model.K8sObjectFilter;
import io.kubecache.k8s.model.K8sObjectMeta;
import io.kubecache.k8s.model.Manifests;
import io.kubecache.k8s.model.ObjectKey;
import io.kubecache.k8s.model.PropagationPolicy;
import io.kubecache.k8s.model.WatchEvent;
import io.kubernetes.client.openapi.ApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link ClusterConnection} backed by an in-process object store, for development and tests.
 * <p>
 * Behaves like an API server where it matters to callers: objects get a uid and increasing resource versions,
 * creating an existing object fails with 409, deletes cascade to dependents through owner references,
 * listing is paginated, and every mutation is delivered to the open watches.
 */
public class InMemoryClusterConnection implements ClusterConnection {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryClusterConnection.class);

    private static final int HTTP_CONFLICT = 409;
    private static final int HTTP_UNPROCESSABLE_ENTITY = 422;

    private final ClusterId clusterId;
    private final int pageSize;

    private final Object lock = new Object();

    @GuardedBy("lock")
    private final Map<ObjectKey, K8sObject> objects = new LinkedHashMap<>();

    @GuardedBy("lock")
    private long resourceVersion;

    private final List<InMemoryWatchStream> watches = new CopyOnWriteArrayList<>();

    private volatile boolean unavailable;

    public InMemoryClusterConnection(final ClusterId clusterId) {
        this(clusterId, 500);
    }

    public InMemoryClusterConnection(final ClusterId clusterId, final int pageSize) {
        this.clusterId = clusterId;
        this.pageSize = pageSize;
    }

    @Override
    public ClusterId clusterId() {
        return clusterId;
    }

    /**
     * Makes every subsequent call fail with {@link ClusterUnavailableException}, as if the endpoint was unreachable.
     */
    public void setUnavailable(final boolean unavailable) {
        this.unavailable = unavailable;
    }

    private void checkAvailable() {
        if (unavailable) {
            throw new ClusterUnavailableException(String.format("Cluster %s is unreachable.", clusterId));
        }
    }

    @Override
    public Iterable<K8sObject> list(final K8sObjectFilter filter, final boolean raiseOnError) throws ApiException {
        checkAvailable();

        final List<K8sObject> snapshot;

        synchronized (lock) {
            snapshot = objects.values().stream()
                    .filter(object -> filter.gvk == null || filter.gvk.equals(object.meta.gvk))
                    .filter(object -> filter.namespace == null || filter.namespace.equals(object.meta.namespace))
                    .filter(object -> filter.name == null || filter.name.equals(object.meta.name))
                    .filter(object -> filter.labelsMatch(object.labels()))
                    .collect(ImmutableList.toImmutableList());
        }

        class SnapshotPage implements ResourceListIterable.Page<K8sObject> {
            private final int offset;

            private SnapshotPage(final int offset) {
                this.offset = offset;
            }

            @Override
            public Collection<K8sObject> items() {
                return snapshot.subList(offset, Math.min(offset + pageSize, snapshot.size()));
            }

            @Override
            public SnapshotPage nextPage() {
                final int next = offset + pageSize;

                if (next >= snapshot.size())
                    return null;

                checkAvailable();

                return new SnapshotPage(next);
            }
        }

        return new ResourceListIterable<>(new SnapshotPage(0));
    }

    @Override
    public Optional<K8sObject> get(final K8sObjectMeta meta) throws ApiException {
        checkAvailable();

        synchronized (lock) {
            return Optional.ofNullable(objects.get(keyOf(meta)));
        }
    }

    @Override
    public K8sObject create(final K8sObject object) throws ApiException {
        checkAvailable();

        final K8sObject created;

        synchronized (lock) {
            final ObjectKey key = keyOf(object.meta);

            if (objects.containsKey(key)) {
                throw new ApiException(HTTP_CONFLICT, String.format("%s already exists.", object.meta));
            }

            final JsonObject manifest = object.manifest();
            final JsonObject metadata = Manifests.getOrCreateObject(manifest, "metadata");

            metadata.addProperty("uid", UUID.randomUUID().toString());
            metadata.addProperty("creationTimestamp", Instant.now().toString());
            metadata.remove("deletionTimestamp");

            if (object.meta.namespace != null) {
                metadata.addProperty("namespace", object.meta.namespace);
            }

            created = store(key, manifest);
            publish(EventType.ADDED, created);
        }

        logger.debug("Created {}.", created);

        return created;
    }

    @Override
    public K8sObject patch(final K8sObjectMeta meta, final JsonElement patch) throws ApiException {
        checkAvailable();

        final K8sObject patched;

        synchronized (lock) {
            final ObjectKey key = keyOf(meta);
            final K8sObject existing = objects.get(key);

            if (existing == null) {
                throw new MissingResourceException(String.format("Cannot patch %s, it does not exist.", meta));
            }

            final JsonObject manifest;

            try {
                manifest = JsonPatches.apply(existing.manifest(), patch);

            } catch (final IllegalArgumentException e) {
                throw new ApiException(HTTP_UNPROCESSABLE_ENTITY, e.getMessage());
            }

            // identity is immutable
            final JsonObject metadata = Manifests.getOrCreateObject(manifest, "metadata");
            final JsonObject existingMetadata = Manifests.getObject(existing.manifest(), "metadata").orElseGet(JsonObject::new);

            for (final String member : new String[]{"name", "namespace", "uid", "creationTimestamp"}) {
                if (existingMetadata.has(member)) {
                    metadata.add(member, existingMetadata.get(member));
                } else {
                    metadata.remove(member);
                }
            }

            patched = store(key, manifest);
            publish(EventType.MODIFIED, patched);
        }

        return patched;
    }

    @Override
    public void delete(final K8sObjectMeta meta, final PropagationPolicy propagationPolicy) throws ApiException {
        checkAvailable();

        final List<K8sObject> deleted = new ArrayList<>();

        synchronized (lock) {
            final K8sObject owner = objects.get(keyOf(meta));

            if (owner == null) {
                logger.debug("{} was already gone.", meta);
                return;
            }

            if (propagationPolicy != PropagationPolicy.ORPHAN) {
                collectDependents(owner, deleted);
            }

            deleted.add(owner);

            for (final K8sObject object : deleted) {
                objects.remove(keyOf(object.meta));
                publish(EventType.DELETED, object);
            }
        }
    }

    // depth first, so that dependents are listed before their owners
    @GuardedBy("lock")
    private void collectDependents(final K8sObject owner, final List<K8sObject> collected) {
        final String uid = owner.uid();

        if (uid == null) {
            return;
        }

        final Deque<K8sObject> dependents = new ArrayDeque<>();

        for (final K8sObject candidate : objects.values()) {
            if (isOwnedBy(candidate, uid) && !collected.contains(candidate)) {
                dependents.add(candidate);
            }
        }

        for (final K8sObject dependent : dependents) {
            collectDependents(dependent, collected);
            collected.add(dependent);
        }
    }

    private static boolean isOwnedBy(final K8sObject object, final String ownerUid) {
        return Manifests.get(object.manifest(), "metadata", "ownerReferences")
                .filter(JsonElement::isJsonArray)
                .map(references -> FluentIterable.from(references.getAsJsonArray())
                        .filter(JsonElement::isJsonObject)
                        .anyMatch(reference -> Manifests.getString(reference.getAsJsonObject(), "uid")
                                .map(ownerUid::equals)
                                .orElse(false)))
                .orElse(false);
    }

    @Override
    public WatchStream watch(final GVK gvk, @Nullable final String namespace) throws ApiException {
        checkAvailable();

        final InMemoryWatchStream stream = new InMemoryWatchStream(gvk, namespace);
        watches.add(stream);

        return stream;
    }

    /**
     * Delivers an event to the open watches without touching the stored objects, e.g. to replay a stale event.
     * Events are queued under the store lock, so watches see changes in resource version order.
     */
    public void publish(final EventType type, final K8sObject object) {
        final WatchEvent event = new WatchEvent(type, object);

        synchronized (lock) {
            for (final InMemoryWatchStream stream : watches) {
                if (stream.accepts(object)) {
                    stream.events.add(Optional.of(event));
                }
            }
        }
    }

    /**
     * Ends every open watch, as a server closing its connections would.
     */
    public void closeWatches() {
        for (final InMemoryWatchStream stream : watches) {
            stream.close();
        }
    }

    public int openWatchCount() {
        return watches.size();
    }

    private ObjectKey keyOf(final K8sObjectMeta meta) {
        return new ObjectKey(clusterId, meta.namespace, meta.gvk, meta.name);
    }

    @GuardedBy("lock")
    private K8sObject store(final ObjectKey key, final JsonObject manifest) {
        resourceVersion++;

        Manifests.getOrCreateObject(manifest, "metadata").add("resourceVersion", new JsonPrimitive(Long.toString(resourceVersion)));

        final K8sObject stored = K8sObject.fromManifest(clusterId, manifest);
        objects.put(key, stored);

        return stored;
    }

    private class InMemoryWatchStream implements WatchStream {
        private final GVK gvk;
        @Nullable
        private final String namespace;

        // empty marks the end of the stream
        private final BlockingQueue<Optional<WatchEvent>> events = new LinkedBlockingQueue<>();

        private InMemoryWatchStream(final GVK gvk, @Nullable final String namespace) {
            this.gvk = gvk;
            this.namespace = namespace;
        }

        private boolean accepts(final K8sObject object) {
            return gvk.equals(object.meta.gvk) && (namespace == null || Objects.equals(namespace, object.meta.namespace));
        }

        @Override
        public Iterator<WatchEvent> iterator() {
            return new AbstractIterator<WatchEvent>() {
                @Override
                protected WatchEvent computeNext() {
                    try {
                        return events.take().orElseGet(this::endOfData);

                    } catch (final InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return endOfData();
                    }
                }
            };
        }

        @Override
        public void close() {
            if (watches.remove(this)) {
                events.add(Optional.empty());
            }
        }
    }
}
