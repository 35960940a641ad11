package io.kubecache.k8s.client;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.awaitility.Awaitility.await;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNotEquals;
import static org.testng.Assert.assertNotNull;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.kubecache.errors.ClusterUnavailableException;
import io.kubecache.errors.MissingResourceException;
import io.kubecache.k8s.K8sTestObjects;
import io.kubecache.k8s.model.ClusterId;
import io.kubecache.k8s.model.EventType;
import io.kubecache.k8s.model.GVK;
import io.kubecache.k8s.model.K8sObject;
import io.kubecache.k8s.model.K8sObjectFilter;
import io.kubecache.k8s.model.PropagationPolicy;
import io.kubecache.k8s.model.WatchEvent;
import io.kubernetes.client.openapi.ApiException;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class InMemoryClusterConnectionTest {
    private static final ClusterId CLUSTER = ClusterId.of("cluster-a");
    private static final GVK CONFIG_MAP = GVK.core("v1", "ConfigMap");
    private static final GVK OWNER = new GVK("scheduling.k8s.io", "v1", "PriorityClass");

    private InMemoryClusterConnection connection;

    @BeforeMethod
    public void setup() {
        connection = new InMemoryClusterConnection(CLUSTER, 2);
    }

    @Test
    public void testCreateAssignsIdentityAndResourceVersion() throws ApiException {
        final K8sObject first = connection.create(K8sTestObjects.object(CLUSTER, CONFIG_MAP, "default", "first"));
        final K8sObject second = connection.create(K8sTestObjects.object(CLUSTER, CONFIG_MAP, "default", "second"));

        assertNotNull(first.uid());
        assertNotEquals(first.uid(), second.uid());
        assertEquals(first.resourceVersion(), "1");
        assertEquals(second.resourceVersion(), "2");
        assertEquals(connection.get(first.meta), Optional.of(first));
    }

    @Test
    public void testCreatingExistingObjectIsConflict() throws ApiException {
        connection.create(K8sTestObjects.object(CLUSTER, CONFIG_MAP, "default", "settings"));

        final ApiException e = expectThrows(ApiException.class, () -> connection.create(K8sTestObjects.object(CLUSTER, CONFIG_MAP, "default", "settings")));
        assertEquals(e.getCode(), 409);

        // same name in another namespace is another object
        connection.create(K8sTestObjects.object(CLUSTER, CONFIG_MAP, "other", "settings"));
    }

    @Test
    public void testListPaginatesAndFilters() throws ApiException {
        for (int i = 0; i < 5; i++) {
            connection.create(K8sTestObjects.object(CLUSTER, CONFIG_MAP, "default", "map-" + i, ImmutableMap.of("index", Integer.toString(i % 2))));
        }
        connection.create(K8sTestObjects.object(CLUSTER, CONFIG_MAP, "other", "elsewhere"));

        final Iterable<K8sObject> all = connection.list(K8sObjectFilter.builder(CONFIG_MAP).namespace("default").build());
        assertEquals(Iterables.size(all), 5);

        final List<String> evenNames = new ArrayList<>();
        for (final K8sObject object : connection.list(K8sObjectFilter.builder(CONFIG_MAP).label("index", "0").build())) {
            evenNames.add(object.meta.name);
        }
        assertEquals(evenNames, ImmutableList.of("map-0", "map-2", "map-4"));

        assertEquals(Iterables.getOnlyElement(connection.list(K8sObjectFilter.builder(CONFIG_MAP).name("elsewhere").build())).meta.namespace, "other");
    }

    @Test
    public void testListFailsWhenUnavailable() {
        connection.setUnavailable(true);

        assertThrows(ClusterUnavailableException.class, () -> connection.list(K8sObjectFilter.builder(CONFIG_MAP).build()));
        assertThrows(ClusterUnavailableException.class, () -> connection.get(K8sTestObjects.object(CLUSTER, CONFIG_MAP, "default", "any").meta));
    }

    @Test
    public void testJsonPatchAndMergePatch() throws ApiException {
        final K8sObject created = connection.create(K8sTestObjects.object(CLUSTER, CONFIG_MAP, "default", "settings"));

        final K8sObject jsonPatched = connection.patch(created.meta, JsonParser.parseString("[{\"op\":\"add\",\"path\":\"/data\",\"value\":{\"key\":\"value\"}}]"));
        assertEquals(jsonPatched.manifest().getAsJsonObject("data").get("key").getAsString(), "value");

        final K8sObject mergePatched = connection.patch(created.meta, JsonParser.parseString("{\"data\":{\"key\":null,\"other\":\"x\"},\"metadata\":{\"uid\":\"forged\"}}"));
        assertFalse(mergePatched.manifest().getAsJsonObject("data").has("key"));
        assertEquals(mergePatched.uid(), created.uid());
        assertTrue(Long.parseLong(mergePatched.resourceVersion()) > Long.parseLong(created.resourceVersion()));
    }

    @Test
    public void testPatchingMissingObjectFails() {
        final K8sObject absent = K8sTestObjects.object(CLUSTER, CONFIG_MAP, "default", "absent");

        assertThrows(MissingResourceException.class, () -> connection.patch(absent.meta, new JsonObject()));
    }

    @Test
    public void testInvalidPatchIsUnprocessable() throws ApiException {
        final K8sObject created = connection.create(K8sTestObjects.object(CLUSTER, CONFIG_MAP, "default", "settings"));

        final ApiException e = expectThrows(ApiException.class, () -> connection.patch(created.meta, JsonParser.parseString("[{\"op\":\"remove\",\"path\":\"/absent\"}]")));
        assertEquals(e.getCode(), 422);
    }

    @Test
    public void testDeleteCascadesThroughOwnerReferences() throws ApiException {
        final K8sObject owner = connection.create(K8sTestObjects.object(CLUSTER, OWNER, null, "owner"));
        final K8sObject dependent = connection.create(dependentOf(owner, "dependent"));
        final K8sObject unrelated = connection.create(K8sTestObjects.object(CLUSTER, CONFIG_MAP, "default", "unrelated"));

        connection.delete(owner.meta, PropagationPolicy.FOREGROUND);

        assertFalse(connection.get(owner.meta).isPresent());
        assertFalse(connection.get(dependent.meta).isPresent());
        assertTrue(connection.get(unrelated.meta).isPresent());
    }

    @Test
    public void testOrphanDeleteKeepsDependents() throws ApiException {
        final K8sObject owner = connection.create(K8sTestObjects.object(CLUSTER, OWNER, null, "owner"));
        final K8sObject dependent = connection.create(dependentOf(owner, "dependent"));

        connection.delete(owner.meta, PropagationPolicy.ORPHAN);

        assertFalse(connection.get(owner.meta).isPresent());
        assertTrue(connection.get(dependent.meta).isPresent());
    }

    @Test
    public void testDeletingAbsentObjectIsNoop() throws ApiException {
        connection.delete(K8sTestObjects.object(CLUSTER, CONFIG_MAP, "default", "absent").meta, PropagationPolicy.BACKGROUND);
    }

    @Test
    public void testWatchDeliversMutationsInOrder() throws Exception {
        final List<WatchEvent> received = Collections.synchronizedList(new ArrayList<>());

        final WatchStream stream = connection.watch(CONFIG_MAP, "default");
        final Thread reader = new Thread(() -> stream.forEach(received::add));
        reader.start();

        final K8sObject created = connection.create(K8sTestObjects.object(CLUSTER, CONFIG_MAP, "default", "settings"));
        connection.create(K8sTestObjects.object(CLUSTER, CONFIG_MAP, "other", "not-watched"));
        connection.patch(created.meta, JsonParser.parseString("{\"data\":{\"key\":\"value\"}}"));
        connection.delete(created.meta, PropagationPolicy.BACKGROUND);

        await().atMost(5, SECONDS).until(() -> received.size() == 3);

        assertEquals(received.get(0).type, EventType.ADDED);
        assertEquals(received.get(1).type, EventType.MODIFIED);
        assertEquals(received.get(2).type, EventType.DELETED);
        assertEquals(received.get(2).object.meta.name, "settings");

        stream.close();
        reader.join(SECONDS.toMillis(5));

        assertFalse(reader.isAlive());
        assertEquals(connection.openWatchCount(), 0);
    }

    @Test
    public void testConcurrentPatchesAreWatchedInResourceVersionOrder() throws Exception {
        final K8sObject created = connection.create(K8sTestObjects.object(CLUSTER, CONFIG_MAP, "default", "counter"));
        final List<WatchEvent> received = Collections.synchronizedList(new ArrayList<>());

        final WatchStream stream = connection.watch(CONFIG_MAP, "default");
        final Thread reader = new Thread(() -> stream.forEach(received::add));
        reader.start();

        final ExecutorService writers = Executors.newFixedThreadPool(4);
        try {
            final List<Future<?>> results = new ArrayList<>();
            for (int writer = 0; writer < 4; writer++) {
                final String key = "writer-" + writer;
                results.add(writers.submit(() -> {
                    for (int i = 0; i < 50; i++) {
                        connection.patch(created.meta, JsonParser.parseString("{\"data\":{\"" + key + "\":\"" + i + "\"}}"));
                    }
                    return null;
                }));
            }
            for (final Future<?> result : results) {
                result.get(5, SECONDS);
            }
        } finally {
            writers.shutdownNow();
        }

        await().atMost(5, SECONDS).until(() -> received.size() == 200);

        long previous = Long.parseLong(created.resourceVersion());
        synchronized (received) {
            for (final WatchEvent event : received) {
                final long resourceVersion = Long.parseLong(event.object.resourceVersion());
                assertTrue(resourceVersion > previous, resourceVersion + " after " + previous);
                previous = resourceVersion;
            }
        }

        stream.close();
        reader.join(SECONDS.toMillis(5));
    }

    @Test
    public void testCloseWatchesEndsStreams() throws Exception {
        final WatchStream stream = connection.watch(CONFIG_MAP, null);
        final Thread reader = new Thread(() -> stream.forEach(event -> {}));
        reader.start();

        connection.closeWatches();
        reader.join(SECONDS.toMillis(5));

        assertFalse(reader.isAlive());
    }

    private static K8sObject dependentOf(final K8sObject owner, final String name) {
        final JsonObject manifest = K8sTestObjects.manifest(CONFIG_MAP, "default", name, ImmutableMap.of());

        final JsonObject reference = new JsonObject();
        reference.addProperty("apiVersion", owner.meta.gvk.groupVersion());
        reference.addProperty("kind", owner.meta.gvk.kind);
        reference.addProperty("name", owner.meta.name);
        reference.addProperty("uid", owner.uid());

        final JsonArray references = new JsonArray();
        references.add(reference);
        manifest.getAsJsonObject("metadata").add("ownerReferences", references);

        return K8sObject.fromManifest(CLUSTER, manifest);
    }
}
