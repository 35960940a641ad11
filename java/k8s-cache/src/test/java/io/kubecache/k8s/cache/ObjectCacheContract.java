package io.kubecache.k8s.cache;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;

import javax.validation.ValidationException;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import io.kubecache.k8s.K8sTestObjects;
import io.kubecache.k8s.model.ClusterId;
import io.kubecache.k8s.model.GVK;
import io.kubecache.k8s.model.K8sObject;
import io.kubecache.k8s.model.K8sObjectFilter;
import org.testng.annotations.Test;

/**
 * Behaviour every {@link ObjectCache} implementation shares. Subclasses provide a fresh, empty cache per test.
 */
public abstract class ObjectCacheContract {
    protected static final ClusterId CLUSTER_A = ClusterId.of("cluster-a");
    protected static final ClusterId CLUSTER_B = ClusterId.of("cluster-b");
    protected static final GVK SESSION = new GVK("amalthea.dev", "v1alpha1", "AmaltheaSession");
    protected static final GVK CONFIG_MAP = GVK.core("v1", "ConfigMap");
    protected static final GVK PRIORITY_CLASS = new GVK("scheduling.k8s.io", "v1", "PriorityClass");

    protected abstract ObjectCache cache();

    private static K8sObject owned(final ClusterId cluster, final GVK gvk, final String namespace, final String name, final String userId) {
        return K8sTestObjects.object(cluster, gvk, namespace, name, ImmutableMap.of("owner", userId)).withUserId(userId);
    }

    private static Set<String> names(final Iterable<K8sObject> objects) {
        return StreamSupport.stream(objects.spliterator(), false)
                .map(object -> object.meta.cluster + "/" + object.meta.name)
                .collect(Collectors.toSet());
    }

    @Test
    public void testUpsertIsIdempotent() {
        final K8sObject object = K8sTestObjects.withResourceVersion(owned(CLUSTER_A, SESSION, "default", "session-1", "user-1"), "10");

        cache().upsert(object);
        cache().upsert(object);

        assertEquals(cache().get(object.meta).orElseThrow(AssertionError::new), object);
        assertEquals(Iterables.size(cache().list(K8sObjectFilter.builder().build())), 1);
    }

    @Test
    public void testUpsertReplacesPreviousState() {
        final K8sObject v1 = K8sTestObjects.withResourceVersion(owned(CLUSTER_A, SESSION, "default", "session-1", "user-1"), "1");
        final K8sObject v2 = K8sTestObjects.withState(K8sTestObjects.withResourceVersion(v1, "2"), "Running");

        cache().upsert(v1);
        cache().upsert(v2);

        final K8sObject cached = cache().get(v1.meta).orElseThrow(AssertionError::new);
        assertEquals(cached.resourceVersion(), "2");
        assertEquals(cached.manifest().getAsJsonObject("status").get("state").getAsString(), "Running");
        assertEquals(cached.meta.userId, "user-1");
    }

    @Test
    public void testUpsertWithoutUserIdIsRejected() {
        final K8sObject object = K8sTestObjects.object(CLUSTER_A, SESSION, "default", "session-1");

        assertThrows(ValidationException.class, () -> cache().upsert(object));
        assertFalse(cache().get(object.meta).isPresent());
    }

    @Test
    public void testDelete() {
        final K8sObject object = owned(CLUSTER_A, SESSION, "default", "session-1", "user-1");

        cache().upsert(object);
        cache().delete(object.meta);

        assertFalse(cache().get(object.meta).isPresent());

        // deleting again is fine
        cache().delete(object.meta);
    }

    @Test
    public void testIdentityIncludesClusterNamespaceAndKind() {
        cache().upsert(owned(CLUSTER_A, SESSION, "default", "same-name", "user-1"));
        cache().upsert(owned(CLUSTER_B, SESSION, "default", "same-name", "user-1"));
        cache().upsert(owned(CLUSTER_A, SESSION, "other", "same-name", "user-1"));
        cache().upsert(owned(CLUSTER_A, CONFIG_MAP, "default", "same-name", "user-1"));

        assertEquals(Iterables.size(cache().list(K8sObjectFilter.builder().name("same-name").build())), 4);
    }

    @Test
    public void testClusterScopedObjects() {
        final K8sObject priorityClass = K8sTestObjects.object(CLUSTER_A, PRIORITY_CLASS, null, "quota-1").withUserId("system");

        cache().upsert(priorityClass);

        final K8sObject cached = cache().get(priorityClass.meta).orElseThrow(AssertionError::new);
        assertEquals(cached.meta.namespace, null);
        assertEquals(cached.meta.gvk, PRIORITY_CLASS);
    }

    @Test
    public void testCoreGroupRoundTrips() {
        final K8sObject configMap = owned(CLUSTER_A, CONFIG_MAP, "default", "settings", "user-1");

        cache().upsert(configMap);

        final K8sObject listed = Iterables.getOnlyElement(cache().list(K8sObjectFilter.builder(GVK.core("v1", "ConfigMap")).build()));
        assertEquals(listed.meta.gvk, CONFIG_MAP);
        assertEquals(listed.meta.gvk.group, null);
    }

    @Test
    public void testListFilters() {
        cache().upsert(owned(CLUSTER_A, SESSION, "default", "a1", "user-1"));
        cache().upsert(owned(CLUSTER_A, SESSION, "default", "a2", "user-2"));
        cache().upsert(owned(CLUSTER_A, SESSION, "other", "a3", "user-1"));
        cache().upsert(owned(CLUSTER_B, SESSION, "default", "b1", "user-1"));
        cache().upsert(owned(CLUSTER_A, CONFIG_MAP, "default", "c1", "user-1"));

        assertEquals(names(cache().list(K8sObjectFilter.builder().build())),
                     ImmutableSet.of("cluster-a/a1", "cluster-a/a2", "cluster-a/a3", "cluster-b/b1", "cluster-a/c1"));

        assertEquals(names(cache().list(K8sObjectFilter.builder(SESSION).cluster(CLUSTER_A).build())),
                     ImmutableSet.of("cluster-a/a1", "cluster-a/a2", "cluster-a/a3"));

        assertEquals(names(cache().list(K8sObjectFilter.builder(SESSION).namespace("default").userId("user-1").build())),
                     ImmutableSet.of("cluster-a/a1", "cluster-b/b1"));

        assertEquals(names(cache().list(K8sObjectFilter.builder().label("owner", "user-2").build())),
                     ImmutableSet.of("cluster-a/a2"));

        assertEquals(names(cache().list(K8sObjectFilter.builder().name("a3").build())),
                     ImmutableSet.of("cluster-a/a3"));

        assertTrue(names(cache().list(K8sObjectFilter.builder().label("owner", "nobody").build())).isEmpty());
    }
}
