package io.kubecache.k8s.client;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;

import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.kubecache.errors.MissingResourceException;
import io.kubecache.k8s.model.ClusterId;
import org.testng.annotations.Test;

public class ClusterRegistryTest {

    private static Cluster inMemory(final String id) {
        return new Cluster(ClusterId.of(id), "sessions", new InMemoryClusterConnection(ClusterId.of(id)));
    }

    @Test
    public void testClustersAreOrderedById() {
        final ClusterRegistry registry = new ClusterRegistry(ImmutableList.of(inMemory("zeta"), inMemory("default"), inMemory("alpha")));

        assertEquals(registry.clusters().stream().map(cluster -> cluster.id.id).collect(Collectors.toList()),
                     ImmutableList.of("alpha", "default", "zeta"));
    }

    @Test
    public void testLookup() {
        final ClusterRegistry registry = new ClusterRegistry(ImmutableList.of(inMemory("default"), inMemory("cluster-a")));

        assertEquals(registry.get(ClusterId.of("cluster-a")).id, ClusterId.of("cluster-a"));
        assertTrue(registry.get(ClusterId.DEFAULT).id.isDefault());
        assertFalse(registry.find(ClusterId.of("cluster-b")).isPresent());
        assertThrows(MissingResourceException.class, () -> registry.get(ClusterId.of("cluster-b")));
    }

    @Test
    public void testDuplicateIdsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ClusterRegistry(ImmutableList.of(inMemory("cluster-a"), inMemory("cluster-a"))));
    }

    @Test
    public void testNamespaceForKind() {
        final Cluster cluster = inMemory("cluster-a");

        assertEquals(cluster.namespaceFor(true), "sessions");
        assertNull(cluster.namespaceFor(false));
    }

    @Test
    public void testInMemoryClustersFromOptions() throws Exception {
        final ClusterOptions options = new ClusterOptions();
        options.namespace = "sessions";
        options.inMemoryClusters = ImmutableList.of("default", "cluster-a");

        final ClusterRegistry registry = new ClusterLoader(options).load();

        assertEquals(registry.clusters().size(), 2);
        assertTrue(registry.get(ClusterId.of("cluster-a")).connection instanceof InMemoryClusterConnection);
        assertEquals(registry.get(ClusterId.DEFAULT).namespace, "sessions");
    }

    @Test
    public void testEqualitySelector() {
        assertEquals(LabelSelectors.equalitySelector("app", "kubecache"), "app=kubecache");
        assertEquals(LabelSelectors.equalitySelector(ImmutableMap.of("app", "kubecache", "tier", "quota")), "app=kubecache,tier=quota");
        assertNull(LabelSelectors.equalitySelector(ImmutableMap.of()));
    }
}
