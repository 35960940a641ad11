package io.kubecache.k8s.client;

import java.util.Collection;
import java.util.Optional;

import com.google.common.collect.ImmutableSortedMap;
import io.kubecache.errors.MissingResourceException;
import io.kubecache.k8s.model.ClusterId;

/**
 * The fixed set of clusters this process works with, iterated in cluster id order.
 */
public class ClusterRegistry {
    private final ImmutableSortedMap<ClusterId, Cluster> clusters;

    public ClusterRegistry(final Collection<Cluster> clusters) {
        final ImmutableSortedMap.Builder<ClusterId, Cluster> builder = ImmutableSortedMap.naturalOrder();

        for (final Cluster cluster : clusters) {
            builder.put(cluster.id, cluster);
        }

        // duplicate ids fail here
        this.clusters = builder.build();
    }

    /**
     * @throws MissingResourceException if no cluster has the id
     */
    public Cluster get(final ClusterId id) {
        return find(id).orElseThrow(() -> new MissingResourceException(String.format("Cluster %s is not configured.", id)));
    }

    public Optional<Cluster> find(final ClusterId id) {
        return Optional.ofNullable(clusters.get(id));
    }

    public Collection<Cluster> clusters() {
        return clusters.values();
    }
}
