package io.kubecache.k8s.client;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import io.kubecache.k8s.model.ClusterId;

/**
 * One cluster of the fleet: its id, the namespace this process works in, and the connection to its API.
 */
public final class Cluster {
    public final ClusterId id;
    public final String namespace;
    public final ClusterConnection connection;

    public Cluster(final ClusterId id, final String namespace, final ClusterConnection connection) {
        this.id = id;
        this.namespace = namespace;
        this.connection = connection;
    }

    /**
     * @return the namespace to use for objects of a kind, {@code null} for cluster-scoped kinds
     */
    @Nullable
    public String namespaceFor(final boolean namespaced) {
        return namespaced ? namespace : null;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("namespace", namespace)
                .toString();
    }
}
