package io.kubecache.k8s.quota;

import java.util.Optional;

import com.google.gson.JsonObject;
import io.kubecache.k8s.client.Cluster;
import io.kubecache.k8s.model.GVK;
import io.kubecache.k8s.model.K8sObject;
import io.kubecache.k8s.model.K8sObjectMeta;
import io.kubecache.k8s.model.PropagationPolicy;
import io.kubecache.k8s.watch.TrackedKinds;
import io.kubernetes.client.openapi.ApiException;

/**
 * Cluster-scoped PriorityClass objects of one cluster.
 */
public class PriorityClassClient {
    public static final GVK PRIORITY_CLASS = TrackedKinds.PRIORITY_CLASS;

    private final Cluster cluster;

    public PriorityClassClient(final Cluster cluster) {
        this.cluster = cluster;
    }

    public K8sObjectMeta meta(final String name) {
        return new K8sObjectMeta(name, null, cluster.id, PRIORITY_CLASS);
    }

    public Optional<K8sObject> get(final String name) throws ApiException {
        return cluster.connection.get(meta(name));
    }

    public K8sObject create(final JsonObject manifest) throws ApiException {
        final K8sObject object = K8sObject.fromManifest(cluster.id, manifest);

        if (!object.meta.gvk.equals(PRIORITY_CLASS) || object.meta.namespace != null) {
            throw new IllegalArgumentException("Not a cluster-scoped PriorityClass: " + object.meta);
        }

        return cluster.connection.create(object);
    }

    public void delete(final String name, final PropagationPolicy propagationPolicy) throws ApiException {
        cluster.connection.delete(meta(name), propagationPolicy);
    }
}
