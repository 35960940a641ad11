package io.kubecache.k8s.model;

import javax.annotation.Nullable;
import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.gson.JsonObject;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Identifies an object in a cluster. A {@code null} namespace denotes a cluster-scoped object.
 */
public final class K8sObjectMeta {
    public final String name;
    @Nullable
    public final String namespace;
    public final ClusterId cluster;
    public final GVK gvk;
    @Nullable
    public final String userId;

    public K8sObjectMeta(final String name,
                         @Nullable final String namespace,
                         final ClusterId cluster,
                         final GVK gvk,
                         @Nullable final String userId) {
        checkArgument(!Strings.isNullOrEmpty(name), "name is required");

        this.name = name;
        this.namespace = Strings.emptyToNull(namespace);
        this.cluster = checkNotNull(cluster);
        this.gvk = checkNotNull(gvk);
        this.userId = userId;
    }

    public K8sObjectMeta(final String name, @Nullable final String namespace, final ClusterId cluster, final GVK gvk) {
        this(name, namespace, cluster, gvk, null);
    }

    public ObjectKey key() {
        return new ObjectKey(cluster, namespace, gvk, name);
    }

    public K8sObjectMeta withUserId(@Nullable final String userId) {
        return new K8sObjectMeta(name, namespace, cluster, gvk, userId);
    }

    public K8sObject withManifest(final JsonObject manifest) {
        return new K8sObject(this, manifest);
    }

    /**
     * A filter that matches exactly this object.
     */
    public K8sObjectFilter toFilter() {
        return K8sObjectFilter.builder(gvk)
                .name(name)
                .namespace(namespace)
                .cluster(cluster)
                .userId(userId)
                .build();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final K8sObjectMeta that = (K8sObjectMeta) o;
        return Objects.equals(name, that.name) &&
                Objects.equals(namespace, that.namespace) &&
                Objects.equals(cluster, that.cluster) &&
                Objects.equals(gvk, that.gvk) &&
                Objects.equals(userId, that.userId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, namespace, cluster, gvk, userId);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("cluster", cluster)
                .add("namespace", namespace)
                .add("gvk", gvk)
                .add("name", name)
                .add("userId", userId)
                .toString();
    }
}
