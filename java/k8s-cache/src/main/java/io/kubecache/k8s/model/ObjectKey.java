package io.kubecache.k8s.model;

import javax.annotation.Nullable;
import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * Identity of a cached object: cluster, namespace, type and name.
 */
public final class ObjectKey {
    public final ClusterId cluster;
    @Nullable
    public final String namespace;
    public final GVK gvk;
    public final String name;

    public ObjectKey(final ClusterId cluster, @Nullable final String namespace, final GVK gvk, final String name) {
        this.cluster = cluster;
        this.namespace = namespace;
        this.gvk = gvk;
        this.name = name;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final ObjectKey that = (ObjectKey) o;
        return Objects.equals(cluster, that.cluster) &&
                Objects.equals(namespace, that.namespace) &&
                Objects.equals(gvk, that.gvk) &&
                Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cluster, namespace, gvk, name);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("cluster", cluster)
                .add("namespace", namespace)
                .add("gvk", gvk)
                .add("name", name)
                .toString();
    }
}
