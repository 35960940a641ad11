package io.kubecache.k8s.model;

import javax.annotation.Nullable;
import java.util.Map;
import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

/**
 * Query predicate over cached or listed objects. Every unset field matches anything.
 * <p>
 * The label selector matches objects whose labels contain all of its entries.
 */
public final class K8sObjectFilter {
    @Nullable
    public final GVK gvk;
    @Nullable
    public final String name;
    @Nullable
    public final String namespace;
    @Nullable
    public final ClusterId cluster;
    @Nullable
    public final String userId;
    public final ImmutableMap<String, String> labelSelector;

    private K8sObjectFilter(final Builder builder) {
        this.gvk = builder.gvk;
        this.name = builder.name;
        this.namespace = builder.namespace;
        this.cluster = builder.cluster;
        this.userId = builder.userId;
        this.labelSelector = builder.labelSelector.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(final GVK gvk) {
        return new Builder().gvk(gvk);
    }

    public boolean matches(final K8sObject object) {
        final K8sObjectMeta meta = object.meta;

        if (gvk != null && !gvk.equals(meta.gvk)) return false;
        if (name != null && !name.equals(meta.name)) return false;
        if (namespace != null && !namespace.equals(meta.namespace)) return false;
        if (cluster != null && !cluster.equals(meta.cluster)) return false;
        if (userId != null && !userId.equals(meta.userId)) return false;

        return labelsMatch(object.labels());
    }

    public boolean labelsMatch(final Map<String, String> labels) {
        return labels.entrySet().containsAll(labelSelector.entrySet());
    }

    public Builder toBuilder() {
        final Builder builder = new Builder()
                .gvk(gvk)
                .name(name)
                .namespace(namespace)
                .cluster(cluster)
                .userId(userId);

        builder.labelSelector.putAll(labelSelector);

        return builder;
    }

    public static final class Builder {
        private GVK gvk;
        private String name;
        private String namespace;
        private ClusterId cluster;
        private String userId;
        private final ImmutableMap.Builder<String, String> labelSelector = ImmutableMap.builder();

        private Builder() {}

        public Builder gvk(@Nullable final GVK gvk) {
            this.gvk = gvk;
            return this;
        }

        public Builder name(@Nullable final String name) {
            this.name = name;
            return this;
        }

        public Builder namespace(@Nullable final String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder cluster(@Nullable final ClusterId cluster) {
            this.cluster = cluster;
            return this;
        }

        public Builder userId(@Nullable final String userId) {
            this.userId = userId;
            return this;
        }

        public Builder label(final String label, final String value) {
            this.labelSelector.put(label, value);
            return this;
        }

        public Builder labels(final Map<String, String> labels) {
            this.labelSelector.putAll(labels);
            return this;
        }

        public K8sObjectFilter build() {
            return new K8sObjectFilter(this);
        }
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final K8sObjectFilter that = (K8sObjectFilter) o;
        return Objects.equals(gvk, that.gvk) &&
                Objects.equals(name, that.name) &&
                Objects.equals(namespace, that.namespace) &&
                Objects.equals(cluster, that.cluster) &&
                Objects.equals(userId, that.userId) &&
                Objects.equals(labelSelector, that.labelSelector);
    }

    @Override
    public int hashCode() {
        return Objects.hash(gvk, name, namespace, cluster, userId, labelSelector);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("gvk", gvk)
                .add("name", name)
                .add("namespace", namespace)
                .add("cluster", cluster)
                .add("userId", userId)
                .add("labelSelector", labelSelector)
                .toString();
    }
}
