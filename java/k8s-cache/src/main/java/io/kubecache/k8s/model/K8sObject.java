package io.kubecache.k8s.model;

import javax.annotation.Nullable;
import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonObject;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A Kubernetes object as observed in a cluster: its identity plus the raw manifest.
 * <p>
 * The manifest is copied on the way in and out, instances are immutable.
 */
public final class K8sObject {
    public final K8sObjectMeta meta;
    private final JsonObject manifest;

    public K8sObject(final K8sObjectMeta meta, final JsonObject manifest) {
        this.meta = checkNotNull(meta);
        this.manifest = manifest.deepCopy();
    }

    /**
     * Reads the identity of the object from its manifest.
     *
     * @throws IllegalArgumentException if {@code apiVersion}, {@code kind} or {@code metadata.name} are missing
     */
    public static K8sObject fromManifest(final ClusterId cluster, final JsonObject manifest) {
        final String apiVersion = Manifests.getString(manifest, "apiVersion")
                .orElseThrow(() -> new IllegalArgumentException("Manifest has no apiVersion."));
        final String kind = Manifests.getString(manifest, "kind")
                .orElseThrow(() -> new IllegalArgumentException("Manifest has no kind."));
        final String name = Manifests.getString(manifest, "metadata", "name")
                .orElseThrow(() -> new IllegalArgumentException("Manifest has no metadata.name."));
        final String namespace = Manifests.getString(manifest, "metadata", "namespace").orElse(null);

        return new K8sObject(new K8sObjectMeta(name, namespace, cluster, GVK.fromApiVersion(apiVersion, kind)), manifest);
    }

    public JsonObject manifest() {
        return manifest.deepCopy();
    }

    public K8sObject withUserId(@Nullable final String userId) {
        return new K8sObject(meta.withUserId(userId), manifest);
    }

    public ImmutableMap<String, String> labels() {
        return Manifests.stringMap(manifest, "metadata", "labels");
    }

    public ImmutableMap<String, String> annotations() {
        return Manifests.stringMap(manifest, "metadata", "annotations");
    }

    @Nullable
    public String resourceVersion() {
        return Manifests.getString(manifest, "metadata", "resourceVersion").orElse(null);
    }

    @Nullable
    public String uid() {
        return Manifests.getString(manifest, "metadata", "uid").orElse(null);
    }

    public boolean isBeingDeleted() {
        return Manifests.get(manifest, "metadata", "deletionTimestamp").isPresent();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final K8sObject that = (K8sObject) o;
        return Objects.equals(meta, that.meta) &&
                Objects.equals(manifest, that.manifest);
    }

    @Override
    public int hashCode() {
        return Objects.hash(meta, manifest);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("meta", meta)
                .add("resourceVersion", resourceVersion())
                .toString();
    }
}
