package io.kubecache.k8s;

import javax.annotation.Nullable;
import java.util.Map;

import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonObject;
import io.kubecache.k8s.model.ClusterId;
import io.kubecache.k8s.model.GVK;
import io.kubecache.k8s.model.K8sObject;
import io.kubecache.k8s.model.Manifests;
import io.kubecache.k8s.watch.TrackedKinds;

public final class K8sTestObjects {
    private K8sTestObjects() {}

    public static JsonObject manifest(final GVK gvk, @Nullable final String namespace, final String name, final Map<String, String> labels) {
        final JsonObject manifest = new JsonObject();
        manifest.addProperty("apiVersion", gvk.groupVersion());
        manifest.addProperty("kind", gvk.kind);

        final JsonObject metadata = new JsonObject();
        metadata.addProperty("name", name);
        if (namespace != null) {
            metadata.addProperty("namespace", namespace);
        }
        metadata.add("labels", Manifests.toJsonObject(labels));
        manifest.add("metadata", metadata);

        return manifest;
    }

    public static K8sObject object(final ClusterId cluster, final GVK gvk, @Nullable final String namespace, final String name, final Map<String, String> labels) {
        return K8sObject.fromManifest(cluster, manifest(gvk, namespace, name, labels));
    }

    public static K8sObject object(final ClusterId cluster, final GVK gvk, @Nullable final String namespace, final String name) {
        return object(cluster, gvk, namespace, name, ImmutableMap.of());
    }

    /**
     * A session owned by {@code userId}, optionally with a {@code status.state}.
     */
    public static K8sObject session(final ClusterId cluster, final String namespace, final String name, final String userId, @Nullable final String state) {
        final JsonObject manifest = manifest(TrackedKinds.SESSION, namespace, name, ImmutableMap.of(TrackedKinds.USER_ID_LABEL, userId));

        if (state != null) {
            Manifests.getOrCreateObject(manifest, "status").addProperty("state", state);
        }

        return K8sObject.fromManifest(cluster, manifest);
    }

    public static K8sObject withResourceVersion(final K8sObject object, final String resourceVersion) {
        final JsonObject manifest = object.manifest();
        Manifests.getOrCreateObject(manifest, "metadata").addProperty("resourceVersion", resourceVersion);

        return new K8sObject(object.meta, manifest);
    }

    public static K8sObject withState(final K8sObject object, final String state) {
        final JsonObject manifest = object.manifest();
        Manifests.getOrCreateObject(manifest, "status").addProperty("state", state);

        return new K8sObject(object.meta, manifest);
    }

    public static K8sObject withDeletionTimestamp(final K8sObject object) {
        final JsonObject manifest = object.manifest();
        Manifests.getOrCreateObject(manifest, "metadata").addProperty("deletionTimestamp", "2024-01-01T00:00:00Z");

        return new K8sObject(object.meta, manifest);
    }
}
