package io.kubecache.k8s.model;

import com.google.common.base.MoreObjects;

/**
 * One event delivered by a watch stream.
 */
public final class WatchEvent {
    public final EventType type;
    public final K8sObject object;

    public WatchEvent(final EventType type, final K8sObject object) {
        this.type = type;
        this.object = object;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("type", type)
                .add("object", object)
                .toString();
    }
}
