package io.kubecache.k8s.watch;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import io.kubecache.k8s.model.ClusterId;
import io.kubecache.k8s.model.EventType;
import io.kubecache.k8s.model.K8sObject;

/**
 * Posted to the {@link com.google.common.eventbus.EventBus} for every watch event applied to the cache.
 */
public class K8sObjectEvent {
    @Nullable
    public final K8sObject previous;
    public final K8sObject current;
    public final ClusterId cluster;
    public final EventType eventType;

    public K8sObjectEvent(@Nullable final K8sObject previous, final K8sObject current, final ClusterId cluster, final EventType eventType) {
        this.previous = previous;
        this.current = current;
        this.cluster = cluster;
        this.eventType = eventType;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("eventType", eventType)
                .add("cluster", cluster)
                .add("current", current)
                .toString();
    }
}
