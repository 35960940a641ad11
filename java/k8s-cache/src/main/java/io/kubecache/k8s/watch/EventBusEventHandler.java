package io.kubecache.k8s.watch;

import javax.annotation.Nullable;
import javax.inject.Inject;

import com.google.common.eventbus.EventBus;
import io.kubecache.k8s.client.Cluster;
import io.kubecache.k8s.model.EventType;
import io.kubecache.k8s.model.K8sObject;

/**
 * Fans watch events out to the subscribers of the {@link EventBus}.
 */
public class EventBusEventHandler implements K8sEventHandler {
    private final EventBus eventBus;

    @Inject
    public EventBusEventHandler(final EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Override
    public void handle(@Nullable final K8sObject previous, final K8sObject current, final Cluster cluster, final EventType eventType) {
        eventBus.post(new K8sObjectEvent(previous, current, cluster.id, eventType));
    }
}
