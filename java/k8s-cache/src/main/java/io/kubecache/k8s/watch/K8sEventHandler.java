package io.kubecache.k8s.watch;

import javax.annotation.Nullable;

import io.kubecache.k8s.client.Cluster;
import io.kubecache.k8s.model.EventType;
import io.kubecache.k8s.model.K8sObject;

/**
 * Reacts to the watch events the watcher applied to the cache.
 * <p>
 * Events can be delivered again after a reconnect, implementations must tolerate that.
 * Exceptions are logged by the watcher and otherwise ignored.
 */
@FunctionalInterface
public interface K8sEventHandler {

    /**
     * @param previous the cached object before the event, if any
     * @param current the object as delivered, for deletions its last known state
     * @param eventType {@link EventType#DELETED} for deletions, including objects marked for deletion
     */
    void handle(@Nullable K8sObject previous, K8sObject current, Cluster cluster, EventType eventType);
}
