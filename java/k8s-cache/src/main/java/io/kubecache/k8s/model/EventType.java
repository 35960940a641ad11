package io.kubecache.k8s.model;

public enum EventType {
    ADDED,
    MODIFIED,
    DELETED
}
