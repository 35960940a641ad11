package io.kubecache.k8s.model;

/**
 * How the garbage collector treats dependents of a deleted object.
 */
public enum PropagationPolicy {
    /** Dependents are deleted before the owner disappears. */
    FOREGROUND("Foreground"),
    BACKGROUND("Background"),
    ORPHAN("Orphan");

    public final String wireValue;

    PropagationPolicy(final String wireValue) {
        this.wireValue = wireValue;
    }
}
