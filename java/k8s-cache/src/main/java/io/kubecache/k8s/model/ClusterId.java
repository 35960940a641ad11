package io.kubecache.k8s.model;

import java.util.Objects;

import com.google.common.base.Strings;

import static com.google.common.base.Preconditions.checkArgument;

public final class ClusterId implements Comparable<ClusterId> {
    /**
     * The cluster the process itself is configured against. Listing errors are fatal for this cluster only.
     */
    public static final ClusterId DEFAULT = new ClusterId("default");

    public final String id;

    private ClusterId(final String id) {
        checkArgument(!Strings.isNullOrEmpty(id), "cluster id must not be empty");
        this.id = id;
    }

    public static ClusterId of(final String id) {
        return DEFAULT.id.equals(id) ? DEFAULT : new ClusterId(id);
    }

    public boolean isDefault() {
        return DEFAULT.equals(this);
    }

    @Override
    public int compareTo(final ClusterId o) {
        return id.compareTo(o.id);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((ClusterId) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return id;
    }
}
