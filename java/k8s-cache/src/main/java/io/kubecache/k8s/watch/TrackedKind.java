package io.kubecache.k8s.watch;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.google.common.base.MoreObjects;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import io.kubecache.k8s.model.GVK;
import io.kubecache.k8s.model.K8sObject;

/**
 * A kind mirrored by the watcher, together with how to find the user owning its objects.
 */
public final class TrackedKind {
    /** Owner of objects that don't belong to a user, e.g. quotas and priority classes. */
    public static final String SYSTEM_USER_ID = "system";

    public final GVK gvk;
    public final boolean namespaced;

    /** Label holding the owning user id, {@code null} if objects of this kind are owned by {@link #SYSTEM_USER_ID}. */
    @Nullable
    public final String ownerLabel;

    public TrackedKind(final GVK gvk, final boolean namespaced, @Nullable final String ownerLabel) {
        this.gvk = gvk;
        this.namespaced = namespaced;
        this.ownerLabel = ownerLabel;
    }

    public static TrackedKind userOwned(final GVK gvk, final String ownerLabel) {
        return new TrackedKind(gvk, true, ownerLabel);
    }

    public static TrackedKind system(final GVK gvk, final boolean namespaced) {
        return new TrackedKind(gvk, namespaced, null);
    }

    /**
     * Parses {@code <apiVersion>/<Kind>[,owner=<label>][,cluster-scoped]},
     * e.g. {@code scheduling.k8s.io/v1/PriorityClass,cluster-scoped}.
     */
    public static TrackedKind parse(final String value) {
        final List<String> parts = Splitter.on(',').trimResults().omitEmptyStrings().splitToList(value);

        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Empty kind definition.");
        }

        final String type = parts.get(0);
        final int slash = type.lastIndexOf('/');

        if (slash <= 0 || slash == type.length() - 1) {
            throw new IllegalArgumentException(String.format("Kind %s is not of the form <apiVersion>/<Kind>.", type));
        }

        final GVK gvk = GVK.fromApiVersion(type.substring(0, slash), type.substring(slash + 1));

        String ownerLabel = null;
        boolean namespaced = true;

        for (final String option : parts.subList(1, parts.size())) {
            if (option.equals("cluster-scoped")) {
                namespaced = false;
            } else if (option.startsWith("owner=") && option.length() > "owner=".length()) {
                ownerLabel = option.substring("owner=".length());
            } else {
                throw new IllegalArgumentException(String.format("Unknown option %s of kind %s.", option, type));
            }
        }

        return new TrackedKind(gvk, namespaced, ownerLabel);
    }

    /**
     * @return the owning user id, empty if the object lacks the owner label
     */
    public Optional<String> userIdOf(final K8sObject object) {
        if (ownerLabel == null) {
            return Optional.of(SYSTEM_USER_ID);
        }

        return Optional.ofNullable(Strings.emptyToNull(object.labels().get(ownerLabel)));
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final TrackedKind that = (TrackedKind) o;
        return namespaced == that.namespaced &&
                Objects.equals(gvk, that.gvk) &&
                Objects.equals(ownerLabel, that.ownerLabel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(gvk, namespaced, ownerLabel);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("gvk", gvk)
                .add("namespaced", namespaced)
                .add("ownerLabel", ownerLabel)
                .toString();
    }
}
