package io.kubecache.k8s.model;

import javax.annotation.Nullable;
import java.util.Locale;
import java.util.Objects;

import com.google.common.base.Strings;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Group, version and kind of a Kubernetes object type. A {@code null} group is the core API group.
 */
public final class GVK {
    @Nullable
    public final String group;
    public final String version;
    public final String kind;

    public GVK(@Nullable final String group, final String version, final String kind) {
        checkArgument(!Strings.isNullOrEmpty(version), "version is required");
        checkArgument(!Strings.isNullOrEmpty(kind), "kind is required");

        this.group = normaliseGroup(group);
        this.version = version;
        this.kind = kind;
    }

    public static GVK core(final String version, final String kind) {
        return new GVK(null, version, kind);
    }

    /**
     * @param apiVersion {@code group/version}, or just {@code version} for the core group
     */
    public static GVK fromApiVersion(final String apiVersion, final String kind) {
        checkArgument(!Strings.isNullOrEmpty(apiVersion), "apiVersion is required");

        final int slash = apiVersion.lastIndexOf('/');

        if (slash < 0) {
            return new GVK(null, apiVersion, kind);
        }

        return new GVK(apiVersion.substring(0, slash), apiVersion.substring(slash + 1), kind);
    }

    @Nullable
    private static String normaliseGroup(@Nullable final String group) {
        if (Strings.isNullOrEmpty(group) || group.equals("core")) {
            return null;
        }

        return group;
    }

    public String groupVersion() {
        return group == null ? version : group + "/" + version;
    }

    /**
     * The group as used in API paths, empty for the core group.
     */
    public String apiGroup() {
        return Strings.nullToEmpty(group);
    }

    /**
     * Resource name used in API paths, e.g. {@code resourcequotas} or {@code priorityclasses}.
     */
    public String plural() {
        final String lower = kind.toLowerCase(Locale.ROOT);

        return lower.endsWith("s") ? lower + "es" : lower + "s";
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final GVK that = (GVK) o;
        return Objects.equals(group, that.group) &&
                Objects.equals(version, that.version) &&
                Objects.equals(kind, that.kind);
    }

    @Override
    public int hashCode() {
        return Objects.hash(group, version, kind);
    }

    @Override
    public String toString() {
        return groupVersion() + "/" + kind;
    }
}
