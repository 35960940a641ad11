package io.kubecache.k8s.watch;

import javax.annotation.Nullable;

import com.google.common.primitives.Longs;

/**
 * Resource versions are opaque strings. In practice they are increasing integers, which is relied upon only
 * to recognise events that are older than the cached state.
 */
final class ResourceVersions {
    private ResourceVersions() {}

    /**
     * @return true only if both versions are numeric and {@code candidate} is lower than {@code reference}
     */
    static boolean isOlder(@Nullable final String candidate, @Nullable final String reference) {
        if (candidate == null || reference == null) {
            return false;
        }

        final Long candidateVersion = Longs.tryParse(candidate);
        final Long referenceVersion = Longs.tryParse(reference);

        return candidateVersion != null && referenceVersion != null && candidateVersion < referenceVersion;
    }
}
