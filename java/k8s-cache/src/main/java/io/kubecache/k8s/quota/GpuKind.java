package io.kubecache.k8s.quota;

import java.util.Optional;

public enum GpuKind {
    NVIDIA("nvidia.com"),
    AMD("amd.com");

    /** Domain of the extended resource, as in {@code nvidia.com/gpu}. */
    public final String domain;

    GpuKind(final String domain) {
        this.domain = domain;
    }

    /**
     * Key of the hard limit on requested GPUs of this kind in a ResourceQuota.
     */
    public String hardLimitKey() {
        return "requests." + domain + "/gpu";
    }

    public static Optional<GpuKind> fromDomain(final String domain) {
        for (final GpuKind kind : values()) {
            if (kind.domain.equals(domain)) {
                return Optional.of(kind);
            }
        }

        return Optional.empty();
    }
}
