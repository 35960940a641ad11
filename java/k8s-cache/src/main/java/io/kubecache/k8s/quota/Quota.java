package io.kubecache.k8s.quota;

import javax.annotation.Nullable;
import java.util.Objects;

import com.google.common.base.MoreObjects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Hard ceiling on the resources requested by the workloads of one priority class.
 * <p>
 * Memory is in decimal gigabytes (10^9 bytes). The id is also the name of the paired PriorityClass.
 */
public final class Quota {
    @Nullable
    public final String id;
    public final double cpu;
    public final int memory;
    public final int gpu;
    public final GpuKind gpuKind;

    public Quota(@Nullable final String id, final double cpu, final int memory, final int gpu, final GpuKind gpuKind) {
        checkArgument(cpu >= 0, "cpu must not be negative");
        checkArgument(memory >= 0, "memory must not be negative");
        checkArgument(gpu >= 0, "gpu must not be negative");

        this.id = id;
        this.cpu = cpu;
        this.memory = memory;
        this.gpu = gpu;
        this.gpuKind = checkNotNull(gpuKind);
    }

    public Quota(final double cpu, final int memory, final int gpu) {
        this(null, cpu, memory, gpu, GpuKind.NVIDIA);
    }

    public Quota withId(final String id) {
        return new Quota(id, cpu, memory, gpu, gpuKind);
    }

    /**
     * Compares the limits only, ignoring the id.
     */
    public boolean sameLimits(final Quota other) {
        return Double.compare(cpu, other.cpu) == 0 &&
                memory == other.memory &&
                gpu == other.gpu &&
                gpuKind == other.gpuKind;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final Quota that = (Quota) o;
        return Objects.equals(id, that.id) && sameLimits(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, cpu, memory, gpu, gpuKind);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("cpu", cpu)
                .add("memory", memory)
                .add("gpu", gpu)
                .add("gpuKind", gpuKind)
                .toString();
    }
}
