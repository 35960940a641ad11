package io.kubecache.metrics;

import com.google.common.base.MoreObjects;

/**
 * A size of session: CPU in cores, memory in GB, and a number of GPUs.
 */
public final class ResourceClass {
    public final int id;
    public final String name;
    public final double cpu;
    public final int memory;
    public final int gpu;

    public ResourceClass(final int id, final String name, final double cpu, final int memory, final int gpu) {
        this.id = id;
        this.name = name;
        this.cpu = cpu;
        this.memory = memory;
        this.gpu = gpu;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("name", name)
                .add("cpu", cpu)
                .add("memory", memory)
                .add("gpu", gpu)
                .toString();
    }
}
