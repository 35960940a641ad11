package io.kubecache.metrics;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

public final class ResourcePool {
    @Nullable
    public final Integer id;
    public final String name;
    public final ImmutableList<ResourceClass> classes;

    public ResourcePool(@Nullable final Integer id, final String name, final Iterable<ResourceClass> classes) {
        this.id = id;
        this.name = name;
        this.classes = ImmutableList.copyOf(classes);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("name", name)
                .add("classes", classes)
                .toString();
    }
}
