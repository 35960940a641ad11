package io.kubecache.metrics;

import java.util.HashMap;
import java.util.Map;

import com.google.common.collect.ImmutableMap;
import io.kubecache.errors.MissingResourceException;

public class InMemoryResourcePoolRepository implements ResourcePoolRepository {
    private final ImmutableMap<Integer, ResourcePool> poolsByClassId;
    private final ImmutableMap<Integer, ResourceClass> classesById;

    public InMemoryResourcePoolRepository(final Iterable<ResourcePool> pools) {
        final Map<Integer, ResourcePool> poolsByClassId = new HashMap<>();
        final Map<Integer, ResourceClass> classesById = new HashMap<>();

        for (final ResourcePool pool : pools) {
            for (final ResourceClass resourceClass : pool.classes) {
                if (classesById.put(resourceClass.id, resourceClass) != null) {
                    throw new IllegalArgumentException(String.format("Resource class %d is defined more than once.", resourceClass.id));
                }
                poolsByClassId.put(resourceClass.id, pool);
            }
        }

        this.poolsByClassId = ImmutableMap.copyOf(poolsByClassId);
        this.classesById = ImmutableMap.copyOf(classesById);
    }

    @Override
    public ResourcePool getResourcePoolFromClass(final int resourceClassId) {
        final ResourcePool pool = poolsByClassId.get(resourceClassId);

        if (pool == null) {
            throw new MissingResourceException(String.format("No resource pool contains resource class %d.", resourceClassId));
        }

        return pool;
    }

    @Override
    public ResourceClass getResourceClass(final int resourceClassId) {
        final ResourceClass resourceClass = classesById.get(resourceClassId);

        if (resourceClass == null) {
            throw new MissingResourceException(String.format("Resource class %d does not exist.", resourceClassId));
        }

        return resourceClass;
    }
}
