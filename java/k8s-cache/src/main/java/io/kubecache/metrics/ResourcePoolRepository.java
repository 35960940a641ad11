package io.kubecache.metrics;

import io.kubecache.errors.MissingResourceException;

/**
 * Read access to the resource pools sessions are launched from.
 */
public interface ResourcePoolRepository {
    /**
     * @throws MissingResourceException if no pool contains the class
     */
    ResourcePool getResourcePoolFromClass(int resourceClassId);

    /**
     * @throws MissingResourceException if the class doesn't exist
     */
    ResourceClass getResourceClass(int resourceClassId);
}
