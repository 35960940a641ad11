package io.kubecache.k8s.cache;

import java.util.Optional;

import io.kubecache.k8s.model.K8sObject;
import io.kubecache.k8s.model.K8sObjectFilter;
import io.kubecache.k8s.model.K8sObjectMeta;

/**
 * Local mirror of cluster objects, keyed by cluster, namespace, group, version, kind and name.
 * <p>
 * Each call is atomic on its own. Sequences of calls are not, concurrent writers of the same object
 * simply overwrite each other. Storage failures surface as {@link ObjectCacheException}.
 */
public interface ObjectCache {

    /**
     * Inserts the object or replaces the stored copy with the same identity.
     *
     * @throws javax.validation.ValidationException if the object has no user id
     */
    void upsert(K8sObject object);

    Optional<K8sObject> get(K8sObjectMeta meta);

    /**
     * Removes the object. Removing an object that isn't cached does nothing.
     */
    void delete(K8sObjectMeta meta);

    Iterable<K8sObject> list(K8sObjectFilter filter);
}
