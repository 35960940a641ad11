package io.kubecache.k8s.cache;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.google.common.collect.ImmutableList;
import io.kubecache.k8s.model.K8sObject;
import io.kubecache.k8s.model.K8sObjectFilter;
import io.kubecache.k8s.model.K8sObjectMeta;
import io.kubecache.k8s.model.ObjectKey;

public class InMemoryObjectCache implements ObjectCache {
    private final Map<ObjectKey, K8sObject> objects = new ConcurrentHashMap<>();

    @Override
    public void upsert(final K8sObject object) {
        OwnershipValidation.requireUserId(object);

        objects.put(object.meta.key(), object);
    }

    @Override
    public Optional<K8sObject> get(final K8sObjectMeta meta) {
        return Optional.ofNullable(objects.get(meta.key()));
    }

    @Override
    public void delete(final K8sObjectMeta meta) {
        objects.remove(meta.key());
    }

    @Override
    public Iterable<K8sObject> list(final K8sObjectFilter filter) {
        return objects.values().stream()
                .filter(filter::matches)
                .collect(ImmutableList.toImmutableList());
    }
}
