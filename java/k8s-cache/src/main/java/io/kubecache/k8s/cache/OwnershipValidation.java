package io.kubecache.k8s.cache;

import javax.validation.ValidationException;

import io.kubecache.k8s.model.K8sObject;

final class OwnershipValidation {
    private OwnershipValidation() {}

    static void requireUserId(final K8sObject object) {
        if (object.meta.userId == null) {
            throw new ValidationException(String.format("Cannot cache %s without a user id.", object.meta));
        }
    }
}
