package io.kubecache.k8s.client;

import io.kubernetes.client.openapi.ApiException;

/**
 * Carries an {@link ApiException} out of an iterator, where checked exceptions can't be thrown.
 */
public class UncheckedApiException extends RuntimeException {
    public UncheckedApiException(final ApiException cause) {
        super(cause.getMessage(), cause);
    }

    @Override
    public synchronized ApiException getCause() {
        return (ApiException) super.getCause();
    }
}
