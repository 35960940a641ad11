package io.kubecache.logback;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxy;
import ch.qos.logback.core.pattern.DynamicConverter;
import io.kubecache.k8s.client.UncheckedApiException;
import io.kubernetes.client.openapi.ApiException;

/**
 * Renders the HTTP response of any {@link ApiException} in the cause chain of the logged exception,
 * including those wrapped by {@link UncheckedApiException}.
 */
public class ExceptionDetailsConverter extends DynamicConverter<ILoggingEvent> {
    @Override
    public String convert(final ILoggingEvent event) {
        final IThrowableProxy throwableProxy = event.getThrowableProxy();

        if (!(throwableProxy instanceof ThrowableProxy))
            return "";

        Throwable throwable = ((ThrowableProxy) throwableProxy).getThrowable();

        final StringBuilder output = new StringBuilder();

        while (throwable != null) {
            if (throwable instanceof ApiException) {
                final ApiException apiException = (ApiException) throwable;

                output.append(String.format("Kubernetes API response of %s:%n", apiException.getClass().getSimpleName()));
                output.append(String.format("\tcode: %d%n", apiException.getCode()));
                output.append(String.format("\theaders: %s%n", apiException.getResponseHeaders()));
                output.append(String.format("\tbody: %s%n", apiException.getResponseBody()));
            }

            throwable = throwable.getCause();
        }

        return output.toString();
    }
}
