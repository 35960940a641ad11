package io.kubecache.slf4j;

import javax.annotation.Nullable;
import java.io.Closeable;

/**
 * try-with-resources friendly wrapper around {@link org.slf4j.MDC}.
 * Closing restores whatever value each key held before, so scopes can nest.
 */
public final class MDC {
    private MDC() {}

    public static class MDCCloseable implements Closeable {
        private final String key;
        private final String previousValue;
        private final MDCCloseable next;

        private MDCCloseable(final String key, @Nullable final String value, @Nullable final MDCCloseable next) {
            this.key = key;
            this.previousValue = org.slf4j.MDC.get(key);
            this.next = next;

            set(key, value);
        }

        @Override
        public void close() {
            set(key, previousValue);

            if (next != null) {
                next.close();
            }
        }

        public MDCCloseable andPut(final String key, @Nullable final Object value) {
            return new MDCCloseable(key, value == null ? null : value.toString(), this);
        }
    }

    public static MDCCloseable put(final String key, @Nullable final Object value) {
        return new MDCCloseable(key, value == null ? null : value.toString(), null);
    }

    private static void set(final String key, @Nullable final String value) {
        if (value == null) {
            org.slf4j.MDC.remove(key);
        } else {
            org.slf4j.MDC.put(key, value);
        }
    }
}
