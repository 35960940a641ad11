package io.kubecache.task;

import java.time.Duration;

import static com.google.common.base.Preconditions.checkArgument;

@FunctionalInterface
public interface BackoffPolicy {

    /**
     * @param restarts how many times the task has been restarted before this restart
     * @return the delay to wait before restarting
     */
    Duration delayBeforeRestart(int restarts);

    /**
     * {@code min(2^restarts, maxWait)} seconds, i.e. 1s, 2s, 4s... saturating at {@code maxWait}.
     */
    static BackoffPolicy exponential(final Duration maxWait) {
        checkArgument(!maxWait.isNegative(), "maxWait must not be negative");

        return restarts -> {
            checkArgument(restarts >= 0, "restarts must not be negative");

            if (restarts >= 62) {
                return maxWait;
            }

            final Duration delay = Duration.ofSeconds(1L << restarts);

            return delay.compareTo(maxWait) < 0 ? delay : maxWait;
        };
    }

    static BackoffPolicy fixed(final Duration delay) {
        return restarts -> delay;
    }
}
