package io.kubecache.k8s.watch;

import java.time.Duration;
import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import static com.google.common.base.Preconditions.checkArgument;

public class WatcherConfig {
    public final Duration syncPeriod;
    public final Duration reconnectDelay;
    public final Duration stopTimeout;
    public final ImmutableList<TrackedKind> kinds;

    public WatcherConfig(final Duration syncPeriod,
                         final Duration reconnectDelay,
                         final Duration stopTimeout,
                         final List<TrackedKind> kinds) {
        checkArgument(syncPeriod.compareTo(Duration.ofMillis(10)) >= 0, "sync period is too short");
        checkArgument(!reconnectDelay.isZero() && !reconnectDelay.isNegative(), "reconnect delay must be positive");

        this.syncPeriod = syncPeriod;
        this.reconnectDelay = reconnectDelay;
        this.stopTimeout = stopTimeout;
        this.kinds = ImmutableList.copyOf(kinds);
    }

    public static WatcherConfig defaults() {
        return new WatcherConfig(Duration.ofSeconds(600), Duration.ofSeconds(10), Duration.ofSeconds(10), TrackedKinds.defaults());
    }

    /**
     * How often the periodic sync checks whether a full sync is due.
     */
    public Duration pollInterval() {
        return syncPeriod.dividedBy(10);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("syncPeriod", syncPeriod)
                .add("reconnectDelay", reconnectDelay)
                .add("stopTimeout", stopTimeout)
                .add("kinds", kinds)
                .toString();
    }
}
