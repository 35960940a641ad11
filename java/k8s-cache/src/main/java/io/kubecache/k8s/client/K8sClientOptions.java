package io.kubecache.k8s.client;

import java.time.Duration;

import com.google.common.base.MoreObjects;

/**
 * Timeouts and paging of live cluster connections.
 */
public class K8sClientOptions {
    /** Connect, read and write timeout of ordinary API calls. */
    public Duration requestTimeout = Duration.ofSeconds(10);

    /** Read timeout of watch streams. A stream that stays silent for longer is considered dead. */
    public Duration watchReadTimeout = Duration.ofMinutes(5);

    /** Asks the server to end a watch after this long, must be below {@link #watchReadTimeout}. */
    public Duration watchServerTimeout = Duration.ofMinutes(4);

    public int pageSize = 500;

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("requestTimeout", requestTimeout)
                .add("watchReadTimeout", watchReadTimeout)
                .add("watchServerTimeout", watchServerTimeout)
                .add("pageSize", pageSize)
                .toString();
    }
}
