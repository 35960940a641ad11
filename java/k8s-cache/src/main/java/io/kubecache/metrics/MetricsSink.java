package io.kubecache.metrics;

import java.util.Map;

/**
 * Receives product metrics about the lifecycle of user sessions.
 */
public interface MetricsSink {
    void sessionStarted(String userId, Map<String, Object> metadata);

    void sessionResumed(String userId, Map<String, Object> metadata);

    void sessionHibernated(String userId, Map<String, Object> metadata);

    void sessionStopped(String userId, Map<String, Object> metadata);
}
