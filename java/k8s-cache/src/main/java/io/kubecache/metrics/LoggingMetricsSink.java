package io.kubecache.metrics;

import java.util.Map;

import io.kubecache.slf4j.MDC;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingMetricsSink implements MetricsSink {
    private static final Logger logger = LoggerFactory.getLogger(LoggingMetricsSink.class);

    @Override
    public void sessionStarted(final String userId, final Map<String, Object> metadata) {
        log("session_started", userId, metadata);
    }

    @Override
    public void sessionResumed(final String userId, final Map<String, Object> metadata) {
        log("session_resumed", userId, metadata);
    }

    @Override
    public void sessionHibernated(final String userId, final Map<String, Object> metadata) {
        log("session_hibernated", userId, metadata);
    }

    @Override
    public void sessionStopped(final String userId, final Map<String, Object> metadata) {
        log("session_stopped", userId, metadata);
    }

    private static void log(final String event, final String userId, final Map<String, Object> metadata) {
        try (@SuppressWarnings("unused") final MDC.MDCCloseable _userMDC = MDC.put("User", userId)) {
            logger.info("Metrics event {} {}", event, metadata);
        }
    }
}
