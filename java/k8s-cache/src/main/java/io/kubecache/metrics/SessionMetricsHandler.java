package io.kubecache.metrics;

import javax.annotation.Nullable;
import javax.inject.Inject;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;
import com.google.common.eventbus.Subscribe;
import com.google.common.primitives.Ints;
import io.kubecache.guava.EventBusSubscriber;
import io.kubecache.k8s.model.EventType;
import io.kubecache.k8s.model.K8sObject;
import io.kubecache.k8s.model.Manifests;
import io.kubecache.k8s.watch.K8sObjectEvent;
import io.kubecache.k8s.watch.TrackedKinds;
import io.kubecache.slf4j.MDC;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives session lifecycle transitions from the watch events of session objects and reports them to the {@link MetricsSink}.
 * <p>
 * A session is started when it turns {@code Running} for the first time or after {@code NotReady},
 * resumed when it leaves {@code Hibernated}, and stopped when it is deleted.
 */
@EventBusSubscriber
public class SessionMetricsHandler {
    private static final Logger logger = LoggerFactory.getLogger(SessionMetricsHandler.class);

    public static final String RESOURCE_CLASS_ANNOTATION = "kubecache.io/resource-class-id";

    private final MetricsSink metrics;
    private final ResourcePoolRepository resourcePools;

    @Inject
    public SessionMetricsHandler(final MetricsSink metrics, final ResourcePoolRepository resourcePools) {
        this.metrics = metrics;
        this.resourcePools = resourcePools;
    }

    @Subscribe
    void handleObjectEvent(final K8sObjectEvent event) {
        if (!event.current.meta.gvk.equals(TrackedKinds.SESSION) || event.current.meta.userId == null) {
            return;
        }

        try (@SuppressWarnings("unused") final MDC.MDCCloseable _sessionMDC = MDC.put("Cluster", event.cluster.toString()).andPut("Object", event.current.meta.name)) {
            collect(event.previous, event.current, event.eventType);

        } catch (final RuntimeException e) {
            logger.error("Failed to track metrics for {} of session {}.", event.eventType, event.current.meta.name, e);
        }
    }

    void collect(@Nullable final K8sObject previous, final K8sObject current, final EventType eventType) {
        final String userId = current.meta.userId;
        final ImmutableMap<String, Object> sessionId = ImmutableMap.of("session_id", current.meta.name);

        if (eventType == EventType.DELETED) {
            // a session marked for deletion is already gone from the cache when the final DELETED arrives
            if (previous != null) {
                metrics.sessionStopped(userId, sessionId);
            }
            return;
        }

        // an unrecognised previous state is not the same as none
        final Optional<String> previousWireState = previous == null ? Optional.empty() : wireStateOf(previous);
        final Optional<SessionState> previousState = previousWireState.flatMap(SessionState::fromWireValue);
        final Optional<SessionState> state = stateOf(current);

        if (!state.isPresent()) {
            return;
        }

        switch (state.get()) {
            case RUNNING:
                if (!previousWireState.isPresent() || previousState.equals(Optional.of(SessionState.NOT_READY))) {
                    metrics.sessionStarted(userId, startedMetadata(current));
                    return;
                }
                if (previousState.equals(Optional.of(SessionState.HIBERNATED))) {
                    metrics.sessionResumed(userId, sessionId);
                }
                return;

            case NOT_READY:
                if (previousState.isPresent() && previousState.get() == SessionState.HIBERNATED) {
                    metrics.sessionResumed(userId, sessionId);
                }
                return;

            case HIBERNATED:
                if (!previousState.isPresent() || previousState.get() != SessionState.HIBERNATED) {
                    metrics.sessionHibernated(userId, sessionId);
                }
                return;

            default:
        }
    }

    private ImmutableMap<String, Object> startedMetadata(final K8sObject session) {
        final String annotation = session.annotations().get(RESOURCE_CLASS_ANNOTATION);
        final Integer resourceClassId = annotation == null ? null : Ints.tryParse(annotation.trim());

        if (resourceClassId == null) {
            throw new IllegalStateException(String.format("Session %s has no valid %s annotation: %s", session.meta.name, RESOURCE_CLASS_ANNOTATION, annotation));
        }

        final ResourcePool pool = resourcePools.getResourcePoolFromClass(resourceClassId);
        final ResourceClass resourceClass = resourcePools.getResourceClass(resourceClassId);

        return ImmutableMap.<String, Object>builder()
                .put("cpu", (int) (resourceClass.cpu * 1000))
                .put("memory", resourceClass.memory)
                .put("gpu", resourceClass.gpu)
                .put("storage", Manifests.getString(session.manifest(), "spec", "session", "storage", "size").orElse(""))
                .put("resource_class_id", resourceClassId)
                .put("resource_pool_id", pool.id == null ? "" : pool.id)
                .put("resource_class_name", pool.name + "." + resourceClass.name)
                .put("session_id", session.meta.name)
                .build();
    }

    private static Optional<SessionState> stateOf(final K8sObject session) {
        return wireStateOf(session).flatMap(SessionState::fromWireValue);
    }

    private static Optional<String> wireStateOf(final K8sObject session) {
        return Manifests.getString(session.manifest(), "status", "state");
    }
}
