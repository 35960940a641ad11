package io.kubecache.metrics;

import java.util.Optional;

/**
 * Values of {@code status.state} of a session object.
 */
public enum SessionState {
    RUNNING("Running"),
    NOT_READY("NotReady"),
    HIBERNATED("Hibernated"),
    FAILED("Failed"),
    RUNNING_DEGRADED("RunningDegraded");

    public final String wireValue;

    SessionState(final String wireValue) {
        this.wireValue = wireValue;
    }

    public static Optional<SessionState> fromWireValue(final String wireValue) {
        for (final SessionState state : values()) {
            if (state.wireValue.equals(wireValue)) {
                return Optional.of(state);
            }
        }

        return Optional.empty();
    }
}
