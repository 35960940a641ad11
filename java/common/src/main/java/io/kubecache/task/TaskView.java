package io.kubecache.task;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * Read-only snapshot of a supervised task.
 */
public final class TaskView {
    public final String name;
    public final Instant startedAt;
    public final int restartCount;

    public TaskView(final String name, final Instant startedAt, final int restartCount) {
        this.name = name;
        this.startedAt = startedAt;
        this.restartCount = restartCount;
    }

    public Duration runningTime(final Instant reference) {
        return Duration.between(startedAt, reference);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final TaskView that = (TaskView) o;
        return restartCount == that.restartCount &&
                Objects.equals(name, that.name) &&
                Objects.equals(startedAt, that.startedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, startedAt, restartCount);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("name", name)
                .add("startedAt", startedAt)
                .add("restartCount", restartCount)
                .toString();
    }
}
