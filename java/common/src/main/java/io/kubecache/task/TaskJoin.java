package io.kubecache.task;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handle used to wait until a supervised task is no longer tracked as running.
 */
public final class TaskJoin {
    private static final long POLL_INTERVAL_MILLIS = 50;

    private final TaskSupervisor supervisor;
    private final TaskSupervisor.TaskContext context;

    TaskJoin(final TaskSupervisor supervisor, final TaskSupervisor.TaskContext context) {
        this.supervisor = supervisor;
        this.context = context;
    }

    public String name() {
        return context.name;
    }

    public boolean isDone() {
        return !supervisor.isTracked(context);
    }

    /**
     * Blocks until the task finished.
     *
     * @param maxWait how long to wait, zero or negative waits indefinitely
     * @throws TimeoutException if the task is still running after {@code maxWait}
     */
    public void join(final Duration maxWait) throws TimeoutException, InterruptedException {
        final boolean bounded = !maxWait.isZero() && !maxWait.isNegative();
        final long deadline = System.nanoTime() + (bounded ? maxWait.toNanos() : 0);

        while (!isDone()) {
            if (bounded && System.nanoTime() - deadline >= 0) {
                throw new TimeoutException(String.format("Task %s did not finish within %s.", context.name, maxWait));
            }

            TimeUnit.MILLISECONDS.sleep(POLL_INTERVAL_MILLIS);
        }
    }
}
