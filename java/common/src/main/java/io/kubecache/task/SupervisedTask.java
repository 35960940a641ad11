package io.kubecache.task;

/**
 * A long-running routine run by the {@link TaskSupervisor}.
 * <p>
 * Throwing from {@link #run()} makes the supervisor restart the routine (with a fresh instance from its
 * {@link TaskFactory}) after a back-off delay. Returning normally ends the task for good.
 */
@FunctionalInterface
public interface SupervisedTask {

    void run() throws Exception;

    /**
     * Invoked on cancellation, in addition to interrupting the thread running {@link #run()}.
     * Routines blocked in I/O that ignores interrupts (e.g. a socket read) close their resources here.
     */
    default void triggerCancel() {}
}
