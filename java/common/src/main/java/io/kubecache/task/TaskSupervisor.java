package io.kubecache.task;

import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.inject.Inject;
import javax.inject.Named;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.AbstractIdleService;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.kubecache.slf4j.MDC;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs named long-lived routines, restarting them with exponential back-off when they fail.
 * <p>
 * Names are unique: starting a task whose name is already running is a logged no-op.
 * A task leaves the running set when its routine returns normally, or when it stops after
 * {@link #cancel(String) cancellation}. Stopping the service cancels every task and waits a
 * bounded amount of time for them.
 */
public class TaskSupervisor extends AbstractIdleService {
    private static final Logger logger = LoggerFactory.getLogger(TaskSupervisor.class);

    private final Object lock = new Object();

    @GuardedBy("lock")
    private final Map<String, TaskContext> runningTasks = new HashMap<>();

    private final ExecutorService executorService;
    private final BackoffPolicy backoffPolicy;
    private final Duration stopTimeout;

    @Inject
    public TaskSupervisor(final @Named("maxRetryWait") Duration maxRetryWait,
                          final @Named("taskStopTimeout") Duration stopTimeout) {
        this(BackoffPolicy.exponential(maxRetryWait), stopTimeout);
    }

    public TaskSupervisor(final BackoffPolicy backoffPolicy, final Duration stopTimeout) {
        this.backoffPolicy = backoffPolicy;
        this.stopTimeout = stopTimeout;

        this.executorService = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("supervised-task-%d")
                .setDaemon(true)
                .build());
    }

    static final class TaskContext {
        final String name;
        final Instant startedAt;

        @GuardedBy("lock")
        int restarts;

        @GuardedBy("lock")
        boolean cancelled;

        @GuardedBy("lock")
        @Nullable
        Thread thread;

        @GuardedBy("lock")
        @Nullable
        SupervisedTask current;

        TaskContext(final String name, final Instant startedAt) {
            this.name = name;
            this.startedAt = startedAt;
        }

        TaskView view() {
            return new TaskView(name, startedAt, restarts);
        }
    }

    @Override
    protected void startUp() throws Exception {}

    @Override
    protected void shutDown() throws Exception {
        final List<TaskJoin> joins = cancelAll();
        final long deadline = System.nanoTime() + stopTimeout.toNanos();

        for (final TaskJoin join : joins) {
            final Duration remaining = Duration.ofNanos(Math.max(deadline - System.nanoTime(), 1));

            try {
                join.join(remaining);

            } catch (final TimeoutException e) {
                logger.error("{}: task did not stop within {}, it is stuck.", join.name(), stopTimeout);
            }
        }

        executorService.shutdownNow();
    }

    public void startAll(final TaskDefinitions definitions) {
        definitions.tasks().forEach(this::start);
    }

    /**
     * Starts the task unless a task with the same name is already running.
     */
    public void start(final String name, final TaskFactory factory) {
        final TaskContext context;

        synchronized (lock) {
            if (runningTasks.containsKey(name)) {
                logger.warn("{}: not starting task, it is already running.", name);
                return;
            }

            context = new TaskContext(name, Instant.now());
            runningTasks.put(name, context);
        }

        logger.info("{}: Starting.", name);

        try {
            executorService.execute(() -> runSupervised(context, factory));

        } catch (final RejectedExecutionException e) {
            removeRunning(context);
            throw e;
        }
    }

    /**
     * Requests cancellation of the named task. The task stays tracked until it actually stopped.
     *
     * @return a handle to wait for the task to stop, or empty if no such task is running
     */
    public Optional<TaskJoin> cancel(final String name) {
        final TaskContext context;
        final SupervisedTask current;

        synchronized (lock) {
            context = runningTasks.get(name);

            if (context == null) {
                return Optional.empty();
            }

            context.cancelled = true;
            current = context.current;

            // interrupt under the lock, the thread is released back to the pool only after it cleared context.thread
            if (context.thread != null) {
                context.thread.interrupt();
            }
        }

        logger.info("{}: Cancelling task.", name);

        if (current != null) {
            try {
                current.triggerCancel();

            } catch (final RuntimeException e) {
                logger.warn("{}: Cancellation hook failed.", name, e);
            }
        }

        return Optional.of(new TaskJoin(this, context));
    }

    public List<TaskJoin> cancelAll() {
        final List<String> names;

        synchronized (lock) {
            names = ImmutableList.copyOf(runningTasks.keySet());
        }

        final List<TaskJoin> joins = new ArrayList<>();

        for (final String name : names) {
            cancel(name).ifPresent(joins::add);
        }

        return joins;
    }

    public Optional<TaskJoin> getTaskJoin(final String name) {
        synchronized (lock) {
            return Optional.ofNullable(runningTasks.get(name)).map(context -> new TaskJoin(this, context));
        }
    }

    public Optional<TaskView> getTaskView(final String name) {
        synchronized (lock) {
            return Optional.ofNullable(runningTasks.get(name)).map(TaskContext::view);
        }
    }

    public List<TaskView> taskViews() {
        synchronized (lock) {
            return runningTasks.values().stream()
                    .map(TaskContext::view)
                    .collect(ImmutableList.toImmutableList());
        }
    }

    public boolean isRunning(final String name) {
        synchronized (lock) {
            return runningTasks.containsKey(name);
        }
    }

    boolean isTracked(final TaskContext context) {
        synchronized (lock) {
            return runningTasks.get(context.name) == context;
        }
    }

    private void runSupervised(final TaskContext context, final TaskFactory factory) {
        try (@SuppressWarnings("unused") final MDC.MDCCloseable _taskMDC = MDC.put("Task", context.name)) {
            if (!attach(context)) {
                return;
            }

            while (true) {
                final SupervisedTask task = factory.create();

                if (!setCurrent(context, task)) {
                    logger.info("{}: Cancelled before (re)start.", context.name);
                    return;
                }

                try {
                    task.run();

                    logger.info("{}: Finished in {}s.", context.name, Duration.between(context.startedAt, Instant.now()).getSeconds());
                    return;

                } catch (final InterruptedException e) {
                    logger.info("{}: Interrupted, stopping.", context.name);
                    return;

                } catch (final Exception e) {
                    if (isCancelled(context)) {
                        logger.info("{}: Stopped after cancellation ({}).", context.name, e.toString());
                        return;
                    }

                    final int restarts = incrementRestarts(context);
                    final Duration delay = backoffPolicy.delayBeforeRestart(restarts);

                    logger.error("{}: Failed. Restarting it in {}ms for the {}. time.", context.name, delay.toMillis(), restarts + 1, e);

                    try {
                        TimeUnit.MILLISECONDS.sleep(delay.toMillis());

                    } catch (final InterruptedException ie) {
                        logger.info("{}: Interrupted while waiting to restart, stopping.", context.name);
                        return;
                    }
                }
            }

        } finally {
            detach(context);
            removeRunning(context);
        }
    }

    private boolean attach(final TaskContext context) {
        synchronized (lock) {
            if (context.cancelled) {
                return false;
            }

            context.thread = Thread.currentThread();
            return true;
        }
    }

    private void detach(final TaskContext context) {
        synchronized (lock) {
            context.thread = null;
            context.current = null;

            // don't leak a pending interrupt into the next task using this pool thread
            Thread.interrupted();
        }
    }

    private boolean setCurrent(final TaskContext context, final SupervisedTask task) {
        synchronized (lock) {
            if (context.cancelled) {
                return false;
            }

            context.current = task;
            return true;
        }
    }

    private boolean isCancelled(final TaskContext context) {
        synchronized (lock) {
            return context.cancelled;
        }
    }

    private int incrementRestarts(final TaskContext context) {
        synchronized (lock) {
            return context.restarts++;
        }
    }

    private void removeRunning(final TaskContext context) {
        synchronized (lock) {
            if (runningTasks.get(context.name) == context) {
                runningTasks.remove(context.name);
                logger.debug("{}: Removed from running set.", context.name);
            } else {
                logger.warn("{}: Task was expected in running state, but is not found.", context.name);
            }
        }
    }
}
