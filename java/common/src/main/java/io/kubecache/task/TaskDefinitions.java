package io.kubecache.task;

import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * A named set of task factories, started together with {@link TaskSupervisor#startAll(TaskDefinitions)}.
 */
public final class TaskDefinitions {
    private final ImmutableMap<String, TaskFactory> definitions;

    public TaskDefinitions(final Map<String, TaskFactory> definitions) {
        this.definitions = ImmutableMap.copyOf(definitions);
    }

    public static TaskDefinitions single(final String name, final TaskFactory factory) {
        return new TaskDefinitions(ImmutableMap.of(name, factory));
    }

    /**
     * @return definitions containing both, entries of {@code other} win on name clashes
     */
    public TaskDefinitions merge(final TaskDefinitions other) {
        final Map<String, TaskFactory> merged = new LinkedHashMap<>(definitions);
        merged.putAll(other.definitions);

        return new TaskDefinitions(merged);
    }

    public ImmutableMap<String, TaskFactory> tasks() {
        return definitions;
    }
}
