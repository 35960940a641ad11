package io.kubecache.task;

@FunctionalInterface
public interface TaskFactory {

    /**
     * Creates the routine to run. Called once per (re)start.
     */
    SupervisedTask create();
}
