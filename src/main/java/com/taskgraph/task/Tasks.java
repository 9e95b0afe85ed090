package com.taskgraph.task;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Factory methods for task nodes whose work function completes the task by itself:
 * it publishes the outcome into the result cell and marks the node DONE.
 *
 * Tasks built this way can be invoked directly or handed to a scheduler.
 * Failures thrown by the supplied code are published as failed results.
 */
public final class Tasks {

    private Tasks() {
    }

    /**
     * Creates a task computing a value.
     *
     * @param name diagnostic name
     * @param work computation, may throw
     * @return the task, not yet scheduled
     */
    public static <T> TaskNode<T> create(String name, Callable<? extends T> work) {
        return create(name, DebugColor.WHITE, work);
    }

    public static <T> TaskNode<T> create(String name, DebugColor color, Callable<? extends T> work) {
        Objects.requireNonNull(work, "work cannot be null");
        TaskNode<T> task = new TaskNode<>(name, color);
        task.setFunction(() -> task.complete(work));
        return task;
    }

    /**
     * Creates a task performing a side effect. It publishes null.
     */
    public static TaskNode<Void> run(String name, Runnable work) {
        Objects.requireNonNull(work, "work cannot be null");
        return create(name, DebugColor.WHITE, () -> {
            work.run();
            return null;
        });
    }

    /**
     * Creates a fan-in task depending on all the given tasks. It publishes null when run.
     *
     * @param name diagnostic name
     * @param antecedents tasks to wait for, in order
     */
    public static TaskNode<Void> whenAll(String name, Collection<? extends Task> antecedents) {
        TaskNode<Void> join = create(name, DebugColor.WHITE, () -> null);
        join.addDependencies(antecedents);
        return join;
    }

    /**
     * Creates a fan-in task depending on the given tasks, whose value is computed by
     * {@code combiner}. The combiner typically reads the antecedents' result cells,
     * which are published by the time a scheduler runs this task.
     *
     * Example:
     * TaskNode<String> label = Tasks.join("label",
     *     () -> count.getResult().join() + " x " + unit.getResult().join(),
     *     count, unit);
     */
    public static <T> TaskNode<T> join(String name, Callable<? extends T> combiner, Task... antecedents) {
        TaskNode<T> join = create(name, DebugColor.WHITE, combiner);
        join.addDependencies(antecedents);
        return join;
    }
}
