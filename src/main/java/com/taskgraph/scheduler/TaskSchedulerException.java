package com.taskgraph.scheduler;

/**
 * Thrown by {@link TaskScheduler#runCycle()} when invoking a task failed.
 * The cause is the first failure of the cycle; later ones are attached as suppressed.
 */
public class TaskSchedulerException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TaskSchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
