package com.taskgraph.task;

import com.taskgraph.profiling.TimeIntervalCollector;

import java.util.List;

/**
 * Interface that represents a node of the task graph, independently of its result type.
 *
 * A Task is:
 *  - Created by user code, by {@link Tasks} or by {@link TaskNode#then}
 *  - Handed to a scheduler, which only sees this interface
 *  - Invoked by a worker thread once all its dependencies are DONE
 *  - Closed by its owner when it is no longer needed
 *
 * Everything that depends on the result type lives in {@link TaskNode}.
 *
 * N.B.: status transitions are not synchronized. The scheduler must make sure
 * that at most one thread changes the status of a given task at a time.
 */
public interface Task extends AutoCloseable {

    /**
     * Runs the work function and, if the task ended up DONE, its continuation.
     *
     * @throws IllegalStateException if no work function is set, the task is closed,
     *         or its continuation link points to a closed task
     */
    void invoke();

    TaskStatus getStatus();

    /**
     * Changes the status. Leaving DONE for any other status re-arms the task
     * with a fresh result cell.
     */
    void setStatus(TaskStatus status);

    /**
     * @return true if this task was created as the continuation of another one
     */
    boolean isContinuation();

    /**
     * @return read-only, ordered view of the antecedents of this task
     */
    List<Task> getDependencies();

    /**
     * @return the task chained after this one, or null if none is linked or it was discarded
     */
    Task getContinuation();

    /**
     * @return the collector receiving this task's execution intervals, may be null
     */
    TimeIntervalCollector getProfilingCollector();

    void setProfilingCollector(TimeIntervalCollector collector);

    /**
     * @return human-readable name (for logging and profiling), never null
     */
    String getName();

    /**
     * @return true once {@link #close()} has been called
     */
    boolean isClosed();

    /**
     * Releases the task. A scheduled task (PENDING, SCHEDULED_ONCE, SCHEDULED_POLLING)
     * cannot be closed.
     *
     * @throws IllegalStateException if the task is still owned by a scheduler
     */
    @Override
    void close();
}
