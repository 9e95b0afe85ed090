package com.taskgraph.task;

/**
 * Scheduling state of a {@link Task}.
 * 
 * Transitions:
 *   - construction leaves a node INVALID
 *   - the scheduler moves PENDING → SCHEDULED_ONCE | SCHEDULED_POLLING → DONE
 *   - leaving DONE for any other state resets the node's result cell
 */
public enum TaskStatus {
    PENDING,
    SCHEDULED_ONCE,
    SCHEDULED_POLLING,  // re-queued every scheduling cycle
    DONE,               // result published
    INVALID;

    /**
     * @return true if a scheduler still owns a node in this state
     */
    public boolean isScheduled() {
        return this == PENDING || this == SCHEDULED_ONCE || this == SCHEDULED_POLLING;
    }
}
