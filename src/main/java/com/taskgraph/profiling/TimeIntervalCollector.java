package com.taskgraph.profiling;

/**
 * Receives the time intervals measured around task executions.
 * 
 * Injected into tasks (never owned by them) and shared by all workers,
 * so implementations must accept concurrent calls to {@link #record(TimeInterval)}.
 * 
 * @see ScopedTimeInterval
 */
public interface TimeIntervalCollector {

    /**
     * Called once per execution of a task's work function, after it returned.
     * 
     * @param interval the measured interval
     */
    void record(TimeInterval interval);
}
