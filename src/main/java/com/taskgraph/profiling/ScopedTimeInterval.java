package com.taskgraph.profiling;

import com.taskgraph.task.DebugColor;

/**
 * Acquire/release bracket around one task execution.
 * 
 * Opening the scope records the start time; closing it reports the finished
 * {@link TimeInterval} to the collector. With a null collector both ends are no-ops.
 * 
 * Usage:
 * try (ScopedTimeInterval scope = new ScopedTimeInterval(collector, name, color)) {
 *     work.run();
 * }
 */
public final class ScopedTimeInterval implements AutoCloseable {

    private final TimeIntervalCollector collector;
    private final String name;
    private final DebugColor color;
    private final long startNanos;
    private boolean closed;

    public ScopedTimeInterval(TimeIntervalCollector collector, String name, DebugColor color) {
        this.collector = collector;
        this.name = name;
        this.color = color;
        this.startNanos = collector != null ? System.nanoTime() : 0L;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (collector == null) {
            return;
        }
        long endNanos = System.nanoTime();
        collector.record(new TimeInterval(name, color, Thread.currentThread().getName(), startNanos, endNanos));
    }
}
