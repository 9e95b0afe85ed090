package com.taskgraph.profiling;

import com.taskgraph.task.DebugColor;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * One measured execution of a task: who ran it, on which thread, from when to when.
 * Timestamps come from {@link System#nanoTime()} and are only comparable within one JVM.
 */
public final class TimeInterval {

    private final String name;
    private final DebugColor color;
    private final String threadName;
    private final long startNanos;
    private final long endNanos;

    public TimeInterval(String name, DebugColor color, String threadName, long startNanos, long endNanos) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.color = Objects.requireNonNull(color, "color cannot be null");
        this.threadName = Objects.requireNonNull(threadName, "threadName cannot be null");
        if (endNanos < startNanos) {
            throw new IllegalArgumentException("Interval ends before it starts: " + startNanos + " > " + endNanos);
        }
        this.startNanos = startNanos;
        this.endNanos = endNanos;
    }

    public String getName() {
        return name;
    }

    public DebugColor getColor() {
        return color;
    }

    public String getThreadName() {
        return threadName;
    }

    public long getStartNanos() {
        return startNanos;
    }

    public long getEndNanos() {
        return endNanos;
    }

    public long getDuration(TimeUnit unit) {
        return unit.convert(endNanos - startNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public String toString() {
        return String.format("TimeInterval[%s on %s, %dus, %s]",
            name, threadName, getDuration(TimeUnit.MICROSECONDS), color);
    }
}
