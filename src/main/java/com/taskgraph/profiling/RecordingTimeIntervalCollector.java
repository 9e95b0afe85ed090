package com.taskgraph.profiling;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;

/**
 * In-memory collector: keeps every reported interval until it is drained.
 * Safe to share between worker threads.
 */
public class RecordingTimeIntervalCollector implements TimeIntervalCollector {

    private final ConcurrentLinkedQueue<TimeInterval> intervals = new ConcurrentLinkedQueue<>();

    @Override
    public void record(TimeInterval interval) {
        intervals.add(interval);
    }

    /**
     * @return snapshot of the recorded intervals, in reporting order
     */
    public List<TimeInterval> getIntervals() {
        return Collections.unmodifiableList(new ArrayList<>(intervals));
    }

    /**
     * Removes and returns all intervals recorded so far.
     */
    public List<TimeInterval> drain() {
        List<TimeInterval> drained = new ArrayList<>();
        TimeInterval interval;
        while ((interval = intervals.poll()) != null) {
            drained.add(interval);
        }
        return drained;
    }

    public int size() {
        return intervals.size();
    }

    /**
     * Sums the recorded durations per task name.
     * 
     * @param unit unit of the returned totals
     * @return task name → total time, sorted by name
     */
    public Map<String, Long> totalsByName(TimeUnit unit) {
        Map<String, Long> totals = new TreeMap<>();
        for (TimeInterval interval : intervals) {
            totals.merge(interval.getName(), interval.getDuration(unit), Long::sum);
        }
        return totals;
    }
}
