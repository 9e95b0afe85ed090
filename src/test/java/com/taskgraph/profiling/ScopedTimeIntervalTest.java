package com.taskgraph.profiling;

import com.taskgraph.task.DebugColor;
import com.taskgraph.task.TaskNode;
import com.taskgraph.task.Tasks;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ScopedTimeIntervalTest {

    private static final DebugColor BLUE = new DebugColor(0.0f, 0.0f, 1.0f);

    @Mock
    private TimeIntervalCollector collector;

    @Test
    @DisplayName("Closing the scope reports one interval")
    void reportsOnClose() {
        try (ScopedTimeInterval scope = new ScopedTimeInterval(collector, "work", BLUE)) {
            verifyNoInteractions(collector);
        }

        ArgumentCaptor<TimeInterval> captor = ArgumentCaptor.forClass(TimeInterval.class);
        verify(collector).record(captor.capture());
        TimeInterval interval = captor.getValue();
        assertEquals("work", interval.getName());
        assertEquals(BLUE, interval.getColor());
        assertEquals(Thread.currentThread().getName(), interval.getThreadName());
        assertTrue(interval.getEndNanos() >= interval.getStartNanos());
    }

    @Test
    @DisplayName("Closing twice reports once")
    void closeIsIdempotent() {
        ScopedTimeInterval scope = new ScopedTimeInterval(collector, "work", BLUE);
        scope.close();
        scope.close();

        verify(collector, times(1)).record(any(TimeInterval.class));
    }

    @Test
    @DisplayName("A null collector makes the scope a no-op")
    void nullCollector() {
        assertDoesNotThrow(() -> {
            try (ScopedTimeInterval scope = new ScopedTimeInterval(null, "work", BLUE)) {
                // nothing to measure
            }
        });
    }

    @Test
    @DisplayName("Every invocation of a task is bracketed with its name and color")
    void taskInvocationIsProfiled() {
        try (TaskNode<Integer> task = Tasks.create("profiled", BLUE, () -> 1)) {
            task.setProfilingCollector(collector);
            assertSame(collector, task.getProfilingCollector());

            task.invoke();

            verify(collector).record(argThat(i -> i.getName().equals("profiled") && i.getColor().equals(BLUE)));
        }
    }

    @Test
    @DisplayName("The recording collector keeps intervals until drained")
    void recordingCollector() {
        RecordingTimeIntervalCollector recording = new RecordingTimeIntervalCollector();
        try (TaskNode<Integer> a = Tasks.create("a", () -> 1);
             TaskNode<Integer> b = a.then(v -> v + 1, "b", BLUE)) {
            a.setProfilingCollector(recording);
            b.setProfilingCollector(recording);

            a.invoke();

            List<TimeInterval> intervals = recording.getIntervals();
            assertEquals(2, intervals.size());
            // b's bracket closes inside a's invoke, but after a's own bracket
            assertEquals("a", intervals.get(0).getName());
            assertEquals("b", intervals.get(1).getName());
            assertEquals(2, recording.totalsByName(TimeUnit.NANOSECONDS).size());

            assertEquals(2, recording.drain().size());
            assertEquals(0, recording.size());
        }
    }

    @Test
    @DisplayName("Intervals cannot end before they start")
    void rejectsBackwardsInterval() {
        assertThrows(IllegalArgumentException.class,
            () -> new TimeInterval("x", BLUE, "main", 10L, 5L));
    }
}
