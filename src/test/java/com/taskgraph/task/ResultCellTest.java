package com.taskgraph.task;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ResultCellTest {

    @Test
    @DisplayName("A value is readable any number of times")
    void valueIsNotConsumedByReads() throws Exception {
        ResultCell<String> cell = new ResultCell<>();
        cell.set("hello");

        assertTrue(cell.isPublished());
        assertFalse(cell.isFailed());
        assertEquals("hello", cell.get());
        assertEquals("hello", cell.join());
        assertEquals("hello", cell.get(1, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("Writing a cell twice is rejected")
    void secondWriteFails() {
        ResultCell<Integer> cell = new ResultCell<>();
        cell.set(1);

        assertThrows(IllegalStateException.class, () -> cell.set(2));
        assertThrows(IllegalStateException.class, () -> cell.setError(new RuntimeException("late")));
        assertEquals(1, cell.join());
    }

    @Test
    @DisplayName("Null is a valid value for Void cells")
    void nullValue() throws Exception {
        ResultCell<Void> cell = new ResultCell<>();
        cell.set(null);

        assertTrue(cell.isPublished());
        assertNull(cell.get());
    }

    @Test
    @DisplayName("A published failure surfaces on every reader")
    void failureIsReportedToReaders() {
        ResultCell<Integer> cell = new ResultCell<>();
        IOException boom = new IOException("boom");
        cell.setError(boom);

        assertTrue(cell.isFailed());
        ExecutionException checked = assertThrows(ExecutionException.class, cell::get);
        assertSame(boom, checked.getCause());
        CompletionException unchecked = assertThrows(CompletionException.class, cell::join);
        assertSame(boom, unchecked.getCause());
    }

    @Test
    @DisplayName("Readers block until the value is published")
    void readersWaitForPublication() throws Exception {
        ResultCell<Integer> cell = new ResultCell<>();
        int readers = 4;
        CountDownLatch started = new CountDownLatch(readers);
        ExecutorService pool = Executors.newFixedThreadPool(readers);
        try {
            Future<?>[] reads = new Future<?>[readers];
            for (int i = 0; i < readers; i++) {
                reads[i] = pool.submit(() -> {
                    started.countDown();
                    return cell.get();
                });
            }
            assertTrue(started.await(5, TimeUnit.SECONDS));
            assertThrows(TimeoutException.class, () -> cell.get(50, TimeUnit.MILLISECONDS));

            cell.set(7);

            for (Future<?> read : reads) {
                assertEquals(7, read.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("The future view cannot complete the cell")
    void futureViewIsReadOnly() {
        ResultCell<Integer> cell = new ResultCell<>();
        CompletableFuture<Integer> view = cell.toFuture();
        view.complete(99);

        assertFalse(cell.isPublished());
        cell.set(1);
        assertEquals(1, cell.toFuture().join());
    }
}
