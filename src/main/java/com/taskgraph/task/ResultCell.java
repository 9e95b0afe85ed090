package com.taskgraph.task;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single-assignment, multi-read slot holding the outcome of one run of a task.
 *
 * Exactly one producer (the task's work function) writes the cell once, either
 * a value via {@link #set(Object)} or a failure via {@link #setError(Throwable)}.
 * Any number of consumers may read it, blocking until the outcome is published.
 * Reading never consumes the value.
 *
 * A task that is re-armed does not clear its cell: it installs a new one.
 * Handles to the old cell therefore keep seeing the old outcome.
 *
 * @param <T> type of the published value
 */
public final class ResultCell<T> {

    private final CompletableFuture<T> future = new CompletableFuture<>();

    /**
     * Publishes a value.
     *
     * @param value the value, may be null (e.g. for {@code Void} tasks)
     * @throws IllegalStateException if the cell already holds an outcome
     */
    public void set(T value) {
        if (!future.complete(value)) {
            throw new IllegalStateException("Result already published: " + describe());
        }
    }

    /**
     * Publishes a failure. Readers will observe it as an exception.
     *
     * @param error cause of the failure
     * @throws IllegalStateException if the cell already holds an outcome
     */
    public void setError(Throwable error) {
        Objects.requireNonNull(error, "error cannot be null");
        if (!future.completeExceptionally(error)) {
            throw new IllegalStateException("Result already published: " + describe());
        }
    }

    // ==================== Readers ====================

    /**
     * Blocks until the outcome is published.
     *
     * @return the published value
     * @throws InterruptedException if the waiting thread is interrupted
     * @throws ExecutionException if a failure was published
     */
    public T get() throws InterruptedException, ExecutionException {
        return future.get();
    }

    /**
     * Blocks at most the given time for the outcome.
     */
    public T get(long timeout, TimeUnit unit) throws InterruptedException, ExecutionException, TimeoutException {
        return future.get(timeout, unit);
    }

    /**
     * Blocks until the outcome is published, reporting failures unchecked.
     *
     * @return the published value
     * @throws CompletionException wrapping the published failure
     */
    public T join() {
        return future.join();
    }

    /**
     * @return true once a value or a failure has been published
     */
    public boolean isPublished() {
        return future.isDone();
    }

    /**
     * @return true if the published outcome is a failure
     */
    public boolean isFailed() {
        return future.isCompletedExceptionally();
    }

    /**
     * Returns a read-only view of this cell as a future.
     * Completing the returned future does not affect the cell.
     */
    public CompletableFuture<T> toFuture() {
        return future.copy();
    }

    private String describe() {
        if (!future.isDone()) {
            return "<pending>";
        }
        return future.isCompletedExceptionally() ? "<failed>" : String.valueOf(future.getNow(null));
    }

    @Override
    public String toString() {
        return "ResultCell[" + describe() + "]";
    }
}
