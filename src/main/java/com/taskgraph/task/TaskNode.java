package com.taskgraph.task;

import com.taskgraph.profiling.ScopedTimeInterval;
import com.taskgraph.profiling.TimeIntervalCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.Cleaner;
import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * A unit of deferred work producing a result of type {@code T}.
 *
 * A TaskNode holds:
 *   - a work function, which publishes the result into the current {@link ResultCell}
 *   - a weak link to at most one continuation (see {@link #then})
 *   - strong links to its dependencies (see {@link #addDependencies})
 *   - a status and profiling metadata (name, color, collector)
 *
 * Ownership:
 * Dependencies are kept alive by the node that depends on them. The continuation is NOT:
 * whoever holds the handle returned by {@code then} owns it. If that handle is dropped
 * and collected, the link silently stops firing.
 * A node leaves the live count when it is closed, or when it is collected without
 * having been closed, whichever comes first.
 *
 * Example:
 * TaskNode<Integer> answer = Tasks.create("answer", () -> 42);
 * TaskNode<Integer> doubled = answer.then(v -> v * 2);
 * answer.invoke();                     // runs doubled inline
 * doubled.getResult().join();          // 84
 *
 * @param <T> type of the published result ({@link Void} for side-effect-only tasks)
 */
public class TaskNode<T> implements Task {

    private static final Logger log = LoggerFactory.getLogger(TaskNode.class);

    /**
     * Live instances: incremented by every constructor, decremented once by
     * the first close() or by the cleaner after collection.
     */
    private static final AtomicInteger INSTANCE_COUNT = new AtomicInteger();

    private static final Cleaner CLEANER = Cleaner.create();

    // ==================== State ====================

    private final boolean continuation;
    private final List<Task> dependencies = new ArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Cleaner.Cleanable cleanable;

    private volatile Runnable function;
    private volatile ResultCell<T> result;
    private volatile WeakReference<Task> continuationLink;
    private volatile TaskStatus status;
    private volatile TimeIntervalCollector profilingCollector;
    private volatile String name;
    private volatile DebugColor debugColor;

    // ==================== Constructors ====================

    public TaskNode() {
        this("", DebugColor.WHITE, false);
    }

    public TaskNode(String name) {
        this(name, DebugColor.WHITE, false);
    }

    public TaskNode(String name, DebugColor color) {
        this(name, color, false);
    }

    /**
     * @param name diagnostic name, null means ""
     * @param color diagnostic color, null means {@link DebugColor#WHITE}
     * @param continuation true only for nodes built by {@link #then}
     */
    protected TaskNode(String name, DebugColor color, boolean continuation) {
        this.name = name != null ? name : "";
        this.debugColor = color != null ? color : DebugColor.WHITE;
        this.continuation = continuation;
        this.status = TaskStatus.INVALID;
        reset();

        int live = INSTANCE_COUNT.incrementAndGet();
        this.cleanable = CLEANER.register(this, new Release(this.name, closed));
        log.trace("Created task '{}' (continuation={}, live={})", this.name, continuation, live);
    }

    /**
     * @return number of task nodes created and not yet closed or collected, process-wide
     */
    public static int getInstanceCount() {
        return INSTANCE_COUNT.get();
    }

    // ==================== Invocation ====================

    @Override
    public final void invoke() {
        if (closed.get()) {
            throw new IllegalStateException("Task '" + name + "' invoked after it was closed");
        }
        Runnable work = function;
        if (work == null) {
            throw new IllegalStateException("Task '" + name + "' invoked without a work function");
        }

        try (ScopedTimeInterval scope = new ScopedTimeInterval(profilingCollector, name, debugColor)) {
            work.run();
        }

        TaskStatus after = status;
        if (after == TaskStatus.INVALID) {
            throw new IllegalStateException(
                "Task '" + name + "' is still INVALID after running: it was never scheduled and did not complete");
        }

        // Only a completed task chains forward
        if (after != TaskStatus.DONE) {
            log.trace("Task '{}' ran with status {}, continuation not triggered", name, after);
            return;
        }

        Task next = resolveContinuation();
        if (next != null) {
            log.debug("Task '{}' done, running continuation '{}' inline", name, next.getName());
            next.invoke();
        }
    }

    /**
     * Resolves the weak continuation link.
     *
     * @return the live continuation, or null if none is set or it was collected
     * @throws IllegalStateException if the link still reaches a continuation that was closed
     */
    private Task resolveContinuation() {
        WeakReference<Task> link = continuationLink;
        if (link == null) {
            return null;
        }
        Task next = link.get();
        if (next == null) {
            log.debug("Continuation of task '{}' was discarded by its owner", name);
            return null;
        }
        if (next.isClosed()) {
            throw new IllegalStateException(
                "Continuation '" + next.getName() + "' of task '" + name + "' was closed while still linked");
        }
        return next;
    }

    // ==================== Status ====================

    @Override
    public TaskStatus getStatus() {
        return status;
    }

    @Override
    public void setStatus(TaskStatus status) {
        Objects.requireNonNull(status, "status cannot be null");
        if (this.status == TaskStatus.DONE && status != TaskStatus.DONE) {
            reset();
        }
        this.status = status;
    }

    /**
     * Installs a fresh result cell so the task can publish again.
     * Handles to the previous cell keep their value.
     */
    public void reset() {
        result = new ResultCell<>();
    }

    @Override
    public boolean isContinuation() {
        return continuation;
    }

    // ==================== Work & result ====================

    public Runnable getFunction() {
        return function;
    }

    /**
     * Sets the work function. It is responsible for publishing into {@link #getResult()}
     * and, unless a scheduler does it, for marking the task DONE.
     */
    public void setFunction(Runnable function) {
        this.function = function;
    }

    /**
     * @return the result cell of the current run; stays valid after a reset
     */
    public ResultCell<T> getResult() {
        return result;
    }

    /**
     * Runs {@code body}, publishes its value (or the exception it threw) and marks this task DONE.
     * Used by work functions that complete their own task.
     */
    void complete(Callable<? extends T> body) {
        ResultCell<T> cell = result;
        T value;
        try {
            value = body.call();
        } catch (CompletionException e) {
            // an antecedent's failure read through join()
            cell.setError(e.getCause() != null ? e.getCause() : e);
            setStatus(TaskStatus.DONE);
            return;
        } catch (Exception e) {
            log.debug("Task '{}' published failure: {}", name, e.toString());
            cell.setError(e);
            setStatus(TaskStatus.DONE);
            return;
        }
        cell.set(value);
        setStatus(TaskStatus.DONE);
    }

    // ==================== Continuations ====================

    /**
     * Chains {@code f(result)} after this task.
     *
     * @return the continuation, owned by the caller
     */
    public <R> TaskNode<R> then(Function<? super T, ? extends R> f) {
        return then(f, "", DebugColor.WHITE);
    }

    public <R> TaskNode<R> then(Function<? super T, ? extends R> f, String name, DebugColor color) {
        Objects.requireNonNull(f, "continuation function cannot be null");
        return chain(() -> f.apply(getResult().join()), name, color);
    }

    /**
     * Chains {@code f()} after this task, ignoring its result.
     */
    public <R> TaskNode<R> then(Supplier<? extends R> f) {
        return then(f, "", DebugColor.WHITE);
    }

    public <R> TaskNode<R> then(Supplier<? extends R> f, String name, DebugColor color) {
        Objects.requireNonNull(f, "continuation function cannot be null");
        return chain(f::get, name, color);
    }

    /**
     * Chains a side effect after this task. The continuation publishes null.
     */
    public TaskNode<Void> then(Runnable f) {
        return then(f, "", DebugColor.WHITE);
    }

    public TaskNode<Void> then(Runnable f, String name, DebugColor color) {
        Objects.requireNonNull(f, "continuation function cannot be null");
        return chain(() -> {
            f.run();
            return null;
        }, name, color);
    }

    /**
     * Chains a consumer of this task's result. The continuation publishes null.
     */
    public TaskNode<Void> thenAccept(Consumer<? super T> f) {
        return thenAccept(f, "", DebugColor.WHITE);
    }

    public TaskNode<Void> thenAccept(Consumer<? super T> f, String name, DebugColor color) {
        Objects.requireNonNull(f, "continuation function cannot be null");
        return chain(() -> {
            f.accept(getResult().join());
            return null;
        }, name, color);
    }

    /**
     * Allocates the continuation node, makes this task its only dependency
     * and replaces this task's continuation link with it.
     */
    private <R> TaskNode<R> chain(Callable<? extends R> body, String name, DebugColor color) {
        TaskNode<R> next = new TaskNode<>(name, color, true);
        next.setFunction(() -> next.complete(body));
        next.addDependencies(this);

        Task previous = getContinuation();
        if (previous != null) {
            log.debug("Task '{}' replaces continuation '{}' with '{}'",
                this.name, previous.getName(), next.getName());
        }
        continuationLink = new WeakReference<>(next);
        return next;
    }

    @Override
    public Task getContinuation() {
        WeakReference<Task> link = continuationLink;
        return link != null ? link.get() : null;
    }

    // ==================== Dependencies ====================

    @Override
    public List<Task> getDependencies() {
        return Collections.unmodifiableList(dependencies);
    }

    /**
     * Appends a sequence of antecedents, in iteration order.
     */
    public void addDependencies(Collection<? extends Task> deps) {
        Objects.requireNonNull(deps, "dependencies cannot be null");
        for (Task dep : deps) {
            dependencies.add(Objects.requireNonNull(dep, "dependency cannot be null"));
        }
    }

    /**
     * Appends antecedents of any result type, in argument order.
     */
    public void addDependencies(Task... deps) {
        Objects.requireNonNull(deps, "dependencies cannot be null");
        for (Task dep : deps) {
            dependencies.add(Objects.requireNonNull(dep, "dependency cannot be null"));
        }
    }

    // ==================== Profiling ====================

    @Override
    public TimeIntervalCollector getProfilingCollector() {
        return profilingCollector;
    }

    @Override
    public void setProfilingCollector(TimeIntervalCollector collector) {
        this.profilingCollector = collector;
    }

    @Override
    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name != null ? name : "";
    }

    public DebugColor getDebugColor() {
        return debugColor;
    }

    public void setDebugColor(DebugColor color) {
        this.debugColor = Objects.requireNonNull(color, "color cannot be null");
    }

    // ==================== Lifecycle ====================

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        TaskStatus current = status;
        if (current.isScheduled()) {
            throw new IllegalStateException("Task '" + name + "' closed while still " + current);
        }
        cleanable.clean();
    }

    @Override
    public String toString() {
        return String.format("TaskNode[%s, status=%s, continuation=%s, deps=%d]",
            name.isEmpty() ? "<unnamed>" : name, status, continuation, dependencies.size());
    }

    /**
     * Leaves the live count. Runs on close() or, for a node that was never closed,
     * on the cleaner thread. Must not reference the node itself.
     */
    private static final class Release implements Runnable {

        private final String name;
        private final AtomicBoolean closed;

        Release(String name, AtomicBoolean closed) {
            this.name = name;
            this.closed = closed;
        }

        @Override
        public void run() {
            if (closed.compareAndSet(false, true)) {
                int live = INSTANCE_COUNT.decrementAndGet();
                log.trace("Released task '{}' (live={})", name, live);
            }
        }
    }
}
