package com.taskgraph.scheduler;

import com.taskgraph.task.Task;
import com.taskgraph.task.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * TaskScheduler runs a graph of {@link Task}s on a fixed thread pool, one cycle at a time.
 *
 * Queue:
 *   - submit()        → task runs once, then leaves the queue (SCHEDULED_ONCE)
 *   - submitPolling() → task runs once per cycle until removed (SCHEDULED_POLLING)
 *
 * Cycle (runCycle()):
 * 1. Polling tasks completed in the previous cycle are re-armed, together with
 *    the continuation chain hanging off them
 * 2. Every queued task whose dependencies are all DONE is dispatched to the pool
 * 3. Step 2 repeats until no queued task is ready
 * 4. Once-tasks that completed are dropped from the queue
 *
 * Continuations are never queued: they run inline on the worker thread that
 * completed their antecedent.
 *
 * N.B.: the scheduler does not detect dependency cycles or antecedents that are
 * never scheduled. Such tasks are reported at WARN and stay queued.
 *
 * Thread Pool Sizing:
 * - Size = SchedulerConfig.getThreadCount() (default: CPU cores × CORE_MULTIPLIER)
 */
public class TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    // ==================== State ====================

    /**
     * Queued tasks in submission order.
     * Key: task, Value: true for polling tasks.
     * Guarded by its own monitor.
     */
    private final Map<Task, Boolean> queue = new LinkedHashMap<>();

    private final AtomicInteger cycleCount = new AtomicInteger();

    // ==================== Dependencies ====================

    private final SchedulerConfig config;
    private final ExecutorService threadPool;

    // ==================== Constructors ====================

    public TaskScheduler() {
        this(SchedulerConfig.defaults());
    }

    /**
     * Creates a scheduler with a fixed thread pool sized by the configuration.
     *
     * @param config scheduler configuration
     */
    public TaskScheduler(SchedulerConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.threadPool = Executors.newFixedThreadPool(config.getThreadCount());

        log.info("TaskScheduler initialized: {}", config);
    }

    // ==================== Submission ====================

    /**
     * Queues a task for a single run.
     *
     * @param task task to run; its dependencies are awaited, not submitted
     * @throws IllegalArgumentException if the task is a continuation, closed or already queued
     */
    public void submit(Task task) {
        enqueue(task, false);
    }

    /**
     * Queues a task for one run per cycle, until {@link #remove(Task)} is called.
     *
     * @param task task to run
     * @throws IllegalArgumentException if the task is a continuation, closed or already queued
     */
    public void submitPolling(Task task) {
        enqueue(task, true);
    }

    private void enqueue(Task task, boolean polling) {
        Objects.requireNonNull(task, "task cannot be null");
        if (task.isContinuation()) {
            throw new IllegalArgumentException(
                "Task '" + task.getName() + "' is a continuation: it runs inline after its antecedent");
        }
        if (task.isClosed()) {
            throw new IllegalArgumentException("Task '" + task.getName() + "' is closed");
        }

        if (task.getProfilingCollector() == null && config.getProfilingCollector() != null) {
            task.setProfilingCollector(config.getProfilingCollector());
        }

        synchronized (queue) {
            if (queue.containsKey(task)) {
                throw new IllegalArgumentException("Task '" + task.getName() + "' is already queued");
            }
            arm(task, polling);
            queue.put(task, polling);
        }

        log.debug("Queued task '{}' (polling={}, dependencies={})",
            task.getName(), polling, task.getDependencies().size());
    }

    /**
     * Takes a task off the queue. Waits for a running cycle to finish.
     * A task that did not complete in its last run is left INVALID, and so is
     * every node of its continuation chain still waiting to run.
     *
     * @param task task to remove
     * @return true if the task was queued
     */
    public synchronized boolean remove(Task task) {
        Boolean removed;
        synchronized (queue) {
            removed = queue.remove(task);
        }
        if (removed == null) {
            return false;
        }
        if (task.getStatus() != TaskStatus.DONE) {
            task.setStatus(TaskStatus.INVALID);
        }
        disarm(task);
        log.debug("Removed task '{}' from the queue (status={})", task.getName(), task.getStatus());
        return true;
    }

    /**
     * Sets the scheduling status and re-arms the continuation chain of the task,
     * so that every node of the chain can publish a new result.
     */
    private void arm(Task task, boolean polling) {
        task.setStatus(polling ? TaskStatus.SCHEDULED_POLLING : TaskStatus.SCHEDULED_ONCE);

        for (Task next = task.getContinuation(); next != null; next = next.getContinuation()) {
            if (next.getStatus() == TaskStatus.DONE) {
                next.setStatus(TaskStatus.PENDING);
            }
        }
    }

    /**
     * Undoes {@link #arm}: continuations armed but never run go back to INVALID.
     */
    private void disarm(Task task) {
        for (Task next = task.getContinuation(); next != null; next = next.getContinuation()) {
            if (next.getStatus() == TaskStatus.PENDING) {
                next.setStatus(TaskStatus.INVALID);
            }
        }
    }

    // ==================== Execution ====================

    /**
     * Runs one scheduling cycle. Blocks until every task that could become ready has run.
     *
     * @return number of tasks that completed in this cycle (continuations not counted)
     * @throws TaskSchedulerException if a task invocation threw, after the cycle ended
     */
    public synchronized int runCycle() {
        Map<Task, Boolean> snapshot;
        synchronized (queue) {
            snapshot = new LinkedHashMap<>(queue);
        }

        int cycle = cycleCount.incrementAndGet();
        if (snapshot.isEmpty()) {
            log.debug("Cycle {}: queue is empty", cycle);
            return 0;
        }

        // Re-arm polling tasks that completed in the previous cycle
        for (Map.Entry<Task, Boolean> entry : snapshot.entrySet()) {
            if (entry.getValue() && entry.getKey().getStatus() == TaskStatus.DONE) {
                arm(entry.getKey(), true);
            }
        }

        log.debug("Cycle {}: {} tasks queued", cycle, snapshot.size());

        Set<Task> remaining = new LinkedHashSet<>(snapshot.keySet());
        List<Task> completed = new ArrayList<>();
        TaskSchedulerException failure = null;

        while (!remaining.isEmpty()) {
            List<Task> ready = new ArrayList<>();
            for (Task task : remaining) {
                if (isReady(task)) {
                    ready.add(task);
                }
            }

            if (ready.isEmpty()) {
                log.warn("Cycle {}: {} tasks cannot become ready (failed, unscheduled or cyclic dependencies): {}",
                    cycle, remaining.size(), names(remaining));
                break;
            }

            remaining.removeAll(ready);
            failure = dispatch(cycle, ready, completed, failure);
        }

        // Once-tasks that completed leave the queue, polling tasks stay
        synchronized (queue) {
            for (Task task : completed) {
                if (!snapshot.get(task)) {
                    queue.remove(task);
                }
            }
        }

        log.info("Cycle {} finished: {} tasks completed, {} still queued",
            cycle, completed.size(), getQueuedCount());

        if (failure != null) {
            throw failure;
        }
        return completed.size();
    }

    /**
     * Runs the given number of cycles, stopping at the first failing one.
     *
     * @return total number of completed tasks
     */
    public int runCycles(int cycles) {
        if (cycles < 0) {
            throw new IllegalArgumentException("cycles cannot be negative, got " + cycles);
        }
        int total = 0;
        for (int i = 0; i < cycles; i++) {
            total += runCycle();
        }
        return total;
    }

    /**
     * Invokes a batch of ready tasks in parallel and waits for all of them.
     * Results are processed as they arrive (CompletionService).
     *
     * @return the cycle failure, created or extended with the failures of this batch
     */
    private TaskSchedulerException dispatch(int cycle, List<Task> ready, List<Task> completed,
                                            TaskSchedulerException failure) {
        CompletionService<Task> completionService = new ExecutorCompletionService<>(threadPool);
        Map<Future<Task>, Task> submitted = new HashMap<>();

        for (Task task : ready) {
            Future<Task> future = completionService.submit(() -> {
                log.debug("Invoking task '{}'", task.getName());
                task.invoke();
                return task;
            });
            submitted.put(future, task);
        }

        for (int i = 0; i < ready.size(); i++) {
            Future<Task> future;
            try {
                // blocks until a task completes, and then gives us its future
                future = completionService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TaskSchedulerException("Interrupted while waiting for cycle " + cycle, e);
            }

            Task task = submitted.get(future);
            try {
                future.get();
                markDone(task);
                completed.add(task);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                log.error("Task '{}' failed in cycle {}", task.getName(), cycle, cause);
                if (failure == null) {
                    failure = new TaskSchedulerException(
                        "Task '" + task.getName() + "' failed in cycle " + cycle, cause);
                } else {
                    failure.addSuppressed(cause);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TaskSchedulerException("Interrupted while waiting for cycle " + cycle, e);
            }
        }
        return failure;
    }

    /**
     * Tasks built with raw work functions do not complete themselves: the scheduler does it.
     * Their continuations are not triggered in that case.
     */
    private void markDone(Task task) {
        if (task.getStatus() != TaskStatus.DONE) {
            log.debug("Task '{}' ran without completing itself, marking it DONE", task.getName());
            task.setStatus(TaskStatus.DONE);
        }
    }

    private static boolean isReady(Task task) {
        for (Task dependency : task.getDependencies()) {
            if (dependency.getStatus() != TaskStatus.DONE) {
                return false;
            }
        }
        return true;
    }

    private static String names(Set<Task> tasks) {
        return tasks.stream().map(Task::getName).collect(Collectors.joining(", ", "[", "]"));
    }

    // ==================== Queries ====================

    public int getQueuedCount() {
        synchronized (queue) {
            return queue.size();
        }
    }

    public boolean isQueued(Task task) {
        synchronized (queue) {
            return queue.containsKey(task);
        }
    }

    /**
     * @return number of cycles started so far
     */
    public int getCycleCount() {
        return cycleCount.get();
    }

    public SchedulerConfig getConfig() {
        return config;
    }

    // ==================== Lifecycle ====================

    /**
     * Shuts down the thread pool and waits for running tasks to complete.
     *
     * This is a graceful shutdown: it waits up to the configured timeout
     * for running tasks to finish before forcibly terminating them.
     */
    public void shutdown() {
        log.info("Shutting down TaskScheduler...");

        threadPool.shutdown();

        long timeoutMillis = config.getShutdownTimeout().toMillis();
        try {
            if (!threadPool.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                log.warn("Thread pool did not terminate in {} ms, forcing shutdown", timeoutMillis);
                threadPool.shutdownNow();
            }

            log.info("TaskScheduler shutdown complete");

        } catch (InterruptedException e) {
            log.error("TaskScheduler shutdown interrupted", e);
            threadPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
