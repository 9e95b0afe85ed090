package com.taskgraph.cli.commands;

import com.taskgraph.cli.TaskGraphCli;
import com.taskgraph.profiling.RecordingTimeIntervalCollector;
import com.taskgraph.scheduler.SchedulerConfig;
import com.taskgraph.scheduler.TaskScheduler;
import com.taskgraph.scheduler.TaskSchedulerException;
import com.taskgraph.task.DebugColor;
import com.taskgraph.task.Task;
import com.taskgraph.task.TaskNode;
import com.taskgraph.task.Tasks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds a small demonstration graph and runs it through the scheduler.
 *
 * Graph:
 *   tick (polling) → square → report        continuation chain, re-run every cycle
 *   base, unit → combine → announce         fan-in, runs in the first cycle only
 */
@Command(name = "run", description = "Run a demonstration task graph")
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    private static final DebugColor TICK_COLOR = new DebugColor(0.2f, 0.6f, 1.0f);
    private static final DebugColor CHAIN_COLOR = new DebugColor(0.2f, 1.0f, 0.4f);
    private static final DebugColor JOIN_COLOR = new DebugColor(1.0f, 0.6f, 0.2f);

    @ParentCommand
    TaskGraphCli parent;

    @Spec
    CommandSpec spec;

    @Option(
        names = {"-t", "--threads"},
        description = "Worker threads (default: CPU cores)"
    )
    Integer threads;

    @Option(
        names = {"-c", "--cycles"},
        description = "Scheduling cycles to run (default: ${DEFAULT-VALUE})",
        defaultValue = "3"
    )
    int cycles;

    @Option(
        names = {"--profile"},
        description = "Print the time spent in each task"
    )
    boolean profile;

    @Override
    public Integer call() {
        if (parent != null) {
            parent.applyLogLevel();
        }
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (cycles < 1) {
            err.println("ERROR: --cycles must be at least 1");
            err.flush();
            return 1;
        }
        if (threads != null && threads < 1) {
            err.println("ERROR: --threads must be at least 1");
            err.flush();
            return 1;
        }

        RecordingTimeIntervalCollector collector = profile ? new RecordingTimeIntervalCollector() : null;
        SchedulerConfig.Builder builder = new SchedulerConfig.Builder().profilingCollector(collector);
        if (threads != null) {
            builder.threadCount(threads);
        }
        TaskScheduler scheduler = new TaskScheduler(builder.build());

        // Polling chain
        AtomicInteger ticks = new AtomicInteger();
        TaskNode<Integer> tick = Tasks.create("tick", TICK_COLOR, () -> ticks.incrementAndGet());
        TaskNode<Integer> square = tick.then(n -> n * n, "square", CHAIN_COLOR);
        TaskNode<Void> report = square.thenAccept(
            sq -> out.println("  tick " + ticks.get() + " squared: " + sq), "report", CHAIN_COLOR);

        // Fan-in
        TaskNode<Integer> base = Tasks.create("base", JOIN_COLOR, () -> 21);
        TaskNode<String> unit = Tasks.create("unit", JOIN_COLOR, () -> "apples");
        TaskNode<String> combine = Tasks.join("combine",
            () -> base.getResult().join() * 2 + " " + unit.getResult().join(), base, unit);
        TaskNode<Void> announce = combine.thenAccept(s -> out.println("  combined: " + s), "announce", JOIN_COLOR);

        List<Task> graph = Arrays.asList(tick, square, report, base, unit, combine, announce);
        if (collector != null) {
            // continuations are not submitted, so the scheduler cannot inject the collector
            square.setProfilingCollector(collector);
            report.setProfilingCollector(collector);
            announce.setProfilingCollector(collector);
        }

        out.println("Running " + cycles + " cycles on " + scheduler.getConfig().getThreadCount() + " threads");
        try {
            scheduler.submitPolling(tick);
            scheduler.submit(base);
            scheduler.submit(unit);
            scheduler.submit(combine);

            for (int i = 1; i <= cycles; i++) {
                out.println("Cycle " + i + ":");
                int completed = scheduler.runCycle();
                out.println("  " + completed + " scheduled tasks completed");
            }
        } catch (TaskSchedulerException e) {
            log.error("Demonstration graph failed", e);
            err.println("ERROR: " + e.getMessage());
            err.flush();
            return 1;
        } finally {
            for (Task task : graph) {
                scheduler.remove(task);
            }
            scheduler.shutdown();
            for (Task task : graph) {
                task.close();
            }
            out.flush();
        }

        if (collector != null) {
            out.println("Profile (total microseconds per task):");
            for (Map.Entry<String, Long> entry : collector.totalsByName(TimeUnit.MICROSECONDS).entrySet()) {
                out.printf("  %-10s %d%n", entry.getKey(), entry.getValue());
            }
        }
        out.println("Live task nodes after cleanup: " + TaskNode.getInstanceCount());
        out.flush();
        return 0;
    }
}
