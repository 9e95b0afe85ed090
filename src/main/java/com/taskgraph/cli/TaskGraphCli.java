package com.taskgraph.cli;

import ch.qos.logback.classic.Level;
import com.taskgraph.cli.commands.RunCommand;
import com.taskgraph.cli.commands.VersionCommand;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * taskgraph CLI - Main entry point and command dispatcher
 * 
 * Root command with global options and subcommands to run a demonstration
 * task graph through the scheduler.
 */
@Command(
    name = "taskgraph",
    description = "taskgraph - task graph concurrency runtime",
    version = "taskgraph v1.0-SNAPSHOT",
    mixinStandardHelpOptions = true,
    subcommands = {
        RunCommand.class,
        VersionCommand.class
    }
)
public class TaskGraphCli implements Callable<Integer> { // Callable<Integer> to return an exit code

    static final String LOGGER_NAME = "com.taskgraph";

    // Global option, read by subcommands through @ParentCommand
    @Option(
        names = {"-v", "--verbose"},
        description = "Enable verbose output (DEBUG logging)"
    )
    private boolean verbose;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TaskGraphCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        // No subcommand: show usage
        new CommandLine(this).usage(System.out);
        return 0;
    }

    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Raises the runtime's log level to DEBUG when --verbose was given.
     */
    public void applyLogLevel() {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(LOGGER_NAME);
            root.setLevel(Level.DEBUG);
        }
    }
}
