package com.taskgraph.cli.commands;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Displays version information about taskgraph and its components.
 */
@Command(name = "version", description = "Show version information")
public class VersionCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("taskgraph - task graph concurrency runtime");
        out.println();
        out.println("Version: 1.0-SNAPSHOT");
        out.println("Java: " + System.getProperty("java.version"));
        out.println("Java Vendor: " + System.getProperty("java.vendor"));
        out.println("OS: " + System.getProperty("os.name") + " " + System.getProperty("os.version"));
        out.println("Processors: " + Runtime.getRuntime().availableProcessors());
        out.println();
        out.println("Components:");
        out.println("  - CLI: Picocli 4.7.5");
        out.println("  - Logging: SLF4J + Logback");
        out.flush();
        return 0;
    }
}
