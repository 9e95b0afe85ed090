package com.taskgraph.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

class TaskGraphCliTest {

    private CommandLine cmd;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        cmd = new CommandLine(new TaskGraphCli());
        out = new StringWriter();
        err = new StringWriter();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
    }

    @Test
    void runExecutesTheDemonstrationGraph() {
        int exitCode = cmd.execute("run", "--cycles", "2", "--threads", "2");

        assertEquals(0, exitCode);
        String output = out.toString();
        assertTrue(output.contains("Cycle 2:"), output);
        assertTrue(output.contains("combined: 42 apples"), output);
        assertTrue(output.contains("tick 2 squared: 4"), output);
    }

    @Test
    void runWithProfilePrintsTotals() {
        int exitCode = cmd.execute("run", "--cycles", "1", "--profile");

        assertEquals(0, exitCode);
        String output = out.toString();
        assertTrue(output.contains("Profile"), output);
        assertTrue(output.contains("combine"), output);
    }

    @Test
    void runRejectsInvalidOptions() {
        assertEquals(1, cmd.execute("run", "--cycles", "0"));
        assertTrue(err.toString().contains("--cycles"));
    }

    @Test
    void versionCommand() {
        assertEquals(0, cmd.execute("version"));
        assertTrue(out.toString().contains("1.0-SNAPSHOT"));
    }
}
