package com.mongodb.log.analytics.filter;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

public class LogFilterTest {

    private static final String L1 = "2014-03-01T10:00:00.000Z [conn1] query test.a query: { a: 1 } 10ms";
    private static final String L2 = "2014-03-01T10:01:00.000Z [conn1] query test.b query: { a: 1 } 200ms";
    private static final String L3 = "   continued";
    private static final String L4 = "2014-03-01T10:02:00.000Z [conn2] update test.a query: { a: 1 } 500ms";
    private static final String L5 = "2014-03-01T10:03:00.000Z [conn3] end connection 127.0.0.1:5000";
    private static final String L6 = "2014-03-01T10:05:00.000Z [conn1] query test.a query: { a: 2 } 5ms";

    @TempDir
    Path tempDir;

    private Path log;

    @BeforeEach
    public void setUp() throws IOException {
        log = tempDir.resolve("mongod.log");
        Files.write(log, List.of(L1, L2, L3, L4, L5, L6), StandardCharsets.UTF_8);
    }

    private List<String> run(String... args) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        List<String> allArgs = new ArrayList<>(List.of("-f", log.toString()));
        allArgs.addAll(List.of(args));
        int exitCode = new CommandLine(new LogFilter(new PrintStream(bytes, true, StandardCharsets.UTF_8)))
                .execute(allArgs.toArray(new String[0]));
        assertEquals(0, exitCode);
        String output = bytes.toString(StandardCharsets.UTF_8);
        return output.isEmpty() ? List.of() : List.of(output.split("\\R"));
    }

    @Test
    public void testDefaultIgnorePatterns() {
        assertEquals(List.of(L1, L2, L3, L4, L6), run());
        assertEquals(List.of(L1, L2, L3, L4, L5, L6), run("--no-ignore"));
    }

    @Test
    public void testTimeRange() {
        assertEquals(List.of(L2, L3, L4), run("--from", "start +1min", "--to", "10:02:00"));
        assertEquals(List.of(L4, L6), run("--from", "10:02"));
        assertEquals(List.of(L1, L2, L3), run("--to", "+90s"));
    }

    @Test
    public void testSlowAndNamespace() {
        assertEquals(List.of(L2, L4), run("--slow", "100"));
        assertEquals(List.of(L1, L4, L6), run("--ns", "test.a"));
        assertEquals(List.of(L4), run("--ns", "test.a", "--slow", "100"));
    }

    @Test
    public void testWords() {
        assertEquals(List.of(L4), run("--word", "update"));
    }

    @Test
    public void testInvalidRangeFails() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        int exitCode = new CommandLine(new LogFilter(new PrintStream(bytes)))
                .execute("-f", log.toString(), "--from", "10:04", "--to", "10:01");

        assertEquals(1, exitCode);
    }

    @Test
    public void testTimeRangeNeedsFiles() {
        int exitCode = new CommandLine(new LogFilter(new PrintStream(new ByteArrayOutputStream())))
                .execute("--from", "start");

        assertEquals(1, exitCode);
    }
}
