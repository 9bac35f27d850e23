package com.repo.treemap;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AppTest {

    @TempDir
    Path tempDir;

    private Path writeInput() throws IOException {
        Path csv = tempDir.resolve("tickets.csv");
        Files.writeString(csv, """
                Level 1;Level 2;Level 3;Level 4;Total Tickets Q1
                Billing;Refunds;Card;;1200
                Billing;Refunds;Cash;;300
                Access;Password;Reset;;500
                Access;;;;nan
                """);
        return csv;
    }

    @Test
    void testEndToEnd() throws IOException {
        Path input = writeInput();
        Path out = tempDir.resolve("out");
        Path config = tempDir.resolve("treemap.yaml");
        Files.writeString(config, """
                report:
                  title: "Q1 Root Causes"
                  output_html: report.html
                  output_csv: leaves.csv
                debug:
                  output_dir: dumps
                """);

        int status = App.execute(new String[] {
                "--input", input.toString(), "--output", out.toString(), "--config", config.toString() });

        assertEquals(0, status);
        String html = Files.readString(out.resolve("report.html"));
        assertTrue(html.contains("<title>Q1 Root Causes: Total Tickets Q1</title>"));
        assertTrue(html.contains("Card (1,200, 60.00%)"));

        List<String> leaves = Files.readAllLines(out.resolve("leaves.csv"));
        assertEquals(4, leaves.size());
        // Password is the only child of Access
        assertTrue(leaves.contains("\"Access > Reset\",\"Access > Password > Reset\",\"Reset (500, 25.00%)\",\"500\",\"25.00\",\"1\""),
                leaves.toString());

        assertTrue(Files.exists(out.resolve("dumps/raw.csv")));
        assertTrue(Files.exists(out.resolve("dumps/tree.json")));
    }

    @Test
    void testNoDebugSkipsDumps() throws IOException {
        Path input = writeInput();
        Path out = tempDir.resolve("out");

        int status = App.execute(new String[] {
                "--input", input.toString(), "--output", out.toString(),
                "--config", tempDir.resolve("absent.yaml").toString(), "--no-debug" });

        assertEquals(0, status);
        assertTrue(Files.exists(out.resolve("tickets-treemap.html")));
        assertFalse(Files.exists(out.resolve("debug_output")));
    }

    @Test
    void testFailedReportIsWarnedWithoutStoppingTheOther() throws IOException {
        Path input = writeInput();
        Path out = tempDir.resolve("out");
        // A directory where the HTML file should go makes that write fail
        Files.createDirectories(out.resolve("tickets-treemap.html"));

        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int status;
        try {
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            status = App.execute(new String[] {
                    "--input", input.toString(), "--output", out.toString(),
                    "--config", tempDir.resolve("absent.yaml").toString(), "--no-debug" });
        } finally {
            System.setErr(originalErr);
        }

        assertEquals(0, status);
        assertTrue(Files.exists(out.resolve("tickets-treemap-leaves.csv")));
        String messages = err.toString(StandardCharsets.UTF_8);
        assertTrue(messages.contains("Error: Could not write HTML report"), messages);
        assertTrue(messages.contains("Warning: Some reports could not be written: "), messages);
        assertFalse(messages.contains("tickets-treemap-leaves.csv"), messages);
    }

    @Test
    void testMissingInputFails() {
        int status = App.execute(new String[] {
                "--input", tempDir.resolve("nope.csv").toString(),
                "--config", tempDir.resolve("absent.yaml").toString() });

        assertEquals(1, status);
    }

    @Test
    void testInputIsRequired() {
        assertEquals(1, App.execute(new String[0]));
        assertNull(App.parseArgs(new String[] { "--output", "x" }));
    }

    @Test
    void testParseArgs() {
        App.CliArgs args = App.parseArgs(new String[] { "--input", "a.csv", "--debug-dir", "d", "--bogus" });

        assertEquals(Path.of("a.csv"), args.input());
        assertEquals(Path.of("."), args.outputDir());
        assertEquals("d", args.debugDir());
        assertFalse(args.noDebug());
    }
}
