package com.repo.treemap.report;

import com.repo.treemap.core.HierarchyRecord;
import com.repo.treemap.diagnostics.DiagnosticsSink;
import com.repo.treemap.tree.TreemapPipeline;
import com.repo.treemap.tree.TreemapResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvReporterTest {

    @TempDir
    Path tempDir;

    @Test
    void testOneRowPerLeaf() throws IOException {
        TreemapResult result = new TreemapPipeline(1.0e-6, true, DiagnosticsSink.NONE).run(List.of(
                HierarchyRecord.of(10, "A", "X"),
                HierarchyRecord.of(5, "A", "Y"),
                HierarchyRecord.of(3, "B", "Z")), 2);
        Path output = tempDir.resolve("leaves.csv");

        assertTrue(new CsvReporter().generate(result, output));

        List<String> lines = Files.readAllLines(output);
        assertEquals(4, lines.size());
        assertEquals("\"Structural Path\",\"Original Path\",\"Label\",\"Value\",\"Percentage\",\"Collapsed Levels\"",
                lines.get(0));
        assertEquals("\"A > X\",\"A > X\",\"X (10, 55.56%)\",\"10\",\"55.56\",\"0\"", lines.get(1));
        assertEquals("\"B > Z\",\"B > Z\",\"Z (3, 16.67%)\",\"3\",\"16.67\",\"0\"", lines.get(3));
    }
}
