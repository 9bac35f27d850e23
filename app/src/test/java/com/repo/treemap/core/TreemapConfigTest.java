package com.repo.treemap.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TreemapConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() {
        TreemapConfig config = TreemapConfig.defaults();
        assertEquals(';', config.getDelimiter());
        assertEquals('"', config.getQuoteChar());
        assertEquals(List.of("Level 1", "Level 2", "Level 3", "Level 4"), config.getHierarchyColumns());
        assertEquals(4, config.getDepth());
        assertTrue(config.getValueColumn().isEmpty());
        assertTrue(config.isCollapseSingleChild());
        assertTrue(config.isDebugEnabled());
        assertEquals("Customer Service Root Cause Analysis", config.getTitle());
    }

    @Test
    void testYamlLoading() throws IOException {
        Path yamlFile = tempDir.resolve("treemap.yaml");
        String yamlContent = """
                input:
                  delimiter: ","
                hierarchy:
                  columns: ["Area", "Topic"]
                value:
                  column: "Tickets"
                aggregate:
                  tolerance: 0.5
                structure:
                  collapse_single_child: false
                debug:
                  enabled: false
                  output_dir: "dumps"
                """;
        Files.writeString(yamlFile, yamlContent);

        TreemapConfig config = TreemapConfig.load(tempDir);

        assertEquals(',', config.getDelimiter(), "Should override delimiter");
        assertEquals('"', config.getQuoteChar(), "Unset keys keep their default");
        assertEquals(List.of("Area", "Topic"), config.getHierarchyColumns());
        assertEquals(2, config.getDepth());
        assertEquals("Tickets", config.getValueColumn().orElseThrow());
        assertEquals(0.5, config.getTolerance());
        assertFalse(config.isCollapseSingleChild());
        assertFalse(config.isDebugEnabled());
        assertEquals("dumps", config.getDebugOutputDir());
    }

    @Test
    void testWrongTypesFallBackToDefaults() throws IOException {
        Path yamlFile = tempDir.resolve("custom.yaml");
        Files.writeString(yamlFile, """
                input:
                  delimiter: ";;"
                aggregate:
                  tolerance: "tiny"
                structure:
                  collapse_single_child: "no"
                """);

        TreemapConfig config = TreemapConfig.loadFile(yamlFile);

        assertEquals(';', config.getDelimiter());
        assertEquals(1.0e-6, config.getTolerance());
        assertTrue(config.isCollapseSingleChild());
    }

    @Test
    void testMissingFileUsesDefaults() {
        TreemapConfig config = TreemapConfig.loadFile(tempDir.resolve("absent.yaml"));
        assertEquals(4, config.getDepth());
    }

    @Test
    void testMalformedYamlUsesDefaults() throws IOException {
        Path yamlFile = tempDir.resolve("broken.yaml");
        Files.writeString(yamlFile, """
                report:
                  title: "unterminated
                  output_html: [a, b
                """);

        TreemapConfig config = TreemapConfig.loadFile(yamlFile);

        assertEquals("Customer Service Root Cause Analysis", config.getTitle());
        assertEquals("tickets-treemap.html", config.getOutputHtml());
    }

    @Test
    void testNonMappingYamlUsesDefaults() throws IOException {
        Path listFile = tempDir.resolve("list.yaml");
        Files.writeString(listFile, "- Level 1\n- Level 2\n");
        Path scalarFile = tempDir.resolve("scalar.yaml");
        Files.writeString(scalarFile, "just text\n");

        assertEquals(4, TreemapConfig.loadFile(listFile).getDepth());
        assertEquals(';', TreemapConfig.loadFile(scalarFile).getDelimiter());
    }

    @Test
    void testCommandLineOverrides() {
        TreemapConfig config = TreemapConfig.defaults()
                .withDebugEnabled(false)
                .withDebugOutputDir("elsewhere");
        assertFalse(config.isDebugEnabled());
        assertEquals("elsewhere", config.getDebugOutputDir());
    }
}
