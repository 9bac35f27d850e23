package com.repo.treemap.core;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Configuration for a treemap run.
 * Loaded from treemap.yaml or uses the defaults of the customer-service export.
 */
public class TreemapConfig {

    public static final String FILE_NAME = "treemap.yaml";

    // Input format
    private char delimiter = ';';
    private char quoteChar = '"';

    // Hierarchy levels, top first. The list length is the tree depth.
    private List<String> hierarchyColumns = List.of("Level 1", "Level 2", "Level 3", "Level 4");

    // Measure column
    private String valueColumn = null;
    private List<String> valueKeywords = List.of("Tickets", "Count", "Volume", "Total");
    private String excludedHeaderKeyword = "contact root cause";

    // Aggregation
    private double tolerance = 1.0e-6;

    // Structure
    private boolean collapseSingleChild = true;

    // Report settings
    private String title = "Customer Service Root Cause Analysis";
    private String outputHtml = "tickets-treemap.html";
    private String outputCsv = "tickets-treemap-leaves.csv";

    // Debug output
    private boolean debugEnabled = true;
    private String debugOutputDir = "debug_output";

    /**
     * Load configuration from treemap.yaml in the given directory or return defaults.
     */
    public static TreemapConfig load(Path directory) {
        return loadFile(directory.resolve(FILE_NAME));
    }

    /**
     * Load configuration from an explicit YAML file, falling back to defaults when it
     * does not exist or cannot be read.
     */
    @SuppressWarnings("unchecked")
    public static TreemapConfig loadFile(Path configFile) {
        TreemapConfig config = new TreemapConfig();

        if (Files.exists(configFile)) {
            try (InputStream is = Files.newInputStream(configFile)) {
                Yaml yaml = new Yaml();
                Object data = yaml.load(is);
                if (data instanceof Map) {
                    config.parseYaml((Map<String, Object>) data);
                    System.out.println("Loaded configuration from: " + configFile);
                } else if (data != null) {
                    System.err.println("Warning: Config file " + configFile + " is not a mapping, using defaults");
                }
            } catch (IOException | YAMLException e) {
                System.err.println("Warning: Could not read config file, using defaults: " + e.getMessage());
                return new TreemapConfig();
            }
        }
        return config;
    }

    public static TreemapConfig defaults() {
        return new TreemapConfig();
    }

    @SuppressWarnings("unchecked")
    private void parseYaml(Map<String, Object> data) {
        if (data.get("input") instanceof Map) {
            Map<String, Object> input = (Map<String, Object>) data.get("input");
            delimiter = getChar(input, "delimiter", delimiter);
            quoteChar = getChar(input, "quote_char", quoteChar);
        }

        if (data.get("hierarchy") instanceof Map) {
            Map<String, Object> hierarchy = (Map<String, Object>) data.get("hierarchy");
            List<String> columns = getStringList(hierarchy, "columns");
            if (columns != null && !columns.isEmpty()) {
                hierarchyColumns = columns;
            }
        }

        if (data.get("value") instanceof Map) {
            Map<String, Object> value = (Map<String, Object>) data.get("value");
            valueColumn = getString(value, "column", valueColumn);
            List<String> keywords = getStringList(value, "keywords");
            if (keywords != null && !keywords.isEmpty()) {
                valueKeywords = keywords;
            }
            excludedHeaderKeyword = getString(value, "excluded_header_keyword", excludedHeaderKeyword);
        }

        if (data.get("aggregate") instanceof Map) {
            Map<String, Object> aggregate = (Map<String, Object>) data.get("aggregate");
            tolerance = getDouble(aggregate, "tolerance", tolerance);
        }

        if (data.get("structure") instanceof Map) {
            Map<String, Object> structure = (Map<String, Object>) data.get("structure");
            collapseSingleChild = getBool(structure, "collapse_single_child", collapseSingleChild);
        }

        if (data.get("report") instanceof Map) {
            Map<String, Object> report = (Map<String, Object>) data.get("report");
            title = getString(report, "title", title);
            outputHtml = getString(report, "output_html", outputHtml);
            outputCsv = getString(report, "output_csv", outputCsv);
        }

        if (data.get("debug") instanceof Map) {
            Map<String, Object> debug = (Map<String, Object>) data.get("debug");
            debugEnabled = getBool(debug, "enabled", debugEnabled);
            debugOutputDir = getString(debug, "output_dir", debugOutputDir);
        }
    }

    private String getString(Map<String, Object> map, String key, String defaultVal) {
        Object val = map.get(key);
        if (val instanceof String)
            return (String) val;
        return defaultVal;
    }

    private char getChar(Map<String, Object> map, String key, char defaultVal) {
        Object val = map.get(key);
        if (val instanceof String && ((String) val).length() == 1)
            return ((String) val).charAt(0);
        return defaultVal;
    }

    private double getDouble(Map<String, Object> map, String key, double defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number)
            return ((Number) val).doubleValue();
        return defaultVal;
    }

    private boolean getBool(Map<String, Object> map, String key, boolean defaultVal) {
        Object val = map.get(key);
        if (val instanceof Boolean)
            return (Boolean) val;
        return defaultVal;
    }

    private List<String> getStringList(Map<String, Object> map, String key) {
        Object val = map.get(key);
        if (!(val instanceof List))
            return null;
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) val) {
            if (item != null)
                result.add(item.toString());
        }
        return List.copyOf(result);
    }

    // === Getters ===

    public char getDelimiter() {
        return delimiter;
    }

    public char getQuoteChar() {
        return quoteChar;
    }

    public List<String> getHierarchyColumns() {
        return hierarchyColumns;
    }

    public int getDepth() {
        return hierarchyColumns.size();
    }

    public Optional<String> getValueColumn() {
        return Optional.ofNullable(valueColumn);
    }

    public List<String> getValueKeywords() {
        return valueKeywords;
    }

    public String getExcludedHeaderKeyword() {
        return excludedHeaderKeyword;
    }

    public double getTolerance() {
        return tolerance;
    }

    public boolean isCollapseSingleChild() {
        return collapseSingleChild;
    }

    public String getTitle() {
        return title;
    }

    public String getOutputHtml() {
        return outputHtml;
    }

    public String getOutputCsv() {
        return outputCsv;
    }

    public boolean isDebugEnabled() {
        return debugEnabled;
    }

    public String getDebugOutputDir() {
        return debugOutputDir;
    }

    // === Command-line overrides ===

    public TreemapConfig withDebugEnabled(boolean enabled) {
        this.debugEnabled = enabled;
        return this;
    }

    public TreemapConfig withDebugOutputDir(String dir) {
        this.debugOutputDir = dir;
        return this;
    }
}
