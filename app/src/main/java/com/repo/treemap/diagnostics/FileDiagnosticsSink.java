package com.repo.treemap.diagnostics;

import com.opencsv.CSVWriter;
import com.repo.treemap.core.HierarchyRecord;
import com.repo.treemap.core.LabelFormatter;
import com.repo.treemap.report.HierarchyJsonConverter;
import com.repo.treemap.source.CleanedDataset;
import com.repo.treemap.source.RawTable;
import com.repo.treemap.source.RecordSet;
import com.repo.treemap.tree.AggregateTree;
import com.repo.treemap.tree.LeafDescriptor;
import com.repo.treemap.tree.SingleStep;
import com.repo.treemap.tree.SingleStepSet;
import com.repo.treemap.tree.TreemapResult;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Dumps every stage of a run as semicolon-separated files (and the tree as JSON) into a
 * directory.
 */
public class FileDiagnosticsSink implements DiagnosticsSink {

    public static final String RAW_FILE = "raw.csv";
    public static final String CLEANED_FILE = "cleaned.csv";
    public static final String AGGREGATED_FILE = "aggregated.csv";
    public static final String TREE_FILE = "tree.json";
    public static final String SINGLE_STEPS_FILE = "single_steps.csv";
    public static final String LEAVES_FILE = "leaves.csv";

    private static final char SEPARATOR = ';';

    private final Path outputDir;

    public FileDiagnosticsSink(Path outputDir) {
        this.outputDir = outputDir;
    }

    @Override
    public void rawTable(RawTable table) {
        List<String[]> rows = new ArrayList<>();
        rows.add(table.header().toArray(String[]::new));
        rows.addAll(table.rows());
        writeCsv(RAW_FILE, rows);
    }

    @Override
    public void cleanedRows(CleanedDataset dataset) {
        writeCsv(CLEANED_FILE, recordRows(dataset.hierarchyColumns(), dataset.valueColumn(), dataset.rows()));
    }

    @Override
    public void aggregatedRecords(RecordSet recordSet) {
        writeCsv(AGGREGATED_FILE,
                recordRows(recordSet.hierarchyColumns(), recordSet.valueColumn(), recordSet.records()));
    }

    @Override
    public void aggregateTree(AggregateTree tree) {
        write(TREE_FILE, new HierarchyJsonConverter().convertAggregateTree(tree));
    }

    @Override
    public void singleSteps(SingleStepSet singleSteps) {
        List<String[]> rows = new ArrayList<>();
        rows.add(new String[] { "Depth", "Parent Path", "Child" });
        for (SingleStep step : singleSteps.sorted()) {
            rows.add(new String[] {
                    String.valueOf(step.depth()),
                    LabelFormatter.pathString(step.parentPath()),
                    step.childName() });
        }
        writeCsv(SINGLE_STEPS_FILE, rows);
    }

    @Override
    public void leaves(TreemapResult result) {
        List<String[]> rows = new ArrayList<>();
        rows.add(new String[] { "Structural Path", "Original Path", "Label", "Value", "Percentage" });
        for (LeafDescriptor leaf : result.leaves()) {
            rows.add(new String[] {
                    String.join(LabelFormatter.PATH_SEPARATOR, leaf.structuralPath()),
                    leaf.originalPathString(),
                    leaf.displayLabel(),
                    LabelFormatter.plainNumber(leaf.value()),
                    String.format(Locale.US, "%.2f", leaf.percentage()) });
        }
        writeCsv(LEAVES_FILE, rows);
    }

    private List<String[]> recordRows(List<String> levelColumns, String valueColumn, List<HierarchyRecord> records) {
        List<String[]> rows = new ArrayList<>();
        String[] header = new String[levelColumns.size() + 1];
        for (int i = 0; i < levelColumns.size(); i++) {
            header[i] = levelColumns.get(i);
        }
        header[levelColumns.size()] = valueColumn;
        rows.add(header);

        for (HierarchyRecord record : records) {
            String[] row = new String[levelColumns.size() + 1];
            for (int i = 0; i < levelColumns.size(); i++) {
                row[i] = i < record.path().size() ? record.path().get(i) : "";
            }
            row[levelColumns.size()] = LabelFormatter.plainNumber(record.value());
            rows.add(row);
        }
        return rows;
    }

    private void writeCsv(String fileName, List<String[]> rows) {
        Path target = prepare(fileName);
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
                CSVWriter csv = new CSVWriter(writer, SEPARATOR, CSVWriter.DEFAULT_QUOTE_CHARACTER,
                        CSVWriter.DEFAULT_ESCAPE_CHARACTER, CSVWriter.DEFAULT_LINE_END)) {
            csv.writeAll(rows);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write diagnostics file " + target, e);
        }
        System.out.println("Debug: Saved " + fileName + " to " + target);
    }

    private void write(String fileName, String content) {
        Path target = prepare(fileName);
        try {
            Files.writeString(target, content);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write diagnostics file " + target, e);
        }
        System.out.println("Debug: Saved " + fileName + " to " + target);
    }

    private Path prepare(String fileName) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create diagnostics directory " + outputDir, e);
        }
        return outputDir.resolve(fileName);
    }
}
