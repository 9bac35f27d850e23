package com.repo.treemap.report;

import com.opencsv.CSVWriter;
import com.repo.treemap.core.LabelFormatter;
import com.repo.treemap.tree.LeafDescriptor;
import com.repo.treemap.tree.TreemapResult;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * One row per leaf: where it is drawn, where it came from, and how much it weighs.
 */
public class CsvReporter {

    static final String[] HEADER = {
            "Structural Path", "Original Path", "Label", "Value", "Percentage", "Collapsed Levels" };

    public boolean generate(TreemapResult result, Path outputPath) {
        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null)
                Files.createDirectories(parent);

            try (Writer writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8);
                    CSVWriter csv = new CSVWriter(writer)) {
                csv.writeNext(HEADER);
                for (LeafDescriptor leaf : result.leaves()) {
                    csv.writeNext(new String[] {
                            String.join(LabelFormatter.PATH_SEPARATOR, leaf.structuralPath()),
                            leaf.originalPathString(),
                            leaf.displayLabel(),
                            LabelFormatter.plainNumber(leaf.value()),
                            String.format(Locale.US, "%.2f", leaf.percentage()),
                            String.valueOf(leaf.collapsedLevels()) });
                }
            }
            System.out.println("CSV Report generated at: " + outputPath.toAbsolutePath());
            return true;
        } catch (IOException e) {
            System.err.println("Error: Could not write CSV report to " + outputPath + ": " + e.getMessage());
            return false;
        }
    }
}
