package com.repo.treemap;

import com.repo.treemap.core.DatasetException;
import com.repo.treemap.core.LabelFormatter;
import com.repo.treemap.core.TreemapConfig;
import com.repo.treemap.diagnostics.DiagnosticsSink;
import com.repo.treemap.diagnostics.FileDiagnosticsSink;
import com.repo.treemap.report.CsvReporter;
import com.repo.treemap.report.HtmlReporter;
import com.repo.treemap.source.CsvRecordSource;
import com.repo.treemap.source.RecordSet;
import com.repo.treemap.tree.LeafDescriptor;
import com.repo.treemap.tree.TreemapPipeline;
import com.repo.treemap.tree.TreemapResult;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Root Cause Treemap - turns a flat CSV export with hierarchy levels and a numeric measure
 * into an interactive nested treemap.
 *
 * Usage: java -jar app.jar --input <csv> [--output <dir>] [--config <yaml>]
 * [--debug-dir <dir>] [--no-debug]
 */
public class App {

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    /**
     * Runs the tool and returns the process exit status.
     */
    public static int execute(String[] args) {
        System.out.println("=== Root Cause Treemap ===");

        CliArgs cliArgs = parseArgs(args);
        if (cliArgs == null) {
            printUsage();
            return 1;
        }

        try {
            new App().run(cliArgs);
            return 0;
        } catch (DatasetException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("An unexpected error occurred: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    private static void printUsage() {
        System.err.println("""
                Usage: java -jar app.jar --input <csv> [options]

                Arguments:
                  --input <csv>       Semicolon-separated export with hierarchy levels and a measure (required)
                  --output <dir>      Output directory for reports (default: current directory)
                  --config <yaml>     Configuration file (default: ./treemap.yaml when present)
                  --debug-dir <dir>   Directory for intermediate dumps (default: <output>/debug_output)
                  --no-debug          Do not write intermediate dumps
                """);
    }

    record CliArgs(
            Path input,
            Path outputDir,
            Path configFile, // null = look for treemap.yaml in the working directory
            String debugDir,
            boolean noDebug) {
    }

    static CliArgs parseArgs(String[] args) {
        Path input = null;
        Path outputDir = Path.of(".");
        Path configFile = null;
        String debugDir = null;
        boolean noDebug = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--input" -> {
                    if (i + 1 < args.length)
                        input = Path.of(args[++i]);
                }
                case "--output" -> {
                    if (i + 1 < args.length)
                        outputDir = Path.of(args[++i]);
                }
                case "--config" -> {
                    if (i + 1 < args.length)
                        configFile = Path.of(args[++i]);
                }
                case "--debug-dir" -> {
                    if (i + 1 < args.length)
                        debugDir = args[++i];
                }
                case "--no-debug" -> noDebug = true;
                default -> System.err.println("Warning: Ignoring unknown argument: " + args[i]);
            }
        }

        if (input == null) {
            return null;
        }
        return new CliArgs(input, outputDir, configFile, debugDir, noDebug);
    }

    private void run(CliArgs args) throws DatasetException {
        TreemapConfig config = args.configFile() != null
                ? TreemapConfig.loadFile(args.configFile())
                : TreemapConfig.load(Path.of("."));
        if (args.noDebug())
            config.withDebugEnabled(false);
        if (args.debugDir() != null)
            config.withDebugOutputDir(args.debugDir());

        DiagnosticsSink diagnostics = config.isDebugEnabled()
                ? new FileDiagnosticsSink(args.outputDir().resolve(config.getDebugOutputDir()))
                : DiagnosticsSink.NONE;

        // Phase 1: Load
        System.out.println("\n>>> PHASE 1: LOADING RECORDS <<<");
        RecordSet recordSet = new CsvRecordSource(config, diagnostics).load(args.input());

        // Phase 2: Aggregate and collapse
        System.out.println("\n>>> PHASE 2: BUILDING HIERARCHY <<<");
        TreemapResult result = new TreemapPipeline(config, diagnostics).run(recordSet);

        // Phase 3: Reports
        System.out.println("\n>>> PHASE 3: GENERATING REPORTS <<<");
        Path htmlPath = args.outputDir().resolve(config.getOutputHtml());
        Path csvPath = args.outputDir().resolve(config.getOutputCsv());

        boolean htmlWritten = new HtmlReporter().generate(result, recordSet.valueColumn(), config.getTitle(), htmlPath);
        boolean csvWritten = new CsvReporter().generate(result, csvPath);

        printSummary(recordSet, result);

        if (!htmlWritten || !csvWritten) {
            List<String> failed = new ArrayList<>();
            if (!htmlWritten)
                failed.add(htmlPath.toString());
            if (!csvWritten)
                failed.add(csvPath.toString());
            System.err.println("Warning: Some reports could not be written: " + String.join(", ", failed));
        }
    }

    private void printSummary(RecordSet recordSet, TreemapResult result) {
        System.out.println("\n=== SUMMARY ===");
        System.out.printf("  %-25s: %s%n", "Value column", recordSet.valueColumn());
        System.out.printf("  %-25s: %d%n", "Input rows", recordSet.rawRows());
        System.out.printf("  %-25s: %d%n", "Dropped rows", recordSet.droppedRows());
        System.out.printf("  %-25s: %d%n", "Unique paths", recordSet.records().size());
        System.out.printf("  %-25s: %s%n", "Total", LabelFormatter.formatValue(result.total()));
        System.out.printf("  %-25s: %d%n", "Leaves", result.leaves().size());
        System.out.printf("  %-25s: %d%n", "Single-step links", result.singleSteps().size());
        System.out.printf("  %-25s: %d%n", "Max structural depth", result.maxStructuralDepth());
        if (result.interiorTotal() != 0) {
            System.out.printf("  %-25s: %s%n", "Value on inner nodes", LabelFormatter.formatValue(result.interiorTotal()));
        }

        List<LeafDescriptor> top = result.leaves().stream()
                .sorted(Comparator.comparingDouble(LeafDescriptor::value).reversed())
                .limit(5)
                .toList();
        if (!top.isEmpty()) {
            System.out.println("\nTop 5 Categories:");
            for (int i = 0; i < top.size(); i++) {
                LeafDescriptor leaf = top.get(i);
                System.out.printf("  %d. %s%n", i + 1, leaf.originalPathString() + " - " + leaf.displayLabel());
            }
        }
    }
}
