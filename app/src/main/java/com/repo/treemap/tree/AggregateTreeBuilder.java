package com.repo.treemap.tree;

import com.repo.treemap.core.HierarchyRecord;

import java.util.Collection;

/**
 * Builds the aggregate tree from unique hierarchy records.
 * <p>
 * Each record walks its path from the root, creating nodes on demand, and leaves its value on
 * the node where the path ends. A single post-order pass then turns direct values into subtree
 * totals. A node that received a direct value but also has children is not a leaf; its direct
 * value is merged into its total.
 * <p>
 * The root total is checked against the externally computed sum of the records. If they differ
 * beyond the tolerance a warning is printed and the root takes the external total.
 */
public class AggregateTreeBuilder {

    public static final double DEFAULT_TOLERANCE = 1.0e-6;

    private final double tolerance;

    public AggregateTreeBuilder() {
        this(DEFAULT_TOLERANCE);
    }

    public AggregateTreeBuilder(double tolerance) {
        this.tolerance = tolerance;
    }

    public AggregateTree build(Collection<HierarchyRecord> records) {
        double expectedTotal = records.stream().mapToDouble(HierarchyRecord::value).sum();
        return build(records, expectedTotal);
    }

    public AggregateTree build(Collection<HierarchyRecord> records, double expectedTotal) {
        AggregateNode root = AggregateNode.root();
        for (HierarchyRecord record : records) {
            insert(root, record);
        }

        double computedTotal = root.finish();

        boolean corrected = false;
        if (!withinTolerance(computedTotal, expectedTotal)) {
            System.err.printf("Warning: Aggregated root total %.6f differs from the expected total %.6f;"
                    + " using the expected total.%n", computedTotal, expectedTotal);
            root.overrideValue(expectedTotal);
            corrected = true;
        }

        return new AggregateTree(root, expectedTotal, computedTotal, corrected);
    }

    private void insert(AggregateNode root, HierarchyRecord record) {
        AggregateNode current = root;
        for (String segment : record.path()) {
            // Defensive truncation at the first absent level
            if (segment == null || segment.isBlank())
                break;
            current = current.childFor(segment);
        }
        current.addTerminalValue(record.value());
    }

    // Relative to the magnitude of the total, absolute below 1
    private boolean withinTolerance(double computed, double expected) {
        return Math.abs(computed - expected) <= tolerance * Math.max(1.0, Math.abs(expected));
    }
}
