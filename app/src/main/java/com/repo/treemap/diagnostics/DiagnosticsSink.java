package com.repo.treemap.diagnostics;

import com.repo.treemap.source.CleanedDataset;
import com.repo.treemap.source.RawTable;
import com.repo.treemap.source.RecordSet;
import com.repo.treemap.tree.AggregateTree;
import com.repo.treemap.tree.SingleStepSet;
import com.repo.treemap.tree.TreemapResult;

/**
 * Receives the intermediate results of a run for inspection.
 * Passed into the record source and the pipeline; every hook is optional.
 */
public interface DiagnosticsSink {

    /** Discards everything. */
    DiagnosticsSink NONE = new DiagnosticsSink() {
    };

    default void rawTable(RawTable table) {
    }

    default void cleanedRows(CleanedDataset dataset) {
    }

    default void aggregatedRecords(RecordSet recordSet) {
    }

    default void aggregateTree(AggregateTree tree) {
    }

    default void singleSteps(SingleStepSet singleSteps) {
    }

    default void leaves(TreemapResult result) {
    }
}
