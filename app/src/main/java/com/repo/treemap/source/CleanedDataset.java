package com.repo.treemap.source;

import com.repo.treemap.core.HierarchyRecord;

import java.util.List;

/**
 * Rows that survived cleaning, one record per input row (not yet aggregated).
 */
public record CleanedDataset(
        String valueColumn,
        List<String> hierarchyColumns,
        List<HierarchyRecord> rows,

        /** Rows dropped for a non-numeric or non-positive value */
        int droppedRows,

        /** Configured hierarchy columns absent from the header */
        List<String> missingLevels) {

    public CleanedDataset {
        hierarchyColumns = List.copyOf(hierarchyColumns);
        rows = List.copyOf(rows);
        missingLevels = List.copyOf(missingLevels);
    }
}
