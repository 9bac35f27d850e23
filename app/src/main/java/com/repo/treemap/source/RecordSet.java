package com.repo.treemap.source;

import com.repo.treemap.core.HierarchyRecord;

import java.util.List;

/**
 * Aggregated records ready for tree construction, plus what was learned while loading them.
 */
public record RecordSet(
        String valueColumn,

        /** Unique paths with summed values, ordered by path */
        List<HierarchyRecord> records,

        int rawRows,
        int droppedRows,
        List<String> missingLevels,

        /** Configured hierarchy levels, top first */
        List<String> hierarchyColumns) {

    public RecordSet {
        records = List.copyOf(records);
        missingLevels = List.copyOf(missingLevels);
        hierarchyColumns = List.copyOf(hierarchyColumns);
    }

    /**
     * Number of hierarchy levels, the longest possible path.
     */
    public int depth() {
        return hierarchyColumns.size();
    }

    public double total() {
        return records.stream().mapToDouble(HierarchyRecord::value).sum();
    }
}
