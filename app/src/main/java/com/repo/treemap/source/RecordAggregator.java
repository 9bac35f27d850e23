package com.repo.treemap.source;

import com.repo.treemap.core.HierarchyRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups cleaned rows by hierarchy path and sums their values, so every path appears once.
 */
public class RecordAggregator {

    public List<HierarchyRecord> aggregate(List<HierarchyRecord> rows) {
        Map<List<String>, Double> sums = new TreeMap<>(HierarchyRecord.PATH_ORDER);
        for (HierarchyRecord row : rows) {
            sums.merge(row.path(), row.value(), Double::sum);
        }

        List<HierarchyRecord> aggregated = new ArrayList<>(sums.size());
        sums.forEach((path, value) -> aggregated.add(new HierarchyRecord(path, value)));
        return aggregated;
    }
}
