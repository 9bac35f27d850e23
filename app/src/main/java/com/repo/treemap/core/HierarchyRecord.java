package com.repo.treemap.core;

import java.util.Comparator;
import java.util.List;

/**
 * A single aggregated input row: a hierarchy path and the summed measure for it.
 * Paths are already truncated at their first absent level.
 */
public record HierarchyRecord(
        /** Category names from the top level down, never containing blanks */
        List<String> path,

        /** Positive aggregated measure */
        double value) {

    /** Lexicographic order over paths, shorter prefix first. */
    public static final Comparator<List<String>> PATH_ORDER = (a, b) -> {
        int shared = Math.min(a.size(), b.size());
        for (int i = 0; i < shared; i++) {
            int cmp = a.get(i).compareTo(b.get(i));
            if (cmp != 0)
                return cmp;
        }
        return Integer.compare(a.size(), b.size());
    };

    public HierarchyRecord {
        path = List.copyOf(path);
    }

    public static HierarchyRecord of(double value, String... path) {
        return new HierarchyRecord(List.of(path), value);
    }

    public int depth() {
        return path.size();
    }
}
