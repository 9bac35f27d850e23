package com.repo.treemap.tree;

import java.util.List;

/**
 * A flattened leaf handed to the renderer.
 */
public record LeafDescriptor(
        /** Path with non-branching links removed; controls nesting depth */
        List<String> structuralPath,

        /** Full path as it appeared in the data */
        List<String> originalPath,

        /** Terminal name with value and share of total, e.g. {@code X (10, 55.56%)} */
        String displayLabel,

        /** Original path joined with " > " */
        String originalPathString,

        double value,

        /** Share of the dataset total in percent, two decimals */
        double percentage) {

    public LeafDescriptor {
        structuralPath = List.copyOf(structuralPath);
        originalPath = List.copyOf(originalPath);
    }

    public String name() {
        return originalPath.get(originalPath.size() - 1);
    }

    public int collapsedLevels() {
        return originalPath.size() - structuralPath.size();
    }
}
