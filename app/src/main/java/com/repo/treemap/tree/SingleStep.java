package com.repo.treemap.tree;

import java.util.List;

/**
 * A parent path whose only child, across the whole dataset, is {@code childName}.
 */
public record SingleStep(List<String> parentPath, String childName) {

    public SingleStep {
        parentPath = List.copyOf(parentPath);
    }

    public int depth() {
        return parentPath.size();
    }
}
