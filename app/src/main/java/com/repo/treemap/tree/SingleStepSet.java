package com.repo.treemap.tree;

import com.repo.treemap.core.HierarchyRecord;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Links of the hierarchy that never branch.
 */
public record SingleStepSet(Set<SingleStep> steps) {

    public static final SingleStepSet EMPTY = new SingleStepSet(Set.of());

    public SingleStepSet {
        steps = Set.copyOf(steps);
    }

    public boolean contains(List<String> parentPath, String childName) {
        return steps.contains(new SingleStep(parentPath, childName));
    }

    public int size() {
        return steps.size();
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    /**
     * Steps ordered by depth, then by parent path and child name.
     */
    public List<SingleStep> sorted() {
        return steps.stream()
                .sorted(Comparator.comparingInt(SingleStep::depth)
                        .thenComparing(SingleStep::parentPath, HierarchyRecord.PATH_ORDER)
                        .thenComparing(SingleStep::childName))
                .toList();
    }
}
