package com.repo.treemap.tree;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds (parent path, child) links that never branch anywhere in the dataset.
 * <p>
 * Every depth is classified on its own from the static set of leaf paths: leaves are grouped by
 * their first {@code k} segments and a group whose paths continue with exactly one distinct
 * segment at position {@code k} yields a single step. Leaves that end before depth {@code k} take
 * no part in that depth. Nothing is re-evaluated after a link is classified, so the result does
 * not depend on the order of the leaf paths.
 */
public class SingleStepAnalyzer {

    public SingleStepSet analyze(AggregateTree tree) {
        return analyze(tree.leafPaths(), tree.depth());
    }

    public SingleStepSet analyze(Collection<List<String>> leafPaths) {
        int depth = leafPaths.stream().mapToInt(List::size).max().orElse(0);
        return analyze(leafPaths, depth);
    }

    public SingleStepSet analyze(Collection<List<String>> leafPaths, int depth) {
        Set<SingleStep> steps = new HashSet<>();
        for (int k = 0; k < depth; k++) {
            Map<List<String>, Set<String>> nextSegments = new HashMap<>();
            for (List<String> path : leafPaths) {
                if (path.size() <= k)
                    continue;
                nextSegments.computeIfAbsent(List.copyOf(path.subList(0, k)), p -> new HashSet<>())
                        .add(path.get(k));
            }

            for (Map.Entry<List<String>, Set<String>> group : nextSegments.entrySet()) {
                if (group.getValue().size() == 1) {
                    steps.add(new SingleStep(group.getKey(), group.getValue().iterator().next()));
                }
            }
        }
        return new SingleStepSet(steps);
    }
}
