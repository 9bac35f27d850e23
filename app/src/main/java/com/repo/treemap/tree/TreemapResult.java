package com.repo.treemap.tree;

import java.util.List;

/**
 * Everything the renderer needs from one pipeline run.
 */
public record TreemapResult(
        AggregateTree tree,
        SingleStepSet singleSteps,
        List<LeafDescriptor> leaves,
        List<InteriorValue> interiorValues) {

    public TreemapResult {
        leaves = List.copyOf(leaves);
        interiorValues = List.copyOf(interiorValues);
    }

    public double total() {
        return tree.root().getValue();
    }

    public double leafTotal() {
        return leaves.stream().mapToDouble(LeafDescriptor::value).sum();
    }

    public double interiorTotal() {
        return interiorValues.stream().mapToDouble(InteriorValue::value).sum();
    }

    public int maxStructuralDepth() {
        return leaves.stream().mapToInt(l -> l.structuralPath().size()).max().orElse(0);
    }

    public int collapsedLinks() {
        return leaves.stream().mapToInt(LeafDescriptor::collapsedLevels).sum();
    }
}
