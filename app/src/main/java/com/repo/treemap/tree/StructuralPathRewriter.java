package com.repo.treemap.tree;

import com.repo.treemap.core.LabelFormatter;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites original leaf paths into structural paths by dropping single-step links.
 * The terminal segment is always kept, so a leaf can never disappear; labels are always taken
 * from the original path.
 */
public class StructuralPathRewriter {

    private final SingleStepSet singleSteps;
    private final boolean collapse;

    public StructuralPathRewriter(SingleStepSet singleSteps) {
        this(singleSteps, true);
    }

    public StructuralPathRewriter(SingleStepSet singleSteps, boolean collapse) {
        this.singleSteps = singleSteps;
        this.collapse = collapse;
    }

    public List<String> structuralPath(List<String> originalPath) {
        return rewrite(originalPath, true);
    }

    /**
     * Structural position for a value sitting on an interior node. Unlike a leaf, the node
     * itself may be collapsed, in which case its nearest visible ancestor is returned.
     */
    public List<String> attachmentPath(List<String> interiorPath) {
        return rewrite(interiorPath, false);
    }

    private List<String> rewrite(List<String> path, boolean keepTerminal) {
        if (!collapse)
            return List.copyOf(path);

        List<String> structural = new ArrayList<>(path.size());
        for (int i = 0; i < path.size(); i++) {
            String segment = path.get(i);
            boolean terminal = i == path.size() - 1;
            if (singleSteps.contains(path.subList(0, i), segment) && !(terminal && keepTerminal))
                continue;
            structural.add(segment);
        }
        return List.copyOf(structural);
    }

    public LeafDescriptor describe(AggregateNode leaf, double total) {
        List<String> originalPath = leaf.getOriginalPath();
        return new LeafDescriptor(
                structuralPath(originalPath),
                originalPath,
                LabelFormatter.displayLabel(leaf.getName(), leaf.getValue(), total),
                LabelFormatter.pathString(originalPath),
                leaf.getValue(),
                LabelFormatter.percentage(leaf.getValue(), total));
    }

    public List<LeafDescriptor> describeLeaves(AggregateTree tree) {
        double total = tree.expectedTotal();
        return tree.leaves().stream().map(leaf -> describe(leaf, total)).toList();
    }

    /**
     * Direct values on nodes that have children, including the root.
     */
    public List<InteriorValue> interiorValues(AggregateTree tree) {
        List<InteriorValue> values = new ArrayList<>();
        for (AggregateNode node : tree.nodes()) {
            boolean interior = node.hasChildren() || node == tree.root();
            if (interior && node.getDirectValue() != 0) {
                values.add(new InteriorValue(node.getOriginalPath(),
                        attachmentPath(node.getOriginalPath()), node.getDirectValue()));
            }
        }
        return values;
    }
}
