package com.repo.treemap.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * A finished, read-only aggregate tree.
 */
public class AggregateTree {

    private final AggregateNode root;
    private final double expectedTotal;
    private final double computedTotal;
    private final boolean rootCorrected;

    AggregateTree(AggregateNode root, double expectedTotal, double computedTotal, boolean rootCorrected) {
        this.root = root;
        this.expectedTotal = expectedTotal;
        this.computedTotal = computedTotal;
        this.rootCorrected = rootCorrected;
    }

    public AggregateNode root() {
        return root;
    }

    /**
     * Sum of all record values as computed outside the tree.
     */
    public double expectedTotal() {
        return expectedTotal;
    }

    /**
     * Root total produced by the post-order pass, before any correction.
     */
    public double computedTotal() {
        return computedTotal;
    }

    /**
     * True when the root total was replaced by the expected total.
     */
    public boolean isRootCorrected() {
        return rootCorrected;
    }

    /**
     * Childless nodes in depth-first order, children visited by name.
     */
    public List<AggregateNode> leaves() {
        List<AggregateNode> leaves = new ArrayList<>();
        for (AggregateNode node : nodes()) {
            if (node != root && node.isLeaf())
                leaves.add(node);
        }
        return leaves;
    }

    public List<List<String>> leafPaths() {
        return leaves().stream().map(AggregateNode::getOriginalPath).toList();
    }

    /**
     * Every node including the root, parents before children.
     */
    public List<AggregateNode> nodes() {
        List<AggregateNode> nodes = new ArrayList<>();
        Deque<AggregateNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            AggregateNode node = stack.pop();
            nodes.add(node);
            List<AggregateNode> children = new ArrayList<>(node.getChildren());
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return nodes;
    }

    public Optional<AggregateNode> find(List<String> path) {
        AggregateNode current = root;
        for (String segment : path) {
            Optional<AggregateNode> child = current.getChild(segment);
            if (child.isEmpty())
                return Optional.empty();
            current = child.get();
        }
        return Optional.of(current);
    }

    /**
     * Length of the longest leaf path.
     */
    public int depth() {
        return nodes().stream().mapToInt(AggregateNode::getDepth).max().orElse(0);
    }
}
