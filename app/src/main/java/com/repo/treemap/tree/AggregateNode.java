package com.repo.treemap.tree;

import com.repo.treemap.core.LabelFormatter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * One category in the aggregate tree.
 * Mutable only while {@link AggregateTreeBuilder} is inserting records; read-only after
 * {@link #finish()} has run on the root.
 */
public class AggregateNode {

    private final String name;
    private final List<String> originalPath;
    // Sorted by name so traversal order never depends on record arrival order
    private final Map<String, AggregateNode> children = new TreeMap<>();

    private double directValue;
    private double value;
    private boolean leaf;
    private boolean finished;

    AggregateNode(String name, List<String> originalPath) {
        this.name = name;
        this.originalPath = List.copyOf(originalPath);
    }

    static AggregateNode root() {
        return new AggregateNode(LabelFormatter.ROOT_LABEL, List.of());
    }

    AggregateNode childFor(String childName) {
        checkMutable();
        return children.computeIfAbsent(childName, n -> {
            List<String> childPath = new ArrayList<>(originalPath);
            childPath.add(n);
            return new AggregateNode(n, childPath);
        });
    }

    /**
     * A record path ended here.
     */
    void addTerminalValue(double amount) {
        checkMutable();
        directValue += amount;
        leaf = true;
    }

    /**
     * Post-order pass: totals include every descendant, and only childless nodes stay leaves.
     */
    double finish() {
        double total = directValue;
        for (AggregateNode child : children.values()) {
            total += child.finish();
        }
        value = total;
        leaf = children.isEmpty();
        finished = true;
        return total;
    }

    void overrideValue(double correctedValue) {
        value = correctedValue;
    }

    private void checkMutable() {
        if (finished)
            throw new IllegalStateException("Aggregate tree is read-only once finished: " + originalPath);
    }

    public String getName() {
        return name;
    }

    public List<String> getOriginalPath() {
        return originalPath;
    }

    public int getDepth() {
        return originalPath.size();
    }

    /**
     * Subtree total, including any value attributed directly to this node.
     */
    public double getValue() {
        return value;
    }

    /**
     * Value of records whose path ended exactly at this node.
     */
    public double getDirectValue() {
        return directValue;
    }

    public boolean isLeaf() {
        return leaf;
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public Collection<AggregateNode> getChildren() {
        return Collections.unmodifiableCollection(children.values());
    }

    public Optional<AggregateNode> getChild(String childName) {
        return Optional.ofNullable(children.get(childName));
    }

    @Override
    public String toString() {
        return "AggregateNode{" + String.join("/", originalPath) + ", value=" + value + ", leaf=" + leaf + "}";
    }
}
