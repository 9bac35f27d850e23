package com.repo.treemap.report;

import com.repo.treemap.core.LabelFormatter;
import com.repo.treemap.tree.AggregateNode;
import com.repo.treemap.tree.AggregateTree;
import com.repo.treemap.tree.InteriorValue;
import com.repo.treemap.tree.LeafDescriptor;
import com.repo.treemap.tree.TreemapResult;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Converts pipeline results to JSON for the HTML treemap and the diagnostics dump.
 */
public class HierarchyJsonConverter {

    /**
     * Nested JSON following the structural paths, for d3.hierarchy().
     * Leaves carry their value; an interior node carries a value only when records were
     * attributed to it (or to a collapsed node above it) directly.
     */
    public String convertToHierarchyJson(TreemapResult result, String valueColumn) {
        AggregateTree tree = result.tree();
        double total = tree.expectedTotal();

        HierarchyNode root = new HierarchyNode(LabelFormatter.ROOT_LABEL, List.of());
        root.label = LabelFormatter.displayLabel(LabelFormatter.ROOT_LABEL, result.total(), total);
        root.hover = LabelFormatter.hoverText(List.of(), valueColumn, result.total(), total);

        for (LeafDescriptor leaf : result.leaves()) {
            List<String> original = leaf.originalPath();
            HierarchyNode current = root;

            // Walk the original path, skipping the links the rewriter collapsed
            for (int i = 0; i < original.size(); i++) {
                String part = original.get(i);
                boolean isLeaf = (i == original.size() - 1);
                List<String> originalPrefix = original.subList(0, i + 1);
                if (!isLeaf && result.singleSteps().contains(original.subList(0, i), part))
                    continue;

                HierarchyNode child = current.findChild(part);
                if (child == null) {
                    child = new HierarchyNode(part, originalPrefix);
                    if (!isLeaf) {
                        double nodeValue = tree.find(originalPrefix).map(AggregateNode::getValue).orElse(0.0);
                        child.label = LabelFormatter.displayLabel(part, nodeValue, total);
                        child.hover = LabelFormatter.hoverText(originalPrefix, valueColumn, nodeValue, total);
                    }
                    current.children.add(child);
                }
                current = child;

                if (isLeaf) {
                    current.value = leaf.value();
                    current.label = leaf.displayLabel();
                    current.hover = LabelFormatter.hoverText(original, valueColumn, leaf.value(), total);
                }
            }
        }

        for (InteriorValue interior : result.interiorValues()) {
            HierarchyNode target = root;
            for (String part : interior.structuralPath()) {
                HierarchyNode child = target.findChild(part);
                if (child == null)
                    break;
                target = child;
            }
            target.value = (target.value != null ? target.value : 0) + interior.value();
        }

        return root.toJson();
    }

    /**
     * The full aggregate tree with direct values and leaf flags, for diagnostics.
     */
    public String convertAggregateTree(AggregateTree tree) {
        return nodeToJson(tree.root());
    }

    private String nodeToJson(AggregateNode node) {
        StringBuilder sb = new StringBuilder();
        sb.append("{");
        sb.append("\"name\":\"").append(escapeJson(node.getName())).append("\"");
        sb.append(",\"path\":\"").append(escapeJson(LabelFormatter.pathString(node.getOriginalPath()))).append("\"");
        sb.append(",\"value\":").append(node.getValue());
        sb.append(",\"directValue\":").append(node.getDirectValue());
        sb.append(",\"isLeaf\":").append(node.isLeaf());
        if (node.hasChildren()) {
            sb.append(",\"children\":[");
            sb.append(node.getChildren().stream().map(this::nodeToJson).collect(Collectors.joining(",")));
            sb.append("]");
        }
        sb.append("}");
        return sb.toString();
    }

    static String escapeJson(String s) {
        if (s == null)
            return "";
        StringBuilder sb = new StringBuilder(s.length());
        for (char c : s.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                // Keeps "</script>" inside names from closing the embedding tag
                case '<' -> sb.append("\\u003c");
                default -> {
                    if (c < 0x20)
                        sb.append(String.format("\\u%04x", (int) c));
                    else
                        sb.append(c);
                }
            }
        }
        return sb.toString();
    }

    // Inner class for building the structural hierarchy
    private static class HierarchyNode {
        String name;
        String id;
        String label;
        String hover;
        List<HierarchyNode> children = new ArrayList<>();
        Double value;

        HierarchyNode(String name, List<String> originalPath) {
            this.name = name;
            this.id = LabelFormatter.pathString(originalPath);
            this.label = name;
            this.hover = "";
        }

        HierarchyNode findChild(String name) {
            for (HierarchyNode c : children) {
                if (c.name.equals(name))
                    return c;
            }
            return null;
        }

        String toJson() {
            StringBuilder sb = new StringBuilder();
            sb.append("{");
            sb.append("\"name\":\"").append(escapeJson(name)).append("\"");
            sb.append(",\"id\":\"").append(escapeJson(id)).append("\"");
            sb.append(",\"label\":\"").append(escapeJson(label)).append("\"");
            sb.append(",\"hover\":\"").append(escapeJson(hover)).append("\"");

            if (value != null) {
                sb.append(",\"value\":").append(value);
            }
            if (!children.isEmpty()) {
                sb.append(",\"children\":[");
                sb.append(children.stream().map(HierarchyNode::toJson).collect(Collectors.joining(",")));
                sb.append("]");
            }
            sb.append("}");
            return sb.toString();
        }
    }
}
