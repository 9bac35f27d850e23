package com.repo.treemap.tree;

import com.repo.treemap.core.HierarchyRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class AggregateTreeBuilderTest {

    private final AggregateTreeBuilder builder = new AggregateTreeBuilder();

    @Test
    void testTwoBranchesWithShortLeaf() {
        AggregateTree tree = builder.build(List.of(
                HierarchyRecord.of(10, "A", "X"),
                HierarchyRecord.of(5, "A", "Y"),
                HierarchyRecord.of(3, "B")));

        AggregateNode root = tree.root();
        assertEquals("Root", root.getName());
        assertEquals(18, root.getValue(), 1e-9);
        assertEquals(2, root.getChildren().size());

        AggregateNode a = tree.find(List.of("A")).orElseThrow();
        assertEquals(15, a.getValue(), 1e-9);
        assertFalse(a.isLeaf());
        assertEquals(10, tree.find(List.of("A", "X")).orElseThrow().getValue(), 1e-9);
        assertEquals(5, tree.find(List.of("A", "Y")).orElseThrow().getValue(), 1e-9);

        AggregateNode b = tree.find(List.of("B")).orElseThrow();
        assertEquals(3, b.getValue(), 1e-9);
        assertTrue(b.isLeaf());
        assertFalse(tree.isRootCorrected());
    }

    @Test
    void testDirectValueOnNodeWithChildrenIsMergedIntoTotal() {
        AggregateTree tree = builder.build(List.of(
                HierarchyRecord.of(7, "A"),
                HierarchyRecord.of(3, "A", "X")));

        AggregateNode a = tree.find(List.of("A")).orElseThrow();
        assertEquals(10, a.getValue(), 1e-9);
        assertEquals(7, a.getDirectValue(), 1e-9);
        assertFalse(a.isLeaf(), "A node with a child is never a leaf");
        assertEquals(1, a.getChildren().size());
        assertEquals(3, a.getChild("X").orElseThrow().getValue(), 1e-9);
        assertEquals(List.of(List.of("A", "X")), tree.leafPaths());
    }

    @Test
    void testLeavesAreExactlyChildlessNodes() {
        AggregateTree tree = builder.build(List.of(
                HierarchyRecord.of(1, "A", "X", "P"),
                HierarchyRecord.of(1, "A", "X"),
                HierarchyRecord.of(1, "A", "Y"),
                HierarchyRecord.of(1, "B")));

        for (AggregateNode node : tree.nodes()) {
            if (node == tree.root())
                continue;
            assertEquals(node.getChildren().isEmpty(), node.isLeaf(), node.toString());
        }
        assertEquals(List.of(List.of("A", "X", "P"), List.of("A", "Y"), List.of("B")), tree.leafPaths());
        assertEquals(3, tree.depth());
    }

    @Test
    void testRootEqualsSumOfRecords() {
        Random random = new Random(42);
        List<HierarchyRecord> records = randomRecords(random, 200);
        double expected = records.stream().mapToDouble(HierarchyRecord::value).sum();

        AggregateTree tree = builder.build(records);

        assertEquals(expected, tree.root().getValue(), 1e-6);
        assertFalse(tree.isRootCorrected());
    }

    @Test
    void testOrderIndependence() {
        Random random = new Random(7);
        List<HierarchyRecord> records = randomRecords(random, 120);
        Map<List<String>, String> expected = signature(builder.build(records));

        for (int i = 0; i < 5; i++) {
            List<HierarchyRecord> shuffled = new ArrayList<>(records);
            Collections.shuffle(shuffled, random);
            assertEquals(expected, signature(builder.build(shuffled)));
        }
    }

    @Test
    void testInconsistentTotalFallsBackToExpected() {
        AggregateTree tree = builder.build(List.of(
                HierarchyRecord.of(10, "A"),
                HierarchyRecord.of(5, "B")), 20);

        assertTrue(tree.isRootCorrected());
        assertEquals(15, tree.computedTotal(), 1e-9);
        assertEquals(20, tree.root().getValue(), 1e-9);
        assertEquals(10, tree.find(List.of("A")).orElseThrow().getValue(), 1e-9, "Only the root is corrected");
    }

    @Test
    void testEmptyPathIsAttributedToRoot() {
        AggregateTree tree = builder.build(List.of(
                new HierarchyRecord(List.of(), 4),
                HierarchyRecord.of(6, "A")));

        assertEquals(10, tree.root().getValue(), 1e-9);
        assertEquals(4, tree.root().getDirectValue(), 1e-9);
        assertEquals(List.of(List.of("A")), tree.leafPaths());
    }

    @Test
    void testZeroValuesAreValidShapes() {
        AggregateTree tree = builder.build(List.of(HierarchyRecord.of(0, "A", "X")));

        assertEquals(0, tree.root().getValue());
        assertTrue(tree.find(List.of("A", "X")).orElseThrow().isLeaf());
    }

    @Test
    void testTreeIsReadOnlyAfterBuild() {
        AggregateTree tree = builder.build(List.of(HierarchyRecord.of(1, "A")));

        AggregateNode a = tree.find(List.of("A")).orElseThrow();
        assertThrows(IllegalStateException.class, () -> a.childFor("B"));
        assertThrows(UnsupportedOperationException.class, () -> a.getChildren().clear());
    }

    private static List<HierarchyRecord> randomRecords(Random random, int count) {
        String[] names = { "A", "B", "C" };
        Map<List<String>, Double> unique = new LinkedHashMap<>();
        for (int i = 0; i < count; i++) {
            int depth = 1 + random.nextInt(4);
            List<String> path = new ArrayList<>();
            for (int d = 0; d < depth; d++) {
                path.add(names[random.nextInt(names.length)] + d);
            }
            unique.merge(path, 1 + random.nextInt(1000) / 10.0, Double::sum);
        }
        List<HierarchyRecord> records = new ArrayList<>();
        unique.forEach((path, value) -> records.add(new HierarchyRecord(path, value)));
        return records;
    }

    private static Map<List<String>, String> signature(AggregateTree tree) {
        Map<List<String>, String> signature = new LinkedHashMap<>();
        for (AggregateNode node : tree.nodes()) {
            signature.put(node.getOriginalPath(),
                    String.format("%.6f/%.6f/%b", node.getValue(), node.getDirectValue(), node.isLeaf()));
        }
        return signature;
    }
}
