package com.repo.treemap.source;

import com.repo.treemap.core.HierarchyRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns raw CSV rows into hierarchy records.
 * Values lose their whitespace thousands separators and must be positive finite numbers;
 * hierarchy cells are trimmed and placeholder text is treated as an absent level.
 */
public class RecordCleaner {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Set<String> ABSENT_MARKERS = Set.of("", "nan", "None");

    private final List<String> hierarchyColumns;

    public RecordCleaner(List<String> hierarchyColumns) {
        this.hierarchyColumns = List.copyOf(hierarchyColumns);
    }

    public CleanedDataset clean(RawTable table, String valueColumn) {
        List<String> missingLevels = hierarchyColumns.stream()
                .filter(column -> !table.hasColumn(column))
                .toList();
        if (!missingLevels.isEmpty()) {
            System.err.println("Warning: Missing hierarchy columns: " + missingLevels
                    + ". They will be treated as empty.");
        }

        int valueIndex = table.columnIndex(valueColumn);
        int[] levelIndexes = hierarchyColumns.stream().mapToInt(table::columnIndex).toArray();

        List<HierarchyRecord> rows = new ArrayList<>();
        int dropped = 0;
        for (String[] row : table.rows()) {
            OptionalDouble value = parseValue(table.cell(row, valueIndex));
            if (value.isEmpty()) {
                dropped++;
                continue;
            }
            rows.add(new HierarchyRecord(toPath(table, row, levelIndexes), value.getAsDouble()));
        }

        if (dropped > 0) {
            System.out.println("Info: Dropped " + dropped + " rows with a non-numeric or non-positive '"
                    + valueColumn + "'.");
        }
        return new CleanedDataset(valueColumn, hierarchyColumns, rows, dropped, missingLevels);
    }

    /**
     * Parse a measure cell. Empty when the cell is not a positive finite number.
     */
    static OptionalDouble parseValue(String cell) {
        if (cell == null)
            return OptionalDouble.empty();
        String compact = WHITESPACE.matcher(cell).replaceAll("");
        if (!NUMBER.matcher(compact).matches())
            return OptionalDouble.empty();
        double value = Double.parseDouble(compact);
        if (!Double.isFinite(value) || value <= 0)
            return OptionalDouble.empty();
        return OptionalDouble.of(value);
    }

    /**
     * Normalize a hierarchy cell; null means the level is absent.
     */
    static String cleanLevel(String cell) {
        if (cell == null)
            return null;
        String trimmed = cell.strip();
        return ABSENT_MARKERS.contains(trimmed) ? null : trimmed;
    }

    // Stops at the first absent level so deeper cells never reattach to a shorter path.
    private List<String> toPath(RawTable table, String[] row, int[] levelIndexes) {
        List<String> path = new ArrayList<>(levelIndexes.length);
        for (int index : levelIndexes) {
            String level = cleanLevel(table.cell(row, index));
            if (level == null)
                break;
            path.add(level);
        }
        return path;
    }
}
