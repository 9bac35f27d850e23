package com.repo.treemap.source;

import java.util.List;

/**
 * The CSV contents as read, before any cleaning.
 * Cells are kept as strings; cells past the end of a short row read as null.
 */
public record RawTable(List<String> header, List<String[]> rows) {

    public RawTable {
        header = List.copyOf(header);
        rows = List.copyOf(rows);
    }

    public int columnIndex(String column) {
        return header.indexOf(column);
    }

    public boolean hasColumn(String column) {
        return header.contains(column);
    }

    public String cell(String[] row, int index) {
        if (index < 0 || index >= row.length)
            return null;
        return row[index];
    }

    public int rowCount() {
        return rows.size();
    }
}
