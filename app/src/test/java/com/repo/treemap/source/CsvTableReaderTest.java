package com.repo.treemap.source;

import com.repo.treemap.core.DatasetException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvTableReaderTest {

    @TempDir
    Path tempDir;

    private final CsvTableReader reader = new CsvTableReader(';', '"');

    @Test
    void testReadsHeaderAndRows() throws Exception {
        Path csv = tempDir.resolve("input.csv");
        Files.writeString(csv, """
                Level 1;Level 2; Total Tickets Q1
                Billing; "Refunds; late";1 200
                Access;;30
                """);

        RawTable table = reader.read(csv);

        assertEquals(List.of("Level 1", "Level 2", "Total Tickets Q1"), table.header());
        assertEquals(2, table.rowCount());
        String[] first = table.rows().get(0);
        assertEquals("Billing", first[0]);
        assertEquals("Refunds; late", first[1], "Quoted cells may contain the delimiter");
        assertEquals("1 200", first[2]);
    }

    @Test
    void testShortRowsReadAsAbsentCells() throws Exception {
        Path csv = tempDir.resolve("short.csv");
        Files.writeString(csv, "A;B;C\nx\n");

        RawTable table = reader.read(csv);

        String[] row = table.rows().get(0);
        assertEquals("x", table.cell(row, 0));
        assertNull(table.cell(row, 2));
        assertNull(table.cell(row, -1));
    }

    @Test
    void testMissingFile() {
        DatasetException e = assertThrows(DatasetException.class, () -> reader.read(tempDir.resolve("nope.csv")));
        assertEquals(DatasetException.Reason.INPUT_NOT_FOUND, e.getReason());
    }

    @Test
    void testEmptyFile() throws IOException {
        Path csv = tempDir.resolve("empty.csv");
        Files.writeString(csv, "");

        DatasetException e = assertThrows(DatasetException.class, () -> reader.read(csv));
        assertEquals(DatasetException.Reason.EMPTY_DATASET, e.getReason());
    }

    @Test
    void testHeaderOnly() throws IOException {
        Path csv = tempDir.resolve("header.csv");
        Files.writeString(csv, "Level 1;Total\n\n");

        DatasetException e = assertThrows(DatasetException.class, () -> reader.read(csv));
        assertEquals(DatasetException.Reason.EMPTY_DATASET, e.getReason());
    }
}
