package com.repo.treemap.source;

import com.repo.treemap.core.DatasetException;
import com.repo.treemap.core.HierarchyRecord;
import com.repo.treemap.core.TreemapConfig;
import com.repo.treemap.diagnostics.DiagnosticsSink;

import java.nio.file.Path;
import java.util.List;

/**
 * Loads a CSV export and produces aggregated hierarchy records.
 * Read, detect the measure, clean, then aggregate; each stage is handed to the
 * diagnostics sink before the next one runs.
 */
public class CsvRecordSource {

    private final TreemapConfig config;
    private final DiagnosticsSink diagnostics;

    public CsvRecordSource(TreemapConfig config, DiagnosticsSink diagnostics) {
        this.config = config;
        this.diagnostics = diagnostics;
    }

    public RecordSet load(Path csvFile) throws DatasetException {
        RawTable table = new CsvTableReader(config).read(csvFile);
        System.out.println("Read " + table.rowCount() + " rows from " + csvFile);
        diagnostics.rawTable(table);

        String valueColumn = new ValueColumnDetector(config).detect(table.header());

        CleanedDataset cleaned = new RecordCleaner(config.getHierarchyColumns()).clean(table, valueColumn);
        diagnostics.cleanedRows(cleaned);

        if (cleaned.rows().isEmpty()) {
            throw new DatasetException(DatasetException.Reason.EMPTY_DATASET,
                    "No valid records remain after cleaning '" + valueColumn + "' in " + csvFile);
        }

        List<HierarchyRecord> aggregated = new RecordAggregator().aggregate(cleaned.rows());
        RecordSet recordSet = new RecordSet(valueColumn, aggregated, table.rowCount(),
                cleaned.droppedRows(), cleaned.missingLevels(), config.getHierarchyColumns());
        System.out.println("Aggregated " + cleaned.rows().size() + " rows into " + aggregated.size()
                + " unique paths.");
        diagnostics.aggregatedRecords(recordSet);
        return recordSet;
    }
}
