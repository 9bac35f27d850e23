package com.repo.treemap.source;

import com.opencsv.CSVParser;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvException;
import com.repo.treemap.core.DatasetException;
import com.repo.treemap.core.TreemapConfig;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads a delimited export into a {@link RawTable}.
 */
public class CsvTableReader {

    private final char delimiter;
    private final char quoteChar;

    public CsvTableReader(TreemapConfig config) {
        this(config.getDelimiter(), config.getQuoteChar());
    }

    public CsvTableReader(char delimiter, char quoteChar) {
        this.delimiter = delimiter;
        this.quoteChar = quoteChar;
    }

    public RawTable read(Path csvFile) throws DatasetException {
        if (!Files.exists(csvFile)) {
            throw new DatasetException(DatasetException.Reason.INPUT_NOT_FOUND,
                    "Input CSV file not found at " + csvFile);
        }

        List<String[]> lines;
        try (Reader reader = Files.newBufferedReader(csvFile, StandardCharsets.UTF_8)) {
            lines = read(reader);
        } catch (IOException | CsvException e) {
            throw new DatasetException(DatasetException.Reason.UNREADABLE_INPUT,
                    "Input CSV file could not be parsed: " + csvFile + " (" + e.getMessage() + ")", e);
        }

        if (lines.isEmpty()) {
            throw new DatasetException(DatasetException.Reason.EMPTY_DATASET,
                    "Input CSV file is empty: " + csvFile);
        }

        List<String> header = Arrays.stream(lines.get(0))
                .map(h -> h == null ? "" : stripBom(h).trim())
                .toList();

        List<String[]> rows = new ArrayList<>();
        for (String[] line : lines.subList(1, lines.size())) {
            if (isBlankLine(line))
                continue;
            rows.add(line);
        }

        if (rows.isEmpty()) {
            throw new DatasetException(DatasetException.Reason.EMPTY_DATASET,
                    "Input CSV file has a header but no data rows: " + csvFile);
        }

        return new RawTable(header, rows);
    }

    List<String[]> read(Reader reader) throws IOException, CsvException {
        CSVParser parser = new CSVParserBuilder()
                .withSeparator(delimiter)
                .withQuoteChar(quoteChar)
                .withIgnoreLeadingWhiteSpace(true)
                .build();
        try (CSVReader csvReader = new CSVReaderBuilder(reader).withCSVParser(parser).build()) {
            return csvReader.readAll();
        }
    }

    private boolean isBlankLine(String[] line) {
        return line.length == 0 || (line.length == 1 && (line[0] == null || line[0].isBlank()));
    }

    private String stripBom(String s) {
        return s.startsWith("\uFEFF") ? s.substring(1) : s;
    }
}
