package com.repo.treemap.source;

import com.repo.treemap.core.DatasetException;
import com.repo.treemap.core.TreemapConfig;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves which header holds the numeric measure.
 * An explicitly configured column wins; otherwise the last column is taken unless it is a
 * hierarchy level, then the first header containing one of the configured keywords.
 */
public class ValueColumnDetector {

    private final TreemapConfig config;

    public ValueColumnDetector(TreemapConfig config) {
        this.config = config;
    }

    public String detect(List<String> header) throws DatasetException {
        Optional<String> configured = config.getValueColumn();
        if (configured.isPresent()) {
            return requirePresent(header, configured.get());
        }

        if (header.isEmpty()) {
            throw new DatasetException(DatasetException.Reason.VALUE_COLUMN_UNDETERMINED,
                    "Cannot determine the value column: the header is empty.");
        }

        String last = header.get(header.size() - 1);
        if (!config.getHierarchyColumns().contains(last) && !containsExcludedKeyword(last)) {
            System.out.println("Info: Automatically detected value column as '" + last + "'.");
            return last;
        }

        System.err.println("Warning: Could not reliably detect value column from the last header '" + last + "'.");
        for (String column : header) {
            for (String keyword : config.getValueKeywords()) {
                if (column.contains(keyword) && !config.getHierarchyColumns().contains(column)) {
                    System.out.println("Info: Using heuristic value column: '" + column + "'.");
                    return column;
                }
            }
        }

        throw new DatasetException(DatasetException.Reason.VALUE_COLUMN_UNDETERMINED,
                "Cannot determine the value column. No header containing any of "
                        + config.getValueKeywords() + " was found.");
    }

    private String requirePresent(List<String> header, String column) throws DatasetException {
        if (!header.contains(column)) {
            throw new DatasetException(DatasetException.Reason.MISSING_VALUE_COLUMN,
                    "Required value column '" + column + "' is missing from the CSV.");
        }
        return column;
    }

    private boolean containsExcludedKeyword(String column) {
        String keyword = config.getExcludedHeaderKeyword();
        if (keyword == null || keyword.isEmpty())
            return false;
        return column.toLowerCase(Locale.ROOT).contains(keyword.toLowerCase(Locale.ROOT));
    }
}
