package com.repo.treemap.core;

/**
 * Structural problem with the input that aborts a run.
 * Recoverable conditions (dropped rows, missing hierarchy levels, total mismatches)
 * are reported as warnings instead.
 */
public class DatasetException extends Exception {

    public enum Reason {
        INPUT_NOT_FOUND,
        UNREADABLE_INPUT,
        EMPTY_DATASET,
        MISSING_VALUE_COLUMN,
        VALUE_COLUMN_UNDETERMINED
    }

    private final Reason reason;

    public DatasetException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public DatasetException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
