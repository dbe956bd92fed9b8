package com.bank.billshock.model;

/**
 * Stable failure kinds reported by validation and by the training / detection pipelines.
 */
public enum ErrorKind {
    FILE_NOT_FOUND,
    WRONG_FORMAT,
    EMPTY_DATA,
    MISSING_COLUMN,
    NON_NUMERIC_COLUMN,
    ALL_MISSING_VALUES,
    INVALID_PARAMETER,
    MODEL_NOT_FOUND,
    CORRUPT_MODEL,
    NO_VALID_DATA,
    UNEXPECTED;

    public boolean isNotFound() {
        return this == FILE_NOT_FOUND || this == MODEL_NOT_FOUND;
    }

    public boolean isInternal() {
        return this == CORRUPT_MODEL || this == UNEXPECTED;
    }
}
