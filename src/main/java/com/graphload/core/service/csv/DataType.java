package com.graphload.core.service.csv;

/**
 * Value class inferred for a CSV column.
 */
public enum DataType {
    INTEGER,
    FLOAT,
    BOOLEAN,
    DATE,
    DATETIME,
    STRING,
    /** Column without a single non-empty value. */
    UNKNOWN
}
