package com.graphload.core.service.csv;

/**
 * Inferred description of one CSV column.
 *
 * @param sampleValue first non-empty value, null for UNKNOWN columns
 * @param format winning layout for DATE and DATETIME columns, null otherwise
 */
public record ColumnMetadata(
        DataType type,
        String sampleValue,
        TemporalFormat format
) {

    public static ColumnMetadata unknown() {
        return new ColumnMetadata(DataType.UNKNOWN, null, null);
    }

    public static ColumnMetadata of(DataType type, String sampleValue) {
        return new ColumnMetadata(type, sampleValue, null);
    }
}
