package com.graphload.core.service.csv;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A fully read CSV file: its header, data rows and per-column metadata.
 */
public record ParsedCsv(
        CsvHeader header,
        List<TypedRow> rows,
        Map<String, ColumnMetadata> columns
) {

    public ParsedCsv {
        rows = List.copyOf(rows);
        columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return header.size();
    }

    public List<String> columnNames() {
        return header.columns();
    }

    public ColumnMetadata column(String name) {
        return columns.get(name);
    }

    public Map<String, DataType> dataTypes() {
        var types = new LinkedHashMap<String, DataType>();
        columns.forEach((name, metadata) -> types.put(name, metadata.type()));
        return types;
    }

    /**
     * Column to first non-empty value; null values are kept for UNKNOWN columns.
     */
    public Map<String, String> sampleValues() {
        var samples = new LinkedHashMap<String, String>();
        columns.forEach((name, metadata) -> samples.put(name, metadata.sampleValue()));
        return samples;
    }
}
