package com.graphload.core.service.csv;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One data row keyed by header column; empty cells are null, others trimmed.
 *
 * @param rowNumber position in the file, the header being row 1
 */
public record TypedRow(int rowNumber, Map<String, String> values) {

    public TypedRow {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String get(String column) {
        return values.get(column);
    }

    public boolean isEmpty(String column) {
        String value = values.get(column);
        return value == null || value.isEmpty();
    }
}
