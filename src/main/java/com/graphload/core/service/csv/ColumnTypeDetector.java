package com.graphload.core.service.csv;

import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Infers a column's data type from a sample of its non-empty values.
 *
 * Classes are tried in the order INTEGER, FLOAT, BOOLEAN, DATE, DATETIME and
 * the first one every sampled value satisfies wins. Temporal classes need a
 * single layout that parses the whole sample.
 */
public class ColumnTypeDetector {

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern FLOAT = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Set<String> BOOLEAN_LITERALS = Set.of("true", "false", "1", "0", "yes", "no");

    private final int sampleSize;

    public ColumnTypeDetector(int sampleSize) {
        if (sampleSize <= 0) {
            throw new IllegalArgumentException("Sample size must be positive: " + sampleSize);
        }
        this.sampleSize = sampleSize;
    }

    /**
     * @param values the column's non-null values in row order
     */
    public ColumnMetadata detect(List<String> values) {
        if (values.isEmpty()) {
            return ColumnMetadata.unknown();
        }

        var sample = values.subList(0, Math.min(sampleSize, values.size()));
        String first = sample.get(0);

        if (all(sample, ColumnTypeDetector::isInteger)) {
            return ColumnMetadata.of(DataType.INTEGER, first);
        }
        if (all(sample, ColumnTypeDetector::isFloat)) {
            return ColumnMetadata.of(DataType.FLOAT, first);
        }
        if (all(sample, ColumnTypeDetector::isBoolean)) {
            return ColumnMetadata.of(DataType.BOOLEAN, first);
        }
        for (DataType temporal : List.of(DataType.DATE, DataType.DATETIME)) {
            for (TemporalFormat format : TemporalFormat.forType(temporal)) {
                if (all(sample, value -> parses(value, format))) {
                    return new ColumnMetadata(temporal, first, format);
                }
            }
        }
        return ColumnMetadata.of(DataType.STRING, first);
    }

    static boolean isInteger(String value) {
        if (!INTEGER.matcher(value).matches()) {
            return false;
        }
        try {
            Long.parseLong(value);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    static boolean isFloat(String value) {
        return FLOAT.matcher(value).matches();
    }

    static boolean isBoolean(String value) {
        return BOOLEAN_LITERALS.contains(value.toLowerCase(Locale.ROOT));
    }

    static boolean parses(String value, TemporalFormat format) {
        try {
            format.formatter().parse(value);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static boolean all(List<String> sample, Predicate<String> check) {
        return sample.stream().allMatch(check);
    }
}
