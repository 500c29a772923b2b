package com.graphload.core.service.csv;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.Arrays;
import java.util.List;

/**
 * Date and date-time layouts recognised in CSV cells, in detection order.
 */
public enum TemporalFormat {

    ISO_DATE(DataType.DATE, pattern("uuuu-M-d")),
    US_DATE(DataType.DATE, pattern("M/d/uuuu")),
    EUROPEAN_DATE(DataType.DATE, pattern("d/M/uuuu")),
    SLASHED_ISO_DATE(DataType.DATE, pattern("uuuu/M/d")),

    SPACED_DATETIME(DataType.DATETIME, pattern("uuuu-M-d H:mm:ss")),
    ISO_DATETIME(DataType.DATETIME, pattern("uuuu-M-d'T'H:mm:ss")),
    SPACED_DATETIME_FRACTION(DataType.DATETIME, withFraction("uuuu-M-d H:mm:ss")),
    ISO_DATETIME_FRACTION(DataType.DATETIME, withFraction("uuuu-M-d'T'H:mm:ss")),
    US_DATETIME(DataType.DATETIME, pattern("M/d/uuuu H:mm:ss"));

    private final DataType type;
    private final DateTimeFormatter formatter;

    TemporalFormat(DataType type, DateTimeFormatter formatter) {
        this.type = type;
        this.formatter = formatter;
    }

    public DataType type() {
        return type;
    }

    public DateTimeFormatter formatter() {
        return formatter;
    }

    static List<TemporalFormat> forType(DataType type) {
        return Arrays.stream(values()).filter(format -> format.type == type).toList();
    }

    private static DateTimeFormatter pattern(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }

    private static DateTimeFormatter withFraction(String pattern) {
        return new DateTimeFormatterBuilder()
                .appendPattern(pattern)
                .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
                .toFormatter()
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
