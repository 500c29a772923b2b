package com.graphload.core.service.csv;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Set;

/**
 * Converts raw cell text into the Java value of its column's inferred type.
 *
 * Conversion never fails: a value its column type cannot represent is
 * returned as the original string.
 */
@Slf4j
public final class ValueConverter {

    private static final Set<String> TRUE_LITERALS = Set.of("true", "1", "yes");

    private ValueConverter() {
    }

    /**
     * @return Long, Double, Boolean, LocalDate, LocalDateTime, the raw string, or null for null input
     */
    public static Object convert(String raw, ColumnMetadata column) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        if (column == null) {
            return raw;
        }

        try {
            return switch (column.type()) {
                case INTEGER -> Long.valueOf(raw);
                case FLOAT -> Double.valueOf(raw);
                case BOOLEAN -> TRUE_LITERALS.contains(raw.toLowerCase(Locale.ROOT));
                case DATE -> column.format() == null ? raw : LocalDate.parse(raw, column.format().formatter());
                case DATETIME -> column.format() == null ? raw : LocalDateTime.parse(raw, column.format().formatter());
                case STRING, UNKNOWN -> raw;
            };
        } catch (NumberFormatException | DateTimeParseException e) {
            log.debug("Keeping '{}' as text, not a valid {}: {}", raw, column.type(), e.getMessage());
            return raw;
        }
    }
}
