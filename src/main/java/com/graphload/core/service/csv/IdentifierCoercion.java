package com.graphload.core.service.csv;

import java.util.regex.Pattern;

/**
 * Identifier values are stored as integers when they look like one, so that
 * {@code 1} in a node file and {@code 1} in a relationship file match.
 */
public final class IdentifierCoercion {

    private static final Pattern WHOLE_NUMBER = Pattern.compile("-?\\d+");

    private IdentifierCoercion() {
    }

    /**
     * @return a Long for whole numbers within range, the trimmed text otherwise, null for blank input
     */
    public static Object coerce(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim();
        if (value.isEmpty()) {
            return null;
        }
        if (WHOLE_NUMBER.matcher(value).matches()) {
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                return value;
            }
        }
        return value;
    }
}
