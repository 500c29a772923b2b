package com.graphload.core.service.persistence;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Labels, relationship types and property names are spliced into Cypher
 * text, so they are restricted to letters, digits and underscores and always
 * back-tick quoted.
 */
public final class CypherIdentifiers {

    private static final Pattern VALID = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern INVALID_CHARS = Pattern.compile("[^A-Za-z0-9_]+");

    private CypherIdentifiers() {
    }

    /**
     * @throws IllegalArgumentException for null, empty, or characters outside {@code [A-Za-z0-9_]}, or a leading digit
     */
    public static String sanitize(String identifier) {
        if (identifier == null || !VALID.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Invalid graph identifier: '" + identifier + "'");
        }
        return identifier;
    }

    public static boolean isValid(String identifier) {
        return identifier != null && VALID.matcher(identifier).matches();
    }

    /**
     * Back-tick quotes a name; embedded back-ticks are doubled.
     */
    public static String quote(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }

    /**
     * Sanitizes then quotes.
     */
    public static String safe(String identifier) {
        return quote(sanitize(identifier));
    }

    /**
     * Turns free text, such as a file name stem, into a valid identifier.
     *
     * @param upperCase relationship types are upper-cased, labels keep their case
     * @return null when nothing usable is left
     */
    public static String normalize(String text, boolean upperCase) {
        if (text == null) {
            return null;
        }
        String cleaned = INVALID_CHARS.matcher(text.trim()).replaceAll("_");
        cleaned = cleaned.replaceAll("^_+|_+$", "");
        if (cleaned.isEmpty()) {
            return null;
        }
        if (Character.isDigit(cleaned.charAt(0))) {
            cleaned = "_" + cleaned;
        }
        return upperCase ? cleaned.toUpperCase(Locale.ROOT) : cleaned;
    }
}
