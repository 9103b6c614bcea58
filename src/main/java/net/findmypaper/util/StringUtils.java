package net.findmypaper.util;

import java.util.Locale;

/**
 * Null-safe string helpers.
 *
 * @since 0.1.0
 */
public final class StringUtils {

    private StringUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns the first non-blank string from the provided arguments.
     *
     * <pre>{@code
     * StringUtils.coalesce(null, "", "  ", "value", "other"); // "value"
     * StringUtils.coalesce(null, "");                          // null
     * }</pre>
     *
     * @param values candidates in priority order
     * @return first non-blank string, or null if all are blank/null
     */
    public static String coalesce(String... values) {
        if (values == null) {
            return null;
        }
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    /**
     * Trims and lower-cases a string with {@link Locale#ROOT}; null stays null.
     */
    public static String normalizeLowercase(String value) {
        if (value == null) {
            return null;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Collapses runs of whitespace (including line breaks) into single spaces and trims.
     */
    public static String collapseWhitespace(String value) {
        if (value == null) {
            return null;
        }
        return value.replaceAll("\\s+", " ").trim();
    }

    /**
     * Cuts {@code value} to at most {@code maxLength} characters, marking the cut with "...".
     */
    public static String abbreviate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        if (maxLength <= 3) {
            return value.substring(0, Math.max(maxLength, 0));
        }
        return value.substring(0, maxLength - 3) + "...";
    }
}
