package net.findmypaper.util;

/**
 * Integer bound helpers for result counts and rank weights.
 */
public final class PagingUtils {

    private PagingUtils() {
        // Utility class
    }

    /**
     * Snap {@code value} up to at least {@code min}.
     */
    public static int atLeast(int value, int min) {
        return value < min ? min : value;
    }
}
