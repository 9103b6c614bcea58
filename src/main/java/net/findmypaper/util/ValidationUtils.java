package net.findmypaper.util;

import java.util.Collection;

/**
 * Null/empty checks shared by the loaders and the engine.
 */
public final class ValidationUtils {
    private ValidationUtils() {
    }

    public static boolean isNullOrEmpty(Collection<?> collection) {
        return collection == null || collection.isEmpty();
    }
}
