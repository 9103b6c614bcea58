package net.findmypaper.util;

import java.util.Arrays;
import org.slf4j.Logger;

/**
 * Helpers for logging errors with an optional cause appended as the last argument.
 */
public final class LoggingUtils {
    private LoggingUtils() {
    }

    public static void error(Logger logger, Throwable throwable, String message, Object... args) {
        if (logger == null || message == null) {
            return;
        }
        logger.error(message, withCause(throwable, args));
    }

    private static Object[] withCause(Throwable throwable, Object... args) {
        Object[] base = (args == null) ? new Object[0] : args;
        if (throwable == null) {
            return base;
        }
        Object[] finalArgs = Arrays.copyOf(base, base.length + 1);
        finalArgs[finalArgs.length - 1] = throwable;
        return finalArgs;
    }
}
