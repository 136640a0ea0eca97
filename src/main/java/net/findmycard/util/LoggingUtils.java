package net.findmycard.util;

import java.util.Arrays;
import org.slf4j.Logger;

/**
 * Helpers for logging warnings and errors with an optional cause appended as the last argument.
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

    public static void warn(Logger logger, Throwable throwable, String message, Object... args) {
        if (logger == null || message == null) {
            return;
        }
        logger.warn(message, withCause(throwable, args));
    }

    /**
     * Short description of a failure for warn lines that should not carry a stack trace.
     */
    public static String describe(Throwable throwable) {
        if (throwable == null) {
            return "unknown";
        }
        String message = throwable.getMessage();
        return throwable.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }

    private static Object[] withCause(Throwable throwable, Object... args) {
        Object[] base = args == null ? new Object[0] : args;
        if (throwable == null) {
            return base;
        }
        Object[] finalArgs = Arrays.copyOf(base, base.length + 1);
        finalArgs[finalArgs.length - 1] = throwable;
        return finalArgs;
    }
}
