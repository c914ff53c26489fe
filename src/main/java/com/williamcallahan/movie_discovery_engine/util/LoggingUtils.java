package com.williamcallahan.movie_discovery_engine.util;

import org.slf4j.Logger;

import java.util.Arrays;

/**
 * Helpers for consistent warn/error logging with an optional cause appended to the arguments
 */
public final class LoggingUtils {
    private LoggingUtils() {
    }

    public static void error(Logger logger, Throwable throwable, String message, Object... args) {
        log(logger, true, throwable, message, args);
    }

    public static void warn(Logger logger, Throwable throwable, String message, Object... args) {
        log(logger, false, throwable, message, args);
    }

    private static void log(Logger logger, boolean error, Throwable throwable, String message, Object... args) {
        if (logger == null || message == null) {
            return;
        }

        Object[] finalArgs = args == null ? new Object[0] : args;
        if (throwable != null) {
            finalArgs = Arrays.copyOf(finalArgs, finalArgs.length + 1);
            finalArgs[finalArgs.length - 1] = throwable;
        }

        if (error) {
            logger.error(message, finalArgs);
        } else {
            logger.warn(message, finalArgs);
        }
    }
}
