package net.findmybook.googlebooks.util;

import java.util.Arrays;
import org.slf4j.Logger;

/**
 * Lightweight helpers for consistent logging of warnings and errors with optional causes.
 * The throwable is appended as the last argument so SLF4J prints its stack trace.
 */
public final class LoggingUtils {
    private LoggingUtils() {
    }

    public static void error(Logger logger, Throwable throwable, String message, Object... args) {
        log(logger, LogLevel.ERROR, throwable, message, args);
    }

    public static void warn(Logger logger, Throwable throwable, String message, Object... args) {
        log(logger, LogLevel.WARN, throwable, message, args);
    }

    static Object[] withCause(Throwable throwable, Object... args) {
        Object[] base = (args == null || args.length == 0) ? new Object[0] : Arrays.copyOf(args, args.length);
        if (throwable == null) {
            return base;
        }
        Object[] finalArgs = Arrays.copyOf(base, base.length + 1);
        finalArgs[finalArgs.length - 1] = throwable;
        return finalArgs;
    }

    private static void log(Logger logger, LogLevel level, Throwable throwable, String message, Object... args) {
        if (logger == null || message == null) {
            return;
        }
        Object[] finalArgs = withCause(throwable, args);
        switch (level) {
            case ERROR -> logger.error(message, finalArgs);
            case WARN -> logger.warn(message, finalArgs);
        }
    }

    private enum LogLevel {
        ERROR,
        WARN
    }
}
