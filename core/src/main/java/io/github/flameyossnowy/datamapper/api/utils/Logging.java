package io.github.flameyossnowy.datamapper.api.utils;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Static logging facade used across the mapper.
 *
 * <p>{@link #info} and {@link #deepInfo} messages are built lazily and only when
 * the corresponding switch is on, so statement text is never rendered for nothing.
 * Warnings and errors are always forwarded.</p>
 */
public final class Logging {
    private static final Logger LOGGER = LoggerFactory.getLogger("DataMapper");

    /** Enables informational output such as compiled statements. */
    public static volatile boolean ENABLED = false;

    /** Enables verbose output (bind values, model dumps). Implies nothing unless {@link #ENABLED} is on too. */
    public static volatile boolean DEEP = false;

    private Logging() {}

    public static void info(@NotNull Supplier<String> message) {
        if (ENABLED && LOGGER.isInfoEnabled()) {
            LOGGER.info(message.get());
        }
    }

    public static void info(String message) {
        if (ENABLED) {
            LOGGER.info(message);
        }
    }

    public static void deepInfo(@NotNull Supplier<String> message) {
        if (ENABLED && DEEP && LOGGER.isDebugEnabled()) {
            LOGGER.debug(message.get());
        } else if (ENABLED && DEEP) {
            LOGGER.info(message.get());
        }
    }

    public static void warn(String message) {
        LOGGER.warn(message);
    }

    public static void error(String message) {
        LOGGER.error(message);
    }

    public static void error(String message, Throwable cause) {
        LOGGER.error(message, cause);
    }
}
