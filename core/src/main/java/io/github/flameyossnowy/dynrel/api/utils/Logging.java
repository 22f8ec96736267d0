package io.github.flameyossnowy.dynrel.api.utils;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Library-wide logging switch.
 * <p>
 * Informational output is off unless {@link #ENABLED} is set; {@link #DEEP} additionally
 * turns on per-step resolution traces. Warnings are always forwarded.
 */
public final class Logging {
    public static volatile boolean ENABLED = false;
    public static volatile boolean DEEP = false;

    private static final Logger LOGGER = LoggerFactory.getLogger("dynamic-relations");

    private Logging() {
        throw new AssertionError("No instances");
    }

    public static void info(@NotNull Supplier<String> message) {
        if (ENABLED && LOGGER.isInfoEnabled()) {
            LOGGER.info(message.get());
        }
    }

    public static void deepInfo(@NotNull Supplier<String> message) {
        if (ENABLED && DEEP && LOGGER.isDebugEnabled()) {
            LOGGER.debug(message.get());
        }
    }

    public static void warn(String message) {
        LOGGER.warn(message);
    }
}
