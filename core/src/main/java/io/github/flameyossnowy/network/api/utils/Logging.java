package io.github.flameyossnowy.network.api.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Library-wide logging switches.
 * <p>
 * {@link #ENABLED} gates info and deep output, {@link #DEEP} additionally gates
 * the per-query and per-materialization traces. Warnings always go through.
 */
public final class Logging {
    private static final Logger LOGGER = LoggerFactory.getLogger("universal-network");

    public static boolean ENABLED = false;
    public static boolean DEEP = false;

    private Logging() {
        throw new AssertionError("No instances");
    }

    public static void info(String message) {
        if (ENABLED) LOGGER.info(message);
    }

    public static void deepInfo(Supplier<String> message) {
        if (ENABLED && DEEP) LOGGER.debug(message.get());
    }

    public static void warn(String message) {
        LOGGER.warn(message);
    }
}
