package dev.apiproxy.protocol;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs protocol traffic in the same format on both sides of a plugin channel.
 */
public final class Wire {

    private static final Logger LOGGER = LoggerFactory.getLogger("WIRE");

    private static final int MAX_LOGGED_CHARS = 200;

    private Wire() {
    }

    public static void rx(String channel, String line) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("RX {} {}", channel, truncate(strip(line), MAX_LOGGED_CHARS));
        }
    }

    public static void tx(String channel, String line) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("TX {} {}", channel, truncate(strip(line), MAX_LOGGED_CHARS));
        }
    }

    public static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }

    private static String strip(String line) {
        return line == null ? null : line.stripTrailing();
    }
}
