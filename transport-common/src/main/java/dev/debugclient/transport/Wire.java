package dev.debugclient.transport;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simple helper for logging framed traffic in a consistent format, one line per message in either direction.
 */
public final class Wire {

    private static final Logger LOGGER = LoggerFactory.getLogger("WIRE");

    private Wire() {
    }

    public static void rx(String adapterId, JsonNode message) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("RX adapter={} type={} seq={} name={} json={}",
                adapterId,
                message.path("type").asText(),
                message.path("seq").asText(),
                name(message),
                truncate(message.toString(), 200));
        }
    }

    public static void tx(String adapterId, JsonNode message) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("TX adapter={} type={} seq={} name={} json={}",
                adapterId,
                message.path("type").asText(),
                message.path("seq").asText(),
                name(message),
                truncate(message.toString(), 200));
        }
    }

    private static String name(JsonNode message) {
        if (message.has("event")) {
            return message.path("event").asText();
        }
        return message.path("command").asText();
    }

    public static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "…";
    }
}
