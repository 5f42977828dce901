package dev.debugclient.client.session;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;

/**
 * A message as received from the adapter. It lives in exactly one of the session's queues at a time.
 */
public record RawMessage(ObjectNode message, Instant receivedAt) {

    public String type() {
        return message.path("type").asText();
    }
}
