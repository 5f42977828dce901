package dev.debugclient.client.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.debugclient.client.DapError;
import dev.debugclient.client.DapException;
import java.util.OptionalInt;

/**
 * Field access on received messages.
 */
public final class Messages {

    private Messages() {
    }

    /**
     * @return the {@code body} object, or {@code null} when the message has none
     */
    public static ObjectNode optionalBody(ObjectNode message) throws DapException {
        JsonNode body = message.get("body");
        if (body == null || body.isNull()) {
            return null;
        }
        if (!body.isObject()) {
            throw new DapException(DapError.INVALID_MESSAGE, "Message body is " + body.getNodeType() + ", not an object");
        }
        return (ObjectNode) body;
    }

    public static ObjectNode body(ObjectNode message) throws DapException {
        ObjectNode body = optionalBody(message);
        if (body == null) {
            throw new DapException(DapError.INVALID_MESSAGE, "Message has no body: " + describe(message));
        }
        return body;
    }

    /**
     * Reads an integer correlation field such as {@code seq} or {@code request_seq}.
     *
     * @return empty when the field is absent
     */
    static OptionalInt seqField(ObjectNode message, String field) throws DapException {
        JsonNode value = message.get(field);
        if (value == null) {
            return OptionalInt.empty();
        }
        if (!value.isInt()) {
            throw new DapException(DapError.INVALID_SEQ_FROM_ADAPTER,
                "Field '" + field + "' is " + value.getNodeType() + ", not an integer");
        }
        return OptionalInt.of(value.intValue());
    }

    static String describe(ObjectNode message) {
        String name = message.has("event") ? message.path("event").asText() : message.path("command").asText();
        return message.path("type").asText() + " " + name + " seq=" + message.path("seq").asText();
    }
}
