package dev.debugclient.client.session;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.debugclient.client.DapException;

/**
 * Applies the effects of a response or event before the session marks it handled. A failure leaves the message
 * in the session's failed messages instead.
 */
@FunctionalInterface
public interface MessageHandler {

    MessageHandler NONE = message -> {
    };

    void handle(ObjectNode message) throws DapException;
}
