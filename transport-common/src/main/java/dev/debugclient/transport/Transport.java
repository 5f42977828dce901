package dev.debugclient.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;

/**
 * Frames and deframes one JSON message at a time over the adapter's output stream.
 */
public interface Transport {

    /**
     * Waits up to {@code timeoutMillis} for the start of a message.
     *
     * @return {@code true} when {@link #readMessage()} can be called without waiting for the adapter
     */
    boolean messageExists(long timeoutMillis) throws IOException;

    /**
     * Reads and parses the next message.
     *
     * @throws EndOfStreamException when the adapter closed its output stream
     */
    JsonNode readMessage() throws IOException;

    byte[] createMessage(ObjectNode message) throws IOException;
}
