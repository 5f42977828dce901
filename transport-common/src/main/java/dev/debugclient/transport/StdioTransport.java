package dev.debugclient.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.BufferedInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Transport over an adapter's standard output. Polling is done on the caller's thread by checking for
 * buffered bytes, so no reader thread is needed.
 */
public class StdioTransport implements Transport {

    private static final long POLL_STEP_MILLIS = 2;

    private final String adapterId;
    private final InputStream in;
    private final BooleanSupplier alive;
    private final ObjectMapper mapper = new ObjectMapper();

    public StdioTransport(String adapterId, InputStream in, BooleanSupplier alive) {
        this.adapterId = adapterId;
        this.in = in instanceof BufferedInputStream ? in : new BufferedInputStream(in);
        this.alive = alive;
    }

    public static StdioTransport forAdapter(AdapterProcess adapter) {
        return new StdioTransport(adapter.id(), adapter.stdout(), adapter::isAlive);
    }

    @Override
    public boolean messageExists(long timeoutMillis) throws IOException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        while (true) {
            if (in.available() > 0) {
                return true;
            }
            // A dead adapter with nothing buffered is reported as readable so readMessage surfaces the EOF.
            if (!alive.getAsBoolean()) {
                return true;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            try {
                TimeUnit.NANOSECONDS.sleep(Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(POLL_STEP_MILLIS)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                InterruptedIOException interrupted = new InterruptedIOException("Interrupted while polling adapter " + adapterId);
                interrupted.initCause(e);
                throw interrupted;
            }
        }
    }

    @Override
    public JsonNode readMessage() throws IOException {
        String frame;
        try {
            frame = ContentLengthCodec.readFrame(in);
        } catch (EOFException e) {
            // output ended inside a frame
            throw new EndOfStreamException("Adapter " + adapterId + " closed its output stream mid-frame", e);
        }
        if (frame == null) {
            throw new EndOfStreamException("Adapter " + adapterId + " closed its output stream");
        }
        JsonNode message = mapper.readTree(frame);
        Wire.rx(adapterId, message);
        return message;
    }

    @Override
    public byte[] createMessage(ObjectNode message) throws JsonProcessingException {
        Wire.tx(adapterId, message);
        return ContentLengthCodec.encode(mapper.writeValueAsString(message));
    }
}
