package dev.debugclient.transport;

import java.io.EOFException;

/**
 * Signals that the adapter closed its output stream. The adapter is considered dead once this is seen.
 */
public class EndOfStreamException extends EOFException {

    private static final long serialVersionUID = 1L;

    public EndOfStreamException(String message) {
        super(message);
    }

    public EndOfStreamException(String message, Throwable cause) {
        super(message);
        initCause(cause);
    }
}
