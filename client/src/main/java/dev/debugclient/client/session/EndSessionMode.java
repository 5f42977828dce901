package dev.debugclient.client.session;

/**
 * How {@link Session#endSession(EndSessionMode)} stops the debuggee.
 */
public enum EndSessionMode {
    /** Ask the debuggee to shut down gracefully. Needs {@code supportsTerminateRequest}. */
    TERMINATE,
    DISCONNECT
}
