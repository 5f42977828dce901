package dev.debugclient.client.data;

public enum ThreadState {
    /** No stopped or continued event has named the thread yet. */
    UNKNOWN,
    STOPPED,
    CONTINUED
}
