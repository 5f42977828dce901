package dev.debugclient.client.session;

public enum SessionState {
    NOT_STARTED,
    LAUNCHED,
    /** Reserved, attaching to a running debuggee is not supported yet. */
    ATTACHED,
    TERMINATED
}
