package dev.debugclient.client.data;

/**
 * What the session data knows about the debuggee. The exit code of an {@link #EXITED} debuggee is kept in
 * {@link SessionData#exitCode()}.
 */
public enum DebuggeeStatus {
    NOT_RUNNING,
    RUNNING,
    STOPPED,
    EXITED
}
