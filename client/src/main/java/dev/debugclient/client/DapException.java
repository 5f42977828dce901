package dev.debugclient.client;

/**
 * Protocol, capability and lifecycle failures reported to the caller.
 */
public class DapException extends Exception {

    private static final long serialVersionUID = 1L;

    private final DapError error;

    public DapException(DapError error, String message) {
        super(error + ": " + message);
        this.error = error;
    }

    public DapException(DapError error, String message, Throwable cause) {
        super(error + ": " + message, cause);
        this.error = error;
    }

    public DapError error() {
        return error;
    }
}
