package dev.debugclient.client;

/**
 * Failure codes surfaced by the session engine and the value marshaller.
 */
public enum DapError {

    /** The message root is not an object, or a mandatory envelope field is missing or mistyped. */
    INVALID_MESSAGE,
    /** The message {@code type} is neither {@code response} nor {@code event}. */
    UNKNOWN_MESSAGE,
    RESPONSE_DOES_NOT_EXIST,
    /** A response names a {@code request_seq} that matches no request awaiting its response. */
    REQUEST_NOT_OUTSTANDING,
    EVENT_DOES_NOT_EXIST,
    REQUEST_FAILED,
    REQUEST_RESPONSE_MISMATCHED_SEQ,
    WRONG_COMMAND_FOR_RESPONSE,
    /** A correlation field ({@code seq} or {@code request_seq}) on the wire is not an integer. */
    INVALID_SEQ_FROM_ADAPTER,
    ADAPTER_DOES_NOT_SUPPORT_CONFIGURATION_DONE,
    ADAPTER_DOES_NOT_SUPPORT_TERMINATE,
    ADAPTER_DOES_NOT_SUPPORT_REQUEST,
    SESSION_NOT_STARTED,
    ANCESTOR_DOES_NOT_EXIST,
    ANCESTOR_IS_NOT_AN_OBJECT,
    /** The adapter closed its output stream while a message was being read. */
    END_OF_STREAM,
    /** The adapter died earlier in this session; a new session is required. */
    ADAPTER_DIED,
    ADAPTER_NOT_SPAWNED,
    ADAPTER_ALREADY_SPAWNED
}
