package dev.debugclient.client.protocol;

/**
 * Body of a {@code module} event.
 */
public record ModuleEventBody(ModuleEventReason reason, DebugModule module) {
}
