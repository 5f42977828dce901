package dev.debugclient.client.protocol;

public record ExitedEventBody(Integer exitCode) {
}
