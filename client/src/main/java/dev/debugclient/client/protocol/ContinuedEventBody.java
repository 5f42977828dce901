package dev.debugclient.client.protocol;

/**
 * Body of a {@code continued} event. A missing {@code allThreadsContinued} means every thread continued.
 */
public record ContinuedEventBody(Integer threadId, Boolean allThreadsContinued) {

    public boolean continuesAllThreads() {
        return allThreadsContinued == null || allThreadsContinued;
    }
}
