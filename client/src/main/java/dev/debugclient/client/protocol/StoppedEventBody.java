package dev.debugclient.client.protocol;

import dev.debugclient.client.value.FieldVisitor;
import dev.debugclient.client.value.Marshaller;
import dev.debugclient.client.value.ProtocolValue;
import dev.debugclient.client.value.ValueCloner;
import java.util.List;

/**
 * Body of a {@code stopped} event. {@code reason} is kept as the adapter sent it since adapters may use reasons
 * outside the well-known set.
 */
public record StoppedEventBody(
    String reason,
    String description,
    Integer threadId,
    Boolean preserveFocusHint,
    String text,
    Boolean allThreadsStopped,
    List<Integer> hitBreakpointIds
) implements ProtocolValue {

    public boolean stopsAllThreads() {
        return Boolean.TRUE.equals(allThreadsStopped);
    }

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.field("reason", reason);
        visitor.field("description", description);
        visitor.field("threadId", threadId);
        visitor.field("preserveFocusHint", preserveFocusHint);
        visitor.field("text", text);
        visitor.field("allThreadsStopped", allThreadsStopped);
        visitor.field("hitBreakpointIds", hitBreakpointIds);
    }

    @Override
    public StoppedEventBody deepClone(ValueCloner cloner) {
        return new StoppedEventBody(
            Marshaller.deepClone(cloner, reason),
            Marshaller.deepClone(cloner, description),
            threadId,
            preserveFocusHint,
            Marshaller.deepClone(cloner, text),
            allThreadsStopped,
            Marshaller.deepCloneList(cloner, hitBreakpointIds));
    }
}
