package dev.debugclient.client.protocol;

import dev.debugclient.client.value.FieldVisitor;
import dev.debugclient.client.value.Marshaller;
import dev.debugclient.client.value.ProtocolValue;
import dev.debugclient.client.value.ValueCloner;

/**
 * Envelope of an outgoing request. Requests without arguments leave the {@code arguments} field out.
 */
public record Request(int seq, Command command, ProtocolValue arguments) implements ProtocolValue {

    public static final String TYPE = "request";

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.field("seq", seq);
        visitor.field("type", TYPE);
        visitor.field("command", command);
        if (arguments != null) {
            visitor.field("arguments", arguments);
        }
    }

    @Override
    public Request deepClone(ValueCloner cloner) {
        return new Request(seq, command, Marshaller.deepClone(cloner, arguments));
    }
}
