package dev.debugclient.client.protocol;

import dev.debugclient.client.value.FieldVisitor;
import dev.debugclient.client.value.Marshaller;
import dev.debugclient.client.value.ProtocolValue;
import dev.debugclient.client.value.ValueCloner;

public record DebugThread(int id, String name) implements ProtocolValue {

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.field("id", id);
        visitor.field("name", name);
    }

    @Override
    public DebugThread deepClone(ValueCloner cloner) {
        return new DebugThread(id, Marshaller.deepClone(cloner, name));
    }
}
