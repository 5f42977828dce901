package dev.debugclient.client.protocol;

import dev.debugclient.client.value.FieldVisitor;
import dev.debugclient.client.value.ProtocolValue;
import dev.debugclient.client.value.ValueCloner;

public record TerminateArguments(Boolean restart) implements ProtocolValue {

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.field("restart", restart);
    }

    @Override
    public TerminateArguments deepClone(ValueCloner cloner) {
        return this;
    }
}
