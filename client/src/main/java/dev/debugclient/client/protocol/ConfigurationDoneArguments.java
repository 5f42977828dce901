package dev.debugclient.client.protocol;

import dev.debugclient.client.value.FieldVisitor;
import dev.debugclient.client.value.ProtocolValue;
import dev.debugclient.client.value.ValueCloner;

public record ConfigurationDoneArguments() implements ProtocolValue {

    @Override
    public void visitFields(FieldVisitor visitor) {
    }

    @Override
    public ConfigurationDoneArguments deepClone(ValueCloner cloner) {
        return this;
    }
}
