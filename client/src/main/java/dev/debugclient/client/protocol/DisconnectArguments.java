package dev.debugclient.client.protocol;

import dev.debugclient.client.value.FieldVisitor;
import dev.debugclient.client.value.ProtocolValue;
import dev.debugclient.client.value.ValueCloner;

public record DisconnectArguments(Boolean restart, Boolean terminateDebuggee, Boolean suspendDebuggee)
    implements ProtocolValue {

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.field("restart", restart);
        visitor.field("terminateDebuggee", terminateDebuggee);
        visitor.field("suspendDebuggee", suspendDebuggee);
    }

    @Override
    public DisconnectArguments deepClone(ValueCloner cloner) {
        return this;
    }
}
