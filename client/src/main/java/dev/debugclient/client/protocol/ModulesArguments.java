package dev.debugclient.client.protocol;

import dev.debugclient.client.value.FieldVisitor;
import dev.debugclient.client.value.ProtocolValue;
import dev.debugclient.client.value.ValueCloner;

/**
 * Paging window of a {@code modules} request; both fields absent asks for every module.
 */
public record ModulesArguments(Integer startModule, Integer moduleCount) implements ProtocolValue {

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.field("startModule", startModule);
        visitor.field("moduleCount", moduleCount);
    }

    @Override
    public ModulesArguments deepClone(ValueCloner cloner) {
        return this;
    }
}
