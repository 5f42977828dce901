package dev.debugclient.client.protocol;

import dev.debugclient.client.value.FieldVisitor;
import dev.debugclient.client.value.Marshaller;
import dev.debugclient.client.value.ProtocolValue;
import dev.debugclient.client.value.ValueCloner;
import java.util.List;

public record BreakpointMode(String mode, String label, String description, List<BreakpointModeApplicability> appliesTo)
    implements ProtocolValue {

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.field("mode", mode);
        visitor.field("label", label);
        visitor.field("description", description);
        visitor.field("appliesTo", appliesTo);
    }

    @Override
    public BreakpointMode deepClone(ValueCloner cloner) {
        return new BreakpointMode(
            Marshaller.deepClone(cloner, mode),
            Marshaller.deepClone(cloner, label),
            Marshaller.deepClone(cloner, description),
            Marshaller.deepCloneList(cloner, appliesTo));
    }
}
