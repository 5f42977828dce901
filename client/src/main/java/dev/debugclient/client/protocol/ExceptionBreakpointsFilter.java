package dev.debugclient.client.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.debugclient.client.value.FieldVisitor;
import dev.debugclient.client.value.Marshaller;
import dev.debugclient.client.value.ProtocolValue;
import dev.debugclient.client.value.ValueCloner;

/**
 * An exception filter the adapter offers for {@code setExceptionBreakpoints}.
 *
 * @param enabledByDefault the wire field {@code default}
 */
public record ExceptionBreakpointsFilter(
    String filter,
    String label,
    String description,
    @JsonProperty("default") Boolean enabledByDefault,
    Boolean supportsCondition,
    String conditionDescription
) implements ProtocolValue {

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.field("filter", filter);
        visitor.field("label", label);
        visitor.field("description", description);
        visitor.field("default", enabledByDefault);
        visitor.field("supportsCondition", supportsCondition);
        visitor.field("conditionDescription", conditionDescription);
    }

    @Override
    public ExceptionBreakpointsFilter deepClone(ValueCloner cloner) {
        return new ExceptionBreakpointsFilter(
            Marshaller.deepClone(cloner, filter),
            Marshaller.deepClone(cloner, label),
            Marshaller.deepClone(cloner, description),
            enabledByDefault,
            supportsCondition,
            Marshaller.deepClone(cloner, conditionDescription));
    }
}
