package dev.debugclient.client.protocol;

import dev.debugclient.client.value.FieldVisitor;
import dev.debugclient.client.value.Marshaller;
import dev.debugclient.client.value.ProtocolValue;
import dev.debugclient.client.value.ValueCloner;

/**
 * An extra module attribute the adapter wants shown as a column.
 */
public record ColumnDescriptor(String attributeName, String label, String format, ColumnType type, Integer width)
    implements ProtocolValue {

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.field("attributeName", attributeName);
        visitor.field("label", label);
        visitor.field("format", format);
        visitor.field("type", type);
        visitor.field("width", width);
    }

    @Override
    public ColumnDescriptor deepClone(ValueCloner cloner) {
        return new ColumnDescriptor(
            Marshaller.deepClone(cloner, attributeName),
            Marshaller.deepClone(cloner, label),
            Marshaller.deepClone(cloner, format),
            type,
            width);
    }
}
