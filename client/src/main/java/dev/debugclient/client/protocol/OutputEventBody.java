package dev.debugclient.client.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import dev.debugclient.client.value.FieldVisitor;
import dev.debugclient.client.value.Marshaller;
import dev.debugclient.client.value.ProtocolValue;
import dev.debugclient.client.value.ValueCloner;

/**
 * Body of an {@code output} event. A missing category means {@code console}.
 */
public record OutputEventBody(
    String category,
    String output,
    String group,
    Integer variablesReference,
    Integer line,
    Integer column,
    JsonNode data
) implements ProtocolValue {

    public static final String CONSOLE = "console";

    public static OutputEventBody of(String category, String output) {
        return new OutputEventBody(category, output, null, null, null, null, null);
    }

    public String categoryOrDefault() {
        return category == null ? CONSOLE : category;
    }

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.field("category", category);
        visitor.field("output", output);
        visitor.field("group", group);
        visitor.field("variablesReference", variablesReference);
        visitor.field("line", line);
        visitor.field("column", column);
        visitor.field("data", data);
    }

    @Override
    public OutputEventBody deepClone(ValueCloner cloner) {
        return new OutputEventBody(
            Marshaller.deepClone(cloner, category),
            Marshaller.deepClone(cloner, output),
            Marshaller.deepClone(cloner, group),
            variablesReference,
            line,
            column,
            Marshaller.deepClone(cloner, data));
    }
}
