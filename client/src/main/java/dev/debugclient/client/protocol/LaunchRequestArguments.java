package dev.debugclient.client.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import dev.debugclient.client.value.FieldVisitor;
import dev.debugclient.client.value.Marshaller;
import dev.debugclient.client.value.ProtocolValue;
import dev.debugclient.client.value.ValueCloner;

/**
 * Arguments of the {@code launch} request. Anything adapter specific (the program, its arguments...) travels as
 * extra fields injected next to these.
 *
 * @param restart the wire field {@code __restart}: data from a {@code terminated} event, handed back untouched
 */
public record LaunchRequestArguments(Boolean noDebug, JsonNode restart) implements ProtocolValue {

    public static LaunchRequestArguments defaults() {
        return new LaunchRequestArguments(null, null);
    }

    public static LaunchRequestArguments restarting(JsonNode restart) {
        return new LaunchRequestArguments(null, restart);
    }

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.field("noDebug", noDebug);
        visitor.field("__restart", restart);
    }

    @Override
    public LaunchRequestArguments deepClone(ValueCloner cloner) {
        return new LaunchRequestArguments(noDebug, Marshaller.deepClone(cloner, restart));
    }
}
