package dev.debugclient.client.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.JsonNode;
import dev.debugclient.client.value.Marshaller;
import dev.debugclient.client.value.TaggedUnion;
import dev.debugclient.client.value.ValueCloner;
import java.util.Objects;

/**
 * A module identifier, which adapters send either as an integer or as a string.
 */
public final class ModuleId implements TaggedUnion {

    private final Integer integer;
    private final String string;

    private ModuleId(Integer integer, String string) {
        this.integer = integer;
        this.string = string;
    }

    public static ModuleId of(int id) {
        return new ModuleId(id, null);
    }

    public static ModuleId of(String id) {
        return new ModuleId(null, Objects.requireNonNull(id));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ModuleId fromWire(JsonNode node) {
        if (node.isInt()) {
            return of(node.intValue());
        }
        if (node.isTextual()) {
            return of(node.textValue());
        }
        throw new IllegalArgumentException("Module id must be an integer or a string, found " + node.getNodeType());
    }

    @Override
    public String tag() {
        return integer != null ? "integer" : "string";
    }

    @Override
    public Object payload() {
        return integer != null ? integer : string;
    }

    @Override
    public ModuleId deepClone(ValueCloner cloner) {
        return integer != null ? this : of(Marshaller.deepClone(cloner, string));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ModuleId that)) {
            return false;
        }
        return Objects.equals(integer, that.integer) && Objects.equals(string, that.string);
    }

    @Override
    public int hashCode() {
        return Objects.hash(integer, string);
    }

    @Override
    public String toString() {
        return String.valueOf(payload());
    }
}
