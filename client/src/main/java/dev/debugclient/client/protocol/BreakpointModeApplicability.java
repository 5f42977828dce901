package dev.debugclient.client.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import dev.debugclient.client.value.Marshaller;
import dev.debugclient.client.value.TaggedUnion;
import dev.debugclient.client.value.ValueCloner;
import java.util.Objects;

/**
 * The kind of breakpoint a {@link BreakpointMode} applies to: one of the well known kinds, or any other string.
 */
public final class BreakpointModeApplicability implements TaggedUnion {

    public static final BreakpointModeApplicability SOURCE = new BreakpointModeApplicability("source", null);
    public static final BreakpointModeApplicability EXCEPTION = new BreakpointModeApplicability("exception", null);
    public static final BreakpointModeApplicability DATA = new BreakpointModeApplicability("data", null);
    public static final BreakpointModeApplicability INSTRUCTION = new BreakpointModeApplicability("instruction", null);

    private final String tag;
    private final String other;

    private BreakpointModeApplicability(String tag, String other) {
        this.tag = tag;
        this.other = other;
    }

    public static BreakpointModeApplicability other(String value) {
        return new BreakpointModeApplicability("string", Objects.requireNonNull(value));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static BreakpointModeApplicability fromWire(String value) {
        return switch (value) {
            case "source" -> SOURCE;
            case "exception" -> EXCEPTION;
            case "data" -> DATA;
            case "instruction" -> INSTRUCTION;
            default -> other(value);
        };
    }

    @Override
    public String tag() {
        return tag;
    }

    @Override
    public Object payload() {
        return other;
    }

    @Override
    public BreakpointModeApplicability deepClone(ValueCloner cloner) {
        return other == null ? this : other(Marshaller.deepClone(cloner, other));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BreakpointModeApplicability that)) {
            return false;
        }
        return tag.equals(that.tag) && Objects.equals(other, that.other);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tag, other);
    }

    @Override
    public String toString() {
        return other == null ? tag : "string(" + other + ")";
    }
}
