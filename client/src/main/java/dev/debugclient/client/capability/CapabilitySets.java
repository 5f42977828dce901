package dev.debugclient.client.capability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.debugclient.client.value.WireEnum;
import java.util.EnumSet;

public final class CapabilitySets {

    private CapabilitySets() {
    }

    /**
     * Collects the capabilities whose wire name matches a boolean field of {@code fields} that is {@code true}.
     * Fields that are absent, null or not booleans leave the capability unset.
     */
    public static <E extends Enum<E> & WireEnum> EnumSet<E> fromFields(ObjectNode fields, Class<E> kind) {
        EnumSet<E> set = EnumSet.noneOf(kind);
        if (fields == null) {
            return set;
        }
        for (E capability : kind.getEnumConstants()) {
            JsonNode field = fields.get(capability.wireName());
            if (field != null && field.isBoolean() && field.booleanValue()) {
                set.add(capability);
            }
        }
        return set;
    }
}
