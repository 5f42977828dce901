package dev.debugclient.client.protocol;

import com.fasterxml.jackson.annotation.JsonValue;
import dev.debugclient.client.value.WireEnum;

public enum ModuleEventReason implements WireEnum {
    NEW("new"),
    CHANGED("changed"),
    REMOVED("removed");

    private final String wireName;

    ModuleEventReason(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    @Override
    public String wireName() {
        return wireName;
    }
}
