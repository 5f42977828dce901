package dev.debugclient.client.protocol;

import com.fasterxml.jackson.annotation.JsonValue;
import dev.debugclient.client.value.WireEnum;

/**
 * How a module column's value is formatted.
 */
public enum ColumnType implements WireEnum {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    UNIX_TIMESTAMP_UTC("unixTimestampUTC");

    private final String wireName;

    ColumnType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    @Override
    public String wireName() {
        return wireName;
    }
}
