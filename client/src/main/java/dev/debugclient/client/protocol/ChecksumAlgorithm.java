package dev.debugclient.client.protocol;

import com.fasterxml.jackson.annotation.JsonValue;
import dev.debugclient.client.value.WireEnum;

public enum ChecksumAlgorithm implements WireEnum {
    MD5("MD5"),
    SHA1("SHA1"),
    SHA256("SHA256"),
    TIMESTAMP("timestamp");

    private final String wireName;

    ChecksumAlgorithm(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    @Override
    public String wireName() {
        return wireName;
    }
}
