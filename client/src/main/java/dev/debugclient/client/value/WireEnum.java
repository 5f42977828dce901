package dev.debugclient.client.value;

import java.util.Optional;

/**
 * An enumeration whose constants have a fixed spelling on the wire.
 */
public interface WireEnum {

    String wireName();

    static <E extends Enum<E> & WireEnum> Optional<E> fromWireName(Class<E> type, String wireName) {
        for (E constant : type.getEnumConstants()) {
            if (constant.wireName().equals(wireName)) {
                return Optional.of(constant);
            }
        }
        return Optional.empty();
    }
}
