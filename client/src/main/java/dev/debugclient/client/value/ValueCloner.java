package dev.debugclient.client.value;

/**
 * Strategy used by {@link Marshaller#deepClone(ValueCloner, Object)} to duplicate strings. The same clone walk
 * serves a short-lived copy and a long-lived interned cache depending on the strategy supplied.
 */
@FunctionalInterface
public interface ValueCloner {

    String cloneString(String value);

    /**
     * A cloner that gives every cloned string its own instance.
     */
    static ValueCloner copying() {
        return value -> new String(value);
    }
}
