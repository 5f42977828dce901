package dev.debugclient.client.value;

/**
 * Receives the fields of a {@link ProtocolValue} in wire order. Field names are the wire keys, verbatim.
 */
@FunctionalInterface
public interface FieldVisitor {

    void field(String name, Object value);
}
