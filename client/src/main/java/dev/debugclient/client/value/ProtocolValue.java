package dev.debugclient.client.value;

/**
 * A struct-shaped protocol value. Implementations list their fields explicitly instead of being walked
 * reflectively, and know how to rebuild themselves from cloned parts.
 */
public interface ProtocolValue {

    void visitFields(FieldVisitor visitor);

    /**
     * Returns an equal value whose strings, lists and nested values were all produced through {@code cloner}.
     */
    ProtocolValue deepClone(ValueCloner cloner);
}
