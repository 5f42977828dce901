package dev.debugclient.client.value;

/**
 * A value with exactly one active branch. A branch without data encodes as its tag name; a branch carrying data
 * encodes as that data, under the field name of the union.
 */
public interface TaggedUnion {

    String tag();

    /**
     * @return the active branch's data, or {@code null} when the branch carries none
     */
    Object payload();

    TaggedUnion deepClone(ValueCloner cloner);
}
