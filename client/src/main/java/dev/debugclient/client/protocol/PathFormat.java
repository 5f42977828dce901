package dev.debugclient.client.protocol;

import dev.debugclient.client.value.Marshaller;
import dev.debugclient.client.value.TaggedUnion;
import dev.debugclient.client.value.ValueCloner;
import java.util.Objects;

/**
 * Format of paths exchanged with the adapter: {@code path}, {@code uri}, or a vendor specific string.
 */
public final class PathFormat implements TaggedUnion {

    public static final PathFormat PATH = new PathFormat("path", null);
    public static final PathFormat URI = new PathFormat("uri", null);

    private final String tag;
    private final String other;

    private PathFormat(String tag, String other) {
        this.tag = tag;
        this.other = other;
    }

    public static PathFormat other(String format) {
        return new PathFormat("string", Objects.requireNonNull(format));
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
    public PathFormat deepClone(ValueCloner cloner) {
        return other == null ? this : other(Marshaller.deepClone(cloner, other));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PathFormat that)) {
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
