package dev.debugclient.client.value;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.JsonNodeType;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.debugclient.client.DapError;
import dev.debugclient.client.DapException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Converts typed protocol values to and from the generic object tree used on the wire, injects extra fields
 * into built objects and deep-clones protocol values.
 *
 * <p>Values the marshaller cannot represent are integration errors and fail with
 * {@link IllegalArgumentException}. Failures caused by the data itself are reported as {@link DapException}.
 */
public final class Marshaller {

    private static final JsonNodeFactory FACTORY = JsonNodeFactory.instance;

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private Marshaller() {
    }

    /**
     * Builds the object for a struct-shaped value. {@code null} (or an empty {@link Optional}) yields an empty
     * object, a pre-built {@link ObjectNode} is copied and a union recurses into its active data branch.
     */
    public static ObjectNode toObject(Object value) {
        if (value == null) {
            return FACTORY.objectNode();
        }
        if (value instanceof Optional<?> optional) {
            return toObject(optional.orElse(null));
        }
        if (value instanceof ObjectNode object) {
            return object.deepCopy();
        }
        if (value instanceof ProtocolValue struct) {
            return structToObject(struct);
        }
        if (value instanceof TaggedUnion union && union.payload() != null) {
            return toObject(union.payload());
        }
        throw new IllegalArgumentException("Only structs and objects can become a message object, found "
            + value.getClass().getName());
    }

    public static JsonNode toNode(Object value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        if (value instanceof Optional<?> optional) {
            return toNode(optional.orElse(null));
        }
        if (value instanceof JsonNode node) {
            return node.deepCopy();
        }
        if (value instanceof String string) {
            return TextNode.valueOf(string);
        }
        if (value instanceof byte[] bytes) {
            return TextNode.valueOf(new String(bytes, StandardCharsets.UTF_8));
        }
        if (value instanceof Boolean bool) {
            return FACTORY.booleanNode(bool);
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return FACTORY.numberNode(((Number) value).intValue());
        }
        if (value instanceof Long longValue) {
            return FACTORY.numberNode(longValue);
        }
        if (value instanceof Double doubleValue) {
            return FACTORY.numberNode(doubleValue);
        }
        if (value instanceof Float floatValue) {
            return FACTORY.numberNode(floatValue);
        }
        if (value instanceof WireEnum wireEnum) {
            return TextNode.valueOf(wireEnum.wireName());
        }
        if (value instanceof Enum<?> enumValue) {
            return TextNode.valueOf(enumValue.name());
        }
        if (value instanceof TaggedUnion union) {
            Object payload = union.payload();
            // a branch without data is effectively an enum constant
            return payload == null ? TextNode.valueOf(union.tag()) : toNode(payload);
        }
        if (value instanceof ProtocolValue struct) {
            return structToObject(struct);
        }
        if (value instanceof List<?> list) {
            ArrayNode array = FACTORY.arrayNode(list.size());
            for (Object element : list) {
                array.add(toNode(element));
            }
            return array;
        }
        if (value.getClass().isArray()) {
            throw new IllegalArgumentException("Fixed-size arrays are not supported, use a List: "
                + value.getClass().getSimpleName());
        }
        throw new IllegalArgumentException("Type not supported in a protocol value: " + value.getClass().getName());
    }

    private static ObjectNode structToObject(ProtocolValue struct) {
        ObjectNode object = FACTORY.objectNode();
        struct.visitFields((name, fieldValue) -> object.set(name, toNode(fieldValue)));
        return object;
    }

    /**
     * Walks {@code path}, a dot separated list of keys naming nested objects, starting at {@code object}. An
     * empty path names {@code object} itself.
     */
    public static ObjectNode ancestor(ObjectNode object, String path) throws DapException {
        ObjectNode current = object;
        if (path == null || path.isEmpty()) {
            return current;
        }
        for (String segment : path.split("\\.")) {
            JsonNode next = current.get(segment);
            if (next == null) {
                throw new DapException(DapError.ANCESTOR_DOES_NOT_EXIST, "No field '" + segment + "' on path '" + path + "'");
            }
            if (!next.isObject()) {
                throw new DapException(DapError.ANCESTOR_IS_NOT_AN_OBJECT,
                    "Field '" + segment + "' on path '" + path + "' is " + next.getNodeType());
            }
            current = (ObjectNode) next;
        }
        return current;
    }

    public static void injectIntoAncestor(ObjectNode object, String path, String key, JsonNode value) throws DapException {
        ancestor(object, path).set(key, value.deepCopy());
    }

    /**
     * Copies every field of {@code extra} into the object found at {@code path}, overwriting existing keys. Does
     * nothing, and does not walk the path, when {@code extra} is null or empty.
     */
    public static void injectAllIntoAncestor(ObjectNode object, String path, ObjectNode extra) throws DapException {
        if (extra == null || extra.isEmpty()) {
            return;
        }
        merge(ancestor(object, path), extra);
    }

    public static void merge(ObjectNode object, ObjectNode extra) {
        Iterator<Map.Entry<String, JsonNode>> fields = extra.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            object.set(field.getKey(), field.getValue().deepCopy());
        }
    }

    /**
     * Recursively clones {@code value}, routing every string through {@code cloner}. Shapes and active union
     * branches are preserved exactly.
     *
     * @throws UnsupportedOperationException when a value node wraps an opaque payload (POJO or binary)
     */
    @SuppressWarnings("unchecked")
    public static <T> T deepClone(ValueCloner cloner, T value) {
        return (T) cloneAny(cloner, value);
    }

    public static <T> List<T> deepCloneList(ValueCloner cloner, List<T> list) {
        if (list == null) {
            return null;
        }
        List<T> cloned = new ArrayList<>(list.size());
        for (T element : list) {
            cloned.add(deepClone(cloner, element));
        }
        return cloned;
    }

    private static Object cloneAny(ValueCloner cloner, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String string) {
            return cloner.cloneString(string);
        }
        if (value instanceof Boolean || value instanceof Number || value instanceof Enum<?>) {
            return value;
        }
        if (value instanceof Optional<?> optional) {
            return optional.map(present -> cloneAny(cloner, present));
        }
        if (value instanceof JsonNode node) {
            return cloneTree(cloner, node);
        }
        if (value instanceof ProtocolValue struct) {
            return struct.deepClone(cloner);
        }
        if (value instanceof TaggedUnion union) {
            return union.deepClone(cloner);
        }
        if (value instanceof List<?> list) {
            return deepCloneList(cloner, list);
        }
        if (value instanceof byte[] bytes) {
            return bytes.clone();
        }
        throw new IllegalArgumentException("Type not possible in a protocol value: " + value.getClass().getName());
    }

    private static JsonNode cloneTree(ValueCloner cloner, JsonNode node) {
        return switch (node.getNodeType()) {
            case OBJECT -> {
                ObjectNode cloned = FACTORY.objectNode();
                Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    cloned.set(cloner.cloneString(field.getKey()), cloneTree(cloner, field.getValue()));
                }
                yield cloned;
            }
            case ARRAY -> {
                ArrayNode cloned = FACTORY.arrayNode(node.size());
                for (JsonNode element : node) {
                    cloned.add(cloneTree(cloner, element));
                }
                yield cloned;
            }
            case STRING -> TextNode.valueOf(cloner.cloneString(node.textValue()));
            case POJO, BINARY -> throw new UnsupportedOperationException(
                "Cannot clone an opaque " + node.getNodeType() + " payload inside a value node");
            // numbers, booleans, null and missing nodes are immutable
            default -> node;
        };
    }

    public static <T> T decode(JsonNode node, Class<T> type) throws DapException {
        try {
            return MAPPER.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new DapException(DapError.INVALID_MESSAGE, "Could not decode " + type.getSimpleName(), e);
        }
    }

    public static <T> List<T> decodeList(JsonNode node, Class<T> type) throws DapException {
        if (node == null || node.getNodeType() != JsonNodeType.ARRAY) {
            throw new DapException(DapError.INVALID_MESSAGE, "Expected an array of " + type.getSimpleName());
        }
        try {
            return MAPPER.convertValue(node, MAPPER.getTypeFactory().constructCollectionType(List.class, type));
        } catch (IllegalArgumentException e) {
            throw new DapException(DapError.INVALID_MESSAGE, "Could not decode a list of " + type.getSimpleName(), e);
        }
    }
}
