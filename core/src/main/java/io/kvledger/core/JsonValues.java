// file: src/main/java/io/kvledger/core/JsonValues.java
package io.kvledger.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Iterator;

/**
 * Conversion between caller values and the JSON trees the store keeps.
 * <p>
 * Every tree handed in or out is a deep copy, so nobody outside the store
 * can reach the live mapping.
 */
public final class JsonValues {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectReader STRICT = MAPPER.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private JsonValues() {
        // utility
    }

    /** Shared mapper. Thread-safe once configured; never reconfigure it. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Convert an arbitrary value to a detached JSON tree.
     *
     * @throws SerializationException if Jackson cannot map the value, or the
     *         result holds a number JSON cannot express (NaN, infinity)
     */
    public static JsonNode toNode(Object value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        JsonNode node;
        if (value instanceof JsonNode given) {
            node = given.deepCopy();
        } else {
            try {
                node = MAPPER.valueToTree(value);
            } catch (IllegalArgumentException e) {
                throw new SerializationException(
                        "value of type " + value.getClass().getName() + " is not JSON-serializable", e);
            }
        }
        if (node == null || node.isMissingNode()) {
            throw new SerializationException("value of type " + value.getClass().getName()
                    + " produced no JSON", null);
        }
        requireFinite(node);
        return node;
    }

    /**
     * Parse exactly one JSON document. Anything after it other than whitespace
     * is an error, so {@code {"a":1} {"b":2}} does not silently read as {@code {"a":1}}.
     * Empty input gives a missing node.
     */
    public static JsonNode parseStrict(String text) throws JsonProcessingException {
        return STRICT.readTree(text);
    }

    /** Null-safe deep copy. */
    public static JsonNode copy(JsonNode node) {
        return node == null ? null : node.deepCopy();
    }

    /**
     * Map a JSON scalar to its plain Java counterpart (String, Long, Double,
     * Boolean or null). Containers come back as their compact JSON text.
     */
    public static Object toScalar(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        if (node.isTextual()) return node.textValue();
        if (node.isBoolean()) return node.booleanValue();
        if (node.isIntegralNumber()) return node.longValue();
        if (node.isNumber()) return node.doubleValue();
        return node.toString();
    }

    private static void requireFinite(JsonNode node) {
        if (node.isFloatingPointNumber()) {
            double d = node.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new SerializationException("non-finite number " + d + " has no JSON form", null);
            }
            return;
        }
        if (node.isContainerNode()) {
            for (Iterator<JsonNode> it = node.elements(); it.hasNext(); ) {
                requireFinite(it.next());
            }
        }
    }
}
