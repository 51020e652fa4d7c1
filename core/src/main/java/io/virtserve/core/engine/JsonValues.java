package io.virtserve.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Shared JSON node helpers for predicate evaluation: the canonical string form of scalars, the
 * presence rule used by {@code exists}, and the normalization applied by {@code deepEquals}.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class JsonValues {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JsonValues() {}

    /**
     * Returns the string a value compares as.
     *
     * <ul>
     * <li>text → itself</li>
     * <li>integral numbers → decimal digits ({@code 123})</li>
     * <li>other numbers → shortest plain form ({@code 1.50} → {@code 1.5}, {@code 2.0} → {@code 2})</li>
     * <li>booleans → {@code true}/{@code false}; {@code null} → {@code null}</li>
     * <li>objects and arrays → compact JSON</li>
     * <li>{@code null} reference or missing node → empty string</li>
     * </ul>
     */
    public static String canonicalString(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "";
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isIntegralNumber()) {
            return node.asText();
        }
        if (node.isNumber()) {
            return node.decimalValue().stripTrailingZeros().toPlainString();
        }
        if (node.isBoolean() || node.isNull()) {
            return node.asText();
        }
        return node.toString();
    }

    /** True for text, numbers, booleans and JSON {@code null}. */
    public static boolean isScalar(JsonNode node) {
        return node != null && (node.isTextual() || node.isNumber() || node.isBoolean() || node.isNull());
    }

    /**
     * Determines whether an {@code exists} expectation asks for presence.
     *
     * <ul>
     * <li>{@code null}, {@code NullNode}, {@code MissingNode} → falsy</li>
     * <li>{@code BooleanNode} → its value</li>
     * <li>{@code TextNode} → falsy when empty or {@code "false"}</li>
     * <li>any other node → truthy</li>
     * </ul>
     */
    public static boolean isTruthy(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            return !node.textValue().isEmpty() && !"false".equals(node.textValue());
        }
        return true;
    }

    /**
     * The {@code exists} presence rule: a value exists when it is present and its string form is
     * non-empty. An array exists when it has at least one element; JSON {@code null} does not exist.
     */
    public static boolean isPresentNonEmpty(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return false;
        }
        if (node.isTextual()) {
            return !node.textValue().isEmpty();
        }
        if (node.isArray()) {
            return node.size() > 0;
        }
        return true;
    }

    /**
     * Normalizes a value for {@code deepEquals}: scalars become their canonical strings, arrays are
     * sorted by the serialized form of their normalized elements, and, when {@code lowercase} is
     * set, strings and object keys are lowercased. Applied recursively.
     *
     * @param node      value to normalize
     * @param lowercase whether to fold case
     * @return a new normalized tree
     */
    public static JsonNode normalize(JsonNode node, boolean lowercase) {
        if (node.isObject()) {
            ObjectNode result = NODES.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String key = lowercase ? field.getKey().toLowerCase(Locale.ROOT) : field.getKey();
                result.set(key, normalize(field.getValue(), lowercase));
            }
            return result;
        }
        if (node.isArray()) {
            List<JsonNode> elements = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                elements.add(normalize(element, lowercase));
            }
            elements.sort(Comparator.comparing(JsonNode::toString));
            ArrayNode result = NODES.arrayNode(elements.size());
            result.addAll(elements);
            return result;
        }
        String text = canonicalString(node);
        return NODES.textNode(lowercase ? text.toLowerCase(Locale.ROOT) : text);
    }

    /** Lowercases with {@link Locale#ROOT} when {@code fold} is set. */
    public static String fold(String value, boolean fold) {
        return fold ? value.toLowerCase(Locale.ROOT) : value;
    }
}
