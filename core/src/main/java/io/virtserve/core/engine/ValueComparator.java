package io.virtserve.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.virtserve.core.model.Predicate;
import io.virtserve.core.model.RequestField;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Compares one expected field value of a leaf predicate against the corresponding (already
 * modifier-transformed) request value.
 *
 * <p>
 * Expected objects descend into the actual value's keys; a string actual (typically the body) is
 * parsed as JSON for this purpose. Keys of {@code query}, {@code headers} and {@code form} always
 * compare case-insensitively, body keys only when the predicate is case-insensitive. An expected
 * array requires each of its elements to match some actual element; a scalar expectation against
 * a multi-valued actual requires one element to match.
 *
 * <p>
 * Thread-safe: holds only the regex budget.
 */
public final class ValueComparator {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final int maxRegexSteps;

    public ValueComparator(MatchBudget budget) {
        this.maxRegexSteps = budget.maxRegexSteps();
    }

    /**
     * Tests one field of a leaf.
     *
     * @param leaf     the leaf (operator, modifiers, compiled patterns)
     * @param field    the field's wire name
     * @param expected the leaf's expected value for the field
     * @param actual   the request value after {@code except} and selectors, or {@code null} if absent
     * @param fields   the request, for JSON parse caching
     * @return whether the field satisfies the leaf
     */
    public boolean matches(
            Predicate.Leaf leaf, String field, JsonNode expected, JsonNode actual, RequestFields fields) {
        RequestField known = RequestField.fromWireName(field);
        boolean keyed = known != null && known.keyed();
        boolean caseSensitive = leaf.modifiers().caseSensitive();
        return switch (leaf.operator()) {
            case EXISTS -> exists(expected, actual, keyed || !caseSensitive, fields);
            case DEEP_EQUALS -> deepEquals(expected, actual, keyed, caseSensitive, fields);
            case EQUALS, CONTAINS, STARTS_WITH, ENDS_WITH, MATCHES ->
                compare(leaf, expected, actual, keyed || !caseSensitive, fields);
            case AND, OR, NOT -> throw new IllegalStateException("Not a leaf operator: " + leaf.operator());
        };
    }

    // ── equals / contains / startsWith / endsWith / matches ──

    private boolean compare(
            Predicate.Leaf leaf, JsonNode expected, JsonNode actual, boolean foldKeys, RequestFields fields) {
        if (actual == null || actual.isMissingNode()) {
            return false;
        }
        if (expected.isObject()) {
            JsonNode container = structured(actual, fields);
            if (container == null) {
                return false;
            }
            if (container.isArray()) {
                for (JsonNode element : container) {
                    if (element.isObject() && compareKeys(leaf, expected, element, foldKeys, fields)) {
                        return true;
                    }
                }
                return false;
            }
            return container.isObject() && compareKeys(leaf, expected, container, foldKeys, fields);
        }
        if (expected.isArray()) {
            JsonNode candidates = actual.isArray() ? actual : structured(actual, fields);
            if (candidates == null || !candidates.isArray()) {
                candidates = NODES.arrayNode().add(actual);
            }
            for (JsonNode wanted : expected) {
                if (!anyMatches(leaf, wanted, candidates, foldKeys, fields)) {
                    return false;
                }
            }
            return true;
        }
        if (actual.isArray()) {
            return anyMatches(leaf, expected, actual, foldKeys, fields);
        }
        return compareStrings(leaf, JsonValues.canonicalString(expected), JsonValues.canonicalString(actual));
    }

    private boolean compareKeys(
            Predicate.Leaf leaf, JsonNode expected, JsonNode container, boolean foldKeys, RequestFields fields) {
        Iterator<Map.Entry<String, JsonNode>> entries = expected.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            JsonNode sub = lookup(container, entry.getKey(), foldKeys);
            if (!compare(leaf, entry.getValue(), sub, !leaf.modifiers().caseSensitive(), fields)) {
                return false;
            }
        }
        return true;
    }

    private boolean anyMatches(
            Predicate.Leaf leaf, JsonNode expected, JsonNode candidates, boolean foldKeys, RequestFields fields) {
        for (JsonNode candidate : candidates) {
            if (compare(leaf, expected, candidate, foldKeys, fields)) {
                return true;
            }
        }
        return false;
    }

    private boolean compareStrings(Predicate.Leaf leaf, String expected, String actual) {
        boolean fold = !leaf.modifiers().caseSensitive();
        return switch (leaf.operator()) {
            case MATCHES -> {
                Pattern pattern = leaf.patterns().get(expected);
                yield pattern != null && BoundedRegex.find(pattern, actual, maxRegexSteps);
            }
            case EQUALS -> JsonValues.fold(actual, fold).equals(JsonValues.fold(expected, fold));
            case CONTAINS -> JsonValues.fold(actual, fold).contains(JsonValues.fold(expected, fold));
            case STARTS_WITH -> JsonValues.fold(actual, fold).startsWith(JsonValues.fold(expected, fold));
            case ENDS_WITH -> JsonValues.fold(actual, fold).endsWith(JsonValues.fold(expected, fold));
            case DEEP_EQUALS, EXISTS, AND, OR, NOT ->
                throw new IllegalStateException("Not a string operator: " + leaf.operator());
        };
    }

    // ── exists ──

    private boolean exists(JsonNode expected, JsonNode actual, boolean foldKeys, RequestFields fields) {
        if (expected.isObject()) {
            JsonNode container = actual != null ? structured(actual, fields) : null;
            Iterator<Map.Entry<String, JsonNode>> entries = expected.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                JsonNode sub = container != null && container.isObject()
                        ? lookup(container, entry.getKey(), foldKeys)
                        : null;
                if (!exists(entry.getValue(), sub, foldKeys, fields)) {
                    return false;
                }
            }
            return true;
        }
        return JsonValues.isTruthy(expected) == JsonValues.isPresentNonEmpty(actual);
    }

    // ── deepEquals ──

    private boolean deepEquals(
            JsonNode expected, JsonNode actual, boolean keyed, boolean caseSensitive, RequestFields fields) {
        if (actual == null || actual.isMissingNode()) {
            return false;
        }
        boolean fold = !caseSensitive;
        if (expected.isObject() || expected.isArray()) {
            JsonNode structuredActual = structured(actual, fields);
            if (structuredActual == null || structuredActual.isObject() != expected.isObject()) {
                return false;
            }
            JsonNode wanted = JsonValues.normalize(keyed ? lowercaseKeys(expected) : expected, fold);
            return wanted.equals(JsonValues.normalize(structuredActual, fold));
        }
        if (!JsonValues.isScalar(actual)) {
            return false;
        }
        return JsonValues.fold(JsonValues.canonicalString(expected), fold)
                .equals(JsonValues.fold(JsonValues.canonicalString(actual), fold));
    }

    // ── helpers ──

    private static JsonNode structured(JsonNode actual, RequestFields fields) {
        if (actual.isContainerNode()) {
            return actual;
        }
        if (actual.isTextual()) {
            JsonNode parsed = fields.parseJson(actual.textValue());
            return parsed != null && parsed.isContainerNode() ? parsed : null;
        }
        return null;
    }

    private static JsonNode lookup(JsonNode container, String key, boolean foldKeys) {
        JsonNode exact = container.get(key);
        if (exact != null || !foldKeys) {
            return exact;
        }
        String folded = key.toLowerCase(Locale.ROOT);
        Iterator<Map.Entry<String, JsonNode>> entries = container.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (entry.getKey().toLowerCase(Locale.ROOT).equals(folded)) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static JsonNode lowercaseKeys(JsonNode expected) {
        if (!expected.isObject()) {
            return expected;
        }
        ObjectNode result = NODES.objectNode();
        expected.fields()
                .forEachRemaining(entry -> result.set(entry.getKey().toLowerCase(Locale.ROOT), entry.getValue()));
        return result;
    }
}
