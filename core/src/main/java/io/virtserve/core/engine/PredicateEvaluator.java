package io.virtserve.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.virtserve.core.error.MatchEvalException;
import io.virtserve.core.model.Predicate;
import io.virtserve.core.model.PredicateModifiers;
import io.virtserve.core.model.Selector;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Direct interpreter of predicate trees against a request. This is the semantic reference for
 * matching; {@link FieldOptimizer} output must agree with it on every request.
 *
 * <p>
 * Per leaf, modifiers apply in a fixed order: {@code except} removes its matches from every string
 * of the field, then the {@code jsonpath} (or, only when no jsonpath is declared, {@code xpath})
 * selector extracts from the filtered value, then the comparison runs with the leaf's
 * {@code caseSensitive} setting. A failed extraction makes the leaf false.
 *
 * <p>
 * Evaluation never throws. An unexpected runtime failure in a leaf is logged and the leaf evaluates
 * to false. A regex that exceeds its {@link MatchBudget} aborts the whole call: {@link #evaluate}
 * and {@link #evaluateAll} return false, so a {@code not} around a runaway pattern cannot turn the
 * abort into a match.
 *
 * <p>
 * Thread-safe.
 */
public final class PredicateEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(PredicateEvaluator.class);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final MatchBudget budget;
    private final ValueComparator comparator;

    public PredicateEvaluator() {
        this(MatchBudget.DEFAULT);
    }

    public PredicateEvaluator(MatchBudget budget) {
        this.budget = Objects.requireNonNull(budget, "budget must not be null");
        this.comparator = new ValueComparator(budget);
    }

    /**
     * Evaluates a stub's top-level predicate list (an implicit AND; empty matches everything).
     *
     * @param predicates predicates in declaration order
     * @param fields     the normalized request
     * @return true if every predicate matches; false if evaluation was aborted
     */
    public boolean evaluateAll(List<Predicate> predicates, RequestFields fields) {
        try {
            return allMatch(predicates, fields);
        } catch (MatchEvalException e) {
            LOG.warn("Predicate evaluation aborted, treating as no match: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Evaluates one predicate node.
     *
     * @param node   the predicate
     * @param fields the normalized request
     * @return whether the request satisfies the predicate; false if evaluation was aborted
     */
    public boolean evaluate(Predicate node, RequestFields fields) {
        try {
            return test(node, fields);
        } catch (MatchEvalException e) {
            LOG.warn("Predicate evaluation aborted, treating as no match: {}", e.getMessage());
            return false;
        }
    }

    private boolean allMatch(List<Predicate> predicates, RequestFields fields) {
        for (Predicate predicate : predicates) {
            if (!test(predicate, fields)) {
                return false;
            }
        }
        return true;
    }

    private boolean test(Predicate node, RequestFields fields) {
        if (node instanceof Predicate.Leaf leaf) {
            return evaluateLeaf(leaf, fields);
        }
        if (node instanceof Predicate.And conjunction) {
            return allMatch(conjunction.children(), fields);
        }
        if (node instanceof Predicate.Or disjunction) {
            for (Predicate child : disjunction.children()) {
                if (test(child, fields)) {
                    return true;
                }
            }
            return false;
        }
        if (node instanceof Predicate.Not negation) {
            return !test(negation.child(), fields);
        }
        throw new IllegalStateException("Unknown predicate node: " + node.getClass().getName());
    }

    private boolean evaluateLeaf(Predicate.Leaf leaf, RequestFields fields) {
        try {
            Iterator<Map.Entry<String, JsonNode>> entries = leaf.fields().fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                JsonNode actual = fields.get(entry.getKey());
                if (leaf.modifiers().transformsValue()) {
                    actual = transform(actual, leaf.modifiers(), fields);
                    if (actual == null) {
                        LOG.debug("{} on '{}': extraction failed", leaf.operator().key(), entry.getKey());
                        return false;
                    }
                }
                if (!comparator.matches(leaf, entry.getKey(), entry.getValue(), actual, fields)) {
                    return false;
                }
            }
            return true;
        } catch (MatchEvalException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.warn("{} predicate failed unexpectedly, treating as no match", leaf.operator().key(), e);
            return false;
        }
    }

    /**
     * Applies {@code except} then the active selector. Returns {@code null} when the field is
     * absent and a selector is declared, or when the selector selects nothing.
     */
    private JsonNode transform(JsonNode actual, PredicateModifiers modifiers, RequestFields fields) {
        JsonNode value = actual;
        if (modifiers.except() != null && value != null) {
            value = removeAll(value, modifiers.except());
        }
        Selector selector = modifiers.activeSelector();
        if (selector == null) {
            return value;
        }
        if (value == null) {
            return null;
        }
        if (value.isTextual()) {
            return BodySelectors.select(selector, value.textValue(), fields);
        }
        if (value.isArray()) {
            ArrayNode selected = NODES.arrayNode();
            for (JsonNode element : value) {
                JsonNode result =
                        element.isTextual() ? BodySelectors.select(selector, element.textValue(), fields) : null;
                if (result != null) {
                    selected.add(result);
                }
            }
            return selected.isEmpty() ? null : selected;
        }
        return null;
    }

    private JsonNode removeAll(JsonNode value, Pattern except) {
        if (value.isTextual()) {
            return NODES.textNode(BoundedRegex.removeAll(except, value.textValue(), budget.maxRegexSteps()));
        }
        if (value.isArray()) {
            ArrayNode result = NODES.arrayNode(value.size());
            value.forEach(element -> result.add(removeAll(element, except)));
            return result;
        }
        if (value.isObject()) {
            ObjectNode result = NODES.objectNode();
            value.fields()
                    .forEachRemaining(entry -> result.set(entry.getKey(), removeAll(entry.getValue(), except)));
            return result;
        }
        return value;
    }
}
