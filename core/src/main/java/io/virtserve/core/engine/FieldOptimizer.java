package io.virtserve.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.virtserve.core.model.Predicate;
import io.virtserve.core.model.PredicateOperator;
import io.virtserve.core.model.RequestField;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a stub's predicate list into a {@link CompiledPredicate}.
 *
 * <p>
 * Nested {@code and} nodes are flattened into the top-level list (their own modifiers have no
 * effect on children). A leaf is batched into per-field {@link StringPredicateGroup}s when
 *
 * <ul>
 * <li>its operator is {@code equals}, {@code contains}, {@code startsWith}, {@code endsWith} or
 * {@code matches};</li>
 * <li>it declares no {@code except}, {@code jsonpath} or {@code xpath} modifier;</li>
 * <li>every field it names is a known request field;</li>
 * <li>keyed fields ({@code query}, {@code headers}, {@code form}) expect a non-empty object of
 * strings, numbers or booleans, and other fields expect a string, number or boolean.</li>
 * </ul>
 *
 * Everything else ({@code or}, {@code not}, {@code deepEquals}, {@code exists}, structured
 * expectations) is kept as residual and evaluated by {@link PredicateEvaluator}.
 *
 * <p>
 * Compilation is deterministic: the same predicate list always yields an equivalent result.
 * Thread-safe.
 */
public final class FieldOptimizer {

    private static final Logger LOG = LoggerFactory.getLogger(FieldOptimizer.class);

    private final MatchBudget budget;

    public FieldOptimizer() {
        this(MatchBudget.DEFAULT);
    }

    public FieldOptimizer(MatchBudget budget) {
        this.budget = Objects.requireNonNull(budget, "budget must not be null");
    }

    /**
     * Compiles a stub's top-level predicates.
     *
     * @param predicates predicates in declaration order (implicitly ANDed)
     * @return the compiled form
     */
    public CompiledPredicate compile(List<Predicate> predicates) {
        if (predicates.isEmpty()) {
            return CompiledPredicate.MATCH_ALL;
        }
        List<Predicate> flat = new ArrayList<>();
        flatten(predicates, flat);

        Map<FieldKey, StringPredicateGroup.Builder> builders = new LinkedHashMap<>();
        List<Predicate> residual = new ArrayList<>();
        for (Predicate predicate : flat) {
            if (predicate instanceof Predicate.Leaf leaf && isBatchable(leaf)) {
                addTargets(leaf, builders);
            } else {
                residual.add(predicate);
            }
        }

        boolean unsatisfiable = false;
        List<StringPredicateGroup> groups = new ArrayList<>(builders.size());
        for (StringPredicateGroup.Builder builder : builders.values()) {
            unsatisfiable |= builder.unsatisfiable();
            StringPredicateGroup group = builder.build();
            if (!group.isEmpty()) {
                groups.add(group);
            }
        }
        groups.sort(Comparator.comparingInt(StringPredicateGroup::cost));

        LOG.debug(
                "Compiled {} predicate(s): {} group(s), {} residual{}",
                predicates.size(),
                groups.size(),
                residual.size(),
                unsatisfiable ? ", unsatisfiable" : "");
        return new CompiledPredicate(groups, residual, unsatisfiable);
    }

    private static void flatten(List<Predicate> predicates, List<Predicate> out) {
        for (Predicate predicate : predicates) {
            if (predicate instanceof Predicate.And conjunction) {
                flatten(conjunction.children(), out);
            } else {
                out.add(predicate);
            }
        }
    }

    static boolean isBatchable(Predicate.Leaf leaf) {
        if (!leaf.operator().isStringOperator() || leaf.modifiers().transformsValue()) {
            return false;
        }
        Iterator<Map.Entry<String, JsonNode>> entries = leaf.fields().fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            RequestField field = RequestField.fromWireName(entry.getKey());
            if (field == null) {
                return false;
            }
            JsonNode expected = entry.getValue();
            if (field.keyed()) {
                if (!expected.isObject() || expected.isEmpty()) {
                    return false;
                }
                for (JsonNode value : expected) {
                    if (!isFlatScalar(value)) {
                        return false;
                    }
                }
            } else if (!isFlatScalar(expected)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isFlatScalar(JsonNode node) {
        return node.isTextual() || node.isNumber() || node.isBoolean();
    }

    private void addTargets(Predicate.Leaf leaf, Map<FieldKey, StringPredicateGroup.Builder> builders) {
        Iterator<Map.Entry<String, JsonNode>> entries = leaf.fields().fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            RequestField field = RequestField.fromWireName(entry.getKey());
            if (field.keyed()) {
                Iterator<Map.Entry<String, JsonNode>> keys = entry.getValue().fields();
                while (keys.hasNext()) {
                    Map.Entry<String, JsonNode> key = keys.next();
                    addTarget(leaf, FieldKey.of(field, key.getKey()), key.getValue(), builders);
                }
            } else {
                addTarget(leaf, FieldKey.of(field), entry.getValue(), builders);
            }
        }
    }

    private void addTarget(
            Predicate.Leaf leaf,
            FieldKey key,
            JsonNode expected,
            Map<FieldKey, StringPredicateGroup.Builder> builders) {
        StringPredicateGroup.Builder builder =
                builders.computeIfAbsent(key, k -> StringPredicateGroup.builder(k, budget));
        String value = JsonValues.canonicalString(expected);
        if (leaf.operator() == PredicateOperator.MATCHES) {
            builder.add(leaf.patterns().get(value));
        } else {
            builder.add(new LiteralTarget(leaf.operator(), value, leaf.modifiers().caseSensitive()));
        }
    }
}
