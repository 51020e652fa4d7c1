package io.virtserve.core.engine;

import io.virtserve.core.model.Predicate;
import java.util.List;

/**
 * Compiled form of a stub's predicate list: field groups (cheapest first) and the residual
 * predicates left to {@link PredicateEvaluator}, all ANDed.
 *
 * <p>
 * Immutable and thread-safe. Built once per stub and replaced wholesale when the stub changes.
 *
 * @param groups        non-empty field groups, ordered by ascending cost
 * @param residual      predicates evaluated by the reference evaluator, in declaration order
 * @param unsatisfiable true if two batched targets contradict; the stub then never matches
 */
public record CompiledPredicate(List<StringPredicateGroup> groups, List<Predicate> residual, boolean unsatisfiable) {

    /** The compiled form of an empty predicate list: matches every request. */
    public static final CompiledPredicate MATCH_ALL = new CompiledPredicate(List.of(), List.of(), false);

    public CompiledPredicate {
        groups = List.copyOf(groups);
        residual = List.copyOf(residual);
    }

    /**
     * Tests a request.
     *
     * @param fields    the normalized request
     * @param evaluator evaluator for the residual predicates
     * @return true if every group and every residual predicate holds
     */
    public boolean matches(RequestFields fields, PredicateEvaluator evaluator) {
        if (unsatisfiable) {
            return false;
        }
        for (StringPredicateGroup group : groups) {
            if (!group.matches(fields)) {
                return false;
            }
        }
        return evaluator.evaluateAll(residual, fields);
    }
}
