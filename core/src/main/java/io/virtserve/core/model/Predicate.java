package io.virtserve.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A node of a stub's predicate tree. Implementations are a sealed hierarchy: one leaf variant and
 * the three combinators.
 *
 * <p>
 * Every node records the operators that followed the active one in its definition object
 * ({@link #ignoredOperators()}): only the first operator key of an object is evaluated.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface Predicate {

    /** Modifiers declared on this node's own definition object. */
    PredicateModifiers modifiers();

    /** Operators declared after the active one in the same object, in declaration order. */
    List<PredicateOperator> ignoredOperators();

    /**
     * A leaf comparison such as {@code {"equals": {"path": "/test"}}}.
     *
     * <p>
     * {@code fields} is copied on construction and on every access, so the expectations a
     * compiled stub was built from cannot change underneath it.
     *
     * @param operator         the operator, never a combinator
     * @param fields           field name → expected value, in declaration order
     * @param patterns         compiled {@code matches} patterns keyed by their source text; empty for
     *                         other operators
     * @param modifiers        this object's modifiers
     * @param ignoredOperators inactive operator keys of the same object
     */
    record Leaf(
            PredicateOperator operator,
            ObjectNode fields,
            Map<String, Pattern> patterns,
            PredicateModifiers modifiers,
            List<PredicateOperator> ignoredOperators)
            implements Predicate {
        public Leaf {
            Objects.requireNonNull(operator, "operator must not be null");
            fields = Objects.requireNonNull(fields, "fields must not be null").deepCopy();
            if (operator.isCombinator()) {
                throw new IllegalArgumentException("Leaf operator must not be a combinator: " + operator);
            }
            patterns = patterns != null ? Map.copyOf(patterns) : Map.of();
            modifiers = modifiers != null ? modifiers : PredicateModifiers.NONE;
            ignoredOperators = ignoredOperators != null ? List.copyOf(ignoredOperators) : List.of();
        }

        /** Field name → expected value, in declaration order. Returns a copy. */
        @Override
        public ObjectNode fields() {
            return fields.deepCopy();
        }
    }

    /** All children must match. */
    record And(List<Predicate> children, PredicateModifiers modifiers, List<PredicateOperator> ignoredOperators)
            implements Predicate {
        public And {
            children = List.copyOf(children);
            modifiers = modifiers != null ? modifiers : PredicateModifiers.NONE;
            ignoredOperators = ignoredOperators != null ? List.copyOf(ignoredOperators) : List.of();
        }
    }

    /** At least one child must match. */
    record Or(List<Predicate> children, PredicateModifiers modifiers, List<PredicateOperator> ignoredOperators)
            implements Predicate {
        public Or {
            children = List.copyOf(children);
            modifiers = modifiers != null ? modifiers : PredicateModifiers.NONE;
            ignoredOperators = ignoredOperators != null ? List.copyOf(ignoredOperators) : List.of();
        }
    }

    /** The child must not match. */
    record Not(Predicate child, PredicateModifiers modifiers, List<PredicateOperator> ignoredOperators)
            implements Predicate {
        public Not {
            Objects.requireNonNull(child, "child must not be null");
            modifiers = modifiers != null ? modifiers : PredicateModifiers.NONE;
            ignoredOperators = ignoredOperators != null ? List.copyOf(ignoredOperators) : List.of();
        }
    }
}
