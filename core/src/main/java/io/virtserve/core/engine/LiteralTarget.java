package io.virtserve.core.engine;

import io.virtserve.core.model.PredicateOperator;
import java.util.Locale;
import java.util.Objects;

/**
 * One literal comparison of a {@link StringPredicateGroup}: {@code equals}, {@code startsWith},
 * {@code endsWith} or {@code contains} against a fixed string. Case-insensitive targets keep their
 * lowercase form so a request only lowercases the actual value.
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class LiteralTarget {

    private final PredicateOperator operator;
    private final String value;
    private final boolean caseSensitive;
    private final String comparand;

    /**
     * @param operator      the comparison
     * @param value         the expected string as declared
     * @param caseSensitive whether case is preserved
     */
    public LiteralTarget(PredicateOperator operator, String value, boolean caseSensitive) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
        if (!operator.isStringOperator() || operator == PredicateOperator.MATCHES) {
            throw new IllegalArgumentException("Not a literal operator: " + operator);
        }
        this.caseSensitive = caseSensitive;
        this.comparand = caseSensitive ? value : value.toLowerCase(Locale.ROOT);
    }

    public PredicateOperator operator() {
        return operator;
    }

    public String value() {
        return value;
    }

    public boolean caseSensitive() {
        return caseSensitive;
    }

    /**
     * Tests an actual value.
     *
     * @param actual  the raw actual value
     * @param lowered the actual value lowercased with {@link Locale#ROOT}
     */
    public boolean test(String actual, String lowered) {
        String subject = caseSensitive ? actual : lowered;
        return switch (operator) {
            case EQUALS -> subject.equals(comparand);
            case STARTS_WITH -> subject.startsWith(comparand);
            case ENDS_WITH -> subject.endsWith(comparand);
            case CONTAINS -> subject.contains(comparand);
            case DEEP_EQUALS, MATCHES, EXISTS, AND, OR, NOT -> throw notLiteral(operator);
        };
    }

    /**
     * True if every string satisfying this target also satisfies {@code other}. Only decided for
     * targets of the same case mode; otherwise false.
     */
    public boolean implies(LiteralTarget other) {
        if (caseSensitive != other.caseSensitive) {
            return false;
        }
        return switch (other.operator) {
            case EQUALS -> operator == PredicateOperator.EQUALS && comparand.equals(other.comparand);
            case STARTS_WITH -> (operator == PredicateOperator.EQUALS || operator == PredicateOperator.STARTS_WITH)
                    && comparand.startsWith(other.comparand);
            case ENDS_WITH -> (operator == PredicateOperator.EQUALS || operator == PredicateOperator.ENDS_WITH)
                    && comparand.endsWith(other.comparand);
            case CONTAINS -> comparand.contains(other.comparand);
            case DEEP_EQUALS, MATCHES, EXISTS, AND, OR, NOT -> throw notLiteral(other.operator);
        };
    }

    private static IllegalStateException notLiteral(PredicateOperator operator) {
        return new IllegalStateException("Not a literal operator: " + operator);
    }

    /**
     * True if no single string can satisfy both targets. Decided for same-case-mode pairs of
     * {@code equals}, {@code startsWith} and {@code endsWith} where one side is {@code equals} or
     * both have the same operator; otherwise false.
     */
    public boolean contradicts(LiteralTarget other) {
        if (caseSensitive != other.caseSensitive
                || operator == PredicateOperator.CONTAINS
                || other.operator == PredicateOperator.CONTAINS) {
            return false;
        }
        if (operator == PredicateOperator.EQUALS) {
            return !implies(other);
        }
        if (other.operator == PredicateOperator.EQUALS) {
            return !other.implies(this);
        }
        if (operator != other.operator) {
            return false;
        }
        if (operator == PredicateOperator.STARTS_WITH) {
            return !comparand.startsWith(other.comparand) && !other.comparand.startsWith(comparand);
        }
        return !comparand.endsWith(other.comparand) && !other.comparand.endsWith(comparand);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LiteralTarget)) {
            return false;
        }
        LiteralTarget that = (LiteralTarget) o;
        return operator == that.operator && caseSensitive == that.caseSensitive && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, value, caseSensitive);
    }

    @Override
    public String toString() {
        return operator.key() + "(" + value + (caseSensitive ? "" : ", ci") + ")";
    }
}
