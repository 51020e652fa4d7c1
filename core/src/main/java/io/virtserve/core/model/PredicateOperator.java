package io.virtserve.core.model;

/**
 * The closed set of predicate operators, keyed by their wire name. Combinators ({@code and},
 * {@code or}, {@code not}) take part in first-key-wins resolution exactly like leaf operators.
 */
public enum PredicateOperator {
    EQUALS("equals"),
    DEEP_EQUALS("deepEquals"),
    CONTAINS("contains"),
    STARTS_WITH("startsWith"),
    ENDS_WITH("endsWith"),
    MATCHES("matches"),
    EXISTS("exists"),
    AND("and"),
    OR("or"),
    NOT("not");

    private final String key;

    PredicateOperator(String key) {
        this.key = key;
    }

    /** Wire key, e.g. {@code "startsWith"}. */
    public String key() {
        return key;
    }

    /** True for {@code and}, {@code or} and {@code not}. */
    public boolean isCombinator() {
        return this == AND || this == OR || this == NOT;
    }

    /**
     * True for the string operators the field optimizer can batch: {@code equals},
     * {@code contains}, {@code startsWith}, {@code endsWith} and {@code matches}.
     */
    public boolean isStringOperator() {
        return this == EQUALS || this == CONTAINS || this == STARTS_WITH || this == ENDS_WITH || this == MATCHES;
    }

    /**
     * Resolves a wire key (case-sensitive).
     *
     * @return the operator, or {@code null} if the key is not an operator
     */
    public static PredicateOperator fromKey(String key) {
        for (PredicateOperator operator : values()) {
            if (operator.key.equals(key)) {
                return operator;
            }
        }
        return null;
    }
}
