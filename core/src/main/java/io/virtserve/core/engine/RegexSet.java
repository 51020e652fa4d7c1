package io.virtserve.core.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * The {@code matches} patterns of one field, tested together: every pattern must be found in the
 * value. Patterns are the instances compiled when the predicate was parsed, so flags and budget
 * consumption are identical to per-leaf evaluation.
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class RegexSet {

    static final RegexSet EMPTY = new RegexSet(List.of());

    private final List<Pattern> patterns;

    RegexSet(List<Pattern> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    /**
     * Tests a single value against every pattern, stopping at the first miss.
     *
     * @throws io.virtserve.core.error.RegexBudgetExceededException if a pattern exceeds the budget
     */
    public boolean matchesAll(String value, int maxSteps) {
        for (Pattern pattern : patterns) {
            if (!BoundedRegex.find(pattern, value, maxSteps)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Tests a multi-valued field: every pattern must be found in at least one of the values.
     *
     * @throws io.virtserve.core.error.RegexBudgetExceededException if a pattern exceeds the budget
     */
    public boolean matchesAll(List<String> values, int maxSteps) {
        for (Pattern pattern : patterns) {
            boolean found = false;
            for (String value : values) {
                if (BoundedRegex.find(pattern, value, maxSteps)) {
                    found = true;
                    break;
                }
            }
            if (!found) {
                return false;
            }
        }
        return true;
    }

    public int size() {
        return patterns.size();
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    /** Source expressions, in insertion order. */
    public List<String> expressions() {
        List<String> expressions = new ArrayList<>(patterns.size());
        patterns.forEach(pattern -> expressions.add(pattern.pattern()));
        return expressions;
    }

    static final class Builder {

        private final List<Pattern> patterns = new ArrayList<>();

        /** Adds a pattern unless an identical one (same source and flags) is present. */
        Builder add(Pattern pattern) {
            for (Pattern existing : patterns) {
                if (existing.pattern().equals(pattern.pattern()) && existing.flags() == pattern.flags()) {
                    return this;
                }
            }
            patterns.add(pattern);
            return this;
        }

        RegexSet build() {
            return patterns.isEmpty() ? EMPTY : new RegexSet(patterns);
        }
    }
}
