package io.virtserve.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.virtserve.core.error.RegexBudgetExceededException;
import io.virtserve.core.model.PredicateOperator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * All batchable string comparisons a stub makes on one request value: at most one
 * {@code equals}, one {@code startsWith} and one {@code endsWith} target, any further literal
 * targets that could not be folded into those slots, the {@code contains} targets and a
 * {@link RegexSet} of the {@code matches} patterns. Every target must hold.
 *
 * <p>
 * Checks run cheapest first: absence, the three literal slots, overflow literals,
 * {@code contains}, then the regex set. For a multi-valued field each target must be satisfied by
 * at least one of the values.
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class StringPredicateGroup {

    private static final Logger LOG = LoggerFactory.getLogger(StringPredicateGroup.class);

    private static final int LITERAL_COST = 1;
    private static final int CONTAINS_COST = 2;
    private static final int REGEX_COST = 16;

    private final FieldKey key;
    private final List<LiteralTarget> literals;
    private final List<LiteralTarget> contains;
    private final RegexSet regexes;
    private final int maxRegexSteps;

    private StringPredicateGroup(
            FieldKey key, List<LiteralTarget> literals, List<LiteralTarget> contains, RegexSet regexes, int steps) {
        this.key = key;
        this.literals = List.copyOf(literals);
        this.contains = List.copyOf(contains);
        this.regexes = regexes;
        this.maxRegexSteps = steps;
    }

    /**
     * Starts a group for one request value.
     *
     * @param key    the request value tested
     * @param budget regex budget applied at match time
     */
    public static Builder builder(FieldKey key, MatchBudget budget) {
        return new Builder(key, budget);
    }

    public FieldKey key() {
        return key;
    }

    /** Slot and overflow literal targets, in evaluation order. */
    public List<LiteralTarget> literals() {
        return literals;
    }

    public List<LiteralTarget> contains() {
        return contains;
    }

    public RegexSet regexes() {
        return regexes;
    }

    /** Total number of active targets. */
    public int targetCount() {
        return literals.size() + contains.size() + regexes.size();
    }

    public boolean isEmpty() {
        return targetCount() == 0;
    }

    /** Relative evaluation cost used to order groups; literal checks are cheapest, regexes dearest. */
    public int cost() {
        return literals.size() * LITERAL_COST + contains.size() * CONTAINS_COST + regexes.size() * REGEX_COST;
    }

    /**
     * Tests this group against a request.
     *
     * @param fields the normalized request
     * @return true if every target holds
     */
    public boolean matches(RequestFields fields) {
        return matches(key.resolve(fields));
    }

    /**
     * Tests this group against a resolved value.
     *
     * @param value text, array of text, or {@code null} when absent
     * @return true if every target holds; false for an absent value unless the group is empty
     */
    public boolean matches(JsonNode value) {
        if (value == null || value.isMissingNode()) {
            return isEmpty();
        }
        List<String> values = new ArrayList<>();
        if (value.isArray()) {
            value.forEach(element -> values.add(JsonValues.canonicalString(element)));
        } else {
            values.add(JsonValues.canonicalString(value));
        }
        return values.size() == 1 ? matchesSingle(values.get(0)) : matchesAny(values);
    }

    private boolean matchesSingle(String value) {
        String lowered = value.toLowerCase(Locale.ROOT);
        for (LiteralTarget target : literals) {
            if (!target.test(value, lowered)) {
                return false;
            }
        }
        for (LiteralTarget target : contains) {
            if (!target.test(value, lowered)) {
                return false;
            }
        }
        return regexMatch(() -> regexes.matchesAll(value, maxRegexSteps));
    }

    private boolean matchesAny(List<String> values) {
        List<String> lowered = new ArrayList<>(values.size());
        values.forEach(value -> lowered.add(value.toLowerCase(Locale.ROOT)));
        for (LiteralTarget target : literals) {
            if (!anyValue(target, values, lowered)) {
                return false;
            }
        }
        for (LiteralTarget target : contains) {
            if (!anyValue(target, values, lowered)) {
                return false;
            }
        }
        return regexMatch(() -> regexes.matchesAll(values, maxRegexSteps));
    }

    private static boolean anyValue(LiteralTarget target, List<String> values, List<String> lowered) {
        for (int i = 0; i < values.size(); i++) {
            if (target.test(values.get(i), lowered.get(i))) {
                return true;
            }
        }
        return false;
    }

    private boolean regexMatch(RegexCheck check) {
        if (regexes.isEmpty()) {
            return true;
        }
        try {
            return check.run();
        } catch (RegexBudgetExceededException e) {
            LOG.warn("matches on '{}' aborted, treating as no match: {}", key, e.getMessage());
            return false;
        }
    }

    @FunctionalInterface
    private interface RegexCheck {
        boolean run();
    }

    @Override
    public String toString() {
        return "StringPredicateGroup[" + key + ", literals=" + literals + ", contains=" + contains + ", regexes="
                + regexes.expressions() + "]";
    }

    /**
     * Collects and folds targets for one {@link FieldKey}.
     *
     * <p>
     * A new {@code equals}/{@code startsWith}/{@code endsWith} target is folded against the
     * targets already held: identical or implied targets are dropped, a target implying a slot
     * occupant replaces it, and on a single-valued field a target contradicting a slot occupant
     * marks the group unsatisfiable. Anything else goes to the overflow list.
     */
    public static final class Builder {

        private final FieldKey key;
        private final int maxRegexSteps;
        private LiteralTarget equals;
        private LiteralTarget startsWith;
        private LiteralTarget endsWith;
        private final List<LiteralTarget> overflow = new ArrayList<>();
        private final List<LiteralTarget> contains = new ArrayList<>();
        private final RegexSet.Builder regexes = new RegexSet.Builder();
        private boolean unsatisfiable;

        private Builder(FieldKey key, MatchBudget budget) {
            this.key = Objects.requireNonNull(key, "key must not be null");
            this.maxRegexSteps = budget.maxRegexSteps();
        }

        /**
         * Adds a literal target.
         *
         * @param target the target
         * @return this builder (fluent)
         */
        public Builder add(LiteralTarget target) {
            if (target.operator() == PredicateOperator.CONTAINS) {
                if (!contains.contains(target)) {
                    contains.add(target);
                }
                return this;
            }
            if (unsatisfiable || isImpliedByExisting(target)) {
                return this;
            }
            if (key.singleValued() && contradictsExisting(target)) {
                LOG.debug("Targets on '{}' cannot all hold ({}); stub never matches", key, target);
                unsatisfiable = true;
                return this;
            }
            LiteralTarget occupant = slot(target.operator());
            if (occupant == null) {
                setSlot(target);
            } else if (target.implies(occupant)) {
                setSlot(target);
            } else {
                overflow.add(target);
            }
            return this;
        }

        /**
         * Adds a compiled {@code matches} pattern.
         *
         * @param pattern the pattern
         * @return this builder (fluent)
         */
        public Builder add(Pattern pattern) {
            regexes.add(pattern);
            return this;
        }

        /** True once two targets were found that no single value can satisfy. */
        public boolean unsatisfiable() {
            return unsatisfiable;
        }

        public StringPredicateGroup build() {
            List<LiteralTarget> literals = new ArrayList<>(3 + overflow.size());
            if (equals != null) {
                literals.add(equals);
            }
            if (startsWith != null) {
                literals.add(startsWith);
            }
            if (endsWith != null) {
                literals.add(endsWith);
            }
            literals.addAll(overflow);
            return new StringPredicateGroup(key, literals, contains, regexes.build(), maxRegexSteps);
        }

        private boolean isImpliedByExisting(LiteralTarget target) {
            for (LiteralTarget existing : held()) {
                if (existing.equals(target) || existing.implies(target)) {
                    return true;
                }
            }
            return false;
        }

        private boolean contradictsExisting(LiteralTarget target) {
            for (LiteralTarget existing : held()) {
                if (existing.contradicts(target)) {
                    return true;
                }
            }
            return false;
        }

        private List<LiteralTarget> held() {
            List<LiteralTarget> held = new ArrayList<>(3 + overflow.size());
            if (equals != null) {
                held.add(equals);
            }
            if (startsWith != null) {
                held.add(startsWith);
            }
            if (endsWith != null) {
                held.add(endsWith);
            }
            held.addAll(overflow);
            return held;
        }

        private LiteralTarget slot(PredicateOperator operator) {
            return switch (operator) {
                case EQUALS -> equals;
                case STARTS_WITH -> startsWith;
                case ENDS_WITH -> endsWith;
                case CONTAINS, DEEP_EQUALS, MATCHES, EXISTS, AND, OR, NOT -> throw noSlot(operator);
            };
        }

        private void setSlot(LiteralTarget target) {
            switch (target.operator()) {
                case EQUALS -> equals = target;
                case STARTS_WITH -> startsWith = target;
                case ENDS_WITH -> endsWith = target;
                case CONTAINS, DEEP_EQUALS, MATCHES, EXISTS, AND, OR, NOT -> throw noSlot(target.operator());
            }
        }

        private static IllegalStateException noSlot(PredicateOperator operator) {
            return new IllegalStateException("No single-target slot for " + operator);
        }
    }
}
