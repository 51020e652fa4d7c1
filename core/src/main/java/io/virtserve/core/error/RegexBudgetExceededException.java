package io.virtserve.core.error;

/** Thrown when a regular expression scan exceeds {@code max-regex-steps}. */
public final class RegexBudgetExceededException extends MatchEvalException {

    private static final long serialVersionUID = 1L;

    private final String pattern;

    public RegexBudgetExceededException(String pattern, int maxSteps) {
        super("Regex '" + pattern + "' exceeded " + maxSteps + " steps", null);
        this.pattern = pattern;
    }

    /** Source of the pattern that was aborted. */
    public String pattern() {
        return pattern;
    }
}
