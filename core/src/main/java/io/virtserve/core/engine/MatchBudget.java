package io.virtserve.core.engine;

/**
 * Evaluation budget for regular expressions ({@code matches} and {@code except}). Each regex run
 * may read at most {@code maxRegexSteps} characters of its input (backtracking re-reads count);
 * beyond that the run is aborted and the stub being evaluated does not match.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param maxRegexSteps maximum character reads per regex run (default: 1,000,000)
 */
public record MatchBudget(int maxRegexSteps) {

    /** Default budget: one million character reads per regex run. */
    public static final MatchBudget DEFAULT = new MatchBudget(1_000_000);

    public MatchBudget {
        if (maxRegexSteps <= 0) {
            throw new IllegalArgumentException("maxRegexSteps must be positive, got: " + maxRegexSteps);
        }
    }
}
