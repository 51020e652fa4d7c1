package io.virtserve.core.engine;

/** How {@link StubMatcher} decides whether a stub matches. */
public enum MatchMode {
    /** Compiled field groups first, then the residual predicates. */
    OPTIMIZED,

    /** Raw predicate trees only, through {@link PredicateEvaluator}. */
    REFERENCE
}
