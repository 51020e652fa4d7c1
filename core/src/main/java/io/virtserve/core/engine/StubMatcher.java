package io.virtserve.core.engine;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects the stub for a request: stubs are tried in declaration order and the first whose
 * predicates match wins. There is no further ranking, so a later, more specific stub is never
 * reached when an earlier one also matches.
 *
 * <p>
 * In {@link MatchMode#OPTIMIZED} mode each stub's {@link CompiledPredicate} is used; in
 * {@link MatchMode#REFERENCE} mode the raw predicates go straight to {@link PredicateEvaluator}.
 * Both modes select the same stub for every request.
 *
 * <p>
 * Thread-safe.
 */
public final class StubMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(StubMatcher.class);

    private final MatchMode mode;
    private final PredicateEvaluator evaluator;

    public StubMatcher() {
        this(MatchMode.OPTIMIZED, MatchBudget.DEFAULT);
    }

    public StubMatcher(MatchMode mode, MatchBudget budget) {
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.evaluator = new PredicateEvaluator(budget);
    }

    public MatchMode mode() {
        return mode;
    }

    /**
     * Finds the first matching stub of an imposter snapshot.
     *
     * @param snapshot the imposter's compiled stubs
     * @param fields   the normalized request
     * @return the first matching stub, or empty if none matched
     */
    public Optional<StubMatch> findMatch(ImposterSnapshot snapshot, RequestFields fields) {
        return findMatch(snapshot.stubs(), fields);
    }

    /**
     * Finds the first matching stub of a compiled stub list.
     *
     * @param stubs  compiled stubs in declaration order
     * @param fields the normalized request
     * @return the first matching stub, or empty if none matched
     */
    public Optional<StubMatch> findMatch(List<CompiledStub> stubs, RequestFields fields) {
        for (int i = 0; i < stubs.size(); i++) {
            CompiledStub candidate = stubs.get(i);
            if (matches(candidate, fields)) {
                LOG.debug("Stub {} matched ({} mode)", i, mode);
                return Optional.of(new StubMatch(i, candidate.stub()));
            }
        }
        LOG.debug("No stub matched among {} ({} mode)", stubs.size(), mode);
        return Optional.empty();
    }

    private boolean matches(CompiledStub candidate, RequestFields fields) {
        if (mode == MatchMode.REFERENCE) {
            return evaluator.evaluateAll(candidate.stub().predicates(), fields);
        }
        return candidate.compiled().matches(fields, evaluator);
    }
}
