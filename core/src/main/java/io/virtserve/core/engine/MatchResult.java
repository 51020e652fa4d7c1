package io.virtserve.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.virtserve.core.model.Stub;

/**
 * Outcome of matching one request against an imposter, handed to the response pipeline.
 *
 * @param outcome         what happened
 * @param port            the port the request was addressed to
 * @param stubIndex       index of the matched stub, or -1
 * @param stub            the matched stub, or null
 * @param defaultResponse the imposter's default response when nothing matched, possibly null
 */
public record MatchResult(Outcome outcome, int port, int stubIndex, Stub stub, JsonNode defaultResponse) {

    /** Possible outcomes. */
    public enum Outcome {
        /** A stub matched. */
        MATCHED,
        /** The imposter exists but no stub matched; the default response applies. */
        NO_MATCH,
        /** No imposter listens on the port. */
        NO_IMPOSTER
    }

    static MatchResult matched(int port, StubMatch match) {
        return new MatchResult(Outcome.MATCHED, port, match.index(), match.stub(), null);
    }

    static MatchResult noMatch(int port, JsonNode defaultResponse) {
        return new MatchResult(Outcome.NO_MATCH, port, -1, null, defaultResponse);
    }

    static MatchResult noImposter(int port) {
        return new MatchResult(Outcome.NO_IMPOSTER, port, -1, null, null);
    }

    public boolean isMatched() {
        return outcome == Outcome.MATCHED;
    }
}
