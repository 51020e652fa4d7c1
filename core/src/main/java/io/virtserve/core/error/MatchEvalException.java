package io.virtserve.core.error;

/**
 * Abstract parent for failures inside predicate evaluation. These never escape the matcher: the
 * stub being evaluated is treated as not matching.
 */
public abstract class MatchEvalException extends VirtServeException {

    private static final long serialVersionUID = 1L;

    protected MatchEvalException(String message, String imposterId) {
        super(message, imposterId, Phase.EVALUATION);
    }

    protected MatchEvalException(String message, Throwable cause, String imposterId) {
        super(message, cause, imposterId, Phase.EVALUATION);
    }
}
