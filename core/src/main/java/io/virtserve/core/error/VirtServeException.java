package io.virtserve.core.error;

/**
 * Root of the virtserve exception hierarchy. Unchecked; concrete subclasses live under
 * {@link ImposterLoadException} (bad definitions), {@link MatchEvalException} (aborted evaluation)
 * and {@link ImposterNotFoundException} (admin calls on an unknown port).
 *
 * <p>
 * The {@link Phase} says whether a caller can ever see the exception: load and admin failures
 * propagate to whoever submitted the definition or mutation, evaluation failures are always
 * absorbed by the matcher and turn into "no match".
 */
public abstract class VirtServeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Where in an imposter's life the error was raised. */
    public enum Phase {
        /** Parsing or compiling an imposter or stub definition; the definition is rejected. */
        LOAD,
        /** An admin mutation addressing state that does not exist; the registry is unchanged. */
        ADMIN,
        /** Matching a request; never escapes the matcher. */
        EVALUATION
    }

    private final String imposterId;
    private final Phase phase;

    protected VirtServeException(String message, String imposterId, Phase phase) {
        super(message);
        this.imposterId = imposterId;
        this.phase = phase;
    }

    protected VirtServeException(String message, Throwable cause, String imposterId, Phase phase) {
        super(message, cause);
        this.imposterId = imposterId;
        this.phase = phase;
    }

    /** The imposter involved (its port as text), or {@code null} when the port is not known yet. */
    public String imposterId() {
        return imposterId;
    }

    public Phase phase() {
        return phase;
    }
}
