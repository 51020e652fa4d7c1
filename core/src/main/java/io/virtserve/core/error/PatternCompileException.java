package io.virtserve.core.error;

/**
 * Thrown when a {@code matches} or {@code except} regular expression, a {@code jsonpath} selector
 * or an {@code xpath} selector fails to compile. This is the only definition error that depends on
 * expression syntax; the imposter is rejected as a whole.
 */
public final class PatternCompileException extends ImposterLoadException {

    private static final long serialVersionUID = 1L;

    private final String expression;

    public PatternCompileException(
            String message, Throwable cause, String expression, String imposterId, String source) {
        super(message, cause, imposterId, source);
        this.expression = expression;
    }

    /** The expression that failed to compile. */
    public String expression() {
        return expression;
    }
}
