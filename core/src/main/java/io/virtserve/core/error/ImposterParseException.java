package io.virtserve.core.error;

/** Thrown when an imposter definition is unreadable or misses required fields. */
public final class ImposterParseException extends ImposterLoadException {

    private static final long serialVersionUID = 1L;

    public ImposterParseException(String message, String imposterId, String source) {
        super(message, imposterId, source);
    }

    public ImposterParseException(String message, Throwable cause, String imposterId, String source) {
        super(message, cause, imposterId, source);
    }
}
