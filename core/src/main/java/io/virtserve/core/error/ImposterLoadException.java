package io.virtserve.core.error;

/**
 * Abstract parent for definition errors. Thrown while an imposter or stub is parsed and compiled,
 * never while a request is matched. Carries an additional {@code source} field identifying the file
 * or admin payload that caused the error.
 */
public abstract class ImposterLoadException extends VirtServeException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected ImposterLoadException(String message, String imposterId, String source) {
        super(message, imposterId, Phase.LOAD);
        this.source = source;
    }

    protected ImposterLoadException(String message, Throwable cause, String imposterId, String source) {
        super(message, cause, imposterId, Phase.LOAD);
        this.source = source;
    }

    /** The file path or payload identifier that caused the error. */
    public String source() {
        return source;
    }
}
