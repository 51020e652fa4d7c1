package io.virtserve.core.error;

/**
 * Thrown when a predicate object is structurally invalid: not an object, no recognized operator,
 * a combinator with the wrong shape, or a modifier of the wrong type.
 */
public final class PredicateParseException extends ImposterLoadException {

    private static final long serialVersionUID = 1L;

    private final String location;

    public PredicateParseException(String message, String location, String imposterId, String source) {
        super(location + ": " + message, imposterId, source);
        this.location = location;
    }

    /** Path of the offending predicate inside the definition, e.g. {@code stubs[0].predicates[1].and[0]}. */
    public String location() {
        return location;
    }
}
