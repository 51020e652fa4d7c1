package io.virtserve.core.model;

import java.util.regex.Pattern;

/**
 * Modifiers attached to a single predicate object. They affect only the object they are declared
 * on and are never inherited by the children of a combinator.
 *
 * @param caseSensitive whether comparisons preserve case (default {@code true})
 * @param except        pattern whose matches are removed from the raw field value, or {@code null}
 * @param jsonpath      JSONPath extraction, or {@code null}
 * @param xpath         XPath extraction, or {@code null}; ignored when {@code jsonpath} is present
 */
public record PredicateModifiers(
        boolean caseSensitive, Pattern except, Selector.JsonPathSelector jsonpath, Selector.XPathSelector xpath) {

    /** No modifiers: case-sensitive, no except, no selector. */
    public static final PredicateModifiers NONE = new PredicateModifiers(true, null, null, null);

    /** True if the raw field value is rewritten before comparison ({@code except} or a selector). */
    public boolean transformsValue() {
        return except != null || jsonpath != null || xpath != null;
    }

    /**
     * The selector that takes effect. {@code jsonpath} wins outright when both are declared; the
     * XPath selector is then never attempted.
     *
     * @return the active selector, or {@code null}
     */
    public Selector activeSelector() {
        return jsonpath != null ? jsonpath : xpath;
    }
}
