package io.virtserve.core.model;

import com.jayway.jsonpath.JsonPath;
import java.util.Map;
import java.util.Objects;

/**
 * Value extraction applied to a field before comparison. Both variants are compiled (and therefore
 * validated) when the predicate is parsed.
 */
public sealed interface Selector {

    /** The selector expression as written in the definition. */
    String expression();

    /**
     * A JSONPath selector ({@code "jsonpath": {"selector": "$.name"}}).
     *
     * @param expression the JSONPath expression
     * @param path       the compiled, thread-safe path
     */
    record JsonPathSelector(String expression, JsonPath path) implements Selector {
        public JsonPathSelector {
            Objects.requireNonNull(expression, "expression must not be null");
            Objects.requireNonNull(path, "path must not be null");
        }
    }

    /**
     * An XPath selector ({@code "xpath": {"selector": "//title", "ns": {"b": "urn:books"}}}).
     * XPath objects are not thread-safe, so only the source and namespace bindings are kept; the
     * evaluator compiles per thread.
     *
     * @param expression the XPath expression
     * @param namespaces prefix → namespace URI bindings, possibly empty
     */
    record XPathSelector(String expression, Map<String, String> namespaces) implements Selector {
        public XPathSelector {
            Objects.requireNonNull(expression, "expression must not be null");
            namespaces = namespaces != null ? Map.copyOf(namespaces) : Map.of();
        }
    }
}
