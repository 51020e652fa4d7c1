package io.virtserve.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.JsonPathException;
import com.jayway.jsonpath.spi.json.JacksonJsonNodeJsonProvider;
import com.jayway.jsonpath.spi.mapper.JacksonMappingProvider;
import io.virtserve.core.model.Selector;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import javax.xml.XMLConstants;
import javax.xml.namespace.NamespaceContext;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpression;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Extracts values from field strings with {@code jsonpath} and {@code xpath} selectors.
 *
 * <p>
 * Results are normalized the same way for both selector kinds: no result is a failed extraction
 * ({@code null}), a single result becomes its string form, several results become an array of
 * string forms. A JSONPath that selects one array is treated as selecting its elements. XPath
 * node results use the node's text content; non-node results (e.g. {@code count(//item)}) use
 * their string value.
 *
 * <p>
 * Thread-safe: XPath and DOM parser instances are kept per thread.
 */
public final class BodySelectors {

    private static final Logger LOG = LoggerFactory.getLogger(BodySelectors.class);

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Configuration JSON_PATH_CONFIG = Configuration.builder()
            .jsonProvider(new JacksonJsonNodeJsonProvider(MAPPER))
            .mappingProvider(new JacksonMappingProvider(MAPPER))
            .build();

    // XPathFactory is not thread-safe; each thread gets its own factory and XPath
    private static final ThreadLocal<XPath> XPATHS =
            ThreadLocal.withInitial(() -> XPathFactory.newInstance().newXPath());
    private static final ThreadLocal<DocumentBuilder> DOCUMENT_BUILDERS =
            ThreadLocal.withInitial(BodySelectors::newDocumentBuilder);

    private BodySelectors() {}

    /**
     * Compiles an XPath expression with the given namespace bindings. Used to validate
     * {@code xpath} selectors at load time.
     *
     * @param expression the XPath expression
     * @param namespaces prefix → URI bindings
     * @return the compiled expression, valid on the calling thread only
     * @throws XPathExpressionException if the expression is malformed
     */
    public static XPathExpression compileXPath(String expression, Map<String, String> namespaces)
            throws XPathExpressionException {
        XPath xpath = XPATHS.get();
        xpath.reset();
        if (!namespaces.isEmpty()) {
            xpath.setNamespaceContext(new MapNamespaceContext(namespaces));
        }
        return xpath.compile(expression);
    }

    /**
     * Applies a selector to a field value.
     *
     * @param selector the selector
     * @param value    the (already {@code except}-filtered) field string
     * @param fields   the request, for its JSON parse cache
     * @return the selected value, or {@code null} if extraction failed or selected nothing
     */
    public static JsonNode select(Selector selector, String value, RequestFields fields) {
        if (selector instanceof Selector.JsonPathSelector jsonPath) {
            return selectJson(jsonPath, value, fields);
        }
        return selectXml((Selector.XPathSelector) selector, value);
    }

    private static JsonNode selectJson(Selector.JsonPathSelector selector, String value, RequestFields fields) {
        JsonNode document = fields.parseJson(value);
        if (document == null) {
            return null;
        }
        Object raw;
        try {
            raw = selector.path().read(document, JSON_PATH_CONFIG);
        } catch (JsonPathException e) {
            LOG.debug("jsonpath '{}' selected nothing: {}", selector.expression(), e.getMessage());
            return null;
        }
        JsonNode result = raw instanceof JsonNode node ? node : MAPPER.valueToTree(raw);
        if (result == null || result.isMissingNode()) {
            return null;
        }
        if (result.isArray()) {
            List<JsonNode> values = new ArrayList<>(result.size());
            result.forEach(values::add);
            return collapse(values);
        }
        return NODES.textNode(JsonValues.canonicalString(result));
    }

    private static JsonNode selectXml(Selector.XPathSelector selector, String value) {
        Document document = parseXml(value);
        if (document == null) {
            return null;
        }
        try {
            XPathExpression expression = compileXPath(selector.expression(), selector.namespaces());
            try {
                NodeList nodes = (NodeList) expression.evaluate(document, XPathConstants.NODESET);
                List<JsonNode> values = new ArrayList<>(nodes.getLength());
                for (int i = 0; i < nodes.getLength(); i++) {
                    values.add(NODES.textNode(nodes.item(i).getTextContent()));
                }
                return collapse(values);
            } catch (XPathExpressionException notNodeSet) {
                return NODES.textNode(expression.evaluate(document));
            }
        } catch (XPathExpressionException e) {
            LOG.debug("xpath '{}' failed: {}", selector.expression(), e.getMessage());
            return null;
        }
    }

    private static JsonNode collapse(List<JsonNode> values) {
        if (values.isEmpty()) {
            return null;
        }
        if (values.size() == 1) {
            return NODES.textNode(JsonValues.canonicalString(values.get(0)));
        }
        ArrayNode array = NODES.arrayNode(values.size());
        for (JsonNode value : values) {
            array.add(JsonValues.canonicalString(value));
        }
        return array;
    }

    private static Document parseXml(String value) {
        if (value.isBlank()) {
            return null;
        }
        DocumentBuilder builder = DOCUMENT_BUILDERS.get();
        builder.reset();
        builder.setErrorHandler(RethrowingErrorHandler.INSTANCE);
        try {
            return builder.parse(new InputSource(new StringReader(value)));
        } catch (SAXException | IOException e) {
            LOG.debug("Field value is not XML: {}", e.getMessage());
            return null;
        }
    }

    private static DocumentBuilder newDocumentBuilder() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
    }

    private static final class MapNamespaceContext implements NamespaceContext {

        private final Map<String, String> namespaces;

        MapNamespaceContext(Map<String, String> namespaces) {
            this.namespaces = namespaces;
        }

        @Override
        public String getNamespaceURI(String prefix) {
            return namespaces.getOrDefault(prefix, XMLConstants.NULL_NS_URI);
        }

        @Override
        public String getPrefix(String namespaceUri) {
            for (Map.Entry<String, String> entry : namespaces.entrySet()) {
                if (entry.getValue().equals(namespaceUri)) {
                    return entry.getKey();
                }
            }
            return null;
        }

        @Override
        public Iterator<String> getPrefixes(String namespaceUri) {
            List<String> prefixes = new ArrayList<>();
            namespaces.forEach((prefix, uri) -> {
                if (uri.equals(namespaceUri)) {
                    prefixes.add(prefix);
                }
            });
            return prefixes.iterator();
        }
    }

    private enum RethrowingErrorHandler implements ErrorHandler {
        INSTANCE;

        @Override
        public void warning(SAXParseException exception) {}

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}
