package io.virtserve.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.virtserve.core.model.FieldMap;
import io.virtserve.core.model.MediaType;
import io.virtserve.core.model.Request;
import io.virtserve.core.model.RequestField;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A request normalized into the field tree predicates are evaluated against:
 *
 * <pre>
 * {"method": "GET", "path": "/orders", "query": {"id": "1", "tag": ["a", "b"]},
 *  "headers": {"accept": "application/json"}, "body": "", "requestFrom": "10.0.0.1:5050", "ip": "10.0.0.1"}
 * </pre>
 *
 * <p>
 * Keys of {@code query}, {@code headers} and {@code form} are lowercase; a repeated key becomes an
 * array. {@code body} is always present (empty when the request has none). {@code form} is present
 * only for form-urlencoded bodies, {@code requestFrom} and {@code ip} only when the client address
 * is known.
 *
 * <p>
 * Also caches JSON parses of field strings for the duration of one match.
 *
 * <p>
 * NOT thread-safe: one instance per request.
 */
public final class RequestFields {

    private static final Logger LOG = LoggerFactory.getLogger(RequestFields.class);

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final ObjectMapper JSON_MAPPER =
            new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final ObjectNode fields;
    private final Map<String, JsonNode> parsed = new HashMap<>();

    private RequestFields(ObjectNode fields) {
        this.fields = fields;
    }

    /**
     * Normalizes a request.
     *
     * @param request the incoming request
     * @return the request's field tree
     */
    public static RequestFields of(Request request) {
        Objects.requireNonNull(request, "request must not be null");
        ObjectNode fields = NODES.objectNode();
        fields.put(RequestField.METHOD.wireName(), request.method());
        fields.put(RequestField.PATH.wireName(), request.path());
        fields.set(RequestField.QUERY.wireName(), toObjectNode(request.query()));
        fields.set(RequestField.HEADERS.wireName(), toObjectNode(request.headers()));
        String body = request.body().asString();
        fields.put(RequestField.BODY.wireName(), body);
        if (request.body().mediaType() == MediaType.FORM) {
            fields.set(RequestField.FORM.wireName(), toObjectNode(FieldMap.parseUrlEncoded(body)));
        }
        if (request.requestFrom() != null) {
            fields.put(RequestField.REQUEST_FROM.wireName(), request.requestFrom());
            fields.put(RequestField.IP.wireName(), request.ip());
        }
        return new RequestFields(fields);
    }

    /**
     * Wraps an already-normalized field tree (used by tests and diagnostics).
     *
     * @param fields normalized field tree; not copied
     * @return the wrapper
     */
    public static RequestFields of(ObjectNode fields) {
        return new RequestFields(Objects.requireNonNull(fields, "fields must not be null"));
    }

    /**
     * Returns a top-level field.
     *
     * @param name wire name, e.g. {@code "path"}
     * @return the field value, or {@code null} if absent
     */
    public JsonNode get(String name) {
        return fields.get(name);
    }

    /** The whole normalized tree. Callers must not mutate it. */
    public ObjectNode tree() {
        return fields;
    }

    /**
     * Parses a string as JSON. Results (including failures) are cached per distinct input for the
     * lifetime of this instance, so a body referenced by many predicates is parsed once.
     *
     * @param text the text to parse
     * @return the parsed tree, or {@code null} if the text is not a single JSON value
     */
    public JsonNode parseJson(String text) {
        if (parsed.containsKey(text)) {
            return parsed.get(text);
        }
        JsonNode result = null;
        if (!text.isBlank()) {
            try {
                result = JSON_MAPPER.readTree(text);
            } catch (JsonProcessingException e) {
                LOG.debug("Field value is not JSON, treating as absent: {}", e.getOriginalMessage());
            }
        }
        if (result != null && result.isMissingNode()) {
            result = null;
        }
        parsed.put(text, result);
        return result;
    }

    private static ObjectNode toObjectNode(FieldMap map) {
        ObjectNode node = NODES.objectNode();
        for (Map.Entry<String, List<String>> entry : map.toMultiValueMap().entrySet()) {
            List<String> values = entry.getValue();
            if (values.size() == 1) {
                node.put(entry.getKey(), values.get(0));
            } else {
                ArrayNode array = node.putArray(entry.getKey());
                values.forEach(array::add);
            }
        }
        return node;
    }
}
