package io.virtserve.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.List;

/**
 * A (predicates, responses) pair, the unit of match selection. The top-level predicate list is an
 * implicit AND; an empty list matches every request.
 *
 * @param predicates top-level predicates in declaration order
 * @param responses  response definitions, opaque to the matcher; copied in and out
 */
public record Stub(List<Predicate> predicates, JsonNode responses) {

    /** Normalizes absent values. */
    public Stub {
        predicates = predicates != null ? List.copyOf(predicates) : List.of();
        responses = responses != null ? responses.deepCopy() : JsonNodeFactory.instance.arrayNode();
    }

    /** Response definitions. Returns a copy. */
    @Override
    public JsonNode responses() {
        return responses.deepCopy();
    }
}
