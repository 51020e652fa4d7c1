package io.virtserve.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.virtserve.core.model.RequestField;
import java.util.Locale;
import java.util.Objects;

/**
 * Identifies the request value a {@link StringPredicateGroup} tests: a top-level field, or one key
 * of a keyed field ({@code query.id}, {@code headers.accept}).
 *
 * @param field the request field
 * @param key   lowercase key within a keyed field, {@code null} otherwise
 */
public record FieldKey(RequestField field, String key) {

    public FieldKey {
        Objects.requireNonNull(field, "field must not be null");
        if (field.keyed() != (key != null)) {
            throw new IllegalArgumentException("key must be given exactly for keyed fields: " + field);
        }
        key = key != null ? key.toLowerCase(Locale.ROOT) : null;
    }

    /** Key for a top-level field. */
    public static FieldKey of(RequestField field) {
        return new FieldKey(field, null);
    }

    /** Key for one entry of a keyed field. */
    public static FieldKey of(RequestField field, String key) {
        return new FieldKey(field, key);
    }

    /**
     * True if the field holds one string per request. Keyed entries may repeat, so two different
     * literal targets on them are never contradictory.
     */
    public boolean singleValued() {
        return !field.keyed();
    }

    /**
     * Looks up this key's value in a request.
     *
     * @return the value (text or array of text), or {@code null} if absent
     */
    public JsonNode resolve(RequestFields fields) {
        JsonNode value = fields.get(field.wireName());
        if (key == null || value == null) {
            return value;
        }
        return value.isObject() ? value.get(key) : null;
    }

    @Override
    public String toString() {
        return key == null ? field.wireName() : field.wireName() + "." + key;
    }
}
