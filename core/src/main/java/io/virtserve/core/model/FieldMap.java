package io.virtserve.core.model;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Case-insensitive, multi-valued name → values collection used for headers, query parameters and
 * form fields.
 *
 * <p>
 * Names are normalized to <strong>lowercase</strong> ({@link Locale#ROOT}); values keep their
 * original case and arrival order. The class is immutable.
 */
public final class FieldMap {

    private static final FieldMap EMPTY = new FieldMap(new LinkedHashMap<>());

    /** Internal storage: lowercase key, values are non-empty lists in arrival order. */
    private final Map<String, List<String>> store;

    private FieldMap(Map<String, List<String>> store) {
        this.store = store;
    }

    /**
     * First value for a name (case-insensitive).
     *
     * @return the first value, or {@code null} if the name is absent
     */
    public String first(String name) {
        List<String> values = store.get(normalize(name));
        return values != null && !values.isEmpty() ? values.get(0) : null;
    }

    /**
     * All values for a name (case-insensitive).
     *
     * @return an unmodifiable list of values, or an empty list if absent
     */
    public List<String> all(String name) {
        List<String> values = store.get(normalize(name));
        return values != null ? values : List.of();
    }

    /** True if the name exists (case-insensitive). */
    public boolean contains(String name) {
        return store.containsKey(normalize(name));
    }

    /** Returns {@code true} if no entries are present. */
    public boolean isEmpty() {
        return store.isEmpty();
    }

    /** Number of distinct names. */
    public int size() {
        return store.size();
    }

    /**
     * All-values-per-name view with lowercase keys, in first-arrival order.
     *
     * @return an unmodifiable map
     */
    public Map<String, List<String>> toMultiValueMap() {
        return Collections.unmodifiableMap(store);
    }

    // ── Factory methods ──

    /**
     * Creates a map from single values. Keys are normalized to lowercase.
     *
     * @param singleValue name → single value
     * @return immutable {@code FieldMap}
     */
    public static FieldMap of(Map<String, String> singleValue) {
        if (singleValue == null || singleValue.isEmpty()) {
            return EMPTY;
        }
        Map<String, List<String>> map = new LinkedHashMap<>();
        singleValue.forEach((key, value) ->
                map.computeIfAbsent(normalize(key), k -> new ArrayList<>()).add(value));
        return freeze(map);
    }

    /**
     * Creates a map from multiple values per name. Keys are normalized to lowercase; names that
     * differ only in case are merged.
     *
     * @param multiValue name → list of values
     * @return immutable {@code FieldMap}
     */
    public static FieldMap ofMulti(Map<String, List<String>> multiValue) {
        if (multiValue == null || multiValue.isEmpty()) {
            return EMPTY;
        }
        Map<String, List<String>> map = new LinkedHashMap<>();
        multiValue.forEach((key, values) -> {
            if (values != null && !values.isEmpty()) {
                map.computeIfAbsent(normalize(key), k -> new ArrayList<>()).addAll(values);
            }
        });
        return freeze(map);
    }

    /**
     * Parses a raw query string (without leading '?') or form-urlencoded body. Keys and values are
     * percent-decoded; {@code +} decodes to a space. A key without {@code =} gets an empty value, so
     * {@code a&b=} yields {@code a → ""} and {@code b → ""}. Repeated keys accumulate.
     *
     * @param encoded the encoded string, may be {@code null}
     * @return immutable {@code FieldMap}
     */
    public static FieldMap parseUrlEncoded(String encoded) {
        if (encoded == null || encoded.isEmpty()) {
            return EMPTY;
        }
        Map<String, List<String>> map = new LinkedHashMap<>();
        for (String pair : encoded.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq >= 0 ? pair.substring(0, eq) : pair;
            String value = eq >= 0 ? pair.substring(eq + 1) : "";
            map.computeIfAbsent(normalize(decode(key)), k -> new ArrayList<>()).add(decode(value));
        }
        return freeze(map);
    }

    /** Returns an empty instance. */
    public static FieldMap empty() {
        return EMPTY;
    }

    private static FieldMap freeze(Map<String, List<String>> map) {
        map.replaceAll((key, values) -> List.copyOf(values));
        return new FieldMap(map);
    }

    private static String normalize(String name) {
        return name == null ? "" : name.toLowerCase(Locale.ROOT);
    }

    private static String decode(String component) {
        try {
            return URLDecoder.decode(component, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // malformed escape: keep the raw text
            return component;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldMap that)) return false;
        return store.equals(that.store);
    }

    @Override
    public int hashCode() {
        return store.hashCode();
    }

    @Override
    public String toString() {
        return "FieldMap" + store.keySet();
    }
}
