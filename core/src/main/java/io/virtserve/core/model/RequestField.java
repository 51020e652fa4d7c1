package io.virtserve.core.model;

/**
 * Request fields a predicate can address, keyed by their wire name.
 *
 * <p>
 * Keyed fields ({@code query}, {@code headers}, {@code form}) are mappings whose names are
 * case-insensitive and whose values may repeat; the others are single strings.
 */
public enum RequestField {
    METHOD("method", false),
    PATH("path", false),
    QUERY("query", true),
    HEADERS("headers", true),
    BODY("body", false),
    FORM("form", true),
    REQUEST_FROM("requestFrom", false),
    IP("ip", false);

    private final String wireName;
    private final boolean keyed;

    RequestField(String wireName, boolean keyed) {
        this.wireName = wireName;
        this.keyed = keyed;
    }

    /** Field name as it appears in predicate definitions. */
    public String wireName() {
        return wireName;
    }

    /** True for mapping fields (name → one or more values). */
    public boolean keyed() {
        return keyed;
    }

    /**
     * Looks up a field by its exact wire name.
     *
     * @return the field, or {@code null} if the name is not a request field
     */
    public static RequestField fromWireName(String name) {
        for (RequestField field : values()) {
            if (field.wireName.equals(name)) {
                return field;
            }
        }
        return null;
    }
}
