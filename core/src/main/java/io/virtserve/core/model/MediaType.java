package io.virtserve.core.model;

import java.util.Locale;

/**
 * Body media types the matcher distinguishes. Only {@link #FORM} changes the field model (it adds
 * the {@code form} field); JSON and XML bodies stay raw strings until a predicate needs structure.
 */
public enum MediaType {
    /** {@code application/json} and structured suffixes ({@code +json}). */
    JSON("application/json"),

    /** {@code application/xml}, {@code text/xml} and structured suffixes ({@code +xml}). */
    XML("application/xml"),

    /** {@code application/x-www-form-urlencoded}. */
    FORM("application/x-www-form-urlencoded"),

    /** {@code text/plain}. */
    TEXT("text/plain"),

    /** {@code application/octet-stream}, also the fallback for unrecognized types. */
    BINARY("application/octet-stream"),

    /** No content type (body absent or not specified). */
    NONE(null);

    private final String value;

    MediaType(String value) {
        this.value = value;
    }

    /** Returns the MIME type string, or {@code null} for {@link #NONE}. */
    public String value() {
        return value;
    }

    /**
     * Resolves a Content-Type header value to a {@link MediaType}. Parameters such as
     * {@code charset} are ignored, {@code +json}/{@code +xml} suffixes are recognized, blank input
     * gives {@link #NONE} and anything else unrecognized gives {@link #BINARY}.
     *
     * @param contentType the Content-Type header value, e.g. {@code "application/json; charset=utf-8"}
     * @return the resolved {@code MediaType}
     */
    public static MediaType fromContentType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return NONE;
        }

        String mime = contentType;
        int semicolon = mime.indexOf(';');
        if (semicolon >= 0) {
            mime = mime.substring(0, semicolon);
        }
        mime = mime.strip().toLowerCase(Locale.ROOT);

        for (MediaType type : values()) {
            if (type.value != null && type.value.equals(mime)) {
                return type;
            }
        }
        if (mime.equals("text/xml")) {
            return XML;
        }
        if (mime.endsWith("+json")) {
            return JSON;
        }
        if (mime.endsWith("+xml")) {
            return XML;
        }
        if (mime.startsWith("text/")) {
            return TEXT;
        }

        return BINARY;
    }
}
