package io.virtserve.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An incoming HTTP request as seen by the matcher. The HTTP layer builds one per request; the
 * matcher never touches server-native types.
 *
 * <p>
 * Immutable, thread-safe.
 *
 * @param method      the HTTP method, e.g. {@code "GET"}; case is preserved
 * @param path        the request path without query string, e.g. {@code "/api/users"}
 * @param query       decoded query parameters (case-insensitive names)
 * @param headers     request headers (case-insensitive names)
 * @param body        raw body and media type
 * @param requestFrom client address as {@code host:port}, or {@code null} if unknown
 */
public record Request(
        String method, String path, FieldMap query, FieldMap headers, MessageBody body, String requestFrom) {

    /** Validates required fields and normalizes absent collections. */
    public Request {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(path, "path must not be null");
        query = query != null ? query : FieldMap.empty();
        headers = headers != null ? headers : FieldMap.empty();
        body = body != null ? body : MessageBody.empty();
    }

    /**
     * Client IP without the port part of {@link #requestFrom()}. Handles bracketed IPv6 literals
     * ({@code [::1]:5000} → {@code ::1}).
     *
     * @return the IP, or {@code null} if the client address is unknown
     */
    public String ip() {
        if (requestFrom == null || requestFrom.isEmpty()) {
            return null;
        }
        if (requestFrom.startsWith("[")) {
            int close = requestFrom.indexOf(']');
            return close > 0 ? requestFrom.substring(1, close) : requestFrom;
        }
        int colon = requestFrom.lastIndexOf(':');
        if (colon > 0 && requestFrom.indexOf(':') == colon) {
            return requestFrom.substring(0, colon);
        }
        return requestFrom;
    }

    /** Returns a new {@link Builder}. */
    public static Builder builder() {
        return new Builder();
    }

    /** Fluent builder, mainly for adapters and tests. */
    public static final class Builder {

        private String method = "GET";
        private String path = "/";
        private String rawQuery;
        private final Map<String, List<String>> query = new LinkedHashMap<>();
        private final Map<String, List<String>> headers = new LinkedHashMap<>();
        private MessageBody body = MessageBody.empty();
        private String requestFrom;

        Builder() {}

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        /**
         * Sets the path. A {@code ?} splits off a raw query string that is parsed when the request is
         * built; parameters added with {@link #query(String, String)} are appended after it.
         */
        public Builder path(String path) {
            int q = path.indexOf('?');
            if (q >= 0) {
                this.path = path.substring(0, q);
                this.rawQuery = path.substring(q + 1);
            } else {
                this.path = path;
            }
            return this;
        }

        public Builder query(String name, String value) {
            query.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
            return this;
        }

        public Builder header(String name, String value) {
            headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
            return this;
        }

        /** Sets the body; the media type is taken from any {@code Content-Type} header already added. */
        public Builder body(String body) {
            String contentType = null;
            for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
                if (entry.getKey().equalsIgnoreCase("content-type")) {
                    contentType = entry.getValue().get(0);
                }
            }
            this.body = MessageBody.of(body, MediaType.fromContentType(contentType));
            return this;
        }

        public Builder body(MessageBody body) {
            this.body = body;
            return this;
        }

        public Builder requestFrom(String requestFrom) {
            this.requestFrom = requestFrom;
            return this;
        }

        public Request build() {
            Map<String, List<String>> merged = new LinkedHashMap<>(FieldMap.parseUrlEncoded(rawQuery)
                    .toMultiValueMap());
            query.forEach((name, values) -> merged.merge(name, values, (a, b) -> {
                List<String> all = new ArrayList<>(a);
                all.addAll(b);
                return all;
            }));
            return new Request(method, path, FieldMap.ofMulti(merged), FieldMap.ofMulti(headers), body, requestFrom);
        }
    }
}
