package io.virtserve.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * A virtual service bound to a port: an ordered stub list and an optional default response.
 *
 * <p>
 * Immutable; admin mutations produce new instances.
 *
 * @param port            listening port, unique per engine
 * @param protocol        protocol name, e.g. {@code "http"}
 * @param name            optional display name, may be {@code null}
 * @param stubs           stubs in declaration order (order decides which stub wins)
 * @param defaultResponse response used when no stub matches, or {@code null}; copied in and out
 */
public record Imposter(int port, String protocol, String name, List<Stub> stubs, JsonNode defaultResponse) {

    /** Validates the port and copies the stub list. */
    public Imposter {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 0 and 65535, got: " + port);
        }
        protocol = protocol != null ? protocol : "http";
        stubs = stubs != null ? List.copyOf(stubs) : List.of();
        defaultResponse = defaultResponse != null ? defaultResponse.deepCopy() : null;
    }

    /** Response used when no stub matches, or {@code null}. Returns a copy. */
    @Override
    public JsonNode defaultResponse() {
        return defaultResponse != null ? defaultResponse.deepCopy() : null;
    }

    /** Returns a copy of this imposter with a different stub list. */
    public Imposter withStubs(List<Stub> newStubs) {
        return new Imposter(port, protocol, name, newStubs, defaultResponse);
    }
}
