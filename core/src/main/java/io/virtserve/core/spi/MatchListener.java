package io.virtserve.core.spi;

/**
 * SPI for observability hooks on the matching engine.
 *
 * <p>
 * Adapters bridge these calls to a metrics or tracing system; the core has no such dependency.
 * All methods receive immutable event objects. Implementations MUST be thread-safe and
 * non-blocking: matched/no-match events fire on the request path. Exceptions thrown by listeners
 * are caught by the engine and logged and do NOT affect matching.
 *
 * <p>
 * Suggested metrics vocabulary:
 * <ul>
 * <li>{@code stub_matches_total}: counter, incremented on matched</li>
 * <li>{@code stub_misses_total}: counter, incremented on no-match</li>
 * <li>{@code match_duration_seconds}: histogram, from either event</li>
 * <li>{@code imposter_load_errors_total}: counter, incremented on rejected</li>
 * </ul>
 */
public interface MatchListener {

    /**
     * Called when a request matched a stub.
     *
     * @param event contains port, stubIndex, method, path, durationNanos
     */
    void onStubMatched(StubMatchedEvent event);

    /**
     * Called when no stub of an existing imposter matched a request.
     *
     * @param event contains port, method, path, hasDefaultResponse, durationNanos
     */
    void onNoMatch(NoMatchEvent event);

    /**
     * Called after an imposter (or one of its stubs) was compiled and published.
     *
     * @param event contains port, stubCount, groupCount, residualCount
     */
    void onImposterCompiled(ImposterCompiledEvent event);

    /**
     * Called when a definition was rejected at load time.
     *
     * @param event contains source, errorDetail
     */
    void onImposterRejected(ImposterRejectedEvent event);

    // --- Event records ---

    /** Event emitted when a request matched a stub. */
    record StubMatchedEvent(int port, int stubIndex, String method, String path, long durationNanos) {}

    /** Event emitted when no stub matched. */
    record NoMatchEvent(int port, String method, String path, boolean hasDefaultResponse, long durationNanos) {}

    /** Event emitted when an imposter snapshot was published. */
    record ImposterCompiledEvent(int port, int stubCount, int groupCount, int residualCount) {}

    /** Event emitted when a definition was rejected. */
    record ImposterRejectedEvent(String source, String errorDetail) {}
}
