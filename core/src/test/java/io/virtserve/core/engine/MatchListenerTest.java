package io.virtserve.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import io.virtserve.core.error.ImposterLoadException;
import io.virtserve.core.model.Request;
import io.virtserve.core.spec.ImposterParser;
import io.virtserve.core.spi.MatchListener;
import io.virtserve.core.spi.MatchListener.ImposterCompiledEvent;
import io.virtserve.core.spi.MatchListener.ImposterRejectedEvent;
import io.virtserve.core.spi.MatchListener.NoMatchEvent;
import io.virtserve.core.spi.MatchListener.StubMatchedEvent;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for the {@link MatchListener} SPI: compiled, rejected, matched and no-match events, and
 * isolation of failing listeners from matching.
 */
@DisplayName("MatchListenerTest")
class MatchListenerTest {

    private static final String DEFINITION = """
            {"port": 4545,
             "stubs": [
               {"predicates": [{"equals": {"method": "GET"}}, {"not": {"exists": {"body": true}}}]},
               {"predicates": [{"startsWith": {"path": "/api"}}]}
             ],
             "defaultResponse": {"statusCode": 404}}
            """;

    private ImposterEngine engine;
    private CapturingMatchListener listener;

    @BeforeEach
    void setUp() {
        listener = new CapturingMatchListener();
        engine = new ImposterEngine(new ImposterParser(), MatchMode.OPTIMIZED, MatchBudget.DEFAULT, listener);
    }

    @Test
    @DisplayName("Imposter created → onImposterCompiled with group and residual counts")
    void createEmitsCompiledEvent() {
        engine.loadImposter(DEFINITION);

        assertThat(listener.compiled).hasSize(1);
        ImposterCompiledEvent event = listener.compiled.get(0);
        assertThat(event.port()).isEqualTo(4545);
        assertThat(event.stubCount()).isEqualTo(2);
        assertThat(event.groupCount()).isEqualTo(2);
        assertThat(event.residualCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Stub edit → a fresh onImposterCompiled event")
    void stubEditEmitsCompiledEvent() {
        engine.loadImposter(DEFINITION);
        engine.deleteStub(4545, 0);

        assertThat(listener.compiled).hasSize(2);
        assertThat(listener.compiled.get(1).stubCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Rejected definition → onImposterRejected, exception propagates")
    void rejectedDefinitionEmitsEvent() {
        assertThatThrownBy(() -> engine.loadImposter("{\"port\": 1, \"stubs\": [{\"predicates\": [{}]}]}"))
                .isInstanceOf(ImposterLoadException.class);

        assertThat(listener.rejected).hasSize(1);
        assertThat(listener.rejected.get(0).source()).isEqualTo("<inline>");
        assertThat(listener.rejected.get(0).errorDetail()).contains("declares no operator");
        assertThat(listener.compiled).isEmpty();
    }

    @Test
    @DisplayName("Matched request → onStubMatched with stub index")
    void matchEmitsMatchedEvent() {
        engine.loadImposter(DEFINITION);

        engine.match(4545, Request.builder().method("POST").path("/api/orders").build());

        assertThat(listener.matched).hasSize(1);
        StubMatchedEvent event = listener.matched.get(0);
        assertThat(event.stubIndex()).isEqualTo(1);
        assertThat(event.method()).isEqualTo("POST");
        assertThat(event.path()).isEqualTo("/api/orders");
        assertThat(event.durationNanos()).isGreaterThanOrEqualTo(0);
        assertThat(listener.noMatch).isEmpty();
    }

    @Test
    @DisplayName("Unmatched request → onNoMatch noting the default response")
    void noMatchEmitsEvent() {
        engine.loadImposter(DEFINITION);

        engine.match(4545, Request.builder().method("POST").path("/other").body("x").build());

        assertThat(listener.noMatch).hasSize(1);
        NoMatchEvent event = listener.noMatch.get(0);
        assertThat(event.port()).isEqualTo(4545);
        assertThat(event.hasDefaultResponse()).isTrue();
        assertThat(listener.matched).isEmpty();
    }

    @Test
    @DisplayName("Throwing listener never affects matching")
    void throwingListenerIsIsolated() {
        MatchListener failing = mock(MatchListener.class);
        doThrow(new IllegalStateException("boom")).when(failing).onStubMatched(any());
        doThrow(new IllegalStateException("boom")).when(failing).onImposterCompiled(any());
        ImposterEngine isolated =
                new ImposterEngine(new ImposterParser(), MatchMode.OPTIMIZED, MatchBudget.DEFAULT, failing);

        isolated.loadImposter(DEFINITION);
        MatchResult result = isolated.match(4545, Request.builder().path("/").build());

        assertThat(result.isMatched()).isTrue();
        assertThat(result.stubIndex()).isZero();
        verify(failing).onImposterCompiled(any(ImposterCompiledEvent.class));
        verify(failing).onStubMatched(any(StubMatchedEvent.class));
    }

    /** Simple capturing listener for test verification. */
    static class CapturingMatchListener implements MatchListener {
        final List<StubMatchedEvent> matched = new ArrayList<>();
        final List<NoMatchEvent> noMatch = new ArrayList<>();
        final List<ImposterCompiledEvent> compiled = new ArrayList<>();
        final List<ImposterRejectedEvent> rejected = new ArrayList<>();

        @Override
        public void onStubMatched(StubMatchedEvent event) {
            matched.add(event);
        }

        @Override
        public void onNoMatch(NoMatchEvent event) {
            noMatch.add(event);
        }

        @Override
        public void onImposterCompiled(ImposterCompiledEvent event) {
            compiled.add(event);
        }

        @Override
        public void onImposterRejected(ImposterRejectedEvent event) {
            rejected.add(event);
        }
    }
}
