package io.virtserve.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Tests for {@link Request} and its builder. */
class RequestTest {

    @Test
    @DisplayName("Builder splits the raw query off the path and merges added parameters")
    void builderSplitsAndMergesQuery() {
        Request request = Request.builder()
                .path("/orders?id=1&Tag=a")
                .query("tag", "b")
                .build();

        assertThat(request.path()).isEqualTo("/orders");
        assertThat(request.query().first("id")).isEqualTo("1");
        assertThat(request.query().all("tag")).containsExactly("a", "b");
    }

    @Test
    void builderDefaults() {
        Request request = Request.builder().build();

        assertThat(request.method()).isEqualTo("GET");
        assertThat(request.path()).isEqualTo("/");
        assertThat(request.query().isEmpty()).isTrue();
        assertThat(request.headers().isEmpty()).isTrue();
        assertThat(request.body().isEmpty()).isTrue();
        assertThat(request.requestFrom()).isNull();
        assertThat(request.ip()).isNull();
    }

    @Test
    @DisplayName("Body media type follows a Content-Type header added before it")
    void bodyMediaTypeFromHeader() {
        Request request = Request.builder()
                .method("POST")
                .header("Content-Type", "application/x-www-form-urlencoded; charset=utf-8")
                .body("a=1")
                .build();

        assertThat(request.body().mediaType()).isEqualTo(MediaType.FORM);
        assertThat(request.body().asString()).isEqualTo("a=1");
        assertThat(request.headers().first("content-type")).startsWith("application/x-www-form-urlencoded");
    }

    @Test
    void canonicalConstructorRejectsMissingMethodOrPath() {
        assertThatThrownBy(() -> new Request(null, "/", null, null, null, null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("method");
        assertThatThrownBy(() -> new Request("GET", null, null, null, null, null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("path");
    }

    @ParameterizedTest(name = "{0} → {1}")
    @CsvSource({"10.0.0.1:5050, 10.0.0.1", "'[::1]:8080', ::1", "localhost, localhost", "::1, ::1"})
    void ipStripsThePort(String requestFrom, String expectedIp) {
        Request request = Request.builder().requestFrom(requestFrom).build();

        assertThat(request.ip()).isEqualTo(expectedIp);
    }
}
