package fr.lapetina.failover.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OriginTest {

    @Test
    @DisplayName("should accept host, host:port and IP forms")
    void shouldAcceptHostForms() {
        assertThat(Origin.of("example.com").authority()).isEqualTo("example.com");
        assertThat(Origin.of("  example.com:8080 ").authority()).isEqualTo("example.com:8080");
        assertThat(Origin.of("10.0.0.7:81").toString()).isEqualTo("10.0.0.7:81");
    }

    @Test
    @DisplayName("should reject blank values, schemes and paths")
    void shouldRejectInvalid() {
        assertThatThrownBy(() -> Origin.of("   ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Origin.of("http://example.com")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Origin.of("example.com/path")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Origin.of("exa mple.com")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should parse comma-separated lists in order, skipping empty entries")
    void shouldParseList() {
        assertThat(Origin.parseList("a.example, b.example:8080,,c.example ,"))
                .extracting(Origin::authority)
                .containsExactly("a.example", "b.example:8080", "c.example");
        assertThat(Origin.parseList("")).isEmpty();
        assertThat(Origin.parseList(null)).isEmpty();
    }

    @Test
    @DisplayName("should compare by authority")
    void shouldCompareByAuthority() {
        assertThat(Origin.of("a:1")).isEqualTo(new Origin("a:1"));
        assertThat(Origin.of("a:1")).isNotEqualTo(Origin.of("a:2"));
    }

    @Test
    @DisplayName("outcome should describe its failure reason")
    void outcomeShouldDescribeReason() {
        Origin origin = Origin.of("a");

        assertThat(AttemptOutcome.badStatus(origin, 502, Duration.ZERO).reason()).isEqualTo("bad status 502");
        assertThat(AttemptOutcome.timeout(origin, Duration.ZERO).reason()).isEqualTo("timeout");
        assertThat(AttemptOutcome.transportError(origin, new ConnectException("refused"), null).reason())
                .isEqualTo("transport error: ConnectException (refused)");
        assertThat(AttemptOutcome.timeout(origin, null).elapsed()).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("request should normalize path and query")
    void requestShouldNormalize() {
        ProxyRequest request = new ProxyRequest("POST", "", "", null, null);

        assertThat(request.path()).isEqualTo("/");
        assertThat(request.query()).isNull();
        assertThat(request.hasBody()).isFalse();
        assertThat(request.pathAndQuery()).isEqualTo("/");

        ProxyRequest withQuery = ProxyRequest.builder().path("/search").query("q=a%20b").build();
        assertThat(withQuery.pathAndQuery()).isEqualTo("/search?q=a%20b");
    }

    @Test
    @DisplayName("service unavailable response should be a plain-text 503")
    void serviceUnavailableShouldBePlainText() {
        ProxyResponse response = ProxyResponse.serviceUnavailable();

        assertThat(response.statusCode()).isEqualTo(503);
        assertThat(response.bodyAsString()).isEqualTo("Service unavailable");
        assertThat(response.firstHeader("content-type")).isEqualTo("text/plain; charset=utf-8");
    }
}
