package fr.lapetina.failover.infrastructure.http;

import fr.lapetina.failover.domain.failover.AttemptExecutor;
import fr.lapetina.failover.domain.model.AttemptOutcome;
import fr.lapetina.failover.domain.model.Origin;
import fr.lapetina.failover.domain.model.ProxyRequest;
import fr.lapetina.failover.domain.model.ProxyResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * HTTP client replaying inbound requests against origins.
 *
 * Uses java.net.http.HttpClient. Each attempt is bounded twice: the request
 * timeout covers the wait for the response head, and the wait on the response
 * future covers the whole exchange. Whichever fires first, the pending exchange
 * is cancelled before returning.
 */
public class OriginHttpClient implements AttemptExecutor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OriginHttpClient.class);

    /** Headers that describe a single connection, or that HttpClient manages itself. */
    static final Set<String> REQUEST_HEADERS_NOT_FORWARDED = Set.of(
            "connection", "content-length", "expect", "host", "keep-alive",
            "proxy-authenticate", "proxy-authorization", "proxy-connection",
            "te", "trailer", "transfer-encoding", "upgrade"
    );

    /** Framing and hop-by-hop headers recomputed by the serving layer. */
    static final Set<String> RESPONSE_HEADERS_NOT_FORWARDED = Set.of(
            "connection", "content-length", "keep-alive", "proxy-connection",
            "te", "trailer", "transfer-encoding", "upgrade"
    );

    private final HttpClient httpClient;
    private final Set<Integer> successStatusCodes;

    public OriginHttpClient(Duration connectTimeout, Set<Integer> successStatusCodes) {
        this.successStatusCodes = Set.copyOf(successStatusCodes);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    public OriginHttpClient() {
        this(Duration.ofMillis(500), Set.of(200));
    }

    @Override
    public AttemptOutcome attempt(Origin origin, ProxyRequest request, Duration timeout) {
        Instant startTime = Instant.now();

        CompletableFuture<HttpResponse<byte[]>> future;
        try {
            HttpRequest httpRequest = buildHttpRequest(origin, request, timeout);

            log.debug("Sending request: origin={}, method={}, uri={}, timeoutMs={}",
                    origin, request.method(), httpRequest.uri(), timeout.toMillis());

            future = httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IllegalArgumentException e) {
            log.warn("Failed to build request: origin={}, path={}, error={}",
                    origin, request.path(), e.getMessage());
            return AttemptOutcome.transportError(origin, e, elapsedSince(startTime));
        }

        try {
            HttpResponse<byte[]> response = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return handleResponse(origin, response, startTime);

        } catch (TimeoutException e) {
            return AttemptOutcome.timeout(origin, elapsedSince(startTime));

        } catch (ExecutionException e) {
            return handleException(origin, e.getCause(), startTime);

        } catch (CancellationException e) {
            return AttemptOutcome.transportError(origin, e, elapsedSince(startTime));

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AttemptOutcome.transportError(origin, e, elapsedSince(startTime));

        } finally {
            if (!future.isDone()) {
                future.cancel(true);
            }
        }
    }

    HttpRequest buildHttpRequest(Origin origin, ProxyRequest request, Duration timeout) {
        URI uri = buildUri(origin, request);

        HttpRequest.BodyPublisher body = request.hasBody()
                ? HttpRequest.BodyPublishers.ofByteArray(request.body())
                : HttpRequest.BodyPublishers.noBody();

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .method(request.method(), body);

        request.headers().forEach((name, values) -> {
            if (!REQUEST_HEADERS_NOT_FORWARDED.contains(name.toLowerCase(Locale.ROOT))) {
                values.forEach(value -> builder.header(name, value));
            }
        });

        return builder.build();
    }

    static URI buildUri(Origin origin, ProxyRequest request) {
        String path = request.path().startsWith("/") ? request.path() : "/" + request.path();
        String query = request.query() != null ? "?" + request.query() : "";
        return URI.create("http://" + origin.authority() + path + query);
    }

    private AttemptOutcome handleResponse(Origin origin, HttpResponse<byte[]> response, Instant startTime) {
        Duration elapsed = elapsedSince(startTime);
        int statusCode = response.statusCode();

        if (!successStatusCodes.contains(statusCode)) {
            return AttemptOutcome.badStatus(origin, statusCode, elapsed);
        }

        ProxyResponse proxyResponse = new ProxyResponse(
                statusCode,
                copyResponseHeaders(response.headers().map()),
                response.body()
        );
        return AttemptOutcome.success(origin, proxyResponse, elapsed);
    }

    private AttemptOutcome handleException(Origin origin, Throwable ex, Instant startTime) {
        Throwable cause = ex;
        if (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }

        if (cause instanceof HttpTimeoutException) {
            return AttemptOutcome.timeout(origin, elapsedSince(startTime));
        }
        if (!(cause instanceof IOException)) {
            log.error("Request failed unexpectedly: origin={}, errorType={}",
                    origin, cause.getClass().getSimpleName(), cause);
        }
        return AttemptOutcome.transportError(origin, cause, elapsedSince(startTime));
    }

    static Map<String, List<String>> copyResponseHeaders(Map<String, List<String>> headers) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        headers.forEach((name, values) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if (!lower.startsWith(":") && !RESPONSE_HEADERS_NOT_FORWARDED.contains(lower)) {
                copy.put(name, values);
            }
        });
        return copy;
    }

    private static Duration elapsedSince(Instant startTime) {
        return Duration.between(startTime, Instant.now());
    }

    @Override
    public void close() {
        // HttpClient has no close() before Java 21; idle connections expire on their own
    }
}
