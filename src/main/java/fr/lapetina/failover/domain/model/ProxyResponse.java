package fr.lapetina.failover.domain.model;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response handed back to the inbound caller.
 * Either an origin's response carried verbatim, or the synthetic 503.
 */
public record ProxyResponse(
        int statusCode,
        Map<String, List<String>> headers,
        byte[] body
) {
    public static final int SERVICE_UNAVAILABLE = 503;
    public static final String SERVICE_UNAVAILABLE_BODY = "Service unavailable";

    public ProxyResponse {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (headers != null) {
            headers.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        }
        headers = Collections.unmodifiableMap(copy);
        body = body != null ? body : new byte[0];
    }

    /**
     * Response returned when every origin of the pool failed, or the pool was empty.
     */
    public static ProxyResponse serviceUnavailable() {
        return new ProxyResponse(
                SERVICE_UNAVAILABLE,
                Map.of("Content-Type", List.of("text/plain; charset=utf-8")),
                SERVICE_UNAVAILABLE_BODY.getBytes(StandardCharsets.UTF_8)
        );
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    /**
     * First value of a header, matched case-insensitively.
     */
    public String firstHeader(String name) {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
                return entry.getValue().get(0);
            }
        }
        return null;
    }
}
