package fr.lapetina.failover.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Inbound request as seen by the router.
 *
 * The body is buffered once so it can be replayed to every origin tried.
 * Path and query are kept raw (still percent-encoded).
 */
public record ProxyRequest(
        String method,
        String path,
        String query,
        Map<String, List<String>> headers,
        byte[] body
) {
    public ProxyRequest {
        Objects.requireNonNull(method, "Method is required");
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        if (query != null && query.isEmpty()) {
            query = null;
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (headers != null) {
            headers.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        }
        headers = Collections.unmodifiableMap(copy);
        body = body != null ? body : new byte[0];
    }

    public boolean hasBody() {
        return body.length > 0;
    }

    /**
     * Path plus query string, as it should appear after the origin authority.
     */
    public String pathAndQuery() {
        return query == null ? path : path + "?" + query;
    }

    public static ProxyRequest get(String path) {
        return new ProxyRequest("GET", path, null, Map.of(), null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String method = "GET";
        private String path = "/";
        private String query;
        private final Map<String, List<String>> headers = new LinkedHashMap<>();
        private byte[] body;

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
            return this;
        }

        public Builder headers(Map<String, List<String>> headers) {
            headers.forEach((name, values) -> values.forEach(v -> header(name, v)));
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public ProxyRequest build() {
            return new ProxyRequest(method, path, query, headers, body);
        }
    }
}
