package fr.lapetina.failover.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.failover.domain.failover.FailoverConfiguration;
import fr.lapetina.failover.domain.failover.FailoverController;
import fr.lapetina.failover.domain.model.Origin;
import fr.lapetina.failover.domain.model.ProxyRequest;
import fr.lapetina.failover.domain.model.ProxyResponse;
import fr.lapetina.failover.infrastructure.config.RouterConfig;
import fr.lapetina.failover.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - any path - Routed through the failover controller
 * - GET {admin}/health - Router status and configuration (no origin probing)
 * - GET {admin}/metrics - Prometheus metrics endpoint
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final FailoverController controller;
    private final MetricsRegistry metricsRegistry;

    public HttpServer(
            RouterConfig.ServerConfig serverConfig,
            FailoverController controller,
            MetricsRegistry metricsRegistry
    ) throws IOException {
        this.controller = controller;
        this.metricsRegistry = metricsRegistry;
        this.objectMapper = new ObjectMapper();

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(serverConfig.getHost(), serverConfig.getPort()),
                serverConfig.getBacklog()
        );

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, serverConfig.getWorkerThreads()), r -> {
            Thread t = new Thread(r, "router-worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        // Register handlers; the longest matching context wins
        String admin = normalizePrefix(serverConfig.getAdminPathPrefix());
        server.createContext("/", new ProxyHandler());
        server.createContext(admin + "/health", new HealthHandler());
        server.createContext(admin + "/metrics", new MetricsHandler());

        log.info("HTTP server configured on {}:{}, admin prefix {}",
                serverConfig.getHost(), getPort(), admin);
    }

    static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isBlank() || prefix.equals("/")) {
            return "/_router";
        }
        String normalized = prefix.startsWith("/") ? prefix : "/" + prefix;
        return normalized.endsWith("/") ? normalized.substring(0, normalized.length() - 1) : normalized;
    }

    public void start() {
        server.start();
        log.info("HTTP server started");
    }

    /**
     * Actual bound port, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("HTTP server stopped");
    }

    // ==================== PROXY HANDLER ====================

    private class ProxyHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String requestId = exchange.getRequestHeaders().getFirst("X-Request-ID");
            MDC.put("requestId", requestId != null ? requestId : UUID.randomUUID().toString());

            try {
                ProxyRequest request = toProxyRequest(exchange);
                ProxyResponse response = controller.route(request);
                sendResponse(exchange, "HEAD".equalsIgnoreCase(request.method()), response);

            } catch (Exception e) {
                log.error("Error handling proxied request", e);
                sendText(exchange, 500, "Internal server error");
            } finally {
                MDC.clear();
            }
        }
    }

    private ProxyRequest toProxyRequest(HttpExchange exchange) throws IOException {
        URI uri = exchange.getRequestURI();
        byte[] body;
        try (InputStream is = exchange.getRequestBody()) {
            body = is.readAllBytes();
        }

        Map<String, List<String>> headers = new LinkedHashMap<>();
        exchange.getRequestHeaders().forEach(headers::put);

        return new ProxyRequest(
                exchange.getRequestMethod(),
                uri.getRawPath(),
                uri.getRawQuery(),
                headers,
                body
        );
    }

    private void sendResponse(HttpExchange exchange, boolean head, ProxyResponse response) throws IOException {
        Headers responseHeaders = exchange.getResponseHeaders();
        response.headers().forEach((name, values) -> responseHeaders.put(name, values));

        byte[] body = response.body();
        int status = response.statusCode();
        boolean noBody = head || body.length == 0 || status == 204 || status == 304 || status < 200;
        exchange.sendResponseHeaders(status, noBody ? -1 : body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            if (!noBody) {
                os.write(body);
            }
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            FailoverConfiguration configuration = controller.getConfiguration();
            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", configuration.origins().isEmpty() ? "NO_ORIGINS" : "UP");
            health.put("timestamp", System.currentTimeMillis());
            health.put("origins", configuration.origins().stream().map(Origin::authority).toList());
            health.put("selectionPolicy", configuration.selectionPolicy().getName());
            health.put("attemptTimeoutMs", configuration.attemptTimeout().toMillis());
            health.put("successStatusCodes", configuration.successStatusCodes());

            int statusCode = configuration.origins().isEmpty() ? 503 : 200;
            sendJson(exchange, statusCode, health);
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== HELPER METHODS ====================

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        sendJson(exchange, statusCode, Map.of("error", message));
    }

    private void sendText(HttpExchange exchange, int statusCode, String message) throws IOException {
        byte[] bytes = message.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
