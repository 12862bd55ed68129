package fr.lapetina.failover.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the failover router.
 * Designed to be populated from YAML, then overlaid with environment variables.
 */
public class RouterConfig {

    private ServerConfig server = new ServerConfig();
    private List<String> origins = new ArrayList<>();
    private AttemptConfig attempt = new AttemptConfig();
    private SelectionConfig selection = new SelectionConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public List<String> getOrigins() { return origins; }
    public void setOrigins(List<String> origins) { this.origins = origins; }

    public AttemptConfig getAttempt() { return attempt; }
    public void setAttempt(AttemptConfig attempt) { this.attempt = attempt; }

    public SelectionConfig getSelection() { return selection; }
    public void setSelection(SelectionConfig selection) { this.selection = selection; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Inbound HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int workerThreads = 64;
        private String adminPathPrefix = "/_router";

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }

        public String getAdminPathPrefix() { return adminPathPrefix; }
        public void setAdminPathPrefix(String adminPathPrefix) { this.adminPathPrefix = adminPathPrefix; }
    }

    /**
     * Per-attempt settings.
     */
    public static class AttemptConfig {
        public static final long DEFAULT_TIMEOUT_MS = 500;

        private long timeoutMs = DEFAULT_TIMEOUT_MS;
        private List<Integer> successStatusCodes = new ArrayList<>(List.of(200));

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public List<Integer> getSuccessStatusCodes() { return successStatusCodes; }
        public void setSuccessStatusCodes(List<Integer> successStatusCodes) { this.successStatusCodes = successStatusCodes; }
    }

    /**
     * Origin selection policy configuration.
     */
    public static class SelectionConfig {
        private String type = "sequential";

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "failover";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
