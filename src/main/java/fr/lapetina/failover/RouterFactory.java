package fr.lapetina.failover;

import fr.lapetina.failover.domain.failover.AttemptExecutor;
import fr.lapetina.failover.domain.failover.FailoverConfiguration;
import fr.lapetina.failover.domain.failover.FailoverController;
import fr.lapetina.failover.domain.failover.FailoverListener;
import fr.lapetina.failover.domain.model.Origin;
import fr.lapetina.failover.domain.pool.SelectionPolicy;
import fr.lapetina.failover.domain.pool.SelectionPolicyFactory;
import fr.lapetina.failover.infrastructure.config.ConfigLoader;
import fr.lapetina.failover.infrastructure.config.ConfigLoader.ConfigurationException;
import fr.lapetina.failover.infrastructure.config.RouterConfig;
import fr.lapetina.failover.infrastructure.http.OriginHttpClient;
import fr.lapetina.failover.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Factory for creating a fully-wired failover controller from configuration.
 * This is the primary entry point for obtaining a configured FailoverController.
 *
 * <p>Usage:
 * <pre>{@code
 * try (RouterFactory factory = RouterFactory.create("config.yaml")) {
 *     FailoverController controller = factory.getController();
 *     ProxyResponse response = controller.route(ProxyRequest.get("/index.html"));
 * }
 * }</pre>
 */
public class RouterFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RouterFactory.class);

    private final RouterConfig config;
    private final FailoverConfiguration failoverConfiguration;
    private final MetricsRegistry metricsRegistry;
    private final AttemptExecutor attemptExecutor;
    private final FailoverController controller;

    protected RouterFactory(String configPath, Map<String, String> environment, AttemptExecutor executorOverride) {
        log.info("Initializing RouterFactory from config: {}", configPath);

        // Load configuration
        this.config = new ConfigLoader(configPath, environment).load();
        this.failoverConfiguration = createFailoverConfiguration(config);

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());
        metricsRegistry.setConfiguredOrigins(failoverConfiguration.origins().size());

        // Initialize attempt executor (allow override for testing)
        this.attemptExecutor = executorOverride != null ? executorOverride : createHttpClient();

        FailoverListener listener = config.getMetrics().isEnabled() ? metricsRegistry : FailoverListener.NOOP;
        this.controller = new FailoverController(failoverConfiguration, attemptExecutor, listener);

        log.info("Failover router configured: origins={}, policy={}, attemptTimeoutMs={}, successStatusCodes={}",
                failoverConfiguration.origins(),
                failoverConfiguration.selectionPolicy().getName(),
                failoverConfiguration.attemptTimeout().toMillis(),
                failoverConfiguration.successStatusCodes());
    }

    /**
     * Creates a factory from a configuration file, overlaid with the process environment.
     */
    public static RouterFactory create(String configPath) {
        return new RouterFactory(configPath, System.getenv(), null);
    }

    /**
     * Creates a factory from a configuration file, overlaid with the given environment.
     */
    public static RouterFactory create(String configPath, Map<String, String> environment) {
        return new RouterFactory(configPath, environment, null);
    }

    /**
     * Converts the loaded configuration into the immutable failover settings.
     *
     * @throws ConfigurationException on an invalid origin, policy or status code
     */
    static FailoverConfiguration createFailoverConfiguration(RouterConfig config) {
        List<Origin> origins = new ArrayList<>();
        for (String entry : config.getOrigins()) {
            try {
                origins.add(Origin.of(entry));
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new ConfigurationException("Invalid origin: " + entry, e);
            }
        }

        String policyName = config.getSelection().getType();
        SelectionPolicy policy = SelectionPolicyFactory.create(policyName)
                .orElseThrow(() -> new ConfigurationException("Unknown selection policy: " + policyName
                        + ". Available: " + SelectionPolicyFactory.getRegisteredNames()));

        Set<Integer> successCodes = new LinkedHashSet<>();
        if (config.getAttempt().getSuccessStatusCodes() != null) {
            for (Integer code : config.getAttempt().getSuccessStatusCodes()) {
                if (code == null || code < 100 || code > 599) {
                    throw new ConfigurationException("Invalid success status code: " + code);
                }
                successCodes.add(code);
            }
        }

        return new FailoverConfiguration(
                origins,
                Duration.ofMillis(config.getAttempt().getTimeoutMs()),
                policy,
                successCodes
        );
    }

    private OriginHttpClient createHttpClient() {
        return new OriginHttpClient(
                failoverConfiguration.attemptTimeout(),
                failoverConfiguration.successStatusCodes()
        );
    }

    public RouterConfig getConfig() {
        return config;
    }

    public FailoverConfiguration getFailoverConfiguration() {
        return failoverConfiguration;
    }

    public FailoverController getController() {
        return controller;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public AttemptExecutor getAttemptExecutor() {
        return attemptExecutor;
    }

    @Override
    public void close() {
        log.info("Shutting down RouterFactory...");

        if (attemptExecutor instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Error closing attempt executor", e);
            }
        }

        metricsRegistry.close();

        log.info("RouterFactory shut down");
    }
}
