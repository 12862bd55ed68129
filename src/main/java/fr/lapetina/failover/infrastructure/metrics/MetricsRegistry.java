package fr.lapetina.failover.infrastructure.metrics;

import fr.lapetina.failover.domain.failover.FailoverListener;
import fr.lapetina.failover.domain.model.AttemptOutcome;
import fr.lapetina.failover.domain.model.Origin;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Attempt counters and latency timers per origin and outcome
 * - Routed / exhausted request counters
 * - Attempts-per-request distribution
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements FailoverListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Timer> attemptTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> attemptCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> routedCounters = new ConcurrentHashMap<>();

    private final Counter exhaustedCounter;
    private final DistributionSummary attemptsPerRequest;
    private final AtomicInteger configuredOrigins = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_configured_origins", configuredOrigins, AtomicInteger::get)
                .description("Number of configured origins")
                .register(registry);

        this.exhaustedCounter = Counter.builder(prefix + "_exhausted_total")
                .description("Requests answered with 503 because no origin succeeded")
                .register(registry);

        this.attemptsPerRequest = DistributionSummary.builder(prefix + "_attempts_per_request")
                .description("Number of origin attempts made per inbound request")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("failover");
    }

    @Override
    public void onAttempt(AttemptOutcome outcome) {
        String origin = outcome.origin().authority();
        String type = outcome.type().name();
        String key = origin + ":" + type;

        attemptCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_attempts_total")
                        .description("Total number of origin attempts")
                        .tag("origin", origin)
                        .tag("outcome", type)
                        .register(registry)
        ).increment();

        attemptTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_attempt_latency")
                        .description("Origin attempt latency")
                        .tag("origin", origin)
                        .tag("outcome", type)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(outcome.elapsed());
    }

    @Override
    public void onRouted(Origin origin, int attempts) {
        routedCounters.computeIfAbsent(origin.authority(), k ->
                Counter.builder(prefix + "_routed_total")
                        .description("Requests answered by an origin")
                        .tag("origin", k)
                        .register(registry)
        ).increment();
        attemptsPerRequest.record(attempts);
    }

    @Override
    public void onExhausted(int attempts) {
        exhaustedCounter.increment();
        attemptsPerRequest.record(attempts);
    }

    /**
     * Updates the configured origin count.
     */
    public void setConfiguredOrigins(int value) {
        configuredOrigins.set(value);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    @Override
    public void close() {
        registry.close();
    }
}
