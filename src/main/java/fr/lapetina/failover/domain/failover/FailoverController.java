package fr.lapetina.failover.domain.failover;

import fr.lapetina.failover.domain.model.AttemptOutcome;
import fr.lapetina.failover.domain.model.Origin;
import fr.lapetina.failover.domain.model.ProxyRequest;
import fr.lapetina.failover.domain.model.ProxyResponse;
import fr.lapetina.failover.domain.pool.OriginPool;
import fr.lapetina.failover.domain.pool.PoolExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Routes one inbound request across a pool of origins.
 *
 * Origins are drawn one at a time and attempted sequentially, with no delay
 * between attempts. The first successful response is returned verbatim; when
 * every origin has failed (or the pool was empty to begin with) the caller gets
 * a synthetic 503. The controller never throws to its caller.
 *
 * Holds no per-request state and is shared by all request threads.
 */
public final class FailoverController {

    private static final Logger log = LoggerFactory.getLogger(FailoverController.class);

    private final FailoverConfiguration configuration;
    private final AttemptExecutor executor;
    private final FailoverListener listener;

    public FailoverController(
            FailoverConfiguration configuration,
            AttemptExecutor executor,
            FailoverListener listener
    ) {
        this.configuration = Objects.requireNonNull(configuration, "Configuration is required");
        this.executor = Objects.requireNonNull(executor, "Attempt executor is required");
        this.listener = listener != null ? listener : FailoverListener.NOOP;
    }

    public FailoverController(FailoverConfiguration configuration, AttemptExecutor executor) {
        this(configuration, executor, FailoverListener.NOOP);
    }

    /**
     * Routes a request using a fresh pool built from the configured origins.
     */
    public ProxyResponse route(ProxyRequest request) {
        return route(request, configuration.newPool());
    }

    /**
     * Routes a request using the given pool. The pool is consumed.
     */
    public ProxyResponse route(ProxyRequest request, OriginPool pool) {
        int attempts = 0;

        while (!pool.isEmpty()) {
            Origin origin;
            try {
                origin = pool.next();
            } catch (PoolExhaustedException e) {
                break;
            }

            attempts++;
            AttemptOutcome outcome = attempt(origin, request);
            notifyAttempt(outcome);

            if (outcome.isSuccess()) {
                log.info("Request routed: origin={}, method={}, path={}, status={}, attempt={}, latencyMs={}",
                        origin, request.method(), request.path(), outcome.statusCode(),
                        attempts, outcome.elapsed().toMillis());
                notifyRouted(origin, attempts);
                return outcome.response();
            }

            log.warn("Attempt failed, failing over: origin={}, method={}, path={}, reason={}, elapsedMs={}, remaining={}",
                    origin, request.method(), request.path(), outcome.reason(),
                    outcome.elapsed().toMillis(), pool.size());
        }

        log.warn("Origin pool exhausted: method={}, path={}, attempts={}",
                request.method(), request.path(), attempts);
        notifyExhausted(attempts);
        return ProxyResponse.serviceUnavailable();
    }

    private AttemptOutcome attempt(Origin origin, ProxyRequest request) {
        Instant start = Instant.now();
        try {
            AttemptOutcome outcome = executor.attempt(origin, request, configuration.attemptTimeout());
            if (outcome == null) {
                return AttemptOutcome.transportError(origin,
                        new IllegalStateException("Executor returned no outcome"),
                        Duration.between(start, Instant.now()));
            }
            return outcome;
        } catch (RuntimeException e) {
            log.error("Attempt executor failed unexpectedly: origin={}", origin, e);
            return AttemptOutcome.transportError(origin, e, Duration.between(start, Instant.now()));
        }
    }

    private void notifyAttempt(AttemptOutcome outcome) {
        try {
            listener.onAttempt(outcome);
        } catch (Exception e) {
            log.error("Error notifying failover listener", e);
        }
    }

    private void notifyRouted(Origin origin, int attempts) {
        try {
            listener.onRouted(origin, attempts);
        } catch (Exception e) {
            log.error("Error notifying failover listener", e);
        }
    }

    private void notifyExhausted(int attempts) {
        try {
            listener.onExhausted(attempts);
        } catch (Exception e) {
            log.error("Error notifying failover listener", e);
        }
    }

    public FailoverConfiguration getConfiguration() {
        return configuration;
    }
}
