package fr.lapetina.failover.domain.failover;

import fr.lapetina.failover.domain.model.Origin;
import fr.lapetina.failover.domain.pool.OriginPool;
import fr.lapetina.failover.domain.pool.SelectionPolicy;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Process-wide failover settings, built once at startup and never mutated.
 *
 * @param origins            configured origins, in configuration order
 * @param attemptTimeout     upper bound for each individual attempt
 * @param selectionPolicy    policy used to draw origins from each request's pool
 * @param successStatusCodes statuses accepted as success; anything else fails over
 */
public record FailoverConfiguration(
        List<Origin> origins,
        Duration attemptTimeout,
        SelectionPolicy selectionPolicy,
        Set<Integer> successStatusCodes
) {
    public static final Duration DEFAULT_ATTEMPT_TIMEOUT = Duration.ofMillis(500);
    public static final Set<Integer> DEFAULT_SUCCESS_STATUS_CODES = Set.of(200);

    public FailoverConfiguration {
        origins = List.copyOf(origins);
        Objects.requireNonNull(attemptTimeout, "Attempt timeout is required");
        if (attemptTimeout.isZero() || attemptTimeout.isNegative()) {
            throw new IllegalArgumentException("Attempt timeout must be positive: " + attemptTimeout);
        }
        Objects.requireNonNull(selectionPolicy, "Selection policy is required");
        successStatusCodes = successStatusCodes == null || successStatusCodes.isEmpty()
                ? DEFAULT_SUCCESS_STATUS_CODES
                : Set.copyOf(successStatusCodes);
    }

    /**
     * Creates the private pool for one inbound request.
     */
    public OriginPool newPool() {
        return new OriginPool(origins, selectionPolicy);
    }
}
