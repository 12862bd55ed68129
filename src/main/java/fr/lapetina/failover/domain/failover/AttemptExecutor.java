package fr.lapetina.failover.domain.failover;

import fr.lapetina.failover.domain.model.AttemptOutcome;
import fr.lapetina.failover.domain.model.Origin;
import fr.lapetina.failover.domain.model.ProxyRequest;

import java.time.Duration;

/**
 * Performs one bounded-time request against a single origin.
 *
 * Implementations must be thread-safe and must return within roughly
 * {@code timeout}: an attempt that has not produced a response by then is
 * cancelled and reported as {@link fr.lapetina.failover.domain.model.OutcomeType#TIMEOUT}.
 * Failures are reported as outcomes, not thrown.
 */
public interface AttemptExecutor {

    /**
     * Sends {@code request} to {@code origin}, keeping method, path, query and body.
     *
     * @param origin  Target origin
     * @param request Inbound request to replay
     * @param timeout Upper bound for this attempt only
     * @return Classified outcome of the attempt
     */
    AttemptOutcome attempt(Origin origin, ProxyRequest request, Duration timeout);
}
