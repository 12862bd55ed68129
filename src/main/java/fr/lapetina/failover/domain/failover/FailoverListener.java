package fr.lapetina.failover.domain.failover;

import fr.lapetina.failover.domain.model.AttemptOutcome;
import fr.lapetina.failover.domain.model.Origin;

/**
 * Observer of the failover loop, used for metrics.
 *
 * Called from request threads concurrently; implementations must be thread-safe.
 */
public interface FailoverListener {

    FailoverListener NOOP = new FailoverListener() {
    };

    /**
     * Called after every attempt, successful or not.
     */
    default void onAttempt(AttemptOutcome outcome) {
        // Default no-op
    }

    /**
     * Called when a request was answered by an origin.
     *
     * @param origin   The origin whose response is returned
     * @param attempts Number of attempts made for the request, including the successful one
     */
    default void onRouted(Origin origin, int attempts) {
        // Default no-op
    }

    /**
     * Called when a request ends with a 503 because no origin succeeded.
     *
     * @param attempts Number of failed attempts (0 for an empty pool)
     */
    default void onExhausted(int attempts) {
        // Default no-op
    }
}
