package fr.lapetina.failover.domain.pool;

/**
 * Thrown when a selection is requested from a pool with no untried origins left.
 *
 * Never escapes the failover controller: it is turned into a 503 response.
 */
public final class PoolExhaustedException extends RuntimeException {

    public PoolExhaustedException() {
        super("No untried origins remain in the pool");
    }
}
