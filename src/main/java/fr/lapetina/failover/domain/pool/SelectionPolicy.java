package fr.lapetina.failover.domain.pool;

import fr.lapetina.failover.domain.model.Origin;

import java.util.List;

/**
 * Policy choosing the next origin to try among those still untried for a request.
 *
 * Implementations must be pure with respect to the given list (never mutate it)
 * and thread-safe, as a single policy instance is shared by all concurrent requests.
 */
public interface SelectionPolicy {

    /**
     * Returns the name of this policy for configuration and logs.
     */
    String getName();

    /**
     * Picks one origin out of {@code remaining}.
     *
     * @param remaining origins not yet tried for the current request
     * @return the chosen origin and the list without it
     * @throws PoolExhaustedException if {@code remaining} is empty
     */
    Selection select(List<Origin> remaining);
}
