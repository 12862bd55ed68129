package fr.lapetina.failover.domain.pool;

import fr.lapetina.failover.domain.model.Origin;

import java.util.List;
import java.util.Objects;

/**
 * Candidate origins for a single inbound request.
 *
 * The pool owns a private copy of the configured origins and only ever shrinks:
 * each {@link #next()} removes the drawn origin, so no origin is tried twice
 * for the same request.
 *
 * Not thread-safe. A pool belongs to exactly one request and is discarded
 * when that request's failover loop ends.
 */
public final class OriginPool {

    private final SelectionPolicy policy;
    private List<Origin> remaining;

    public OriginPool(List<Origin> origins, SelectionPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "Selection policy is required");
        this.remaining = List.copyOf(origins);
    }

    /**
     * Removes and returns the next origin to try, as chosen by the policy.
     *
     * @throws PoolExhaustedException if no origins remain
     */
    public Origin next() {
        if (remaining.isEmpty()) {
            throw new PoolExhaustedException();
        }
        Selection selection = policy.select(remaining);
        remaining = selection.remaining();
        return selection.origin();
    }

    public boolean isEmpty() {
        return remaining.isEmpty();
    }

    public int size() {
        return remaining.size();
    }

    /**
     * Immutable snapshot of the origins not yet drawn.
     */
    public List<Origin> remaining() {
        return remaining;
    }
}
