package fr.lapetina.failover.domain.pool;

import fr.lapetina.failover.domain.model.Origin;

import java.util.List;

/**
 * Ordered selection: always takes the head of the remaining origins,
 * so origins are tried in configuration order.
 *
 * Stateless, hence thread-safe.
 */
public final class SequentialPolicy implements SelectionPolicy {

    @Override
    public String getName() {
        return "sequential";
    }

    @Override
    public Selection select(List<Origin> remaining) {
        if (remaining == null || remaining.isEmpty()) {
            throw new PoolExhaustedException();
        }
        return new Selection(remaining.get(0), remaining.subList(1, remaining.size()));
    }
}
