package fr.lapetina.failover.domain.pool;

import fr.lapetina.failover.domain.model.Origin;

import java.util.List;
import java.util.Objects;

/**
 * Result of applying a {@link SelectionPolicy}: the chosen origin and the pool left after removing it.
 */
public record Selection(Origin origin, List<Origin> remaining) {

    public Selection {
        Objects.requireNonNull(origin, "Selected origin is required");
        remaining = List.copyOf(remaining);
    }
}
