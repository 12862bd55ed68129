package fr.lapetina.failover.domain.pool;

import fr.lapetina.failover.domain.model.Origin;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Random selection without replacement.
 *
 * Each call picks uniformly among the origins remaining at that call, so over one
 * request every origin is tried at most once, in an unpredictable order.
 *
 * Thread-safe via ThreadLocalRandom.
 */
public final class RandomPolicy implements SelectionPolicy {

    private final Supplier<? extends Random> random;

    public RandomPolicy() {
        this(ThreadLocalRandom::current);
    }

    /**
     * @param random source of randomness, consulted once per selection
     */
    public RandomPolicy(Supplier<? extends Random> random) {
        this.random = random;
    }

    @Override
    public String getName() {
        return "random";
    }

    @Override
    public Selection select(List<Origin> remaining) {
        if (remaining == null || remaining.isEmpty()) {
            throw new PoolExhaustedException();
        }

        int index = random.get().nextInt(remaining.size());
        List<Origin> rest = new ArrayList<>(remaining);
        Origin chosen = rest.remove(index);
        return new Selection(chosen, rest);
    }
}
