package fr.lapetina.failover.domain.pool;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Factory for creating selection policies by configuration name.
 */
public final class SelectionPolicyFactory {

    public static final String SEQUENTIAL = "sequential";
    public static final String RANDOM = "random";

    private static final Map<String, Supplier<SelectionPolicy>> REGISTRY = new ConcurrentHashMap<>();

    static {
        register(SEQUENTIAL, SequentialPolicy::new);
        register(RANDOM, RandomPolicy::new);
    }

    private SelectionPolicyFactory() {
        // Utility class
    }

    /**
     * Registers a custom policy.
     *
     * @param name Policy name (used in configuration)
     * @param supplier Factory for creating policy instances
     */
    public static void register(String name, Supplier<SelectionPolicy> supplier) {
        REGISTRY.put(name.toLowerCase(), supplier);
    }

    /**
     * Creates a policy by name.
     *
     * @param name Policy name from configuration
     * @return Policy instance, or empty if not found
     */
    public static Optional<SelectionPolicy> create(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Supplier<SelectionPolicy> supplier = REGISTRY.get(name.trim().toLowerCase());
        if (supplier == null) {
            return Optional.empty();
        }
        return Optional.of(supplier.get());
    }

    /**
     * Maps the boolean "random" switch of the environment configuration to a policy name.
     */
    public static String nameFor(boolean random) {
        return random ? RANDOM : SEQUENTIAL;
    }

    /**
     * Returns all registered policy names.
     */
    public static Iterable<String> getRegisteredNames() {
        return REGISTRY.keySet();
    }
}
