package fr.lapetina.admission.domain.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Registry of placement strategies by configuration name.
 *
 * An instance is built once at startup and handed to whoever needs to resolve a strategy
 * name. Built-in strategies are registered in a fixed order by {@link #withDefaults()}.
 * Registering a name twice fails.
 */
public final class PlacementStrategyRegistry {

    private static final Logger log = LoggerFactory.getLogger(PlacementStrategyRegistry.class);

    private final Map<String, Supplier<PlacementStrategy>> registry = new LinkedHashMap<>();

    /**
     * Creates a registry holding the built-in strategies.
     */
    public static PlacementStrategyRegistry withDefaults() {
        return new PlacementStrategyRegistry()
                .register(LeastLoadedPlacementStrategy.NAME, LeastLoadedPlacementStrategy::new)
                .register(LongestPromptFirstPlacementStrategy.NAME, LongestPromptFirstPlacementStrategy::new);
    }

    /**
     * Registers a strategy.
     *
     * @param name     Strategy name (used in configuration), case-insensitive
     * @param supplier Factory for creating strategy instances
     * @throws IllegalStateException if the name is already registered
     */
    public synchronized PlacementStrategyRegistry register(String name, Supplier<PlacementStrategy> supplier) {
        Objects.requireNonNull(supplier, "supplier");
        String key = normalize(name);
        if (registry.containsKey(key)) {
            throw new IllegalStateException("Placement strategy already registered: " + key);
        }
        registry.put(key, supplier);
        log.debug("Placement strategy registered: {}", key);
        return this;
    }

    /**
     * Creates a strategy by name.
     *
     * @return Strategy instance, or empty if not found
     */
    public synchronized Optional<PlacementStrategy> create(String name) {
        Supplier<PlacementStrategy> supplier = registry.get(normalize(name));
        if (supplier == null) {
            return Optional.empty();
        }
        return Optional.of(supplier.get());
    }

    /**
     * Creates a strategy by name.
     *
     * @throws IllegalArgumentException if no strategy is registered under {@code name}
     */
    public PlacementStrategy get(String name) {
        return create(name).orElseThrow(() -> new IllegalArgumentException(
                "Placement strategy not registered: " + name + ", known: " + getRegisteredNames()));
    }

    public synchronized boolean has(String name) {
        return registry.containsKey(normalize(name));
    }

    /**
     * Returns all registered names in registration order.
     */
    public synchronized List<String> getRegisteredNames() {
        return List.copyOf(registry.keySet());
    }

    private static String normalize(String name) {
        Objects.requireNonNull(name, "name");
        return name.trim().toLowerCase();
    }
}
