package org.cachegrid.runtime.worldgen;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A factory for creating cache value strategies.
 * It uses a registry to store different types of strategies.
 */
public class CacheStrategyFactory {

    private static final Map<String, ICacheStrategyCreator> registry = new HashMap<>();

    static {
        register("tiered", TieredValueStrategy::new);
        register("uniform", UniformValueStrategy::new);
    }

    private CacheStrategyFactory() {
    }

    /**
     * Registers a new cache value strategy creator.
     * @param type The type of the strategy.
     * @param creator The creator for the strategy.
     */
    public static void register(String type, ICacheStrategyCreator creator) {
        registry.put(type.toLowerCase(), creator);
    }

    /**
     * Creates a new cache value strategy.
     * @param type The type of the strategy to create.
     * @param options The options for the strategy, may be null.
     * @return The created strategy.
     * @throws IllegalArgumentException if the strategy type is unknown.
     */
    public static ICacheValueStrategy create(String type, Config options) {
        Objects.requireNonNull(type, "Strategy type cannot be null.");
        ICacheStrategyCreator creator = registry.get(type.toLowerCase());
        if (creator == null) {
            throw new IllegalArgumentException("Unknown cache value strategy type: " + type);
        }
        return creator.create(options != null ? options : ConfigFactory.empty());
    }
}
