package org.cachegrid.runtime.worldgen;

import com.typesafe.config.Config;

/**
 * A functional interface for creating cache value strategies from their configuration block.
 */
@FunctionalInterface
public interface ICacheStrategyCreator {
    /**
     * Creates a new cache value strategy.
     * @param options The strategy options; never null, possibly empty.
     * @return The created strategy.
     */
    ICacheValueStrategy create(Config options);
}
