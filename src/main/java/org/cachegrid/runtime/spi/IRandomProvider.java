package org.cachegrid.runtime.spi;

/**
 * Provides deterministic randomness scoped to a game.
 * Implementations must be pure with respect to the provided seed and
 * support derivation of child providers for independent sub-streams.
 */
public interface IRandomProvider {

    /**
     * Returns a random double in the range [0.0, 1.0).
     *
     * @return the random double
     */
    double nextDouble();

    /**
     * Creates a derived provider that is deterministically based on this provider's seed and the given scope/key.
     * Use this to create independent sub-streams (e.g., per cell and per purpose).
     *
     * @param scope a stable, descriptive scope name (e.g., "cache-presence", "cache-value")
     * @param key a stable numeric key (e.g., a packed cell identity)
     * @return a derived random provider
     */
    IRandomProvider deriveFor(String scope, long key);
}
