package org.cachegrid.runtime.worldgen;

/**
 * Maps a uniform sample to the token value of a freshly generated cache.
 * Implementations must be pure: the same sample always yields the same value.
 */
public interface ICacheValueStrategy {

    /**
     * @param uniform A sample in [0.0, 1.0).
     * @return A positive token value.
     */
    int sample(double uniform);
}
