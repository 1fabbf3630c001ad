package org.cachegrid.runtime.worldgen;

import com.typesafe.config.Config;

/**
 * A value strategy drawing uniformly from an inclusive integer range.
 */
public class UniformValueStrategy implements ICacheValueStrategy {

    private final int min;
    private final int max;

    /**
     * @param min Smallest value, must be positive.
     * @param max Largest value, at least {@code min}.
     */
    public UniformValueStrategy(int min, int max) {
        if (min <= 0 || max < min) {
            throw new IllegalArgumentException("Uniform range must satisfy 0 < min <= max: [" + min + ", " + max + "]");
        }
        this.min = min;
        this.max = max;
    }

    /**
     * Config-based constructor.
     * @param options Configuration with optional {@code min} (default 1) and {@code max} (default 99).
     */
    public UniformValueStrategy(Config options) {
        this(
            options.hasPath("min") ? options.getInt("min") : 1,
            options.hasPath("max") ? options.getInt("max") : 99
        );
    }

    @Override
    public int sample(double uniform) {
        long span = (long) max - min + 1;
        long offset = Math.min(span - 1, (long) Math.floor(uniform * span));
        return (int) (min + offset);
    }

    @Override
    public String toString() {
        return "UniformValueStrategy{min=" + min + ", max=" + max + "}";
    }
}
