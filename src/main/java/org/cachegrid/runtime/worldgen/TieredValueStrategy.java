package org.cachegrid.runtime.worldgen;

import com.typesafe.config.Config;

import java.util.Arrays;
import java.util.List;

/**
 * A value strategy drawing from a fixed discrete distribution, looked up through a cumulative
 * distribution table. The default table is biased towards small values:
 * P(1)=0.60, P(2)=0.30, P(3)=0.07, P(4)=0.025, P(5)=0.005.
 */
public class TieredValueStrategy implements ICacheValueStrategy {

    static final int[] DEFAULT_VALUES = {1, 2, 3, 4, 5};
    static final double[] DEFAULT_WEIGHTS = {0.60, 0.30, 0.07, 0.025, 0.005};

    private final int[] values;
    private final double[] cumulative;

    /**
     * Creates the strategy with the default table.
     */
    public TieredValueStrategy() {
        this(DEFAULT_VALUES, DEFAULT_WEIGHTS);
    }

    /**
     * Creates a strategy from parallel value and weight arrays. Weights are normalised.
     *
     * @param values Positive token values, one per tier.
     * @param weights Non-negative relative weights, one per tier, with a positive sum.
     */
    public TieredValueStrategy(int[] values, double[] weights) {
        if (values.length == 0 || values.length != weights.length) {
            throw new IllegalArgumentException("Tier values and weights must be non-empty and of equal length");
        }
        double total = 0;
        for (int k = 0; k < values.length; k++) {
            if (values[k] <= 0) {
                throw new IllegalArgumentException("Tier value must be positive: " + values[k]);
            }
            if (weights[k] < 0 || !Double.isFinite(weights[k])) {
                throw new IllegalArgumentException("Tier weight must be a non-negative number: " + weights[k]);
            }
            total += weights[k];
        }
        if (total <= 0) {
            throw new IllegalArgumentException("Tier weights must not all be zero");
        }
        this.values = values.clone();
        this.cumulative = new double[weights.length];
        double running = 0;
        for (int k = 0; k < weights.length; k++) {
            running += weights[k] / total;
            cumulative[k] = running;
        }
    }

    /**
     * Config-based constructor.
     * @param options Configuration with a {@code tiers} list of {@code {value, weight}} objects.
     *                Falls back to the default table when {@code tiers} is absent.
     */
    public TieredValueStrategy(Config options) {
        this(tierValues(options), tierWeights(options));
    }

    @Override
    public int sample(double uniform) {
        for (int k = 0; k < cumulative.length; k++) {
            if (uniform < cumulative[k]) {
                return values[k];
            }
        }
        // Rounding can leave the last cumulative entry just below 1.0
        return values[values.length - 1];
    }

    int[] values() {
        return values.clone();
    }

    @Override
    public String toString() {
        return "TieredValueStrategy{values=" + Arrays.toString(values) + ", cumulative=" + Arrays.toString(cumulative) + "}";
    }

    private static int[] tierValues(Config options) {
        if (!options.hasPath("tiers")) {
            return DEFAULT_VALUES;
        }
        List<? extends Config> tiers = options.getConfigList("tiers");
        return tiers.stream().mapToInt(t -> t.getInt("value")).toArray();
    }

    private static double[] tierWeights(Config options) {
        if (!options.hasPath("tiers")) {
            return DEFAULT_WEIGHTS;
        }
        List<? extends Config> tiers = options.getConfigList("tiers");
        return tiers.stream().mapToDouble(t -> t.getDouble("weight")).toArray();
    }
}
