package org.cachegrid.runtime.worldgen;

import org.cachegrid.runtime.model.BaselineContent;
import org.cachegrid.runtime.model.CellId;
import org.cachegrid.runtime.spi.IRandomProvider;

import java.util.Objects;

/**
 * Deterministic generator of baseline cell content.
 * <p>
 * Baseline content is never stored: it is recomputed from the cell identity whenever it is
 * needed. Presence and value come from two streams derived from the root provider under different
 * scope names, so the decision whether a cache exists carries no information about its value.
 * <p>
 * <strong>Thread Safety:</strong> stateless after construction; derived streams are created per call.
 */
public class CacheGenerator {

    static final String PRESENCE_SCOPE = "cache-presence";
    static final String VALUE_SCOPE = "cache-value";

    private final IRandomProvider randomProvider;
    private final double spawnProbability;
    private final ICacheValueStrategy valueStrategy;

    /**
     * Creates a generator.
     *
     * @param randomProvider Root provider; only {@link IRandomProvider#deriveFor(String, long)} is used.
     * @param spawnProbability Chance in [0, 1] that an unmodified cell holds a cache.
     * @param valueStrategy Maps the value stream to token values.
     */
    public CacheGenerator(IRandomProvider randomProvider, double spawnProbability, ICacheValueStrategy valueStrategy) {
        this.randomProvider = Objects.requireNonNull(randomProvider, "randomProvider");
        this.valueStrategy = Objects.requireNonNull(valueStrategy, "valueStrategy");
        if (spawnProbability < 0 || spawnProbability > 1 || Double.isNaN(spawnProbability)) {
            throw new IllegalArgumentException("Spawn probability must be within [0, 1]: " + spawnProbability);
        }
        this.spawnProbability = spawnProbability;
    }

    /**
     * @param i Row index.
     * @param j Column index.
     * @return The baseline content of cell {@code (i, j)}.
     */
    public BaselineContent generate(int i, int j) {
        return generate(new CellId(i, j));
    }

    /**
     * @param cell The cell.
     * @return The baseline content of the cell.
     */
    public BaselineContent generate(CellId cell) {
        long key = cell.packed();
        double presence = randomProvider.deriveFor(PRESENCE_SCOPE, key).nextDouble();
        if (presence >= spawnProbability) {
            return BaselineContent.ABSENT;
        }
        double magnitude = randomProvider.deriveFor(VALUE_SCOPE, key).nextDouble();
        return BaselineContent.cache(valueStrategy.sample(magnitude));
    }

    public double getSpawnProbability() {
        return spawnProbability;
    }

    public ICacheValueStrategy getValueStrategy() {
        return valueStrategy;
    }
}
