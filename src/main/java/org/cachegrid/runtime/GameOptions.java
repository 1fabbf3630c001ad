package org.cachegrid.runtime;

import com.typesafe.config.ConfigFactory;
import org.cachegrid.runtime.model.GeoPoint;

import java.util.Objects;

/**
 * Typed, validated settings of one game session.
 * <p>
 * Built either from the {@code cachegrid} block of the HOCON configuration or through the
 * {@link Builder}. Keys missing from the configuration fall back to the defaults in {@link Config}.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * cachegrid {
 *   seed = 0
 *   grid {
 *     origin { lat = 36.997936938057016, lng = -122.05703507501151 }
 *     tile-degrees = 1.0e-4
 *     neighborhood-size = 8
 *   }
 *   generation {
 *     spawn-probability = 0.1
 *     strategy { type = "tiered", options { } }
 *   }
 *   interaction {
 *     proximity-radius = 3
 *     carry-capacity = 1
 *     win-threshold = 32
 *   }
 *   viewport { follow-player = true }
 * }
 * </pre>
 */
public final class GameOptions {

    private final long seed;
    private final GeoPoint origin;
    private final double tileDegrees;
    private final int neighborhoodSize;
    private final double spawnProbability;
    private final String valueStrategy;
    private final com.typesafe.config.Config valueStrategyOptions;
    private final int proximityRadius;
    private final int carryCapacity;
    private final int winThreshold;
    private final boolean followPlayer;

    private GameOptions(Builder builder) {
        this.seed = builder.seed;
        this.origin = Objects.requireNonNull(builder.origin, "origin");
        this.tileDegrees = builder.tileDegrees;
        this.neighborhoodSize = builder.neighborhoodSize;
        this.spawnProbability = builder.spawnProbability;
        this.valueStrategy = Objects.requireNonNull(builder.valueStrategy, "valueStrategy");
        this.valueStrategyOptions = Objects.requireNonNull(builder.valueStrategyOptions, "valueStrategyOptions");
        this.proximityRadius = builder.proximityRadius;
        this.carryCapacity = builder.carryCapacity;
        this.winThreshold = builder.winThreshold;
        this.followPlayer = builder.followPlayer;
        validate();
    }

    /**
     * @return Options holding every built-in default.
     */
    public static GameOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Config-based factory.
     * @param config The {@code cachegrid} configuration block.
     * @return The options.
     * @throws com.typesafe.config.ConfigException if a value has the wrong type.
     * @throws IllegalArgumentException if a value is out of range.
     */
    public static GameOptions fromConfig(com.typesafe.config.Config config) {
        Builder builder = builder();
        if (config.hasPath("seed")) {
            builder.seed(config.getLong("seed"));
        }
        if (config.hasPath("grid.origin.lat") || config.hasPath("grid.origin.lng")) {
            builder.origin(new GeoPoint(
                config.hasPath("grid.origin.lat") ? config.getDouble("grid.origin.lat") : Config.DEFAULT_ORIGIN_LAT,
                config.hasPath("grid.origin.lng") ? config.getDouble("grid.origin.lng") : Config.DEFAULT_ORIGIN_LNG));
        }
        if (config.hasPath("grid.tile-degrees")) {
            builder.tileDegrees(config.getDouble("grid.tile-degrees"));
        }
        if (config.hasPath("grid.neighborhood-size")) {
            builder.neighborhoodSize(config.getInt("grid.neighborhood-size"));
        }
        if (config.hasPath("generation.spawn-probability")) {
            builder.spawnProbability(config.getDouble("generation.spawn-probability"));
        }
        if (config.hasPath("generation.strategy.type")) {
            builder.valueStrategy(config.getString("generation.strategy.type"));
        }
        if (config.hasPath("generation.strategy.options")) {
            builder.valueStrategyOptions(config.getConfig("generation.strategy.options"));
        }
        if (config.hasPath("interaction.proximity-radius")) {
            builder.proximityRadius(config.getInt("interaction.proximity-radius"));
        }
        if (config.hasPath("interaction.carry-capacity")) {
            builder.carryCapacity(config.getInt("interaction.carry-capacity"));
        }
        if (config.hasPath("interaction.win-threshold")) {
            builder.winThreshold(config.getInt("interaction.win-threshold"));
        }
        if (config.hasPath("viewport.follow-player")) {
            builder.followPlayer(config.getBoolean("viewport.follow-player"));
        }
        return builder.build();
    }

    private void validate() {
        if (!(tileDegrees > 0) || !Double.isFinite(tileDegrees)) {
            throw new IllegalArgumentException("grid.tile-degrees must be a positive number: " + tileDegrees);
        }
        if (neighborhoodSize < 1) {
            throw new IllegalArgumentException("grid.neighborhood-size must be at least 1: " + neighborhoodSize);
        }
        if (!(spawnProbability >= 0 && spawnProbability <= 1)) {
            throw new IllegalArgumentException("generation.spawn-probability must be within [0, 1]: " + spawnProbability);
        }
        if (proximityRadius < 0) {
            throw new IllegalArgumentException("interaction.proximity-radius must be non-negative: " + proximityRadius);
        }
        if (carryCapacity < 1) {
            throw new IllegalArgumentException("interaction.carry-capacity must be at least 1: " + carryCapacity);
        }
        if (winThreshold < 1) {
            throw new IllegalArgumentException("interaction.win-threshold must be positive: " + winThreshold);
        }
    }

    public long getSeed() {
        return seed;
    }

    public GeoPoint getOrigin() {
        return origin;
    }

    public double getTileDegrees() {
        return tileDegrees;
    }

    public int getNeighborhoodSize() {
        return neighborhoodSize;
    }

    public double getSpawnProbability() {
        return spawnProbability;
    }

    public String getValueStrategy() {
        return valueStrategy;
    }

    public com.typesafe.config.Config getValueStrategyOptions() {
        return valueStrategyOptions;
    }

    public int getProximityRadius() {
        return proximityRadius;
    }

    public int getCarryCapacity() {
        return carryCapacity;
    }

    public int getWinThreshold() {
        return winThreshold;
    }

    public boolean isFollowPlayer() {
        return followPlayer;
    }

    @Override
    public String toString() {
        return "GameOptions{seed=" + seed
            + ", origin=" + origin
            + ", tileDegrees=" + tileDegrees
            + ", neighborhoodSize=" + neighborhoodSize
            + ", spawnProbability=" + spawnProbability
            + ", valueStrategy=" + valueStrategy
            + ", proximityRadius=" + proximityRadius
            + ", carryCapacity=" + carryCapacity
            + ", winThreshold=" + winThreshold
            + ", followPlayer=" + followPlayer
            + "}";
    }

    /**
     * Builder starting from the built-in defaults.
     */
    public static final class Builder {
        private long seed = 0L;
        private GeoPoint origin = new GeoPoint(Config.DEFAULT_ORIGIN_LAT, Config.DEFAULT_ORIGIN_LNG);
        private double tileDegrees = Config.DEFAULT_TILE_DEGREES;
        private int neighborhoodSize = Config.DEFAULT_NEIGHBORHOOD_SIZE;
        private double spawnProbability = Config.DEFAULT_SPAWN_PROBABILITY;
        private String valueStrategy = Config.DEFAULT_VALUE_STRATEGY;
        private com.typesafe.config.Config valueStrategyOptions = ConfigFactory.empty();
        private int proximityRadius = Config.DEFAULT_PROXIMITY_RADIUS;
        private int carryCapacity = Config.DEFAULT_CARRY_CAPACITY;
        private int winThreshold = Config.DEFAULT_WIN_THRESHOLD;
        private boolean followPlayer = true;

        private Builder() {
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder origin(GeoPoint origin) {
            this.origin = origin;
            return this;
        }

        public Builder tileDegrees(double tileDegrees) {
            this.tileDegrees = tileDegrees;
            return this;
        }

        public Builder neighborhoodSize(int neighborhoodSize) {
            this.neighborhoodSize = neighborhoodSize;
            return this;
        }

        public Builder spawnProbability(double spawnProbability) {
            this.spawnProbability = spawnProbability;
            return this;
        }

        public Builder valueStrategy(String valueStrategy) {
            this.valueStrategy = valueStrategy;
            return this;
        }

        public Builder valueStrategyOptions(com.typesafe.config.Config valueStrategyOptions) {
            this.valueStrategyOptions = valueStrategyOptions;
            return this;
        }

        public Builder proximityRadius(int proximityRadius) {
            this.proximityRadius = proximityRadius;
            return this;
        }

        public Builder carryCapacity(int carryCapacity) {
            this.carryCapacity = carryCapacity;
            return this;
        }

        public Builder winThreshold(int winThreshold) {
            this.winThreshold = winThreshold;
            return this;
        }

        public Builder followPlayer(boolean followPlayer) {
            this.followPlayer = followPlayer;
            return this;
        }

        public GameOptions build() {
            return new GameOptions(this);
        }
    }
}
