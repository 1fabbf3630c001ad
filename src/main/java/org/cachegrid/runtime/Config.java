package org.cachegrid.runtime;

/**
 * Provides the built-in defaults of the game.
 * These values mirror {@code reference.conf} and are used when a session is built without a
 * configuration object. It is not meant to be instantiated.
 */
public final class Config {

    /**
     * Private constructor to prevent instantiation of this utility class.
     */
    private Config() {}

    /**
     * Latitude of the south-west corner of cell (0, 0).
     */
    public static final double DEFAULT_ORIGIN_LAT = 36.997936938057016;

    /**
     * Longitude of the south-west corner of cell (0, 0).
     */
    public static final double DEFAULT_ORIGIN_LNG = -122.05703507501151;

    /**
     * Edge length of a cell in degrees.
     */
    public static final double DEFAULT_TILE_DEGREES = 1e-4;

    /**
     * Half-width of the region shown around the player when the viewport follows the player.
     */
    public static final int DEFAULT_NEIGHBORHOOD_SIZE = 8;

    /**
     * Chance that an unmodified cell holds a cache.
     */
    public static final double DEFAULT_SPAWN_PROBABILITY = 0.1;

    /**
     * How many cells away (inclusive) the player can interact with a cache.
     */
    public static final int DEFAULT_PROXIMITY_RADIUS = 3;

    /**
     * Number of tokens the player can carry at once.
     */
    public static final int DEFAULT_CARRY_CAPACITY = 1;

    /**
     * Token value that wins the game once crafted.
     */
    public static final int DEFAULT_WIN_THRESHOLD = 32;

    /**
     * Name of the default cache value strategy.
     */
    public static final String DEFAULT_VALUE_STRATEGY = "tiered";
}
