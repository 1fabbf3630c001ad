package org.cachegrid.runtime.model;

/**
 * Output of the deterministic generator for one cell.
 *
 * @param present Whether an unmodified cell spawns a cache.
 * @param value The token value of the cache, or {@code 0} when absent.
 */
public record BaselineContent(boolean present, int value) {

    public static final BaselineContent ABSENT = new BaselineContent(false, 0);

    public static BaselineContent cache(int value) {
        return new BaselineContent(true, value);
    }

    /**
     * @return The equivalent resolved content.
     */
    public CellContent toContent() {
        return present ? CellContent.cache(value) : CellContent.NO_CACHE;
    }
}
