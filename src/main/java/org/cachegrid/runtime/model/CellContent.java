package org.cachegrid.runtime.model;

import java.util.OptionalInt;

/**
 * Authoritative content of a cell: either no cache, or a cache holding a token value.
 */
public final class CellContent {

    /**
     * The cell holds no cache.
     */
    public static final CellContent NO_CACHE = new CellContent(0);

    private final int value;

    private CellContent(int value) {
        this.value = value;
    }

    /**
     * @param value Positive token value.
     * @return Content describing a cache with that value.
     */
    public static CellContent cache(int value) {
        if (value <= 0) {
            throw new IllegalArgumentException("Cache value must be positive: " + value);
        }
        return new CellContent(value);
    }

    public boolean hasCache() {
        return value > 0;
    }

    /**
     * @return The token value.
     * @throws IllegalStateException if the cell holds no cache.
     */
    public int value() {
        if (!hasCache()) {
            throw new IllegalStateException("Cell holds no cache");
        }
        return value;
    }

    public OptionalInt valueIfPresent() {
        return hasCache() ? OptionalInt.of(value) : OptionalInt.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CellContent)) return false;
        return value == ((CellContent) o).value;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value);
    }

    @Override
    public String toString() {
        return hasCache() ? "Cache(" + value + ")" : "NoCache";
    }
}
