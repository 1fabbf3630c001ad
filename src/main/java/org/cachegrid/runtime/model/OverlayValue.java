package org.cachegrid.runtime.model;

/**
 * A player-caused deviation from a cell's baseline content.
 * <p>
 * Either a token of a given value, or the explicit marker that a cache was removed and must not
 * be regenerated.
 */
public final class OverlayValue {

    private static final OverlayValue EXPLICITLY_EMPTY = new OverlayValue(0);

    private final int value;

    private OverlayValue(int value) {
        this.value = value;
    }

    public static OverlayValue explicitlyEmpty() {
        return EXPLICITLY_EMPTY;
    }

    /**
     * @param value Positive token value.
     * @return An overlay token.
     * @throws IllegalArgumentException if the value is not positive.
     */
    public static OverlayValue token(int value) {
        if (value <= 0) {
            throw new IllegalArgumentException("Overlay token value must be positive: " + value);
        }
        return new OverlayValue(value);
    }

    public boolean isExplicitlyEmpty() {
        return value == 0;
    }

    /**
     * @return The token value, {@code 0} for an explicitly empty cell.
     */
    public int value() {
        return value;
    }

    /**
     * @return The resolved content this entry stands for.
     */
    public CellContent toContent() {
        return isExplicitlyEmpty() ? CellContent.NO_CACHE : CellContent.cache(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OverlayValue)) return false;
        return value == ((OverlayValue) o).value;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value);
    }

    @Override
    public String toString() {
        return isExplicitlyEmpty() ? "ExplicitlyEmpty" : "Token(" + value + ")";
    }
}
