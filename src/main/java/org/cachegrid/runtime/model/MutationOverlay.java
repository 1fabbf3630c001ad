package org.cachegrid.runtime.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Sparse store of player-caused deviations from baseline content.
 * <p>
 * A key is present only for cells the player has changed. Entries are never removed: a cache
 * that was picked up is recorded as {@link OverlayValue#explicitlyEmpty()}. The store has no
 * capacity bound and lives as long as the game session that owns it.
 * <p>
 * <strong>Thread Safety:</strong> not thread-safe; the owning session serialises access.
 */
public class MutationOverlay {

    private final Map<CellId, OverlayValue> entries = new HashMap<>();

    /**
     * @param cell The cell to look up.
     * @return The overlay entry, or empty if the cell still follows its baseline.
     */
    public Optional<OverlayValue> get(CellId cell) {
        Objects.requireNonNull(cell, "cell");
        return Optional.ofNullable(entries.get(cell));
    }

    /**
     * Records that the cell now holds a token of the given value.
     *
     * @param cell The cell.
     * @param value Positive token value.
     */
    public void setToken(CellId cell, int value) {
        Objects.requireNonNull(cell, "cell");
        entries.put(cell, OverlayValue.token(value));
    }

    /**
     * Records that the cell's cache was removed.
     *
     * @param cell The cell.
     */
    public void setEmpty(CellId cell) {
        Objects.requireNonNull(cell, "cell");
        entries.put(cell, OverlayValue.explicitlyEmpty());
    }

    public boolean contains(CellId cell) {
        return entries.containsKey(cell);
    }

    public int size() {
        return entries.size();
    }

    /**
     * @return Read-only view of every touched cell.
     */
    public Map<CellId, OverlayValue> entries() {
        return Collections.unmodifiableMap(entries);
    }
}
