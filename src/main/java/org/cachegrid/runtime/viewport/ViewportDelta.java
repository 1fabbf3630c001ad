package org.cachegrid.runtime.viewport;

import org.cachegrid.runtime.model.CellId;

import java.util.List;

/**
 * The cells that entered and left the viewport in one region change.
 *
 * @param entered Cells newly materialized.
 * @param left Cells evicted.
 */
public record ViewportDelta(List<CellId> entered, List<CellId> left) {

    public static final ViewportDelta EMPTY = new ViewportDelta(List.of(), List.of());

    public ViewportDelta {
        entered = List.copyOf(entered);
        left = List.copyOf(left);
    }

    public boolean isEmpty() {
        return entered.isEmpty() && left.isEmpty();
    }
}
