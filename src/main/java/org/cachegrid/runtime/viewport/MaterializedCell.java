package org.cachegrid.runtime.viewport;

import org.cachegrid.runtime.model.CellContent;
import org.cachegrid.runtime.model.CellId;

/**
 * Transient record of a cell that is currently inside the viewport.
 * <p>
 * Cells holding a cache are materialized as interactive targets; empty cells as non-interactive
 * placeholders. The content is a snapshot taken at materialization or refresh time.
 *
 * @param cellId The cell.
 * @param content The resolved content at materialization or last refresh.
 */
public record MaterializedCell(CellId cellId, CellContent content) {

    /**
     * @return {@code true} if the record is an interactive cache target, {@code false} for a placeholder.
     */
    public boolean isInteractive() {
        return content.hasCache();
    }
}
