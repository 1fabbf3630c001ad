package org.cachegrid.runtime.spi;

import org.cachegrid.runtime.model.CellId;
import org.cachegrid.runtime.viewport.MaterializedCell;

/**
 * Receives the lifecycle events of materialized cells, typically to create, update and remove
 * the visible representation of each cell in a front end.
 * <p>
 * Callbacks run synchronously on the thread that changed the viewport or the cell.
 */
public interface IMaterializationListener {

    /**
     * A no-op listener.
     */
    IMaterializationListener NONE = new IMaterializationListener() {
        @Override
        public void onMaterialize(MaterializedCell cell) {
        }

        @Override
        public void onEvict(CellId cell) {
        }
    };

    /**
     * Called when a cell enters the viewport.
     *
     * @param cell The new record.
     */
    void onMaterialize(MaterializedCell cell);

    /**
     * Called when a visible cell's content changed.
     *
     * @param cell The refreshed record.
     */
    default void onRefresh(MaterializedCell cell) {
    }

    /**
     * Called when a cell leaves the viewport.
     *
     * @param cell The evicted cell.
     */
    void onEvict(CellId cell);
}
