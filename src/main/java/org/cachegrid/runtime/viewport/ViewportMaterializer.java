package org.cachegrid.runtime.viewport;

import org.cachegrid.runtime.model.CellBounds;
import org.cachegrid.runtime.model.CellContent;
import org.cachegrid.runtime.model.CellId;
import org.cachegrid.runtime.services.CellStateResolver;
import org.cachegrid.runtime.spi.IMaterializationListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps the set of materialized cells equal to the cells inside the current visible region.
 * <p>
 * A region change only visits the cells in the difference of the old and new rectangles, so
 * panning by one row costs one row of work however large the viewport is. Eviction only drops
 * the transient record; the overlay is read through the resolver and never written here.
 * <p>
 * <strong>Thread Safety:</strong> not thread-safe; the owning session serialises access.
 */
public class ViewportMaterializer {

    private static final Logger LOG = LoggerFactory.getLogger(ViewportMaterializer.class);

    private final CellStateResolver resolver;
    private final IMaterializationListener listener;
    private final Map<CellId, MaterializedCell> materialized = new HashMap<>();
    private CellBounds currentRegion;

    /**
     * @param resolver Source of cell content.
     * @param listener Receiver of lifecycle events, {@link IMaterializationListener#NONE} if nobody listens.
     */
    public ViewportMaterializer(CellStateResolver resolver, IMaterializationListener listener) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Moves the visible region and materializes/evicts the difference.
     *
     * @param region The new visible region (inclusive bounds).
     * @return The cells that entered and left.
     */
    public ViewportDelta setVisibleRegion(CellBounds region) {
        Objects.requireNonNull(region, "region");
        if (region.equals(currentRegion)) {
            return ViewportDelta.EMPTY;
        }

        List<CellId> left = new ArrayList<>();
        if (currentRegion != null) {
            for (CellBounds strip : currentRegion.minus(region)) {
                left.addAll(strip.cells());
            }
        }
        List<CellId> entered = new ArrayList<>();
        for (CellBounds strip : region.minus(currentRegion)) {
            entered.addAll(strip.cells());
        }

        for (CellId cell : left) {
            evict(cell);
        }
        for (CellId cell : entered) {
            materialize(cell);
        }
        currentRegion = region;

        LOG.debug("Visible region now {}: {} entered, {} left, {} materialized",
            region, entered.size(), left.size(), materialized.size());
        return new ViewportDelta(entered, left);
    }

    /**
     * Re-resolves a visible cell after its content changed. Cells outside the viewport are ignored;
     * they will be resolved afresh when they enter it.
     *
     * @param cell The changed cell.
     * @return The refreshed record, or empty if the cell is not materialized.
     */
    public Optional<MaterializedCell> refresh(CellId cell) {
        if (!materialized.containsKey(cell)) {
            return Optional.empty();
        }
        MaterializedCell record = new MaterializedCell(cell, resolver.resolve(cell));
        materialized.put(cell, record);
        listener.onRefresh(record);
        return Optional.of(record);
    }

    /**
     * Evicts every record and forgets the current region.
     */
    public void clear() {
        for (CellId cell : new ArrayList<>(materialized.keySet())) {
            evict(cell);
        }
        currentRegion = null;
    }

    public Optional<MaterializedCell> materialized(CellId cell) {
        return Optional.ofNullable(materialized.get(cell));
    }

    public boolean isMaterialized(CellId cell) {
        return materialized.containsKey(cell);
    }

    /**
     * @return Read-only view of the current records.
     */
    public Collection<MaterializedCell> materializedCells() {
        return Collections.unmodifiableCollection(materialized.values());
    }

    public Optional<CellBounds> currentRegion() {
        return Optional.ofNullable(currentRegion);
    }

    public int size() {
        return materialized.size();
    }

    private void evict(CellId cell) {
        if (materialized.remove(cell) != null) {
            listener.onEvict(cell);
        }
    }

    private void materialize(CellId cell) {
        CellContent content = resolver.resolve(cell);
        MaterializedCell record = new MaterializedCell(cell, content);
        if (materialized.putIfAbsent(cell, record) != null) {
            throw new IllegalStateException("Cell " + cell + " is already materialized");
        }
        listener.onMaterialize(record);
    }
}
