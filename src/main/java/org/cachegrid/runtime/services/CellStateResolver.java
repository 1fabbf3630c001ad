package org.cachegrid.runtime.services;

import org.cachegrid.runtime.model.CellContent;
import org.cachegrid.runtime.model.CellId;
import org.cachegrid.runtime.model.MutationOverlay;
import org.cachegrid.runtime.model.OverlayValue;
import org.cachegrid.runtime.worldgen.CacheGenerator;

import java.util.Objects;
import java.util.Optional;

/**
 * Decides what a cell currently holds.
 * <p>
 * An overlay entry, when present, is authoritative and the generator is not consulted. Otherwise
 * the generator's baseline decides. Every other component goes through this class instead of
 * re-deriving presence or value itself.
 */
public class CellStateResolver {

    private final CacheGenerator generator;
    private final MutationOverlay overlay;

    /**
     * @param generator The baseline generator.
     * @param overlay The overlay of player changes.
     */
    public CellStateResolver(CacheGenerator generator, MutationOverlay overlay) {
        this.generator = Objects.requireNonNull(generator, "generator");
        this.overlay = Objects.requireNonNull(overlay, "overlay");
    }

    /**
     * @param cell The cell.
     * @return The authoritative content of the cell.
     */
    public CellContent resolve(CellId cell) {
        Optional<OverlayValue> entry = overlay.get(cell);
        if (entry.isPresent()) {
            return entry.get().toContent();
        }
        return generator.generate(cell).toContent();
    }
}
