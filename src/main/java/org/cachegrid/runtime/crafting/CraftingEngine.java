package org.cachegrid.runtime.crafting;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntComparators;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.cachegrid.runtime.model.CellContent;
import org.cachegrid.runtime.model.CellId;
import org.cachegrid.runtime.model.Inventory;
import org.cachegrid.runtime.model.MutationOverlay;
import org.cachegrid.runtime.services.CellStateResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * The carry/merge state machine.
 * <p>
 * Every request is authorised against the player's cell at the moment of the request. All
 * preconditions are checked before any effect is applied, so a rejected request leaves the
 * inventory, the overlay and the win flag untouched.
 * <p>
 * Transitions:
 * <ul>
 *   <li><b>pickup</b>: in range, a free slot, a cache in the cell. The token moves into the
 *       inventory and the cell becomes explicitly empty.</li>
 *   <li><b>place</b>: in range, something carried, a cache in the cell, a carried token equal
 *       to it. The cell's value doubles and the carried token is consumed. Placement never
 *       creates a cache in an empty cell.</li>
 *   <li><b>craft</b>: two equal carried tokens become one token of twice the value.</li>
 * </ul>
 * A merged or crafted value at or above the win threshold sets the win flag once. Values above
 * {@link #MAX_DOUBLABLE_VALUE} are refused for place and craft since their double does not fit in an int.
 */
public class CraftingEngine {

    private static final Logger LOG = LoggerFactory.getLogger(CraftingEngine.class);

    /** Largest token value that can still be merged or crafted. */
    public static final int MAX_DOUBLABLE_VALUE = Integer.MAX_VALUE / 2;

    private final CellStateResolver resolver;
    private final MutationOverlay overlay;
    private final Inventory inventory;
    private final int proximityRadius;
    private final int winThreshold;
    private boolean won;

    /**
     * @param resolver Source of cell content.
     * @param overlay Overlay receiving the cell changes.
     * @param inventory The player's carry slots.
     * @param proximityRadius Maximum Chebyshev distance for interaction, inclusive.
     * @param winThreshold Value a merge or craft must reach to win.
     */
    public CraftingEngine(CellStateResolver resolver, MutationOverlay overlay, Inventory inventory,
                          int proximityRadius, int winThreshold) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.overlay = Objects.requireNonNull(overlay, "overlay");
        this.inventory = Objects.requireNonNull(inventory, "inventory");
        if (proximityRadius < 0) {
            throw new IllegalArgumentException("Proximity radius must be non-negative: " + proximityRadius);
        }
        if (winThreshold <= 0) {
            throw new IllegalArgumentException("Win threshold must be positive: " + winThreshold);
        }
        this.proximityRadius = proximityRadius;
        this.winThreshold = winThreshold;
    }

    /**
     * Picks up the cache in the target cell.
     *
     * @param target The cell to take the cache from.
     * @param playerCell The player's current cell.
     * @return The outcome.
     */
    public InteractionResult pickup(CellId target, CellId playerCell) {
        int distance = playerCell.chebyshevDistance(target);
        if (distance > proximityRadius) {
            return reject(InteractionType.PICKUP, RejectionReason.TOO_FAR, target, 0, distance);
        }
        if (inventory.isFull()) {
            return reject(InteractionType.PICKUP, RejectionReason.ALREADY_CARRYING, target, 0, distance);
        }
        CellContent content = resolver.resolve(target);
        if (!content.hasCache()) {
            return reject(InteractionType.PICKUP, RejectionReason.NO_CACHE_HERE, target, 0, distance);
        }

        int value = content.value();
        inventory.add(value);
        overlay.setEmpty(target);
        LOG.debug("Picked up token {} from cell {} (carrying {})", value, target, inventory.tokens());
        return InteractionResult.accepted(InteractionType.PICKUP, target, value, distance, proximityRadius, false);
    }

    /**
     * Places a carried token onto the equal-valued cache in the target cell.
     *
     * @param target The cell holding the resident cache.
     * @param playerCell The player's current cell.
     * @return The outcome; on success {@link InteractionResult#value()} is the doubled cell value.
     */
    public InteractionResult place(CellId target, CellId playerCell) {
        int distance = playerCell.chebyshevDistance(target);
        if (distance > proximityRadius) {
            return reject(InteractionType.PLACE, RejectionReason.TOO_FAR, target, 0, distance);
        }
        if (inventory.isEmpty()) {
            return reject(InteractionType.PLACE, RejectionReason.NOTHING_CARRIED, target, 0, distance);
        }
        CellContent content = resolver.resolve(target);
        if (!content.hasCache()) {
            return reject(InteractionType.PLACE, RejectionReason.NO_CACHE_HERE, target, 0, distance);
        }
        int resident = content.value();
        if (!inventory.contains(resident)) {
            return reject(InteractionType.PLACE, RejectionReason.VALUE_MISMATCH, target, resident, distance);
        }
        if (resident > MAX_DOUBLABLE_VALUE) {
            return reject(InteractionType.PLACE, RejectionReason.VALUE_TOO_LARGE, target, resident, distance);
        }

        int merged = resident * 2;
        inventory.removeOne(resident);
        overlay.setToken(target, merged);
        boolean newlyWon = recordCraftedValue(merged);
        LOG.debug("Merged token {} into cell {}, cell now holds {}", resident, target, merged);
        return InteractionResult.accepted(InteractionType.PLACE, target, merged, distance, proximityRadius, newlyWon);
    }

    /**
     * Combines two carried tokens of the given value into one token of twice the value.
     *
     * @param value The value of the tokens to combine.
     * @return The outcome; on success {@link InteractionResult#value()} is the crafted value.
     */
    public InteractionResult craft(int value) {
        if (inventory.isEmpty()) {
            return InteractionResult.rejected(InteractionType.CRAFT, RejectionReason.NOTHING_CARRIED, null, value, -1, -1);
        }
        if (value <= 0 || inventory.count(value) < 2) {
            return InteractionResult.rejected(InteractionType.CRAFT, RejectionReason.NOT_ENOUGH_TO_CRAFT, null, value, -1, -1);
        }
        if (value > MAX_DOUBLABLE_VALUE) {
            return InteractionResult.rejected(InteractionType.CRAFT, RejectionReason.VALUE_TOO_LARGE, null, value, -1, -1);
        }

        int crafted = value * 2;
        inventory.removeOne(value);
        inventory.removeOne(value);
        inventory.add(crafted);
        boolean newlyWon = recordCraftedValue(crafted);
        LOG.debug("Crafted two tokens of {} into {}", value, crafted);
        return InteractionResult.accepted(InteractionType.CRAFT, null, crafted, -1, -1, newlyWon);
    }

    /**
     * Whether the front end should offer an action on the cell right now.
     *
     * @param target The cell.
     * @param playerCell The player's current cell.
     * @return {@code true} if the cell holds a cache in range that can be picked up or merged with.
     */
    public boolean isInteractable(CellId target, CellId playerCell) {
        if (playerCell.chebyshevDistance(target) > proximityRadius) {
            return false;
        }
        CellContent content = resolver.resolve(target);
        if (!content.hasCache()) {
            return false;
        }
        return !inventory.isFull() || inventory.contains(content.value());
    }

    /**
     * @return Distinct carried values with at least two copies, largest first.
     */
    public IntList craftableValues() {
        IntArrayList craftable = new IntArrayList();
        for (Int2IntMap.Entry entry : inventory.grouped().int2IntEntrySet()) {
            if (entry.getIntValue() >= 2) {
                craftable.add(entry.getIntKey());
            }
        }
        craftable.sort(IntComparators.OPPOSITE_COMPARATOR);
        return IntLists.unmodifiable(craftable);
    }

    public boolean isWon() {
        return won;
    }

    public int getProximityRadius() {
        return proximityRadius;
    }

    public int getWinThreshold() {
        return winThreshold;
    }

    public Inventory getInventory() {
        return inventory;
    }

    private boolean recordCraftedValue(int value) {
        if (won || value < winThreshold) {
            return false;
        }
        won = true;
        LOG.info("Win threshold {} reached with a token of value {}", winThreshold, value);
        return true;
    }

    private InteractionResult reject(InteractionType type, RejectionReason reason, CellId target, int value, int distance) {
        LOG.debug("Rejected {} at {}: {}", type, target, reason);
        return InteractionResult.rejected(type, reason, target, value, distance, proximityRadius);
    }
}
