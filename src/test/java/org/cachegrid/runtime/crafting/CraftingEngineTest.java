package org.cachegrid.runtime.crafting;

import org.cachegrid.junit.extensions.logging.LogWatchExtension;
import org.cachegrid.runtime.internal.services.SeededRandomProvider;
import org.cachegrid.runtime.model.CellContent;
import org.cachegrid.runtime.model.CellId;
import org.cachegrid.runtime.model.Inventory;
import org.cachegrid.runtime.model.MutationOverlay;
import org.cachegrid.runtime.services.CellStateResolver;
import org.cachegrid.runtime.worldgen.CacheGenerator;
import org.cachegrid.runtime.worldgen.TieredValueStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class CraftingEngineTest {

    private static final CellId PLAYER = new CellId(0, 0);
    private static final int RADIUS = 3;

    private MutationOverlay overlay;
    private CellStateResolver resolver;

    @BeforeEach
    void setUp() {
        // An empty baseline; every cache in these tests is placed explicitly
        overlay = new MutationOverlay();
        CacheGenerator empty = new CacheGenerator(new SeededRandomProvider(0L), 0.0, new TieredValueStrategy());
        resolver = new CellStateResolver(empty, overlay);
    }

    private CraftingEngine engine(int capacity, int winThreshold) {
        return new CraftingEngine(resolver, overlay, new Inventory(capacity), RADIUS, winThreshold);
    }

    @Nested
    class Pickup {

        @Test
        @DisplayName("Distance exactly R is allowed, R + 1 is too far")
        void proximityBoundaryIsInclusive() {
            CraftingEngine engine = engine(1, 32);
            CellId atRadius = new CellId(RADIUS, -RADIUS);
            CellId beyond = new CellId(RADIUS + 1, 0);
            overlay.setToken(atRadius, 2);
            overlay.setToken(beyond, 2);

            InteractionResult far = engine.pickup(beyond, PLAYER);
            assertThat(far.rejection()).isEqualTo(RejectionReason.TOO_FAR);
            assertThat(far.distance()).isEqualTo(RADIUS + 1);
            assertThat(far.requiredDistance()).isEqualTo(RADIUS);
            assertThat(far.message()).isEqualTo("Too far (4 cells). Move within 3 cells to pick up.");
            assertThat(resolver.resolve(beyond)).isEqualTo(CellContent.cache(2));

            InteractionResult near = engine.pickup(atRadius, PLAYER);
            assertThat(near.isAccepted()).isTrue();
            assertThat(near.value()).isEqualTo(2);
        }

        @Test
        void movesTokenIntoInventoryAndEmptiesCell() {
            CraftingEngine engine = engine(1, 32);
            CellId cell = new CellId(1, 1);
            overlay.setToken(cell, 4);

            InteractionResult result = engine.pickup(cell, PLAYER);

            assertThat(result.isAccepted()).isTrue();
            assertThat(engine.getInventory().single()).hasValue(4);
            assertThat(resolver.resolve(cell).hasCache()).isFalse();
            assertThat(result.message()).isEqualTo("Picked up a token of value 4.");
        }

        @Test
        void alreadyCarryingLeavesInventoryAndCellUntouched() {
            CraftingEngine engine = engine(1, 32);
            CellId first = new CellId(0, 1);
            CellId second = new CellId(0, 2);
            overlay.setToken(first, 1);
            overlay.setToken(second, 8);
            engine.pickup(first, PLAYER);

            InteractionResult result = engine.pickup(second, PLAYER);

            assertThat(result.rejection()).isEqualTo(RejectionReason.ALREADY_CARRYING);
            assertThat(engine.getInventory().tokens().toIntArray()).containsExactly(1);
            assertThat(resolver.resolve(second)).isEqualTo(CellContent.cache(8));
        }

        @Test
        void emptyCellIsRejected() {
            CraftingEngine engine = engine(1, 32);
            CellId cell = new CellId(1, 0);

            InteractionResult result = engine.pickup(cell, PLAYER);

            assertThat(result.rejection()).isEqualTo(RejectionReason.NO_CACHE_HERE);
            assertThat(engine.getInventory().isEmpty()).isTrue();
            assertThat(overlay.contains(cell)).isFalse();
        }

        @Test
        void authorisationUsesPlayerCellAtRequestTime() {
            CraftingEngine engine = engine(1, 32);
            CellId cell = new CellId(10, 10);
            overlay.setToken(cell, 1);

            assertThat(engine.isInteractable(cell, PLAYER)).isFalse();
            assertThat(engine.pickup(cell, PLAYER).rejection()).isEqualTo(RejectionReason.TOO_FAR);
            assertThat(engine.pickup(cell, new CellId(8, 12)).isAccepted()).isTrue();
        }

        @Test
        @DisplayName("A cache at Integer.MIN_VALUE is far away, not within reach through wrap-around")
        void distanceDoesNotWrapAtIntegerMinValue() {
            CraftingEngine engine = engine(1, 32);
            CellId far = new CellId(Integer.MIN_VALUE, 0);
            overlay.setToken(far, 2);

            InteractionResult result = engine.pickup(far, PLAYER);

            assertThat(result.rejection()).isEqualTo(RejectionReason.TOO_FAR);
            assertThat(result.distance()).isEqualTo(Integer.MAX_VALUE);
            assertThat(engine.isInteractable(far, PLAYER)).isFalse();
            assertThat(engine.getInventory().isEmpty()).isTrue();
            assertThat(resolver.resolve(far)).isEqualTo(CellContent.cache(2));
        }
    }

    @Nested
    class Place {

        @Test
        @DisplayName("Compounding merges set the win flag exactly once")
        void mergeDoublingAndWin() {
            CraftingEngine engine = engine(1, 5);
            CellId a = new CellId(0, 1);
            CellId b = new CellId(0, 2);
            CellId c = new CellId(1, 0);
            CellId d = new CellId(1, 1);
            CellId e = new CellId(2, 2);
            overlay.setToken(a, 1);
            overlay.setToken(b, 1);
            overlay.setToken(c, 2);
            overlay.setToken(d, 4);
            overlay.setToken(e, 16);

            // 1 + 1 -> 2
            engine.pickup(a, PLAYER);
            InteractionResult first = engine.place(b, PLAYER);
            assertThat(first.isAccepted()).isTrue();
            assertThat(first.value()).isEqualTo(2);
            assertThat(resolver.resolve(b)).isEqualTo(CellContent.cache(2));
            assertThat(engine.getInventory().isEmpty()).isTrue();
            assertThat(engine.isWon()).isFalse();

            // 2 + 2 -> 4
            engine.pickup(b, PLAYER);
            InteractionResult second = engine.place(c, PLAYER);
            assertThat(second.value()).isEqualTo(4);
            assertThat(second.won()).isFalse();
            assertThat(engine.isWon()).isFalse();

            // 4 + 4 -> 8 crosses the threshold
            engine.pickup(c, PLAYER);
            InteractionResult third = engine.place(d, PLAYER);
            assertThat(third.value()).isEqualTo(8);
            assertThat(third.won()).isTrue();
            assertThat(third.message()).endsWith("You win!");
            assertThat(engine.isWon()).isTrue();

            // Further crossings keep the flag but do not report a new win
            engine.pickup(d, PLAYER);
            assertThat(engine.isWon()).isTrue();
            overlay.setToken(e, 8);
            InteractionResult fourth = engine.place(e, PLAYER);
            assertThat(fourth.value()).isEqualTo(16);
            assertThat(fourth.won()).isFalse();
            assertThat(engine.isWon()).isTrue();
        }

        @Test
        void mismatchLeavesStateUnchanged() {
            CraftingEngine engine = engine(1, 32);
            CellId source = new CellId(0, 1);
            CellId target = new CellId(0, -1);
            overlay.setToken(source, 2);
            overlay.setToken(target, 3);
            engine.pickup(source, PLAYER);

            InteractionResult result = engine.place(target, PLAYER);

            assertThat(result.isRejected()).isTrue();
            assertThat(result.rejection()).isEqualTo(RejectionReason.VALUE_MISMATCH);
            assertThat(result.message()).isEqualTo("This cache holds 3. Only an equal token can be placed here.");
            assertThat(engine.getInventory().single()).hasValue(2);
            assertThat(resolver.resolve(target)).isEqualTo(CellContent.cache(3));
        }

        @Test
        void neverCreatesCacheInEmptyCell() {
            CraftingEngine engine = engine(1, 32);
            CellId source = new CellId(0, 1);
            overlay.setToken(source, 2);
            engine.pickup(source, PLAYER);

            InteractionResult ontoPickedUp = engine.place(source, PLAYER);
            InteractionResult ontoUntouched = engine.place(new CellId(2, 2), PLAYER);

            assertThat(ontoPickedUp.rejection()).isEqualTo(RejectionReason.NO_CACHE_HERE);
            assertThat(ontoUntouched.rejection()).isEqualTo(RejectionReason.NO_CACHE_HERE);
            assertThat(overlay.contains(new CellId(2, 2))).isFalse();
            assertThat(engine.getInventory().single()).hasValue(2);
        }

        @Test
        void nothingCarriedAndTooFar() {
            CraftingEngine engine = engine(1, 32);
            CellId near = new CellId(1, 1);
            CellId far = new CellId(-4, 0);
            overlay.setToken(near, 2);
            overlay.setToken(far, 2);

            assertThat(engine.place(near, PLAYER).rejection()).isEqualTo(RejectionReason.NOTHING_CARRIED);
            engine.pickup(near, PLAYER);
            InteractionResult tooFar = engine.place(far, PLAYER);
            assertThat(tooFar.rejection()).isEqualTo(RejectionReason.TOO_FAR);
            assertThat(tooFar.message()).endsWith("to place.");
            assertThat(resolver.resolve(far)).isEqualTo(CellContent.cache(2));
        }

        @Test
        void mergeBeyondIntRangeIsRefusedWithoutEffect() {
            CraftingEngine engine = engine(1, 32);
            int huge = 1 << 30;
            CellId source = new CellId(0, 1);
            CellId target = new CellId(0, 2);
            overlay.setToken(source, huge);
            overlay.setToken(target, huge);
            engine.pickup(source, PLAYER);

            InteractionResult result = engine.place(target, PLAYER);

            assertThat(result.rejection()).isEqualTo(RejectionReason.VALUE_TOO_LARGE);
            assertThat(result.message()).isEqualTo("A token of value 1073741824 cannot be doubled any further.");
            assertThat(engine.getInventory().single()).hasValue(huge);
            assertThat(resolver.resolve(target)).isEqualTo(CellContent.cache(huge));
            assertThat(engine.isWon()).isFalse();
        }

        @Test
        void largestDoublableValueStillMerges() {
            CraftingEngine engine = engine(1, 32);
            CellId source = new CellId(0, 1);
            CellId target = new CellId(0, 2);
            overlay.setToken(source, CraftingEngine.MAX_DOUBLABLE_VALUE);
            overlay.setToken(target, CraftingEngine.MAX_DOUBLABLE_VALUE);
            engine.pickup(source, PLAYER);

            InteractionResult result = engine.place(target, PLAYER);

            assertThat(result.isAccepted()).isTrue();
            assertThat(result.value()).isEqualTo(Integer.MAX_VALUE - 1);
        }

        @Test
        void interactableFoldsInInventory() {
            CraftingEngine engine = engine(1, 32);
            CellId two = new CellId(0, 1);
            CellId otherTwo = new CellId(0, 2);
            CellId three = new CellId(0, 3);
            overlay.setToken(two, 2);
            overlay.setToken(otherTwo, 2);
            overlay.setToken(three, 3);

            assertThat(engine.isInteractable(three, PLAYER)).isTrue();
            engine.pickup(two, PLAYER);

            assertThat(engine.isInteractable(otherTwo, PLAYER)).isTrue();
            assertThat(engine.isInteractable(three, PLAYER)).isFalse();
            assertThat(engine.isInteractable(two, PLAYER)).isFalse();
        }
    }

    @Nested
    class Craft {

        @Test
        void combinesTwoEqualTokens() {
            CraftingEngine engine = engine(3, 32);
            overlay.setToken(new CellId(0, 1), 4);
            overlay.setToken(new CellId(0, 2), 4);
            overlay.setToken(new CellId(0, 3), 1);
            engine.pickup(new CellId(0, 1), PLAYER);
            engine.pickup(new CellId(0, 2), PLAYER);
            engine.pickup(new CellId(0, 3), PLAYER);
            assertThat(engine.craftableValues().toIntArray()).containsExactly(4);

            InteractionResult result = engine.craft(4);

            assertThat(result.isAccepted()).isTrue();
            assertThat(result.value()).isEqualTo(8);
            assertThat(engine.getInventory().tokens().toIntArray()).containsExactlyInAnyOrder(1, 8);
            assertThat(engine.craftableValues().toIntArray()).isEmpty();
        }

        @Test
        void craftedValueCanWin() {
            CraftingEngine engine = engine(2, 8);
            overlay.setToken(new CellId(0, 1), 4);
            overlay.setToken(new CellId(0, 2), 4);
            engine.pickup(new CellId(0, 1), PLAYER);
            engine.pickup(new CellId(0, 2), PLAYER);

            InteractionResult result = engine.craft(4);

            assertThat(result.won()).isTrue();
            assertThat(engine.isWon()).isTrue();
        }

        @Test
        void rejectsWithoutPair() {
            CraftingEngine engine = engine(2, 32);
            assertThat(engine.craft(2).rejection()).isEqualTo(RejectionReason.NOTHING_CARRIED);

            overlay.setToken(new CellId(0, 1), 2);
            engine.pickup(new CellId(0, 1), PLAYER);
            InteractionResult result = engine.craft(2);

            assertThat(result.rejection()).isEqualTo(RejectionReason.NOT_ENOUGH_TO_CRAFT);
            assertThat(result.message()).isEqualTo("Not enough matching tokens to craft.");
            assertThat(engine.getInventory().tokens().toIntArray()).containsExactly(2);
        }

        @Test
        void craftBeyondIntRangeIsRefusedWithoutEffect() {
            CraftingEngine engine = engine(2, 32);
            int huge = 1 << 30;
            overlay.setToken(new CellId(0, 1), huge);
            overlay.setToken(new CellId(0, 2), huge);
            engine.pickup(new CellId(0, 1), PLAYER);
            engine.pickup(new CellId(0, 2), PLAYER);

            InteractionResult result = engine.craft(huge);

            assertThat(result.rejection()).isEqualTo(RejectionReason.VALUE_TOO_LARGE);
            assertThat(engine.getInventory().tokens().toIntArray()).containsExactly(huge, huge);
            assertThat(engine.isWon()).isFalse();
        }

        @Test
        void snapshotTotalDoesNotWrap() {
            CraftingEngine engine = engine(2, 32);
            overlay.setToken(new CellId(0, 1), Integer.MAX_VALUE);
            overlay.setToken(new CellId(0, 2), Integer.MAX_VALUE);
            engine.pickup(new CellId(0, 1), PLAYER);
            engine.pickup(new CellId(0, 2), PLAYER);

            InventorySnapshot snapshot = new InventorySnapshot(engine.getInventory().tokens(), 2, engine.craftableValues());

            assertThat(snapshot.total()).isEqualTo(2L * Integer.MAX_VALUE);
        }
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new CraftingEngine(resolver, overlay, new Inventory(1), -1, 32))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CraftingEngine(resolver, overlay, new Inventory(1), 3, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
