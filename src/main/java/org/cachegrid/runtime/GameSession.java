package org.cachegrid.runtime;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.cachegrid.runtime.crafting.CraftingEngine;
import org.cachegrid.runtime.crafting.InteractionResult;
import org.cachegrid.runtime.crafting.InventorySnapshot;
import org.cachegrid.runtime.internal.services.SeededRandomProvider;
import org.cachegrid.runtime.model.CellBounds;
import org.cachegrid.runtime.model.CellContent;
import org.cachegrid.runtime.model.CellId;
import org.cachegrid.runtime.model.GeoPoint;
import org.cachegrid.runtime.model.GridProperties;
import org.cachegrid.runtime.model.Inventory;
import org.cachegrid.runtime.model.MutationOverlay;
import org.cachegrid.runtime.model.ViewportBounds;
import org.cachegrid.runtime.services.CellStateResolver;
import org.cachegrid.runtime.spi.IMaterializationListener;
import org.cachegrid.runtime.viewport.CellView;
import org.cachegrid.runtime.viewport.MaterializedCell;
import org.cachegrid.runtime.viewport.ViewportDelta;
import org.cachegrid.runtime.viewport.ViewportMaterializer;
import org.cachegrid.runtime.worldgen.CacheGenerator;
import org.cachegrid.runtime.worldgen.CacheStrategyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One game: the explicit context owning the overlay, the inventory, the materialized viewport and
 * the player position.
 * <p>
 * The session is driven by three kinds of events: player moves, viewport changes and interaction
 * requests. Each public method processes one event to completion. Methods are synchronized on the
 * session, so a front end that calls from several threads still sees every event applied as a
 * whole and never interleaves an eviction with a pickup or place on the same cell.
 */
public class GameSession {

    private static final Logger LOG = LoggerFactory.getLogger(GameSession.class);

    private final GameOptions options;
    private final GridProperties grid;
    private final MutationOverlay overlay;
    private final CellStateResolver resolver;
    private final ViewportMaterializer materializer;
    private final CraftingEngine engine;
    private GeoPoint playerPosition;
    private CellId playerCell;

    /**
     * Creates a session without a lifecycle listener.
     *
     * @param options The game settings.
     */
    public GameSession(GameOptions options) {
        this(options, IMaterializationListener.NONE);
    }

    /**
     * Creates a session whose generator is built from the options.
     *
     * @param options The game settings.
     * @param listener Receiver of materialize/refresh/evict events.
     */
    public GameSession(GameOptions options, IMaterializationListener listener) {
        this(options, createGenerator(options), listener);
    }

    /**
     * Creates a session with an explicit generator.
     *
     * @param options The game settings.
     * @param generator The baseline generator.
     * @param listener Receiver of materialize/refresh/evict events.
     */
    public GameSession(GameOptions options, CacheGenerator generator, IMaterializationListener listener) {
        this.options = Objects.requireNonNull(options, "options");
        this.grid = new GridProperties(options.getOrigin(), options.getTileDegrees());
        this.overlay = new MutationOverlay();
        this.resolver = new CellStateResolver(generator, overlay);
        this.materializer = new ViewportMaterializer(resolver, listener);
        this.engine = new CraftingEngine(resolver, overlay, new Inventory(options.getCarryCapacity()),
            options.getProximityRadius(), options.getWinThreshold());
        this.playerPosition = options.getOrigin();
        this.playerCell = grid.toCell(playerPosition);
        LOG.debug("Game session created: {}", options);
    }

    /**
     * Builds the generator described by the options.
     *
     * @param options The game settings.
     * @return The generator.
     */
    public static CacheGenerator createGenerator(GameOptions options) {
        return new CacheGenerator(
            new SeededRandomProvider(options.getSeed()),
            options.getSpawnProbability(),
            CacheStrategyFactory.create(options.getValueStrategy(), options.getValueStrategyOptions()));
    }

    /**
     * Records a new player position. When the session follows the player, the visible region is
     * recentred on the player's neighbourhood.
     *
     * @param position The new continuous position.
     * @return The player's cell after the move.
     */
    public synchronized CellId reportPlayerMoved(GeoPoint position) {
        Objects.requireNonNull(position, "position");
        CellId cell = grid.toCell(position);
        CellBounds region = options.isFollowPlayer() ? grid.neighborhood(cell, options.getNeighborhoodSize()) : null;

        // Nothing is committed until the cell and region have been computed
        CellId previous = playerCell;
        this.playerPosition = position;
        this.playerCell = cell;
        if (!cell.equals(previous)) {
            LOG.debug("Player moved from cell {} to {}", previous, cell);
        }
        if (region != null) {
            materializer.setVisibleRegion(region);
        }
        return cell;
    }

    /**
     * Moves the player to the centre of a cell.
     *
     * @param cell The target cell.
     * @return The player's cell after the move.
     */
    public synchronized CellId movePlayerTo(CellId cell) {
        return reportPlayerMoved(grid.cellCenter(cell));
    }

    /**
     * Moves the player by whole cells.
     *
     * @param di Rows to move north (negative moves south).
     * @param dj Columns to move east (negative moves west).
     * @return The player's cell after the move.
     */
    public synchronized CellId movePlayerBy(int di, int dj) {
        return reportPlayerMoved(playerPosition.plus(di * grid.getTileDegrees(), dj * grid.getTileDegrees()));
    }

    /**
     * Materializes the cells covered by the reported continuous viewport.
     *
     * @param south Southern edge.
     * @param north Northern edge.
     * @param west Western edge.
     * @param east Eastern edge.
     * @return The cells that entered and left.
     */
    public synchronized ViewportDelta reportViewportBounds(double south, double north, double west, double east) {
        return showRegion(grid.toCellBounds(new ViewportBounds(south, north, west, east)));
    }

    /**
     * Materializes exactly the given region.
     *
     * @param region The visible region in cell space.
     * @return The cells that entered and left.
     */
    public synchronized ViewportDelta showRegion(CellBounds region) {
        return materializer.setVisibleRegion(region);
    }

    public synchronized InteractionResult requestPickup(CellId cell) {
        InteractionResult result = engine.pickup(Objects.requireNonNull(cell, "cell"), playerCell);
        if (result.isAccepted()) {
            materializer.refresh(cell);
        }
        return result;
    }

    public synchronized InteractionResult requestPlace(CellId cell) {
        InteractionResult result = engine.place(Objects.requireNonNull(cell, "cell"), playerCell);
        if (result.isAccepted()) {
            materializer.refresh(cell);
        }
        return result;
    }

    /**
     * Crafts two carried tokens of the given value into one of twice the value.
     *
     * @param value The value to combine.
     * @return The outcome.
     */
    public synchronized InteractionResult requestCraft(int value) {
        return engine.craft(value);
    }

    /**
     * @return Views of every materialized cell in row-major order, with interactability derived
     *         from the current player cell and inventory.
     */
    public synchronized List<CellView> visibleCells() {
        List<CellView> views = new ArrayList<>(materializer.size());
        for (MaterializedCell record : materializer.materializedCells()) {
            views.add(toView(record.cellId()));
        }
        views.sort(Comparator.comparing(CellView::cellId));
        return views;
    }

    /**
     * @param cell The cell.
     * @return The view of the cell, or empty if it is not materialized.
     */
    public synchronized Optional<CellView> cellView(CellId cell) {
        if (!materializer.isMaterialized(cell)) {
            return Optional.empty();
        }
        return Optional.of(toView(cell));
    }

    /**
     * @param cell Any cell, visible or not.
     * @return The authoritative content of the cell.
     */
    public synchronized CellContent contentOf(CellId cell) {
        return resolver.resolve(cell);
    }

    public synchronized InventorySnapshot inventorySnapshot() {
        Inventory inventory = engine.getInventory();
        return new InventorySnapshot(
            IntLists.unmodifiable(new IntArrayList(inventory.tokens())),
            inventory.capacity(),
            engine.craftableValues());
    }

    public synchronized boolean isWon() {
        return engine.isWon();
    }

    public synchronized CellId playerCell() {
        return playerCell;
    }

    public synchronized GeoPoint playerPosition() {
        return playerPosition;
    }

    public synchronized int overlaySize() {
        return overlay.size();
    }

    public synchronized Optional<CellBounds> visibleRegion() {
        return materializer.currentRegion();
    }

    public GridProperties grid() {
        return grid;
    }

    public GameOptions options() {
        return options;
    }

    private CellView toView(CellId cell) {
        CellContent content = resolver.resolve(cell);
        return new CellView(cell, content.hasCache(), content.valueIfPresent(), engine.isInteractable(cell, playerCell));
    }
}
