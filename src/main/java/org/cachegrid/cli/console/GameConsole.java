package org.cachegrid.cli.console;

import it.unimi.dsi.fastutil.ints.IntList;
import org.cachegrid.runtime.GameSession;
import org.cachegrid.runtime.crafting.InteractionResult;
import org.cachegrid.runtime.crafting.InventorySnapshot;
import org.cachegrid.runtime.model.CellId;
import org.cachegrid.runtime.model.GeoPoint;
import org.cachegrid.runtime.viewport.CellView;
import org.cachegrid.runtime.viewport.ViewportDelta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Text front end for a {@link GameSession}.
 * <p>
 * Translates one input line into one session event and formats the response. The console has no
 * terminal of its own; the {@code play} command feeds it lines from JLine, tests feed it strings.
 */
public class GameConsole {

    private static final Logger LOG = LoggerFactory.getLogger(GameConsole.class);

    static final String HELP = String.join(System.lineSeparator(),
        "Available commands:",
        "  n | s | e | w [steps]           - Move the player by whole cells.",
        "  goto <lat> <lng>                - Move the player to a map position.",
        "  view <south> <north> <west> <east> - Report the visible map bounds.",
        "  pickup <i> <j>                  - Pick up the cache in cell (i, j).",
        "  place <i> <j>                   - Merge a carried token into the equal cache in cell (i, j).",
        "  craft <value>                   - Combine two carried tokens of that value.",
        "  cells                           - List visible caches.",
        "  inventory                       - Show carried tokens.",
        "  status                          - Show player cell, inventory and win state.",
        "  help                            - Show this help message.",
        "  exit                            - Leave the game.");

    private final GameSession session;
    private boolean exitRequested;

    public GameConsole(GameSession session) {
        this.session = Objects.requireNonNull(session, "session");
    }

    /**
     * Executes one command line.
     *
     * @param line The raw input.
     * @return The text to show; empty for blank input.
     */
    public String execute(String line) {
        if (line == null || line.isBlank()) {
            return "";
        }
        String[] parts = line.trim().split("\\s+");
        String command = parts[0].toLowerCase(Locale.ROOT);
        try {
            switch (command) {
                case "n":
                case "north":
                    return move(parts, 1, 0);
                case "s":
                case "south":
                    return move(parts, -1, 0);
                case "e":
                case "east":
                    return move(parts, 0, 1);
                case "w":
                case "west":
                    return move(parts, 0, -1);
                case "goto":
                    requireArgs(parts, 2);
                    CellId cell = session.reportPlayerMoved(new GeoPoint(parseDouble(parts[1]), parseDouble(parts[2])));
                    return "You are in cell " + cell + ".";
                case "view":
                    requireArgs(parts, 4);
                    ViewportDelta delta = session.reportViewportBounds(
                        parseDouble(parts[1]), parseDouble(parts[2]), parseDouble(parts[3]), parseDouble(parts[4]));
                    return delta.entered().size() + " cells entered, " + delta.left().size() + " cells left the view.";
                case "pickup":
                    requireArgs(parts, 2);
                    return describe(session.requestPickup(parseCell(parts)));
                case "place":
                    requireArgs(parts, 2);
                    return describe(session.requestPlace(parseCell(parts)));
                case "craft":
                    requireArgs(parts, 1);
                    return describe(session.requestCraft(parseInt(parts[1])));
                case "cells":
                    return cells();
                case "inventory":
                case "inv":
                    return inventory();
                case "status":
                    return status();
                case "help":
                    return HELP;
                case "exit":
                case "quit":
                    exitRequested = true;
                    return "Goodbye.";
                default:
                    LOG.warn("Unknown command: {}. Type 'help' for a list of commands.", command);
                    return "Unknown command: " + command + ". Type 'help' for a list of commands.";
            }
        } catch (IllegalArgumentException e) {
            LOG.debug("Rejected console input '{}': {}", line, e.getMessage());
            return "Invalid input: " + e.getMessage();
        }
    }

    public boolean isExitRequested() {
        return exitRequested;
    }

    private String move(String[] parts, int di, int dj) {
        int steps = parts.length > 1 ? parseInt(parts[1]) : 1;
        CellId cell = session.movePlayerBy(di * steps, dj * steps);
        return "You are in cell " + cell + ".";
    }

    private String describe(InteractionResult result) {
        return result.message();
    }

    private String cells() {
        List<CellView> caches = session.visibleCells().stream()
            .filter(CellView::hasCache)
            .collect(Collectors.toList());
        if (caches.isEmpty()) {
            return "No caches in view.";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(caches.size()).append(" caches in view:");
        for (CellView view : caches) {
            sb.append(System.lineSeparator())
                .append("  ").append(view.cellId())
                .append(" value ").append(view.value().getAsInt())
                .append(view.interactable() ? " *" : "");
        }
        return sb.toString();
    }

    private String inventory() {
        InventorySnapshot snapshot = session.inventorySnapshot();
        if (snapshot.isEmpty()) {
            return "Inventory: (empty)";
        }
        IntList craftable = snapshot.craftable();
        String text = "Inventory: " + joinValues(snapshot.tokens()) + " (total: " + snapshot.total() + ")";
        if (snapshot.capacity() > 1) {
            text += System.lineSeparator() + "Craftable: " + (craftable.isEmpty() ? "none" : joinValues(craftable));
        }
        return text;
    }

    private String status() {
        return "Player cell: " + session.playerCell() + System.lineSeparator()
            + inventory() + System.lineSeparator()
            + (session.isWon() ? "You have won!" : "Not won yet.");
    }

    private static String joinValues(IntList values) {
        return values.intStream().mapToObj(Integer::toString).collect(Collectors.joining(", "));
    }

    private static CellId parseCell(String[] parts) {
        return new CellId(parseInt(parts[1]), parseInt(parts[2]));
    }

    private static void requireArgs(String[] parts, int count) {
        if (parts.length - 1 < count) {
            throw new IllegalArgumentException("'" + parts[0] + "' expects " + count + " argument(s)");
        }
    }

    private static int parseInt(String text) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not an integer: " + text, e);
        }
    }

    private static double parseDouble(String text) {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a number: " + text, e);
        }
    }
}
