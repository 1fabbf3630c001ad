package org.cachegrid.runtime.crafting;

import org.cachegrid.runtime.model.CellId;

import java.util.Objects;

/**
 * Outcome of a pickup, place or craft request.
 * <p>
 * Accepted results carry the value that changed hands: the picked-up token, the merged value left
 * in the cell, or the crafted token. Rejected results carry the reason and, for
 * {@link RejectionReason#TOO_FAR}, the measured and the allowed distance.
 *
 * @param type The request kind.
 * @param rejection The reason for refusal, or {@code null} if the request was accepted.
 * @param cell The target cell, {@code null} for crafting.
 * @param value The resulting token value; {@code 0} when not applicable.
 * @param distance The measured Chebyshev distance; {@code -1} for crafting.
 * @param requiredDistance The configured proximity radius; {@code -1} for crafting.
 * @param won {@code true} if this request set the win flag.
 */
public record InteractionResult(
    InteractionType type,
    RejectionReason rejection,
    CellId cell,
    int value,
    int distance,
    int requiredDistance,
    boolean won
) {

    public InteractionResult {
        Objects.requireNonNull(type, "type");
    }

    static InteractionResult accepted(InteractionType type, CellId cell, int value, int distance, int requiredDistance, boolean won) {
        return new InteractionResult(type, null, cell, value, distance, requiredDistance, won);
    }

    static InteractionResult rejected(InteractionType type, RejectionReason reason, CellId cell, int value, int distance, int requiredDistance) {
        return new InteractionResult(type, Objects.requireNonNull(reason, "reason"), cell, value, distance, requiredDistance, false);
    }

    public boolean isAccepted() {
        return rejection == null;
    }

    public boolean isRejected() {
        return rejection != null;
    }

    /**
     * @return A short message suitable for showing to the player.
     */
    public String message() {
        if (isAccepted()) {
            switch (type) {
                case PICKUP:
                    return "Picked up a token of value " + value + ".";
                case PLACE:
                    return won
                        ? "Merged into a cache of value " + value + ". You win!"
                        : "Merged into a cache of value " + value + ".";
                default:
                    return won
                        ? "Crafted a token of value " + value + ". You win!"
                        : "Crafted a token of value " + value + ".";
            }
        }
        switch (rejection) {
            case TOO_FAR:
                return "Too far (" + distance + " cells). Move within " + requiredDistance + " cells to "
                    + (type == InteractionType.PICKUP ? "pick up." : "place.");
            case ALREADY_CARRYING:
                return "Your hands are full. Place a token before picking up another.";
            case NOTHING_CARRIED:
                return "You are not carrying a token.";
            case VALUE_MISMATCH:
                return "This cache holds " + value + ". Only an equal token can be placed here.";
            case NO_CACHE_HERE:
                return "There is no cache at " + cell + ".";
            case VALUE_TOO_LARGE:
                return "A token of value " + value + " cannot be doubled any further.";
            default:
                return "Not enough matching tokens to craft.";
        }
    }
}
