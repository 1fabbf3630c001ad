package org.cachegrid.runtime.crafting;

/**
 * Why a request was refused. A refused request never changes any state.
 */
public enum RejectionReason {
    /** The target cell is beyond the proximity radius of the player's current cell. */
    TOO_FAR,
    /** Every carry slot is occupied. */
    ALREADY_CARRYING,
    /** No token is carried. */
    NOTHING_CARRIED,
    /** The resident cache differs from every carried token. */
    VALUE_MISMATCH,
    /** The target cell holds no cache. */
    NO_CACHE_HERE,
    /** Fewer than two carried tokens share the requested value. */
    NOT_ENOUGH_TO_CRAFT,
    /** Doubling the value would exceed the largest representable token. */
    VALUE_TOO_LARGE
}
