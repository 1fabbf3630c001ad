package org.cachegrid.runtime.crafting;

/**
 * The user-initiated requests the crafting engine understands.
 */
public enum InteractionType {
    PICKUP,
    PLACE,
    CRAFT
}
