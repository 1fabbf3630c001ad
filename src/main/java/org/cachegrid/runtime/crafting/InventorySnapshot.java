package org.cachegrid.runtime.crafting;

import it.unimi.dsi.fastutil.ints.IntList;

import java.util.OptionalInt;

/**
 * Immutable copy of the carry state.
 *
 * @param tokens Carried token values in pickup order.
 * @param capacity Number of carry slots.
 * @param craftable Distinct carried values with at least two copies, largest first.
 */
public record InventorySnapshot(IntList tokens, int capacity, IntList craftable) {

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public boolean isFull() {
        return tokens.size() >= capacity;
    }

    /**
     * @return The carried value when exactly one token is carried.
     */
    public OptionalInt carried() {
        return tokens.size() == 1 ? OptionalInt.of(tokens.getInt(0)) : OptionalInt.empty();
    }

    /**
     * @return Sum of all carried values.
     */
    public long total() {
        long sum = 0;
        for (int i = 0; i < tokens.size(); i++) {
            sum += tokens.getInt(i);
        }
        return sum;
    }
}
