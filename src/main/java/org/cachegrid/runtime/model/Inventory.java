package org.cachegrid.runtime.model;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.OptionalInt;

/**
 * Carry slots of the player.
 * <p>
 * Holds token values in pickup order, up to a fixed capacity. A capacity of one gives the
 * single-slot carry state; larger capacities give a multiset from which equal tokens can be
 * crafted together.
 */
public class Inventory {

    private final int capacity;
    private final IntArrayList tokens;

    /**
     * @param capacity Maximum number of carried tokens, at least 1.
     */
    public Inventory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Carry capacity must be at least 1: " + capacity);
        }
        this.capacity = capacity;
        this.tokens = new IntArrayList(Math.min(capacity, 16));
    }

    public int capacity() {
        return capacity;
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public boolean isFull() {
        return tokens.size() >= capacity;
    }

    public boolean contains(int value) {
        return tokens.contains(value);
    }

    /**
     * @param value Token value.
     * @return How many tokens of that value are carried.
     */
    public int count(int value) {
        int n = 0;
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.getInt(i) == value) {
                n++;
            }
        }
        return n;
    }

    /**
     * Adds a token.
     *
     * @param value Positive token value.
     * @throws IllegalStateException if the inventory is full.
     */
    public void add(int value) {
        if (value <= 0) {
            throw new IllegalArgumentException("Token value must be positive: " + value);
        }
        if (isFull()) {
            throw new IllegalStateException("Inventory is full (capacity " + capacity + ")");
        }
        tokens.add(value);
    }

    /**
     * Removes the most recently added token of the given value.
     *
     * @param value Token value.
     * @return {@code true} if a token was removed.
     */
    public boolean removeOne(int value) {
        for (int i = tokens.size() - 1; i >= 0; i--) {
            if (tokens.getInt(i) == value) {
                tokens.removeInt(i);
                return true;
            }
        }
        return false;
    }

    /**
     * @return The carried value when exactly one token is carried, empty otherwise.
     */
    public OptionalInt single() {
        return tokens.size() == 1 ? OptionalInt.of(tokens.getInt(0)) : OptionalInt.empty();
    }

    /**
     * @return Read-only view of the carried tokens in pickup order.
     */
    public IntList tokens() {
        return IntLists.unmodifiable(tokens);
    }

    /**
     * Groups the carried tokens by value.
     *
     * @return Map from value to number of carried copies.
     */
    public Int2IntMap grouped() {
        Int2IntOpenHashMap counts = new Int2IntOpenHashMap();
        for (int i = 0; i < tokens.size(); i++) {
            counts.addTo(tokens.getInt(i), 1);
        }
        return counts;
    }
}
