package org.cachegrid.runtime.viewport;

import org.cachegrid.runtime.model.CellId;

import java.util.OptionalInt;

/**
 * What a front end needs to draw one visible cell.
 *
 * @param cellId The cell.
 * @param hasCache Whether the cell currently holds a cache.
 * @param value The cache value, empty if there is no cache.
 * @param interactable Whether a pickup or place on this cell would be accepted right now.
 */
public record CellView(CellId cellId, boolean hasCache, OptionalInt value, boolean interactable) {
}
