package org.cachegrid.runtime.model;

/**
 * The continuous bounds of the visible map area as reported by the front end.
 *
 * @param south Southern latitude edge.
 * @param north Northern latitude edge.
 * @param west Western longitude edge.
 * @param east Eastern longitude edge.
 */
public record ViewportBounds(double south, double north, double west, double east) {

    public ViewportBounds {
        if (!Double.isFinite(south) || !Double.isFinite(north) || !Double.isFinite(west) || !Double.isFinite(east)) {
            throw new IllegalArgumentException("Viewport bounds must be finite");
        }
        if (south > north || west > east) {
            throw new IllegalArgumentException(
                "Viewport bounds are inverted: south=" + south + " north=" + north + " west=" + west + " east=" + east);
        }
    }
}
