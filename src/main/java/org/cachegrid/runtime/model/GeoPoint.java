package org.cachegrid.runtime.model;

/**
 * A continuous position in map coordinates.
 *
 * @param lat Latitude in degrees.
 * @param lng Longitude in degrees.
 */
public record GeoPoint(double lat, double lng) {

    public GeoPoint {
        if (!Double.isFinite(lat) || !Double.isFinite(lng)) {
            throw new IllegalArgumentException("Coordinates must be finite: " + lat + ", " + lng);
        }
    }

    /**
     * Returns this point moved by the given deltas.
     *
     * @param dLat Latitude delta in degrees.
     * @param dLng Longitude delta in degrees.
     * @return The moved point.
     */
    public GeoPoint plus(double dLat, double dLng) {
        return new GeoPoint(lat + dLat, lng + dLng);
    }
}
