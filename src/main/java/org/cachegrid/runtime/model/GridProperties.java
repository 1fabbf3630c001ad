package org.cachegrid.runtime.model;

import java.util.Objects;

/**
 * Maps between continuous map coordinates and discrete cell identities.
 * <p>
 * Cell {@code (i, j)} covers the half-open rectangle
 * {@code [origin.lat + i * tile, origin.lat + (i + 1) * tile) x [origin.lng + j * tile, origin.lng + (j + 1) * tile)}.
 * <p>
 * <strong>Thread Safety:</strong> immutable and therefore thread-safe.
 */
public class GridProperties {
    private final GeoPoint origin;
    private final double tileDegrees;

    /**
     * Creates new grid properties.
     *
     * @param origin The south-west corner of cell {@code (0, 0)}.
     * @param tileDegrees Edge length of a cell in degrees, must be positive.
     */
    public GridProperties(GeoPoint origin, double tileDegrees) {
        this.origin = Objects.requireNonNull(origin, "origin");
        if (!(tileDegrees > 0) || !Double.isFinite(tileDegrees)) {
            throw new IllegalArgumentException("Tile size must be a positive finite number: " + tileDegrees);
        }
        this.tileDegrees = tileDegrees;
    }

    public GeoPoint getOrigin() {
        return origin;
    }

    public double getTileDegrees() {
        return tileDegrees;
    }

    /**
     * Quantises a continuous position to the cell containing it.
     *
     * @param point The position.
     * @return The containing cell.
     */
    public CellId toCell(GeoPoint point) {
        return new CellId(floorIndex(point.lat(), origin.lat()), floorIndex(point.lng(), origin.lng()));
    }

    /**
     * Quantises viewport bounds to the inclusive range of cells whose rectangles intersect it.
     * <p>
     * Lower edges are floored, upper edges are ceiled minus one, so an upper edge lying exactly on
     * a grid line does not pull in the next row or column. A degenerate viewport still covers the
     * one cell it touches.
     *
     * @param viewport The continuous bounds.
     * @return The covered cells.
     */
    public CellBounds toCellBounds(ViewportBounds viewport) {
        int minI = floorIndex(viewport.south(), origin.lat());
        int maxI = (int) Math.max(minI, (long) ceilIndex(viewport.north(), origin.lat()) - 1);
        int minJ = floorIndex(viewport.west(), origin.lng());
        int maxJ = (int) Math.max(minJ, (long) ceilIndex(viewport.east(), origin.lng()) - 1);
        return new CellBounds(minI, maxI, minJ, maxJ);
    }

    /**
     * @param cell The cell.
     * @return The south-west corner of the cell.
     */
    public GeoPoint cellSouthWest(CellId cell) {
        return new GeoPoint(origin.lat() + (double) cell.i() * tileDegrees, origin.lng() + (double) cell.j() * tileDegrees);
    }

    /**
     * @param cell The cell.
     * @return The centre of the cell.
     */
    public GeoPoint cellCenter(CellId cell) {
        double half = tileDegrees / 2;
        return cellSouthWest(cell).plus(half, half);
    }

    /**
     * The square neighbourhood drawn around a cell: {@code [c - size, c + size - 1]} on both axes,
     * i.e. {@code 2 * size} rows and columns. Near the ends of the index range the square is
     * clipped, so it may hold fewer rows or columns there.
     *
     * @param center The centre cell.
     * @param size Half-width of the neighbourhood, at least 1.
     * @return The neighbourhood bounds.
     */
    public CellBounds neighborhood(CellId center, int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Neighborhood size must be at least 1: " + size);
        }
        return CellBounds.clamped((long) center.i() - size, (long) center.i() + size - 1,
            (long) center.j() - size, (long) center.j() + size - 1);
    }

    private int floorIndex(double coordinate, double originCoordinate) {
        return toIndex(Math.floor(offsetInTiles(coordinate, originCoordinate)));
    }

    private int ceilIndex(double coordinate, double originCoordinate) {
        return toIndex(Math.ceil(offsetInTiles(coordinate, originCoordinate)));
    }

    private double offsetInTiles(double coordinate, double originCoordinate) {
        double tiles = (coordinate - originCoordinate) / tileDegrees;
        // Snap values within float noise of a grid line onto it
        double nearest = Math.rint(tiles);
        return Math.abs(tiles - nearest) < 1e-9 ? nearest : tiles;
    }

    private static int toIndex(double tiles) {
        if (tiles > Integer.MAX_VALUE || tiles < Integer.MIN_VALUE) {
            throw new IllegalArgumentException("Coordinate is outside the addressable grid: " + tiles + " tiles from origin");
        }
        return (int) tiles;
    }
}
