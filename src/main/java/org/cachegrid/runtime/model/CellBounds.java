package org.cachegrid.runtime.model;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Rectangular region of cells with inclusive bounds on both axes.
 * <p>
 * Format: {@code [minI, maxI] x [minJ, maxJ]}. A region always contains at least one cell.
 */
public final class CellBounds {
    private final int minI;
    private final int maxI;
    private final int minJ;
    private final int maxJ;

    /**
     * Creates a new region.
     *
     * @param minI Lowest row, inclusive.
     * @param maxI Highest row, inclusive.
     * @param minJ Lowest column, inclusive.
     * @param maxJ Highest column, inclusive.
     * @throws IllegalArgumentException if a minimum exceeds its maximum.
     */
    public CellBounds(int minI, int maxI, int minJ, int maxJ) {
        if (minI > maxI || minJ > maxJ) {
            throw new IllegalArgumentException(
                "Region bounds are inverted: i=[" + minI + "," + maxI + "], j=[" + minJ + "," + maxJ + "]");
        }
        this.minI = minI;
        this.maxI = maxI;
        this.minJ = minJ;
        this.maxJ = maxJ;
    }

    /**
     * Creates the square region of the given radius around a center cell.
     *
     * @param center The center cell.
     * @param radius Chebyshev radius, must be non-negative.
     * @return The region, clipped to the addressable index range.
     */
    public static CellBounds around(CellId center, int radius) {
        if (radius < 0) {
            throw new IllegalArgumentException("Radius must be non-negative: " + radius);
        }
        return clamped((long) center.i() - radius, (long) center.i() + radius,
            (long) center.j() - radius, (long) center.j() + radius);
    }

    /**
     * Creates a region from bounds that may lie beyond the {@code int} range, clipping each bound
     * to {@code [Integer.MIN_VALUE, Integer.MAX_VALUE]}.
     *
     * @param minI Lowest row, inclusive.
     * @param maxI Highest row, inclusive.
     * @param minJ Lowest column, inclusive.
     * @param maxJ Highest column, inclusive.
     * @return The clipped region.
     */
    public static CellBounds clamped(long minI, long maxI, long minJ, long maxJ) {
        return new CellBounds(clip(minI), clip(maxI), clip(minJ), clip(maxJ));
    }

    private static int clip(long index) {
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, index));
    }

    public int minI() {
        return minI;
    }

    public int maxI() {
        return maxI;
    }

    public int minJ() {
        return minJ;
    }

    public int maxJ() {
        return maxJ;
    }

    public long height() {
        return (long) maxI - minI + 1;
    }

    public long width() {
        return (long) maxJ - minJ + 1;
    }

    /**
     * @return Number of cells in the region; saturates at {@link Long#MAX_VALUE} for the full plane.
     */
    public long cellCount() {
        long h = height();
        long w = width();
        return h > Long.MAX_VALUE / w ? Long.MAX_VALUE : h * w;
    }

    public boolean contains(CellId cell) {
        return cell.i() >= minI && cell.i() <= maxI && cell.j() >= minJ && cell.j() <= maxJ;
    }

    public boolean intersects(CellBounds other) {
        return minI <= other.maxI && other.minI <= maxI && minJ <= other.maxJ && other.minJ <= maxJ;
    }

    /**
     * Decomposes {@code this \ other} into at most four disjoint rectangles.
     * <p>
     * The strips are a full-width band below and above {@code other}, then the left and right
     * remainders of the overlapping rows. Iterating the strips visits exactly the cells of this
     * region that {@code other} does not contain, so the cost is proportional to the difference
     * rather than to the region.
     *
     * @param other The region to subtract, may be {@code null} (nothing to subtract).
     * @return Disjoint strips covering the difference, empty if {@code other} covers this region.
     */
    public List<CellBounds> minus(CellBounds other) {
        List<CellBounds> strips = new ArrayList<>(4);
        if (other == null || !intersects(other)) {
            strips.add(this);
            return strips;
        }
        int overlapMinI = Math.max(minI, other.minI);
        int overlapMaxI = Math.min(maxI, other.maxI);
        if (minI < overlapMinI) {
            strips.add(new CellBounds(minI, overlapMinI - 1, minJ, maxJ));
        }
        if (overlapMaxI < maxI) {
            strips.add(new CellBounds(overlapMaxI + 1, maxI, minJ, maxJ));
        }
        if (minJ < other.minJ) {
            strips.add(new CellBounds(overlapMinI, overlapMaxI, minJ, other.minJ - 1));
        }
        if (other.maxJ < maxJ) {
            strips.add(new CellBounds(overlapMinI, overlapMaxI, other.maxJ + 1, maxJ));
        }
        return strips;
    }

    /**
     * Visits every cell in row-major order.
     *
     * @param action The visitor.
     */
    public void forEach(Consumer<CellId> action) {
        // long counters, an int would wrap past a bound of Integer.MAX_VALUE
        for (long i = minI; i <= maxI; i++) {
            for (long j = minJ; j <= maxJ; j++) {
                action.accept(new CellId((int) i, (int) j));
            }
        }
    }

    /**
     * @return All cells of the region in row-major order.
     */
    public List<CellId> cells() {
        List<CellId> result = new ArrayList<>((int) Math.min(cellCount(), Integer.MAX_VALUE));
        forEach(result::add);
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CellBounds)) return false;
        CellBounds that = (CellBounds) o;
        return minI == that.minI && maxI == that.maxI && minJ == that.minJ && maxJ == that.maxJ;
    }

    @Override
    public int hashCode() {
        int result = minI;
        result = 31 * result + maxI;
        result = 31 * result + minJ;
        result = 31 * result + maxJ;
        return result;
    }

    @Override
    public String toString() {
        return "CellBounds{i=[" + minI + "," + maxI + "], j=[" + minJ + "," + maxJ + "]}";
    }
}
