package org.cachegrid.runtime.model;

/**
 * Identity of a single grid cell.
 * <p>
 * Cells are addressed by an integer pair {@code (i, j)} where {@code i} grows northwards and
 * {@code j} grows eastwards. Every pair is a valid address; the grid has no edges.
 * Equality and hashing are structural, and the natural order is row-major ({@code i}, then {@code j}).
 *
 * @param i The row index (latitude axis).
 * @param j The column index (longitude axis).
 */
public record CellId(int i, int j) implements Comparable<CellId> {

    /**
     * Chebyshev ("king move") distance between two cells.
     *
     * @param other The other cell.
     * @return {@code max(|di|, |dj|)}, saturated at {@link Integer#MAX_VALUE}.
     */
    public int chebyshevDistance(CellId other) {
        long distance = Math.max(Math.abs((long) i - other.i), Math.abs((long) j - other.j));
        return (int) Math.min(distance, Integer.MAX_VALUE);
    }

    /**
     * Packs the pair into a single long, used as the key for derived random streams.
     *
     * @return {@code i} in the high 32 bits, {@code j} in the low 32 bits.
     */
    public long packed() {
        return ((long) i << 32) | (j & 0xFFFFFFFFL);
    }

    @Override
    public int compareTo(CellId other) {
        int byRow = Integer.compare(i, other.i);
        return byRow != 0 ? byRow : Integer.compare(j, other.j);
    }

    @Override
    public String toString() {
        return i + "," + j;
    }
}
