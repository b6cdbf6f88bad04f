package com.sweeper.model;

/**
 * Immutable board position, zero-based.
 *
 * @param row row index
 * @param col column index
 */
public record Coordinate(int row, int col) {

    public static Coordinate of(int row, int col) {
        return new Coordinate(row, col);
    }

    /**
     * King-move adjacency: true when the two positions differ by at most one
     * in both directions and are not the same cell.
     */
    public boolean isNeighborOf(Coordinate other) {
        int dr = Math.abs(row - other.row);
        int dc = Math.abs(col - other.col);
        return (dr != 0 || dc != 0) && dr <= 1 && dc <= 1;
    }

    @Override
    public String toString() {
        return "(" + row + "," + col + ")";
    }
}
