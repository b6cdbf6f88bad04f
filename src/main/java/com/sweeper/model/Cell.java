package com.sweeper.model;

import lombok.Getter;
import lombok.ToString;

/**
 * A single square of a {@link Board}.
 * <p>
 * Position is fixed at construction. Mine and treasure status are assigned
 * once during generation; the adjacency count is assigned once afterwards.
 * Cells are mutated only through their {@link Board}.
 */
@Getter
@ToString
public class Cell {

    private final int row;
    private final int col;

    private boolean mine;
    private boolean treasure;
    private boolean flagged;
    private boolean revealed;
    private int adjacentMineCount = -1;

    public Cell(int row, int col) {
        this.row = row;
        this.col = col;
    }

    public Coordinate getCoordinate() {
        return new Coordinate(row, col);
    }

    /** True when the cell is neither a mine nor a treasure. */
    public boolean isSafe() {
        return !mine && !treasure;
    }

    public boolean isHidden() {
        return !revealed && !flagged;
    }

    void placeMine() {
        if (treasure) {
            throw new IllegalStateException("Cell " + getCoordinate() + " already holds a treasure");
        }
        mine = true;
    }

    void placeTreasure() {
        if (mine) {
            throw new IllegalStateException("Cell " + getCoordinate() + " already holds a mine");
        }
        treasure = true;
    }

    void assignAdjacentMineCount(int count) {
        if (adjacentMineCount >= 0) {
            throw new IllegalStateException("Adjacent mine count already computed for " + getCoordinate());
        }
        adjacentMineCount = count;
    }

    /**
     * Marks the cell revealed.
     *
     * @return false if it was already revealed
     */
    boolean reveal() {
        if (revealed) {
            return false;
        }
        revealed = true;
        return true;
    }

    /**
     * Flips the flag.
     *
     * @return the new flag state
     * @throws IllegalStateException if the cell is already revealed
     */
    boolean toggleFlag() {
        if (revealed) {
            throw new IllegalStateException("Cannot flag revealed cell " + getCoordinate());
        }
        flagged = !flagged;
        return flagged;
    }

    // restore path only
    void restore(boolean flagged, boolean revealed) {
        this.flagged = flagged;
        this.revealed = revealed;
    }
}
