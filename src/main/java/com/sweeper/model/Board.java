package com.sweeper.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Fixed-size grid of cells with mines and treasures.
 * <p>
 * A board is populated by placing mines and treasures and then sealed with
 * {@link #computeAdjacentMineCounts()}. Once sealed, mine and treasure
 * positions never change; only reveal and flag state does.
 */
public class Board {

    /** Largest number of rows or columns a board may have. */
    public static final int MAX_DIMENSION = 100;

    @Getter
    private final int rows;

    @Getter
    private final int columns;

    @Getter
    private final boolean fixedLayout;

    private final Cell[][] cells;
    private final Set<Coordinate> treasureCells = new LinkedHashSet<>();

    @Getter
    private int mineCount;

    @Getter
    private boolean sealed;

    public Board(int rows, int columns, boolean fixedLayout) {
        if (rows <= 0 || columns <= 0 || rows > MAX_DIMENSION || columns > MAX_DIMENSION) {
            throw new IllegalArgumentException("Board dimensions must be between 1 and " + MAX_DIMENSION
                    + ": " + rows + "x" + columns);
        }
        this.rows = rows;
        this.columns = columns;
        this.fixedLayout = fixedLayout;
        this.cells = new Cell[rows][columns];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                cells[r][c] = new Cell(r, c);
            }
        }
    }

    public int getCellCount() {
        return rows * columns;
    }

    public int getTreasureCount() {
        return treasureCells.size();
    }

    /** Cells that are neither mines nor treasures; revealing all of them wins the game. */
    public int getSafeCellCount() {
        return getCellCount() - mineCount - treasureCells.size();
    }

    public Set<Coordinate> getTreasureCells() {
        return Collections.unmodifiableSet(treasureCells);
    }

    public boolean contains(int row, int col) {
        return row >= 0 && row < rows && col >= 0 && col < columns;
    }

    public Cell getCell(int row, int col) {
        if (!contains(row, col)) {
            throw new IndexOutOfBoundsException("Cell (" + row + "," + col + ") outside " + rows + "x" + columns + " board");
        }
        return cells[row][col];
    }

    public Cell getCell(Coordinate coordinate) {
        return getCell(coordinate.row(), coordinate.col());
    }

    /**
     * Up to eight king-move neighbours, clipped at the edges.
     */
    public List<Cell> neighborsOf(Cell cell) {
        List<Cell> neighbors = new ArrayList<>(8);
        for (int dr = -1; dr <= 1; dr++) {
            for (int dc = -1; dc <= 1; dc++) {
                int r = cell.getRow() + dr;
                int c = cell.getCol() + dc;
                if ((dr != 0 || dc != 0) && contains(r, c)) {
                    neighbors.add(cells[r][c]);
                }
            }
        }
        return neighbors;
    }

    /** Row-major list of every cell. */
    public List<Cell> cells() {
        List<Cell> all = new ArrayList<>(getCellCount());
        for (Cell[] row : cells) {
            Collections.addAll(all, row);
        }
        return all;
    }

    public boolean isAdjacentToTreasure(Cell cell) {
        Coordinate position = cell.getCoordinate();
        for (Coordinate treasure : treasureCells) {
            if (treasure.isNeighborOf(position)) {
                return true;
            }
        }
        return false;
    }

    public void placeMine(Coordinate coordinate) {
        checkNotSealed();
        Cell cell = getCell(coordinate);
        if (!cell.isMine()) {
            cell.placeMine();
            mineCount++;
        }
    }

    public void placeTreasure(Coordinate coordinate) {
        checkNotSealed();
        getCell(coordinate).placeTreasure();
        treasureCells.add(coordinate);
    }

    /**
     * Computes every cell's adjacent mine count and seals the layout.
     */
    public void computeAdjacentMineCounts() {
        checkNotSealed();
        for (Cell[] row : cells) {
            for (Cell cell : row) {
                int count = 0;
                for (Cell neighbor : neighborsOf(cell)) {
                    if (neighbor.isMine()) {
                        count++;
                    }
                }
                cell.assignAdjacentMineCount(count);
            }
        }
        sealed = true;
    }

    /**
     * Reveals a cell of a sealed board.
     *
     * @return false if the cell was already revealed
     */
    public boolean reveal(Coordinate coordinate) {
        checkSealed();
        return getCell(coordinate).reveal();
    }

    /**
     * Flips the flag on a cell of a sealed board.
     *
     * @return the new flag state
     * @throws IllegalStateException if the cell is already revealed
     */
    public boolean toggleFlag(Coordinate coordinate) {
        checkSealed();
        return getCell(coordinate).toggleFlag();
    }

    /**
     * Reapplies persisted reveal and flag state to a sealed board.
     */
    public void restoreCellState(Coordinate coordinate, boolean flagged, boolean revealed) {
        checkSealed();
        getCell(coordinate).restore(flagged, revealed);
    }

    /**
     * Layout matrix: 0 empty, 1 mine, 2 treasure.
     */
    public int[][] toLayoutMatrix() {
        int[][] matrix = new int[rows][columns];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                Cell cell = cells[r][c];
                matrix[r][c] = cell.isMine() ? FixedLayout.MINE : cell.isTreasure() ? FixedLayout.TREASURE : FixedLayout.EMPTY;
            }
        }
        return matrix;
    }

    private void checkSealed() {
        if (!sealed) {
            throw new IllegalStateException("Board layout is not sealed yet");
        }
    }

    private void checkNotSealed() {
        if (sealed) {
            throw new IllegalStateException("Board layout is sealed");
        }
    }
}
