package com.sweeper.exception;

/**
 * Reveal or flag coordinate outside the board. Nothing was mutated.
 */
public class InvalidCoordinateException extends IllegalArgumentException {

    public InvalidCoordinateException(int row, int col, int rows, int columns) {
        super(String.format("Coordinate (%d,%d) is outside the %dx%d board", row, col, rows, columns));
    }
}
