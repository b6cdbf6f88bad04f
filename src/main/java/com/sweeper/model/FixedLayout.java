package com.sweeper.model;

import com.sweeper.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.StringJoiner;

/**
 * Immutable rectangular layout matrix used to build a board in fixed mode.
 * Values: {@value #EMPTY} empty, {@value #MINE} mine, {@value #TREASURE} treasure.
 */
public final class FixedLayout {

    public static final int EMPTY = 0;
    public static final int MINE = 1;
    public static final int TREASURE = 2;

    private final int[][] matrix;

    private FixedLayout(int[][] matrix) {
        this.matrix = matrix;
    }

    /**
     * Copies the given matrix.
     *
     * @throws ConfigurationException if the matrix is empty, ragged or holds values outside 0..2
     */
    public static FixedLayout of(int[][] source) {
        if (source == null || source.length == 0 || source[0] == null || source[0].length == 0) {
            throw new ConfigurationException("Layout must have at least one row and one column");
        }
        int columns = source[0].length;
        int[][] copy = new int[source.length][];
        for (int r = 0; r < source.length; r++) {
            if (source[r] == null || source[r].length != columns) {
                throw new ConfigurationException("Layout row " + r + " does not have " + columns + " values");
            }
            for (int value : source[r]) {
                if (value < EMPTY || value > TREASURE) {
                    throw new ConfigurationException("Layout value out of range: " + value);
                }
            }
            copy[r] = source[r].clone();
        }
        return new FixedLayout(copy);
    }

    /**
     * Builds a layout from nested lists, e.g. as read from JSON.
     *
     * @throws ConfigurationException if a row or value is missing, or for the reasons {@link #of} rejects
     */
    public static FixedLayout fromRows(List<List<Integer>> rows) {
        if (rows == null) {
            throw new ConfigurationException("Layout must have at least one row and one column");
        }
        int[][] matrix = new int[rows.size()][];
        for (int r = 0; r < rows.size(); r++) {
            List<Integer> row = rows.get(r);
            if (row == null) {
                throw new ConfigurationException("Layout row " + r + " is missing");
            }
            matrix[r] = new int[row.size()];
            for (int c = 0; c < row.size(); c++) {
                Integer value = row.get(c);
                if (value == null) {
                    throw new ConfigurationException("Layout value at (" + r + "," + c + ") is missing");
                }
                matrix[r][c] = value;
            }
        }
        return of(matrix);
    }

    public int getRows() {
        return matrix.length;
    }

    public int getColumns() {
        return matrix[0].length;
    }

    public int valueAt(int row, int col) {
        return matrix[row][col];
    }

    public int count(int value) {
        int count = 0;
        for (int[] row : matrix) {
            for (int v : row) {
                if (v == value) {
                    count++;
                }
            }
        }
        return count;
    }

    public int[][] toMatrix() {
        int[][] copy = new int[matrix.length][];
        for (int r = 0; r < matrix.length; r++) {
            copy[r] = matrix[r].clone();
        }
        return copy;
    }

    public List<List<Integer>> toRows() {
        List<List<Integer>> rows = new ArrayList<>(matrix.length);
        for (int[] row : matrix) {
            rows.add(Arrays.stream(row).boxed().toList());
        }
        return List.copyOf(rows);
    }

    /** Text table form: one line per row, comma-separated values. */
    public String toText() {
        StringJoiner lines = new StringJoiner("\n");
        for (int[] row : matrix) {
            StringJoiner line = new StringJoiner(",");
            for (int v : row) {
                line.add(Integer.toString(v));
            }
            lines.add(line.toString());
        }
        return lines.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FixedLayout other)) return false;
        return Arrays.deepEquals(matrix, other.matrix);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(matrix);
    }

    @Override
    public String toString() {
        return "FixedLayout[" + getRows() + "x" + getColumns() + "]";
    }
}
