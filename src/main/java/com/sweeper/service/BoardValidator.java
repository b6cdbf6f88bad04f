package com.sweeper.service;

import com.sweeper.model.FixedLayout;
import com.sweeper.model.ValidationResult;
import com.sweeper.model.ValidationRule;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates externally supplied 8x8 test layouts.
 * <p>
 * Rules are checked in {@link ValidationRule} order and the first violation is
 * returned. This class has no state and never throws on bad input.
 */
@Component
public class BoardValidator {

    public static final int SIZE = 8;
    public static final int REQUIRED_MINES = 10;
    public static final int MIN_TREASURES = 1;
    public static final int MAX_TREASURES = 9;

    /**
     * Parses and validates a text table: {@value #SIZE} lines of {@value #SIZE}
     * comma-separated integers. Blank lines are ignored.
     */
    public ValidationResult validate(String text) {
        if (text == null) {
            return ValidationResult.failure(ValidationRule.SHAPE);
        }
        List<String[]> rows = new ArrayList<>();
        for (String line : text.split("\\R")) {
            if (!line.isBlank()) {
                rows.add(line.split(",", -1));
            }
        }
        if (rows.size() != SIZE) {
            return ValidationResult.failure(ValidationRule.SHAPE);
        }
        for (String[] row : rows) {
            if (row.length != SIZE) {
                return ValidationResult.failure(ValidationRule.SHAPE);
            }
        }

        int[][] matrix = new int[SIZE][SIZE];
        for (int r = 0; r < SIZE; r++) {
            for (int c = 0; c < SIZE; c++) {
                try {
                    matrix[r][c] = Integer.parseInt(rows.get(r)[c].trim());
                } catch (NumberFormatException e) {
                    return ValidationResult.failure(ValidationRule.VALUES);
                }
            }
        }
        return validate(matrix);
    }

    public ValidationResult validate(List<List<Integer>> rows) {
        if (rows == null || rows.size() != SIZE) {
            return ValidationResult.failure(ValidationRule.SHAPE);
        }
        int[][] matrix = new int[SIZE][];
        for (int r = 0; r < SIZE; r++) {
            List<Integer> row = rows.get(r);
            if (row == null || row.size() != SIZE) {
                return ValidationResult.failure(ValidationRule.SHAPE);
            }
            matrix[r] = new int[SIZE];
            for (int c = 0; c < SIZE; c++) {
                Integer value = row.get(c);
                if (value == null) {
                    return ValidationResult.failure(ValidationRule.VALUES);
                }
                matrix[r][c] = value;
            }
        }
        return validate(matrix);
    }

    public ValidationResult validate(int[][] matrix) {
        if (!hasShape(matrix)) {
            return ValidationResult.failure(ValidationRule.SHAPE);
        }
        if (!hasValidValues(matrix)) {
            return ValidationResult.failure(ValidationRule.VALUES);
        }
        if (count(matrix, FixedLayout.MINE) != REQUIRED_MINES) {
            return ValidationResult.failure(ValidationRule.MINE_COUNT);
        }
        if (!everyRowHasMine(matrix)) {
            return ValidationResult.failure(ValidationRule.ROW_COVERAGE);
        }
        if (!everyColumnHasMine(matrix)) {
            return ValidationResult.failure(ValidationRule.COLUMN_COVERAGE);
        }
        if (diagonalMines(matrix) != 1) {
            return ValidationResult.failure(ValidationRule.DIAGONAL);
        }
        if (orthogonalMinePairs(matrix) != 1) {
            return ValidationResult.failure(ValidationRule.ORTHOGONAL_PAIR);
        }
        int treasures = count(matrix, FixedLayout.TREASURE);
        if (treasures < MIN_TREASURES || treasures > MAX_TREASURES) {
            return ValidationResult.failure(ValidationRule.TREASURE_COUNT);
        }
        return ValidationResult.success(FixedLayout.of(matrix));
    }

    private boolean hasShape(int[][] matrix) {
        if (matrix == null || matrix.length != SIZE) {
            return false;
        }
        for (int[] row : matrix) {
            if (row == null || row.length != SIZE) {
                return false;
            }
        }
        return true;
    }

    private boolean hasValidValues(int[][] matrix) {
        for (int[] row : matrix) {
            for (int value : row) {
                if (value < FixedLayout.EMPTY || value > FixedLayout.TREASURE) {
                    return false;
                }
            }
        }
        return true;
    }

    private int count(int[][] matrix, int wanted) {
        int count = 0;
        for (int[] row : matrix) {
            for (int value : row) {
                if (value == wanted) {
                    count++;
                }
            }
        }
        return count;
    }

    private boolean everyRowHasMine(int[][] matrix) {
        for (int[] row : matrix) {
            boolean found = false;
            for (int value : row) {
                found |= value == FixedLayout.MINE;
            }
            if (!found) {
                return false;
            }
        }
        return true;
    }

    private boolean everyColumnHasMine(int[][] matrix) {
        for (int c = 0; c < SIZE; c++) {
            boolean found = false;
            for (int r = 0; r < SIZE; r++) {
                found |= matrix[r][c] == FixedLayout.MINE;
            }
            if (!found) {
                return false;
            }
        }
        return true;
    }

    private int diagonalMines(int[][] matrix) {
        int count = 0;
        for (int i = 0; i < SIZE; i++) {
            if (matrix[i][i] == FixedLayout.MINE) {
                count++;
            }
        }
        return count;
    }

    // each edge-sharing pair counted once: right and down neighbours only
    private int orthogonalMinePairs(int[][] matrix) {
        int pairs = 0;
        for (int r = 0; r < SIZE; r++) {
            for (int c = 0; c < SIZE; c++) {
                if (matrix[r][c] != FixedLayout.MINE) {
                    continue;
                }
                if (c + 1 < SIZE && matrix[r][c + 1] == FixedLayout.MINE) {
                    pairs++;
                }
                if (r + 1 < SIZE && matrix[r + 1][c] == FixedLayout.MINE) {
                    pairs++;
                }
            }
        }
        return pairs;
    }
}
