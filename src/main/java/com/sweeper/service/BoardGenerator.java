package com.sweeper.service;

import com.sweeper.exception.ConfigurationException;
import com.sweeper.model.Board;
import com.sweeper.model.Coordinate;
import com.sweeper.model.FixedLayout;
import com.sweeper.model.GameSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Places mines and treasures on a new board and computes adjacency counts.
 * <p>
 * Random placement samples without replacement from the injected
 * {@link Random}; a seeded handle makes boards reproducible.
 */
@Component
@Slf4j
public class BoardGenerator {

    private final Random random;

    public BoardGenerator(Random random) {
        this.random = random;
    }

    public Board generate(GameSettings settings) {
        if (settings.isFixed()) {
            return generate(settings.rows(), settings.columns(), settings.layout());
        }
        return generate(settings.rows(), settings.columns(), settings.mineCount(), settings.treasureCount());
    }

    /**
     * Random mode.
     *
     * @throws ConfigurationException if the counts do not fit the board
     */
    public Board generate(int rows, int columns, int mineCount, int treasureCount) {
        if (rows <= 0 || columns <= 0 || rows > Board.MAX_DIMENSION || columns > Board.MAX_DIMENSION) {
            throw new ConfigurationException(String.format("Board dimensions must be between 1 and %d: %dx%d",
                    Board.MAX_DIMENSION, rows, columns));
        }
        if (mineCount < 0) {
            throw new ConfigurationException("Mine count must not be negative: " + mineCount);
        }
        if (treasureCount < 1) {
            throw new ConfigurationException("At least one treasure is required: " + treasureCount);
        }
        int cellCount = rows * columns;
        if (mineCount + treasureCount >= cellCount) {
            throw new ConfigurationException(String.format(
                    "Not enough cells for %d mines and %d treasures on a %dx%d board",
                    mineCount, treasureCount, rows, columns));
        }

        List<Coordinate> candidates = new ArrayList<>(cellCount);
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                candidates.add(new Coordinate(r, c));
            }
        }
        // one shuffle gives two disjoint uniform samples
        Collections.shuffle(candidates, random);

        Board board = new Board(rows, columns, false);
        candidates.subList(0, mineCount).forEach(board::placeMine);
        candidates.subList(mineCount, mineCount + treasureCount).forEach(board::placeTreasure);
        board.computeAdjacentMineCounts();

        log.debug("Generated random {}x{} board with {} mines and {} treasure(s)",
                rows, columns, mineCount, treasureCount);
        return board;
    }

    /**
     * Fixed mode. Mine and treasure counts come from the layout.
     *
     * @throws ConfigurationException if the layout does not match the requested size or holds no treasure
     */
    public Board generate(int rows, int columns, FixedLayout layout) {
        if (layout.getRows() != rows || layout.getColumns() != columns) {
            throw new ConfigurationException(String.format(
                    "Layout is %dx%d but the board is %dx%d",
                    layout.getRows(), layout.getColumns(), rows, columns));
        }
        if (layout.count(FixedLayout.TREASURE) == 0) {
            throw new ConfigurationException("Layout contains no treasure");
        }

        Board board = new Board(rows, columns, true);
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                switch (layout.valueAt(r, c)) {
                    case FixedLayout.MINE -> board.placeMine(new Coordinate(r, c));
                    case FixedLayout.TREASURE -> board.placeTreasure(new Coordinate(r, c));
                    default -> { }
                }
            }
        }
        board.computeAdjacentMineCounts();

        log.debug("Built fixed {}x{} board with {} mines and {} treasure(s)",
                rows, columns, board.getMineCount(), board.getTreasureCount());
        return board;
    }
}
