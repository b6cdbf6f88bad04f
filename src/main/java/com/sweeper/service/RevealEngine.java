package com.sweeper.service;

import com.sweeper.model.Board;
import com.sweeper.model.Cell;
import com.sweeper.model.Coordinate;
import com.sweeper.model.FlagOutcome;
import com.sweeper.model.GameState;
import com.sweeper.model.RevealOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Per-cell reveal and flag transitions, including the breadth-first flood fill.
 * <p>
 * The flood fill never reveals a treasure cell or any cell touching one;
 * those must be opened by an explicit reveal. Status transitions are left to
 * {@link GameEngine}.
 */
@Component
@Slf4j
public class RevealEngine {

    /**
     * Reveals the cell at {@code coordinate}. The coordinate must lie on the board.
     */
    public RevealOutcome reveal(GameState state, Coordinate coordinate) {
        Board board = state.getBoard();
        Cell start = board.getCell(coordinate);
        if (start.isRevealed() || start.isFlagged()) {
            return RevealOutcome.alreadyRevealedOrFlagged();
        }

        board.reveal(coordinate);
        state.recordReveal();

        if (start.isMine()) {
            return RevealOutcome.hitMine(coordinate);
        }
        if (start.isTreasure()) {
            return RevealOutcome.foundTreasure(coordinate);
        }

        List<Coordinate> revealed = new ArrayList<>();
        revealed.add(coordinate);
        if (start.getAdjacentMineCount() == 0) {
            floodFill(state, start, revealed);
        }
        log.debug("Reveal at {} opened {} cell(s)", coordinate, revealed.size());
        return RevealOutcome.revealed(revealed);
    }

    private void floodFill(GameState state, Cell start, List<Coordinate> revealed) {
        Board board = state.getBoard();
        Deque<Cell> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            Cell current = queue.poll();
            for (Cell neighbor : board.neighborsOf(current)) {
                if (!canCascadeInto(board, neighbor)) {
                    continue;
                }
                board.reveal(neighbor.getCoordinate());
                state.recordReveal();
                revealed.add(neighbor.getCoordinate());
                if (neighbor.getAdjacentMineCount() == 0) {
                    queue.add(neighbor);
                }
            }
        }
    }

    private boolean canCascadeInto(Board board, Cell cell) {
        return !cell.isRevealed()
                && !cell.isMine()
                && !cell.isFlagged()
                && !cell.isTreasure()
                && !board.isAdjacentToTreasure(cell);
    }

    /**
     * Flips the flag on an unrevealed cell. Revealed cells are left alone.
     * The flag count is observational and never checked against the mine count.
     */
    public FlagOutcome toggleFlag(GameState state, Coordinate coordinate) {
        Board board = state.getBoard();
        if (board.getCell(coordinate).isRevealed()) {
            return new FlagOutcome(FlagOutcome.Type.IGNORED, coordinate, state.getFlagCount());
        }
        boolean flagged = board.toggleFlag(coordinate);
        state.adjustFlagCount(flagged ? 1 : -1);
        return new FlagOutcome(flagged ? FlagOutcome.Type.FLAGGED : FlagOutcome.Type.UNFLAGGED,
                coordinate, state.getFlagCount());
    }
}
