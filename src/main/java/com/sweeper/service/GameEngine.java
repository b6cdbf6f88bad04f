package com.sweeper.service;

import com.sweeper.dto.GameSnapshotDTO;
import com.sweeper.exception.IllegalOperationException;
import com.sweeper.exception.InvalidCoordinateException;
import com.sweeper.model.Board;
import com.sweeper.model.Coordinate;
import com.sweeper.model.FlagOutcome;
import com.sweeper.model.GameSettings;
import com.sweeper.model.GameState;
import com.sweeper.model.GameStatus;
import com.sweeper.model.RevealOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Game state machine: NOT_STARTED, IN_PROGRESS, then WON or LOST.
 * <p>
 * Checks bounds and terminal status before delegating a move to
 * {@link RevealEngine}, then applies the resulting transition.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameEngine {

    private final BoardGenerator boardGenerator;
    private final RevealEngine revealEngine;
    private final Clock clock;

    /**
     * Build a new game.
     *
     * @throws com.sweeper.exception.ConfigurationException if the settings cannot produce a board
     */
    public GameState newGame(GameSettings settings) {
        Board board = boardGenerator.generate(settings);
        return new GameState(board, settings);
    }

    /**
     * Reveal a cell and apply the win/loss transition.
     */
    public RevealOutcome reveal(GameState state, int row, int col) {
        checkPlayable(state, "reveal");
        Coordinate coordinate = checkBounds(state, row, col);

        RevealOutcome outcome = revealEngine.reveal(state, coordinate);
        if (outcome.isNoOp()) {
            return outcome;
        }
        if (state.getStatus() == GameStatus.NOT_STARTED) {
            state.start(clock.instant());
        }

        switch (outcome.getType()) {
            case HIT_MINE -> state.finish(GameStatus.LOST);
            case FOUND_TREASURE -> state.finish(GameStatus.WON);
            case REVEALED -> {
                if (state.isAllSafeCellsRevealed()) {
                    state.finish(GameStatus.WON);
                }
            }
            default -> { }
        }

        if (state.isOver()) {
            log.info("Game over at {}: {} after {} revealed cell(s)", coordinate, state.getStatus(), state.getClickedCount());
        }
        return outcome;
    }

    /**
     * Toggle the flag on a cell. Allowed before the first reveal.
     */
    public FlagOutcome toggleFlag(GameState state, int row, int col) {
        checkPlayable(state, "flag");
        Coordinate coordinate = checkBounds(state, row, col);
        return revealEngine.toggleFlag(state, coordinate);
    }

    /**
     * Build a fresh game from the same settings. A fixed layout is reused as is;
     * random settings get a new placement.
     */
    public GameState restart(GameState state) {
        return newGame(state.getSettings());
    }

    public GameSnapshotDTO snapshot(String sessionId, GameState state) {
        return GameSnapshotDTO.fromState(sessionId, state);
    }

    private void checkPlayable(GameState state, String action) {
        if (state.isOver()) {
            throw new IllegalOperationException("Cannot " + action + ": game is already " + state.getStatus());
        }
    }

    private Coordinate checkBounds(GameState state, int row, int col) {
        Board board = state.getBoard();
        if (!board.contains(row, col)) {
            throw new InvalidCoordinateException(row, col, board.getRows(), board.getColumns());
        }
        return new Coordinate(row, col);
    }
}
