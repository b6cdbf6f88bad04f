package com.sweeper.model;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Run-time state of one game: the board plus counters and status.
 * <p>
 * A game state is never reset. Restarting builds a new instance from the
 * same {@link GameSettings}.
 */
@Getter
@ToString(exclude = "board")
public class GameState {

    private final Board board;
    private final GameSettings settings;

    /** Cells revealed so far, explicit and cascaded. */
    private int clickedCount;
    private int flagCount;
    private Instant startedAt;
    private GameStatus status = GameStatus.NOT_STARTED;

    public GameState(Board board, GameSettings settings) {
        this.board = board;
        this.settings = settings;
    }

    /**
     * Rebuilds a state from persisted counters. The board must already carry
     * its restored cell state.
     */
    public static GameState restore(Board board, GameSettings settings, int clickedCount, int flagCount,
                                    Instant startedAt, GameStatus status) {
        GameState state = new GameState(board, settings);
        state.clickedCount = clickedCount;
        state.flagCount = flagCount;
        state.startedAt = startedAt;
        state.status = status;
        return state;
    }

    public boolean isOver() {
        return status.isOver();
    }

    public boolean isAllSafeCellsRevealed() {
        return clickedCount == board.getSafeCellCount();
    }

    public void recordReveal() {
        clickedCount++;
    }

    public void adjustFlagCount(int delta) {
        flagCount += delta;
    }

    public void start(Instant now) {
        if (status != GameStatus.NOT_STARTED) {
            throw new IllegalStateException("Game already started");
        }
        startedAt = now;
        status = GameStatus.IN_PROGRESS;
    }

    public void finish(GameStatus result) {
        if (!result.isOver()) {
            throw new IllegalArgumentException("Not a terminal status: " + result);
        }
        status = result;
    }
}
