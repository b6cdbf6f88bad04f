package com.sweeper.service;

import com.sweeper.dto.CellDTO;
import com.sweeper.dto.GameSnapshotDTO;
import com.sweeper.model.Board;
import com.sweeper.model.Coordinate;
import com.sweeper.model.FlagOutcome;
import com.sweeper.model.GameState;
import com.sweeper.model.GameStatus;
import com.sweeper.model.RevealOutcome;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Owns one game and is its only mutator.
 * <p>
 * Every operation runs under a single per-session lock, so observers and
 * snapshot readers never see a half-applied move. Restart swaps in a complete
 * new {@link GameState}.
 */
@Slf4j
public class GameSession {

    @Getter
    private final String id;

    @Getter
    private final Instant createdAt;

    private final GameEngine engine;
    private final List<CellObserver> observers;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private GameState state;

    /** Time of the last move, restart or save. Guarded by {@code lock}. */
    private Instant lastActivity;

    public GameSession(String id, GameState state, GameEngine engine, List<CellObserver> observers, Clock clock) {
        this.id = id;
        this.state = state;
        this.engine = engine;
        this.observers = List.copyOf(observers);
        this.clock = clock;
        this.createdAt = clock.instant();
        this.lastActivity = createdAt;
    }

    public Instant getLastActivity() {
        lock.lock();
        try {
            return lastActivity;
        } finally {
            lock.unlock();
        }
    }

    public RevealOutcome reveal(int row, int col) {
        lock.lock();
        try {
            lastActivity = clock.instant();
            RevealOutcome outcome = engine.reveal(state, row, col);
            if (!outcome.isNoOp()) {
                Board board = state.getBoard();
                List<CellDTO> cells = outcome.getRevealedCells().stream()
                        .map(c -> CellDTO.fromCell(board.getCell(c)))
                        .toList();
                notifyObservers(o -> o.onCellsRevealed(id, cells));
                if (state.isOver()) {
                    GameStatus status = state.getStatus();
                    notifyObservers(o -> o.onGameOver(id, status));
                }
            }
            return outcome;
        } finally {
            lock.unlock();
        }
    }

    public FlagOutcome toggleFlag(int row, int col) {
        lock.lock();
        try {
            lastActivity = clock.instant();
            FlagOutcome outcome = engine.toggleFlag(state, row, col);
            if (outcome.isChanged()) {
                Coordinate coordinate = outcome.getCoordinate();
                CellDTO cell = CellDTO.fromCell(state.getBoard().getCell(coordinate));
                notifyObservers(o -> o.onFlagChanged(id, cell, outcome.getFlagCount()));
            }
            return outcome;
        } finally {
            lock.unlock();
        }
    }

    public GameSnapshotDTO restart() {
        lock.lock();
        try {
            lastActivity = clock.instant();
            GameState fresh = engine.restart(state);
            state = fresh;
            GameSnapshotDTO snapshot = engine.snapshot(id, fresh);
            log.info("Session {} restarted ({} layout)", id, fresh.getBoard().isFixedLayout() ? "fixed" : "random");
            notifyObservers(o -> o.onRestarted(id, snapshot));
            return snapshot;
        } finally {
            lock.unlock();
        }
    }

    public GameSnapshotDTO snapshot() {
        lock.lock();
        try {
            return engine.snapshot(id, state);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code reader} against the current state while holding the session lock.
     * The state is live, so only collaborators in this package get to see it.
     */
    <T> T read(Function<GameState, T> reader) {
        lock.lock();
        try {
            lastActivity = clock.instant();
            return reader.apply(state);
        } finally {
            lock.unlock();
        }
    }

    private void notifyObservers(Consumer<CellObserver> event) {
        for (CellObserver observer : observers) {
            try {
                event.accept(observer);
            } catch (RuntimeException e) {
                log.error("Observer {} failed for session {}", observer.getClass().getSimpleName(), id, e);
            }
        }
    }
}
