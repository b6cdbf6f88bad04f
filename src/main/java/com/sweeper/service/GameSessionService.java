package com.sweeper.service;

import com.sweeper.config.LevelLoader;
import com.sweeper.dto.CreateGameRequest;
import com.sweeper.dto.GameSnapshotDTO;
import com.sweeper.exception.ConfigurationException;
import com.sweeper.exception.GameNotFoundException;
import com.sweeper.exception.ValidationFailedException;
import com.sweeper.model.FlagOutcome;
import com.sweeper.model.GameSettings;
import com.sweeper.model.GameState;
import com.sweeper.model.RevealOutcome;
import com.sweeper.model.ValidationResult;
import com.sweeper.persistence.SavedGame;
import com.sweeper.persistence.SavedGameCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of game sessions and entry point for every move.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameSessionService {

    private final GameEngine gameEngine;
    private final BoardValidator boardValidator;
    private final LevelLoader levelLoader;
    private final SavedGameCodec savedGameCodec;
    private final List<CellObserver> observers;
    private final Clock clock;

    private final Map<String, GameSession> sessions = new ConcurrentHashMap<>();

    @Value("${sweeper.default-level:classic}")
    private String defaultLevel;

    @Value("${sweeper.session.idle-timeout-ms:1800000}")
    private long idleTimeoutMs;

    /**
     * Create a new session.
     *
     * @throws ValidationFailedException if a test-mode layout breaks a structural rule
     * @throws ConfigurationException    if the settings cannot produce a board
     */
    public GameSession createSession(CreateGameRequest request) {
        GameSettings settings = resolveSettings(request);
        GameState state = gameEngine.newGame(settings);
        GameSession session = register(state);
        log.info("Created session {}: {}x{} board, {} mines, {} treasure(s){}", session.getId(),
                settings.rows(), settings.columns(), state.getBoard().getMineCount(),
                state.getBoard().getTreasureCount(), settings.isFixed() ? " (fixed layout)" : "");
        return session;
    }

    GameSettings resolveSettings(CreateGameRequest request) {
        if (request.hasLayout()) {
            ValidationResult result = boardValidator.validate(request.getLayout());
            if (!result.isOk()) {
                log.warn("Rejected test layout: {}", result.getMessage());
                throw new ValidationFailedException(result);
            }
            return GameSettings.fixed(result.getLayout());
        }
        if (request.hasExplicitSize()) {
            if (request.getRows() == null || request.getColumns() == null || request.getMines() == null) {
                throw new ConfigurationException("Rows, columns and mines are required for a custom board");
            }
            return GameSettings.random(request.getRows(), request.getColumns(), request.getMines(), request.getTreasures());
        }
        String levelId = request.getLevelId() != null && !request.getLevelId().isBlank()
                ? request.getLevelId() : defaultLevel;
        return levelLoader.getSettings(levelId);
    }

    /**
     * Get a session by id.
     *
     * @throws GameNotFoundException if no such session exists
     */
    public GameSession getSession(String sessionId) {
        GameSession session = sessions.get(sessionId);
        if (session == null) {
            throw new GameNotFoundException(sessionId);
        }
        return session;
    }

    public List<GameSnapshotDTO> getAllSnapshots() {
        return sessions.values().stream()
                .map(GameSession::snapshot)
                .toList();
    }

    public RevealOutcome reveal(String sessionId, int row, int col) {
        return getSession(sessionId).reveal(row, col);
    }

    public FlagOutcome toggleFlag(String sessionId, int row, int col) {
        return getSession(sessionId).toggleFlag(row, col);
    }

    public GameSnapshotDTO restart(String sessionId) {
        return getSession(sessionId).restart();
    }

    public GameSnapshotDTO snapshot(String sessionId) {
        return getSession(sessionId).snapshot();
    }

    public void removeSession(String sessionId) {
        if (sessions.remove(sessionId) == null) {
            throw new GameNotFoundException(sessionId);
        }
        log.info("Removed session {}", sessionId);
    }

    public SavedGame save(String sessionId) {
        return getSession(sessionId).read(savedGameCodec::toSavedGame);
    }

    /**
     * Start a new session from a saved game.
     *
     * @throws ConfigurationException if the saved game is inconsistent
     */
    public GameSession restore(SavedGame savedGame) {
        GameState state = savedGameCodec.fromSavedGame(savedGame);
        GameSession session = register(state);
        log.info("Restored session {} ({} at {} revealed cell(s))", session.getId(), state.getStatus(), state.getClickedCount());
        return session;
    }

    /**
     * Drops sessions that have seen no move, restart or save for longer than
     * {@code sweeper.session.idle-timeout-ms}. Finished games are kept until then
     * so they can still be restarted or saved.
     */
    @Scheduled(fixedDelayString = "${sweeper.session.sweep-interval-ms:60000}")
    public void evictIdleSessions() {
        evictIdleSessions(clock.instant());
    }

    int evictIdleSessions(Instant now) {
        Instant cutoff = now.minus(Duration.ofMillis(idleTimeoutMs));
        int before = sessions.size();
        sessions.values().removeIf(session -> session.getLastActivity().isBefore(cutoff));
        int evicted = before - sessions.size();
        if (evicted > 0) {
            log.info("Evicted {} idle session(s), {} remaining", evicted, sessions.size());
        }
        return evicted;
    }

    private GameSession register(GameState state) {
        String id = UUID.randomUUID().toString();
        GameSession session = new GameSession(id, state, gameEngine, observers, clock);
        sessions.put(id, session);
        return session;
    }
}
