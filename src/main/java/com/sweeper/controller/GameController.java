package com.sweeper.controller;

import com.sweeper.config.LevelLoader;
import com.sweeper.dto.CreateGameRequest;
import com.sweeper.dto.GameSnapshotDTO;
import com.sweeper.dto.LevelInfoDTO;
import com.sweeper.dto.MoveResultDTO;
import com.sweeper.model.FlagOutcome;
import com.sweeper.model.RevealOutcome;
import com.sweeper.persistence.SavedGame;
import com.sweeper.service.GameSession;
import com.sweeper.service.GameSessionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API controller for game sessions.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
@CrossOrigin(origins = "*")
public class GameController {

    private final GameSessionService sessionService;
    private final LevelLoader levelLoader;

    /**
     * List available levels.
     */
    @GetMapping("/levels")
    public ResponseEntity<List<LevelInfoDTO>> getLevels() {
        List<LevelInfoDTO> levels = levelLoader.getAvailableLevels().stream()
                .map(LevelInfoDTO::fromDefinition)
                .toList();
        return ResponseEntity.ok(levels);
    }

    /**
     * Create a new game.
     */
    @PostMapping("/games")
    public ResponseEntity<GameSnapshotDTO> createGame(@Valid @RequestBody CreateGameRequest request) {
        GameSession session = sessionService.createSession(request);
        return ResponseEntity.ok(session.snapshot());
    }

    /**
     * List all running games.
     */
    @GetMapping("/games")
    public ResponseEntity<List<GameSnapshotDTO>> getGames() {
        return ResponseEntity.ok(sessionService.getAllSnapshots());
    }

    /**
     * Get game details.
     */
    @GetMapping("/games/{gameId}")
    public ResponseEntity<GameSnapshotDTO> getGame(@PathVariable String gameId) {
        return ResponseEntity.ok(sessionService.snapshot(gameId));
    }

    /**
     * Reveal a cell.
     */
    @PostMapping("/games/{gameId}/reveal")
    public ResponseEntity<MoveResultDTO> reveal(@PathVariable String gameId,
                                                @RequestParam int row,
                                                @RequestParam int col) {
        RevealOutcome outcome = sessionService.reveal(gameId, row, col);
        return ResponseEntity.ok(MoveResultDTO.fromReveal(outcome, sessionService.snapshot(gameId)));
    }

    /**
     * Toggle the flag on a cell.
     */
    @PostMapping("/games/{gameId}/flag")
    public ResponseEntity<MoveResultDTO> toggleFlag(@PathVariable String gameId,
                                                    @RequestParam int row,
                                                    @RequestParam int col) {
        FlagOutcome outcome = sessionService.toggleFlag(gameId, row, col);
        return ResponseEntity.ok(MoveResultDTO.fromFlag(outcome, sessionService.snapshot(gameId)));
    }

    /**
     * Restart with the same settings.
     */
    @PostMapping("/games/{gameId}/restart")
    public ResponseEntity<GameSnapshotDTO> restart(@PathVariable String gameId) {
        return ResponseEntity.ok(sessionService.restart(gameId));
    }

    @DeleteMapping("/games/{gameId}")
    public ResponseEntity<Void> deleteGame(@PathVariable String gameId) {
        sessionService.removeSession(gameId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Export the game in its persisted form.
     */
    @GetMapping("/games/{gameId}/save")
    public ResponseEntity<SavedGame> save(@PathVariable String gameId) {
        return ResponseEntity.ok(sessionService.save(gameId));
    }

    /**
     * Start a new session from a persisted game.
     */
    @PostMapping("/games/restore")
    public ResponseEntity<GameSnapshotDTO> restore(@RequestBody SavedGame savedGame) {
        GameSession session = sessionService.restore(savedGame);
        return ResponseEntity.ok(session.snapshot());
    }
}
