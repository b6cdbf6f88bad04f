package com.sweeper.websocket;

import com.sweeper.dto.CellDTO;
import com.sweeper.dto.GameSnapshotDTO;
import com.sweeper.model.GameStatus;
import com.sweeper.service.CellObserver;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Pushes game events to STOMP subscribers of {@code /topic/game/{sessionId}}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GameWebSocketHandler implements CellObserver {

    static final String TOPIC_PREFIX = "/topic/game/";

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void onCellsRevealed(String sessionId, List<CellDTO> cells) {
        send(sessionId, GameMessage.cellsRevealed(cells));
    }

    @Override
    public void onFlagChanged(String sessionId, CellDTO cell, int flagCount) {
        send(sessionId, GameMessage.flagChanged(new FlagChangeMessage(cell, flagCount)));
    }

    @Override
    public void onGameOver(String sessionId, GameStatus status) {
        send(sessionId, GameMessage.gameOver(status));
    }

    @Override
    public void onRestarted(String sessionId, GameSnapshotDTO snapshot) {
        send(sessionId, GameMessage.gameRestarted(snapshot));
    }

    /**
     * Broadcast an error message to the subscribers of one game.
     */
    public void broadcastError(String sessionId, String error) {
        send(sessionId, GameMessage.error(error));
    }

    private void send(String sessionId, GameMessage message) {
        try {
            messagingTemplate.convertAndSend(TOPIC_PREFIX + sessionId, message);
            log.debug("Broadcast {} for game {}", message.getType(), sessionId);
        } catch (RuntimeException e) {
            log.error("Error broadcasting {} for game {}", message.getType(), sessionId, e);
        }
    }

    /**
     * Generic game message wrapper.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class GameMessage {
        private String type;
        private Object payload;
        private long timestamp;

        public static GameMessage cellsRevealed(List<CellDTO> cells) {
            return of("CELLS_REVEALED", cells);
        }

        public static GameMessage flagChanged(FlagChangeMessage change) {
            return of("FLAG_CHANGED", change);
        }

        public static GameMessage gameOver(GameStatus status) {
            return of("GAME_OVER", status);
        }

        public static GameMessage gameRestarted(GameSnapshotDTO snapshot) {
            return of("GAME_RESTARTED", snapshot);
        }

        public static GameMessage error(String error) {
            return of("ERROR", error);
        }

        private static GameMessage of(String type, Object payload) {
            return GameMessage.builder()
                    .type(type)
                    .payload(payload)
                    .timestamp(System.currentTimeMillis())
                    .build();
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FlagChangeMessage {
        private CellDTO cell;
        private int flagCount;
    }
}
