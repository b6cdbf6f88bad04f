package com.sweeper.websocket;

import com.sweeper.service.GameSessionService;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Controller;

/**
 * WebSocket controller for moves sent over STOMP. Results reach clients
 * through {@link GameWebSocketHandler}.
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class GameWebSocketController {

    private final GameSessionService sessionService;
    private final GameWebSocketHandler webSocketHandler;

    /**
     * Handle a reveal.
     */
    @MessageMapping("/game/{gameId}/reveal")
    public void handleReveal(@DestinationVariable String gameId, @Payload MoveMessage message) {
        log.debug("Reveal request ({},{}) in game {}", message.getRow(), message.getCol(), gameId);
        try {
            sessionService.reveal(gameId, message.getRow(), message.getCol());
        } catch (RuntimeException e) {
            log.warn("Reveal rejected in game {}: {}", gameId, e.getMessage());
            webSocketHandler.broadcastError(gameId, e.getMessage());
        }
    }

    /**
     * Handle a flag toggle.
     */
    @MessageMapping("/game/{gameId}/flag")
    public void handleFlag(@DestinationVariable String gameId, @Payload MoveMessage message) {
        log.debug("Flag request ({},{}) in game {}", message.getRow(), message.getCol(), gameId);
        try {
            sessionService.toggleFlag(gameId, message.getRow(), message.getCol());
        } catch (RuntimeException e) {
            log.warn("Flag rejected in game {}: {}", gameId, e.getMessage());
            webSocketHandler.broadcastError(gameId, e.getMessage());
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MoveMessage {
        private int row;
        private int col;
    }
}
