package com.sweeper.websocket;

import com.sweeper.dto.CellDTO;
import com.sweeper.dto.GameSnapshotDTO;
import com.sweeper.model.GameStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for GameWebSocketHandler.
 */
@ExtendWith(MockitoExtension.class)
class GameWebSocketHandlerTest {

    @Mock private SimpMessagingTemplate messagingTemplate;

    private GameWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GameWebSocketHandler(messagingTemplate);
    }

    private GameWebSocketHandler.GameMessage captureMessage(String expectedDestination) {
        ArgumentCaptor<Object> msgCaptor = ArgumentCaptor.forClass(Object.class);
        verify(messagingTemplate).convertAndSend(eq(expectedDestination), msgCaptor.capture());
        return (GameWebSocketHandler.GameMessage) msgCaptor.getValue();
    }

    private static CellDTO cell(int row, int col, boolean flagged) {
        return CellDTO.builder().row(row).col(col).flagged(flagged).adjacentMineCount(0).build();
    }

    @Nested
    @DisplayName("observer callbacks")
    class ObserverTests {

        @Test
        @DisplayName("revealed cells go to the game topic")
        void shouldSendRevealedCells() {
            List<CellDTO> cells = List.of(cell(0, 0, false), cell(0, 1, false));

            handler.onCellsRevealed("game-1", cells);

            GameWebSocketHandler.GameMessage msg = captureMessage("/topic/game/game-1");
            assertEquals("CELLS_REVEALED", msg.getType());
            assertEquals(cells, msg.getPayload());
            assertTrue(msg.getTimestamp() > 0);
        }

        @Test
        @DisplayName("flag change carries the cell and the flag count")
        void shouldSendFlagChange() {
            CellDTO flagged = cell(3, 4, true);

            handler.onFlagChanged("game-1", flagged, 2);

            GameWebSocketHandler.GameMessage msg = captureMessage("/topic/game/game-1");
            assertEquals("FLAG_CHANGED", msg.getType());
            GameWebSocketHandler.FlagChangeMessage payload = (GameWebSocketHandler.FlagChangeMessage) msg.getPayload();
            assertSame(flagged, payload.getCell());
            assertEquals(2, payload.getFlagCount());
        }

        @Test
        @DisplayName("game over carries the final status")
        void shouldSendGameOver() {
            handler.onGameOver("game-2", GameStatus.LOST);

            GameWebSocketHandler.GameMessage msg = captureMessage("/topic/game/game-2");
            assertEquals("GAME_OVER", msg.getType());
            assertEquals(GameStatus.LOST, msg.getPayload());
        }

        @Test
        @DisplayName("restart carries the fresh snapshot")
        void shouldSendRestart() {
            GameSnapshotDTO snapshot = GameSnapshotDTO.builder().sessionId("game-1").status(GameStatus.NOT_STARTED).build();

            handler.onRestarted("game-1", snapshot);

            GameWebSocketHandler.GameMessage msg = captureMessage("/topic/game/game-1");
            assertEquals("GAME_RESTARTED", msg.getType());
            assertSame(snapshot, msg.getPayload());
        }
    }

    @Nested
    @DisplayName("broadcastError()")
    class BroadcastErrorTests {

        @Test
        @DisplayName("should send error message to game topic via STOMP")
        void shouldSendErrorViaSTOMP() {
            handler.broadcastError("game-1", "Coordinate (9,9) is outside the 8x8 board");

            GameWebSocketHandler.GameMessage msg = captureMessage("/topic/game/game-1");
            assertEquals("ERROR", msg.getType());
            assertEquals("Coordinate (9,9) is outside the 8x8 board", msg.getPayload());
        }

        @Test
        @DisplayName("should not propagate broker failures")
        void shouldSwallowSendFailure() {
            doThrow(new MessagingException("broker down"))
                    .when(messagingTemplate).convertAndSend(anyString(), any(Object.class));

            assertDoesNotThrow(() -> handler.broadcastError("game-1", "boom"));
        }
    }
}
