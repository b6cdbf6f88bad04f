package com.sweeper.dto;

import com.sweeper.model.Board;
import com.sweeper.model.GameState;
import com.sweeper.model.GameStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Immutable view of a whole game for presentation adapters.
 * Cells are listed in row-major order.
 */
@Value
@Builder
public class GameSnapshotDTO {

    String sessionId;
    int rows;
    int columns;
    boolean fixedLayout;
    List<CellDTO> cells;
    int flagCount;
    int mineCount;
    int treasureCount;
    int clickedCount;
    GameStatus status;
    Instant startedAt;

    public static GameSnapshotDTO fromState(String sessionId, GameState state) {
        Board board = state.getBoard();
        return GameSnapshotDTO.builder()
                .sessionId(sessionId)
                .rows(board.getRows())
                .columns(board.getColumns())
                .fixedLayout(board.isFixedLayout())
                .cells(board.cells().stream().map(CellDTO::fromCell).toList())
                .flagCount(state.getFlagCount())
                .mineCount(board.getMineCount())
                .treasureCount(board.getTreasureCount())
                .clickedCount(state.getClickedCount())
                .status(state.getStatus())
                .startedAt(state.getStartedAt())
                .build();
    }

    public CellDTO cellAt(int row, int col) {
        return cells.get(row * columns + col);
    }
}
