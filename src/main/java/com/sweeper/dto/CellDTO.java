package com.sweeper.dto;

import com.sweeper.model.Cell;
import lombok.Builder;
import lombok.Value;

/**
 * Read-only view of one cell.
 */
@Value
@Builder
public class CellDTO {

    int row;
    int col;
    boolean revealed;
    boolean flagged;
    boolean mine;
    boolean treasure;
    int adjacentMineCount;

    public static CellDTO fromCell(Cell cell) {
        return CellDTO.builder()
                .row(cell.getRow())
                .col(cell.getCol())
                .revealed(cell.isRevealed())
                .flagged(cell.isFlagged())
                .mine(cell.isMine())
                .treasure(cell.isTreasure())
                .adjacentMineCount(cell.getAdjacentMineCount())
                .build();
    }
}
