package com.sweeper.dto;

import com.sweeper.model.Board;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for creating a new game.
 * <p>
 * Precedence: a fixed {@code layout} text table, then explicit {@code rows}/{@code columns},
 * then a level id (the configured default level when absent).
 * Uses Integer wrappers so Jackson 3 leaves absent fields as null.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateGameRequest {

    private String levelId;

    @Min(value = 1, message = "Rows must be at least 1")
    @Max(value = Board.MAX_DIMENSION, message = "Rows must be at most 100")
    private Integer rows;

    @Min(value = 1, message = "Columns must be at least 1")
    @Max(value = Board.MAX_DIMENSION, message = "Columns must be at most 100")
    private Integer columns;

    @Min(value = 0, message = "Mines must not be negative")
    private Integer mines;

    @Min(value = 1, message = "At least one treasure is required")
    private Integer treasures;

    /** Test-mode layout: 8 lines of 8 comma-separated values. */
    private String layout;

    public boolean hasLayout() {
        return layout != null && !layout.isBlank();
    }

    public boolean hasExplicitSize() {
        return rows != null || columns != null;
    }

    public int getTreasures() {
        return treasures != null ? treasures : 1;
    }
}
