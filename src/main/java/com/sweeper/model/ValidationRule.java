package com.sweeper.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Structural rules a fixed test layout must satisfy, in evaluation order.
 */
@Getter
@RequiredArgsConstructor
public enum ValidationRule {
    SHAPE("The board must have exactly 8 rows of exactly 8 values each"),
    VALUES("Every value must be 0 (empty), 1 (mine) or 2 (treasure)"),
    MINE_COUNT("The board must contain exactly 10 mines"),
    ROW_COVERAGE("Every row must contain at least one mine"),
    COLUMN_COVERAGE("Every column must contain at least one mine"),
    DIAGONAL("Exactly one mine must lie on the main diagonal"),
    ORTHOGONAL_PAIR("Exactly one pair of mines must be horizontally or vertically adjacent"),
    TREASURE_COUNT("The board must contain at least 1 and at most 9 treasures");

    private final String message;
}
