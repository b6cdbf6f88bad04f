package com.sweeper.model;

/**
 * Lifecycle of a single game. {@link #WON} and {@link #LOST} are terminal.
 */
public enum GameStatus {
    NOT_STARTED,
    IN_PROGRESS,
    WON,
    LOST;

    public boolean isOver() {
        return this == WON || this == LOST;
    }
}
