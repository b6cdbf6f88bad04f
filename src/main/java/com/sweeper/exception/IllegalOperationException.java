package com.sweeper.exception;

/**
 * Move rejected in the current game state, e.g. after the game is won or lost.
 */
public class IllegalOperationException extends IllegalStateException {

    public IllegalOperationException(String message) {
        super(message);
    }
}
