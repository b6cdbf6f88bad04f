package com.sweeper.exception;

public class GameNotFoundException extends RuntimeException {

    public GameNotFoundException(String sessionId) {
        super("Game not found: " + sessionId);
    }
}
