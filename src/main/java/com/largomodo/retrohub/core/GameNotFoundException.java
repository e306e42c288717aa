package com.largomodo.retrohub.core;

/**
 * Thrown when an operation names a game ID that is not in the library.
 */
public class GameNotFoundException extends Exception {

    private final String gameId;

    public GameNotFoundException(String gameId) {
        super("Game not found: " + gameId);
        this.gameId = gameId;
    }

    public String getGameId() {
        return gameId;
    }
}
