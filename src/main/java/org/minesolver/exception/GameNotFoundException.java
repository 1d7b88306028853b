package org.minesolver.exception;

public class GameNotFoundException extends RuntimeException {

    public GameNotFoundException(String gameId) {
        super("Unknown game " + gameId);
    }
}
