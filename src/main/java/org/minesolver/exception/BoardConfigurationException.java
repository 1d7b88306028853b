package org.minesolver.exception;

/** Dimensions et nombre de mines qui ne donnent pas de plateau valide. */
public class BoardConfigurationException extends IllegalArgumentException {

    public BoardConfigurationException(String message) {
        super(message);
    }
}
