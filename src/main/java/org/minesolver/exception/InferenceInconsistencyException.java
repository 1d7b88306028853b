package org.minesolver.exception;

/**
 * Les contraintes accumulées n'ont pas de solution. La partie qui les a
 * produites ne peut pas continuer ; seule une nouvelle paire plateau / solveur repart.
 */
public class InferenceInconsistencyException extends IllegalStateException {

    public InferenceInconsistencyException(String message) {
        super(message);
    }

    public InferenceInconsistencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
