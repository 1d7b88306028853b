package org.minesolver.model;

public enum GameStatus {
    RUNNING,
    WON,
    LOST,
    /** le solveur n'a plus rien à révéler ni à marquer */
    STALLED,
    /** budget de tours épuisé ou arrêt demandé de l'extérieur */
    CANCELLED,
    /** les contraintes accumulées n'ont plus de solution */
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
