package org.minesolver.service.solver;

/**
 * Objectif donné à l'optimiseur. Les contraintes portent toute l'information,
 * l'objectif choisit seulement quel point admissible est renvoyé.
 */
public enum RelaxationObjective {

    /**
     * Minimise la distance au carré à l'estimation précédente : la solution du
     * tour précédent projetée sur l'ensemble admissible courant.
     */
    CENTERED,

    /** Maximise zéro et garde le point admissible trouvé par l'optimiseur. */
    FEASIBILITY
}
