package org.minesolver.service.solver;

import org.minesolver.model.Cell;

import java.util.List;

/**
 * La somme des estimations de {@code cells} vaut {@code total}.
 *
 * @param origin case révélée d'où vient la contrainte, null pour le total de mines
 */
public record LinearConstraint(List<Cell> cells, int total, Cell origin) {

    public LinearConstraint {
        cells = List.copyOf(cells);
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }
}
