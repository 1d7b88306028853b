package org.minesolver.service.solver;

import org.minesolver.model.Cell;

import java.util.List;

/** Cases à révéler et cases à marquer pour un tour. */
public record Decision(List<Cell> reveal, List<Cell> flag) {

    public Decision {
        reveal = List.copyOf(reveal);
        flag = List.copyOf(flag);
    }

    public static Decision revealOnly(Cell cell) {
        return new Decision(List.of(cell), List.of());
    }

    public boolean isEmpty() {
        return reveal.isEmpty() && flag.isEmpty();
    }
}
