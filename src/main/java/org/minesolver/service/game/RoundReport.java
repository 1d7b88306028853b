package org.minesolver.service.game;

import org.minesolver.model.Cell;
import org.minesolver.model.GameStatus;
import org.minesolver.model.Reveal;

import java.util.List;

/** Ce qu'un tour a changé sur le plateau. */
public record RoundReport(int round, List<Reveal> revealed, List<Cell> flagged, GameStatus status,
                          int remainingSafeCells, int flagsRemaining) {
}
