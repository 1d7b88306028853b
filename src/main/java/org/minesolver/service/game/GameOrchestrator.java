package org.minesolver.service.game;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.minesolver.exception.InferenceInconsistencyException;
import org.minesolver.model.Board;
import org.minesolver.model.Cell;
import org.minesolver.model.GameStatus;
import org.minesolver.model.Reveal;
import org.minesolver.service.solver.ConstraintSolver;
import org.minesolver.service.solver.Decision;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Pilote une partie : demande une décision au solveur, l'applique au plateau
 * et renvoie chaque nombre révélé au solveur. Aucune logique d'inférence ici.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameOrchestrator {

    private final GameEventPublisher events;

    /**
     * Joue un tour.
     *
     * @throws IllegalStateException si la partie est déjà terminée
     * @throws InferenceInconsistencyException si les contraintes du solveur n'ont
     * plus de solution ; la partie passe d'abord en {@link GameStatus#FAILED}
     */
    public RoundReport playRound(SolverGame game) {
        synchronized (game) {
            if (game.isFinished())
                throw new IllegalStateException("Game " + game.getId() + " is already " + game.getStatus());

            Board board = game.getBoard();
            ConstraintSolver solver = game.getSolver();
            List<Reveal> revealed = new ArrayList<>();
            List<Cell> flagged = new ArrayList<>();
            boolean hitMine = false;
            Decision decision;

            try {
                decision = solver.decide();
                reveal:
                for (Cell cell : decision.reveal()) {
                    for (Reveal r : board.reveal(cell.col(), cell.row())) {
                        revealed.add(r);
                        if (r.isLoss()) {
                            hitMine = true;
                            break reveal;
                        }
                        solver.addConstraint(r.col(), r.row(), r.count());
                    }
                }
            } catch (InferenceInconsistencyException ex) {
                game.setFailure(ex.getMessage());
                game.finish(GameStatus.FAILED);
                game.roundPlayed();
                log.warn("Game {} failed in round {}: {}", game.getId(), game.getRounds(), ex.getMessage());
                throw ex;
            }

            if (!hitMine) {
                for (Cell cell : decision.flag()) {
                    board.flag(cell.col(), cell.row());
                    flagged.add(cell);
                }
            }

            if (hitMine) game.finish(GameStatus.LOST);
            else if (board.hasWon()) game.finish(GameStatus.WON);
            else if (decision.isEmpty()) game.finish(GameStatus.STALLED);
            game.roundPlayed();

            RoundReport report = new RoundReport(game.getRounds(), revealed, flagged, game.getStatus(),
                    board.getRemainingSafeCells(), board.getFlagsRemaining());
            log.debug("Game {} round {}: {} revealed, {} flagged, {} safe cells remaining",
                    game.getId(), report.round(), revealed.size(), flagged.size(), board.getRemainingSafeCells());
            if (game.isFinished())
                log.info("Game {} {} after {} rounds", game.getId(), game.getStatus(), game.getRounds());

            events.roundPlayed(game, report);
            return report;
        }
    }

    /**
     * Joue des tours jusqu'à la fin de la partie ou jusqu'à {@code maxRounds}
     * tours joués par cet appel ; la partie est alors annulée.
     */
    public GameStatus run(SolverGame game, int maxRounds) {
        synchronized (game) {
            int played = 0;
            while (!game.isFinished() && played < maxRounds) {
                playRound(game);
                played++;
            }
            if (!game.isFinished()) {
                log.info("Game {} cancelled after {} rounds", game.getId(), played);
                game.finish(GameStatus.CANCELLED);
            }
            return game.getStatus();
        }
    }

    public void cancel(SolverGame game) {
        synchronized (game) {
            if (!game.isFinished()) game.finish(GameStatus.CANCELLED);
        }
    }
}
