package org.minesolver.service.game;

import org.minesolver.dto.GameStateResponse;
import org.minesolver.dto.RoundResponse;
import org.minesolver.model.Board;
import org.springframework.stereotype.Component;

/** Construit les vues JSON d'une partie. */
@Component
public class GameViews {

    public GameStateResponse state(SolverGame game) {
        synchronized (game) {
            Board b = game.getBoard();
            return GameStateResponse.builder()
                    .gameId(game.getId())
                    .columns(b.getColumns())
                    .rows(b.getRows())
                    .mines(b.getMineCount())
                    .seed(game.getSettings().getSeed())
                    .status(game.getStatus().name())
                    .failure(game.getFailure())
                    .rounds(game.getRounds())
                    .remainingSafeCells(b.getRemainingSafeCells())
                    .flagsRemaining(b.getFlagsRemaining())
                    .lost(b.isLost())
                    .won(b.hasWon())
                    .elapsedSeconds(game.elapsedSeconds())
                    .constraints(game.getSolver().constraintCount())
                    .grid(grid(b))
                    .build();
        }
    }

    public RoundResponse round(RoundReport r) {
        return new RoundResponse(r.round(), r.revealed(), r.flagged(), r.status().name(),
                r.remainingSafeCells(), r.flagsRemaining());
    }

    String[] grid(Board b) {
        String[] lines = new String[b.getRows()];
        for (int r = 0; r < b.getRows(); r++) {
            StringBuilder sb = new StringBuilder(b.getColumns());
            for (int c = 0; c < b.getColumns(); c++) {
                if (b.isRevealed(c, r)) sb.append((char) ('0' + b.neighborMineCount(c, r)));
                else if (b.isLost() && b.isMine(c, r)) sb.append('*');
                else if (b.isFlagged(c, r)) sb.append('F');
                else sb.append('#');
            }
            lines[r] = sb.toString();
        }
        return lines;
    }
}
