package org.minesolver.service.game;

import lombok.Getter;
import lombok.Setter;
import org.minesolver.model.Board;
import org.minesolver.model.GameSettings;
import org.minesolver.model.GameStatus;
import org.minesolver.service.solver.ConstraintSolver;
import org.minesolver.service.solver.RelaxationObjective;

import java.time.Instant;

/**
 * Un plateau et le solveur qui le joue. Les deux sont créés ensemble et
 * remplacés ensemble par {@link #restart()} ; rien ne passe d'une partie à l'autre.
 */
@Getter
public class SolverGame {

    private final String id;
    private final GameSettings settings;
    private final RelaxationObjective objective;
    private final double epsilon;
    private final Instant createdAt = Instant.now();

    private Board board;
    private ConstraintSolver solver;
    @Setter private GameStatus status;
    @Setter private String failure;
    @Setter private Instant lastActiveAt = Instant.now();
    private int rounds;
    private Instant startedAt;
    private Instant finishedAt;

    public SolverGame(String id, GameSettings settings, RelaxationObjective objective, double epsilon) {
        this.id = id;
        this.settings = settings;
        this.objective = objective;
        this.epsilon = epsilon;
        reset(new Board(settings), newSolver());
    }

    SolverGame(String id, GameSettings settings, Board board, ConstraintSolver solver) {
        this.id = id;
        this.settings = settings;
        this.objective = solver.getObjective();
        this.epsilon = solver.getEpsilon();
        reset(board, solver);
    }

    /** Plateau suivant du même générateur, solveur neuf. */
    public void restart() {
        board.create();
        reset(board, newSolver());
    }

    private ConstraintSolver newSolver() {
        return new ConstraintSolver(settings.getColumns(), settings.getRows(), settings.getMines(), objective, epsilon);
    }

    private void reset(Board b, ConstraintSolver s) {
        this.board = b;
        this.solver = s;
        this.status = GameStatus.RUNNING;
        this.failure = null;
        this.rounds = 0;
        this.startedAt = Instant.now();
        this.finishedAt = null;
        this.lastActiveAt = startedAt;
    }

    void roundPlayed() {
        rounds++;
        lastActiveAt = Instant.now();
    }

    void finish(GameStatus terminal) {
        status = terminal;
        finishedAt = Instant.now();
    }

    public boolean isFinished() {
        return status.isTerminal();
    }

    /** Secondes depuis le début du plateau courant, figées à la fin de la partie. */
    public long elapsedSeconds() {
        Instant end = finishedAt != null ? finishedAt : Instant.now();
        return end.getEpochSecond() - startedAt.getEpochSecond();
    }
}
