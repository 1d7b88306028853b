package org.minesolver.service.solver;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.minesolver.exception.InferenceInconsistencyException;
import org.minesolver.model.Cell;
import org.ojalgo.optimisation.Expression;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.optimisation.Variable;

import java.util.*;

/**
 * Moteur d'inférence. Chaque case porte une variable continue dans [0, 1], lue
 * comme la probabilité qu'elle cache une mine. Les nombres révélés deviennent
 * des égalités linéaires, et chaque {@link #decide()} résout de nouveau la
 * relaxation pour choisir les cases à révéler et à marquer.
 * <p>
 * Limite connue : une case cachée, ni cliquée ni marquée, dont l'estimation n'a
 * pas bougé depuis la résolution précédente est révélée aussitôt. Une
 * estimation stable est prise pour une case que rien ne contraint, ce qui ne
 * prouve pas qu'elle soit sûre.
 */
@Slf4j
public class ConstraintSolver {

    public static final double DEFAULT_EPSILON = 1e-6;
    private static final int UNKNOWN = -1;
    private static final int FREE = -1;

    @Getter private final int columns;
    @Getter private final int rows;
    @Getter private final int mineCount;
    @Getter private final RelaxationObjective objective;
    @Getter private final double epsilon;

    private final ConstraintLog constraints = new ConstraintLog();
    private final double[][] estimate;
    private final double[][] previousEstimate;
    private final int[][] knownCount;
    private final Set<Cell> clicked = new LinkedHashSet<>();
    private final Set<Cell> flagged = new LinkedHashSet<>();

    @Getter private int solveCount;

    public ConstraintSolver(int columns, int rows, int mineCount) {
        this(columns, rows, mineCount, RelaxationObjective.CENTERED, DEFAULT_EPSILON);
    }

    public ConstraintSolver(int columns, int rows, int mineCount, RelaxationObjective objective, double epsilon) {
        if (columns < 1 || rows < 1) throw new IllegalArgumentException("Invalid board size " + columns + "x" + rows);
        if (mineCount < 0 || mineCount > columns * rows) throw new IllegalArgumentException("Invalid mine count " + mineCount);
        if (epsilon <= 0) throw new IllegalArgumentException("Epsilon must be positive");
        this.columns = columns;
        this.rows = rows;
        this.mineCount = mineCount;
        this.objective = Objects.requireNonNull(objective, "objective");
        this.epsilon = epsilon;

        this.estimate = new double[columns][rows];
        this.previousEstimate = new double[columns][rows];
        this.knownCount = new int[columns][rows];
        double density = (double) mineCount / (columns * rows);
        List<Cell> all = new ArrayList<>(columns * rows);
        for (int c = 0; c < columns; c++) {
            Arrays.fill(estimate[c], density);
            Arrays.fill(previousEstimate[c], density);
            Arrays.fill(knownCount[c], UNKNOWN);
            for (int r = 0; r < rows; r++) all.add(new Cell(c, r));
        }
        constraints.append(new LinearConstraint(all, mineCount, null));
    }

    /**
     * Résout la relaxation et choisit les cases à jouer.
     * <ul>
     *     <li>la première case non décidée (colonne par colonne) dont l'estimation
     *     a bougé de moins d'epsilon est renvoyée seule, à révéler ;</li>
     *     <li>sinon toutes les cases non décidées à epsilon près de l'estimation
     *     minimale sont révélées, et toute case non marquée à epsilon près de 1
     *     est marquée.</li>
     * </ul>
     * Une case est décidée dès qu'elle a été cliquée ou marquée. Les cases à 1
     * ne passent que par le marquage. Une case renvoyée ne l'est plus jamais.
     *
     * @throws InferenceInconsistencyException si les contraintes n'ont pas de solution
     */
    public Decision decide() {
        double[][] next = solve();

        List<Cell> lowest = new ArrayList<>();
        List<Cell> certain = new ArrayList<>();
        double min = 1;
        Cell settled = null;

        scan:
        for (int c = 0; c < columns; c++) {
            for (int r = 0; r < rows; r++) {
                Cell cell = new Cell(c, r);
                double x = next[c][r];
                boolean mine = Math.abs(x - 1) < epsilon;
                if (!clicked.contains(cell) && !flagged.contains(cell) && !mine) {
                    if (Math.abs(x - previousEstimate[c][r]) < epsilon) {
                        settled = cell;
                        break scan;
                    }
                    if (x < min) {
                        min = x;
                        lowest.clear();
                        lowest.add(cell);
                        continue;
                    } else if (Math.abs(x - min) < epsilon) {
                        lowest.add(cell);
                        continue;
                    }
                }
                if (!flagged.contains(cell) && mine) certain.add(cell);
            }
        }

        for (int c = 0; c < columns; c++) {
            System.arraycopy(next[c], 0, estimate[c], 0, rows);
            System.arraycopy(next[c], 0, previousEstimate[c], 0, rows);
        }

        if (settled != null) {
            clicked.add(settled);
            log.debug("Solve #{}: ({}, {}) unchanged, revealing it", solveCount, settled.col(), settled.row());
            return Decision.revealOnly(settled);
        }

        clicked.addAll(lowest);
        flagged.addAll(certain);
        log.debug("Solve #{}: min estimate {}, {} to reveal, {} to flag", solveCount, min, lowest.size(), certain.size());
        return new Decision(lowest, certain);
    }

    /**
     * Enregistre le nombre affiché par une case révélée : ses voisines encore
     * non cliquées portent {@code mineCount} mines et la case elle-même aucune.
     * Un voisinage vide est enregistré tel quel ({@code 0 = n}) et laissé à la
     * prochaine résolution.
     */
    public void addConstraint(int col, int row, int mineCount) {
        checkBounds(col, row);
        if (mineCount < 0 || mineCount > 8)
            throw new IllegalArgumentException("Neighbour count out of range: " + mineCount);
        if (knownCount[col][row] != UNKNOWN && knownCount[col][row] != mineCount)
            throw new IllegalStateException("Cell (" + col + ", " + row + ") already known with count "
                    + knownCount[col][row] + ", got " + mineCount);

        Cell origin = new Cell(col, row);
        List<Cell> neighbours = new ArrayList<>(8);
        for (int c = col - 1; c <= col + 1; c++) {
            for (int r = row - 1; r <= row + 1; r++) {
                if (c == col && r == row) continue;
                if (c < 0 || r < 0 || c >= columns || r >= rows) continue;
                Cell n = new Cell(c, r);
                if (!clicked.contains(n)) neighbours.add(n);
            }
        }
        if (neighbours.isEmpty() && mineCount > 0)
            log.debug("Cell ({}, {}) reports {} mines with no undecided neighbour", col, row, mineCount);

        constraints.append(new LinearConstraint(neighbours, mineCount, origin));
        constraints.append(new LinearConstraint(List.of(origin), 0, origin));
        knownCount[col][row] = mineCount;
    }

    /*
     * Le journal reste intact ; seul le modèle est simplifié :
     *  - somme = 0 ou somme = nombre de cases : bornes fixées sur les variables ;
     *  - égalités identiques : une seule ligne.
     */
    private double[][] solve() {
        int[][] pinned = new int[columns][rows];
        for (int[] col : pinned) Arrays.fill(col, FREE);
        List<LinearConstraint> equalities = new ArrayList<>();
        Map<Set<Cell>, Integer> seen = new HashMap<>();

        for (LinearConstraint lc : constraints.entries()) {
            int size = lc.cells().size();
            if (lc.total() > size)
                throw inconsistent(lc.total() + " mines required among " + size + " cells", lc);
            if (lc.total() == 0 || lc.total() == size) {
                int value = lc.total() == 0 ? 0 : 1;
                for (Cell cell : lc.cells()) pin(pinned, cell, value, lc);
                continue;
            }
            Integer known = seen.putIfAbsent(new HashSet<>(lc.cells()), lc.total());
            if (known == null) equalities.add(lc);
            else if (known != lc.total())
                throw inconsistent("same cells counted " + known + " and " + lc.total(), lc);
        }

        solveCount++;
        Optimisation.Result result = null;
        try {
            result = optimise(objective, pinned, equalities);
        } catch (RuntimeException ex) {
            if (objective != RelaxationObjective.CENTERED)
                throw new InferenceInconsistencyException("Solver aborted on " + constraints.size() + " constraints", ex);
            log.warn("Solve #{}: quadratic model aborted ({})", solveCount, ex.getMessage());
        }

        // le QP peut échouer numériquement sur un modèle faisable : on retente en LP
        if (objective == RelaxationObjective.CENTERED && (result == null || !result.getState().isFeasible())) {
            log.warn("Solve #{}: quadratic model returned {}, retrying as a linear program",
                    solveCount, result == null ? "nothing" : result.getState());
            try {
                result = optimise(RelaxationObjective.FEASIBILITY, pinned, equalities);
            } catch (RuntimeException ex) {
                throw new InferenceInconsistencyException("Solver aborted on " + constraints.size() + " constraints", ex);
            }
        }

        if (!result.getState().isFeasible()) {
            log.warn("Solve #{} failed with state {} over {} constraints", solveCount, result.getState(), constraints.size());
            throw new InferenceInconsistencyException("No feasible mine layout for " + constraints.size()
                    + " constraints (solver state " + result.getState() + ")");
        }

        double[][] next = new double[columns][rows];
        for (int c = 0; c < columns; c++) {
            for (int r = 0; r < rows; r++) {
                double v = result.doubleValue(c * rows + r);
                next[c][r] = Math.max(0, Math.min(1, v));
            }
        }
        return next;
    }

    private Optimisation.Result optimise(RelaxationObjective goal, int[][] pinned, List<LinearConstraint> equalities) {
        ExpressionsBasedModel model = new ExpressionsBasedModel();
        Variable[][] x = new Variable[columns][rows];
        for (int c = 0; c < columns; c++) {
            for (int r = 0; r < rows; r++) {
                Variable v = Variable.make("x_" + c + "_" + r);
                if (pinned[c][r] == FREE) v.lower(0).upper(1);
                else v.lower(pinned[c][r]).upper(pinned[c][r]);
                model.addVariable(v);
                x[c][r] = v;
            }
        }

        for (int i = 0; i < equalities.size(); i++) {
            LinearConstraint lc = equalities.get(i);
            Expression e = model.addExpression("c" + i).level(lc.total());
            for (Cell cell : lc.cells()) e.set(x[cell.col()][cell.row()], 1);
        }

        if (goal == RelaxationObjective.CENTERED) {
            // (x - p)^2 = x^2 - 2px + p^2, le terme constant ne déplace pas l'optimum
            Expression distance = model.addExpression("distance").weight(1);
            for (int c = 0; c < columns; c++) {
                for (int r = 0; r < rows; r++) {
                    distance.set(x[c][r], x[c][r], 1);
                    distance.set(x[c][r], -2 * previousEstimate[c][r]);
                }
            }
            return model.minimise();
        }
        return model.maximise();
    }

    private void pin(int[][] pinned, Cell cell, int value, LinearConstraint source) {
        int current = pinned[cell.col()][cell.row()];
        if (current != FREE && current != value)
            throw inconsistent("cell (" + cell.col() + ", " + cell.row() + ") must be both 0 and 1", source);
        pinned[cell.col()][cell.row()] = value;
    }

    private InferenceInconsistencyException inconsistent(String reason, LinearConstraint lc) {
        String from = lc.origin() == null ? "mine total" : "cell (" + lc.origin().col() + ", " + lc.origin().row() + ")";
        log.warn("Inconsistent constraints from {}: {}", from, reason);
        return new InferenceInconsistencyException("No feasible mine layout: " + reason + " (from " + from + ")");
    }

    public double estimate(int col, int row) {
        checkBounds(col, row);
        return estimate[col][row];
    }

    /** Nombre affiché par la case, ou -1 tant qu'il est inconnu. */
    public int knownCount(int col, int row) {
        checkBounds(col, row);
        return knownCount[col][row];
    }

    public Set<Cell> clickedCells() {
        return Collections.unmodifiableSet(clicked);
    }

    public Set<Cell> flaggedCells() {
        return Collections.unmodifiableSet(flagged);
    }

    public List<LinearConstraint> constraints() {
        return constraints.entries();
    }

    public int constraintCount() {
        return constraints.size();
    }

    private void checkBounds(int col, int row) {
        if (col < 0 || row < 0 || col >= columns || row >= rows)
            throw new IndexOutOfBoundsException(
                    "Cell (" + col + ", " + row + ") outside " + columns + "x" + rows + " board");
    }
}
