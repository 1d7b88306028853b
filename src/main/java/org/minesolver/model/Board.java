package org.minesolver.model;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.security.SecureRandom;
import java.util.*;

/**
 * État d'un plateau : mines, cases révélées et marquées, nombres de voisines
 * et compteurs de victoire / défaite.
 * <p>
 * Le plateau possède son propre générateur. Avec une graine, la suite de
 * plateaux produite par {@link #create()} est reproductible.
 */
@Slf4j
public class Board {

    // E, SE, S, SW, W, NW, N, NE
    static final int[] DCOL = {1, 1, 0, -1, -1, -1, 0, 1};
    static final int[] DROW = {0, 1, 1, 1, 0, -1, -1, -1};

    @Getter private final int columns;
    @Getter private final int rows;
    @Getter private final int mineCount;
    private final Random random;

    private boolean[][] mine;
    private boolean[][] revealed;
    private boolean[][] flagged;
    private int[][] neighborMines;

    @Getter private int remainingSafeCells;
    @Getter private int flagsRemaining;
    @Getter private boolean lost;

    public Board(GameSettings settings) {
        this.columns = settings.getColumns();
        this.rows = settings.getRows();
        this.mineCount = settings.getMines();
        this.random = settings.getSeed() != null ? new Random(settings.getSeed()) : new SecureRandom();
        create();
    }

    /** Remet grilles et compteurs à zéro et pose un nouveau jeu de mines. */
    public void create() {
        mine = new boolean[columns][rows];
        revealed = new boolean[columns][rows];
        flagged = new boolean[columns][rows];
        neighborMines = new int[columns][rows];
        remainingSafeCells = columns * rows - mineCount;
        flagsRemaining = mineCount;
        lost = false;

        List<Cell> candidates = new ArrayList<>(columns * rows);
        for (int c = 0; c < columns; c++) {
            for (int r = 0; r < rows; r++) candidates.add(new Cell(c, r));
        }
        Collections.shuffle(candidates, random);

        int assigned = 0;
        for (Cell cell : candidates) {
            if (assigned == mineCount) break;
            if (GameSettings.inCornerZone(cell.col(), cell.row(), columns, rows)) continue;
            mine[cell.col()][cell.row()] = true;
            assigned++;
        }
        if (assigned < mineCount)
            throw new IllegalStateException("Placed " + assigned + " of " + mineCount + " mines");

        for (int c = 0; c < columns; c++) {
            for (int r = 0; r < rows; r++) {
                if (!mine[c][r]) continue;
                for (int k = 0; k < 8; k++) {
                    int nc = c + DCOL[k], nr = r + DROW[k];
                    if (inBounds(nc, nr)) neighborMines[nc][nr]++;
                }
            }
        }
        log.debug("Created board {}x{} with {} mines", columns, rows, mineCount);
    }

    /**
     * Révèle une case et, si aucune voisine n'est minée, toute la zone de zéros
     * autour d'elle avec sa bordure numérotée.
     *
     * @return chaque case découverte avec son nombre, ou une seule entrée
     * {@link Reveal#LOSS} si la case était une mine ; vide si rien n'a changé
     */
    public List<Reveal> reveal(int col, int row) {
        checkBounds(col, row);
        if (lost || revealed[col][row] || flagged[col][row]) return List.of();

        if (mine[col][row]) {
            lost = true;
            log.debug("Mine revealed at ({}, {})", col, row);
            return List.of(Reveal.loss(col, row));
        }

        List<Reveal> out = new ArrayList<>();
        Deque<Cell> pending = new ArrayDeque<>();
        expose(col, row, out, pending);

        while (!pending.isEmpty()) {
            Cell cur = pending.pop();
            for (int k = 0; k < 8; k++) {
                int nc = cur.col() + DCOL[k], nr = cur.row() + DROW[k];
                if (!inBounds(nc, nr)) continue;
                if (revealed[nc][nr] || flagged[nc][nr] || mine[nc][nr]) continue;
                expose(nc, nr, out, pending);
            }
        }
        return out;
    }

    // marquée avant d'être empilée : une case partagée par deux zéros n'est révélée qu'une fois
    private void expose(int col, int row, List<Reveal> out, Deque<Cell> pending) {
        revealed[col][row] = true;
        remainingSafeCells--;
        int count = neighborMines[col][row];
        out.add(new Reveal(col, row, count));
        if (count == 0) pending.push(new Cell(col, row));
    }

    /** Pose ou retire le drapeau sur une case cachée. */
    public void flag(int col, int row) {
        checkBounds(col, row);
        if (lost || revealed[col][row]) return;
        flagged[col][row] = !flagged[col][row];
        flagsRemaining += flagged[col][row] ? -1 : 1;
    }

    public boolean hasWon() {
        return remainingSafeCells == 0;
    }

    public boolean isMine(int col, int row) {
        checkBounds(col, row);
        return mine[col][row];
    }

    public boolean isRevealed(int col, int row) {
        checkBounds(col, row);
        return revealed[col][row];
    }

    public boolean isFlagged(int col, int row) {
        checkBounds(col, row);
        return flagged[col][row];
    }

    public int neighborMineCount(int col, int row) {
        checkBounds(col, row);
        return neighborMines[col][row];
    }

    public List<Cell> mineCells() {
        List<Cell> out = new ArrayList<>(mineCount);
        for (int c = 0; c < columns; c++) {
            for (int r = 0; r < rows; r++) {
                if (mine[c][r]) out.add(new Cell(c, r));
            }
        }
        return out;
    }

    public boolean inBounds(int col, int row) {
        return col >= 0 && row >= 0 && col < columns && row < rows;
    }

    private void checkBounds(int col, int row) {
        if (!inBounds(col, row))
            throw new IndexOutOfBoundsException(
                    "Cell (" + col + ", " + row + ") outside " + columns + "x" + rows + " board");
    }
}
