package org.minesolver.model;

/**
 * Case découverte, telle que renvoyée par {@link Board#reveal(int, int)}.
 * Un nombre égal à {@link #LOSS} signifie que la case était une mine.
 */
public record Reveal(int col, int row, int count) {

    public static final int LOSS = -1;

    public static Reveal loss(int col, int row) {
        return new Reveal(col, row, LOSS);
    }

    public boolean isLoss() {
        return count == LOSS;
    }

    public Cell cell() {
        return new Cell(col, row);
    }
}
