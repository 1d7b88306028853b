package org.minesolver.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.minesolver.exception.BoardConfigurationException;

/**
 * Dimensions, nombre de mines et graine optionnelle, validés à la construction.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class GameSettings {

    private final int columns;
    private final int rows;
    private final int mines;
    private final Long seed; // null -> plateau non reproductible

    public GameSettings(int columns, int rows, int mines, Long seed) {
        if (columns < 1 || rows < 1)
            throw new BoardConfigurationException("Invalid board size " + columns + "x" + rows);
        if (mines < 0)
            throw new BoardConfigurationException("Mine count must be positive or zero: " + mines);
        int eligible = eligibleCells(columns, rows);
        if (mines > eligible)
            throw new BoardConfigurationException(
                    "Too many mines (" + mines + ") for a " + columns + "x" + rows
                            + " board, only " + eligible + " cells lie outside the corner zones");
        this.columns = columns;
        this.rows = rows;
        this.mines = mines;
        this.seed = seed;
    }

    public GameSettings(int columns, int rows, int mines) {
        this(columns, rows, mines, null);
    }

    public int cellCount() {
        return columns * rows;
    }

    public int safeCellCount() {
        return columns * rows - mines;
    }

    /** Le bloc 2x2 de chacun des quatre coins ne contient jamais de mine. */
    public static boolean inCornerZone(int col, int row, int columns, int rows) {
        boolean edgeCol = col < 2 || col > columns - 3;
        boolean edgeRow = row < 2 || row > rows - 3;
        return edgeCol && edgeRow;
    }

    /** Nombre de cases hors des coins, c.-à-d. où une mine peut être posée. */
    public static int eligibleCells(int columns, int rows) {
        int n = 0;
        for (int c = 0; c < columns; c++) {
            for (int r = 0; r < rows; r++) {
                if (!inCornerZone(c, r, columns, rows)) n++;
            }
        }
        return n;
    }
}
