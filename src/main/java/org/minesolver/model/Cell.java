package org.minesolver.model;

/** Coordonnée dans la grille, à partir de 0 : colonne puis ligne. */
public record Cell(int col, int row) {

    public static Cell of(int col, int row) {
        return new Cell(col, row);
    }
}
