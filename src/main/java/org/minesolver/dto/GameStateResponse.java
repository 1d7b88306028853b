package org.minesolver.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class GameStateResponse {
    private String gameId;
    private int columns;
    private int rows;
    private int mines;
    private Long seed;
    private String status;
    private String failure;
    private int rounds;
    private int remainingSafeCells;
    private int flagsRemaining;
    private boolean lost;
    private boolean won;
    private long elapsedSeconds;
    private int constraints;
    // une chaîne par ligne : '#' cachée, 'F' marquée, '*' mine, chiffre = nombre révélé
    private String[] grid;
}
