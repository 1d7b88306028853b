package org.minesolver.dto;

import lombok.Builder;
import lombok.Data;
import org.minesolver.model.Cell;
import org.minesolver.model.Reveal;

import java.util.List;

@Data
@Builder
public class RoundEvent {
    private String gameId;
    private int round;
    private List<Reveal> revealed; // nombre -1 = mine touchée
    private List<Cell> flagged;
    private int remainingSafeCells;
    private int flagsRemaining;
    private String status;
}
