package org.minesolver.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.minesolver.model.Cell;
import org.minesolver.model.Reveal;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RoundResponse {
    private int round;
    private List<Reveal> revealed;
    private List<Cell> flagged;
    private String status;
    private int remainingSafeCells;
    private int flagsRemaining;
}
