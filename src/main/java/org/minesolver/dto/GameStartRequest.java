package org.minesolver.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

/** Tout champ laissé à null reprend la valeur configurée. */
@Data
public class GameStartRequest {

    @Min(1) @Max(500)
    private Integer columns;

    @Min(1) @Max(500)
    private Integer rows;

    @Min(0)
    private Integer mines;

    private Long seed;
}
