package org.minesolver.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class BenchmarkRequest extends GameStartRequest {

    @Min(1) @Max(1000)
    private int games = 10;
}
