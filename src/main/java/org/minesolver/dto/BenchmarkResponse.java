package org.minesolver.dto;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class BenchmarkResponse {
    private int games;
    private int won;
    private double winRate;
    private double averageRounds;
    private long durationMs;
    private Map<String, Integer> outcomes; // statut -> nombre de parties
}
