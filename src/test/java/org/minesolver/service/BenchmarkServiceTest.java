package org.minesolver.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.minesolver.config.SolverProperties;
import org.minesolver.dto.BenchmarkResponse;
import org.minesolver.model.GameSettings;
import org.minesolver.service.game.GameEventPublisher;
import org.minesolver.service.game.GameOrchestrator;
import org.mockito.Mockito;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class BenchmarkServiceTest {

    BenchmarkService service;

    @BeforeEach
    void setup() {
        GameOrchestrator orchestrator = new GameOrchestrator(Mockito.mock(GameEventPublisher.class));
        service = new BenchmarkService(orchestrator, new SolverProperties());
    }

    @Test
    void run_countsOutcomes() {
        BenchmarkResponse res = service.run(new GameSettings(5, 5, 0, 3L), 3);

        assertThat(res.getGames()).isEqualTo(3);
        assertThat(res.getWon()).isEqualTo(3);
        assertThat(res.getWinRate()).isEqualTo(1.0);
        assertThat(res.getAverageRounds()).isEqualTo(1.0);
        assertThat(res.getOutcomes()).isEqualTo(Map.of("WON", 3));
    }

    @Test
    void run_seededSeries_endsEveryGameWonOrLost() {
        BenchmarkResponse res = service.run(new GameSettings(9, 9, 10, 10L), 3);

        assertThat(res.getOutcomes().values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(3);
        assertThat(res.getOutcomes().keySet()).isSubsetOf("WON", "LOST");
        assertThat(res.getWon()).isEqualTo(res.getOutcomes().getOrDefault("WON", 0));
    }

    @Test
    void run_requiresAtLeastOneGame() {
        assertThatThrownBy(() -> service.run(new GameSettings(5, 5, 1), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
