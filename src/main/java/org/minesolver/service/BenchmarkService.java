package org.minesolver.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.minesolver.config.SolverProperties;
import org.minesolver.dto.BenchmarkResponse;
import org.minesolver.exception.InferenceInconsistencyException;
import org.minesolver.model.GameSettings;
import org.minesolver.model.GameStatus;
import org.minesolver.service.game.GameOrchestrator;
import org.minesolver.service.game.SolverGame;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Joue une série de parties à la suite, sans les conserver. Avec une graine
 * la série est reproductible : chaque partie est le plateau suivant tiré du
 * même générateur.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BenchmarkService {

    private final GameOrchestrator orchestrator;
    private final SolverProperties properties;

    public BenchmarkResponse run(GameSettings settings, int games) {
        if (games < 1) throw new IllegalArgumentException("At least one game is required");

        long t0 = System.currentTimeMillis();
        Map<GameStatus, Integer> outcomes = new EnumMap<>(GameStatus.class);
        long totalRounds = 0;
        SolverGame game = new SolverGame("benchmark-" + t0, settings, properties.getObjective(), properties.getEpsilon());

        for (int i = 0; i < games; i++) {
            if (i > 0) game.restart();
            GameStatus status;
            try {
                status = orchestrator.run(game, properties.getMaxRounds());
            } catch (InferenceInconsistencyException ex) {
                status = game.getStatus(); // FAILED, déjà journalisé par l'orchestrateur
            }
            outcomes.merge(status, 1, Integer::sum);
            totalRounds += game.getRounds();
            log.info("Game {}/{}: {} in {} rounds, {} safe cells left",
                    i + 1, games, status, game.getRounds(), game.getBoard().getRemainingSafeCells());
        }

        int won = outcomes.getOrDefault(GameStatus.WON, 0);
        Map<String, Integer> byName = new LinkedHashMap<>();
        outcomes.forEach((k, v) -> byName.put(k.name(), v));
        long duration = System.currentTimeMillis() - t0;
        log.info("Benchmark {}x{} / {} mines: won {} of {} games in {} ms",
                settings.getColumns(), settings.getRows(), settings.getMines(), won, games, duration);

        return BenchmarkResponse.builder()
                .games(games)
                .won(won)
                .winRate((double) won / games)
                .averageRounds((double) totalRounds / games)
                .durationMs(duration)
                .outcomes(byName)
                .build();
    }
}
