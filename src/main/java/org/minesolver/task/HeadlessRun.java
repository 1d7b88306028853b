package org.minesolver.task;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.minesolver.config.SolverProperties;
import org.minesolver.dto.BenchmarkResponse;
import org.minesolver.service.BenchmarkService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Joue {@code minesolver.headless.games} parties sur le plateau par défaut une
 * fois l'application démarrée, et journalise le résultat.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "minesolver.headless", name = "enabled", havingValue = "true")
public class HeadlessRun {

    private final BenchmarkService benchmarkService;
    private final SolverProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        BenchmarkResponse res = benchmarkService.run(properties.defaultSettings(), properties.getHeadless().getGames());
        log.info("Headless run: {}/{} won ({}%), {} rounds per game on average, outcomes {}",
                res.getWon(), res.getGames(), Math.round(res.getWinRate() * 100), res.getAverageRounds(), res.getOutcomes());
    }
}
