package org.minesolver.task;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.minesolver.config.SolverProperties;
import org.minesolver.service.game.GameRegistry;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class FinishedGameCleanup {

    private final GameRegistry registry;
    private final SolverProperties properties;

    // toutes les minutes
    @Scheduled(fixedDelay = 60_000)
    public void evict() {
        int removed = registry.evictFinished(properties.getFinishedTtlMs());
        if (removed > 0) log.debug("Evicted {} finished games", removed);
    }
}
