package org.minesolver.service.game;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.minesolver.config.SolverProperties;
import org.minesolver.exception.GameNotFoundException;
import org.minesolver.model.GameSettings;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/** Parties en mémoire, indexées par id. */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameRegistry {

    private final SolverProperties properties;
    private final Map<String, SolverGame> games = new ConcurrentHashMap<>();

    public SolverGame create(GameSettings settings) {
        String id = UUID.randomUUID().toString();
        SolverGame game = new SolverGame(id, settings, properties.getObjective(), properties.getEpsilon());
        games.put(id, game);
        log.debug("Game {} created: {}", id, settings);
        return game;
    }

    public SolverGame get(String id) {
        SolverGame g = games.get(id);
        if (g == null) throw new GameNotFoundException(id);
        return g;
    }

    public Collection<SolverGame> all() {
        return games.values();
    }

    public boolean remove(String id) {
        return games.remove(id) != null;
    }

    /** Oublie les parties terminées inactives depuis plus de {@code ttlMs}. */
    public int evictFinished(long ttlMs) {
        Instant limit = Instant.now().minusMillis(ttlMs);
        int before = games.size();
        games.values().removeIf(g -> g.isFinished() && g.getLastActiveAt().isBefore(limit));
        return before - games.size();
    }
}
