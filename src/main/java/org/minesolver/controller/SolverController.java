package org.minesolver.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.minesolver.config.SolverProperties;
import org.minesolver.dto.BenchmarkRequest;
import org.minesolver.dto.GameStartRequest;
import org.minesolver.exception.GameNotFoundException;
import org.minesolver.model.GameSettings;
import org.minesolver.service.BenchmarkService;
import org.minesolver.service.game.*;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/solver")
@RequiredArgsConstructor
public class SolverController {

    private final GameRegistry registry;
    private final GameOrchestrator orchestrator;
    private final GameViews views;
    private final BenchmarkService benchmarkService;
    private final SolverProperties properties;

    // ==================== DÉMARRER PARTIE ====================
    @PostMapping("/games")
    public ResponseEntity<?> start(@Valid @RequestBody(required = false) GameStartRequest req) {
        try {
            SolverGame game = registry.create(settingsFrom(req));
            return ResponseEntity.ok(views.state(game));
        } catch (RuntimeException ex) {
            return failure(ex);
        }
    }

    @GetMapping("/games")
    public ResponseEntity<?> list() {
        List<Map<String, Object>> out = registry.all().stream()
                .map(g -> Map.<String, Object>of(
                        "gameId", g.getId(),
                        "status", g.getStatus().name(),
                        "rounds", g.getRounds()))
                .toList();
        return ResponseEntity.ok(out);
    }

    @GetMapping("/games/{id}")
    public ResponseEntity<?> state(@PathVariable String id) {
        try {
            return ResponseEntity.ok(views.state(registry.get(id)));
        } catch (RuntimeException ex) {
            return failure(ex);
        }
    }

    // ==================== JOUER ====================
    @PostMapping("/games/{id}/step")
    public ResponseEntity<?> step(@PathVariable String id) {
        try {
            RoundReport report = orchestrator.playRound(registry.get(id));
            return ResponseEntity.ok(views.round(report));
        } catch (RuntimeException ex) {
            return failure(ex);
        }
    }

    @PostMapping("/games/{id}/run")
    public ResponseEntity<?> run(@PathVariable String id, @RequestParam(required = false) Integer maxRounds) {
        try {
            SolverGame game = registry.get(id);
            int budget = maxRounds != null && maxRounds > 0 ? maxRounds : properties.getMaxRounds();
            orchestrator.run(game, budget);
            return ResponseEntity.ok(views.state(game));
        } catch (RuntimeException ex) {
            return failure(ex);
        }
    }

    @PostMapping("/games/{id}/restart")
    public ResponseEntity<?> restart(@PathVariable String id) {
        try {
            SolverGame game = registry.get(id);
            synchronized (game) {
                game.restart();
            }
            return ResponseEntity.ok(views.state(game));
        } catch (RuntimeException ex) {
            return failure(ex);
        }
    }

    @DeleteMapping("/games/{id}")
    public ResponseEntity<?> discard(@PathVariable String id) {
        if (!registry.remove(id)) return failure(new GameNotFoundException(id));
        return ResponseEntity.noContent().build();
    }

    // ==================== BENCHMARK ====================
    @PostMapping("/benchmark")
    public ResponseEntity<?> benchmark(@Valid @RequestBody BenchmarkRequest req) {
        try {
            return ResponseEntity.ok(benchmarkService.run(settingsFrom(req), req.getGames()));
        } catch (RuntimeException ex) {
            return failure(ex);
        }
    }

    private GameSettings settingsFrom(GameStartRequest req) {
        if (req == null) return properties.defaultSettings();
        return new GameSettings(
                req.getColumns() != null ? req.getColumns() : properties.getColumns(),
                req.getRows() != null ? req.getRows() : properties.getRows(),
                req.getMines() != null ? req.getMines() : properties.getMines(),
                req.getSeed() != null ? req.getSeed() : properties.getSeed());
    }

    private ResponseEntity<Map<String, String>> failure(RuntimeException ex) {
        HttpStatus status;
        if (ex instanceof GameNotFoundException) status = HttpStatus.NOT_FOUND;
        else if (ex instanceof IllegalStateException) status = HttpStatus.CONFLICT; // y compris les échecs d'inférence
        else if (ex instanceof IllegalArgumentException || ex instanceof IndexOutOfBoundsException) status = HttpStatus.BAD_REQUEST;
        else throw ex;
        return ResponseEntity.status(status).body(Map.of("error", String.valueOf(ex.getMessage())));
    }
}
