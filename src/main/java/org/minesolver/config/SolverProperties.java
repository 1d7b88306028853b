package org.minesolver.config;

import lombok.Data;
import org.minesolver.model.GameSettings;
import org.minesolver.service.solver.ConstraintSolver;
import org.minesolver.service.solver.RelaxationObjective;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "minesolver")
public class SolverProperties {

    // plateau par défaut quand la requête ne précise pas la géométrie
    private int columns = 30;
    private int rows = 16;
    private int mines = 99;
    private Long seed;

    private double epsilon = ConstraintSolver.DEFAULT_EPSILON;
    private RelaxationObjective objective = RelaxationObjective.CENTERED;

    /** tours autorisés pour un appel /run ou une partie sans rendu */
    private int maxRounds = 10_000;
    /** les parties terminées sont oubliées après ce délai */
    private long finishedTtlMs = 10 * 60 * 1000L;

    private Headless headless = new Headless();

    @Data
    public static class Headless {
        private boolean enabled = false;
        private int games = 10;
    }

    public GameSettings defaultSettings() {
        return new GameSettings(columns, rows, mines, seed);
    }
}
