package org.mides.delivery.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "optimizer")
public class OptimizerConfiguration {
    private int executorThreads = 10;
    private Genetic genetic = new Genetic();
    private ConstraintSolver constraintSolver = new ConstraintSolver();

    @Data
    public static class Genetic {
        private int generations = 100;
        private int populationSize = 50;
        private double mutationRate = 0.1;
        private int eliteSize = 5;
        private int tournamentSize = 5;
        /* Unset means a fresh random source per run */
        private Long seed;
    }

    @Data
    public static class ConstraintSolver {
        private long timeLimitSeconds = 1;
    }
}
