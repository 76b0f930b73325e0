package com.bank.mulegraph.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "graph")
public class GraphFeatureConfig {

    private Community community = new Community();

    private Proximity proximity = new Proximity();

    private Batch batch = new Batch();

    private Query query = new Query();

    // Thresholds for the risk signals attached to an evaluation
    private Risk risk = new Risk();

    @Data
    public static class Community {
        // Modularity resolution (gamma). Higher values favour smaller communities.
        private double resolution = 1.0;
        // Minimum modularity gain for a hierarchy level to count as an improvement
        private double tolerance = 1e-7;
        private int maxPasses = 10;
        private int maxLevels = 10;
    }

    @Data
    public static class Proximity {
        private int maxDepth = 10;
    }

    @Data
    public static class Batch {
        private boolean enabled = true;
        private long refreshMs = 3_600_000;
        private long initialDelayMs = 5_000;
        // Node count at or above which passes and BFS levels run on parallel streams
        private int parallelThreshold = 10_000;
    }

    @Data
    public static class Query {
        // Recompute diversity from the graph store per request instead of reading the snapshot
        private boolean realtimeDiversity = true;
        private int maxNetworkNodes = 200;
    }

    @Data
    public static class Risk {
        private double muleDensityThreshold = 0.2;
        private double lowDiversityRatio = 0.1;
        private int lowDiversityMinTransactions = 50;
        private double topCounterpartyShareThreshold = 0.5;
        private int proximityHops = 1;
    }
}
