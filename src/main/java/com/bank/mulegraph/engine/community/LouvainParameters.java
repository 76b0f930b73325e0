package com.bank.mulegraph.engine.community;

import com.bank.mulegraph.config.GraphFeatureConfig;

/**
 * Tuning knobs of one community detection run.
 *
 * @param resolution modularity resolution (gamma), must be positive
 * @param tolerance  minimum modularity gain for a hierarchy level to count as progress
 * @param maxPasses  local-moving sweeps per level
 * @param maxLevels  aggregation levels
 */
public record LouvainParameters(double resolution, double tolerance, int maxPasses, int maxLevels) {

    public LouvainParameters {
        if (!(resolution > 0)) {
            throw new IllegalArgumentException("resolution must be > 0, got " + resolution);
        }
        if (tolerance < 0) {
            throw new IllegalArgumentException("tolerance must be >= 0, got " + tolerance);
        }
        if (maxPasses < 1 || maxLevels < 1) {
            throw new IllegalArgumentException("maxPasses and maxLevels must be >= 1");
        }
    }

    public static LouvainParameters from(GraphFeatureConfig.Community community) {
        return new LouvainParameters(community.getResolution(), community.getTolerance(),
                community.getMaxPasses(), community.getMaxLevels());
    }

    public static LouvainParameters defaults() {
        return from(new GraphFeatureConfig.Community());
    }
}
