package com.bank.mulegraph.service;

import com.bank.mulegraph.config.MetricsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the live feature snapshot. Readers take the current reference and never block; a batch run
 * publishes a complete new generation with a single atomic swap.
 */
@Component
public class FeatureStore {

    private static final Logger log = LoggerFactory.getLogger(FeatureStore.class);

    private final AtomicReference<FeatureSnapshot> current = new AtomicReference<>(FeatureSnapshot.empty());
    private final MetricsConfig metricsConfig;

    public FeatureStore(MetricsConfig metricsConfig) {
        this.metricsConfig = metricsConfig;
    }

    public FeatureSnapshot current() {
        return current.get();
    }

    /**
     * Publishes a snapshot. Generations must strictly increase.
     *
     * @return the snapshot that was replaced
     */
    public FeatureSnapshot swap(FeatureSnapshot next) {
        FeatureSnapshot previous;
        do {
            previous = current.get();
            if (next.getGeneration() <= previous.getGeneration()) {
                throw new IllegalStateException("Snapshot generation " + next.getGeneration()
                        + " is not newer than live generation " + previous.getGeneration());
            }
        } while (!current.compareAndSet(previous, next));

        metricsConfig.recordSnapshotSwap(next.getGeneration(), next.accountCount());
        log.info("Feature snapshot generation {} is live ({} accounts, replaced generation {})",
                next.getGeneration(), next.accountCount(), previous.getGeneration());
        return previous;
    }
}
