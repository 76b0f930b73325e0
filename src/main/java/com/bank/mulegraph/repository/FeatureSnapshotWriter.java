package com.bank.mulegraph.repository;

import com.bank.mulegraph.model.AccountFeatures;

import java.util.Map;

/**
 * Persists a computed feature snapshot for consumers outside this service.
 */
public interface FeatureSnapshotWriter {

    void commitFeatureSnapshot(long generation, Map<Long, AccountFeatures> featuresByAccount);

    /** Highest generation committed so far, 0 when none. */
    long lastCommittedGeneration();
}
