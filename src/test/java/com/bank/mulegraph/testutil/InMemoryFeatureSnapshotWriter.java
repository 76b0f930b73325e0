package com.bank.mulegraph.testutil;

import com.bank.mulegraph.model.AccountFeatures;
import com.bank.mulegraph.repository.FeatureSnapshotWriter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class InMemoryFeatureSnapshotWriter implements FeatureSnapshotWriter {

    private final List<Map<Long, AccountFeatures>> commits = new ArrayList<>();
    private long lastGeneration;

    @Override
    public synchronized void commitFeatureSnapshot(long generation, Map<Long, AccountFeatures> features) {
        commits.add(new LinkedHashMap<>(features));
        lastGeneration = generation;
    }

    @Override
    public synchronized long lastCommittedGeneration() {
        return lastGeneration;
    }

    public synchronized List<Map<Long, AccountFeatures>> getCommits() {
        return commits;
    }
}
