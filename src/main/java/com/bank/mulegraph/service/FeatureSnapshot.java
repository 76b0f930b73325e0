package com.bank.mulegraph.service;

import com.bank.mulegraph.engine.projection.ProjectedGraph;
import com.bank.mulegraph.exception.UnknownAccountException;
import com.bank.mulegraph.model.AccountFeatures;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * One committed generation of per-account features, immutable once built. Also keeps the projection
 * and mule set it was computed from, for on-demand proximity and community views.
 */
public final class FeatureSnapshot {

    private static final FeatureSnapshot EMPTY =
            new FeatureSnapshot(0L, Instant.EPOCH, Map.of(), null, Set.of(), List.of());

    private final long generation;
    private final Instant createdAt;
    private final Map<Long, AccountFeatures> featuresByAccount;
    private final Map<String, Long> accountIdByNumber;
    private final Map<Integer, List<Long>> membersByCommunity;
    private final ProjectedGraph graph;
    private final Set<Long> muleIds;
    private final List<String> warnings;

    public FeatureSnapshot(long generation, Instant createdAt, Map<Long, AccountFeatures> featuresByAccount,
                           ProjectedGraph graph, Set<Long> muleIds, List<String> warnings) {
        this.generation = generation;
        this.createdAt = createdAt;
        this.featuresByAccount = Collections.unmodifiableMap(new TreeMap<>(featuresByAccount));
        this.graph = graph;
        this.muleIds = Collections.unmodifiableSet(new TreeSet<>(muleIds));
        this.warnings = List.copyOf(warnings);

        Map<String, Long> byNumber = new HashMap<>(featuresByAccount.size() * 2);
        Map<Integer, List<Long>> members = new TreeMap<>();
        for (AccountFeatures features : this.featuresByAccount.values()) {
            byNumber.put(features.getAccountNumber(), features.getAccountId());
            if (features.getCommunityId() != null) {
                members.computeIfAbsent(features.getCommunityId(), k -> new ArrayList<>()).add(features.getAccountId());
            }
        }
        this.accountIdByNumber = Collections.unmodifiableMap(byNumber);
        this.membersByCommunity = Collections.unmodifiableMap(members);
    }

    public static FeatureSnapshot empty() {
        return EMPTY;
    }

    public long getGeneration() {
        return generation;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isEmpty() {
        return featuresByAccount.isEmpty();
    }

    public int accountCount() {
        return featuresByAccount.size();
    }

    public Map<Long, AccountFeatures> getFeaturesByAccount() {
        return featuresByAccount;
    }

    public Optional<AccountFeatures> findByAccountNumber(String accountNumber) {
        Long id = accountIdByNumber.get(accountNumber);
        return id == null ? Optional.empty() : Optional.ofNullable(featuresByAccount.get(id));
    }

    /** @throws UnknownAccountException when the account is not part of this generation */
    public AccountFeatures require(String accountNumber) {
        return findByAccountNumber(accountNumber)
                .orElseThrow(() -> new UnknownAccountException(accountNumber));
    }

    public boolean isConfirmedMule(long accountId) {
        return muleIds.contains(accountId);
    }

    public List<Long> membersOf(int communityId) {
        return membersByCommunity.getOrDefault(communityId, List.of());
    }

    /** Null for the empty snapshot. */
    public ProjectedGraph getGraph() {
        return graph;
    }

    public Set<Long> getMuleIds() {
        return muleIds;
    }

    public List<String> getWarnings() {
        return warnings;
    }
}
