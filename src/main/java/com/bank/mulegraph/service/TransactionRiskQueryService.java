package com.bank.mulegraph.service;

import com.bank.mulegraph.config.GraphFeatureConfig;
import com.bank.mulegraph.config.MetricsConfig;
import com.bank.mulegraph.engine.diversity.DiversityCalculator;
import com.bank.mulegraph.engine.projection.ProjectedGraph;
import com.bank.mulegraph.engine.proximity.ProximityEngine;
import com.bank.mulegraph.model.AccountFeatures;
import com.bank.mulegraph.model.CommunityNetwork;
import com.bank.mulegraph.model.DiversityMetrics;
import com.bank.mulegraph.model.DiversitySource;
import com.bank.mulegraph.model.PartyFeatures;
import com.bank.mulegraph.model.ProximityResult;
import com.bank.mulegraph.model.RiskLevel;
import com.bank.mulegraph.model.TransactionRiskEvaluation;
import com.bank.mulegraph.repository.GraphStore;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Read side of the feature pipeline. Serves cached features from the live snapshot and derives risk
 * signals for a transfer between two accounts. Diversity may be recomputed from the store's latest
 * edges; everything else comes from the snapshot.
 */
@Service
public class TransactionRiskQueryService {

    private static final Logger log = LoggerFactory.getLogger(TransactionRiskQueryService.class);

    private final FeatureStore featureStore;
    private final GraphStore graphStore;
    private final DiversityCalculator diversityCalculator;
    private final ProximityEngine proximityEngine;
    private final GraphFeatureConfig config;
    private final MetricsConfig metricsConfig;

    public TransactionRiskQueryService(FeatureStore featureStore,
                                       GraphStore graphStore,
                                       DiversityCalculator diversityCalculator,
                                       ProximityEngine proximityEngine,
                                       GraphFeatureConfig config,
                                       MetricsConfig metricsConfig) {
        this.featureStore = featureStore;
        this.graphStore = graphStore;
        this.diversityCalculator = diversityCalculator;
        this.proximityEngine = proximityEngine;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Features of both parties plus risk signals. Unknown accounts are reported with null features
     * rather than rejected. Both parties are read from the same snapshot generation.
     */
    @Observed(name = "graph.evaluate_transaction", contextualName = "evaluate-transaction")
    public TransactionRiskEvaluation evaluateTransaction(String sourceAccount, String targetAccount) {
        FeatureSnapshot snapshot = featureStore.current();
        PartyFeatures source = resolveParty(snapshot, sourceAccount);
        PartyFeatures target = resolveParty(snapshot, targetAccount);

        List<String> signals = new ArrayList<>();
        RiskLevel level = RiskLevel.LOW;
        level = level.max(assess("Source", source, signals));
        level = level.max(assess("Target", target, signals));

        metricsConfig.recordEvaluation(level.name());
        log.debug("Evaluated {} -> {} against generation {}: {} ({} signals)",
                sourceAccount, targetAccount, snapshot.getGeneration(), level, signals.size());

        return TransactionRiskEvaluation.builder()
                .snapshotGeneration(snapshot.getGeneration())
                .source(source)
                .target(target)
                .riskSignals(signals)
                .riskLevel(level)
                .evaluatedAt(System.currentTimeMillis())
                .build();
    }

    /** @throws com.bank.mulegraph.exception.UnknownAccountException if absent from the live snapshot */
    public AccountFeatures getAccountFeatures(String accountNumber) {
        return featureStore.current().require(accountNumber);
    }

    /**
     * Nearest-mule search for one account over the live snapshot's projection, with a representative path.
     */
    public ProximityResult computeProximityForAccount(String accountNumber) {
        FeatureSnapshot snapshot = featureStore.current();
        AccountFeatures features = snapshot.require(accountNumber);
        ProjectedGraph graph = snapshot.getGraph();
        if (graph == null) {
            return ProximityResult.unreached(features.getAccountId());
        }
        return proximityEngine.computeForAccount(graph, features.getAccountId(), config.getProximity().getMaxDepth());
    }

    /**
     * Members of a community and the projected edges among them, capped at the configured node count.
     *
     * @return null when no account of the live snapshot belongs to the community
     */
    public CommunityNetwork getCommunityNetwork(int communityId) {
        FeatureSnapshot snapshot = featureStore.current();
        List<Long> members = snapshot.membersOf(communityId);
        ProjectedGraph graph = snapshot.getGraph();
        if (members.isEmpty() || graph == null) {
            return null;
        }

        int limit = config.getQuery().getMaxNetworkNodes();
        List<Long> shown = members.size() > limit ? members.subList(0, limit) : members;
        boolean[] included = new boolean[graph.nodeCount()];

        List<CommunityNetwork.NetworkNode> nodes = new ArrayList<>(shown.size());
        for (Long accountId : shown) {
            AccountFeatures features = snapshot.getFeaturesByAccount().get(accountId);
            int node = graph.indexOf(accountId);
            if (node >= 0) {
                included[node] = true;
            }
            nodes.add(CommunityNetwork.NetworkNode.builder()
                    .id(features.getAccountNumber())
                    .label(features.getAccountNumber())
                    .confirmedMule(snapshot.isConfirmedMule(accountId))
                    .distanceToMule(features.getDistanceToMule())
                    .build());
        }

        List<CommunityNetwork.NetworkEdge> edges = new ArrayList<>();
        for (int u = 0; u < included.length; u++) {
            if (!included[u]) continue;
            for (int slot = graph.neighborStart(u); slot < graph.neighborEnd(u); slot++) {
                int v = graph.neighborAt(slot);
                if (v > u && included[v]) {
                    edges.add(CommunityNetwork.NetworkEdge.builder()
                            .from(graph.accountNumber(u))
                            .to(graph.accountNumber(v))
                            .weight(graph.weightAt(slot))
                            .build());
                }
            }
        }

        AccountFeatures first = snapshot.getFeaturesByAccount().get(members.get(0));
        return CommunityNetwork.builder()
                .communityId(communityId)
                .communitySize(members.size())
                .muleCount(first.getMuleCount() == null ? 0 : first.getMuleCount())
                .muleDensity(first.getMuleDensity() == null ? 0.0 : first.getMuleDensity())
                .truncated(shown.size() < members.size())
                .nodes(nodes)
                .edges(edges)
                .build();
    }

    private PartyFeatures resolveParty(FeatureSnapshot snapshot, String accountNumber) {
        Optional<AccountFeatures> cached = snapshot.findByAccountNumber(accountNumber);
        if (cached.isEmpty()) {
            return PartyFeatures.builder()
                    .accountNumber(accountNumber)
                    .known(false)
                    .features(AccountFeatures.builder().accountNumber(accountNumber).build())
                    .build();
        }

        AccountFeatures features = cached.get();
        DiversitySource diversitySource = DiversitySource.SNAPSHOT;
        if (config.getQuery().isRealtimeDiversity()) {
            try {
                DiversityMetrics fresh = diversityCalculator.computeDiversity(features.getAccountId(),
                        graphStore.loadTransactionEdgesFor(features.getAccountId()));
                features = features.toBuilder()
                        .uniqueCounterparties(fresh.uniqueCounterparties())
                        .totalTransactions(fresh.totalTransactions())
                        .diversityRatio(fresh.diversityRatio())
                        .topCounterpartyShare(fresh.topCounterpartyShare())
                        .build();
                diversitySource = DiversitySource.REALTIME;
            } catch (RuntimeException e) {
                log.warn("Real-time diversity failed for {}, serving snapshot values: {}", accountNumber, e.getMessage());
                metricsConfig.recordRealtimeDiversityFallback();
            }
        }

        return PartyFeatures.builder()
                .accountNumber(accountNumber)
                .known(true)
                .confirmedMule(snapshot.isConfirmedMule(features.getAccountId()))
                .features(features)
                .diversitySource(diversitySource)
                .build();
    }

    private RiskLevel assess(String role, PartyFeatures party, List<String> signals) {
        String who = role + " " + party.getAccountNumber();
        if (!party.isKnown()) {
            signals.add(who + " has no graph features yet");
            return RiskLevel.LOW;
        }

        GraphFeatureConfig.Risk risk = config.getRisk();
        AccountFeatures f = party.getFeatures();
        RiskLevel level = RiskLevel.LOW;

        if (party.isConfirmedMule()) {
            signals.add(who + " is a confirmed mule");
            level = level.max(RiskLevel.HIGH);
        }
        if (f.getMuleDensity() != null && f.getMuleDensity() > risk.getMuleDensityThreshold()) {
            signals.add(String.format(Locale.ROOT, "%s sits in community %d with mule density %.4f",
                    who, f.getCommunityId(), f.getMuleDensity()));
            level = level.max(RiskLevel.HIGH);
        }
        if (f.getDistanceToMule() != null && f.getDistanceToMule() > 0
                && f.getDistanceToMule() <= risk.getProximityHops()) {
            signals.add(String.format(Locale.ROOT, "%s is %d hop(s) from mule %s",
                    who, f.getDistanceToMule(), f.getNearestMuleAccountNumber()));
            level = level.max(RiskLevel.HIGH);
        }
        if (f.getDiversityRatio() != null && f.getTotalTransactions() != null
                && f.getDiversityRatio() < risk.getLowDiversityRatio()
                && f.getTotalTransactions() > risk.getLowDiversityMinTransactions()) {
            signals.add(String.format(Locale.ROOT, "%s has low counterparty diversity %.4f over %d transactions",
                    who, f.getDiversityRatio(), f.getTotalTransactions()));
            level = level.max(RiskLevel.HIGH);
        }
        if (f.getTopCounterpartyShare() != null && f.getTopCounterpartyShare() > risk.getTopCounterpartyShareThreshold()) {
            signals.add(String.format(Locale.ROOT, "%s sends or receives %.0f%% of transactions with one counterparty",
                    who, f.getTopCounterpartyShare() * 100));
            level = level.max(RiskLevel.MEDIUM);
        }
        return level;
    }
}
