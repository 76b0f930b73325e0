package com.bank.mulegraph.service;

import com.bank.mulegraph.config.GraphFeatureConfig;
import com.bank.mulegraph.config.MetricsConfig;
import com.bank.mulegraph.engine.CancellationToken;
import com.bank.mulegraph.engine.community.CommunityDetectionResult;
import com.bank.mulegraph.engine.community.CommunityDetector;
import com.bank.mulegraph.engine.community.LouvainParameters;
import com.bank.mulegraph.engine.density.DensityAggregator;
import com.bank.mulegraph.engine.diversity.DiversityCalculator;
import com.bank.mulegraph.engine.projection.ProjectedGraph;
import com.bank.mulegraph.engine.projection.ProjectionBuilder;
import com.bank.mulegraph.engine.proximity.ProximityEngine;
import com.bank.mulegraph.exception.BatchAlreadyRunningException;
import com.bank.mulegraph.exception.BatchCancelledException;
import com.bank.mulegraph.exception.ConcurrentMutationConflictException;
import com.bank.mulegraph.exception.GraphLoadException;
import com.bank.mulegraph.model.Account;
import com.bank.mulegraph.model.AccountFeatures;
import com.bank.mulegraph.model.AccountLabel;
import com.bank.mulegraph.model.BatchRunResult;
import com.bank.mulegraph.model.BatchStatus;
import com.bank.mulegraph.model.CommunityDensity;
import com.bank.mulegraph.model.DiversityMetrics;
import com.bank.mulegraph.model.ProximityResult;
import com.bank.mulegraph.model.TransactionEdge;
import com.bank.mulegraph.repository.FeatureSnapshotWriter;
import com.bank.mulegraph.repository.GraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Recomputes every account's graph features from a full read of the graph store and publishes
 * them as a new snapshot generation.
 *
 * A run is all-or-nothing: if loading fails, the store changes underneath it, or it is cancelled,
 * nothing is committed and the previous generation stays live. At most one run executes at a time.
 */
@Service
public class GraphFeatureBatchService {

    private static final Logger log = LoggerFactory.getLogger(GraphFeatureBatchService.class);

    private final GraphStore graphStore;
    private final FeatureSnapshotWriter snapshotWriter;
    private final FeatureStore featureStore;
    private final ProjectionBuilder projectionBuilder;
    private final CommunityDetector communityDetector;
    private final DensityAggregator densityAggregator;
    private final ProximityEngine proximityEngine;
    private final DiversityCalculator diversityCalculator;
    private final GraphFeatureConfig config;
    private final MetricsConfig metricsConfig;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile CancellationToken activeToken;
    private volatile BatchRunResult lastResult;

    public GraphFeatureBatchService(GraphStore graphStore,
                                    FeatureSnapshotWriter snapshotWriter,
                                    FeatureStore featureStore,
                                    ProjectionBuilder projectionBuilder,
                                    CommunityDetector communityDetector,
                                    DensityAggregator densityAggregator,
                                    ProximityEngine proximityEngine,
                                    DiversityCalculator diversityCalculator,
                                    GraphFeatureConfig config,
                                    MetricsConfig metricsConfig) {
        this.graphStore = graphStore;
        this.snapshotWriter = snapshotWriter;
        this.featureStore = featureStore;
        this.projectionBuilder = projectionBuilder;
        this.communityDetector = communityDetector;
        this.densityAggregator = densityAggregator;
        this.proximityEngine = proximityEngine;
        this.diversityCalculator = diversityCalculator;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @Scheduled(initialDelayString = "${graph.batch.initial-delay-ms:5000}",
            fixedDelayString = "${graph.batch.refresh-ms:3600000}")
    public void scheduledRun() {
        if (!config.getBatch().isEnabled()) {
            return;
        }
        try {
            runBatch();
        } catch (BatchAlreadyRunningException e) {
            log.info("Skipping scheduled graph feature run: {}", e.getMessage());
        }
    }

    /**
     * Runs the full pipeline synchronously on the calling thread.
     *
     * @throws BatchAlreadyRunningException if another run is in progress
     */
    public BatchRunResult runBatch() {
        if (!running.compareAndSet(false, true)) {
            throw new BatchAlreadyRunningException();
        }
        CancellationToken token = new CancellationToken();
        activeToken = token;

        Instant start = Instant.now();
        List<String> warnings = new ArrayList<>();
        BatchRunResult.BatchRunResultBuilder result = BatchRunResult.builder()
                .startedAt(start.toEpochMilli())
                .warnings(warnings);
        log.info("Starting graph feature batch run");

        try {
            long generation = execute(token, result, warnings);
            result.status(BatchStatus.COMPLETED).generation(generation);
        } catch (BatchCancelledException e) {
            log.warn("Graph feature batch run cancelled: {}", e.getMessage());
            result.status(BatchStatus.CANCELLED).errorMessage(e.getMessage());
        } catch (ConcurrentMutationConflictException e) {
            log.warn("Graph feature batch run discarded: {}", e.getMessage());
            result.status(BatchStatus.CONFLICT).errorMessage(e.getMessage());
        } catch (GraphLoadException e) {
            log.error("Graph feature batch run failed to load graph: {}", e.getMessage());
            result.status(BatchStatus.FAILED).errorMessage(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Graph feature batch run failed", e);
            result.status(BatchStatus.FAILED).errorMessage(e.getMessage());
        } finally {
            activeToken = null;
            running.set(false);
        }

        Duration elapsed = Duration.between(start, Instant.now());
        BatchRunResult finished = result.durationMs(elapsed.toMillis()).build();
        lastResult = finished;
        metricsConfig.recordBatchRun(finished.getStatus().name(), elapsed);
        log.info("Graph feature batch run finished with status {} in {}ms",
                finished.getStatus(), finished.getDurationMs());
        return finished;
    }

    /** @return true if a run was in progress and has been asked to stop */
    public boolean cancel() {
        CancellationToken token = activeToken;
        if (token == null) {
            return false;
        }
        token.cancel();
        log.info("Cancellation requested for running graph feature batch");
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    /** Null until the first run finishes. */
    public BatchRunResult getLastResult() {
        return lastResult;
    }

    private long execute(CancellationToken token, BatchRunResult.BatchRunResultBuilder result,
                         List<String> warnings) {
        long markerAtStart = graphStore.snapshotMarker();
        List<Account> accounts = graphStore.loadAccounts();
        List<TransactionEdge> edges = graphStore.loadTransactionEdges();
        result.accountCount(accounts.size()).transactionEdgeCount(edges.size());
        token.throwIfCancelled("load");

        ProjectedGraph graph = projectionBuilder.build(accounts, edges);
        result.projectedEdgeCount(graph.edgeCount());
        token.throwIfCancelled("projection");

        CommunityDetectionResult communities =
                communityDetector.detect(graph, LouvainParameters.from(config.getCommunity()), token);
        result.communityCount(communities.communityCount()).convergenceReached(communities.convergenceReached());
        if (!communities.convergenceReached()) {
            warnings.add("Community detection stopped at its pass or level limit; best partition found was used");
        }

        Map<Long, Set<AccountLabel>> labels = new HashMap<>(accounts.size() * 2);
        Set<Long> muleIds = new TreeSet<>();
        for (Account account : accounts) {
            labels.put(account.getAccountId(), account.getLabels() == null ? Set.of() : account.getLabels());
            if (account.isConfirmedMule()) {
                muleIds.add(account.getAccountId());
            }
        }
        if (muleIds.isEmpty()) {
            warnings.add("No confirmed mules in the graph; proximity is null for every account");
        }
        Map<Long, CommunityDensity> density = densityAggregator.computeDensity(communities.communityByAccount(), labels);
        token.throwIfCancelled("density");

        Map<Long, ProximityResult> proximity = proximityEngine.computeProximity(
                graph, muleIds, config.getProximity().getMaxDepth(), false, token);

        Map<Long, DiversityMetrics> diversity = diversityCalculator.computeAll(labels.keySet(), edges, token);

        Map<Long, AccountFeatures> features = assemble(accounts, density, proximity, diversity);

        long markerAtEnd = graphStore.snapshotMarker();
        if (markerAtEnd != markerAtStart) {
            throw new ConcurrentMutationConflictException(markerAtStart, markerAtEnd);
        }
        token.throwIfCancelled("commit");

        long generation = Math.max(featureStore.current().getGeneration(), snapshotWriter.lastCommittedGeneration()) + 1;
        snapshotWriter.commitFeatureSnapshot(generation, features);
        featureStore.swap(new FeatureSnapshot(generation, Instant.now(), features, graph, muleIds, warnings));

        log.info("Committed feature generation {}: {} accounts, {} projected edges, {} communities (modularity {})",
                generation, features.size(), graph.edgeCount(), communities.communityCount(),
                String.format("%.4f", communities.modularity()));
        return generation;
    }

    private Map<Long, AccountFeatures> assemble(List<Account> accounts,
                                                Map<Long, CommunityDensity> density,
                                                Map<Long, ProximityResult> proximity,
                                                Map<Long, DiversityMetrics> diversity) {
        Map<Long, AccountFeatures> features = new LinkedHashMap<>(accounts.size() * 2);
        for (Account account : accounts) {
            long id = account.getAccountId();
            AccountFeatures.AccountFeaturesBuilder builder = AccountFeatures.builder()
                    .accountId(id)
                    .accountNumber(account.getAccountNumber());

            CommunityDensity community = density.get(id);
            if (community != null) {
                builder.communityId(community.communityId())
                        .communitySize(community.communitySize())
                        .muleCount(community.muleCount())
                        .muleDensity(community.muleDensity());
            }

            ProximityResult nearest = proximity.get(id);
            if (nearest != null && nearest.isReached()) {
                builder.distanceToMule(nearest.distanceToMule())
                        .nearestMuleId(nearest.nearestMuleId())
                        .nearestMuleAccountNumber(nearest.nearestMuleAccountNumber())
                        .tiedMuleAccountNumbers(nearest.tiedMuleAccountNumbers());
            }

            DiversityMetrics metrics = diversity.getOrDefault(id, DiversityMetrics.EMPTY);
            builder.uniqueCounterparties(metrics.uniqueCounterparties())
                    .totalTransactions(metrics.totalTransactions())
                    .diversityRatio(metrics.diversityRatio())
                    .topCounterpartyShare(metrics.topCounterpartyShare());

            features.put(id, builder.build());
        }
        return features;
    }
}
