package com.bank.mulegraph.engine.diversity;

import com.bank.mulegraph.config.GraphFeatureConfig;
import com.bank.mulegraph.engine.CancellationToken;
import com.bank.mulegraph.model.DiversityMetrics;
import com.bank.mulegraph.model.TransactionEdge;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Counterparty diversity of an account.
 *
 * Only transactions between two accounts count, and never self-transfers. Each qualifying edge adds
 * one occurrence of the other party, so counts are per transaction, not per counterparty.
 * The same per-account routine serves real-time requests and the batch sweep.
 */
@Component
public class DiversityCalculator {

    private final GraphFeatureConfig config;

    public DiversityCalculator(GraphFeatureConfig config) {
        this.config = config;
    }

    public DiversityMetrics computeDiversity(long accountId, Iterable<TransactionEdge> edges) {
        Map<Long, Integer> occurrences = new HashMap<>();
        int total = 0;
        for (TransactionEdge edge : edges) {
            if (!edge.isAccountToAccount()) continue;
            long counterparty;
            if (edge.getPerformerId() == accountId && edge.getBeneficiaryId() != accountId) {
                counterparty = edge.getBeneficiaryId();
            } else if (edge.getBeneficiaryId() == accountId && edge.getPerformerId() != accountId) {
                counterparty = edge.getPerformerId();
            } else {
                continue;
            }
            occurrences.merge(counterparty, 1, Integer::sum);
            total++;
        }

        if (total == 0) {
            return DiversityMetrics.EMPTY;
        }
        int top = Collections.max(occurrences.values());
        return new DiversityMetrics(occurrences.size(), total,
                (double) occurrences.size() / total, (double) top / total);
    }

    /**
     * Batch mode: the per-account routine over every account, in parallel for large inputs.
     * The edge collection is only read.
     */
    public Map<Long, DiversityMetrics> computeAll(Collection<Long> accountIds, Collection<TransactionEdge> edges,
                                                  CancellationToken token) {
        token.throwIfCancelled("diversity indexing");
        Map<Long, List<TransactionEdge>> edgesByAccount = indexByAccount(edges);

        Stream<Long> ids = accountIds.stream();
        if (accountIds.size() >= config.getBatch().getParallelThreshold()) {
            ids = ids.parallel();
        }
        Map<Long, DiversityMetrics> results = new ConcurrentHashMap<>(accountIds.size() * 2);
        ids.forEach(id -> results.put(id,
                computeDiversity(id, edgesByAccount.getOrDefault(id, Collections.emptyList()))));

        token.throwIfCancelled("diversity computation");
        return new TreeMap<>(results);
    }

    static Map<Long, List<TransactionEdge>> indexByAccount(Collection<TransactionEdge> edges) {
        Map<Long, List<TransactionEdge>> index = new HashMap<>();
        for (TransactionEdge edge : edges) {
            if (!edge.isAccountToAccount() || edge.getPerformerId() == edge.getBeneficiaryId()) continue;
            index.computeIfAbsent(edge.getPerformerId(), k -> new ArrayList<>()).add(edge);
            index.computeIfAbsent(edge.getBeneficiaryId(), k -> new ArrayList<>()).add(edge);
        }
        return index;
    }
}
