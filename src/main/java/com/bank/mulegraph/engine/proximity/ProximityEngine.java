package com.bank.mulegraph.engine.proximity;

import com.bank.mulegraph.config.GraphFeatureConfig;
import com.bank.mulegraph.engine.CancellationToken;
import com.bank.mulegraph.engine.projection.ProjectedGraph;
import com.bank.mulegraph.model.ProximityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicIntegerArray;
import java.util.stream.IntStream;

/**
 * Hop distance from every account to the nearest confirmed mule, over the undirected projection.
 *
 * Level-synchronous BFS seeded from all mules at distance 0. Within a level every frontier node
 * claims its unvisited neighbours (first write wins, so a node is assigned exactly once, at its
 * minimal level). Claimed nodes then pull the mule sets of all their neighbours on the previous
 * level, so every mule tied at the minimal distance is kept. The nearest mule is the tied mule with
 * the lowest account number.
 */
@Component
public class ProximityEngine {

    private static final Logger log = LoggerFactory.getLogger(ProximityEngine.class);

    private final GraphFeatureConfig config;

    public ProximityEngine(GraphFeatureConfig config) {
        this.config = config;
    }

    public Map<Long, ProximityResult> computeProximity(ProjectedGraph graph, Collection<Long> muleIds, int maxDepth) {
        return computeProximity(graph, muleIds, maxDepth, false, CancellationToken.none());
    }

    /**
     * @param includePaths also reconstruct one representative path per reached account
     * @return a result for every account of the graph, ordered by account id
     */
    public Map<Long, ProximityResult> computeProximity(ProjectedGraph graph, Collection<Long> muleIds, int maxDepth,
                                                      boolean includePaths, CancellationToken token) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0, got " + maxDepth);
        }
        int n = graph.nodeCount();

        // rank = position of a mule in account-number order; tied sets hold ranks, sorted
        int[] muleByRank = muleIds.stream()
                .distinct()
                .mapToInt(id -> graph.indexOf(id))
                .filter(idx -> idx >= 0)
                .boxed()
                .sorted(Comparator.comparing(graph::accountNumber))
                .mapToInt(Integer::intValue)
                .toArray();
        if (muleByRank.length < muleIds.stream().distinct().count()) {
            log.debug("{} mule ids are not part of the projection and were ignored",
                    muleIds.stream().distinct().count() - muleByRank.length);
        }

        AtomicIntegerArray distance = new AtomicIntegerArray(n);
        for (int v = 0; v < n; v++) {
            distance.set(v, -1);
        }
        int[][] tied = new int[n][];
        int[] parent = new int[n];
        Arrays.fill(parent, -1);

        int[] frontier = new int[muleByRank.length];
        for (int rank = 0; rank < muleByRank.length; rank++) {
            int node = muleByRank[rank];
            distance.set(node, 0);
            tied[node] = new int[]{rank};
            frontier[rank] = node;
        }
        Arrays.sort(frontier);

        boolean parallel = n >= config.getBatch().getParallelThreshold();
        for (int level = 0; level < maxDepth && frontier.length > 0; level++) {
            token.throwIfCancelled("proximity level " + level);
            int nextLevel = level + 1;
            int previousLevel = level;

            IntStream relax = Arrays.stream(frontier);
            if (parallel) relax = relax.parallel();
            int[] reached = relax
                    .flatMap(u -> IntStream.range(graph.neighborStart(u), graph.neighborEnd(u))
                            .map(graph::neighborAt)
                            .filter(v -> distance.compareAndSet(v, -1, nextLevel)))
                    .sorted()
                    .toArray();

            // barrier: every node of this level is claimed before any pulls from the previous one
            IntStream pull = Arrays.stream(reached);
            if (parallel) pull = pull.parallel();
            pull.forEach(v -> settle(graph, v, previousLevel, distance, tied, parent));

            frontier = reached;
        }

        Map<Long, ProximityResult> results = new LinkedHashMap<>(n * 2);
        for (int v = 0; v < n; v++) {
            long accountId = graph.accountId(v);
            int d = distance.get(v);
            if (d < 0) {
                results.put(accountId, ProximityResult.unreached(accountId));
                continue;
            }
            List<String> tiedNumbers = new ArrayList<>(tied[v].length);
            for (int rank : tied[v]) {
                tiedNumbers.add(graph.accountNumber(muleByRank[rank]));
            }
            int nearest = muleByRank[tied[v][0]];
            List<String> path = includePaths ? pathToMule(graph, v, parent) : List.of();
            results.put(accountId, new ProximityResult(accountId, d, graph.accountId(nearest),
                    graph.accountNumber(nearest), List.copyOf(tiedNumbers), path));
        }
        return results;
    }

    private static void settle(ProjectedGraph graph, int v, int previousLevel, AtomicIntegerArray distance,
                               int[][] tied, int[] parent) {
        TreeSet<Integer> ranks = new TreeSet<>();
        for (int e = graph.neighborStart(v); e < graph.neighborEnd(v); e++) {
            int u = graph.neighborAt(e);
            if (distance.get(u) == previousLevel) {
                for (int rank : tied[u]) ranks.add(rank);
            }
        }
        int[] merged = ranks.stream().mapToInt(Integer::intValue).toArray();
        int nearestRank = merged[0];

        int best = -1;
        for (int e = graph.neighborStart(v); e < graph.neighborEnd(v); e++) {
            int u = graph.neighborAt(e);
            if (distance.get(u) == previousLevel && Arrays.binarySearch(tied[u], nearestRank) >= 0
                    && (best < 0 || graph.accountNumber(u).compareTo(graph.accountNumber(best)) < 0)) {
                best = u;
            }
        }
        tied[v] = merged;
        parent[v] = best;
    }

    private static List<String> pathToMule(ProjectedGraph graph, int v, int[] parent) {
        List<String> path = new ArrayList<>();
        for (int node = v; node >= 0; node = parent[node]) {
            path.add(graph.accountNumber(node));
        }
        return List.copyOf(path);
    }

    /**
     * On-demand variant for one account: BFS outward from the account, stopping at the first level
     * that contains a confirmed mule. Distance and tied mules match the multi-source computation.
     */
    public ProximityResult computeForAccount(ProjectedGraph graph, long accountId, int maxDepth) {
        int source = graph.indexOf(accountId);
        if (source < 0) {
            return ProximityResult.unreached(accountId);
        }
        String sourceNumber = graph.accountNumber(source);
        if (graph.isConfirmedMule(source)) {
            return new ProximityResult(accountId, 0, accountId, sourceNumber, List.of(sourceNumber), List.of(sourceNumber));
        }

        int n = graph.nodeCount();
        int[] distance = new int[n];
        Arrays.fill(distance, -1);
        int[] parent = new int[n];
        Arrays.fill(parent, -1);
        distance[source] = 0;
        List<Integer> frontier = List.of(source);

        for (int level = 0; level < maxDepth && !frontier.isEmpty(); level++) {
            List<Integer> next = new ArrayList<>();
            for (int u : frontier) {
                for (int e = graph.neighborStart(u); e < graph.neighborEnd(u); e++) {
                    int v = graph.neighborAt(e);
                    if (distance[v] < 0) {
                        distance[v] = level + 1;
                        parent[v] = u;
                        next.add(v);
                    }
                }
            }
            next.sort(Integer::compare);

            List<Integer> mules = next.stream()
                    .filter(graph::isConfirmedMule)
                    .sorted(Comparator.comparing(graph::accountNumber))
                    .toList();
            if (!mules.isEmpty()) {
                int nearest = mules.get(0);
                List<String> path = new ArrayList<>();
                for (int node = nearest; node >= 0; node = parent[node]) {
                    path.add(0, graph.accountNumber(node));
                }
                return new ProximityResult(accountId, level + 1, graph.accountId(nearest),
                        graph.accountNumber(nearest),
                        mules.stream().map(graph::accountNumber).toList(),
                        List.copyOf(path));
            }
            frontier = next;
        }
        return ProximityResult.unreached(accountId);
    }
}
