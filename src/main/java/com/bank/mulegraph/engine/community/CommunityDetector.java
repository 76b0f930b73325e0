package com.bank.mulegraph.engine.community;

import com.bank.mulegraph.config.GraphFeatureConfig;
import com.bank.mulegraph.engine.CancellationToken;
import com.bank.mulegraph.engine.projection.ProjectedGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.IntStream;

/**
 * Louvain modularity optimization over the account projection.
 *
 * Each level runs local moving until a sweep commits no move (or the pass limit), then collapses
 * communities into nodes and repeats on the coarser graph. Gain of moving node i into community C:
 * <pre>
 *   dQ(i -> C) = [k_i,in(C) - gamma * k_i * Sigma_tot(C) / (2m)] / m
 * </pre>
 * Candidate moves of one sweep are all evaluated against the assignment committed by the previous
 * sweep, so the outcome does not depend on evaluation order or thread scheduling. At the barrier the
 * candidates are committed in node order, each one re-evaluated against the assignment as updated by
 * the commits before it. Every committed move therefore strictly increases modularity.
 */
@Component
public class CommunityDetector {

    private static final Logger log = LoggerFactory.getLogger(CommunityDetector.class);

    private final GraphFeatureConfig config;

    public CommunityDetector(GraphFeatureConfig config) {
        this.config = config;
    }

    /** Community id per account id, using configured pass and level limits. */
    public Map<Long, Integer> detectCommunities(ProjectedGraph graph, double resolution, double tolerance) {
        GraphFeatureConfig.Community c = config.getCommunity();
        LouvainParameters params = new LouvainParameters(resolution, tolerance, c.getMaxPasses(), c.getMaxLevels());
        return detect(graph, params, CancellationToken.none()).communityByAccount();
    }

    public CommunityDetectionResult detect(ProjectedGraph graph, LouvainParameters params, CancellationToken token) {
        int n = graph.nodeCount();
        int[] membership = identity(n);
        double m = graph.totalWeight();

        if (n == 0 || m <= 0.0) {
            log.debug("Graph has no weighted edges; every account is its own community");
            return finish(graph, membership, 0.0, 0, true);
        }

        double gamma = params.resolution();
        LevelGraph level = LevelGraph.of(graph);
        double previousQ = modularity(graph, membership, gamma);
        double bestQ = previousQ;
        int[] best = membership.clone();

        boolean converged = false;
        boolean passLimitHit = false;
        int levels = 0;

        for (int lvl = 0; lvl < params.maxLevels(); lvl++) {
            token.throwIfCancelled("community detection level " + lvl);

            LocalMoveOutcome outcome = moveNodes(level, m, params, token);
            levels++;
            passLimitHit |= outcome.passLimitHit();

            if (outcome.communityCount() == level.nodeCount) {
                converged = true;
                break;
            }

            for (int v = 0; v < n; v++) {
                membership[v] = outcome.communities()[membership[v]];
            }
            double q = modularity(graph, membership, gamma);
            log.debug("Louvain level {}: {} -> {} communities, modularity {}",
                    lvl, level.nodeCount, outcome.communityCount(), q);

            if (q > bestQ) {
                bestQ = q;
                best = membership.clone();
            }
            if (q - previousQ < params.tolerance()) {
                converged = true;
                break;
            }
            previousQ = q;
            level = level.aggregate(outcome.communities(), outcome.communityCount());
        }

        boolean reached = converged && !passLimitHit;
        if (!reached) {
            log.warn("Community detection did not converge within {} levels / {} passes; "
                    + "using best partition found (modularity {})", params.maxLevels(), params.maxPasses(), bestQ);
        }
        return finish(graph, best, bestQ, levels, reached);
    }

    private LocalMoveOutcome moveNodes(LevelGraph g, double m, LouvainParameters params, CancellationToken token) {
        int n = g.nodeCount;
        int[] community = identity(n);
        double[] sigmaTot = Arrays.copyOf(g.degree, n);
        int[] proposal = new int[n];
        boolean passLimitHit = true;

        for (int pass = 0; pass < params.maxPasses(); pass++) {
            token.throwIfCancelled("community detection pass " + pass);

            IntStream nodes = IntStream.range(0, n);
            if (n >= config.getBatch().getParallelThreshold()) {
                nodes = nodes.parallel();
            }
            nodes.forEach(i -> proposal[i] = bestCommunity(g, i, community, sigmaTot, m, params.resolution()));

            // barrier: commit in node order, re-checking each candidate against earlier commits
            int moves = 0;
            for (int i = 0; i < n; i++) {
                if (proposal[i] == community[i]) {
                    continue;
                }
                int target = bestCommunity(g, i, community, sigmaTot, m, params.resolution());
                if (target == community[i]) {
                    continue;
                }
                sigmaTot[community[i]] -= g.degree[i];
                sigmaTot[target] += g.degree[i];
                community[i] = target;
                moves++;
            }

            if (moves == 0) {
                passLimitHit = false;
                break;
            }
        }

        int[] dense = new int[n];
        int[] relabel = new int[n];
        Arrays.fill(relabel, -1);
        int count = 0;
        for (int i = 0; i < n; i++) {
            int c = community[i];
            if (relabel[c] < 0) {
                relabel[c] = count++;
            }
            dense[i] = relabel[c];
        }
        return new LocalMoveOutcome(dense, count, passLimitHit);
    }

    private static int bestCommunity(LevelGraph g, int i, int[] community, double[] sigmaTot,
                                     double m, double gamma) {
        int own = community[i];
        double ki = g.degree[i];

        TreeMap<Integer, Double> weightToCommunity = new TreeMap<>();
        for (int e = g.offsets[i]; e < g.offsets[i + 1]; e++) {
            weightToCommunity.merge(community[g.neighbors[e]], g.weights[e], Double::sum);
        }

        int best = own;
        double bestGain = gain(weightToCommunity.getOrDefault(own, 0.0), sigmaTot[own] - ki, ki, m, gamma);
        for (Map.Entry<Integer, Double> entry : weightToCommunity.entrySet()) {
            int c = entry.getKey();
            if (c == own) continue;
            double g2 = gain(entry.getValue(), sigmaTot[c], ki, m, gamma);
            if (g2 > bestGain) {
                best = c;
                bestGain = g2;
            }
        }
        return best;
    }

    static double gain(double kIn, double sigmaTot, double ki, double m, double gamma) {
        return (kIn - gamma * ki * sigmaTot / (2.0 * m)) / m;
    }

    /** Newman modularity of a partition of the original graph. */
    static double modularity(ProjectedGraph graph, int[] membership, double gamma) {
        double m = graph.totalWeight();
        if (m <= 0.0) return 0.0;
        int n = graph.nodeCount();
        double[] internal = new double[n];
        double[] total = new double[n];
        for (int i = 0; i < n; i++) {
            total[membership[i]] += graph.degree(i);
            for (int e = graph.neighborStart(i); e < graph.neighborEnd(i); e++) {
                int j = graph.neighborAt(e);
                if (j > i && membership[j] == membership[i]) {
                    internal[membership[i]] += graph.weightAt(e);
                }
            }
        }
        double q = 0.0;
        for (int c = 0; c < n; c++) {
            if (total[c] == 0.0 && internal[c] == 0.0) continue;
            double share = total[c] / (2.0 * m);
            q += internal[c] / m - gamma * share * share;
        }
        return q;
    }

    private CommunityDetectionResult finish(ProjectedGraph graph, int[] membership, double modularity,
                                            int levels, boolean converged) {
        int n = graph.nodeCount();
        int[] relabel = new int[n];
        Arrays.fill(relabel, -1);
        int[] communityByNode = new int[n];
        Map<Long, Integer> byAccount = new LinkedHashMap<>(n * 2);
        int count = 0;
        // nodes are in ascending account id order, so ids follow each community's smallest account id
        for (int v = 0; v < n; v++) {
            int c = membership[v];
            if (relabel[c] < 0) {
                relabel[c] = count++;
            }
            communityByNode[v] = relabel[c];
            byAccount.put(graph.accountId(v), relabel[c]);
        }
        return new CommunityDetectionResult(communityByNode, byAccount, count, modularity, levels, converged);
    }

    private static int[] identity(int n) {
        int[] ids = new int[n];
        for (int i = 0; i < n; i++) ids[i] = i;
        return ids;
    }

    private record LocalMoveOutcome(int[] communities, int communityCount, boolean passLimitHit) {}

    /**
     * Graph of one hierarchy level. Intra-community weight of collapsed nodes lives in
     * {@code selfLoop} and in {@code degree}, never in the adjacency.
     */
    static final class LevelGraph {

        final int nodeCount;
        final int[] offsets;
        final int[] neighbors;
        final double[] weights;
        final double[] selfLoop;
        final double[] degree;

        private LevelGraph(int nodeCount, int[] offsets, int[] neighbors, double[] weights,
                           double[] selfLoop, double[] degree) {
            this.nodeCount = nodeCount;
            this.offsets = offsets;
            this.neighbors = neighbors;
            this.weights = weights;
            this.selfLoop = selfLoop;
            this.degree = degree;
        }

        static LevelGraph of(ProjectedGraph graph) {
            int n = graph.nodeCount();
            int[] offsets = new int[n + 1];
            for (int i = 0; i < n; i++) {
                offsets[i + 1] = graph.neighborEnd(i);
            }
            int slots = offsets[n];
            int[] neighbors = new int[slots];
            double[] weights = new double[slots];
            for (int e = 0; e < slots; e++) {
                neighbors[e] = graph.neighborAt(e);
                weights[e] = graph.weightAt(e);
            }
            double[] degree = new double[n];
            for (int i = 0; i < n; i++) {
                degree[i] = graph.degree(i);
            }
            return new LevelGraph(n, offsets, neighbors, weights, new double[n], degree);
        }

        LevelGraph aggregate(int[] communityOf, int communityCount) {
            double[] self = new double[communityCount];
            double[] deg = new double[communityCount];
            Map<Long, Double> between = new HashMap<>();

            for (int i = 0; i < nodeCount; i++) {
                int cu = communityOf[i];
                self[cu] += selfLoop[i];
                deg[cu] += degree[i];
                for (int e = offsets[i]; e < offsets[i + 1]; e++) {
                    int j = neighbors[e];
                    if (j <= i) continue;
                    int cv = communityOf[j];
                    if (cu == cv) {
                        self[cu] += weights[e];
                    } else {
                        long key = ((long) Math.min(cu, cv) << 32) | Math.max(cu, cv);
                        between.merge(key, weights[e], Double::sum);
                    }
                }
            }

            long[] keys = between.keySet().stream().mapToLong(Long::longValue).sorted().toArray();
            int[] count = new int[communityCount];
            for (long key : keys) {
                count[(int) (key >>> 32)]++;
                count[(int) key]++;
            }
            int[] off = new int[communityCount + 1];
            for (int c = 0; c < communityCount; c++) {
                off[c + 1] = off[c] + count[c];
            }
            int[] cursor = Arrays.copyOf(off, communityCount);
            int[] nbr = new int[off[communityCount]];
            double[] w = new double[off[communityCount]];
            for (long key : keys) {
                int lo = (int) (key >>> 32);
                int hi = (int) key;
                double weight = between.get(key);
                nbr[cursor[lo]] = hi;
                w[cursor[lo]++] = weight;
                nbr[cursor[hi]] = lo;
                w[cursor[hi]++] = weight;
            }
            return new LevelGraph(communityCount, off, nbr, w, self, deg);
        }
    }
}
