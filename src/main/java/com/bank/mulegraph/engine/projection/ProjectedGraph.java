package com.bank.mulegraph.engine.projection;

import com.bank.mulegraph.model.ProjectedEdge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable weighted, undirected account graph in compressed adjacency form.
 *
 * Nodes are dense indices 0..n-1 assigned in ascending account id order; every algorithm works on
 * indices and translates back to account ids at its boundary. Each undirected edge appears in the
 * adjacency of both endpoints, neighbours sorted by index. There are no self-edges.
 */
public final class ProjectedGraph {

    private final long[] accountIds;
    private final String[] accountNumbers;
    private final boolean[] confirmedMule;
    private final int[] offsets;
    private final int[] neighbors;
    private final double[] weights;
    private final double[] degrees;
    private final double totalWeight;
    private final Map<Long, Integer> indexByAccountId;

    ProjectedGraph(long[] accountIds, String[] accountNumbers, boolean[] confirmedMule,
                   int[] offsets, int[] neighbors, double[] weights) {
        this.accountIds = accountIds;
        this.accountNumbers = accountNumbers;
        this.confirmedMule = confirmedMule;
        this.offsets = offsets;
        this.neighbors = neighbors;
        this.weights = weights;

        this.degrees = new double[accountIds.length];
        double sum = 0.0;
        for (int i = 0; i < accountIds.length; i++) {
            double k = 0.0;
            for (int e = offsets[i]; e < offsets[i + 1]; e++) {
                k += weights[e];
                if (neighbors[e] > i) {
                    sum += weights[e];
                }
            }
            degrees[i] = k;
        }
        this.totalWeight = sum;

        Map<Long, Integer> index = new HashMap<>(accountIds.length * 2);
        for (int i = 0; i < accountIds.length; i++) {
            index.put(accountIds[i], i);
        }
        this.indexByAccountId = Collections.unmodifiableMap(index);
    }

    public int nodeCount() {
        return accountIds.length;
    }

    public int edgeCount() {
        return neighbors.length / 2;
    }

    /** Sum of all undirected edge weights (m). */
    public double totalWeight() {
        return totalWeight;
    }

    public long accountId(int node) {
        return accountIds[node];
    }

    public String accountNumber(int node) {
        return accountNumbers[node];
    }

    public boolean isConfirmedMule(int node) {
        return confirmedMule[node];
    }

    /** Weighted degree k_i. */
    public double degree(int node) {
        return degrees[node];
    }

    public int neighborStart(int node) {
        return offsets[node];
    }

    public int neighborEnd(int node) {
        return offsets[node + 1];
    }

    public int neighborAt(int slot) {
        return neighbors[slot];
    }

    public double weightAt(int slot) {
        return weights[slot];
    }

    /** Node index of an account, or -1 when the account is not in the projection. */
    public int indexOf(long accountId) {
        Integer idx = indexByAccountId.get(accountId);
        return idx == null ? -1 : idx;
    }

    /** Weight between two accounts, 0 when not adjacent. */
    public double weight(long accountA, long accountB) {
        int a = indexOf(accountA);
        int b = indexOf(accountB);
        if (a < 0 || b < 0) return 0.0;
        int lo = offsets[a];
        int hi = offsets[a + 1] - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (neighbors[mid] < b) lo = mid + 1;
            else if (neighbors[mid] > b) hi = mid - 1;
            else return weights[mid];
        }
        return 0.0;
    }

    /** Every undirected edge once, in canonical (lower account id first) order. */
    public List<ProjectedEdge> edges() {
        List<ProjectedEdge> edges = new ArrayList<>(edgeCount());
        for (int i = 0; i < accountIds.length; i++) {
            for (int e = offsets[i]; e < offsets[i + 1]; e++) {
                int j = neighbors[e];
                if (j > i) {
                    edges.add(new ProjectedEdge(accountIds[i], accountIds[j], weights[e]));
                }
            }
        }
        return edges;
    }
}
