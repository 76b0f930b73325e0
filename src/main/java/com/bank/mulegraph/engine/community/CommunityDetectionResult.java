package com.bank.mulegraph.engine.community;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

/**
 * Final partition of a projected graph. Community ids are dense, 0..communityCount-1, numbered in
 * order of each community's smallest member account id.
 */
public final class CommunityDetectionResult {

    private final int[] communityByNode;
    private final Map<Long, Integer> communityByAccount;
    private final int communityCount;
    private final double modularity;
    private final int levels;
    private final boolean convergenceReached;

    CommunityDetectionResult(int[] communityByNode, Map<Long, Integer> communityByAccount, int communityCount,
                             double modularity, int levels, boolean convergenceReached) {
        this.communityByNode = communityByNode;
        this.communityByAccount = Collections.unmodifiableMap(communityByAccount);
        this.communityCount = communityCount;
        this.modularity = modularity;
        this.levels = levels;
        this.convergenceReached = convergenceReached;
    }

    public int communityOfNode(int node) {
        return communityByNode[node];
    }

    public int[] communityByNode() {
        return Arrays.copyOf(communityByNode, communityByNode.length);
    }

    public Map<Long, Integer> communityByAccount() {
        return communityByAccount;
    }

    public int communityCount() {
        return communityCount;
    }

    public double modularity() {
        return modularity;
    }

    public int levels() {
        return levels;
    }

    /** False when a pass or level limit stopped the search; the partition is still the best seen. */
    public boolean convergenceReached() {
        return convergenceReached;
    }
}
