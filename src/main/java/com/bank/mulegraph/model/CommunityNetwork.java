package com.bank.mulegraph.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommunityNetwork {

    private int communityId;
    private int communitySize;
    private int muleCount;
    private double muleDensity;
    private boolean truncated;
    private List<NetworkNode> nodes;
    private List<NetworkEdge> edges;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NetworkNode {
        private String id;
        private String label;
        private boolean confirmedMule;
        private Integer distanceToMule;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NetworkEdge {
        private String from;
        private String to;
        private double weight;
    }
}
