package com.bank.mulegraph.model;

public record CommunityDensity(int communityId, int communitySize, int muleCount, double muleDensity) {}
