package com.bank.mulegraph.model;

public record DiversityMetrics(int uniqueCounterparties,
                               int totalTransactions,
                               double diversityRatio,
                               double topCounterpartyShare) {

    public static final DiversityMetrics EMPTY = new DiversityMetrics(0, 0, 0.0, 0.0);
}
