package com.bank.mulegraph.model;

/**
 * Undirected weighted edge of the account projection. {@code lowAccountId < highAccountId} always holds.
 */
public record ProjectedEdge(long lowAccountId, long highAccountId, double weight) {

    public ProjectedEdge {
        if (lowAccountId >= highAccountId) {
            throw new IllegalArgumentException("Projected edge endpoints must be canonical: "
                    + lowAccountId + " >= " + highAccountId);
        }
    }
}
