package com.bank.mulegraph.model;

import java.util.List;

/**
 * Distance from an account to its nearest confirmed mule(s).
 * {@code distanceToMule} is null when no mule is reachable within the depth limit.
 */
public record ProximityResult(long accountId,
                              Integer distanceToMule,
                              Long nearestMuleId,
                              String nearestMuleAccountNumber,
                              List<String> tiedMuleAccountNumbers,
                              List<String> path) {

    public static ProximityResult unreached(long accountId) {
        return new ProximityResult(accountId, null, null, null, List.of(), List.of());
    }

    public boolean isReached() {
        return distanceToMule != null;
    }
}
