package com.bank.mulegraph.engine.density;

import com.bank.mulegraph.model.AccountLabel;
import com.bank.mulegraph.model.CommunityDensity;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Per community: member count, confirmed-mule count and mule density, written back to every member.
 */
@Component
public class DensityAggregator {

    /**
     * @param communities community id per account id
     * @param labels      label set per account id; accounts without an entry count as non-mules
     * @return the community aggregate for every account in {@code communities}
     */
    public Map<Long, CommunityDensity> computeDensity(Map<Long, Integer> communities,
                                                      Map<Long, Set<AccountLabel>> labels) {
        Map<Integer, CommunityDensity> byCommunity = aggregate(communities, labels);

        Map<Long, CommunityDensity> byAccount = new LinkedHashMap<>(communities.size() * 2);
        for (Map.Entry<Long, Integer> entry : communities.entrySet()) {
            byAccount.put(entry.getKey(), byCommunity.get(entry.getValue()));
        }
        return byAccount;
    }

    /** Community summaries ordered by density (highest first), then size, then id. */
    public List<CommunityDensity> summarize(Map<Long, Integer> communities, Map<Long, Set<AccountLabel>> labels) {
        List<CommunityDensity> summaries = new ArrayList<>(aggregate(communities, labels).values());
        summaries.sort(Comparator.comparingDouble(CommunityDensity::muleDensity).reversed()
                .thenComparing(Comparator.comparingInt(CommunityDensity::communitySize).reversed())
                .thenComparingInt(CommunityDensity::communityId));
        return summaries;
    }

    private Map<Integer, CommunityDensity> aggregate(Map<Long, Integer> communities,
                                                     Map<Long, Set<AccountLabel>> labels) {
        Map<Integer, int[]> counts = new TreeMap<>();
        for (Map.Entry<Long, Integer> entry : communities.entrySet()) {
            int[] sizeAndMules = counts.computeIfAbsent(entry.getValue(), k -> new int[2]);
            sizeAndMules[0]++;
            Set<AccountLabel> accountLabels = labels.getOrDefault(entry.getKey(), Collections.emptySet());
            if (accountLabels.contains(AccountLabel.CONFIRMED_MULE)) {
                sizeAndMules[1]++;
            }
        }

        Map<Integer, CommunityDensity> byCommunity = new TreeMap<>();
        for (Map.Entry<Integer, int[]> entry : counts.entrySet()) {
            int size = entry.getValue()[0];
            int mules = entry.getValue()[1];
            byCommunity.put(entry.getKey(),
                    new CommunityDensity(entry.getKey(), size, mules, roundDensity(mules, size)));
        }
        return byCommunity;
    }

    static double roundDensity(int muleCount, int communitySize) {
        return BigDecimal.valueOf(muleCount)
                .divide(BigDecimal.valueOf(communitySize), 4, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
