package com.bank.mulegraph.engine.projection;

import com.bank.mulegraph.exception.GraphLoadException;
import com.bank.mulegraph.model.Account;
import com.bank.mulegraph.model.ParticipantType;
import com.bank.mulegraph.model.TransactionEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts raw transaction edges into the weighted, undirected account projection.
 *
 * Edge weight = sum of amounts of all transactions between the pair in either direction.
 * Self-transfers and edges touching a non-account participant are dropped; an account endpoint
 * that is not among the loaded accounts fails the projection.
 */
@Component
public class ProjectionBuilder {

    private static final Logger log = LoggerFactory.getLogger(ProjectionBuilder.class);

    public ProjectedGraph build(Collection<Account> accounts, Iterable<TransactionEdge> transactionEdges) {
        List<Account> ordered = new ArrayList<>(accounts);
        ordered.sort(Comparator.comparingLong(Account::getAccountId));

        int n = ordered.size();
        long[] accountIds = new long[n];
        String[] accountNumbers = new String[n];
        boolean[] mule = new boolean[n];
        Map<Long, Integer> indexById = new HashMap<>(n * 2);
        Set<String> seenNumbers = new HashSet<>(n * 2);

        for (int i = 0; i < n; i++) {
            Account account = ordered.get(i);
            if (account.getAccountNumber() == null || account.getAccountNumber().isBlank()) {
                throw new GraphLoadException("Account " + account.getAccountId() + " has no account number");
            }
            if (indexById.put(account.getAccountId(), i) != null) {
                throw new GraphLoadException("Duplicate account id " + account.getAccountId());
            }
            if (!seenNumbers.add(account.getAccountNumber())) {
                throw new GraphLoadException("Duplicate account number " + account.getAccountNumber());
            }
            accountIds[i] = account.getAccountId();
            accountNumbers[i] = account.getAccountNumber();
            mule[i] = account.isConfirmedMule();
        }

        // Collect (pair, amount) and sum after sorting so weights do not depend on input order
        List<PairAmount> pairAmounts = new ArrayList<>();
        int skippedNonAccount = 0;
        int skippedSelf = 0;
        for (TransactionEdge edge : transactionEdges) {
            validate(edge);
            int a = edge.getPerformerType() == ParticipantType.ACCOUNT
                    ? resolve(indexById, edge.getPerformerId(), edge) : -1;
            int b = edge.getBeneficiaryType() == ParticipantType.ACCOUNT
                    ? resolve(indexById, edge.getBeneficiaryId(), edge) : -1;
            if (a < 0 || b < 0) {
                skippedNonAccount++;
                continue;
            }
            if (a == b) {
                skippedSelf++;
                continue;
            }
            int lo = Math.min(a, b);
            int hi = Math.max(a, b);
            pairAmounts.add(new PairAmount(((long) lo << 32) | hi, edge.getAmount()));
        }
        pairAmounts.sort(Comparator.comparingLong(PairAmount::pairKey).thenComparingDouble(PairAmount::amount));

        List<long[]> pairs = new ArrayList<>();
        List<Double> pairWeights = new ArrayList<>();
        int[] degreeCount = new int[n];
        int p = 0;
        while (p < pairAmounts.size()) {
            long key = pairAmounts.get(p).pairKey();
            double sum = 0.0;
            while (p < pairAmounts.size() && pairAmounts.get(p).pairKey() == key) {
                sum += pairAmounts.get(p).amount();
                p++;
            }
            if (sum > 0.0) {
                int lo = (int) (key >>> 32);
                int hi = (int) key;
                pairs.add(new long[]{lo, hi});
                pairWeights.add(sum);
                degreeCount[lo]++;
                degreeCount[hi]++;
            }
        }

        int[] offsets = new int[n + 1];
        for (int i = 0; i < n; i++) {
            offsets[i + 1] = offsets[i] + degreeCount[i];
        }
        int[] cursor = new int[n];
        System.arraycopy(offsets, 0, cursor, 0, n);
        int[] neighbors = new int[offsets[n]];
        double[] weights = new double[offsets[n]];

        // Pairs are sorted by (lo, hi), so every adjacency list fills in ascending neighbour order
        for (int e = 0; e < pairs.size(); e++) {
            int lo = (int) pairs.get(e)[0];
            int hi = (int) pairs.get(e)[1];
            double w = pairWeights.get(e);
            neighbors[cursor[lo]] = hi;
            weights[cursor[lo]++] = w;
            neighbors[cursor[hi]] = lo;
            weights[cursor[hi]++] = w;
        }

        log.info("Projected {} accounts, {} weighted edges (skipped {} non-account, {} self transactions)",
                n, pairs.size(), skippedNonAccount, skippedSelf);

        return new ProjectedGraph(accountIds, accountNumbers, mule, offsets, neighbors, weights);
    }

    private void validate(TransactionEdge edge) {
        if (edge == null) {
            throw new GraphLoadException("Null transaction edge in graph snapshot");
        }
        if (edge.getPerformerType() == null || edge.getBeneficiaryType() == null) {
            throw new GraphLoadException("Transaction " + edge.getTxnId() + " has an endpoint without participant type");
        }
        if (Double.isNaN(edge.getAmount()) || Double.isInfinite(edge.getAmount()) || edge.getAmount() < 0) {
            throw new GraphLoadException("Transaction " + edge.getTxnId() + " has invalid amount " + edge.getAmount());
        }
    }

    private int resolve(Map<Long, Integer> indexById, long accountId, TransactionEdge edge) {
        Integer idx = indexById.get(accountId);
        if (idx == null) {
            throw new GraphLoadException("Transaction " + edge.getTxnId()
                    + " references unknown account id " + accountId);
        }
        return idx;
    }

    private record PairAmount(long pairKey, double amount) {}
}
