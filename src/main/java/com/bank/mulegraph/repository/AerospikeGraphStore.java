package com.bank.mulegraph.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.bank.mulegraph.config.AerospikeConfig;
import com.bank.mulegraph.exception.GraphLoadException;
import com.bank.mulegraph.model.Account;
import com.bank.mulegraph.model.AccountLabel;
import com.bank.mulegraph.model.ParticipantType;
import com.bank.mulegraph.model.TransactionEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Graph store backed by the {@code accounts} and {@code transaction_edges} sets. The change marker is
 * the {@code version} bin of the {@code graph_meta/graph_version} record, bumped by the ingesting writer.
 */
@Repository
public class AerospikeGraphStore implements GraphStore {

    private static final Logger log = LoggerFactory.getLogger(AerospikeGraphStore.class);

    private final AerospikeClient client;
    private final String namespace;
    private final Policy readPolicy;

    public AerospikeGraphStore(AerospikeClient client,
                               @Qualifier("aerospikeNamespace") String namespace,
                               @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
    }

    @Override
    public List<Account> loadAccounts() {
        List<Account> accounts = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ACCOUNTS,
                (key, record) -> {
                    Account account = mapAccount(record);
                    synchronized (accounts) {
                        accounts.add(account);
                    }
                });

        accounts.sort(Comparator.comparingLong(Account::getAccountId));
        return accounts;
    }

    @Override
    public List<TransactionEdge> loadTransactionEdges() {
        List<TransactionEdge> edges = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_TRANSACTION_EDGES,
                (key, record) -> {
                    TransactionEdge edge = mapEdge(record);
                    synchronized (edges) {
                        edges.add(edge);
                    }
                });

        edges.sort(EDGE_ORDER);
        return edges;
    }

    @Override
    public List<TransactionEdge> loadTransactionEdgesFor(long accountId) {
        List<TransactionEdge> edges = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_TRANSACTION_EDGES,
                (key, record) -> {
                    if (record.getLong("performerId") != accountId && record.getLong("beneId") != accountId) {
                        return;
                    }
                    TransactionEdge edge = mapEdge(record);
                    if (edge.touches(accountId)) {
                        synchronized (edges) {
                            edges.add(edge);
                        }
                    }
                });

        edges.sort(EDGE_ORDER);
        return edges;
    }

    @Override
    public long snapshotMarker() {
        Key key = new Key(namespace, AerospikeConfig.SET_GRAPH_META, AerospikeConfig.META_GRAPH_VERSION);
        Record record = client.get(readPolicy, key);
        if (record == null) {
            return 0L;
        }
        return record.getLong("version");
    }

    private Account mapAccount(Record record) {
        String accountNumber = record.getString("accountNumber");
        Object rawId = record.getValue("accountId");
        if (rawId == null || accountNumber == null) {
            throw new GraphLoadException("Account record without accountId/accountNumber: " + record);
        }

        Set<AccountLabel> labels = EnumSet.noneOf(AccountLabel.class);
        List<?> rawLabels = record.getList("labels");
        if (rawLabels != null) {
            for (Object raw : rawLabels) {
                AccountLabel label = AccountLabel.fromStoreLabel(String.valueOf(raw));
                if (label != null) {
                    labels.add(label);
                } else {
                    log.debug("Ignoring untracked label '{}' on account {}", raw, accountNumber);
                }
            }
        }

        return Account.builder()
                .accountId(record.getLong("accountId"))
                .accountNumber(accountNumber)
                .labels(labels)
                .build();
    }

    private TransactionEdge mapEdge(Record record) {
        if (record.getValue("performerId") == null || record.getValue("beneId") == null) {
            throw new GraphLoadException("Transaction edge without endpoint: " + record.getString("txnId"));
        }
        return TransactionEdge.builder()
                .txnId(record.getString("txnId"))
                .performerId(record.getLong("performerId"))
                .performerType(participantType(record.getString("performerType")))
                .beneficiaryId(record.getLong("beneId"))
                .beneficiaryType(participantType(record.getString("beneType")))
                .amount(record.getDouble("amount"))
                .timestamp(record.getLong("timestamp"))
                .build();
    }

    private static ParticipantType participantType(String raw) {
        if (raw == null || raw.isBlank()) {
            return ParticipantType.ACCOUNT;
        }
        try {
            return ParticipantType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new GraphLoadException("Unknown participant type '" + raw + "'", e);
        }
    }

    private static final Comparator<TransactionEdge> EDGE_ORDER = Comparator
            .comparingLong(TransactionEdge::getTimestamp)
            .thenComparing(TransactionEdge::getTxnId, Comparator.nullsFirst(Comparator.naturalOrder()));
}
