package com.bank.mulegraph.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.bank.mulegraph.config.AerospikeConfig;
import com.bank.mulegraph.model.AccountFeatures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes one {@code account_features} record per account, then the committed generation to
 * {@code graph_meta}. Records are replaced whole, so features that became unset disappear.
 * The persisted copy is best-effort: the in-memory snapshot is what queries are served from.
 * The meta record is written last, so if a commit fails part way the store holds a mix of
 * generations while {@code graph_meta} still names the previous one. Readers of this set should
 * trust only records whose {@code gen} equals the committed generation; a record above it belongs
 * to a run that never committed, and the next successful run replaces every record.
 */
@Repository
public class AerospikeFeatureSnapshotWriter implements FeatureSnapshotWriter {

    private static final Logger log = LoggerFactory.getLogger(AerospikeFeatureSnapshotWriter.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public AerospikeFeatureSnapshotWriter(AerospikeClient client,
                                          @Qualifier("aerospikeNamespace") String namespace,
                                          @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                          @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    @Override
    public void commitFeatureSnapshot(long generation, Map<Long, AccountFeatures> featuresByAccount) {
        WritePolicy replace = new WritePolicy(writePolicy);
        replace.recordExistsAction = RecordExistsAction.REPLACE;

        for (Map.Entry<Long, AccountFeatures> entry : featuresByAccount.entrySet()) {
            Key key = new Key(namespace, AerospikeConfig.SET_ACCOUNT_FEATURES, entry.getKey());
            client.put(replace, key, toBins(generation, entry.getValue()));
        }

        Key metaKey = new Key(namespace, AerospikeConfig.SET_GRAPH_META, AerospikeConfig.META_FEATURE_GENERATION);
        client.put(writePolicy, metaKey,
                new Bin("generation", generation),
                new Bin("committedAt", System.currentTimeMillis()),
                new Bin("accounts", featuresByAccount.size()));

        log.info("Persisted feature snapshot generation {} ({} accounts)", generation, featuresByAccount.size());
    }

    @Override
    public long lastCommittedGeneration() {
        Key metaKey = new Key(namespace, AerospikeConfig.SET_GRAPH_META, AerospikeConfig.META_FEATURE_GENERATION);
        Record record = client.get(readPolicy, metaKey);
        return record == null ? 0L : record.getLong("generation");
    }

    // Aerospike bin names are limited to 15 characters
    private Bin[] toBins(long generation, AccountFeatures f) {
        List<Bin> bins = new ArrayList<>();
        bins.add(new Bin("gen", generation));
        bins.add(new Bin("acctId", f.getAccountId().longValue()));
        bins.add(new Bin("acctNum", f.getAccountNumber()));
        addIfSet(bins, "commId", f.getCommunityId());
        addIfSet(bins, "commSize", f.getCommunitySize());
        addIfSet(bins, "muleCount", f.getMuleCount());
        addIfSet(bins, "muleDensity", f.getMuleDensity());
        addIfSet(bins, "distToMule", f.getDistanceToMule());
        addIfSet(bins, "nearMuleId", f.getNearestMuleId());
        if (f.getNearestMuleAccountNumber() != null) {
            bins.add(new Bin("nearMuleNum", f.getNearestMuleAccountNumber()));
        }
        if (f.getTiedMuleAccountNumbers() != null && !f.getTiedMuleAccountNumbers().isEmpty()) {
            bins.add(new Bin("tiedMules", f.getTiedMuleAccountNumbers()));
        }
        addIfSet(bins, "uniqCpty", f.getUniqueCounterparties());
        addIfSet(bins, "totalTxns", f.getTotalTransactions());
        addIfSet(bins, "divRatio", f.getDiversityRatio());
        addIfSet(bins, "topCptyShare", f.getTopCounterpartyShare());
        return bins.toArray(new Bin[0]);
    }

    private static void addIfSet(List<Bin> bins, String name, Number value) {
        if (value == null) return;
        if (value instanceof Double d) {
            bins.add(new Bin(name, d.doubleValue()));
        } else {
            bins.add(new Bin(name, value.longValue()));
        }
    }
}
