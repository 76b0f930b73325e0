package com.bank.mulegraph.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.bank.mulegraph.config.AerospikeConfig;
import com.bank.mulegraph.model.AccountFeatures;
import com.bank.mulegraph.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AerospikeFeatureSnapshotWriterTest {

    @Mock private AerospikeClient client;

    private AerospikeFeatureSnapshotWriter writer;

    private final Key metaKey = new Key("test", AerospikeConfig.SET_GRAPH_META,
            AerospikeConfig.META_FEATURE_GENERATION);

    @BeforeEach
    void setUp() {
        writer = new AerospikeFeatureSnapshotWriter(client, "test", new WritePolicy(), new Policy());
    }

    @Test
    void commit_replacesEachAccountRecordThenWritesGeneration() {
        Map<Long, AccountFeatures> features = new TreeMap<>();
        features.put(1L, TestDataFactory.createFeatures(1L, "ACC_1"));
        features.put(2L, TestDataFactory.createFeatures(2L, "ACC_2"));

        writer.commitFeatureSnapshot(5L, features);

        for (long id : new long[]{1L, 2L}) {
            verify(client).put(
                    argThat(p -> p != null && p.recordExistsAction == RecordExistsAction.REPLACE),
                    eq(new Key("test", AerospikeConfig.SET_ACCOUNT_FEATURES, id)),
                    any(Bin[].class));
        }
        verify(client).put(any(WritePolicy.class), eq(metaKey), any(Bin[].class));
    }

    @Test
    void commit_failsPartWay_leavesGenerationUncommitted() {
        Map<Long, AccountFeatures> features = new TreeMap<>();
        features.put(1L, TestDataFactory.createFeatures(1L, "ACC_1"));
        features.put(2L, TestDataFactory.createFeatures(2L, "ACC_2"));
        lenient().doThrow(new AerospikeException("node unavailable")).when(client).put(any(WritePolicy.class),
                eq(new Key("test", AerospikeConfig.SET_ACCOUNT_FEATURES, 2L)), any(Bin[].class));

        assertThatThrownBy(() -> writer.commitFeatureSnapshot(6L, features))
                .isInstanceOf(AerospikeException.class);

        verify(client, never()).put(any(WritePolicy.class), eq(metaKey), any(Bin[].class));
    }

    @Test
    void lastCommittedGeneration_readsMetaRecord() {
        when(client.get(any(Policy.class), eq(metaKey)))
                .thenReturn(new Record(Map.of("generation", 41L), 1, 0));

        assertThat(writer.lastCommittedGeneration()).isEqualTo(41L);
    }

    @Test
    void lastCommittedGeneration_noMetaRecord_returnsZero() {
        when(client.get(any(Policy.class), eq(metaKey))).thenReturn(null);

        assertThat(writer.lastCommittedGeneration()).isZero();
    }
}
