package com.bank.mulegraph.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Aerospike connection beans. Switched off with {@code aerospike.enabled=false} when a test supplies its own client.
 */
@Configuration
@ConditionalOnProperty(name = "aerospike.enabled", havingValue = "true", matchIfMissing = true)
public class AerospikeConfig {

    public static final String SET_ACCOUNTS = "accounts";
    public static final String SET_TRANSACTION_EDGES = "transaction_edges";
    public static final String SET_ACCOUNT_FEATURES = "account_features";
    public static final String SET_GRAPH_META = "graph_meta";

    // Keys inside SET_GRAPH_META
    public static final String META_GRAPH_VERSION = "graph_version";
    public static final String META_FEATURE_GENERATION = "feature_generation";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:banking}")
    private String namespace;

    @Bean
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = 100;
        clientPolicy.timeout = 5000;

        // Batch scans read whole sets; keep socket timeouts generous
        clientPolicy.readPolicyDefault.totalTimeout = 10000;
        clientPolicy.readPolicyDefault.socketTimeout = 5000;

        clientPolicy.writePolicyDefault.totalTimeout = 3000;
        clientPolicy.writePolicyDefault.socketTimeout = 1000;

        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = 3000;
        policy.socketTimeout = 1000;
        return policy;
    }

    @Bean
    public Policy defaultReadPolicy() {
        Policy policy = new Policy();
        policy.totalTimeout = 3000;
        policy.socketTimeout = 1000;
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }
}
