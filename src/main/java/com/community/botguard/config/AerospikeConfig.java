package com.community.botguard.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AerospikeConfig {

    public static final String SET_AUDIT_RECORDS = "bot_audit_records";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:botguard}")
    private String namespace;

    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = 100;
        clientPolicy.timeout = 5000;
        // Start without a reachable cluster; audit writes retry and log gaps instead.
        clientPolicy.failIfNotConnected = false;

        clientPolicy.readPolicyDefault.totalTimeout = 3000;
        clientPolicy.readPolicyDefault.socketTimeout = 1000;

        clientPolicy.writePolicyDefault.totalTimeout = 3000;
        clientPolicy.writePolicyDefault.socketTimeout = 1000;

        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = 3000;
        policy.socketTimeout = 1000;
        // Audit records are append-only.
        policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
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
