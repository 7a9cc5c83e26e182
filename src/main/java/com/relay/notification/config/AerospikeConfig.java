package com.relay.notification.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Getter
@Configuration
@ConditionalOnProperty(name = "notification.filter.behavior-store.type", havingValue = "aerospike")
public class AerospikeConfig {

    public static final String SET_BEHAVIOR_PATTERNS = "behavior_patterns";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:notifications}")
    private String namespace;

    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = 100;
        clientPolicy.timeout = 5000;

        clientPolicy.readPolicyDefault.totalTimeout = 1000;
        clientPolicy.readPolicyDefault.socketTimeout = 500;

        clientPolicy.writePolicyDefault.totalTimeout = 1000;
        clientPolicy.writePolicyDefault.socketTimeout = 500;

        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public WritePolicy behaviorWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = 1000;
        policy.socketTimeout = 500;
        return policy;
    }

    @Bean
    public Policy behaviorReadPolicy() {
        Policy policy = new Policy();
        policy.totalTimeout = 1000;
        policy.socketTimeout = 500;
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }
}
