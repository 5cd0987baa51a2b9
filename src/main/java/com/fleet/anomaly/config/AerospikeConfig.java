package com.fleet.anomaly.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.WritePolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AerospikeConfig {

    public static final String SET_ANOMALIES = "anomalies";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:telemetry}")
    private String namespace;

    // Anomaly records expire after this many seconds; -1 keeps them forever.
    @Value("${aerospike.anomaly-ttl-seconds:-1}")
    private int anomalyTtlSeconds;

    @Bean
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = 100;
        clientPolicy.timeout = 5000;
        // Anomaly storage is best-effort: start without a cluster and let the tend thread reconnect.
        clientPolicy.failIfNotConnected = false;
        clientPolicy.writePolicyDefault.totalTimeout = 2000;
        clientPolicy.writePolicyDefault.socketTimeout = 1000;

        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = 2000;
        policy.socketTimeout = 1000;
        policy.expiration = anomalyTtlSeconds;
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }
}
