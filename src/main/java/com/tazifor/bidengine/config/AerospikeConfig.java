package com.tazifor.bidengine.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Host;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.CommitLevel;
import com.aerospike.client.policy.WritePolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Aerospike client for the shared campaign replica and budget store.
 *
 * Only active with {@code bidengine.store=aerospike}; the default in-memory store needs no cluster.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "bidengine.store", havingValue = "aerospike")
public class AerospikeConfig {

    private static final int DEFAULT_PORT = 3000;

    @Value("${aerospike.hosts}")
    private String hosts;

    @Value("${aerospike.namespace}")
    private String namespace;

    @Value("${aerospike.timeout-ms:50}")
    private int timeoutMs;

    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient() {
        ClientPolicy policy = new ClientPolicy();

        // sized for many concurrent auctions per node
        policy.maxConnsPerNode = 300;
        policy.connPoolsPerNode = 1;
        policy.readPolicyDefault.totalTimeout = timeoutMs;
        policy.writePolicyDefault.totalTimeout = timeoutMs;

        AerospikeClient client = new AerospikeClient(policy, parseHosts(hosts));

        log.info("Connected to Aerospike hosts={} namespace={} nodes={}",
            hosts, namespace, client.getNodes().length);
        return client;
    }

    /**
     * Write policy for budget operations, acknowledged by the master replica
     */
    @Bean("budgetWritePolicy")
    public WritePolicy budgetWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = timeoutMs;
        policy.sendKey = true;
        policy.commitLevel = CommitLevel.COMMIT_MASTER;
        return policy;
    }

    static Host[] parseHosts(String hosts) {
        List<Host> hostList = new ArrayList<>();
        for (String hostPart : hosts.split(",")) {
            if (hostPart.isBlank()) {
                continue;
            }
            String[] parts = hostPart.trim().split(":");
            int port = parts.length > 1 ? Integer.parseInt(parts[1]) : DEFAULT_PORT;
            hostList.add(new Host(parts[0], port));
        }
        if (hostList.isEmpty()) {
            throw new IllegalArgumentException("aerospike.hosts is empty");
        }
        return hostList.toArray(new Host[0]);
    }
}
