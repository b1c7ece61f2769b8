package com.bank.monitoring.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.bank.monitoring.repository.StatusCountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the count store under {@code /actuator/health} as {@code aerospike}:
 * DOWN when the client has no live cluster connection or the record count cannot be read.
 */
@Component("aerospike")
public class AerospikeHealthIndicator implements HealthIndicator {

    private static final Logger log = LoggerFactory.getLogger(AerospikeHealthIndicator.class);

    private final AerospikeClient client;
    private final StatusCountRepository repository;

    public AerospikeHealthIndicator(AerospikeClient client, StatusCountRepository repository) {
        this.client = client;
        this.repository = repository;
    }

    @Override
    public Health health() {
        if (!client.isConnected()) {
            return Health.down()
                    .withDetail("dbConnected", false)
                    .withDetail("totalRecords", 0L)
                    .build();
        }

        try {
            return Health.up()
                    .withDetail("dbConnected", true)
                    .withDetail("totalRecords", repository.countStatusRecords())
                    .build();
        } catch (AerospikeException e) {
            log.warn("Aerospike health check failed: {}", e.getMessage());
            return Health.down(e)
                    .withDetail("dbConnected", false)
                    .withDetail("totalRecords", 0L)
                    .build();
        }
    }
}
