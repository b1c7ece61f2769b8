package com.bank.monitoring.config;

import com.aerospike.client.policy.BatchPolicy;
import com.aerospike.client.policy.WritePolicy;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.Bean;

import java.lang.reflect.Method;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class AerospikeConfigTest {

    private final AerospikeConfig config = new AerospikeConfig();

    @Test
    void exposesOnlyThePoliciesTheRepositoryInjects() {
        assertThat(Arrays.stream(AerospikeConfig.class.getDeclaredMethods())
                .filter(m -> m.isAnnotationPresent(Bean.class))
                .map(Method::getName))
                .containsExactlyInAnyOrder("aerospikeClient", "defaultWritePolicy",
                        "defaultBatchPolicy", "aerospikeNamespace");
    }

    @Test
    void writePolicy_timeouts() {
        WritePolicy policy = config.defaultWritePolicy();

        assertThat(policy.totalTimeout).isEqualTo(3000);
        assertThat(policy.socketTimeout).isEqualTo(1000);
    }

    @Test
    void batchPolicy_allowsForDayLongHistoryReads() {
        BatchPolicy policy = config.defaultBatchPolicy();

        assertThat(policy.totalTimeout).isEqualTo(5000);
        assertThat(policy.socketTimeout).isEqualTo(2000);
    }
}
