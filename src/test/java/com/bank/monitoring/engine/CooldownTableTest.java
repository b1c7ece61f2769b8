package com.bank.monitoring.engine;

import com.bank.monitoring.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class CooldownTableTest {

    private static final Duration COOLDOWN = Duration.ofSeconds(300);

    private final AtomicLong nanos = new AtomicLong(1_000_000_000L);
    private CooldownTable table;

    @BeforeEach
    void setUp() {
        table = new CooldownTable(nanos::get);
    }

    @Test
    void firstAcquire_isAllowed() {
        assertThat(table.tryAcquire("denied", Severity.CRITICAL, COOLDOWN)).isTrue();
        assertThat(table.size()).isEqualTo(1);
    }

    @Test
    void secondAcquireInsideCooldown_isRejected() {
        table.tryAcquire("denied", Severity.CRITICAL, COOLDOWN);
        advance(Duration.ofSeconds(299));

        assertThat(table.tryAcquire("denied", Severity.CRITICAL, COOLDOWN)).isFalse();
    }

    @Test
    void acquireAfterCooldown_isAllowedAgain() {
        table.tryAcquire("denied", Severity.CRITICAL, COOLDOWN);
        advance(COOLDOWN);

        assertThat(table.tryAcquire("denied", Severity.CRITICAL, COOLDOWN)).isTrue();
    }

    @Test
    void rejectedAcquire_doesNotExtendCooldown() {
        table.tryAcquire("denied", Severity.CRITICAL, COOLDOWN);
        advance(Duration.ofSeconds(200));
        table.tryAcquire("denied", Severity.CRITICAL, COOLDOWN);
        advance(Duration.ofSeconds(100));

        assertThat(table.tryAcquire("denied", Severity.CRITICAL, COOLDOWN)).isTrue();
    }

    @Test
    void keysAreIndependentPerStatusAndSeverity() {
        assertThat(table.tryAcquire("denied", Severity.CRITICAL, COOLDOWN)).isTrue();
        assertThat(table.tryAcquire("denied", Severity.WARNING, COOLDOWN)).isTrue();
        assertThat(table.tryAcquire("failed", Severity.CRITICAL, COOLDOWN)).isTrue();
        assertThat(table.size()).isEqualTo(3);
    }

    @Test
    void zeroCooldown_neverSuppresses() {
        assertThat(table.tryAcquire("denied", Severity.CRITICAL, Duration.ZERO)).isTrue();
        assertThat(table.tryAcquire("denied", Severity.CRITICAL, Duration.ZERO)).isTrue();
    }

    @Test
    void clear_rearmsEveryKey() {
        table.tryAcquire("denied", Severity.CRITICAL, COOLDOWN);
        table.clear();

        assertThat(table.size()).isZero();
        assertThat(table.tryAcquire("denied", Severity.CRITICAL, COOLDOWN)).isTrue();
    }

    @Test
    void active_reportsRemainingTimeForCoolingKeysOnly() {
        table.tryAcquire("denied", Severity.CRITICAL, COOLDOWN);
        advance(Duration.ofSeconds(250));
        table.tryAcquire("failed", Severity.WARNING, COOLDOWN);
        advance(Duration.ofSeconds(100));

        Map<String, Duration> active = table.active(COOLDOWN);

        assertThat(active).containsOnlyKeys("failed:WARNING");
        assertThat(active.get("failed:WARNING")).isEqualTo(Duration.ofSeconds(200));
    }

    private void advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
    }
}
