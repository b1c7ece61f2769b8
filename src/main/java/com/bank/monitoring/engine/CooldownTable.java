package com.bank.monitoring.engine;

import com.bank.monitoring.model.Severity;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Last dispatch time per (status, severity), on a monotonic clock.
 *
 * Check-and-set, reset and snapshots are mutually exclusive, so one table can be
 * shared between the scheduler thread and request threads. Entries are never
 * persisted; a restart re-arms every key. Size is bounded by statuses x severities.
 */
public class CooldownTable {

    private final Map<String, Long> lastDispatchNanos = new HashMap<>();
    private final LongSupplier nanoClock;

    public CooldownTable() {
        this(System::nanoTime);
    }

    public CooldownTable(LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
    }

    /**
     * Records a dispatch for the key unless one happened less than {@code cooldown} ago.
     *
     * @return true if the caller may dispatch, false if the key is still cooling down
     */
    public synchronized boolean tryAcquire(String status, Severity severity, Duration cooldown) {
        String key = key(status, severity);
        long now = nanoClock.getAsLong();
        Long last = lastDispatchNanos.get(key);
        if (last != null && now - last < cooldown.toNanos()) {
            return false;
        }
        lastDispatchNanos.put(key, now);
        return true;
    }

    public synchronized void clear() {
        lastDispatchNanos.clear();
    }

    public synchronized int size() {
        return lastDispatchNanos.size();
    }

    /**
     * Keys still inside their cooldown, mapped to the remaining time.
     */
    public synchronized Map<String, Duration> active(Duration cooldown) {
        long now = nanoClock.getAsLong();
        Map<String, Duration> active = new LinkedHashMap<>();
        lastDispatchNanos.forEach((key, last) -> {
            long remaining = cooldown.toNanos() - (now - last);
            if (remaining > 0) {
                active.put(key, Duration.ofNanos(remaining));
            }
        });
        return active;
    }

    static String key(String status, Severity severity) {
        return status + ":" + severity.name();
    }
}
