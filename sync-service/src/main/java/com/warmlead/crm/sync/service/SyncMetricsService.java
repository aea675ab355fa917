package com.warmlead.crm.sync.service;

import com.warmlead.crm.common.error.ErrorKind;
import com.warmlead.crm.sync.enums.SyncStatus;
import com.warmlead.crm.sync.enums.SyncType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Prometheus metrics for contact sync.
 * 
 * Tracks:
 * - Runs per sync type and final status
 * - Contacts per outcome (created / updated / unchanged / failed)
 * - Classified errors per kind
 * - Run duration per sync type
 * - Batch deadline expiries
 * 
 * Metrics are exposed at /actuator/prometheus
 * 
 * ⚠️ PERFORMANCE: meters are created once in @PostConstruct and looked up from maps.
 */
@Service
@RequiredArgsConstructor
public class SyncMetricsService {

    public enum ContactOutcome { CREATED, UPDATED, UNCHANGED, FAILED }

    private final MeterRegistry meterRegistry;

    private final Map<String, Counter> runCounters = new HashMap<>();
    private final Map<ContactOutcome, Counter> contactCounters = new EnumMap<>(ContactOutcome.class);
    private final Map<ErrorKind, Counter> errorCounters = new EnumMap<>(ErrorKind.class);
    private final Map<SyncType, Timer> durationTimers = new EnumMap<>(SyncType.class);
    private Counter batchTimeoutCounter;

    @PostConstruct
    void init() {
        for (SyncType type : SyncType.values()) {
            for (SyncStatus status : SyncStatus.values()) {
                runCounters.put(runKey(type, status), Counter.builder("crm.sync.runs")
                    .description("Sync runs by type and final status")
                    .tag("type", type.name())
                    .tag("status", status.name())
                    .register(meterRegistry));
            }
            durationTimers.put(type, Timer.builder("crm.sync.duration")
                .description("Wall-clock duration of sync runs")
                .tag("type", type.name())
                .register(meterRegistry));
        }
        for (ContactOutcome outcome : ContactOutcome.values()) {
            contactCounters.put(outcome, Counter.builder("crm.sync.contacts")
                .description("Contacts processed by outcome")
                .tag("outcome", outcome.name().toLowerCase())
                .register(meterRegistry));
        }
        for (ErrorKind kind : ErrorKind.values()) {
            errorCounters.put(kind, Counter.builder("crm.sync.errors")
                .description("Classified sync errors")
                .tag("kind", kind.name())
                .register(meterRegistry));
        }
        batchTimeoutCounter = Counter.builder("crm.sync.batch.timeouts")
            .description("Batches that exceeded their deadline")
            .register(meterRegistry);
    }

    public void recordRun(SyncType type, SyncStatus status, long durationMs) {
        Counter counter = runCounters.get(runKey(type, status));
        if (counter != null) {
            counter.increment();
        }
        Timer timer = durationTimers.get(type);
        if (timer != null) {
            timer.record(Duration.ofMillis(durationMs));
        }
    }

    public void recordContact(ContactOutcome outcome) {
        contactCounters.get(outcome).increment();
    }

    public void recordError(ErrorKind kind) {
        errorCounters.get(kind).increment();
    }

    public void recordBatchTimeout() {
        batchTimeoutCounter.increment();
    }

    private static String runKey(SyncType type, SyncStatus status) {
        return type.name() + ":" + status.name();
    }
}
