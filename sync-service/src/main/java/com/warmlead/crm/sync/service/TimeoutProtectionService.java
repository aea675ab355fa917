package com.warmlead.crm.sync.service;

import com.warmlead.crm.common.error.SyncException;
import com.warmlead.crm.sync.config.SyncTimeoutProperties;
import com.warmlead.crm.sync.enums.UserSyncStatus;
import com.warmlead.crm.sync.repository.SyncHistoryRepository;
import com.warmlead.crm.sync.repository.UserRepository;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;

/**
 * Deadlines for sync runs and batches.
 * 
 * Guards operations with sync-level and batch-level deadlines, derives batch deadlines
 * from batch size and keeps per-sync batch duration samples to suggest better settings.
 * 
 * Deadline expiry interrupts the guarded operation (see {@link DeadlineExecutor}).
 * 
 * ⚠️ Samples live in memory per sync id until {@link #clearTimeoutMetrics(UUID)} is called.
 * The orchestrator clears them when a run ends.
 */
@Service
@Slf4j
public class TimeoutProtectionService {

    private static final int LARGE_BATCH_SIZE = 1000;
    private static final int SMALL_BATCH_SIZE = 10;
    private static final double SMALL_BATCH_RATIO = 0.05;

    private final DeadlineExecutor deadlineExecutor;
    private final SyncHistoryRepository syncHistoryRepository;
    private final UserRepository userRepository;
    private final SyncMetricsService metricsService;
    private final Clock clock;
    private final TimeoutConfig defaultConfig;

    private final Map<UUID, List<TimeoutMetrics>> timeoutMetrics = new ConcurrentHashMap<>();

    public TimeoutProtectionService(DeadlineExecutor deadlineExecutor,
                                    SyncHistoryRepository syncHistoryRepository,
                                    UserRepository userRepository,
                                    SyncMetricsService metricsService,
                                    Clock clock,
                                    SyncTimeoutProperties properties) {
        this.deadlineExecutor = deadlineExecutor;
        this.syncHistoryRepository = syncHistoryRepository;
        this.userRepository = userRepository;
        this.metricsService = metricsService;
        this.clock = clock;
        this.defaultConfig = properties.toTimeoutConfig();
    }

    @PostConstruct
    void validateOnStartup() {
        ConfigValidation validation = validateTimeoutConfig(defaultConfig);
        if (!validation.valid()) {
            throw new IllegalStateException("Invalid crm.sync.timeout configuration: "
                + String.join("; ", validation.errors()));
        }
        log.info("Sync deadlines: sync={}ms, batch={}ms, maxBatch={}ms, progressive={}",
            defaultConfig.syncTimeoutMs(), defaultConfig.batchTimeoutMs(),
            defaultConfig.maxBatchTimeoutMs(), defaultConfig.progressiveTimeoutEnabled());
    }

    public TimeoutConfig getDefaultConfig() {
        return defaultConfig;
    }

    /**
     * Race a whole sync run against config.syncTimeoutMs.
     * 
     * On expiry with a sync id and user id, the sync row is marked FAILED and the user's
     * sync state is reset to FAILED with no last sync timestamp. Those writes are best-effort.
     */
    public <T> TimeoutResult<T> executeSyncWithTimeout(Callable<T> operation, TimeoutConfig config, TimeoutScope scope) {
        long start = clock.millis();
        String timeoutMessage = "Sync timeout after " + config.syncTimeoutMs() + "ms";
        try {
            T data = deadlineExecutor.call(operation, config.syncTimeoutMs(), () -> timeoutMessage);
            return TimeoutResult.success(data, clock.millis() - start);
        } catch (Exception e) {
            long duration = clock.millis() - start;
            boolean timedOut = isDeadlineExpiry(e, timeoutMessage);
            if (timedOut) {
                log.warn("{} (sync {})", timeoutMessage, scope.syncId());
                if (scope.syncId() != null && scope.userId() != null) {
                    handleSyncTimeout(scope.syncId(), scope.userId(), timeoutMessage);
                }
            }
            restoreInterrupt(e);
            return TimeoutResult.failure(e, timedOut, duration);
        }
    }

    /**
     * Race one batch against config.batchTimeoutMs.
     * 
     * With a sync id and batch number, a metric sample is recorded on success and on
     * expiry. On expiry the sync row's error field is updated (best-effort).
     */
    public <T> TimeoutResult<T> executeBatchWithTimeout(Callable<T> operation, TimeoutConfig config, TimeoutScope scope) {
        long start = clock.millis();
        String batchLabel = scope.batchNumber() != null ? String.valueOf(scope.batchNumber()) : "unknown";
        String timeoutMessage = "Batch " + batchLabel + " timeout after " + config.batchTimeoutMs() + "ms";
        boolean tracked = scope.syncId() != null && scope.batchNumber() != null;
        try {
            T data = deadlineExecutor.call(operation, config.batchTimeoutMs(), () -> timeoutMessage);
            long duration = clock.millis() - start;
            if (tracked) {
                trackTimeoutMetrics(sample(scope, config, duration, false));
            }
            return TimeoutResult.success(data, duration);
        } catch (Exception e) {
            long duration = clock.millis() - start;
            boolean timedOut = isDeadlineExpiry(e, timeoutMessage);
            if (timedOut) {
                metricsService.recordBatchTimeout();
                log.warn("{} (sync {})", timeoutMessage, scope.syncId());
                if (tracked) {
                    trackTimeoutMetrics(sample(scope, config, duration, true));
                }
                if (scope.syncId() != null) {
                    handleBatchTimeout(scope.syncId(), timeoutMessage);
                }
            }
            restoreInterrupt(e);
            return TimeoutResult.failure(e, timedOut, duration);
        }
    }

    public TimeoutConfig calculateProgressiveTimeout(int totalContacts, int batchSize) {
        return calculateProgressiveTimeout(totalContacts, batchSize, defaultConfig);
    }

    /**
     * Batch deadline for a batch size.
     * 
     * - Progressive timeouts disabled: config unchanged
     * - Batch covers every contact, or at least 1000 contacts: max batch timeout
     * - Batch of at most 10 contacts, or at most 5% of all contacts: base batch timeout
     * - Otherwise linear between base and max by batchSize / totalContacts
     */
    public TimeoutConfig calculateProgressiveTimeout(int totalContacts, int batchSize, TimeoutConfig config) {
        if (!config.progressiveTimeoutEnabled()) {
            return config;
        }
        long base = config.batchTimeoutMs();
        long max = config.maxBatchTimeoutMs();
        if (batchSize >= totalContacts || batchSize >= LARGE_BATCH_SIZE) {
            return config.withBatchTimeoutMs(max);
        }
        if (batchSize <= SMALL_BATCH_SIZE || batchSize <= totalContacts * SMALL_BATCH_RATIO) {
            return config.withBatchTimeoutMs(base);
        }
        double ratio = (double) batchSize / totalContacts;
        double progressive = base + ratio * (max - base);
        progressive = Math.min(Math.max(progressive, base), max);
        return config.withBatchTimeoutMs(Math.round(progressive));
    }

    public ConfigValidation validateTimeoutConfig(TimeoutConfig config) {
        List<String> errors = new ArrayList<>();
        if (config.syncTimeoutMs() <= 0) {
            errors.add("syncTimeoutMs must be positive");
        }
        if (config.batchTimeoutMs() <= 0) {
            errors.add("batchTimeoutMs must be positive");
        }
        if (config.maxBatchTimeoutMs() <= 0) {
            errors.add("maxBatchTimeoutMs must be positive");
        }
        if (config.batchTimeoutMs() > config.syncTimeoutMs()) {
            errors.add("batchTimeoutMs cannot exceed syncTimeoutMs");
        }
        if (config.maxBatchTimeoutMs() > config.syncTimeoutMs()) {
            errors.add("maxBatchTimeoutMs cannot exceed syncTimeoutMs");
        }
        return new ConfigValidation(errors.isEmpty(), List.copyOf(errors));
    }

    public TimeoutMetrics trackTimeoutMetrics(TimeoutMetrics metrics) {
        TimeoutMetrics stamped = metrics.timestamp() != null ? metrics : new TimeoutMetrics(
            metrics.syncId(), metrics.batchNumber(), metrics.timeoutMs(), metrics.actualDurationMs(),
            metrics.wasTimeout(), LocalDateTime.now(clock));
        timeoutMetrics.computeIfAbsent(stamped.syncId(), id -> new CopyOnWriteArrayList<>()).add(stamped);
        return stamped;
    }

    public TimeoutPatterns analyzeTimeoutPatterns(UUID syncId) {
        List<TimeoutMetrics> samples = timeoutMetrics.getOrDefault(syncId, List.of());
        if (samples.isEmpty()) {
            return TimeoutPatterns.empty();
        }
        int timeouts = (int) samples.stream().filter(TimeoutMetrics::wasTimeout).count();
        int total = samples.size();
        double average = samples.stream().mapToLong(TimeoutMetrics::actualDurationMs).average().orElse(0);
        long maxDuration = samples.stream().mapToLong(TimeoutMetrics::actualDurationMs).max().orElse(0);
        return new TimeoutPatterns(timeouts, total, (double) timeouts / total, average, maxDuration);
    }

    /**
     * Suggest a larger batch deadline when batches run close to it or expire often.
     * Suggestions never exceed the configured max batch timeout.
     */
    public TimeoutSuggestions suggestTimeoutAdjustments(long currentTimeoutMs, double averageDurationMs,
                                                        double timeoutRate, int totalBatches) {
        long max = defaultConfig.maxBatchTimeoutMs();
        if (averageDurationMs > currentTimeoutMs * 0.8) {
            long recommended = Math.min(Math.round(averageDurationMs * 1.5), max);
            return new TimeoutSuggestions(true, recommended, "average duration exceeds 80% of current timeout");
        }
        if (timeoutRate > 0.2 && totalBatches > 5) {
            long recommended = Math.min(Math.round(currentTimeoutMs * 1.5), max);
            return new TimeoutSuggestions(true, recommended,
                String.format("High timeout rate (%.1f%%) suggests timeout is too aggressive", timeoutRate * 100));
        }
        return new TimeoutSuggestions(false, currentTimeoutMs, "low timeout rate");
    }

    public void clearTimeoutMetrics(UUID syncId) {
        timeoutMetrics.remove(syncId);
    }

    private void handleSyncTimeout(UUID syncId, UUID userId, String message) {
        try {
            syncHistoryRepository.markFailed(syncId, message, LocalDateTime.now(clock));
        } catch (RuntimeException e) {
            log.warn("Failed to update sync history {} on timeout: {}", syncId, e.getMessage());
        }
        try {
            userRepository.updateSyncState(userId, UserSyncStatus.FAILED, null);
        } catch (RuntimeException e) {
            log.warn("Failed to reset sync state of user {} on timeout: {}", userId, e.getMessage());
        }
    }

    private void handleBatchTimeout(UUID syncId, String message) {
        try {
            syncHistoryRepository.recordError(syncId, message, LocalDateTime.now(clock));
        } catch (RuntimeException e) {
            log.warn("Failed to update sync history {} on batch timeout: {}", syncId, e.getMessage());
        }
    }

    private TimeoutMetrics sample(TimeoutScope scope, TimeoutConfig config, long duration, boolean wasTimeout) {
        return new TimeoutMetrics(scope.syncId(), scope.batchNumber(), config.batchTimeoutMs(),
            duration, wasTimeout, LocalDateTime.now(clock));
    }

    private static boolean isDeadlineExpiry(Exception e, String timeoutMessage) {
        return e instanceof SyncException && timeoutMessage.equals(e.getMessage())
            && e.getCause() instanceof TimeoutException;
    }

    private static void restoreInterrupt(Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
    }
}
