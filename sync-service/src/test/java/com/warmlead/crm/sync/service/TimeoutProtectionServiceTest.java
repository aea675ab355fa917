package com.warmlead.crm.sync.service;

import com.warmlead.crm.common.error.ErrorKind;
import com.warmlead.crm.common.error.SyncException;
import com.warmlead.crm.sync.config.SyncTimeoutProperties;
import com.warmlead.crm.sync.enums.UserSyncStatus;
import com.warmlead.crm.sync.repository.SyncHistoryRepository;
import com.warmlead.crm.sync.repository.UserRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TimeoutProtectionServiceTest {

    @Mock
    private SyncHistoryRepository syncHistoryRepository;

    @Mock
    private UserRepository userRepository;

    private ExecutorService executor;
    private TimeoutProtectionService service;
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        SyncMetricsService metricsService = new SyncMetricsService(meterRegistry);
        metricsService.init();
        service = new TimeoutProtectionService(new DeadlineExecutor(executor), syncHistoryRepository,
            userRepository, metricsService, Clock.systemUTC(), new SyncTimeoutProperties());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testCalculateProgressiveTimeout_BatchCoversAllContacts_UsesMax() {
        assertEquals(120_000, service.calculateProgressiveTimeout(100, 100).batchTimeoutMs());
        assertEquals(120_000, service.calculateProgressiveTimeout(5000, 1000).batchTimeoutMs());
    }

    @Test
    void testCalculateProgressiveTimeout_SmallBatch_UsesBase() {
        assertEquals(30_000, service.calculateProgressiveTimeout(1000, 10).batchTimeoutMs());
        assertEquals(30_000, service.calculateProgressiveTimeout(1000, 50).batchTimeoutMs());
    }

    @Test
    void testCalculateProgressiveTimeout_MediumBatch_Interpolates() {
        long timeout = service.calculateProgressiveTimeout(1000, 500).batchTimeoutMs();

        assertTrue(timeout > 30_000 && timeout < 120_000);
        assertEquals(75_000, timeout);
    }

    @Test
    void testCalculateProgressiveTimeout_Disabled_ReturnsConfigUnchanged() {
        TimeoutConfig config = new TimeoutConfig(300_000, 30_000, 120_000, false);

        assertSame(config, service.calculateProgressiveTimeout(100, 100, config));
    }

    @Test
    void testValidateTimeoutConfig_Defaults_AreValid() {
        ConfigValidation validation = service.validateTimeoutConfig(TimeoutConfig.defaults());

        assertTrue(validation.valid());
        assertTrue(validation.errors().isEmpty());
    }

    @Test
    void testValidateTimeoutConfig_BatchLongerThanSync_IsRejected() {
        ConfigValidation validation = service.validateTimeoutConfig(new TimeoutConfig(10_000, 20_000, 5_000, true));

        assertFalse(validation.valid());
        assertTrue(validation.errors().contains("batchTimeoutMs cannot exceed syncTimeoutMs"));
    }

    @Test
    void testValidateTimeoutConfig_AccumulatesEveryViolation() {
        ConfigValidation validation = service.validateTimeoutConfig(new TimeoutConfig(0, -1, 0, true));

        assertEquals(3, validation.errors().size());
    }

    @Test
    void testValidateOnStartup_InvalidProperties_FailsFast() {
        SyncTimeoutProperties properties = new SyncTimeoutProperties();
        properties.setBatchTimeoutMs(600_000);
        TimeoutProtectionService invalid = new TimeoutProtectionService(new DeadlineExecutor(executor),
            syncHistoryRepository, userRepository, mock(SyncMetricsService.class), Clock.systemUTC(), properties);

        assertThrows(IllegalStateException.class, invalid::validateOnStartup);
    }

    @Test
    void testExecuteSyncWithTimeout_Completes_ReturnsData() {
        TimeoutResult<String> result = service.executeSyncWithTimeout(() -> "done",
            TimeoutConfig.defaults(), TimeoutScope.none());

        assertTrue(result.success());
        assertEquals("done", result.data());
        assertFalse(result.timedOut());
    }

    @Test
    void testExecuteSyncWithTimeout_Expires_MarksSyncAndUserFailedAndCancelsOperation() throws Exception {
        UUID syncId = UUID.randomUUID();
        UUID userId = UUID.randomUUID();
        CountDownLatch interrupted = new CountDownLatch(1);
        TimeoutConfig config = new TimeoutConfig(100, 50, 80, true);

        TimeoutResult<String> result = service.executeSyncWithTimeout(() -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return "late";
        }, config, TimeoutScope.sync(syncId, userId));

        assertFalse(result.success());
        assertTrue(result.timedOut());
        assertEquals("Sync timeout after 100ms", result.error());
        assertInstanceOf(SyncException.class, result.failure());
        assertEquals(ErrorKind.NETWORK, ((SyncException) result.failure()).getKind());
        assertTrue(interrupted.await(2, TimeUnit.SECONDS));
        verify(syncHistoryRepository).markFailed(eq(syncId), eq("Sync timeout after 100ms"), any(LocalDateTime.class));
        verify(userRepository).updateSyncState(eq(userId), eq(UserSyncStatus.FAILED), isNull());
    }

    @Test
    void testExecuteSyncWithTimeout_TimeoutHandlerWriteFails_StillReturnsResult() {
        when(syncHistoryRepository.markFailed(any(), any(), any()))
            .thenThrow(new DataAccessResourceFailureException("db down"));

        TimeoutResult<String> result = service.executeSyncWithTimeout(() -> {
            Thread.sleep(10_000);
            return "late";
        }, new TimeoutConfig(50, 50, 50, true), TimeoutScope.sync(UUID.randomUUID(), UUID.randomUUID()));

        assertTrue(result.timedOut());
    }

    @Test
    void testExecuteSyncWithTimeout_OperationFails_NoTimeoutHandling() {
        TimeoutResult<String> result = service.executeSyncWithTimeout(() -> {
            throw new IllegalStateException("boom");
        }, TimeoutConfig.defaults(), TimeoutScope.sync(UUID.randomUUID(), UUID.randomUUID()));

        assertFalse(result.success());
        assertFalse(result.timedOut());
        assertEquals("boom", result.error());
        verifyNoInteractions(syncHistoryRepository, userRepository);
    }

    @Test
    void testExecuteBatchWithTimeout_RecordsSamplesOnSuccessAndTimeout() {
        UUID syncId = UUID.randomUUID();
        TimeoutConfig config = new TimeoutConfig(1000, 50, 100, true);

        service.executeBatchWithTimeout(() -> "fast", config, TimeoutScope.batch(syncId, 1));
        TimeoutResult<String> expired = service.executeBatchWithTimeout(() -> {
            Thread.sleep(10_000);
            return "slow";
        }, config, TimeoutScope.batch(syncId, 2));

        assertTrue(expired.timedOut());
        assertEquals("Batch 2 timeout after 50ms", expired.error());
        verify(syncHistoryRepository).recordError(eq(syncId), eq("Batch 2 timeout after 50ms"), any(LocalDateTime.class));

        TimeoutPatterns patterns = service.analyzeTimeoutPatterns(syncId);
        assertEquals(2, patterns.totalBatches());
        assertEquals(1, patterns.timeoutCount());
        assertEquals(0.5, patterns.timeoutRate());
        assertTrue(patterns.maxDurationMs() >= 50);
        assertEquals(1.0, meterRegistry.get("crm.sync.batch.timeouts").counter().count());
    }

    @Test
    void testExecuteBatchWithTimeout_WithoutBatchNumber_RecordsNothing() {
        UUID syncId = UUID.randomUUID();

        service.executeBatchWithTimeout(() -> "ok", TimeoutConfig.defaults(), TimeoutScope.sync(syncId, UUID.randomUUID()));

        assertEquals(0, service.analyzeTimeoutPatterns(syncId).totalBatches());
    }

    @Test
    void testAnalyzeTimeoutPatterns_UnknownSync_IsEmpty() {
        TimeoutPatterns patterns = service.analyzeTimeoutPatterns(UUID.randomUUID());

        assertEquals(0, patterns.totalBatches());
        assertEquals(0.0, patterns.timeoutRate());
    }

    @Test
    void testAnalyzeTimeoutPatterns_AggregatesSamples() {
        UUID syncId = UUID.randomUUID();
        service.trackTimeoutMetrics(new TimeoutMetrics(syncId, 1, 30_000, 1_000, false, null));
        service.trackTimeoutMetrics(new TimeoutMetrics(syncId, 2, 30_000, 3_000, false, null));
        service.trackTimeoutMetrics(new TimeoutMetrics(syncId, 3, 30_000, 30_000, true, null));

        TimeoutPatterns patterns = service.analyzeTimeoutPatterns(syncId);

        assertEquals(3, patterns.totalBatches());
        assertEquals(1, patterns.timeoutCount());
        assertEquals(34_000 / 3.0, patterns.averageDurationMs(), 0.001);
        assertEquals(30_000, patterns.maxDurationMs());
    }

    @Test
    void testClearTimeoutMetrics_DropsSamples() {
        UUID syncId = UUID.randomUUID();
        service.trackTimeoutMetrics(new TimeoutMetrics(syncId, 1, 30_000, 1_000, false, LocalDateTime.now()));

        service.clearTimeoutMetrics(syncId);

        assertEquals(0, service.analyzeTimeoutPatterns(syncId).totalBatches());
    }

    @Test
    void testSuggestTimeoutAdjustments_SlowBatches_SuggestsOneAndAHalfTimesMean() {
        TimeoutSuggestions suggestion = service.suggestTimeoutAdjustments(30_000, 28_000, 0.0, 3);

        assertTrue(suggestion.shouldIncrease());
        assertEquals(42_000, suggestion.recommendedTimeoutMs());
    }

    @Test
    void testSuggestTimeoutAdjustments_NeverExceedsMaxBatchTimeout() {
        TimeoutSuggestions suggestion = service.suggestTimeoutAdjustments(100_000, 95_000, 0.0, 3);

        assertEquals(120_000, suggestion.recommendedTimeoutMs());
    }

    @Test
    void testSuggestTimeoutAdjustments_FrequentTimeouts_SuggestsIncrease() {
        TimeoutSuggestions suggestion = service.suggestTimeoutAdjustments(30_000, 10_000, 0.5, 10);

        assertTrue(suggestion.shouldIncrease());
        assertEquals(45_000, suggestion.recommendedTimeoutMs());
        assertTrue(suggestion.reason().contains("50.0%"));
    }

    @Test
    void testSuggestTimeoutAdjustments_FewSamples_NoIncrease() {
        TimeoutSuggestions suggestion = service.suggestTimeoutAdjustments(30_000, 10_000, 0.5, 5);

        assertFalse(suggestion.shouldIncrease());
        assertEquals(30_000, suggestion.recommendedTimeoutMs());
    }
}
