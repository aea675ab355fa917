package com.warmlead.crm.sync.service;

import com.warmlead.crm.common.error.ErrorClassification;
import com.warmlead.crm.common.error.ErrorKind;
import com.warmlead.crm.common.retry.RecoveryStrategy;
import com.warmlead.crm.common.retry.RecoveryStrategyResolver;
import com.warmlead.crm.sync.enums.SyncStatus;
import com.warmlead.crm.sync.repository.SyncHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Recovers from sync failures.
 * 
 * Selects a strategy per classified failure, retries operations with the strategy's
 * delays, finds checkpoints to resume from and builds recovery plans for failed batches.
 * 
 * Strategy per kind comes from the {@link RecoveryStrategyResolver}:
 * - RATE_LIMIT, EXTERNAL_API, UNKNOWN: retry with exponential backoff
 * - NETWORK: resume from last success (flat delay)
 * - DATABASE: full retry (flat delay)
 * - AUTHENTICATION, VALIDATION: no recovery
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ErrorRecoveryService {

    static final int DEFAULT_ESTIMATED_TOTAL_CONTACTS = 500;
    static final long ESTIMATED_MS_PER_CONTACT = 2000;

    private final ErrorClassifier errorClassifier;
    private final RecoveryStrategyResolver strategyResolver;
    private final SyncHistoryRepository syncHistoryRepository;
    private final DeadlineExecutor deadlineExecutor;
    private final BackoffSleeper backoffSleeper;
    private final SyncMetricsService metricsService;
    private final Clock clock;

    public RecoveryStrategy selectStrategy(Throwable error) {
        return strategyResolver.resolve(errorClassifier.kindOf(error));
    }

    /**
     * Run an operation with a fixed recovery strategy.
     * 
     * Makes at most maxRetries + 1 attempts, each guarded by timeoutMs. After a failed
     * attempt RETRY_WITH_BACKOFF waits baseDelayMs * 2^(attempt-1), NO_RECOVERY stops,
     * and any other strategy waits baseDelayMs.
     */
    public <T> RecoveryResult<T> executeWithRecovery(Callable<T> operation, RecoveryStrategy strategy,
                                                     RecoveryOptions options) {
        return execute(operation, strategy, error -> strategy, options);
    }

    public <T> RecoveryResult<T> executeWithRecovery(Callable<T> operation, RecoveryStrategy strategy) {
        return executeWithRecovery(operation, strategy, RecoveryOptions.defaults());
    }

    /**
     * Like {@link #executeWithRecovery}, but the strategy is selected again from each
     * failure, so an authentication failure stops at once while a rate limit backs off.
     */
    public <T> RecoveryResult<T> executeWithAdaptiveRecovery(Callable<T> operation, RecoveryOptions options) {
        return execute(operation, null, this::selectStrategy, options);
    }

    private <T> RecoveryResult<T> execute(Callable<T> operation, RecoveryStrategy initialStrategy,
                                          Function<Throwable, RecoveryStrategy> strategyFor,
                                          RecoveryOptions options) {
        int maxAttempts = Math.max(0, options.maxRetries()) + 1;
        RecoveryStrategy strategy = initialStrategy;

        for (int attempt = 1; ; attempt++) {
            Exception failure;
            try {
                T data = deadlineExecutor.call(operation, options.timeoutMs(),
                    () -> "Operation timeout after " + options.timeoutMs() + "ms");
                return RecoveryResult.success(data, attempt, strategy);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return RecoveryResult.failure("Operation interrupted", ErrorKind.NETWORK, attempt, strategy);
            } catch (Exception e) {
                failure = e;
            }

            strategy = strategyFor.apply(failure);
            ErrorKind kind = errorClassifier.kindOf(failure);
            if (strategy == RecoveryStrategy.NO_RECOVERY || attempt >= maxAttempts) {
                return RecoveryResult.failure(failure.getMessage(), kind, attempt, strategy);
            }

            long delay = strategy == RecoveryStrategy.RETRY_WITH_BACKOFF
                ? options.baseDelayMs() * (1L << (attempt - 1))
                : options.baseDelayMs();
            log.warn("Attempt {}/{} failed ({}: {}), retrying in {}ms with {}",
                attempt, maxAttempts, kind, failure.getMessage(), delay, strategy);
            try {
                backoffSleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return RecoveryResult.failure(failure.getMessage(), kind, attempt, strategy);
            }
        }
    }

    /**
     * Newest successful sync of the user, by end time.
     * Empty when the user never synced successfully; callers then run a FULL sync.
     */
    public Optional<RecoveryPoint> findLastSuccessfulSyncPoint(UUID userId) {
        return syncHistoryRepository.findFirstByUserIdAndStatusOrderByEndTimeDesc(userId, SyncStatus.SUCCESS)
            .map(history -> new RecoveryPoint(
                history.getContactsProcessed(),
                history.getContactsUpdated(),
                history.getContactsCreated(),
                history.getContactsFailed(),
                history.getEndTime()));
    }

    public ResumeParameters calculateResumeParameters(RecoveryPoint point, int batchSize) {
        return calculateResumeParameters(point, batchSize, DEFAULT_ESTIMATED_TOTAL_CONTACTS);
    }

    public ResumeParameters calculateResumeParameters(RecoveryPoint point, int batchSize, int estimatedTotalContacts) {
        int startFrom = point.contactsProcessed();
        return new ResumeParameters(startFrom, startFrom, estimatedTotalContacts - startFrom, batchSize);
    }

    public BatchRecoveryPlan createBatchRecoveryPlan(FailedBatch batch) {
        RecoveryStrategy strategy = selectStrategy(batch.error());
        List<String> skip = batch.succeededContacts() != null ? List.copyOf(batch.succeededContacts()) : List.of();
        return new BatchRecoveryPlan(
            batch.batchNumber(),
            batch.startIndex(),
            batch.endIndex(),
            skip,
            strategy,
            ESTIMATED_MS_PER_CONTACT * (batch.endIndex() - batch.startIndex()));
    }

    public MultiBatchRecoveryPlan createMultiBatchRecoveryPlan(List<FailedBatch> batches) {
        List<BatchRecoveryPlan> plans = batches.stream().map(this::createBatchRecoveryPlan).toList();
        long total = plans.stream().mapToLong(BatchRecoveryPlan::estimatedDurationMs).sum();
        return new MultiBatchRecoveryPlan(plans, total, RecoveryStrategy.RESUME_FROM_LAST_SUCCESS);
    }

    /**
     * Record a run-ending error: the sync row becomes FAILED with "{KIND}: {message}".
     * A failure to write the row is logged, never thrown.
     */
    public ErrorClassification logError(Throwable error, ErrorContext context) {
        ErrorClassification classification = errorClassifier.classify(error);
        log.error("Sync {} failed for user {} (batch {}): {}: {}",
            context.syncId(), context.userId(), context.batchNumber(), classification.kind(), error.getMessage());

        if (context.syncId() != null) {
            try {
                syncHistoryRepository.markFailed(context.syncId(),
                    classification.kind() + ": " + error.getMessage(), LocalDateTime.now(clock));
            } catch (RuntimeException e) {
                log.warn("Failed to record error on sync {}: {}", context.syncId(), e.getMessage());
            }
        }
        trackError(error, context.userId());
        return classification;
    }

    public ErrorEvent trackError(Throwable error, UUID userId) {
        ErrorClassification classification = errorClassifier.classify(error);
        metricsService.recordError(classification.kind());
        return new ErrorEvent(classification.kind(), userId, LocalDateTime.now(clock), classification.recoverable());
    }
}
