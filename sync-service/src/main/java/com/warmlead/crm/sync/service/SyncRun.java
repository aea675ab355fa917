package com.warmlead.crm.sync.service;

import com.warmlead.crm.sync.entity.Organization;
import com.warmlead.crm.sync.enums.SyncType;
import com.warmlead.crm.sync.pipedrive.PipedriveClient;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * State of one sync run. Discarded when the run ends.
 * 
 * Contacts are processed on a single worker thread. Counters are atomic because the
 * caller reads them when the run's deadline expires while the worker may still be
 * winding down.
 */
class SyncRun {

    final UUID syncId;
    final UUID userId;
    final SyncType syncType;
    final LocalDateTime since;
    final LocalDateTime startTime;
    final int batchSize;
    final int startOffset;
    final PipedriveClient client;

    final AtomicInteger processed = new AtomicInteger();
    final AtomicInteger created = new AtomicInteger();
    final AtomicInteger updated = new AtomicInteger();
    final AtomicInteger failed = new AtomicInteger();

    /** Resolved organizations by Pipedrive org id. */
    final Map<String, Organization> organizations = new HashMap<>();
    final Set<UUID> touchedOrganizations = new LinkedHashSet<>();
    final List<FailedBatch> failedBatches = new ArrayList<>();

    /** Pipedrive organization names, loaded at most once. Null until needed. */
    Map<Long, String> remoteOrganizationNames;

    volatile int estimatedTotal;
    volatile int currentBatch;
    volatile Throwable lastContactError;
    /** First contact failure whose kind is not recoverable. Fails the run once it completes. */
    volatile Throwable nonRecoverableError;
    volatile BatchRecoveryPlan fatalPlan;
    volatile TimeoutConfig lastBatchConfig;

    SyncRun(UUID syncId, UUID userId, SyncType syncType, LocalDateTime since, LocalDateTime startTime,
            int batchSize, int startOffset, int estimatedTotal, PipedriveClient client) {
        this.syncId = syncId;
        this.userId = userId;
        this.syncType = syncType;
        this.since = since;
        this.startTime = startTime;
        this.batchSize = batchSize;
        this.startOffset = startOffset;
        this.estimatedTotal = estimatedTotal;
        this.client = client;
    }

    boolean allFailed() {
        return processed.get() > 0 && failed.get() == processed.get();
    }

    boolean hasFailed() {
        return nonRecoverableError != null || allFailed();
    }

    synchronized List<FailedBatch> failedBatchesSnapshot() {
        return List.copyOf(failedBatches);
    }

    synchronized void addFailedBatch(FailedBatch batch) {
        failedBatches.add(batch);
    }

    synchronized Set<UUID> touchedOrganizationsSnapshot() {
        return Set.copyOf(touchedOrganizations);
    }

    synchronized void touchOrganization(UUID organizationId) {
        touchedOrganizations.add(organizationId);
    }
}
