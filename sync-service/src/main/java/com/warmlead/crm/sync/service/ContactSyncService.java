package com.warmlead.crm.sync.service;

import com.warmlead.crm.common.error.ErrorClassification;
import com.warmlead.crm.common.error.ErrorKind;
import com.warmlead.crm.common.error.SyncException;
import com.warmlead.crm.common.remote.RemoteCallResult;
import com.warmlead.crm.sync.config.PipedriveProperties;
import com.warmlead.crm.sync.config.SyncRecoveryProperties;
import com.warmlead.crm.sync.dto.SyncHistoryResponse;
import com.warmlead.crm.sync.dto.SyncRequest;
import com.warmlead.crm.sync.dto.SyncResult;
import com.warmlead.crm.sync.entity.Contact;
import com.warmlead.crm.sync.entity.Organization;
import com.warmlead.crm.sync.entity.SyncHistory;
import com.warmlead.crm.sync.entity.User;
import com.warmlead.crm.sync.enums.SyncStatus;
import com.warmlead.crm.sync.enums.SyncType;
import com.warmlead.crm.sync.enums.UserSyncStatus;
import com.warmlead.crm.sync.exception.SyncFailedException;
import com.warmlead.crm.sync.pipedrive.PersonPage;
import com.warmlead.crm.sync.pipedrive.PipedriveClient;
import com.warmlead.crm.sync.pipedrive.PipedriveClientFactory;
import com.warmlead.crm.sync.pipedrive.PipedriveOrgReference;
import com.warmlead.crm.sync.pipedrive.PipedriveOrganization;
import com.warmlead.crm.sync.pipedrive.PipedrivePerson;
import com.warmlead.crm.sync.pipedrive.PipedriveTimestamps;
import com.warmlead.crm.sync.pipedrive.PipedriveUser;
import com.warmlead.crm.sync.repository.ContactRepository;
import com.warmlead.crm.sync.repository.SyncHistoryRepository;
import com.warmlead.crm.sync.repository.UserRepository;
import com.warmlead.crm.sync.service.SyncMetricsService.ContactOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Synchronizes a user's Pipedrive persons into local contacts.
 * 
 * One run:
 * 1. Check the user's API key and the Pipedrive connection (no history row on failure)
 * 2. Pick FULL or INCREMENTAL from the request or the user's last sync timestamp
 * 3. Create a PENDING sync history row
 * 4. Fetch persons page by page; each page is a batch fetched with adaptive recovery
 *    and a progressive batch deadline
 * 5. Create or update each contact, resolving its organization once per run
 * 6. Finalize the history row and the user's sync state
 * 
 * Steps 4 and 5 race the sync deadline. A single contact failing never ends the run.
 * 
 * Final status:
 * - FAILED when a fatal error ends the run (thrown as {@link SyncFailedException})
 * - FAILED when every processed contact failed
 * - SUCCESS otherwise, including when Pipedrive returned no persons
 * 
 * The user's last sync timestamp moves to the run's start time only on SUCCESS.
 * 
 * ⚠️ ONE RUN PER USER: concurrent runs for the same user are rejected by the caller,
 * not here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContactSyncService {

    private final UserRepository userRepository;
    private final ContactRepository contactRepository;
    private final SyncHistoryRepository syncHistoryRepository;
    private final PipedriveClientFactory clientFactory;
    private final OrganizationService organizationService;
    private final ErrorRecoveryService errorRecoveryService;
    private final ErrorClassifier errorClassifier;
    private final TimeoutProtectionService timeoutProtectionService;
    private final SyncMetricsService metricsService;
    private final PipedriveProperties pipedriveProperties;
    private final SyncRecoveryProperties recoveryProperties;
    private final Clock clock;

    public SyncResult runSync(UUID userId, SyncRequest request) {
        SyncRequest options = request != null ? request : SyncRequest.defaults();
        User user = userRepository.findById(userId)
            .orElseThrow(() -> new IllegalArgumentException("User not found: " + userId));

        PipedriveClient client = connect(user);

        int batchSize = options.getBatchSize() != null ? options.getBatchSize() : pipedriveProperties.getPageSize();
        SyncType syncType;
        LocalDateTime since = null;
        int startOffset = 0;
        int estimatedTotal = ErrorRecoveryService.DEFAULT_ESTIMATED_TOTAL_CONTACTS;

        if (options.isResumeFromLastSuccess()) {
            syncType = SyncType.FULL;
            Optional<RecoveryPoint> point = errorRecoveryService.findLastSuccessfulSyncPoint(userId);
            if (point.isPresent()) {
                ResumeParameters resume = errorRecoveryService.calculateResumeParameters(point.get(), batchSize);
                startOffset = resume.skipContacts();
                estimatedTotal = Math.max(resume.skipContacts() + resume.estimatedRemaining(), batchSize);
                log.info("Resuming sync for user {} after {} contacts", userId, startOffset);
            } else {
                log.info("No successful sync to resume from for user {}, running a full sync", userId);
            }
        } else {
            since = options.getSyncType() == SyncType.FULL ? null
                : options.getSinceTimestamp() != null ? options.getSinceTimestamp() : user.getLastSyncTimestamp();
            syncType = since != null ? SyncType.INCREMENTAL : SyncType.FULL;
            if (options.getSyncType() == SyncType.INCREMENTAL && since == null) {
                log.info("Incremental sync requested for user {} without a previous sync, running a full sync", userId);
            }
        }

        long startMillis = clock.millis();
        LocalDateTime startTime = LocalDateTime.now(clock);
        SyncHistory history = new SyncHistory();
        history.setUserId(userId);
        history.setSyncType(syncType);
        history.setStatus(SyncStatus.PENDING);
        history.setStartTime(startTime);
        history = syncHistoryRepository.save(history);
        UUID syncId = history.getId();
        userRepository.updateSyncStatus(userId, UserSyncStatus.SYNCING);
        log.info("Starting {} sync {} for user {} (batch size {}, since {})", syncType, syncId, userId, batchSize, since);

        SyncRun run = new SyncRun(syncId, userId, syncType, since, startTime, batchSize, startOffset,
            estimatedTotal, client);
        TimeoutConfig timeoutConfig = timeoutProtectionService.getDefaultConfig();
        TimeoutResult<SyncRun> outcome = timeoutProtectionService.executeSyncWithTimeout(
            () -> processContacts(run, timeoutConfig), timeoutConfig, TimeoutScope.sync(syncId, userId));

        long durationMs = clock.millis() - startMillis;
        afterRun(run);

        if (!outcome.success()) {
            throw failRun(run, outcome, durationMs);
        }
        return completeRun(run, durationMs);
    }

    public Optional<SyncHistoryResponse> getLatestSync(UUID userId) {
        return syncHistoryRepository.findFirstByUserIdOrderByStartTimeDesc(userId).map(SyncHistoryResponse::from);
    }

    public Optional<SyncHistoryResponse> getSync(UUID userId, UUID syncId) {
        return syncHistoryRepository.findByIdAndUserId(syncId, userId).map(SyncHistoryResponse::from);
    }

    /**
     * @throws SyncFailedException when the user has no API key or Pipedrive rejects the connection
     */
    private PipedriveClient connect(User user) {
        try {
            PipedriveClient client = clientFactory.create(user.getPipedriveApiKey());
            RemoteCallResult<PipedriveUser> connection = client.testConnection();
            if (!connection.success()) {
                ErrorKind kind = connection.errorKind() != null ? connection.errorKind() : ErrorKind.EXTERNAL_API;
                throw new SyncException(kind, "Pipedrive connection test failed: " + connection.error());
            }
            return client;
        } catch (SyncException e) {
            ErrorClassification classification = errorClassifier.classify(e);
            errorRecoveryService.trackError(e, user.getId());
            log.warn("Cannot sync user {}: {}", user.getId(), e.getMessage());
            throw new SyncFailedException(classification, null, e.getMessage(), null, e);
        }
    }

    private SyncRun processContacts(SyncRun run, TimeoutConfig timeoutConfig) {
        RecoveryOptions recoveryOptions = new RecoveryOptions(
            recoveryProperties.getMaxRetries(), recoveryProperties.getBaseDelayMs(), timeoutConfig.syncTimeoutMs());
        int start = run.startOffset;
        int batchNumber = 0;

        while (true) {
            checkCancelled(run);
            batchNumber++;
            run.currentBatch = batchNumber;
            PersonPage page = fetchPage(run, batchNumber, start, recoveryOptions);
            processBatch(run, batchNumber, page);
            try {
                syncHistoryRepository.updateProgress(run.syncId, run.processed.get(), run.created.get(),
                    run.updated.get(), run.failed.get());
            } catch (RuntimeException e) {
                log.warn("Failed to record progress of sync {}: {}", run.syncId, e.getMessage());
            }
            if (!page.hasMore()) {
                return run;
            }
            start = page.nextStart();
            run.estimatedTotal = Math.max(run.estimatedTotal, start + run.batchSize);
        }
    }

    private PersonPage fetchPage(SyncRun run, int batchNumber, int start, RecoveryOptions recoveryOptions) {
        TimeoutConfig batchConfig = timeoutProtectionService.calculateProgressiveTimeout(run.estimatedTotal, run.batchSize);
        run.lastBatchConfig = batchConfig;
        TimeoutScope scope = TimeoutScope.batch(run.syncId, batchNumber);

        RecoveryResult<PersonPage> fetched = errorRecoveryService.executeWithAdaptiveRecovery(() -> {
            TimeoutResult<PersonPage> attempt = timeoutProtectionService.executeBatchWithTimeout(
                () -> run.client.getPersonsPage(run.since, start, run.batchSize).orElseThrow(), batchConfig, scope);
            if (!attempt.success()) {
                throw attempt.failure();
            }
            return attempt.data();
        }, recoveryOptions);

        if (fetched.success()) {
            return fetched.data();
        }
        SyncException failure = new SyncException(
            fetched.errorKind() != null ? fetched.errorKind() : ErrorKind.UNKNOWN,
            "Batch " + batchNumber + " fetch failed after " + fetched.attempts() + " attempt(s): " + fetched.error());
        run.fatalPlan = errorRecoveryService.createBatchRecoveryPlan(
            new FailedBatch(batchNumber, start, start + run.batchSize, List.of(), failure));
        throw failure;
    }

    private void processBatch(SyncRun run, int batchNumber, PersonPage page) {
        int startIndex = run.processed.get();
        List<String> succeeded = new ArrayList<>();
        Throwable batchError = null;

        for (PipedrivePerson person : page.persons()) {
            checkCancelled(run);
            try {
                ContactOutcome outcome = syncContact(run, person);
                switch (outcome) {
                    case CREATED -> run.created.incrementAndGet();
                    case UPDATED -> run.updated.incrementAndGet();
                    default -> { }
                }
                metricsService.recordContact(outcome);
                succeeded.add(String.valueOf(person.id()));
            } catch (RuntimeException e) {
                run.failed.incrementAndGet();
                run.lastContactError = e;
                if (batchError == null) {
                    batchError = e;
                }
                metricsService.recordContact(ContactOutcome.FAILED);
                ErrorEvent event = errorRecoveryService.trackError(e, run.userId);
                if (!event.recoverable() && run.nonRecoverableError == null) {
                    run.nonRecoverableError = e;
                }
                log.warn("Failed to sync Pipedrive person {} in sync {}: {}: {}",
                    person.id(), run.syncId, event.kind(), e.getMessage());
            }
            run.processed.incrementAndGet();
        }

        if (batchError != null) {
            run.addFailedBatch(new FailedBatch(batchNumber, startIndex, run.processed.get(), succeeded, batchError));
        }
    }

    private ContactOutcome syncContact(SyncRun run, PipedrivePerson person) {
        String personId = String.valueOf(person.id());
        Organization organization = resolveOrganization(run, person);
        LocalDateTime remoteUpdate = PipedriveTimestamps.parse(person.updateTime());

        Optional<Contact> existing = contactRepository.findFirstByUserIdAndPipedrivePersonId(run.userId, personId);
        if (existing.isEmpty()) {
            Contact contact = new Contact();
            contact.setUserId(run.userId);
            applyRemote(contact, person, organization, remoteUpdate);
            contactRepository.save(contact);
            return ContactOutcome.CREATED;
        }

        Contact contact = existing.get();
        LocalDateTime localUpdate = contact.getLastPipedriveUpdate();
        if (remoteUpdate != null && (localUpdate == null || remoteUpdate.isAfter(localUpdate))) {
            applyRemote(contact, person, organization, remoteUpdate);
            contactRepository.save(contact);
            return ContactOutcome.UPDATED;
        }
        return ContactOutcome.UNCHANGED;
    }

    private void applyRemote(Contact contact, PipedrivePerson person, Organization organization,
                             LocalDateTime remoteUpdate) {
        contact.setName(person.name() != null && !person.name().isBlank()
            ? person.name().trim() : "Pipedrive person " + person.id());
        contact.setEmail(person.primaryEmail());
        contact.setPhone(person.primaryPhone());
        contact.setPipedrivePersonId(String.valueOf(person.id()));
        contact.setLastPipedriveUpdate(remoteUpdate);

        PipedriveOrgReference reference = person.orgId();
        contact.setPipedriveOrgId(reference != null && reference.id() != null ? String.valueOf(reference.id()) : null);
        contact.setOrganization(organization);
        if (organization != null) {
            contact.setOrganisation(organization.getName());
        } else {
            contact.setOrganisation(person.organizationName());
        }
    }

    /**
     * Local organization for the person's Pipedrive organization, or null when the person
     * has none. Each Pipedrive organization is resolved at most once per run; a failed
     * resolution is not cached.
     */
    private Organization resolveOrganization(SyncRun run, PipedrivePerson person) {
        PipedriveOrgReference reference = person.orgId();
        if (reference == null || reference.id() == null) {
            return null;
        }
        String key = String.valueOf(reference.id());
        Organization cached = run.organizations.get(key);
        if (cached != null) {
            return cached;
        }

        PipedriveOrganization details = fetchOrganizationDetails(run, reference.id());
        String name = person.organizationName();
        if (name == null) {
            name = remoteOrganizationNames(run).get(reference.id());
        }
        if (name == null && details != null) {
            name = details.name();
        }
        if (name == null || name.isBlank()) {
            name = "Pipedrive organization " + key;
        }

        CreateOrganizationData.CreateOrganizationDataBuilder data = CreateOrganizationData.builder()
            .name(name)
            .pipedriveOrgId(key)
            .address(reference.address());
        if (details != null) {
            data.industry(details.industry())
                .size(details.employeeCount() != null ? String.valueOf(details.employeeCount()) : null)
                .website(details.website())
                .country(details.addressCountry())
                .city(details.addressLocality());
            if (details.address() != null) {
                data.address(details.address());
            }
        }

        Organization organization = organizationService.findOrCreateOrganization(data.build());
        run.organizations.put(key, organization);
        run.touchOrganization(organization.getId());
        return organization;
    }

    private PipedriveOrganization fetchOrganizationDetails(SyncRun run, long pipedriveOrgId) {
        try {
            RemoteCallResult<PipedriveOrganization> details = run.client.getOrganizationDetails(pipedriveOrgId);
            if (details.success()) {
                return details.data();
            }
            log.warn("Could not load details of Pipedrive organization {}: {}", pipedriveOrgId, details.error());
        } catch (RuntimeException e) {
            log.warn("Could not load details of Pipedrive organization {}: {}", pipedriveOrgId, e.getMessage());
        }
        return null;
    }

    private Map<Long, String> remoteOrganizationNames(SyncRun run) {
        if (run.remoteOrganizationNames != null) {
            return run.remoteOrganizationNames;
        }
        Map<Long, String> names = new HashMap<>();
        try {
            RemoteCallResult<List<PipedriveOrganization>> organizations = run.client.getOrganizations();
            if (organizations.success() && organizations.data() != null) {
                for (PipedriveOrganization organization : organizations.data()) {
                    if (organization.name() != null) {
                        names.put(organization.id(), organization.name());
                    }
                }
            } else {
                log.warn("Could not list Pipedrive organizations for sync {}: {}", run.syncId, organizations.error());
            }
        } catch (RuntimeException e) {
            log.warn("Could not list Pipedrive organizations for sync {}: {}", run.syncId, e.getMessage());
        }
        run.remoteOrganizationNames = names;
        return names;
    }

    private void afterRun(SyncRun run) {
        for (UUID organizationId : run.touchedOrganizationsSnapshot()) {
            try {
                organizationService.updateOrganizationStats(organizationId);
            } catch (RuntimeException e) {
                log.warn("Failed to refresh stats of organization {}: {}", organizationId, e.getMessage());
            }
        }

        TimeoutPatterns patterns = timeoutProtectionService.analyzeTimeoutPatterns(run.syncId);
        TimeoutConfig batchConfig = run.lastBatchConfig;
        if (patterns.totalBatches() > 0 && batchConfig != null) {
            TimeoutSuggestions suggestion = timeoutProtectionService.suggestTimeoutAdjustments(
                batchConfig.batchTimeoutMs(), patterns.averageDurationMs(), patterns.timeoutRate(), patterns.totalBatches());
            if (suggestion.shouldIncrease()) {
                log.info("Sync {}: consider raising the batch timeout to {}ms ({})",
                    run.syncId, suggestion.recommendedTimeoutMs(), suggestion.reason());
            }
        }
        timeoutProtectionService.clearTimeoutMetrics(run.syncId);
    }

    private SyncFailedException failRun(SyncRun run, TimeoutResult<SyncRun> outcome, long durationMs) {
        Exception failure = outcome.failure();
        try {
            syncHistoryRepository.updateProgress(run.syncId, run.processed.get(), run.created.get(),
                run.updated.get(), run.failed.get());
        } catch (RuntimeException e) {
            log.warn("Failed to record progress of sync {}: {}", run.syncId, e.getMessage());
        }
        ErrorClassification classification = errorRecoveryService.logError(failure,
            new ErrorContext(run.userId, run.syncId, run.currentBatch));
        if (!outcome.timedOut()) {
            try {
                userRepository.updateSyncStatus(run.userId, UserSyncStatus.FAILED);
            } catch (RuntimeException e) {
                log.warn("Failed to update sync status of user {}: {}", run.userId, e.getMessage());
            }
        }
        metricsService.recordRun(run.syncType, SyncStatus.FAILED, durationMs);
        return new SyncFailedException(classification, run.syncId, failure.getMessage(), run.fatalPlan, failure);
    }

    private SyncResult completeRun(SyncRun run, long durationMs) {
        int processed = run.processed.get();
        int failed = run.failed.get();
        SyncStatus status = run.hasFailed() ? SyncStatus.FAILED : SyncStatus.SUCCESS;

        String error = null;
        String userMessage = null;
        if (failed > 0) {
            ErrorClassification lastError = errorClassifier.classify(run.lastContactError);
            error = failed + " of " + processed + " contacts failed; last error " + lastError.kind() + ": "
                + run.lastContactError.getMessage();
            if (run.nonRecoverableError != null) {
                ErrorClassification fatal = errorClassifier.classify(run.nonRecoverableError);
                if (run.nonRecoverableError != run.lastContactError) {
                    error += "; non-recoverable " + fatal.kind() + ": " + run.nonRecoverableError.getMessage();
                }
                userMessage = fatal.userMessage();
            } else if (status == SyncStatus.FAILED) {
                userMessage = lastError.userMessage();
            }
        }

        int rows = syncHistoryRepository.finalizeRun(run.syncId, status, LocalDateTime.now(clock), durationMs,
            processed, run.created.get(), run.updated.get(), failed, error);
        if (rows == 0) {
            log.warn("Sync {} was already finalized, keeping the recorded outcome", run.syncId);
        }

        LocalDateTime lastSyncTimestamp = null;
        if (status == SyncStatus.SUCCESS) {
            lastSyncTimestamp = run.startTime;
            userRepository.updateSyncState(run.userId, UserSyncStatus.COMPLETED, lastSyncTimestamp);
        } else {
            userRepository.updateSyncStatus(run.userId, UserSyncStatus.FAILED);
        }
        metricsService.recordRun(run.syncType, status, durationMs);

        List<FailedBatch> failedBatches = run.failedBatchesSnapshot();
        log.info("Sync {} finished {}: processed={}, created={}, updated={}, failed={} in {}ms",
            run.syncId, status, processed, run.created.get(), run.updated.get(), failed, durationMs);

        return SyncResult.builder()
            .syncId(run.syncId)
            .syncType(run.syncType)
            .status(status)
            .contactsProcessed(processed)
            .contactsCreated(run.created.get())
            .contactsUpdated(run.updated.get())
            .contactsFailed(failed)
            .syncDurationMs(durationMs)
            .lastSyncTimestamp(lastSyncTimestamp)
            .userMessage(userMessage)
            .recoveryPlan(failedBatches.isEmpty() ? null : errorRecoveryService.createMultiBatchRecoveryPlan(failedBatches))
            .build();
    }

    private static void checkCancelled(SyncRun run) {
        if (Thread.currentThread().isInterrupted()) {
            throw new SyncException(ErrorKind.NETWORK, "Sync " + run.syncId + " cancelled after timeout");
        }
    }
}
