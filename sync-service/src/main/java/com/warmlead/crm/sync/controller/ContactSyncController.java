package com.warmlead.crm.sync.controller;

import com.warmlead.crm.sync.dto.ApiResponse;
import com.warmlead.crm.sync.dto.SearchRequest;
import com.warmlead.crm.sync.dto.SearchResponse;
import com.warmlead.crm.sync.dto.SyncHistoryResponse;
import com.warmlead.crm.sync.dto.SyncRequest;
import com.warmlead.crm.sync.dto.SyncResult;
import com.warmlead.crm.sync.exception.SyncAlreadyRunningException;
import com.warmlead.crm.sync.search.PersonSearchService;
import com.warmlead.crm.sync.service.ContactSyncService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pipedrive contact sync and search.
 * 
 * The caller's user id arrives in the X-User-Id header, set by the gateway after authentication.
 */
@RestController
@RequestMapping("/api/pipedrive/contacts")
@RequiredArgsConstructor
@Tag(name = "Pipedrive contacts", description = "Sync Pipedrive persons into local contacts and search them")
public class ContactSyncController {

    static final String USER_HEADER = "X-User-Id";

    private final ContactSyncService contactSyncService;
    private final PersonSearchService personSearchService;

    // Users with a sync in flight on this node
    private final Set<UUID> runningSyncs = ConcurrentHashMap.newKeySet();

    @PostMapping("/sync")
    @Operation(summary = "Run a sync", description = "Runs a full or incremental sync and returns its counters")
    @ApiResponses(value = {
        @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Sync finished"),
        @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "401", description = "Missing or rejected Pipedrive API key"),
        @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "A sync is already running"),
        @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "429", description = "Pipedrive rate limit")
    })
    public ResponseEntity<ApiResponse<SyncResult>> sync(
            @RequestHeader(USER_HEADER) UUID userId,
            @Valid @RequestBody(required = false) SyncRequest request) {
        if (!runningSyncs.add(userId)) {
            throw new SyncAlreadyRunningException(userId);
        }
        try {
            return ResponseEntity.ok(ApiResponse.success(contactSyncService.runSync(userId, request)));
        } finally {
            runningSyncs.remove(userId);
        }
    }

    @GetMapping("/sync/latest")
    @Operation(summary = "Latest sync", description = "Most recently started sync of the user")
    public ResponseEntity<ApiResponse<SyncHistoryResponse>> latestSync(@RequestHeader(USER_HEADER) UUID userId) {
        return contactSyncService.getLatestSync(userId)
            .map(history -> ResponseEntity.ok(ApiResponse.success(history)))
            .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.error("No sync found")));
    }

    @GetMapping("/sync/{syncId}")
    @Operation(summary = "Sync progress", description = "Counters and status of one sync, for polling")
    public ResponseEntity<ApiResponse<SyncHistoryResponse>> syncStatus(
            @RequestHeader(USER_HEADER) UUID userId,
            @PathVariable UUID syncId) {
        return contactSyncService.getSync(userId, syncId)
            .map(history -> ResponseEntity.ok(ApiResponse.success(history)))
            .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.error("Sync not found")));
    }

    @PostMapping("/search")
    @Operation(summary = "Search persons", description = "Searches Pipedrive persons by name or email")
    public ResponseEntity<ApiResponse<SearchResponse>> search(
            @RequestHeader(USER_HEADER) UUID userId,
            @Valid @RequestBody SearchRequest request) {
        return ResponseEntity.ok(ApiResponse.success(personSearchService.search(userId, request.getQuery())));
    }
}
