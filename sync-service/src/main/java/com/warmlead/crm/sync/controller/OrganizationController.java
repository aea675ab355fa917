package com.warmlead.crm.sync.controller;

import com.warmlead.crm.sync.dto.ApiResponse;
import com.warmlead.crm.sync.dto.OrganizationPageResponse;
import com.warmlead.crm.sync.service.OrganizationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/organizations")
@RequiredArgsConstructor
@Tag(name = "Organizations", description = "Organizations of the user's contacts")
public class OrganizationController {

    private final OrganizationService organizationService;

    @GetMapping
    @Operation(summary = "List organizations", description = "Paged, largest first, optionally filtered by name")
    public ResponseEntity<ApiResponse<OrganizationPageResponse>> list(
            @RequestHeader(ContactSyncController.USER_HEADER) UUID userId,
            @RequestParam(name = "page", defaultValue = "1") int page,
            @RequestParam(name = "limit", defaultValue = "20") int limit,
            @RequestParam(name = "search", required = false) String search) {
        return ResponseEntity.ok(ApiResponse.success(
            organizationService.getOrganizationsForUser(userId, page, limit, search)));
    }
}
