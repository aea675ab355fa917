package com.warmlead.crm.sync.service;

import com.warmlead.crm.sync.dto.OrganizationPageResponse;
import com.warmlead.crm.sync.entity.Organization;
import com.warmlead.crm.sync.repository.ContactRepository;
import com.warmlead.crm.sync.repository.OrganizationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OrganizationServiceTest {

    @Mock
    private OrganizationRepository organizationRepository;

    @Mock
    private ContactRepository contactRepository;

    private OrganizationService organizationService;

    @BeforeEach
    void setUp() {
        organizationService = new OrganizationService(organizationRepository, contactRepository);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "Acme, Inc.        | acme inc",
        "ACME INC          | acme inc",
        "  Smith & Sons  | smith sons",
        "foo_bar-baz       | foo bar baz",
        "Example.com       | example com"
    })
    void testNormalizeOrganizationName_StripsSeparatorsAndCase(String input, String expected) {
        assertEquals(expected, organizationService.normalizeOrganizationName(input));
    }

    @Test
    void testNormalizeOrganizationName_IsIdempotent() {
        String once = organizationService.normalizeOrganizationName("  The   Acme -- Group, LLC ");

        assertEquals(once, organizationService.normalizeOrganizationName(once));
    }

    @Test
    void testNormalizeOrganizationName_Null_ReturnsEmpty() {
        assertEquals("", organizationService.normalizeOrganizationName(null));
    }

    @Test
    void testFindOrCreateOrganization_NewName_SavesNormalizedRow() {
        when(organizationRepository.findFirstByPipedriveOrgId("6")).thenReturn(Optional.empty());
        when(organizationRepository.findFirstByNormalizedName("shared organization")).thenReturn(Optional.empty());
        when(organizationRepository.findFirstByNormalizedNameContaining("shared organization")).thenReturn(Optional.empty());
        when(organizationRepository.save(any(Organization.class))).thenAnswer(inv -> inv.getArgument(0));

        Organization created = organizationService.findOrCreateOrganization(CreateOrganizationData.builder()
            .name(" Shared Organization ")
            .pipedriveOrgId("6")
            .city("Berlin")
            .build());

        assertEquals("Shared Organization", created.getName());
        assertEquals("shared organization", created.getNormalizedName());
        assertEquals("6", created.getPipedriveOrgId());
        assertEquals("Berlin", created.getCity());
        assertEquals(0, created.getContactCount());
    }

    @Test
    void testFindOrCreateOrganization_CalledTwice_CreatesOnce() {
        Organization saved = organization("Acme Inc", "acme inc", "42");
        when(organizationRepository.findFirstByPipedriveOrgId("42"))
            .thenReturn(Optional.empty(), Optional.of(saved));
        when(organizationRepository.findFirstByNormalizedName("acme inc")).thenReturn(Optional.empty());
        when(organizationRepository.findFirstByNormalizedNameContaining("acme inc")).thenReturn(Optional.empty());
        when(organizationRepository.save(any(Organization.class))).thenReturn(saved);
        CreateOrganizationData data = CreateOrganizationData.builder().name("Acme, Inc.").pipedriveOrgId("42").build();

        Organization first = organizationService.findOrCreateOrganization(data);
        Organization second = organizationService.findOrCreateOrganization(data);

        assertSame(first, second);
        verify(organizationRepository, times(1)).save(any(Organization.class));
    }

    @Test
    void testFindOrCreateOrganization_NameMatchWithoutPipedriveId_BackfillsId() {
        Organization existing = organization("ACME INC", "acme inc", null);
        when(organizationRepository.findFirstByPipedriveOrgId("42")).thenReturn(Optional.empty());
        when(organizationRepository.findFirstByNormalizedName("acme inc")).thenReturn(Optional.of(existing));
        when(organizationRepository.save(existing)).thenReturn(existing);

        Organization result = organizationService.findOrCreateOrganization(
            CreateOrganizationData.builder().name("Acme, Inc.").pipedriveOrgId("42").build());

        assertSame(existing, result);
        assertEquals("42", result.getPipedriveOrgId());
        verify(organizationRepository, never()).findFirstByNormalizedNameContaining(anyString());
    }

    @Test
    void testFindOrCreateOrganization_MatchWithDifferentPipedriveId_KeepsExistingId() {
        Organization existing = organization("Acme Inc", "acme inc", "7");
        when(organizationRepository.findFirstByPipedriveOrgId("42")).thenReturn(Optional.empty());
        when(organizationRepository.findFirstByNormalizedName("acme inc")).thenReturn(Optional.of(existing));

        Organization result = organizationService.findOrCreateOrganization(
            CreateOrganizationData.builder().name("Acme Inc").pipedriveOrgId("42").build());

        assertEquals("7", result.getPipedriveOrgId());
        verify(organizationRepository, never()).save(any());
    }

    @Test
    void testFindOrCreateOrganization_LegacyRow_MatchedByPartialName() {
        Organization legacy = organization("Acme Inc (legacy)", "acme inc legacy", "9");
        when(organizationRepository.findFirstByNormalizedName("acme inc")).thenReturn(Optional.empty());
        when(organizationRepository.findFirstByNormalizedNameContaining("acme inc")).thenReturn(Optional.of(legacy));

        Organization result = organizationService.findOrCreateOrganization(
            CreateOrganizationData.builder().name("Acme Inc").build());

        assertSame(legacy, result);
        verify(organizationRepository, never()).findFirstByPipedriveOrgId(anyString());
        verify(organizationRepository, never()).save(any());
    }

    @Test
    void testFindOrCreateOrganization_BlankName_Throws() {
        CreateOrganizationData data = CreateOrganizationData.builder().name("   ").build();

        assertThrows(IllegalArgumentException.class, () -> organizationService.findOrCreateOrganization(data));
        verifyNoInteractions(organizationRepository);
    }

    @Test
    void testUpdateOrganizationStats_SetsCountAndLatestActivity() {
        UUID orgId = UUID.randomUUID();
        Organization org = organization("Acme Inc", "acme inc", "42");
        org.setId(orgId);
        LocalDateTime lastContacted = LocalDateTime.of(2025, 7, 1, 9, 30);
        when(organizationRepository.findById(orgId)).thenReturn(Optional.of(org));
        when(contactRepository.countByOrganizationId(orgId)).thenReturn(3L);
        when(contactRepository.findLatestContactActivity(orgId)).thenReturn(lastContacted);

        organizationService.updateOrganizationStats(orgId);

        ArgumentCaptor<Organization> captor = ArgumentCaptor.forClass(Organization.class);
        verify(organizationRepository).save(captor.capture());
        assertEquals(3, captor.getValue().getContactCount());
        assertEquals(lastContacted, captor.getValue().getLastActivity());
    }

    @Test
    void testUpdateOrganizationStats_UnknownOrganization_Throws() {
        UUID orgId = UUID.randomUUID();
        when(organizationRepository.findById(orgId)).thenReturn(Optional.empty());

        assertThrows(IllegalArgumentException.class, () -> organizationService.updateOrganizationStats(orgId));
    }

    @Test
    void testFindOrganizationMatch_LooksUpNormalizedName() {
        Organization org = organization("Acme Inc", "acme inc", null);
        when(organizationRepository.findFirstByNormalizedName("acme inc")).thenReturn(Optional.of(org));

        assertEquals(Optional.of(org), organizationService.findOrganizationMatch("ACME, INC."));
    }

    @Test
    void testGetOrganizationsForUser_BuildsPagination() {
        UUID userId = UUID.randomUUID();
        List<Organization> content = List.of(organization("Acme Inc", "acme inc", "1"),
            organization("Globex", "globex", "2"));
        when(organizationRepository.findForUser(eq(userId), eq("ac"), eq(PageRequest.of(1, 2))))
            .thenReturn(new PageImpl<>(content, PageRequest.of(1, 2), 5));

        OrganizationPageResponse response = organizationService.getOrganizationsForUser(userId, 2, 2, " AC ");

        assertEquals(2, response.organizations().size());
        assertEquals("Acme Inc", response.organizations().get(0).getName());
        OrganizationPageResponse.Pagination pagination = response.pagination();
        assertEquals(5, pagination.total());
        assertEquals(3, pagination.totalPages());
        assertTrue(pagination.hasNext());
        assertTrue(pagination.hasPrev());
    }

    @Test
    void testGetOrganizationsForUser_InvalidPaging_Throws() {
        UUID userId = UUID.randomUUID();

        assertThrows(IllegalArgumentException.class, () -> organizationService.getOrganizationsForUser(userId, 0, 20, null));
        assertThrows(IllegalArgumentException.class, () -> organizationService.getOrganizationsForUser(userId, 1, 101, null));
    }

    private static Organization organization(String name, String normalizedName, String pipedriveOrgId) {
        Organization organization = new Organization();
        organization.setName(name);
        organization.setNormalizedName(normalizedName);
        organization.setPipedriveOrgId(pipedriveOrgId);
        return organization;
    }
}
