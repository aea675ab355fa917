package com.warmlead.crm.sync.repository;

import com.warmlead.crm.sync.entity.Contact;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ContactRepository extends JpaRepository<Contact, UUID> {

    Optional<Contact> findFirstByUserIdAndPipedrivePersonId(UUID userId, String pipedrivePersonId);

    long countByUserId(UUID userId);

    @Query("SELECT COUNT(c) FROM Contact c WHERE c.organization.id = :organizationId")
    long countByOrganizationId(@Param("organizationId") UUID organizationId);

    /**
     * Most recent lastContacted among the organization's contacts, or null when none was contacted.
     */
    @Query("SELECT MAX(c.lastContacted) FROM Contact c WHERE c.organization.id = :organizationId")
    LocalDateTime findLatestContactActivity(@Param("organizationId") UUID organizationId);
}
