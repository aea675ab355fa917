package com.warmlead.crm.sync.repository;

import com.warmlead.crm.sync.entity.Organization;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface OrganizationRepository extends JpaRepository<Organization, UUID> {

    Optional<Organization> findFirstByPipedriveOrgId(String pipedriveOrgId);

    Optional<Organization> findFirstByNormalizedName(String normalizedName);

    /**
     * Legacy lookup for rows written before names were normalized on write.
     * Only used as a fallback by OrganizationService.
     */
    Optional<Organization> findFirstByNormalizedNameContaining(String normalizedName);

    /**
     * Organizations holding at least one of the user's contacts, optionally filtered by name.
     * 
     * @param userId Owning user
     * @param search Lower-cased search term, or null for no filter
     * @param pageable Page request (sorting is applied by the query)
     */
    @Query(value = "SELECT o FROM Organization o " +
           "WHERE EXISTS (SELECT 1 FROM Contact c WHERE c.organization = o AND c.userId = :userId) " +
           "AND (:search IS NULL OR LOWER(o.name) LIKE CONCAT('%', :search, '%') " +
           "OR o.normalizedName LIKE CONCAT('%', :search, '%')) " +
           "ORDER BY o.contactCount DESC",
           countQuery = "SELECT COUNT(o) FROM Organization o " +
           "WHERE EXISTS (SELECT 1 FROM Contact c WHERE c.organization = o AND c.userId = :userId) " +
           "AND (:search IS NULL OR LOWER(o.name) LIKE CONCAT('%', :search, '%') " +
           "OR o.normalizedName LIKE CONCAT('%', :search, '%'))")
    Page<Organization> findForUser(
        @Param("userId") UUID userId,
        @Param("search") String search,
        Pageable pageable
    );
}
