package com.warmlead.crm.sync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Local organization record, deduplicated by normalized name or Pipedrive id.
 * 
 * contactCount and lastActivity are denormalized and refreshed on demand by
 * OrganizationService.updateOrganizationStats, never per contact write.
 */
@Entity
@Table(name = "organizations", indexes = {
    @Index(name = "idx_org_normalized_name", columnList = "normalized_name"),
    @Index(name = "idx_org_pipedrive_id", columnList = "pipedrive_org_id", unique = true)
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class Organization extends BaseAuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "normalized_name", nullable = false, length = 255)
    private String normalizedName;

    @Column(name = "pipedrive_org_id", length = 50)
    private String pipedriveOrgId;

    @Column(name = "industry", length = 255)
    private String industry;

    @Column(name = "size", length = 100)
    private String size;

    @Column(name = "website", length = 500)
    private String website;

    @Column(name = "address", length = 500)
    private String address;

    @Column(name = "country", length = 100)
    private String country;

    @Column(name = "city", length = 100)
    private String city;

    @Column(name = "contact_count", nullable = false)
    private Integer contactCount = 0;

    @Column(name = "last_activity")
    private LocalDateTime lastActivity;
}
