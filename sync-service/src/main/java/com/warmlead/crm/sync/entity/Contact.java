package com.warmlead.crm.sync.entity;

import jakarta.persistence.*;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "contacts", indexes = {
    @Index(name = "idx_contact_user_id", columnList = "user_id"),
    @Index(name = "idx_contact_pipedrive_person", columnList = "user_id, pipedrive_person_id"),
    @Index(name = "idx_contact_organization_id", columnList = "organization_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class Contact extends BaseAuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "email", length = 255)
    private String email;

    @Column(name = "phone", length = 50)
    private String phone;

    /**
     * Free-text organization name as received; the structured link is {@link #organization}.
     */
    @Column(name = "organisation", length = 255)
    private String organisation;

    /**
     * 0 (cold) to 10 (warm).
     */
    @Min(0)
    @Max(10)
    @Column(name = "warmness_score", nullable = false)
    private Integer warmnessScore = 0;

    @Column(name = "last_contacted")
    private LocalDateTime lastContacted;

    @Column(name = "added_to_campaign", nullable = false)
    private Boolean addedToCampaign = false;

    @Column(name = "pipedrive_person_id", length = 50)
    private String pipedrivePersonId;

    @Column(name = "pipedrive_org_id", length = 50)
    private String pipedriveOrgId;

    /**
     * Pipedrive update_time of the version last written locally.
     * A remote record only overwrites the contact when it is strictly newer.
     */
    @Column(name = "last_pipedrive_update")
    private LocalDateTime lastPipedriveUpdate;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "organization_id")
    private Organization organization;

    @Column(name = "user_id", nullable = false)
    private UUID userId;
}
