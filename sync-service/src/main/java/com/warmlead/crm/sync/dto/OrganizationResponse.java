package com.warmlead.crm.sync.dto;

import com.warmlead.crm.sync.entity.Organization;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OrganizationResponse {
    private UUID id;
    private String name;
    private String pipedriveOrgId;
    private String industry;
    private String size;
    private String website;
    private String address;
    private String country;
    private String city;
    private Integer contactCount;
    private LocalDateTime lastActivity;

    public static OrganizationResponse from(Organization organization) {
        return new OrganizationResponse(
            organization.getId(),
            organization.getName(),
            organization.getPipedriveOrgId(),
            organization.getIndustry(),
            organization.getSize(),
            organization.getWebsite(),
            organization.getAddress(),
            organization.getCountry(),
            organization.getCity(),
            organization.getContactCount(),
            organization.getLastActivity()
        );
    }
}
