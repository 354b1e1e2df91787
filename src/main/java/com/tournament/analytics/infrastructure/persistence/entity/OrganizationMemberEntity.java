package com.tournament.analytics.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "organization_members", indexes = {
    @Index(name = "idx_member_org", columnList = "orgId"),
    @Index(name = "idx_member_user", columnList = "userId")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrganizationMemberEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 64)
    private String orgId;

    @Column(nullable = false, length = 64)
    private String userId;
}
