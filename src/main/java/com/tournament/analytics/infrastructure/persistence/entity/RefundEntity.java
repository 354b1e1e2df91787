package com.tournament.analytics.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "refunds", indexes = {
    @Index(name = "idx_refund_tenant_created", columnList = "tenantId, createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefundEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 64)
    private String tenantId;

    @Column(nullable = false, length = 64)
    private String paymentId;

    @Column(nullable = false)
    private long amountCents;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RefundStatus status;

    @Column(nullable = false)
    private Instant createdAt;

    public enum RefundStatus {
        PENDING,
        SUCCEEDED,
        FAILED
    }
}
