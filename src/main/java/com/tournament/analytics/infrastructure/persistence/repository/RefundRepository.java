package com.tournament.analytics.infrastructure.persistence.repository;

import com.tournament.analytics.infrastructure.persistence.entity.RefundEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface RefundRepository extends JpaRepository<RefundEntity, String> {

    @Query("SELECT COUNT(r) FROM RefundEntity r " +
           "WHERE r.tenantId = :tenantId AND r.status = :status " +
           "AND r.createdAt >= :start AND r.createdAt < :end")
    long countByStatusInRange(
            @Param("tenantId") String tenantId,
            @Param("status") RefundEntity.RefundStatus status,
            @Param("start") Instant start,
            @Param("end") Instant end);

    @Query("SELECT COALESCE(SUM(r.amountCents), 0) FROM RefundEntity r " +
           "WHERE r.tenantId = :tenantId AND r.status = :status " +
           "AND r.createdAt >= :start AND r.createdAt < :end")
    long sumAmountByStatusInRange(
            @Param("tenantId") String tenantId,
            @Param("status") RefundEntity.RefundStatus status,
            @Param("start") Instant start,
            @Param("end") Instant end);
}
