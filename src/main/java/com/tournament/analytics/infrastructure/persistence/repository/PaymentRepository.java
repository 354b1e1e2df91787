package com.tournament.analytics.infrastructure.persistence.repository;

import com.tournament.analytics.infrastructure.persistence.entity.PaymentEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, String> {

    @Query("SELECT COUNT(p) FROM PaymentEntity p " +
           "WHERE p.tenantId = :tenantId AND p.createdAt >= :start AND p.createdAt < :end")
    long countInRange(
            @Param("tenantId") String tenantId,
            @Param("start") Instant start,
            @Param("end") Instant end);

    @Query("SELECT COUNT(p) FROM PaymentEntity p " +
           "WHERE p.tenantId = :tenantId AND p.status = :status " +
           "AND p.createdAt >= :start AND p.createdAt < :end")
    long countByStatusInRange(
            @Param("tenantId") String tenantId,
            @Param("status") PaymentEntity.PaymentStatus status,
            @Param("start") Instant start,
            @Param("end") Instant end);

    @Query("SELECT COALESCE(SUM(p.amountCents), 0) FROM PaymentEntity p " +
           "WHERE p.tenantId = :tenantId AND p.status = :status " +
           "AND p.createdAt >= :start AND p.createdAt < :end")
    long sumAmountByStatusInRange(
            @Param("tenantId") String tenantId,
            @Param("status") PaymentEntity.PaymentStatus status,
            @Param("start") Instant start,
            @Param("end") Instant end);

    @Query("SELECT COALESCE(SUM(p.amountCents), 0) FROM PaymentEntity p " +
           "WHERE p.tenantId = :tenantId AND p.status = :status " +
           "AND p.tournamentId IN :tournamentIds")
    long sumAmountByStatusForTournaments(
            @Param("tenantId") String tenantId,
            @Param("status") PaymentEntity.PaymentStatus status,
            @Param("tournamentIds") Collection<String> tournamentIds);

    @Query("SELECT COALESCE(SUM(p.amountCents), 0) FROM PaymentEntity p " +
           "WHERE p.tenantId = :tenantId AND p.status = :status " +
           "AND p.userId IN :userIds " +
           "AND p.createdAt >= :start AND p.createdAt < :end")
    long sumAmountByStatusForUsersInRange(
            @Param("tenantId") String tenantId,
            @Param("status") PaymentEntity.PaymentStatus status,
            @Param("userIds") Collection<String> userIds,
            @Param("start") Instant start,
            @Param("end") Instant end);

    /**
     * Amount per tournament as [tournamentId, cents] rows.
     */
    @Query("SELECT p.tournamentId, COALESCE(SUM(p.amountCents), 0) FROM PaymentEntity p " +
           "WHERE p.tenantId = :tenantId AND p.status = :status " +
           "AND p.tournamentId IN :tournamentIds " +
           "GROUP BY p.tournamentId")
    List<Object[]> sumAmountByTournament(
            @Param("tenantId") String tenantId,
            @Param("status") PaymentEntity.PaymentStatus status,
            @Param("tournamentIds") Collection<String> tournamentIds);
}
