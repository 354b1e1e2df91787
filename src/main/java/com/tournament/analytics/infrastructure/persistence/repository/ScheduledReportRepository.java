package com.tournament.analytics.infrastructure.persistence.repository;

import com.tournament.analytics.infrastructure.persistence.entity.ScheduledReportEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ScheduledReportRepository extends JpaRepository<ScheduledReportEntity, UUID> {

    List<ScheduledReportEntity> findByTenantIdAndDeletedAtIsNullOrderByCreatedAtDesc(String tenantId);

    Optional<ScheduledReportEntity> findByIdAndDeletedAtIsNull(UUID id);

    @Query("SELECT r FROM ScheduledReportEntity r " +
           "WHERE r.enabled = true AND r.deletedAt IS NULL " +
           "AND (r.nextRunAt IS NULL OR r.nextRunAt <= :now) " +
           "ORDER BY r.nextRunAt ASC")
    List<ScheduledReportEntity> findDue(@Param("now") Instant now);
}
