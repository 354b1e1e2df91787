package com.tournament.analytics.infrastructure.persistence.repository;

import com.tournament.analytics.domain.model.PeriodType;
import com.tournament.analytics.infrastructure.persistence.entity.RevenueAggregateEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RevenueAggregateRepository extends JpaRepository<RevenueAggregateEntity, UUID> {

    Optional<RevenueAggregateEntity> findByTenantIdAndPeriodTypeAndPeriodStart(
            String tenantId, PeriodType periodType, LocalDate periodStart);

    List<RevenueAggregateEntity> findByTenantIdAndPeriodTypeAndPeriodStartBetweenOrderByPeriodStartAsc(
            String tenantId, PeriodType periodType, LocalDate from, LocalDate to);

    Optional<RevenueAggregateEntity> findFirstByTenantIdOrderByUpdatedAtDesc(String tenantId);
}
