package com.tournament.analytics.infrastructure.persistence.repository;

import com.tournament.analytics.domain.model.PeriodType;
import com.tournament.analytics.infrastructure.persistence.entity.TournamentAggregateEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TournamentAggregateRepository extends JpaRepository<TournamentAggregateEntity, UUID> {

    Optional<TournamentAggregateEntity> findByTenantIdAndPeriodTypeAndPeriodStart(
            String tenantId, PeriodType periodType, LocalDate periodStart);

    List<TournamentAggregateEntity> findByTenantIdAndPeriodTypeAndPeriodStartBetweenOrderByPeriodStartAsc(
            String tenantId, PeriodType periodType, LocalDate from, LocalDate to);

    Optional<TournamentAggregateEntity> findFirstByTenantIdOrderByUpdatedAtDesc(String tenantId);
}
