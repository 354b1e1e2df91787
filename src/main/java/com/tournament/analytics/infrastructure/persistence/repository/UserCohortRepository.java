package com.tournament.analytics.infrastructure.persistence.repository;

import com.tournament.analytics.infrastructure.persistence.entity.UserCohortEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserCohortRepository extends JpaRepository<UserCohortEntity, UUID> {

    Optional<UserCohortEntity> findByTenantIdAndCohortMonthAndMonthNumber(
            String tenantId, LocalDate cohortMonth, int monthNumber);

    List<UserCohortEntity> findByTenantIdAndCohortMonthOrderByMonthNumberAsc(String tenantId, LocalDate cohortMonth);

    /**
     * Month-0 rows, one per cohort, oldest first. Used as the signup series.
     */
    List<UserCohortEntity> findByTenantIdAndMonthNumberOrderByCohortMonthAsc(String tenantId, int monthNumber);

    @Query("SELECT DISTINCT c.cohortMonth FROM UserCohortEntity c " +
           "WHERE c.tenantId = :tenantId " +
           "ORDER BY c.cohortMonth DESC")
    List<LocalDate> findRecentCohortMonths(@Param("tenantId") String tenantId, Pageable pageable);

    Optional<UserCohortEntity> findFirstByTenantIdOrderByUpdatedAtDesc(String tenantId);
}
