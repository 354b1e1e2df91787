package com.tournament.analytics.infrastructure.persistence.repository;

import com.tournament.analytics.infrastructure.persistence.entity.TournamentEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface TournamentRepository extends JpaRepository<TournamentEntity, String> {

    /**
     * Tournaments created in [start, end), oldest first.
     */
    @Query("SELECT t FROM TournamentEntity t " +
           "WHERE t.orgId = :tenantId AND t.createdAt >= :start AND t.createdAt < :end " +
           "ORDER BY t.createdAt ASC")
    List<TournamentEntity> findCreatedBetween(
            @Param("tenantId") String tenantId,
            @Param("start") Instant start,
            @Param("end") Instant end);

    List<TournamentEntity> findByOrgId(String orgId);

    List<TournamentEntity> findByOrgIdAndFormatAndCreatedAtGreaterThanEqual(
            String orgId, String format, Instant createdAfter);

    Optional<TournamentEntity> findByIdAndOrgId(String id, String orgId);
}
