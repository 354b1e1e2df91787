package com.tournament.analytics.infrastructure.persistence.repository;

import com.tournament.analytics.infrastructure.persistence.entity.AnalyticsJobEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface AnalyticsJobRepository extends JpaRepository<AnalyticsJobEntity, UUID> {

    List<AnalyticsJobEntity> findTop10ByStatusAndNextAttemptAtLessThanEqualOrderByCreatedAtAsc(
            AnalyticsJobEntity.JobStatus status, Instant now);

    boolean existsByDedupeKeyAndStatusIn(String dedupeKey, Collection<AnalyticsJobEntity.JobStatus> statuses);
}
