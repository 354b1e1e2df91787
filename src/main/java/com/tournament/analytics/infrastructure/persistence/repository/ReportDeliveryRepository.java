package com.tournament.analytics.infrastructure.persistence.repository;

import com.tournament.analytics.infrastructure.persistence.entity.ReportDeliveryEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ReportDeliveryRepository extends JpaRepository<ReportDeliveryEntity, UUID> {

    List<ReportDeliveryEntity> findByReportIdOrderByCreatedAtDesc(UUID reportId, Pageable pageable);
}
