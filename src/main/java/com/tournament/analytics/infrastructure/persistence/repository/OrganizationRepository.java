package com.tournament.analytics.infrastructure.persistence.repository;

import com.tournament.analytics.infrastructure.persistence.entity.OrganizationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OrganizationRepository extends JpaRepository<OrganizationEntity, String> {

    @Query("SELECT o.id FROM OrganizationEntity o ORDER BY o.id")
    List<String> findAllIds();
}
