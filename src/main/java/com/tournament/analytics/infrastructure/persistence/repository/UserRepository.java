package com.tournament.analytics.infrastructure.persistence.repository;

import com.tournament.analytics.infrastructure.persistence.entity.UserEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface UserRepository extends JpaRepository<UserEntity, String> {

    /**
     * Members of a tenant whose account was created in [start, end).
     */
    @Query("SELECT u FROM UserEntity u " +
           "WHERE u.createdAt >= :start AND u.createdAt < :end " +
           "AND EXISTS ( " +
           "SELECT m FROM OrganizationMemberEntity m " +
           "WHERE m.userId = u.id AND m.orgId = :tenantId " +
           ")")
    List<UserEntity> findTenantMembersCreatedBetween(
            @Param("tenantId") String tenantId,
            @Param("start") Instant start,
            @Param("end") Instant end);
}
