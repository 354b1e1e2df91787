package com.tournament.analytics.infrastructure.persistence.repository;

import com.tournament.analytics.infrastructure.persistence.entity.TournamentPlayerEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface TournamentPlayerRepository extends JpaRepository<TournamentPlayerEntity, String> {

    /**
     * Player counts per tournament as [tournamentId, count] rows.
     */
    @Query("SELECT p.tournamentId, COUNT(p) FROM TournamentPlayerEntity p " +
           "WHERE p.tournamentId IN :tournamentIds " +
           "GROUP BY p.tournamentId")
    List<Object[]> countByTournamentIds(@Param("tournamentIds") Collection<String> tournamentIds);

    List<TournamentPlayerEntity> findByTournamentIdIn(Collection<String> tournamentIds);
}
