package com.pokerpulse.enrichment.repository;

import com.pokerpulse.enrichment.model.TournamentSeries;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface TournamentSeriesRepository extends JpaRepository<TournamentSeries, Long> {
    Optional<TournamentSeries> findByEntityIdAndSeriesTitleIdAndSeriesYear(Long entityId, Long seriesTitleId, Integer seriesYear);
    List<TournamentSeries> findByEntityIdAndSeriesTitleIdInOrderByIdAsc(Long entityId, Collection<Long> seriesTitleIds);

    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("update TournamentSeries s set s.gameCount = s.gameCount + 1 where s.id = :id")
    int incrementGameCount(@Param("id") Long id);

    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("update TournamentSeries s set s.gameCount = s.gameCount - 1 where s.id = :id and s.gameCount > 0")
    int decrementGameCount(@Param("id") Long id);

    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("update TournamentSeries s set s.lastGameSeenAt = :seen where s.id = :id " +
            "and (s.lastGameSeenAt is null or s.lastGameSeenAt < :seen)")
    int advanceLastGameSeen(@Param("id") Long id, @Param("seen") Instant seen);

    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("update TournamentSeries s set s.startDate = :day where s.id = :id " +
            "and (s.startDate is null or s.startDate > :day)")
    int extendStartDate(@Param("id") Long id, @Param("day") LocalDate day);

    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("update TournamentSeries s set s.endDate = :day where s.id = :id " +
            "and (s.endDate is null or s.endDate < :day)")
    int extendEndDate(@Param("id") Long id, @Param("day") LocalDate day);
}
