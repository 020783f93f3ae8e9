package com.pokerpulse.enrichment.repository;

import com.pokerpulse.enrichment.model.RecurringGame;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface RecurringGameRepository extends JpaRepository<RecurringGame, Long> {
    List<RecurringGame> findByEntityIdAndVenueIdAndDayOfWeekOrderByIdAsc(Long entityId, Long venueId, DayOfWeek dayOfWeek);
    Optional<RecurringGame> findByEntityIdAndVenueIdAndDayOfWeekAndNormalizedName(Long entityId, Long venueId, DayOfWeek dayOfWeek, String normalizedName);

    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("update RecurringGame t set t.gameCount = t.gameCount + 1 where t.id = :id")
    int incrementGameCount(@Param("id") Long id);

    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("update RecurringGame t set t.gameCount = t.gameCount - 1 where t.id = :id and t.gameCount > 0")
    int decrementGameCount(@Param("id") Long id);

    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("update RecurringGame t set t.lastGameSeenAt = :seen where t.id = :id " +
            "and (t.lastGameSeenAt is null or t.lastGameSeenAt < :seen)")
    int advanceLastGameSeen(@Param("id") Long id, @Param("seen") Instant seen);
}
