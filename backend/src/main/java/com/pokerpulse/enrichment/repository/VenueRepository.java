package com.pokerpulse.enrichment.repository;

import com.pokerpulse.enrichment.model.Venue;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface VenueRepository extends JpaRepository<Venue, Long> {
    Optional<Venue> findByEntityIdAndNormalizedName(Long entityId, String normalizedName);
    List<Venue> findByEntityIdOrderByIdAsc(Long entityId, Pageable pageable);
    long countByEntityId(Long entityId);

    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("update Venue v set v.gameCount = v.gameCount + 1, v.lastDataRefreshedAt = :now where v.id = :id")
    int incrementGameCount(@Param("id") Long id, @Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("update Venue v set v.gameCount = v.gameCount - 1 where v.id = :id and v.gameCount > 0")
    int decrementGameCount(@Param("id") Long id);

    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("update Venue v set v.lastGameSeenAt = :seen where v.id = :id " +
            "and (v.lastGameSeenAt is null or v.lastGameSeenAt < :seen)")
    int advanceLastGameSeen(@Param("id") Long id, @Param("seen") Instant seen);
}
