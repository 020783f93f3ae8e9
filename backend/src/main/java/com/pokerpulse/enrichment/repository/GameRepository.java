package com.pokerpulse.enrichment.repository;

import com.pokerpulse.enrichment.model.ConsolidationType;
import com.pokerpulse.enrichment.model.Game;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface GameRepository extends JpaRepository<Game, Long> {

    Optional<Game> findByEntityIdAndSourceUrl(Long entityId, String sourceUrl);

    List<Game> findByEntityIdAndConsolidationKeyAndConsolidationType(Long entityId, String consolidationKey, ConsolidationType type);

    List<Game> findByParentGameIdOrderByIdAsc(Long parentGameId);

    long countByParentGameId(Long parentGameId);

    // Real (non-synthetic) games of a venue in a time window, newest first
    @Query("select g from Game g where g.entityId = :entityId and g.venueAssignment.targetId = :venueId " +
            "and g.consolidationType <> com.pokerpulse.enrichment.model.ConsolidationType.PARENT " +
            "and g.gameStartDateTime >= :from and g.gameStartDateTime < :to order by g.gameStartDateTime desc, g.id desc")
    List<Game> findVenueGamesBetween(@Param("entityId") Long entityId,
                                     @Param("venueId") Long venueId,
                                     @Param("from") LocalDateTime from,
                                     @Param("to") LocalDateTime to,
                                     Pageable pageable);

    // Candidates for social post matching: standalone games and consolidation parents, optionally at one venue
    @Query("select g from Game g where g.entityId = :entityId " +
            "and g.consolidationType <> com.pokerpulse.enrichment.model.ConsolidationType.CHILD " +
            "and (:venueId is null or g.venueAssignment.targetId = :venueId) " +
            "and g.gameStartDateTime >= :from and g.gameStartDateTime < :to order by g.gameStartDateTime asc, g.id asc")
    List<Game> findResultCandidates(@Param("entityId") Long entityId,
                                    @Param("venueId") Long venueId,
                                    @Param("from") LocalDateTime from,
                                    @Param("to") LocalDateTime to,
                                    Pageable pageable);

    @Query("select g.id from Game g where g.entityId = :entityId " +
            "and g.consolidationType <> com.pokerpulse.enrichment.model.ConsolidationType.PARENT " +
            "and (:venueId is null or g.venueAssignment.targetId = :venueId) " +
            "and (:from is null or g.gameStartDateTime >= :from) " +
            "and (:to is null or g.gameStartDateTime < :to) order by g.id asc")
    List<Long> findRecordIds(@Param("entityId") Long entityId,
                             @Param("venueId") Long venueId,
                             @Param("from") LocalDateTime from,
                             @Param("to") LocalDateTime to,
                             Pageable pageable);

    @Query("select g.id from Game g where g.entityId = :entityId " +
            "and g.consolidationType <> com.pokerpulse.enrichment.model.ConsolidationType.PARENT " +
            "and g.venueAssignment.status in (com.pokerpulse.enrichment.model.AssignmentStatus.UNASSIGNED, " +
            "com.pokerpulse.enrichment.model.AssignmentStatus.PENDING_ASSIGNMENT) order by g.id asc")
    List<Long> findIdsWithOpenVenueAssignment(@Param("entityId") Long entityId, Pageable pageable);

    @Query("select g.id from Game g where g.entityId = :entityId " +
            "and g.consolidationType = com.pokerpulse.enrichment.model.ConsolidationType.PARENT order by g.id asc")
    List<Long> findParentIds(@Param("entityId") Long entityId, Pageable pageable);
}
