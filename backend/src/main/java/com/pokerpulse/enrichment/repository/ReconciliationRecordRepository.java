package com.pokerpulse.enrichment.repository;

import com.pokerpulse.enrichment.model.ReconciliationRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;

import java.util.List;
import java.util.Optional;

public interface ReconciliationRecordRepository extends JpaRepository<ReconciliationRecord, Long> {
    Optional<ReconciliationRecord> findBySocialPostIdAndGameId(Long socialPostId, Long gameId);
    List<ReconciliationRecord> findBySocialPostId(Long socialPostId);

    @Modifying
    long deleteByGameId(Long gameId);
}
