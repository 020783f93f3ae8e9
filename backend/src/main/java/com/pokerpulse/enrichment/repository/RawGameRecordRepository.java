package com.pokerpulse.enrichment.repository;

import com.pokerpulse.enrichment.model.RawGameRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface RawGameRecordRepository extends JpaRepository<RawGameRecord, Long> {

    Optional<RawGameRecord> findByEntityIdAndSourceUrlAndPayloadHash(Long entityId, String sourceUrl, String payloadHash);

    @Query("select r.id from RawGameRecord r where r.entityId = :entityId and r.consumedAt is null order by r.id asc")
    List<Long> findUnconsumedIds(@Param("entityId") Long entityId, Pageable pageable);
}
