package com.pokerpulse.enrichment.repository;

import com.pokerpulse.enrichment.model.SocialPost;
import com.pokerpulse.enrichment.model.SocialPostStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface SocialPostRepository extends JpaRepository<SocialPost, Long> {

    Optional<SocialPost> findByEntityIdAndExternalPostId(Long entityId, String externalPostId);

    @Query("select p.id from SocialPost p where p.entityId = :entityId and p.processingStatus in :statuses order by p.id asc")
    List<Long> findIdsByStatus(@Param("entityId") Long entityId,
                               @Param("statuses") Collection<SocialPostStatus> statuses,
                               Pageable pageable);
}
