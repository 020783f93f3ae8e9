package com.pokerpulse.enrichment.repository;

import com.pokerpulse.enrichment.model.SocialPostGameLink;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;

import java.util.List;
import java.util.Optional;

public interface SocialPostGameLinkRepository extends JpaRepository<SocialPostGameLink, Long> {
    List<SocialPostGameLink> findBySocialPostIdOrderByIdAsc(Long socialPostId);
    List<SocialPostGameLink> findByGameId(Long gameId);
    Optional<SocialPostGameLink> findBySocialPostIdAndGameId(Long socialPostId, Long gameId);

    @Modifying
    long deleteByGameId(Long gameId);
}
