package com.pokerpulse.enrichment.repository;

import com.pokerpulse.enrichment.model.TournamentSeriesTitle;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface TournamentSeriesTitleRepository extends JpaRepository<TournamentSeriesTitle, Long> {
    Optional<TournamentSeriesTitle> findByEntityIdAndNormalizedTitle(Long entityId, String normalizedTitle);
    List<TournamentSeriesTitle> findByEntityIdOrderByIdAsc(Long entityId);
}
