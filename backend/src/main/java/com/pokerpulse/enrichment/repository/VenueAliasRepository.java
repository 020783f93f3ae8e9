package com.pokerpulse.enrichment.repository;

import com.pokerpulse.enrichment.model.VenueAlias;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface VenueAliasRepository extends JpaRepository<VenueAlias, Long> {
    List<VenueAlias> findByVenueIdIn(Collection<Long> venueIds);
    boolean existsByVenueIdAndNormalizedAlias(Long venueId, String normalizedAlias);
}
