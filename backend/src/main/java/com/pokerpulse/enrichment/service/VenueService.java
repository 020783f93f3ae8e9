package com.pokerpulse.enrichment.service;

import com.pokerpulse.enrichment.config.ResolutionSettings;
import com.pokerpulse.enrichment.model.Assignment;
import com.pokerpulse.enrichment.model.AssignmentStatus;
import com.pokerpulse.enrichment.model.Game;
import com.pokerpulse.enrichment.model.Venue;
import com.pokerpulse.enrichment.model.VenueAlias;
import com.pokerpulse.enrichment.repository.VenueAliasRepository;
import com.pokerpulse.enrichment.repository.VenueRepository;
import com.pokerpulse.enrichment.util.NameNormalizer;
import com.pokerpulse.enrichment.web.TenantAccessDeniedException;
import jakarta.persistence.EntityNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@Service
public class VenueService {
    private static final Logger log = LoggerFactory.getLogger(VenueService.class);

    private final VenueRepository venueRepository;
    private final VenueAliasRepository aliasRepository;
    private final VenueMatcher matcher;
    private final IdempotentCreator creator;
    private final ResolutionSettings settings;

    public VenueService(VenueRepository venueRepository, VenueAliasRepository aliasRepository, VenueMatcher matcher,
                        IdempotentCreator creator, ResolutionSettings settings) {
        this.venueRepository = venueRepository;
        this.aliasRepository = aliasRepository;
        this.matcher = matcher;
        this.creator = creator;
        this.settings = settings;
    }

    /** Read-only resolution of raw venue text within one tenant. */
    public AssignmentOutcome<Venue> resolve(Long entityId, VenueMatcher.VenueQuery query, Long explicitVenueId) {
        if (explicitVenueId != null) {
            Optional<Venue> explicit = venueRepository.findById(explicitVenueId);
            if (explicit.isPresent()) {
                Venue v = explicit.get();
                TenantAccessDeniedException.check("Venue", explicitVenueId, v.getEntityId(), entityId);
                return AssignmentOutcome.manual(v.getId(), v, "explicit venue id from source");
            }
            log.warn("[Venue][Resolve] entityId={} explicit venueId={} not found, falling back to text match", entityId, explicitVenueId);
        }
        AssignmentOutcome<Venue> outcome = matcher.match(query, loadProfiles(entityId), settings.venuePolicy());
        log.debug("[Venue][Resolve] entityId={} raw='{}' status={} confidence={}", entityId, query.name(), outcome.status(), outcome.confidence());
        return outcome;
    }

    public List<VenueMatcher.VenueProfile> loadProfiles(Long entityId) {
        List<Venue> venues = venueRepository.findByEntityIdOrderByIdAsc(entityId, PageRequest.of(0, settings.getVenueMaxScan()));
        if (venues.isEmpty()) return List.of();
        Map<Long, List<String>> aliases = new HashMap<>();
        for (VenueAlias a : aliasRepository.findByVenueIdIn(venues.stream().map(Venue::getId).toList())) {
            aliases.computeIfAbsent(a.getVenueId(), k -> new ArrayList<>()).add(a.getNormalizedAlias());
        }
        List<VenueMatcher.VenueProfile> out = new ArrayList<>(venues.size());
        for (Venue v : venues) {
            out.add(new VenueMatcher.VenueProfile(v, aliases.getOrDefault(v.getId(), List.of())));
        }
        return out;
    }

    /**
     * Writes the outcome onto the game. Rollup counters move only when the game's venue actually changes,
     * so re-enriching the same record leaves them untouched. Counters move through single-row updates
     * in {@link VenueRepository}, never through the entity. A manual assignment is never overwritten here.
     *
     * @return true when the game's venue assignment changed
     */
    public boolean applyToGame(Game game, AssignmentOutcome<Venue> outcome, Instant now) {
        Assignment current = game.getVenueAssignment();
        if (current.isManual() && outcome.status() != AssignmentStatus.MANUALLY_ASSIGNED) {
            return false;
        }
        Long previous = current.getStatus().isAssigned() ? current.getTargetId() : null;
        Long next = outcome.isAssigned() ? outcome.targetId() : null;
        boolean changed = !Objects.equals(previous, next);
        if (changed) {
            if (previous != null) {
                venueRepository.decrementGameCount(previous);
            }
            if (next != null) {
                venueRepository.incrementGameCount(next, now);
                if (game.getGameStartDateTime() != null) {
                    venueRepository.advanceLastGameSeen(next, game.getGameStartDateTime().atZone(ZoneOffset.UTC).toInstant());
                }
            }
        }
        game.setVenueAssignment(outcome.toAssignment());
        game.setSuggestedVenueName(outcome.isAssigned() ? null : outcome.suggestedName());
        return changed;
    }

    /** Pins a game to a venue and learns the game's raw venue text as an alias of it. */
    public Venue assignManually(Long entityId, Game game, Long venueId, Instant now) {
        Venue venue = venueRepository.findById(venueId)
                .orElseThrow(() -> new EntityNotFoundException("Venue not found: " + venueId));
        TenantAccessDeniedException.check("Venue", venueId, venue.getEntityId(), entityId);
        applyToGame(game, AssignmentOutcome.manual(venue.getId(), venue, "manually assigned"), now);
        learnAlias(venue, game.getVenueName());
        log.info("[Venue][Manual] entityId={} gameId={} venueId={}", entityId, game.getId(), venueId);
        return venue;
    }

    public void learnAlias(Venue venue, String rawName) {
        String normalized = NameNormalizer.normalizeForMatch(rawName);
        if (normalized.isEmpty() || normalized.equals(venue.getNormalizedName())) return;
        if (aliasRepository.existsByVenueIdAndNormalizedAlias(venue.getId(), normalized)) return;
        aliasRepository.save(new VenueAlias(venue.getEntityId(), venue.getId(), rawName.trim(), "MANUAL"));
        log.info("[Venue][Alias] venueId={} alias='{}'", venue.getId(), rawName);
    }

    /** Create-if-missing keyed on the normalized name; concurrent callers converge on one row. */
    public IdempotentCreator.Created<Venue> findOrCreateVenue(Long entityId, String name, String address, String city) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Venue name is required");
        String normalized = NameNormalizer.normalizeForMatch(name);
        return creator.findOrCreate(IdempotentCreator.key("venue", entityId, normalized),
                () -> venueRepository.findByEntityIdAndNormalizedName(entityId, normalized),
                () -> {
                    Venue v = new Venue(entityId, name);
                    v.setAddress(address);
                    v.setCity(city);
                    return venueRepository.saveAndFlush(v);
                });
    }
}
