package com.pokerpulse.enrichment.service;

import com.pokerpulse.enrichment.dto.RawGameRecordRequest;
import com.pokerpulse.enrichment.model.AssignmentStatus;
import com.pokerpulse.enrichment.model.ConsolidationStrategy;
import com.pokerpulse.enrichment.model.ConsolidationType;
import com.pokerpulse.enrichment.model.Game;
import com.pokerpulse.enrichment.model.GameStatus;
import com.pokerpulse.enrichment.model.RecurringGame;
import com.pokerpulse.enrichment.model.TournamentSeries;
import com.pokerpulse.enrichment.model.Venue;
import com.pokerpulse.enrichment.repository.GameRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Dry runs of each resolution step for one raw record. Nothing is created or assigned; the answers say
 * what an ingest would do against the current state.
 */
@Service
public class ResolutionPreviewService {
    private static final Logger log = LoggerFactory.getLogger(ResolutionPreviewService.class);

    private final VenueService venueService;
    private final SeriesResolver seriesResolver;
    private final RecurringGameResolver recurringResolver;
    private final ConsolidationKeyDeriver keyDeriver;
    private final ConsolidationService consolidationService;
    private final GameRepository gameRepository;

    public ResolutionPreviewService(VenueService venueService, SeriesResolver seriesResolver,
                                    RecurringGameResolver recurringResolver, ConsolidationKeyDeriver keyDeriver,
                                    ConsolidationService consolidationService, GameRepository gameRepository) {
        this.venueService = venueService;
        this.seriesResolver = seriesResolver;
        this.recurringResolver = recurringResolver;
        this.keyDeriver = keyDeriver;
        this.consolidationService = consolidationService;
        this.gameRepository = gameRepository;
    }

    public record OutcomeView(AssignmentStatus status, Long targetId, double confidence, String reason,
                              List<AssignmentOutcome.Candidate> candidates, String suggestedName) {

        static OutcomeView of(AssignmentOutcome<?> o) {
            return new OutcomeView(o.status(), o.targetId(), o.confidence(), o.reason(), o.candidates(), o.suggestedName());
        }
    }

    public record ConsolidationPreview(String key,
                                       ConsolidationStrategy strategy,
                                       boolean grouped,
                                       Integer dayNumber,
                                       String flightLetter,
                                       boolean finalDay,
                                       Long existingParentId,
                                       boolean wouldCreateParent,
                                       List<Long> siblingIds,
                                       List<String> missingFlights,
                                       boolean wouldReopen) {}

    @Transactional(readOnly = true)
    public OutcomeView venue(Long entityId, RawGameRecordRequest req) {
        return OutcomeView.of(resolveVenue(entityId, req));
    }

    @Transactional(readOnly = true)
    public OutcomeView series(Long entityId, RawGameRecordRequest req) {
        Long venueId = assigned(resolveVenue(entityId, req));
        return OutcomeView.of(seriesResolver.preview(seriesQuery(entityId, req, venueId)));
    }

    @Transactional(readOnly = true)
    public OutcomeView recurring(Long entityId, RawGameRecordRequest req) {
        Long venueId = assigned(resolveVenue(entityId, req));
        SeriesResolver.SeriesQuery sq = seriesQuery(entityId, req, venueId);
        Long existingGameId = req.getSourceUrl() == null ? null
                : gameRepository.findByEntityIdAndSourceUrl(entityId, req.getSourceUrl()).map(Game::getId).orElse(null);
        AssignmentOutcome<RecurringGame> outcome = recurringResolver.preview(new RecurringGameResolver.RecurringQuery(entityId,
                existingGameId, venueId, req.getName(), req.getGameType(), req.getGameVariant(), req.getBuyIn(),
                req.getGuaranteeAmount(), start(req), SeriesResolver.isSeriesLike(sq)));
        return OutcomeView.of(outcome);
    }

    /** The group this record would join, and the group's missing flights once it has. */
    @Transactional(readOnly = true)
    public ConsolidationPreview consolidation(Long entityId, RawGameRecordRequest req) {
        Long venueId = assigned(resolveVenue(entityId, req));
        AssignmentOutcome<TournamentSeries> series = seriesResolver.preview(seriesQuery(entityId, req, venueId));
        ConsolidationKeyDeriver.ConsolidationKey key = keyDeriver.derive(new ConsolidationKeyDeriver.KeyInput(
                req.getName(), assigned(series), req.getEventNumber(), req.getDayNumber(), req.getFlightLetter(),
                req.getFinalDay(), venueId, req.getVenueName(), start(req), req.getSourceUrl()));
        FlightPatternDetector.FlightInfo flight = key.flight();
        if (!key.isGrouped()) {
            return new ConsolidationPreview(key.key(), key.strategy(), false, flight.dayNumber(), flight.flightLetter(),
                    flight.finalDay(), null, false, List.of(), List.of(), false);
        }

        List<Game> parents = gameRepository.findByEntityIdAndConsolidationKeyAndConsolidationType(
                entityId, key.key(), ConsolidationType.PARENT);
        Game parent = parents.isEmpty() ? null : parents.get(0);
        List<Game> members = new ArrayList<>();
        List<Long> siblingIds = new ArrayList<>();
        boolean alreadyMember = false;
        if (parent != null) {
            for (Game c : consolidationService.children(parent.getId())) {
                if (req.getSourceUrl() != null && req.getSourceUrl().equals(c.getSourceUrl())) {
                    alreadyMember = true;
                    continue;
                }
                members.add(c);
                siblingIds.add(c.getId());
            }
        }
        Game hypothetical = new Game();
        hypothetical.setDayNumber(flight.dayNumber());
        hypothetical.setFlightLetter(flight.flightLetter());
        hypothetical.setFinalDay(flight.finalDay());
        members.add(hypothetical);

        boolean reopen = parent != null && !alreadyMember && parent.getGameStatus() == GameStatus.FINISHED;
        log.debug("[Consolidation][Preview] entityId={} key={} parentId={} siblings={}", entityId, key.key(),
                parent == null ? null : parent.getId(), siblingIds.size());
        return new ConsolidationPreview(key.key(), key.strategy(), true, flight.dayNumber(), flight.flightLetter(),
                flight.finalDay(), parent == null ? null : parent.getId(), parent == null, siblingIds,
                ConsolidationService.missingFlights(members), reopen);
    }

    private AssignmentOutcome<Venue> resolveVenue(Long entityId, RawGameRecordRequest req) {
        return venueService.resolve(entityId,
                new VenueMatcher.VenueQuery(req.getVenueName(), req.getVenueAddress(), req.getVenueCity()), req.getVenueId());
    }

    private static SeriesResolver.SeriesQuery seriesQuery(Long entityId, RawGameRecordRequest req, Long venueId) {
        LocalDateTime start = start(req);
        return new SeriesResolver.SeriesQuery(entityId, req.getName(), req.getSeriesName(), req.getSeriesYear(),
                req.getEventNumber(), req.getGuaranteeAmount(), venueId, start == null ? null : start.toLocalDate());
    }

    private static LocalDateTime start(RawGameRecordRequest req) {
        return req.getStartAt() == null ? null : req.getStartAt().toLocalDateTime();
    }

    private static Long assigned(AssignmentOutcome<?> outcome) {
        return outcome.isAssigned() ? outcome.targetId() : null;
    }
}
