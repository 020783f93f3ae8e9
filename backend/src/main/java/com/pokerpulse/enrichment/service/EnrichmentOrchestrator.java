package com.pokerpulse.enrichment.service;

import com.pokerpulse.enrichment.config.ResolutionSettings;
import com.pokerpulse.enrichment.dto.RawGameRecordRequest;
import com.pokerpulse.enrichment.dto.ReResolveRequest.Dimension;
import com.pokerpulse.enrichment.model.Assignment;
import com.pokerpulse.enrichment.model.AssignmentStatus;
import com.pokerpulse.enrichment.model.Game;
import com.pokerpulse.enrichment.model.RawGameRecord;
import com.pokerpulse.enrichment.model.RecurringGame;
import com.pokerpulse.enrichment.model.TournamentSeries;
import com.pokerpulse.enrichment.model.Venue;
import com.pokerpulse.enrichment.repository.GameRepository;
import com.pokerpulse.enrichment.repository.RawGameRecordRepository;
import com.pokerpulse.enrichment.repository.TournamentSeriesRepository;
import com.pokerpulse.enrichment.util.KeyedLocks;
import com.pokerpulse.enrichment.web.InvariantViolationException;
import com.pokerpulse.enrichment.web.TenantAccessDeniedException;
import com.pokerpulse.enrichment.web.TransientPersistenceException;
import jakarta.persistence.EntityNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * One unit of work per raw record: resolve venue and series, derive the consolidation key, then under the
 * group lock(s) upsert the game, apply every dimension, compute financials, fold into the group, refresh
 * social reconciliations and write the metadata trail. Either all of it commits or none of it does.
 */
@Service
public class EnrichmentOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentOrchestrator.class);

    private static final Set<Dimension> ALL = EnumSet.allOf(Dimension.class);

    private final GameRepository gameRepository;
    private final RawGameRecordRepository rawRepository;
    private final TournamentSeriesRepository seriesRepository;
    private final VenueService venueService;
    private final SeriesResolver seriesResolver;
    private final RecurringGameResolver recurringResolver;
    private final ConsolidationKeyDeriver keyDeriver;
    private final ConsolidationService consolidationService;
    private final FinancialsCalculator financials;
    private final SocialPostService socialPostService;
    private final JsonCodec json;
    private final ResolutionSettings settings;
    private final TransactionTemplate enrichmentTx;
    private final TransactionTemplate creationTx;
    private final KeyedLocks groupLocks = new KeyedLocks(256);

    public EnrichmentOrchestrator(GameRepository gameRepository,
                                  RawGameRecordRepository rawRepository,
                                  TournamentSeriesRepository seriesRepository,
                                  VenueService venueService,
                                  SeriesResolver seriesResolver,
                                  RecurringGameResolver recurringResolver,
                                  ConsolidationKeyDeriver keyDeriver,
                                  ConsolidationService consolidationService,
                                  FinancialsCalculator financials,
                                  SocialPostService socialPostService,
                                  JsonCodec json,
                                  ResolutionSettings settings,
                                  @Qualifier("enrichmentTx") TransactionTemplate enrichmentTx,
                                  @Qualifier("creationTx") TransactionTemplate creationTx) {
        this.gameRepository = gameRepository;
        this.rawRepository = rawRepository;
        this.seriesRepository = seriesRepository;
        this.venueService = venueService;
        this.seriesResolver = seriesResolver;
        this.recurringResolver = recurringResolver;
        this.keyDeriver = keyDeriver;
        this.consolidationService = consolidationService;
        this.financials = financials;
        this.socialPostService = socialPostService;
        this.json = json;
        this.settings = settings;
        this.enrichmentTx = enrichmentTx;
        this.creationTx = creationTx;
    }

    public record DimensionView(AssignmentStatus status, Long targetId, double confidence, String reason,
                                List<AssignmentOutcome.Candidate> candidates, boolean wasCreated, String suggestedName) {

        static DimensionView of(Assignment a, AssignmentOutcome<?> applied) {
            if (applied == null) {
                return new DimensionView(a.getStatus(), a.getTargetId(), a.getConfidence() == null ? 0.0 : a.getConfidence(),
                        a.getReason(), List.of(), false, null);
            }
            return new DimensionView(a.getStatus(), a.getTargetId(), a.getConfidence() == null ? 0.0 : a.getConfidence(),
                    a.getReason(), applied.candidates(), applied.wasCreated(), applied.suggestedName());
        }
    }

    public record FieldChange(String field, String reason) {}

    public record EnrichmentResult(Long gameId,
                                   Long rawRecordId,
                                   boolean gameCreated,
                                   DimensionView venue,
                                   DimensionView series,
                                   DimensionView recurring,
                                   ConsolidationService.ConsolidationResult consolidation,
                                   boolean financialsCalculated,
                                   List<FieldChange> changes,
                                   List<String> warnings) {}

    public record DeleteResult(Long gameId, Long parentGameId, boolean deleteParent) {}

    /** Persisted trail. Holds no timestamps and no creation flags, so an unchanged re-run writes nothing new. */
    public record Metadata(Long rawRecordId,
                           Map<String, Trail> dimensions,
                           Map<String, Object> consolidation,
                           boolean financialsCalculated,
                           List<FieldChange> changes,
                           List<String> warnings) {}

    public record Trail(AssignmentStatus status, Long targetId, Double confidence, String reason,
                        List<AssignmentOutcome.Candidate> candidates, String suggestedName) {

        static Trail of(DimensionView v) {
            return new Trail(v.status(), v.targetId(), v.confidence(), v.reason(), v.candidates(), v.suggestedName());
        }
    }

    /** Options of one run. Manual ids pin a dimension before anything is resolved. */
    record RunOptions(Set<Dimension> dimensions, boolean clearManual, Long manualVenueId, Long manualSeriesId) {
        static RunOptions full() {
            return new RunOptions(ALL, false, null, null);
        }
    }

    public EnrichmentResult enrich(Long rawRecordId) {
        return enrich(rawRecordId, RunOptions.full());
    }

    /**
     * Re-runs the chosen dimensions of a game from its latest raw record. With {@code clearManual} the chosen
     * dimensions lose their manual pin first; otherwise manual assignments stay.
     */
    public EnrichmentResult reResolve(Long entityId, Long gameId, Set<Dimension> dimensions, boolean clearManual) {
        Game game = loadGame(entityId, gameId);
        Set<Dimension> chosen = dimensions == null || dimensions.isEmpty() ? ALL : EnumSet.copyOf(dimensions);
        log.info("[Enrichment][ReResolve] entityId={} gameId={} dimensions={} clearManual={}", entityId, gameId, chosen, clearManual);
        return enrich(rawRecordOf(game), new RunOptions(chosen, clearManual, null, null));
    }

    /** Pins the venue, learns the raw text as an alias and re-keys the game. */
    public EnrichmentResult assignVenue(Long entityId, Long gameId, Long venueId) {
        Game game = loadGame(entityId, gameId);
        return enrich(rawRecordOf(game), new RunOptions(EnumSet.of(Dimension.RECURRING), false, venueId, null));
    }

    /** Creates (or finds) the dated series and, when a game is given, pins that game to it. */
    public IdempotentCreator.Created<TournamentSeries> confirmSeries(Long entityId, String title, int year, Long venueId, Long gameId) {
        IdempotentCreator.Created<TournamentSeries> created = seriesResolver.confirmSeriesCreation(entityId, title, year, venueId);
        if (gameId != null) {
            Game game = loadGame(entityId, gameId);
            enrich(rawRecordOf(game), new RunOptions(EnumSet.of(Dimension.RECURRING), false, null, created.entity().getId()));
        }
        return created;
    }

    /**
     * Deletes a standalone game or a flight. A flight leaves its group first; the result says whether the
     * parent is now an empty synthetic shell. Parents with children are refused.
     */
    public DeleteResult deleteGame(Long entityId, Long gameId) {
        Game current = loadGame(entityId, gameId);
        List<String> keys = new ArrayList<>();
        keys.add(gameLockKey(entityId, current.getSourceUrl()));
        keys.add(current.getConsolidationKey());
        return withRetry("delete game " + gameId, null, () -> groupLocks.withLocks(keys, () -> enrichmentTx.execute(status -> {
            Game game = loadGame(entityId, gameId);
            if (game.isParent() && gameRepository.countByParentGameId(game.getId()) > 0) {
                throw new IllegalArgumentException("Game " + gameId + " still has flights; delete or move them first");
            }
            Instant now = Instant.now();
            boolean deleteParent = false;
            Long parentId = game.getParentGameId();
            if (parentId != null) {
                deleteParent = consolidationService.detach(game).deleteParent();
            }
            demoteManual(game, ALL);
            venueService.applyToGame(game, AssignmentOutcome.unassigned(0.0, "game deleted", null), now);
            seriesResolver.applyToGame(game, AssignmentOutcome.unassigned(0.0, "game deleted", null), now);
            recurringResolver.applyToGame(game, AssignmentOutcome.unassigned(0.0, "game deleted", null), now);
            socialPostService.forgetGame(game.getId());
            gameRepository.delete(game);
            log.info("[Enrichment][Delete] entityId={} gameId={} parentId={} deleteParent={}", entityId, gameId, parentId, deleteParent);
            return new DeleteResult(gameId, parentId, deleteParent);
        })));
    }

    /** Recomputes one group from its children and acknowledges a reopen. */
    public ConsolidationService.RecomputeResult recalculateGroup(Long entityId, Long parentId) {
        Game parent = loadGame(entityId, parentId);
        return withRetry("recalculate group " + parentId, null,
                () -> groupLocks.withLock(Objects.requireNonNullElse(parent.getConsolidationKey(), "parent:" + parentId),
                        () -> enrichmentTx.execute(status -> consolidationService.recalculateGroup(entityId, parentId))));
    }

    EnrichmentResult enrich(Long rawRecordId, RunOptions options) {
        RawGameRecord raw = rawRepository.findById(rawRecordId)
                .orElseThrow(() -> new EntityNotFoundException("Raw record not found: " + rawRecordId));
        try {
            return withRetry("enrich raw " + rawRecordId, rawRecordId, () -> attempt(raw.getId(), options));
        } catch (InvariantViolationException e) {
            log.error("[Enrichment][Invariant] rawId={} sourceUrl={} {}", rawRecordId, raw.getSourceUrl(), e.getMessage());
            recordFailure(rawRecordId, e);
            throw e;
        }
    }

    private EnrichmentResult attempt(Long rawRecordId, RunOptions options) {
        RawGameRecord raw = rawRepository.findById(rawRecordId).orElseThrow();
        RawGameRecordRequest req = json.read(raw.getPayload(), RawGameRecordRequest.class);
        Long entityId = raw.getEntityId();
        LocalDateTime start = req.getStartAt() == null ? null : req.getStartAt().toLocalDateTime();
        Game existing = gameRepository.findByEntityIdAndSourceUrl(entityId, raw.getSourceUrl()).orElse(null);

        // resolution outside the group lock; only canonical-entity creation writes here
        AssignmentOutcome<Venue> venueOutcome = null;
        Long venueId;
        if (options.manualVenueId() != null) {
            venueId = options.manualVenueId();
        } else if (options.dimensions().contains(Dimension.VENUE) && !keepsManual(existing, Dimension.VENUE, options)) {
            venueOutcome = venueService.resolve(entityId,
                    new VenueMatcher.VenueQuery(req.getVenueName(), req.getVenueAddress(), req.getVenueCity()), req.getVenueId());
            venueId = venueOutcome.isAssigned() ? venueOutcome.targetId() : null;
        } else {
            venueId = assignedTarget(existing == null ? null : existing.getVenueAssignment());
        }

        SeriesResolver.SeriesQuery seriesQuery = new SeriesResolver.SeriesQuery(entityId, req.getName(), req.getSeriesName(),
                req.getSeriesYear(), req.getEventNumber(), req.getGuaranteeAmount(), venueId,
                start == null ? null : start.toLocalDate());
        AssignmentOutcome<TournamentSeries> seriesOutcome = null;
        Long seriesId;
        if (options.manualSeriesId() != null) {
            seriesId = options.manualSeriesId();
        } else if (options.dimensions().contains(Dimension.SERIES) && !keepsManual(existing, Dimension.SERIES, options)) {
            seriesOutcome = seriesResolver.resolveAndCreate(seriesQuery);
            seriesId = seriesOutcome.isAssigned() ? seriesOutcome.targetId() : null;
        } else {
            seriesId = assignedTarget(existing == null ? null : existing.getSeriesAssignment());
        }

        ConsolidationKeyDeriver.ConsolidationKey key = keyDeriver.derive(new ConsolidationKeyDeriver.KeyInput(
                req.getName(), seriesId, req.getEventNumber(), req.getDayNumber(), req.getFlightLetter(), req.getFinalDay(),
                venueId, req.getVenueName(), start, raw.getSourceUrl()));
        String previousKey = existing == null ? null : existing.getConsolidationKey();

        List<String> lockKeys = new ArrayList<>();
        lockKeys.add(gameLockKey(entityId, raw.getSourceUrl()));
        lockKeys.add(key.key());
        if (previousKey != null) lockKeys.add(previousKey);

        AssignmentOutcome<Venue> venueApplied = venueOutcome;
        AssignmentOutcome<TournamentSeries> seriesApplied = seriesOutcome;
        return groupLocks.withLocks(lockKeys, () -> enrichmentTx.execute(status -> {
            Instant now = Instant.now();
            Game game = gameRepository.findByEntityIdAndSourceUrl(entityId, raw.getSourceUrl()).orElse(null);
            if (game != null && !Objects.equals(game.getConsolidationKey(), previousKey)) {
                throw new OptimisticLockingFailureException("Game " + game.getId() + " moved groups while being enriched");
            }
            boolean created = game == null;
            if (created) {
                game = new Game();
                game.setEntityId(entityId);
                game.setSourceUrl(raw.getSourceUrl());
            }
            Map<String, String> before = created ? Map.of() : fingerprint(game);
            ConsolidationService.TotalsSnapshot snapshot = created ? null : ConsolidationService.TotalsSnapshot.of(game);
            if (!created && options.clearManual()) demoteManual(game, options.dimensions());

            copyRawFields(game, raw, req, start);
            game = gameRepository.save(game);

            if (options.manualVenueId() != null) {
                venueService.assignManually(entityId, game, options.manualVenueId(), now);
            } else if (venueApplied != null) {
                venueService.applyToGame(game, venueApplied, now);
            }
            if (options.manualSeriesId() != null) {
                TournamentSeries series = seriesRepository.findById(options.manualSeriesId()).orElseThrow();
                seriesResolver.assignManually(game, series, now);
            } else if (seriesApplied != null) {
                seriesResolver.applyToGame(game, seriesApplied, now);
            }

            AssignmentOutcome<RecurringGame> recurringApplied = null;
            if (options.dimensions().contains(Dimension.RECURRING) && !game.getRecurringAssignment().isManual()) {
                recurringApplied = recurringResolver.resolveAndCreate(new RecurringGameResolver.RecurringQuery(entityId,
                        game.getId(), assignedTarget(game.getVenueAssignment()), game.getName(), game.getGameType(),
                        game.getGameVariant(), game.getBuyIn(), game.getGuaranteeAmount(), start,
                        SeriesResolver.isSeriesLike(seriesQuery)));
                recurringResolver.applyToGame(game, recurringApplied, now);
            }

            financials.apply(game);
            List<String> warnings = ConsolidationService.detectConflicts(snapshot, game);
            for (String w : warnings) {
                log.warn("[Enrichment][Conflict] gameId={} sourceUrl={} {}", game.getId(), game.getSourceUrl(), w);
            }
            ConsolidationService.ConsolidationResult consolidation = consolidationService.fold(game, key, warnings);
            socialPostService.recomputeForGame(game);
            if (game.getParentGameId() != null) {
                gameRepository.findById(game.getParentGameId()).ifPresent(socialPostService::recomputeForGame);
            }

            DimensionView venueView = DimensionView.of(game.getVenueAssignment(), applied(venueApplied, game.getVenueAssignment()));
            DimensionView seriesView = DimensionView.of(game.getSeriesAssignment(), applied(seriesApplied, game.getSeriesAssignment()));
            DimensionView recurringView = DimensionView.of(game.getRecurringAssignment(), applied(recurringApplied, game.getRecurringAssignment()));
            List<FieldChange> changes = changes(before, fingerprint(game), game);
            if (created || !changes.isEmpty() || game.getEnrichmentMetadata() == null) {
                Map<String, Trail> trails = new LinkedHashMap<>();
                trails.put("venue", Trail.of(venueView));
                trails.put("series", Trail.of(seriesView));
                trails.put("recurring", Trail.of(recurringView));
                game.setEnrichmentMetadata(json.write(new Metadata(raw.getId(), trails, consolidationTrail(consolidation, key),
                        financials.canCalculate(game), changes, warnings)));
            }
            gameRepository.save(game);

            if (raw.getConsumedAt() == null) {
                RawGameRecord fresh = rawRepository.findById(raw.getId()).orElseThrow();
                fresh.setConsumedAt(now);
                rawRepository.save(fresh);
            }
            log.info("[Enrichment][Done] entityId={} gameId={} created={} venue={} series={} recurring={} key={} changes={}",
                    entityId, game.getId(), created, venueView.status(), seriesView.status(), recurringView.status(),
                    key.key(), changes.size());
            return new EnrichmentResult(game.getId(), raw.getId(), created, venueView, seriesView, recurringView,
                    consolidation, financials.canCalculate(game), changes, warnings);
        }));
    }

    private <T> T withRetry(String what, Long rawRecordId, Supplier<T> work) {
        int maxAttempts = Math.max(1, settings.getEnrichmentMaxAttempts());
        for (int attempt = 1; ; attempt++) {
            try {
                return work.get();
            } catch (TransientDataAccessException | DataAccessResourceFailureException | CannotCreateTransactionException e) {
                if (attempt >= maxAttempts) {
                    log.error("[Enrichment][Retry] {} failed after {} attempts: {}", what, attempt, e.getMessage());
                    if (rawRecordId != null) recordFailure(rawRecordId, e);
                    throw new TransientPersistenceException(what + " failed after " + attempt + " attempts", e);
                }
                long backoff = settings.getEnrichmentBackoffMs() * (1L << (attempt - 1));
                log.warn("[Enrichment][Retry] {} attempt {} failed ({}), retrying in {} ms", what, attempt, e.getClass().getSimpleName(), backoff);
                sleep(backoff);
            }
        }
    }

    private void recordFailure(Long rawRecordId, Exception cause) {
        try {
            creationTx.executeWithoutResult(status -> rawRepository.findById(rawRecordId).ifPresent(r -> {
                r.setAttempts(r.getAttempts() + 1);
                String message = cause.getClass().getSimpleName() + ": " + cause.getMessage();
                r.setLastError(message.length() > 1000 ? message.substring(0, 1000) : message);
                rawRepository.save(r);
            }));
        } catch (RuntimeException e) {
            log.warn("[Enrichment][Failure] could not record failure of raw {}: {}", rawRecordId, e.getMessage());
        }
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientPersistenceException("Interrupted while backing off", e);
        }
    }

    private static boolean keepsManual(Game existing, Dimension dimension, RunOptions options) {
        if (existing == null || options.clearManual()) return false;
        Assignment a = switch (dimension) {
            case VENUE -> existing.getVenueAssignment();
            case SERIES -> existing.getSeriesAssignment();
            case RECURRING -> existing.getRecurringAssignment();
        };
        return a.isManual();
    }

    /** A manual pin becomes an automatic one on the same target, so rollups stay where they are. */
    private static void demoteManual(Game game, Set<Dimension> dimensions) {
        if (dimensions.contains(Dimension.VENUE) && game.getVenueAssignment().isManual()) {
            game.setVenueAssignment(demoted(game.getVenueAssignment()));
        }
        if (dimensions.contains(Dimension.SERIES) && game.getSeriesAssignment().isManual()) {
            game.setSeriesAssignment(demoted(game.getSeriesAssignment()));
        }
        if (dimensions.contains(Dimension.RECURRING) && game.getRecurringAssignment().isManual()) {
            game.setRecurringAssignment(demoted(game.getRecurringAssignment()));
        }
    }

    private static Assignment demoted(Assignment a) {
        return new Assignment(a.getTargetId(), AssignmentStatus.AUTO_ASSIGNED, a.getConfidence(), "manual assignment cleared");
    }

    private static Long assignedTarget(Assignment a) {
        return a != null && a.getStatus().isAssigned() ? a.getTargetId() : null;
    }

    private static AssignmentOutcome<?> applied(AssignmentOutcome<?> outcome, Assignment result) {
        if (outcome == null) return null;
        return outcome.status() == result.getStatus() && Objects.equals(outcome.targetId(), result.getTargetId()) ? outcome : null;
    }

    private static void copyRawFields(Game game, RawGameRecord raw, RawGameRecordRequest req, LocalDateTime start) {
        game.setRawRecordId(raw.getId());
        game.setExternalId(req.getExternalId());
        game.setName(req.getName());
        game.setGameType(req.getGameType());
        game.setGameVariant(req.getGameVariant());
        game.setGameStatus(req.getGameStatus());
        game.setGameStartDateTime(start);
        game.setGameEndDateTime(req.getEndAt() == null ? null : req.getEndAt().toLocalDateTime());
        game.setBuyIn(req.getBuyIn());
        game.setRake(req.getRake());
        game.setGuaranteeAmount(req.getGuaranteeAmount());
        game.setTotalInitialEntries(req.getTotalInitialEntries());
        game.setTotalEntries(req.getTotalEntries());
        game.setTotalRebuys(req.getTotalRebuys());
        game.setTotalAddons(req.getTotalAddons());
        game.setTotalUniquePlayers(req.getTotalUniquePlayers());
        game.setPrizepoolPaid(req.getPrizepoolPaid());
        game.setNumberOfTicketsPaid(req.getNumberOfTicketsPaid());
        game.setTicketValue(req.getTicketValue());
        game.setVenueName(req.getVenueName());
        game.setVenueAddress(req.getVenueAddress());
        game.setVenueCity(req.getVenueCity());
        game.setSeriesName(req.getSeriesName());
        game.setSeriesYear(req.getSeriesYear());
        game.setEventNumber(req.getEventNumber());
    }

    private static Map<String, Object> consolidationTrail(ConsolidationService.ConsolidationResult r,
                                                          ConsolidationKeyDeriver.ConsolidationKey key) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("key", r.key());
        out.put("strategy", r.strategy());
        out.put("flight", key.flight().multiDay() ? key.flight().flightId() : null);
        out.put("parentGameId", r.parentId());
        out.put("partialData", r.partialData());
        out.put("missingFlights", r.missingFlights());
        return out;
    }

    /** Fields whose change is worth a line in the trail, as comparable strings. */
    private static Map<String, String> fingerprint(Game g) {
        Map<String, String> f = new LinkedHashMap<>();
        f.put("name", g.getName());
        f.put("gameStatus", str(g.getGameStatus()));
        f.put("gameStartDateTime", str(g.getGameStartDateTime()));
        f.put("gameEndDateTime", str(g.getGameEndDateTime()));
        f.put("buyIn", money(g.getBuyIn()));
        f.put("guaranteeAmount", money(g.getGuaranteeAmount()));
        f.put("totalEntries", str(g.getTotalEntries()));
        f.put("totalUniquePlayers", str(g.getTotalUniquePlayers()));
        f.put("prizepoolPaid", money(g.getPrizepoolPaid()));
        f.put("venueName", g.getVenueName());
        f.put("venueAssignment", assignment(g.getVenueAssignment()));
        f.put("seriesAssignment", assignment(g.getSeriesAssignment()));
        f.put("recurringAssignment", assignment(g.getRecurringAssignment()));
        f.put("recurringInstanceStatus", str(g.getRecurringInstanceStatus()));
        f.put("consolidationKey", g.getConsolidationKey());
        f.put("parentGameId", str(g.getParentGameId()));
        f.put("prizepoolCalculated", money(g.getPrizepoolCalculated()));
        f.put("gameProfit", money(g.getGameProfit()));
        return f;
    }

    private static List<FieldChange> changes(Map<String, String> before, Map<String, String> after, Game g) {
        List<FieldChange> out = new ArrayList<>();
        for (Map.Entry<String, String> e : after.entrySet()) {
            if (before.isEmpty() || !Objects.equals(before.get(e.getKey()), e.getValue())) {
                if (e.getValue() == null && before.isEmpty()) continue;
                out.add(new FieldChange(e.getKey(), reasonFor(e.getKey(), g)));
            }
        }
        return out;
    }

    private static String reasonFor(String field, Game g) {
        return switch (field) {
            case "venueAssignment" -> g.getVenueAssignment().getReason();
            case "seriesAssignment" -> g.getSeriesAssignment().getReason();
            case "recurringAssignment" -> g.getRecurringAssignment().getReason();
            case "recurringInstanceStatus" -> g.getRecurringDeviationNotes() == null ? "within template tolerance" : g.getRecurringDeviationNotes();
            case "consolidationKey", "parentGameId" -> "derived by " + g.getConsolidationStrategy();
            case "prizepoolCalculated", "gameProfit" -> "recomputed from buy-in, rake and entries";
            default -> "source data";
        };
    }

    private static String assignment(Assignment a) {
        return a.getStatus() + ":" + a.getTargetId();
    }

    private static String money(BigDecimal v) {
        return v == null ? null : v.stripTrailingZeros().toPlainString();
    }

    private static String str(Object o) {
        return o == null ? null : o.toString();
    }

    private static String gameLockKey(Long entityId, String sourceUrl) {
        return "game:" + entityId + ":" + sourceUrl;
    }

    private Game loadGame(Long entityId, Long gameId) {
        Game game = gameRepository.findById(gameId)
                .orElseThrow(() -> new EntityNotFoundException("Game not found: " + gameId));
        TenantAccessDeniedException.check("Game", gameId, game.getEntityId(), entityId);
        return game;
    }

    private static Long rawRecordOf(Game game) {
        if (game.getRawRecordId() == null) {
            throw new IllegalArgumentException("Game " + game.getId() + " has no raw record; consolidation parents are recalculated, not re-resolved");
        }
        return game.getRawRecordId();
    }
}
