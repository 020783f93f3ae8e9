package com.pokerpulse.enrichment.service;

import com.pokerpulse.enrichment.config.ResolutionSettings;
import com.pokerpulse.enrichment.model.Assignment;
import com.pokerpulse.enrichment.model.AssignmentStatus;
import com.pokerpulse.enrichment.model.Game;
import com.pokerpulse.enrichment.model.GameType;
import com.pokerpulse.enrichment.model.RecurringGame;
import com.pokerpulse.enrichment.model.RecurringInstanceStatus;
import com.pokerpulse.enrichment.repository.GameRepository;
import com.pokerpulse.enrichment.repository.RecurringGameRepository;
import com.pokerpulse.enrichment.util.NameNormalizer;
import com.pokerpulse.enrichment.util.TextSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Links a game to the weekly template it is an instance of. The (venue, day-of-week, session mode) triple
 * is a hard gate; within it name, variant, buy-in tier and start time decide. This is the only resolver
 * that creates its canonical entity without confirmation, and only after enough repetitions were seen.
 */
@Service
public class RecurringGameResolver {
    private static final Logger log = LoggerFactory.getLogger(RecurringGameResolver.class);

    private static final int PRIOR_SCAN = 200;
    private static final Set<String> STOPWORDS = Set.of("the", "and", "gtd", "guaranteed", "guarantee",
            "tournament", "poker", "weekly");

    public enum Signal implements MatchSignal {
        NAME(0.50),
        VARIANT(0.25),
        BUY_IN(0.15),
        START_TIME(0.10);

        private final double weight;

        Signal(double weight) { this.weight = weight; }

        @Override
        public double defaultWeight() { return weight; }
    }

    public enum BuyInTier {
        FREEROLL(0),
        MICRO(30),
        LOW(100),
        MID(300),
        HIGH(1000),
        SUPER_HIGH(5000),
        ULTRA_HIGH(Long.MAX_VALUE);

        private final long upperBound;

        BuyInTier(long upperBound) { this.upperBound = upperBound; }

        public static BuyInTier of(BigDecimal buyIn) {
            if (buyIn == null || buyIn.signum() <= 0) return FREEROLL;
            for (BuyInTier t : values()) {
                if (buyIn.compareTo(BigDecimal.valueOf(t.upperBound)) <= 0) return t;
            }
            return ULTRA_HIGH;
        }
    }

    public record RecurringQuery(Long entityId,
                                 Long gameId,
                                 Long venueId,
                                 String name,
                                 GameType gameType,
                                 String variant,
                                 BigDecimal buyIn,
                                 BigDecimal guarantee,
                                 LocalDateTime start,
                                 boolean seriesLike) {

        public DayOfWeek dayOfWeek() {
            return start == null ? null : start.getDayOfWeek();
        }
    }

    private final RecurringGameRepository recurringRepository;
    private final GameRepository gameRepository;
    private final IdempotentCreator creator;
    private final ResolutionSettings settings;

    public RecurringGameResolver(RecurringGameRepository recurringRepository, GameRepository gameRepository,
                                 IdempotentCreator creator, ResolutionSettings settings) {
        this.recurringRepository = recurringRepository;
        this.gameRepository = gameRepository;
        this.creator = creator;
        this.settings = settings;
    }

    /** Dry run: never creates a template, reports the creation it would make instead. */
    public AssignmentOutcome<RecurringGame> preview(RecurringQuery q) {
        return resolve(q, false);
    }

    /** Resolves and, when the repetition rule is met, creates the template and links prior occurrences. */
    public AssignmentOutcome<RecurringGame> resolveAndCreate(RecurringQuery q) {
        return resolve(q, true);
    }

    private AssignmentOutcome<RecurringGame> resolve(RecurringQuery q, boolean create) {
        if (q.seriesLike()) return AssignmentOutcome.notApplicable("series-like record");
        if (q.venueId() == null) return AssignmentOutcome.unassigned(0.0, "venue unresolved", null);
        if (q.start() == null) return AssignmentOutcome.unassigned(0.0, "no start time", null);

        ThresholdPolicy policy = settings.recurringPolicy();
        List<RecurringGame> templates = recurringRepository.findByEntityIdAndVenueIdAndDayOfWeekOrderByIdAsc(
                q.entityId(), q.venueId(), q.dayOfWeek());
        AssignmentOutcome<RecurringGame> outcome = policy.decide(score(q, templates), "recurring game");
        if (outcome.status() != AssignmentStatus.UNASSIGNED) return outcome;

        List<Game> prior = priorOccurrences(q);
        if (prior.size() < settings.getRecurringMinRepetitions()) {
            return outcome;
        }
        String name = FlightPatternDetector.baseName(q.name());
        if (!create) {
            return AssignmentOutcome.unassigned(outcome.confidence(),
                    "would create recurring game '" + name + "' from " + prior.size() + " prior occurrences", name);
        }

        IdempotentCreator.Created<RecurringGame> created = createTemplate(q, name);
        RecurringGame template = created.entity();
        ScoredCandidate<RecurringGame> self = scoreOne(q, template);
        if (self.confidence() < policy.autoThreshold()) {
            return policy.decide(List.of(self), "recurring game");
        }
        if (created.wasCreated()) {
            linkPriorOccurrences(template, prior, policy);
            log.info("[Recurring][Create] entityId={} venueId={} day={} name='{}' prior={}",
                    q.entityId(), q.venueId(), q.dayOfWeek(), name, prior.size());
        }
        AssignmentOutcome<RecurringGame> matched = policy.decide(List.of(self), "recurring game");
        return AssignmentOutcome.autoAssigned(template.getId(), template, matched.confidence(), policy.autoThreshold(),
                matched.reason(), matched.candidates(), created.wasCreated());
    }

    public List<ScoredCandidate<RecurringGame>> score(RecurringQuery q, List<RecurringGame> templates) {
        List<ScoredCandidate<RecurringGame>> out = new ArrayList<>();
        for (RecurringGame t : templates) {
            if (!Objects.equals(t.getGameType(), q.gameType()) && t.getGameType() != null && q.gameType() != null) continue;
            out.add(scoreOne(q, t));
        }
        return ConfidenceScorer.rank(out);
    }

    private ScoredCandidate<RecurringGame> scoreOne(RecurringQuery q, RecurringGame t) {
        List<SignalMatch> signals = List.of(
                SignalMatch.of(Signal.NAME, nameSimilarity(q.name(), t.getName())),
                SignalMatch.of(Signal.VARIANT, variantSimilarity(q.variant(), t.getGameVariant())),
                SignalMatch.of(Signal.BUY_IN, buyInSimilarity(q.buyIn(), t.getTypicalBuyIn())),
                SignalMatch.of(Signal.START_TIME, startTimeSimilarity(q.start() == null ? null : q.start().toLocalTime(), t.getStartTime())));
        return ScoredCandidate.of(t, t.getId(), t.getName(), t.getUpdatedAt(), signals);
    }

    static double nameSimilarity(String a, String b) {
        String na = NameNormalizer.normalizeForMatch(FlightPatternDetector.baseName(a));
        String nb = NameNormalizer.normalizeForMatch(FlightPatternDetector.baseName(b));
        if (na.isEmpty() || nb.isEmpty()) return 0.0;
        if (na.equals(nb)) return 1.0;
        if (na.contains(nb) || nb.contains(na)) return 0.9;
        return 0.6 * TextSimilarity.jaccard(coreTokens(na), coreTokens(nb)) + 0.4 * TextSimilarity.editRatio(na, nb);
    }

    private static Set<String> coreTokens(String normalized) {
        return NameNormalizer.tokens(normalized).stream()
                .filter(t -> t.length() > 2)
                .filter(t -> !STOPWORDS.contains(t))
                .filter(t -> !t.chars().allMatch(Character::isDigit))
                .collect(Collectors.toSet());
    }

    static double variantSimilarity(String a, String b) {
        if (a == null || a.isBlank() || b == null || b.isBlank()) return 0.5;
        return NameNormalizer.normalizeForMatch(a).equals(NameNormalizer.normalizeForMatch(b)) ? 1.0 : 0.0;
    }

    static double buyInSimilarity(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) return 0.5;
        if (a.compareTo(b) == 0) return 1.0;
        BigDecimal lo = a.min(b);
        BigDecimal hi = a.max(b);
        if (lo.signum() > 0 && hi.divide(lo, 4, RoundingMode.HALF_UP).compareTo(BigDecimal.TEN) > 0) return 0.0;
        int distance = Math.abs(BuyInTier.of(a).ordinal() - BuyInTier.of(b).ordinal());
        if (distance == 0) return 1.0;
        return distance == 1 ? 0.5 : 0.0;
    }

    static double startTimeSimilarity(LocalTime a, LocalTime b) {
        if (a == null || b == null) return 0.5;
        long minutes = Math.abs(Duration.between(a, b).toMinutes());
        if (minutes <= 30) return 1.0;
        return minutes <= 90 ? 0.5 : 0.0;
    }

    /** Unlinked games in the same slot within the lookback window whose names look like this one. */
    private List<Game> priorOccurrences(RecurringQuery q) {
        LocalDateTime from = q.start().minusWeeks(settings.getRecurringLookbackWeeks());
        List<Game> window = gameRepository.findVenueGamesBetween(q.entityId(), q.venueId(), from, q.start(),
                PageRequest.of(0, PRIOR_SCAN));
        List<Game> out = new ArrayList<>();
        for (Game g : window) {
            if (Objects.equals(g.getId(), q.gameId())) continue;
            if (g.getGameStartDateTime() == null || g.getGameStartDateTime().getDayOfWeek() != q.dayOfWeek()) continue;
            if (q.gameType() != null && g.getGameType() != null && g.getGameType() != q.gameType()) continue;
            AssignmentStatus status = g.getRecurringAssignment().getStatus();
            if (status.isAssigned() || status == AssignmentStatus.NOT_APPLICABLE) continue;
            if (nameSimilarity(q.name(), g.getName()) < settings.getRecurringPatternSimilarity()) continue;
            out.add(g);
        }
        return out;
    }

    private IdempotentCreator.Created<RecurringGame> createTemplate(RecurringQuery q, String name) {
        String normalized = NameNormalizer.normalizeForMatch(name);
        DayOfWeek day = q.dayOfWeek();
        return creator.findOrCreate(
                IdempotentCreator.key("recurring", q.entityId(), q.venueId() + ":" + day + ":" + normalized),
                () -> recurringRepository.findByEntityIdAndVenueIdAndDayOfWeekAndNormalizedName(q.entityId(), q.venueId(), day, normalized),
                () -> {
                    RecurringGame t = new RecurringGame();
                    t.setEntityId(q.entityId());
                    t.setVenueId(q.venueId());
                    t.setName(name);
                    t.setNormalizedName(normalized);
                    t.setDayOfWeek(day);
                    t.setStartTime(q.start().toLocalTime());
                    t.setGameType(q.gameType());
                    t.setGameVariant(q.variant());
                    t.setTypicalBuyIn(q.buyIn());
                    t.setTypicalGuarantee(q.guarantee());
                    t.setGameCount(0);
                    return recurringRepository.saveAndFlush(t);
                });
    }

    private void linkPriorOccurrences(RecurringGame template, List<Game> prior, ThresholdPolicy policy) {
        Instant now = Instant.now();
        for (Game g : prior) {
            RecurringQuery pq = new RecurringQuery(g.getEntityId(), g.getId(), template.getVenueId(), g.getName(),
                    g.getGameType(), g.getGameVariant(), g.getBuyIn(), g.getGuaranteeAmount(), g.getGameStartDateTime(), false);
            AssignmentOutcome<RecurringGame> o = policy.decide(List.of(scoreOne(pq, template)), "recurring game");
            if (o.isAssigned()) {
                applyToGame(g, o, now);
                gameRepository.save(g);
            }
        }
    }

    /**
     * Writes the outcome onto the game and moves template rollups when the link changed. Manual links are kept.
     *
     * @return true when the game's template changed
     */
    public boolean applyToGame(Game game, AssignmentOutcome<RecurringGame> outcome, Instant now) {
        Assignment current = game.getRecurringAssignment();
        if (current.isManual() && outcome.status() != AssignmentStatus.MANUALLY_ASSIGNED) return false;
        Long previous = current.getStatus().isAssigned() ? current.getTargetId() : null;
        Long next = outcome.isAssigned() ? outcome.targetId() : null;
        boolean changed = !Objects.equals(previous, next);
        if (changed) {
            if (previous != null) {
                recurringRepository.decrementGameCount(previous);
            }
            if (next != null) {
                recurringRepository.incrementGameCount(next);
                if (game.getGameStartDateTime() != null) {
                    recurringRepository.advanceLastGameSeen(next, game.getGameStartDateTime().atZone(ZoneOffset.UTC).toInstant());
                }
            }
        }
        game.setRecurringAssignment(outcome.toAssignment());
        if (next == null) {
            game.setRecurringInstanceStatus(null);
            game.setRecurringDeviationNotes(null);
        } else {
            RecurringGame template = outcome.target() != null ? outcome.target() : recurringRepository.findById(next).orElseThrow();
            String notes = deviationNotes(template, game.getBuyIn(), game.getGuaranteeAmount());
            game.setRecurringInstanceStatus(notes == null ? RecurringInstanceStatus.CONFIRMED : RecurringInstanceStatus.DEVIATION_FLAGGED);
            game.setRecurringDeviationNotes(notes);
        }
        return changed;
    }

    /** Null when buy-in and guarantee are within tolerance of the template's typical values. */
    String deviationNotes(RecurringGame template, BigDecimal buyIn, BigDecimal guarantee) {
        List<String> notes = new ArrayList<>();
        deviation(notes, "buy-in", buyIn, template.getTypicalBuyIn());
        deviation(notes, "guarantee", guarantee, template.getTypicalGuarantee());
        return notes.isEmpty() ? null : String.join("; ", notes);
    }

    private void deviation(List<String> notes, String field, BigDecimal actual, BigDecimal typical) {
        if (actual == null || typical == null || typical.signum() <= 0) return;
        BigDecimal ratio = actual.subtract(typical).abs().divide(typical, 4, RoundingMode.HALF_UP);
        if (ratio.doubleValue() > settings.getRecurringDeviationTolerance()) {
            notes.add(field + " " + actual.setScale(2, RoundingMode.HALF_UP).toPlainString() + " deviates "
                    + ratio.movePointRight(2).setScale(0, RoundingMode.HALF_UP).toPlainString() + "% from typical "
                    + typical.setScale(2, RoundingMode.HALF_UP).toPlainString());
        }
    }
}
