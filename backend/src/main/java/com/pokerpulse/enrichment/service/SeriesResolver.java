package com.pokerpulse.enrichment.service;

import com.pokerpulse.enrichment.config.ResolutionSettings;
import com.pokerpulse.enrichment.model.Assignment;
import com.pokerpulse.enrichment.model.AssignmentStatus;
import com.pokerpulse.enrichment.model.Game;
import com.pokerpulse.enrichment.model.TournamentSeries;
import com.pokerpulse.enrichment.model.TournamentSeriesTitle;
import com.pokerpulse.enrichment.repository.TournamentSeriesRepository;
import com.pokerpulse.enrichment.repository.TournamentSeriesTitleRepository;
import com.pokerpulse.enrichment.util.NameNormalizer;
import com.pokerpulse.enrichment.util.TextSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Two-stage series resolution. The title ("Sydney Championships") persists across years and is created
 * freely; the dated instance ("Sydney Championships 2024") is created only on confirmation unless
 * auto-creation is switched on.
 */
@Service
public class SeriesResolver {
    private static final Logger log = LoggerFactory.getLogger(SeriesResolver.class);

    private static final BigDecimal SERIES_GUARANTEE = new BigDecimal("30000");
    private static final Pattern KEYWORDS = Pattern.compile(
            "\\b(series|championships?|festival|main event|classic|open|cup)\\b|event\\s*#", Pattern.CASE_INSENSITIVE);
    private static final Pattern YEAR = Pattern.compile("\\b(20[2-3]\\d)\\b");

    private static final Pattern[] TITLE_STRIP = new Pattern[] {
            Pattern.compile("\\$?\\d+(?:[.,]\\d+)?\\s*[km]?\\s*(?:gtd|guaranteed)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bevent\\s*#?\\s*\\d+\\b.*$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bmain event\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:day|flight)\\s*\\d*[a-h]?\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bfinal (?:day|table)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:january|february|march|april|may|june|july|august|september|october|november|december"
                    + "|jan|feb|mar|apr|jun|jul|aug|sept|sep|oct|nov|dec)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bq[1-4]\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:19|20)\\d{2}\\b")
    };

    public enum Signal implements MatchSignal {
        TITLE(0.6),
        YEAR(0.3),
        VENUE(0.1);

        private final double weight;

        Signal(double weight) { this.weight = weight; }

        @Override
        public double defaultWeight() { return weight; }
    }

    public record SeriesQuery(Long entityId,
                              String name,
                              String seriesName,
                              Integer seriesYear,
                              Integer eventNumber,
                              BigDecimal guarantee,
                              Long venueId,
                              LocalDate date) {}

    private final TournamentSeriesTitleRepository titleRepository;
    private final TournamentSeriesRepository seriesRepository;
    private final IdempotentCreator creator;
    private final ResolutionSettings settings;

    public SeriesResolver(TournamentSeriesTitleRepository titleRepository, TournamentSeriesRepository seriesRepository,
                          IdempotentCreator creator, ResolutionSettings settings) {
        this.titleRepository = titleRepository;
        this.seriesRepository = seriesRepository;
        this.creator = creator;
        this.settings = settings;
    }

    public static boolean isSeriesLike(SeriesQuery q) {
        if (q.seriesName() != null && !q.seriesName().isBlank()) return true;
        if (q.eventNumber() != null) return true;
        String name = q.name() == null ? "" : q.name();
        if (KEYWORDS.matcher(name).find()) return true;
        return q.guarantee() != null && q.guarantee().compareTo(SERIES_GUARANTEE) >= 0
                && !name.toLowerCase().contains("weekly");
    }

    /** Title text with dates, flights, event numbers and guarantees removed, in its original case. */
    public static String displayTitle(SeriesQuery q) {
        String source = q.seriesName() != null && !q.seriesName().isBlank() ? q.seriesName() : q.name();
        if (source == null) return "";
        String s = source;
        for (Pattern p : TITLE_STRIP) s = p.matcher(s).replaceAll(" ");
        s = s.replaceAll("[\\s\\-–|:#,]+$", "").replaceAll("^[\\s\\-–|:#,]+", "");
        return s.replaceAll("\\s+", " ").trim();
    }

    public static String normalizeTitle(String displayTitle) {
        return NameNormalizer.normalizeForMatch(displayTitle);
    }

    public static Integer resolveYear(SeriesQuery q) {
        if (q.seriesYear() != null) return q.seriesYear();
        for (String text : new String[] {q.seriesName(), q.name()}) {
            if (text == null) continue;
            Matcher m = YEAR.matcher(text);
            if (m.find()) return Integer.parseInt(m.group(1));
        }
        return q.date() == null ? null : q.date().getYear();
    }

    /** Dry run: never creates a title. */
    public AssignmentOutcome<TournamentSeries> preview(SeriesQuery q) {
        return resolve(q, false);
    }

    public AssignmentOutcome<TournamentSeries> resolveAndCreate(SeriesQuery q) {
        return resolve(q, true);
    }

    private AssignmentOutcome<TournamentSeries> resolve(SeriesQuery q, boolean create) {
        if (!isSeriesLike(q)) return AssignmentOutcome.notApplicable("not series-like");
        String title = displayTitle(q);
        String normalized = normalizeTitle(title);
        if (normalized.isEmpty()) return AssignmentOutcome.unassigned(0.0, "no series title text", null);
        Integer year = resolveYear(q);
        ThresholdPolicy policy = settings.seriesPolicy();
        double belowAuto = Math.max(0.0, policy.autoThreshold() - 0.0001);

        Map<TournamentSeriesTitle, Double> titleScores = scoreTitles(q.entityId(), normalized);
        TournamentSeriesTitle best = titleScores.entrySet().stream()
                .filter(e -> e.getValue() >= settings.getSeriesTitleThreshold())
                .max(Map.Entry.<TournamentSeriesTitle, Double>comparingByValue()
                        .thenComparing(e -> -e.getKey().getId()))
                .map(Map.Entry::getKey).orElse(null);
        String suggested = year == null ? title : title + " " + year;

        if (best == null) {
            List<TournamentSeriesTitle> fuzzy = titleScores.entrySet().stream()
                    .filter(e -> e.getValue() >= policy.suggestThreshold())
                    .map(Map.Entry::getKey).toList();
            if (!fuzzy.isEmpty() && year != null) {
                List<ScoredCandidate<TournamentSeries>> candidates = new ArrayList<>();
                for (TournamentSeries s : instancesOf(q.entityId(), fuzzy)) {
                    if (!year.equals(s.getSeriesYear())) continue;
                    candidates.add(scoreInstance(s, titleScores.get(titleOf(fuzzy, s)), year, q.venueId()).cappedAt(belowAuto));
                }
                if (!candidates.isEmpty()) {
                    return policy.<TournamentSeries>decide(ConfidenceScorer.rank(candidates), "series").withSuggestedName(suggested);
                }
            }
            if (create) {
                IdempotentCreator.Created<TournamentSeriesTitle> created = findOrCreateTitle(q.entityId(), title);
                if (created.wasCreated()) log.info("[Series][Title] entityId={} created title '{}'", q.entityId(), title);
            }
            return AssignmentOutcome.unassigned(0.0, "no known series title matches '" + title + "'", suggested);
        }

        // only the exact normalized title with the same year may auto-assign; a close title is a candidate
        boolean exactTitle = normalized.equals(best.getNormalizedTitle());
        List<ScoredCandidate<TournamentSeries>> candidates = new ArrayList<>();
        TournamentSeries sameYear = null;
        for (TournamentSeries s : instancesOf(q.entityId(), List.of(best))) {
            ScoredCandidate<TournamentSeries> c = scoreInstance(s, titleScores.get(best), year, q.venueId());
            boolean sameYearInstance = year != null && year.equals(s.getSeriesYear());
            if (sameYearInstance) sameYear = s;
            candidates.add(sameYearInstance && exactTitle ? c : c.cappedAt(belowAuto));
        }
        if (sameYear == null && year != null) {
            if (exactTitle && settings.isSeriesAutoCreateInstance() && create) {
                IdempotentCreator.Created<TournamentSeries> created = findOrCreateInstance(q.entityId(), best, year, q.venueId());
                TournamentSeries s = created.entity();
                ScoredCandidate<TournamentSeries> self = scoreInstance(s, titleScores.get(best), year, q.venueId());
                AssignmentOutcome<TournamentSeries> matched = policy.decide(List.of(self), "series");
                if (matched.isAssigned()) {
                    return AssignmentOutcome.autoAssigned(s.getId(), s, matched.confidence(), policy.autoThreshold(),
                            matched.reason(), matched.candidates(), created.wasCreated());
                }
                return matched.withSuggestedName(suggested);
            }
            return AssignmentOutcome.unassigned(0.0, "no " + year + " instance of series '" + best.getTitle() + "'", suggested);
        }
        AssignmentOutcome<TournamentSeries> outcome = policy.decide(ConfidenceScorer.rank(candidates), "series");
        return outcome.isAssigned() ? outcome : outcome.withSuggestedName(suggested);
    }

    private Map<TournamentSeriesTitle, Double> scoreTitles(Long entityId, String normalized) {
        return titleRepository.findByEntityIdOrderByIdAsc(entityId).stream()
                .collect(Collectors.toMap(t -> t, t -> titleSimilarity(normalized, t.getNormalizedTitle()),
                        (a, b) -> a, LinkedHashMap::new));
    }

    static double titleSimilarity(String a, String b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) return 0.0;
        if (a.equals(b)) return 1.0;
        return ConfidenceScorer.round(0.5 * TextSimilarity.tokenJaccard(a, b) + 0.5 * TextSimilarity.editRatio(a, b));
    }

    private List<TournamentSeries> instancesOf(Long entityId, List<TournamentSeriesTitle> titles) {
        return seriesRepository.findByEntityIdAndSeriesTitleIdInOrderByIdAsc(entityId,
                titles.stream().map(TournamentSeriesTitle::getId).toList());
    }

    private static TournamentSeriesTitle titleOf(List<TournamentSeriesTitle> titles, TournamentSeries s) {
        return titles.stream().filter(t -> t.getId().equals(s.getSeriesTitleId())).findFirst().orElseThrow();
    }

    private ScoredCandidate<TournamentSeries> scoreInstance(TournamentSeries s, double titleScore, Integer year, Long venueId) {
        double yearScore;
        if (year == null) yearScore = 0.5;
        else if (year.equals(s.getSeriesYear())) yearScore = 1.0;
        else yearScore = Math.abs(year - s.getSeriesYear()) == 1 ? 0.5 : 0.0;
        double venueScore;
        if (venueId == null || s.getVenueId() == null) venueScore = 0.5;
        else venueScore = venueId.equals(s.getVenueId()) ? 1.0 : 0.0;
        List<SignalMatch> signals = List.of(
                SignalMatch.of(Signal.TITLE, titleScore),
                SignalMatch.of(Signal.YEAR, yearScore),
                SignalMatch.of(Signal.VENUE, venueScore));
        return ScoredCandidate.of(s, s.getId(), s.getName(), s.getUpdatedAt(), signals);
    }

    public IdempotentCreator.Created<TournamentSeriesTitle> findOrCreateTitle(Long entityId, String title) {
        String normalized = normalizeTitle(title);
        if (normalized.isEmpty()) throw new IllegalArgumentException("Series title is required");
        return creator.findOrCreate(IdempotentCreator.key("series-title", entityId, normalized),
                () -> titleRepository.findByEntityIdAndNormalizedTitle(entityId, normalized),
                () -> titleRepository.saveAndFlush(new TournamentSeriesTitle(entityId, title.trim(), normalized)));
    }

    private IdempotentCreator.Created<TournamentSeries> findOrCreateInstance(Long entityId, TournamentSeriesTitle title,
                                                                           int year, Long venueId) {
        return creator.findOrCreate(IdempotentCreator.key("series", entityId, title.getId() + ":" + year),
                () -> seriesRepository.findByEntityIdAndSeriesTitleIdAndSeriesYear(entityId, title.getId(), year),
                () -> {
                    TournamentSeries s = new TournamentSeries(entityId, title.getId(), title.getTitle() + " " + year, year);
                    s.setVenueId(venueId);
                    return seriesRepository.saveAndFlush(s);
                });
    }

    /** Confirms a suggested dated series, creating its title and instance when missing. */
    public IdempotentCreator.Created<TournamentSeries> confirmSeriesCreation(Long entityId, String title, int year, Long venueId) {
        TournamentSeriesTitle t = findOrCreateTitle(entityId, title).entity();
        IdempotentCreator.Created<TournamentSeries> created = findOrCreateInstance(entityId, t, year, venueId);
        log.info("[Series][Confirm] entityId={} title='{}' year={} seriesId={} created={}",
                entityId, t.getTitle(), year, created.entity().getId(), created.wasCreated());
        return created;
    }

    /**
     * Writes the outcome onto the game and updates series rollups when the link changed. Manual links are kept.
     *
     * @return true when the game's series changed
     */
    public boolean applyToGame(Game game, AssignmentOutcome<TournamentSeries> outcome, Instant now) {
        Assignment current = game.getSeriesAssignment();
        if (current.isManual() && outcome.status() != AssignmentStatus.MANUALLY_ASSIGNED) return false;
        Long previous = current.getStatus().isAssigned() ? current.getTargetId() : null;
        Long next = outcome.isAssigned() ? outcome.targetId() : null;
        boolean changed = !Objects.equals(previous, next);
        if (changed) {
            if (previous != null) {
                seriesRepository.decrementGameCount(previous);
            }
            if (next != null) {
                seriesRepository.incrementGameCount(next);
                if (game.getGameStartDateTime() != null) {
                    seriesRepository.extendStartDate(next, game.getGameStartDateTime().toLocalDate());
                    seriesRepository.extendEndDate(next, game.getGameStartDateTime().toLocalDate());
                    seriesRepository.advanceLastGameSeen(next, game.getGameStartDateTime().atZone(ZoneOffset.UTC).toInstant());
                }
            }
        }
        game.setSeriesAssignment(outcome.toAssignment());
        game.setSuggestedSeriesName(outcome.isAssigned() ? null : outcome.suggestedName());
        return changed;
    }

    /** Pins a game to a confirmed series instance. */
    public TournamentSeries assignManually(Game game, TournamentSeries series, Instant now) {
        applyToGame(game, AssignmentOutcome.manual(series.getId(), series, "manually assigned"), now);
        return series;
    }
}
