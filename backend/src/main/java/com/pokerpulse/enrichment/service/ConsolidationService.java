package com.pokerpulse.enrichment.service;

import com.pokerpulse.enrichment.config.ResolutionSettings;
import com.pokerpulse.enrichment.model.Assignment;
import com.pokerpulse.enrichment.model.AssignmentStatus;
import com.pokerpulse.enrichment.model.ConsolidationStrategy;
import com.pokerpulse.enrichment.model.ConsolidationType;
import com.pokerpulse.enrichment.model.Game;
import com.pokerpulse.enrichment.model.GameStatus;
import com.pokerpulse.enrichment.repository.GameRepository;
import com.pokerpulse.enrichment.web.InvariantViolationException;
import com.pokerpulse.enrichment.web.TenantAccessDeniedException;
import jakarta.persistence.EntityNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Folds flights into consolidation groups. A group is a synthetic PARENT game plus its CHILD games, linked
 * by {@code parentGameId} only. Callers hold the group lock(s) and an open transaction.
 */
@Service
public class ConsolidationService {
    private static final Logger log = LoggerFactory.getLogger(ConsolidationService.class);

    private static final String PARENT_URL_PREFIX = "consolidated://";

    private final GameRepository gameRepository;
    private final FinancialsCalculator financials;
    private final ResolutionSettings settings;

    public ConsolidationService(GameRepository gameRepository, FinancialsCalculator financials, ResolutionSettings settings) {
        this.gameRepository = gameRepository;
        this.financials = financials;
        this.settings = settings;
    }

    public record ConsolidationResult(String key,
                                      ConsolidationStrategy strategy,
                                      Long parentId,
                                      boolean parentCreated,
                                      int childCount,
                                      boolean partialData,
                                      List<String> missingFlights,
                                      boolean reopened,
                                      List<String> conflicts,
                                      DetachResult detachedFrom) {}

    public record DetachResult(Long parentId, int remainingChildren, boolean deleteParent) {}

    public record RecomputeResult(int childCount, boolean partialData, List<String> missingFlights) {}

    /** Totals of a child before it is overwritten by a re-ingested observation. */
    public record TotalsSnapshot(Integer totalEntries, Integer totalRebuys, Integer totalAddons,
                                 Integer totalUniquePlayers, BigDecimal prizepoolPaid) {
        public static TotalsSnapshot of(Game g) {
            return new TotalsSnapshot(g.getTotalEntries(), g.getTotalRebuys(), g.getTotalAddons(),
                    g.getTotalUniquePlayers(), g.getPrizepoolPaid());
        }
    }

    /**
     * Attaches the saved game to the group of {@code key}, creating the synthetic parent if needed. A game whose
     * key changed is first detached from its previous group. Ungrouped keys make the game standalone.
     */
    public ConsolidationResult fold(Game game, ConsolidationKeyDeriver.ConsolidationKey key, List<String> conflicts) {
        DetachResult detached = null;
        Long currentParentId = game.getParentGameId();
        if (currentParentId != null) {
            Game currentParent = gameRepository.findById(currentParentId).orElse(null);
            if (currentParent == null || !key.isGrouped() || !Objects.equals(currentParent.getConsolidationKey(), key.key())) {
                detached = detach(game);
            }
        }

        game.setConsolidationKey(key.key());
        game.setConsolidationStrategy(key.strategy());
        FlightPatternDetector.FlightInfo flight = key.flight();
        game.setDayNumber(flight.dayNumber());
        game.setFlightLetter(flight.flightLetter());
        game.setFinalDay(flight.finalDay());

        if (!key.isGrouped()) {
            game.setConsolidationType(ConsolidationType.STANDALONE);
            game.setParentGameId(null);
            gameRepository.save(game);
            return new ConsolidationResult(key.key(), key.strategy(), null, false, 0, false, List.of(), false, conflicts, detached);
        }

        List<Game> parents = gameRepository.findByEntityIdAndConsolidationKeyAndConsolidationType(
                game.getEntityId(), key.key(), ConsolidationType.PARENT);
        if (parents.size() > 1) {
            throw InvariantViolationException.duplicateGroup(game.getEntityId(), key.key(), parents.size());
        }
        boolean created = false;
        boolean reopened = false;
        Game parent;
        if (parents.isEmpty()) {
            parent = gameRepository.save(newParent(game, key));
            created = true;
            log.info("[Consolidation][NewGroup] entityId={} key={} parentId={}", game.getEntityId(), key.key(), parent.getId());
        } else {
            parent = parents.get(0);
            boolean alreadyMember = Objects.equals(game.getParentGameId(), parent.getId());
            if (!alreadyMember) {
                long size = gameRepository.countByParentGameId(parent.getId());
                if (size >= settings.getConsolidationMaxChildren()) {
                    throw InvariantViolationException.groupFull(key.key(), settings.getConsolidationMaxChildren());
                }
                if (parent.getGameStatus() == GameStatus.FINISHED) {
                    parent.setReopenedAfterFinish(true);
                    reopened = true;
                    log.warn("[Consolidation][Reopen] key={} parentId={} late childId={}", key.key(), parent.getId(), game.getId());
                }
            }
        }

        game.setConsolidationType(ConsolidationType.CHILD);
        game.setParentGameId(parent.getId());
        gameRepository.save(game);

        RecomputeResult r = recompute(parent);
        return new ConsolidationResult(key.key(), key.strategy(), parent.getId(), created, r.childCount(),
                r.partialData(), r.missingFlights(), reopened, conflicts, detached);
    }

    /** Removes a child from its group and recomputes what is left. The parent is never deleted here. */
    public DetachResult detach(Game child) {
        Long parentId = child.getParentGameId();
        child.setParentGameId(null);
        child.setConsolidationType(ConsolidationType.STANDALONE);
        gameRepository.save(child);
        if (parentId == null) return new DetachResult(null, 0, false);
        Game parent = gameRepository.findById(parentId).orElse(null);
        if (parent == null) return new DetachResult(parentId, 0, false);
        RecomputeResult r = recompute(parent);
        boolean deleteParent = r.childCount() == 0 && !parent.isHasIndependentData();
        log.info("[Consolidation][Detach] childId={} parentId={} remaining={} deleteParent={}", child.getId(), parentId, r.childCount(), deleteParent);
        return new DetachResult(parentId, r.childCount(), deleteParent);
    }

    /** Explicit recalculation; also acknowledges a reopen, so only missing flights keep the group partial. */
    public RecomputeResult recalculateGroup(Long entityId, Long parentId) {
        Game parent = gameRepository.findById(parentId)
                .orElseThrow(() -> new EntityNotFoundException("Game not found: " + parentId));
        TenantAccessDeniedException.check("Game", parentId, parent.getEntityId(), entityId);
        if (!parent.isParent()) throw new IllegalArgumentException("Game " + parentId + " is not a consolidation parent");
        parent.setReopenedAfterFinish(false);
        return recompute(parent);
    }

    public List<Game> children(Long parentId) {
        return gameRepository.findByParentGameIdOrderByIdAsc(parentId);
    }

    RecomputeResult recompute(Game parent) {
        List<Game> children = gameRepository.findByParentGameIdOrderByIdAsc(parent.getId());
        parent.setChildCount(children.size());

        parent.setTotalInitialEntries(sumInt(children, Game::getTotalInitialEntries));
        parent.setTotalEntries(sumInt(children, Game::getTotalEntries));
        parent.setTotalRebuys(sumInt(children, Game::getTotalRebuys));
        parent.setTotalAddons(sumInt(children, Game::getTotalAddons));
        parent.setTotalUniquePlayers(sumInt(children, Game::getTotalUniquePlayers));
        parent.setNumberOfTicketsPaid(sumInt(children, Game::getNumberOfTicketsPaid));
        parent.setPrizepoolPaid(sumMoney(children, Game::getPrizepoolPaid));
        parent.setRakeRevenue(sumMoney(children, Game::getRakeRevenue));
        parent.setTotalBuyInsCollected(sumMoney(children, Game::getTotalBuyInsCollected));
        parent.setPrizepoolPlayerContributions(sumMoney(children, Game::getPrizepoolPlayerContributions));
        parent.setGuaranteeOverlayCost(sumMoney(children, Game::getGuaranteeOverlayCost));
        parent.setPrizepoolSurplus(sumMoney(children, Game::getPrizepoolSurplus));
        parent.setPrizepoolCalculated(sumMoney(children, Game::getPrizepoolCalculated));
        parent.setGameProfit(sumMoney(children, Game::getGameProfit));

        parent.setGameStartDateTime(children.stream().map(Game::getGameStartDateTime).filter(Objects::nonNull)
                .min(Comparator.naturalOrder()).orElse(parent.getGameStartDateTime()));
        LocalDateTime latestEnd = children.stream().map(Game::getGameEndDateTime).filter(Objects::nonNull)
                .max(Comparator.naturalOrder()).orElse(null);
        parent.setGameEndDateTime(latestEnd);
        parent.setGameStatus(aggregateStatus(children));

        List<String> missing = missingFlights(children);
        parent.setMissingFlights(missing.isEmpty() ? null : String.join(",", missing));
        parent.setMissingFlightCount(missing.size());
        parent.setPartialData(!missing.isEmpty() || parent.isReopenedAfterFinish());
        gameRepository.save(parent);
        return new RecomputeResult(children.size(), parent.isPartialData(), missing);
    }

    /**
     * Any flight in play makes the event in play; all finished is finished; all scheduled is scheduled.
     * Cancelled flights are ignored unless every flight was cancelled.
     */
    static GameStatus aggregateStatus(List<Game> children) {
        List<GameStatus> statuses = children.stream().map(Game::getGameStatus).filter(Objects::nonNull).toList();
        if (statuses.isEmpty()) return null;
        List<GameStatus> live = statuses.stream().filter(s -> s != GameStatus.CANCELLED).toList();
        if (live.isEmpty()) return GameStatus.CANCELLED;
        if (live.stream().anyMatch(GameStatus::isInPlay)) return GameStatus.RUNNING;
        if (live.stream().allMatch(s -> s == GameStatus.FINISHED)) return GameStatus.FINISHED;
        if (live.stream().allMatch(s -> s == GameStatus.SCHEDULED)) return GameStatus.SCHEDULED;
        return GameStatus.RUNNING;
    }

    /**
     * Expected flights are days 1..highest day seen; a day that uses letters expects A..highest letter seen
     * on that day. A final day is never expected, only observed.
     */
    static List<String> missingFlights(List<Game> children) {
        Map<Integer, TreeSet<Character>> lettersByDay = new TreeMap<>();
        TreeSet<Integer> days = new TreeSet<>();
        for (Game c : children) {
            if (c.isFinalDay() && c.getDayNumber() == null) continue;
            int day = c.getDayNumber() != null ? c.getDayNumber() : 1;
            days.add(day);
            if (c.getFlightLetter() != null && !c.getFlightLetter().isEmpty()) {
                lettersByDay.computeIfAbsent(day, d -> new TreeSet<>()).add(Character.toUpperCase(c.getFlightLetter().charAt(0)));
            }
        }
        List<String> missing = new ArrayList<>();
        if (days.isEmpty()) return missing;
        for (int d = 1; d <= days.last(); d++) {
            TreeSet<Character> letters = lettersByDay.get(d);
            if (letters != null) {
                for (char l = 'A'; l <= letters.last(); l++) {
                    if (!letters.contains(l)) missing.add(d + String.valueOf(l));
                }
            } else if (!days.contains(d)) {
                missing.add(String.valueOf(d));
            }
        }
        return missing;
    }

    /** Decreases between two observations of the same flight. Reported, never corrected. */
    public static List<String> detectConflicts(TotalsSnapshot before, Game after) {
        List<String> out = new ArrayList<>();
        if (before == null) return out;
        decreased(out, "totalEntries", before.totalEntries(), after.getTotalEntries());
        decreased(out, "totalRebuys", before.totalRebuys(), after.getTotalRebuys());
        decreased(out, "totalAddons", before.totalAddons(), after.getTotalAddons());
        decreased(out, "totalUniquePlayers", before.totalUniquePlayers(), after.getTotalUniquePlayers());
        if (before.prizepoolPaid() != null && after.getPrizepoolPaid() != null
                && after.getPrizepoolPaid().compareTo(before.prizepoolPaid()) < 0) {
            out.add("prizepoolPaid decreased from " + before.prizepoolPaid().toPlainString() + " to " + after.getPrizepoolPaid().toPlainString());
        }
        return out;
    }

    private static void decreased(List<String> out, String field, Integer before, Integer after) {
        if (before != null && after != null && after < before) {
            out.add(field + " decreased from " + before + " to " + after);
        }
    }

    private Game newParent(Game first, ConsolidationKeyDeriver.ConsolidationKey key) {
        Game p = new Game();
        p.setEntityId(first.getEntityId());
        p.setSourceUrl(PARENT_URL_PREFIX + key.key());
        p.setName(parentName(first, key));
        p.setConsolidationKey(key.key());
        p.setConsolidationStrategy(key.strategy());
        p.setConsolidationType(ConsolidationType.PARENT);
        p.setHasIndependentData(false);
        p.setGameType(first.getGameType());
        p.setGameVariant(first.getGameVariant());
        p.setGameStatus(first.getGameStatus());
        p.setGameStartDateTime(first.getGameStartDateTime());
        p.setBuyIn(first.getBuyIn());
        p.setRake(first.getRake());
        p.setGuaranteeAmount(first.getGuaranteeAmount());
        p.setVenueName(first.getVenueName());
        p.setSeriesName(first.getSeriesName());
        p.setSeriesYear(first.getSeriesYear());
        p.setEventNumber(first.getEventNumber());
        Assignment venue = first.getVenueAssignment();
        p.setVenueAssignment(new Assignment(venue.getTargetId(), venue.getStatus(), venue.getConfidence(), venue.getReason()));
        Assignment series = first.getSeriesAssignment();
        p.setSeriesAssignment(new Assignment(series.getTargetId(), series.getStatus(), series.getConfidence(), series.getReason()));
        p.setRecurringAssignment(new Assignment(null, AssignmentStatus.NOT_APPLICABLE, 0.0, "consolidation parent"));
        return p;
    }

    private static String parentName(Game first, ConsolidationKeyDeriver.ConsolidationKey key) {
        if (first.getSeriesName() != null && !first.getSeriesName().isBlank() && first.getEventNumber() != null) {
            return first.getSeriesName().trim() + " Event " + first.getEventNumber();
        }
        return key.baseName() == null || key.baseName().isBlank() ? first.getName() : key.baseName();
    }

    private static Integer sumInt(List<Game> children, Function<Game, Integer> f) {
        Integer total = null;
        for (Game c : children) {
            Integer v = f.apply(c);
            if (v != null) total = (total == null ? 0 : total) + v;
        }
        return total;
    }

    private static BigDecimal sumMoney(List<Game> children, Function<Game, BigDecimal> f) {
        BigDecimal total = null;
        for (Game c : children) {
            BigDecimal v = f.apply(c);
            if (v != null) total = total == null ? v : total.add(v);
        }
        return total;
    }
}
