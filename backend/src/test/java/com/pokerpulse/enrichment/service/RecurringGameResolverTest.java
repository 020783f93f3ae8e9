package com.pokerpulse.enrichment.service;

import com.pokerpulse.enrichment.config.ResolutionSettings;
import com.pokerpulse.enrichment.model.AssignmentStatus;
import com.pokerpulse.enrichment.model.Game;
import com.pokerpulse.enrichment.model.GameType;
import com.pokerpulse.enrichment.model.RecurringGame;
import com.pokerpulse.enrichment.model.RecurringInstanceStatus;
import com.pokerpulse.enrichment.repository.GameRepository;
import com.pokerpulse.enrichment.repository.RecurringGameRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RecurringGameResolverTest {

    private static final Long ENTITY = 1L;
    private static final Long VENUE = 5L;
    private static final LocalDateTime FRIDAY_7PM = LocalDateTime.of(2024, 3, 1, 19, 0);

    @Mock private RecurringGameRepository recurringRepository;
    @Mock private GameRepository gameRepository;
    @Mock private IdempotentCreator creator;

    private RecurringGameResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new RecurringGameResolver(recurringRepository, gameRepository, creator, new ResolutionSettings());
    }

    private static RecurringGameResolver.RecurringQuery query(String name, boolean seriesLike) {
        return new RecurringGameResolver.RecurringQuery(ENTITY, 100L, VENUE, name, GameType.TOURNAMENT, "NLHE",
                new BigDecimal("50"), null, FRIDAY_7PM, seriesLike);
    }

    private static RecurringGame template(long id) {
        RecurringGame t = new RecurringGame();
        t.setId(id);
        t.setEntityId(ENTITY);
        t.setVenueId(VENUE);
        t.setName("Friday Night NLHE");
        t.setDayOfWeek(DayOfWeek.FRIDAY);
        t.setStartTime(LocalTime.of(19, 0));
        t.setGameType(GameType.TOURNAMENT);
        t.setGameVariant("NLHE");
        t.setTypicalBuyIn(new BigDecimal("50"));
        t.setGameCount(0);
        return t;
    }

    private static List<Game> priorFridays(int weeks) {
        List<Game> out = new ArrayList<>();
        for (int i = 1; i <= weeks; i++) {
            Game g = new Game();
            g.setId(10L + i);
            g.setEntityId(ENTITY);
            g.setName("Friday Night NLHE");
            g.setGameType(GameType.TOURNAMENT);
            g.setGameVariant("NLHE");
            g.setBuyIn(new BigDecimal("50"));
            g.setGameStartDateTime(FRIDAY_7PM.minusWeeks(i));
            out.add(g);
        }
        return out;
    }

    @Test
    void seriesLikeRecordIsNotApplicable() {
        AssignmentOutcome<RecurringGame> outcome = resolver.resolveAndCreate(query("Spring Championship Event 4", true));

        assertThat(outcome.status()).isEqualTo(AssignmentStatus.NOT_APPLICABLE);
        verify(recurringRepository, never()).findByEntityIdAndVenueIdAndDayOfWeekOrderByIdAsc(any(), any(), any());
    }

    @Test
    void matchesExistingTemplateInSameSlot() {
        when(recurringRepository.findByEntityIdAndVenueIdAndDayOfWeekOrderByIdAsc(ENTITY, VENUE, DayOfWeek.FRIDAY))
                .thenReturn(List.of(template(7L)));

        AssignmentOutcome<RecurringGame> outcome = resolver.resolveAndCreate(query("Friday Night NLHE", false));

        assertThat(outcome.status()).isEqualTo(AssignmentStatus.AUTO_ASSIGNED);
        assertThat(outcome.targetId()).isEqualTo(7L);
        assertThat(outcome.confidence()).isEqualTo(1.0);
        assertThat(outcome.wasCreated()).isFalse();
    }

    @Test
    void tooFewPriorOccurrencesStaysUnassigned() {
        when(recurringRepository.findByEntityIdAndVenueIdAndDayOfWeekOrderByIdAsc(ENTITY, VENUE, DayOfWeek.FRIDAY)).thenReturn(List.of());
        when(gameRepository.findVenueGamesBetween(eq(ENTITY), eq(VENUE), any(), eq(FRIDAY_7PM), any())).thenReturn(priorFridays(2));

        AssignmentOutcome<RecurringGame> outcome = resolver.resolveAndCreate(query("Friday Night NLHE", false));

        assertThat(outcome.status()).isEqualTo(AssignmentStatus.UNASSIGNED);
        verify(creator, never()).findOrCreate(anyString(), any(), any());
    }

    @Test
    void previewReportsTheTemplateItWouldCreate() {
        when(recurringRepository.findByEntityIdAndVenueIdAndDayOfWeekOrderByIdAsc(ENTITY, VENUE, DayOfWeek.FRIDAY)).thenReturn(List.of());
        when(gameRepository.findVenueGamesBetween(eq(ENTITY), eq(VENUE), any(), eq(FRIDAY_7PM), any())).thenReturn(priorFridays(3));

        AssignmentOutcome<RecurringGame> outcome = resolver.preview(query("Friday Night NLHE Day 1", false));

        assertThat(outcome.status()).isEqualTo(AssignmentStatus.UNASSIGNED);
        assertThat(outcome.reason()).isEqualTo("would create recurring game 'Friday Night NLHE' from 3 prior occurrences");
        assertThat(outcome.suggestedName()).isEqualTo("Friday Night NLHE");
        verify(creator, never()).findOrCreate(anyString(), any(), any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void createsTemplateAfterRepetitionsAndLinksPriorGames() {
        List<Game> prior = priorFridays(3);
        when(recurringRepository.findByEntityIdAndVenueIdAndDayOfWeekOrderByIdAsc(ENTITY, VENUE, DayOfWeek.FRIDAY)).thenReturn(List.of());
        when(gameRepository.findVenueGamesBetween(eq(ENTITY), eq(VENUE), any(), eq(FRIDAY_7PM), any())).thenReturn(prior);
        RecurringGame[] saved = new RecurringGame[1];
        when(recurringRepository.saveAndFlush(any(RecurringGame.class))).thenAnswer(inv -> {
            RecurringGame t = inv.getArgument(0);
            t.setId(77L);
            saved[0] = t;
            return t;
        });
        when(creator.findOrCreate(eq("recurring:1:5:FRIDAY:friday night nlhe"), any(), any())).thenAnswer(inv -> {
            Supplier<RecurringGame> create = inv.getArgument(2);
            return new IdempotentCreator.Created<>(create.get(), true);
        });

        AssignmentOutcome<RecurringGame> outcome = resolver.resolveAndCreate(query("Friday Night NLHE", false));

        assertThat(outcome.status()).isEqualTo(AssignmentStatus.AUTO_ASSIGNED);
        assertThat(outcome.targetId()).isEqualTo(77L);
        assertThat(outcome.wasCreated()).isTrue();
        assertThat(saved[0].getStartTime()).isEqualTo(LocalTime.of(19, 0));
        assertThat(prior).allSatisfy(g -> {
            assertThat(g.getRecurringAssignment().getStatus()).isEqualTo(AssignmentStatus.AUTO_ASSIGNED);
            assertThat(g.getRecurringAssignment().getTargetId()).isEqualTo(77L);
            assertThat(g.getRecurringInstanceStatus()).isEqualTo(RecurringInstanceStatus.CONFIRMED);
        });
        verify(recurringRepository, times(3)).incrementGameCount(77L);
        verify(gameRepository, times(3)).save(any(Game.class));
    }

    @Test
    void applyingTheSameTemplateTwiceCountsOnce() {
        RecurringGame t = template(7L);
        Game game = priorFridays(1).get(0);
        AssignmentOutcome<RecurringGame> outcome = AssignmentOutcome.autoAssigned(7L, t, 0.95, 0.8, "matched", List.of(), false);

        assertThat(resolver.applyToGame(game, outcome, Instant.now())).isTrue();
        assertThat(resolver.applyToGame(game, outcome, Instant.now())).isFalse();

        verify(recurringRepository, times(1)).incrementGameCount(7L);
        verify(recurringRepository).advanceLastGameSeen(eq(7L), any(Instant.class));
        verify(recurringRepository, never()).decrementGameCount(any());
    }

    @Test
    void manualLinkIsNotOverwrittenByAutomaticResolution() {
        RecurringGame t = template(7L);
        Game game = priorFridays(1).get(0);
        resolver.applyToGame(game, AssignmentOutcome.manual(7L, t, "operator"), Instant.now());

        boolean changed = resolver.applyToGame(game, AssignmentOutcome.unassigned(0.0, "no candidates", null), Instant.now());

        assertThat(changed).isFalse();
        assertThat(game.getRecurringAssignment().getStatus()).isEqualTo(AssignmentStatus.MANUALLY_ASSIGNED);
    }

    @Test
    void deviationBeyondToleranceIsFlagged() {
        RecurringGame t = template(7L);

        assertThat(resolver.deviationNotes(t, new BigDecimal("55"), null)).isNull();
        assertThat(resolver.deviationNotes(t, new BigDecimal("70"), null))
                .isEqualTo("buy-in 70.00 deviates 40% from typical 50.00");
    }

    @Test
    void similarityHelpers() {
        assertThat(RecurringGameResolver.nameSimilarity("Friday Night NLHE", "friday night nlhe")).isEqualTo(1.0);
        assertThat(RecurringGameResolver.nameSimilarity("Friday Night NLHE", "Friday Night NLHE Bounty")).isEqualTo(0.9);
        assertThat(RecurringGameResolver.nameSimilarity("", "Friday")).isZero();

        assertThat(RecurringGameResolver.buyInSimilarity(new BigDecimal("50"), new BigDecimal("60"))).isEqualTo(1.0);
        assertThat(RecurringGameResolver.buyInSimilarity(new BigDecimal("50"), new BigDecimal("150"))).isEqualTo(0.5);
        assertThat(RecurringGameResolver.buyInSimilarity(new BigDecimal("10"), new BigDecimal("200"))).isZero();
        assertThat(RecurringGameResolver.buyInSimilarity(null, new BigDecimal("200"))).isEqualTo(0.5);

        assertThat(RecurringGameResolver.startTimeSimilarity(LocalTime.of(19, 0), LocalTime.of(19, 20))).isEqualTo(1.0);
        assertThat(RecurringGameResolver.startTimeSimilarity(LocalTime.of(19, 0), LocalTime.of(19, 45))).isEqualTo(0.5);
        assertThat(RecurringGameResolver.startTimeSimilarity(LocalTime.of(19, 0), LocalTime.of(21, 0))).isZero();

        assertThat(RecurringGameResolver.variantSimilarity(null, "NLHE")).isEqualTo(0.5);
        assertThat(RecurringGameResolver.BuyInTier.of(BigDecimal.ZERO)).isEqualTo(RecurringGameResolver.BuyInTier.FREEROLL);
    }
}
