package com.pokerpulse.enrichment.service;

import com.pokerpulse.enrichment.config.ResolutionSettings;
import com.pokerpulse.enrichment.model.AssignmentStatus;
import com.pokerpulse.enrichment.model.TournamentSeries;
import com.pokerpulse.enrichment.model.TournamentSeriesTitle;
import com.pokerpulse.enrichment.repository.TournamentSeriesRepository;
import com.pokerpulse.enrichment.repository.TournamentSeriesTitleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SeriesResolverTest {

    private static final Long ENTITY = 1L;

    @Mock private TournamentSeriesTitleRepository titleRepository;
    @Mock private TournamentSeriesRepository seriesRepository;
    @Mock private IdempotentCreator creator;

    private ResolutionSettings settings;
    private SeriesResolver resolver;
    private TournamentSeriesTitle sydney;

    @BeforeEach
    void setUp() {
        settings = new ResolutionSettings();
        resolver = new SeriesResolver(titleRepository, seriesRepository, creator, settings);
        sydney = new TournamentSeriesTitle(ENTITY, "Sydney Championships", "sydney championships");
        sydney.setId(3L);
    }

    private static SeriesResolver.SeriesQuery query(String name, Long venueId) {
        return new SeriesResolver.SeriesQuery(ENTITY, name, null, null, null, null, venueId, LocalDate.of(2024, 4, 5));
    }

    private static TournamentSeries instance(long id, int year, Long venueId) {
        TournamentSeries s = new TournamentSeries(ENTITY, 3L, "Sydney Championships " + year, year);
        s.setId(id);
        s.setVenueId(venueId);
        return s;
    }

    @Test
    void seriesLikeDetection() {
        assertThat(SeriesResolver.isSeriesLike(query("Weekly $50 Freezeout", null))).isFalse();
        assertThat(SeriesResolver.isSeriesLike(query("Sydney Championships Event #4", null))).isTrue();
        assertThat(SeriesResolver.isSeriesLike(new SeriesResolver.SeriesQuery(ENTITY, "Big Sunday", null, null, null,
                new BigDecimal("50000"), null, null))).isTrue();
        assertThat(SeriesResolver.isSeriesLike(new SeriesResolver.SeriesQuery(ENTITY, "Weekly Mega", null, null, null,
                new BigDecimal("50000"), null, null))).isFalse();
    }

    @Test
    void displayTitleStripsEventMarkers() {
        SeriesResolver.SeriesQuery q = query("Sydney Championships 2024 Event #12 Day 1A - $100K GTD", null);

        assertThat(SeriesResolver.displayTitle(q)).isEqualTo("Sydney Championships");
        assertThat(SeriesResolver.resolveYear(q)).isEqualTo(2024);
        assertThat(SeriesResolver.resolveYear(query("Sydney Championships Main Event", null))).isEqualTo(2024);
    }

    @Test
    void knownTitleWithSameYearInstanceAutoAssigns() {
        when(titleRepository.findByEntityIdOrderByIdAsc(ENTITY)).thenReturn(List.of(sydney));
        when(seriesRepository.findByEntityIdAndSeriesTitleIdInOrderByIdAsc(ENTITY, List.of(3L)))
                .thenReturn(List.of(instance(20, 2023, 5L), instance(21, 2024, 5L)));

        AssignmentOutcome<TournamentSeries> outcome = resolver.resolveAndCreate(query("Sydney Championships 2024 Event #3", 5L));

        assertThat(outcome.status()).isEqualTo(AssignmentStatus.AUTO_ASSIGNED);
        assertThat(outcome.targetId()).isEqualTo(21L);
        assertThat(outcome.candidates()).extracting(AssignmentOutcome.Candidate::id).containsExactly(21L, 20L);
    }

    @Test
    void knownTitleWithoutThisYearNeedsConfirmation() {
        when(titleRepository.findByEntityIdOrderByIdAsc(ENTITY)).thenReturn(List.of(sydney));
        when(seriesRepository.findByEntityIdAndSeriesTitleIdInOrderByIdAsc(ENTITY, List.of(3L)))
                .thenReturn(List.of(instance(20, 2023, 5L)));

        AssignmentOutcome<TournamentSeries> outcome = resolver.resolveAndCreate(query("Sydney Championships 2024 Event #3", 5L));

        assertThat(outcome.status()).isEqualTo(AssignmentStatus.UNASSIGNED);
        assertThat(outcome.reason()).isEqualTo("no 2024 instance of series 'Sydney Championships'");
        assertThat(outcome.suggestedName()).isEqualTo("Sydney Championships 2024");
        verify(creator, never()).findOrCreate(anyString(), any(), any());
    }

    @Test
    void similarTitleIsOnlySuggested() {
        when(titleRepository.findByEntityIdOrderByIdAsc(ENTITY)).thenReturn(List.of(sydney));
        when(seriesRepository.findByEntityIdAndSeriesTitleIdInOrderByIdAsc(ENTITY, List.of(3L)))
                .thenReturn(List.of(instance(21, 2024, 5L)));

        AssignmentOutcome<TournamentSeries> outcome = resolver.preview(query("Sydney Championship 2024 Event 3", 5L));

        assertThat(outcome.status()).isEqualTo(AssignmentStatus.PENDING_ASSIGNMENT);
        assertThat(outcome.confidence()).isLessThan(0.85);
        assertThat(outcome.candidates()).extracting(AssignmentOutcome.Candidate::id).containsExactly(21L);
    }

    @Test
    void acceptedButInexactTitleNeverAutoAssigns() {
        settings.setSeriesTitleThreshold(0.6);
        settings.setSeriesAutoThreshold(0.75);
        settings.setSeriesAutoCreateInstance(true);
        when(titleRepository.findByEntityIdOrderByIdAsc(ENTITY)).thenReturn(List.of(sydney));
        when(seriesRepository.findByEntityIdAndSeriesTitleIdInOrderByIdAsc(ENTITY, List.of(3L)))
                .thenReturn(List.of(instance(21, 2024, 5L)));

        AssignmentOutcome<TournamentSeries> outcome = resolver.resolveAndCreate(query("Sydney Championship 2024 Event 3", 5L));

        assertThat(outcome.status()).isEqualTo(AssignmentStatus.PENDING_ASSIGNMENT);
        assertThat(outcome.confidence()).isLessThan(0.75);
        assertThat(outcome.candidates()).extracting(AssignmentOutcome.Candidate::id).containsExactly(21L);
    }

    @Test
    void inexactTitleDoesNotCreateAnInstance() {
        settings.setSeriesTitleThreshold(0.6);
        settings.setSeriesAutoCreateInstance(true);
        when(titleRepository.findByEntityIdOrderByIdAsc(ENTITY)).thenReturn(List.of(sydney));
        when(seriesRepository.findByEntityIdAndSeriesTitleIdInOrderByIdAsc(ENTITY, List.of(3L))).thenReturn(List.of());

        AssignmentOutcome<TournamentSeries> outcome = resolver.resolveAndCreate(query("Sydney Championship 2024 Event 3", 5L));

        assertThat(outcome.status()).isEqualTo(AssignmentStatus.UNASSIGNED);
        verify(creator, never()).findOrCreate(anyString(), any(), any());
    }

    @Test
    void unknownTitleIsCreatedButInstanceIsNot() {
        when(titleRepository.findByEntityIdOrderByIdAsc(ENTITY)).thenReturn(List.of());
        TournamentSeriesTitle created = new TournamentSeriesTitle(ENTITY, "Melbourne Festival", "melbourne festival");
        when(creator.<TournamentSeriesTitle>findOrCreate(eq("series-title:1:melbourne festival"), any(), any()))
                .thenReturn(new IdempotentCreator.Created<>(created, true));

        AssignmentOutcome<TournamentSeries> outcome = resolver.resolveAndCreate(query("Melbourne Festival 2024 Event #1", null));

        assertThat(outcome.status()).isEqualTo(AssignmentStatus.UNASSIGNED);
        assertThat(outcome.suggestedName()).isEqualTo("Melbourne Festival 2024");
        verify(seriesRepository, never()).saveAndFlush(any());
    }

    @Test
    void previewNeverCreatesTitles() {
        when(titleRepository.findByEntityIdOrderByIdAsc(ENTITY)).thenReturn(List.of());

        AssignmentOutcome<TournamentSeries> outcome = resolver.preview(query("Melbourne Festival 2024 Event #1", null));

        assertThat(outcome.status()).isEqualTo(AssignmentStatus.UNASSIGNED);
        verify(creator, never()).findOrCreate(anyString(), any(), any());
    }

    @Test
    void nonSeriesRecordIsNotApplicable() {
        assertThat(resolver.resolveAndCreate(query("Tuesday Night Freezeout", null)).status())
                .isEqualTo(AssignmentStatus.NOT_APPLICABLE);
    }
}
