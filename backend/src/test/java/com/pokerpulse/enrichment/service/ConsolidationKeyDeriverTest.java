package com.pokerpulse.enrichment.service;

import com.pokerpulse.enrichment.model.ConsolidationStrategy;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class ConsolidationKeyDeriverTest {

    private final ConsolidationKeyDeriver deriver = new ConsolidationKeyDeriver();

    private static ConsolidationKeyDeriver.KeyInput input(String name, Long seriesId, Integer eventNumber, Long venueId,
                                                          String venueName, LocalDateTime start) {
        return new ConsolidationKeyDeriver.KeyInput(name, seriesId, eventNumber, null, null, null, venueId, venueName,
                start, "https://example.test/" + name.hashCode());
    }

    @Test
    void flightsOfOneWeeklyEventShareANamePatternKey() {
        ConsolidationKeyDeriver.ConsolidationKey day1 = deriver.derive(input("Friday Night NLHE Day 1", null, null, 42L,
                "Joe's Card Room", LocalDateTime.of(2024, 3, 1, 19, 0)));
        ConsolidationKeyDeriver.ConsolidationKey day2 = deriver.derive(input("Friday Night NLHE Day 2", null, null, 42L,
                "Joe's Card Room", LocalDateTime.of(2024, 3, 2, 14, 0)));

        assertThat(day1.key()).isEqualTo("friday-night-nlhe|42|2024-W09");
        assertThat(day2.key()).isEqualTo(day1.key());
        assertThat(day1.strategy()).isEqualTo(ConsolidationStrategy.NAME_PATTERN);
        assertThat(day2.flight().dayNumber()).isEqualTo(2);
    }

    @Test
    void seriesEventTakesPrecedence() {
        ConsolidationKeyDeriver.ConsolidationKey key = deriver.derive(input("Spring Championship Event 12 Day 1A", 7L, 12, 42L,
                null, LocalDateTime.of(2024, 4, 5, 12, 0)));

        assertThat(key.key()).isEqualTo("series:7|event:12");
        assertThat(key.strategy()).isEqualTo(ConsolidationStrategy.SERIES_EVENT);
    }

    @Test
    void unresolvedVenueFallsBackToVenueTextSlug() {
        ConsolidationKeyDeriver.ConsolidationKey key = deriver.derive(input("Thursday Bounty Day 1", null, null, null,
                "Joe's Card Room", LocalDateTime.of(2024, 3, 1, 19, 0)));

        assertThat(key.key()).isEqualTo("thursday-bounty|v:joes-card-room|2024-W09");
    }

    @Test
    void singleDayGameIsNotGrouped() {
        ConsolidationKeyDeriver.ConsolidationKey key = deriver.derive(new ConsolidationKeyDeriver.KeyInput("Monday Freezeout",
                null, null, null, null, null, 42L, null, LocalDateTime.of(2024, 3, 4, 19, 0), "https://example.test/g/1"));

        assertThat(key.isGrouped()).isFalse();
        assertThat(key.strategy()).isEqualTo(ConsolidationStrategy.NONE);
        assertThat(key.key()).isEqualTo("record:https://example.test/g/1");
    }

    @Test
    void derivationIsDeterministic() {
        ConsolidationKeyDeriver.KeyInput in = input("Main Event Day 1B", null, null, 3L, null, LocalDateTime.of(2024, 12, 30, 18, 0));
        assertThat(deriver.derive(in)).isEqualTo(deriver.derive(in));
        assertThat(deriver.derive(in).key()).endsWith("|2025-W01");
    }
}
