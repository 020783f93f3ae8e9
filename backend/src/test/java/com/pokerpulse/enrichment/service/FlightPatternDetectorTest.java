package com.pokerpulse.enrichment.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FlightPatternDetectorTest {

    @Test
    void detectsDayAndLetterFromName() {
        FlightPatternDetector.FlightInfo info = FlightPatternDetector.detect("Main Event Day 1B", null, null, null);

        assertThat(info.multiDay()).isTrue();
        assertThat(info.dayNumber()).isEqualTo(1);
        assertThat(info.flightLetter()).isEqualTo("B");
        assertThat(info.flightId()).isEqualTo("1B");
    }

    @Test
    void bareFlightLetterImpliesDayOne() {
        FlightPatternDetector.FlightInfo info = FlightPatternDetector.detect("Sunday Major Flight C", null, null, null);

        assertThat(info.dayNumber()).isNull();
        assertThat(info.flightLetter()).isEqualTo("C");
        assertThat(info.flightId()).isEqualTo("1C");
    }

    @Test
    void numberedFlightsAreMultiDay() {
        FlightPatternDetector.FlightInfo first = FlightPatternDetector.detect("Spring Classic Flight 1", null, null, null);
        FlightPatternDetector.FlightInfo second = FlightPatternDetector.detect("Spring Classic Flight 2", null, null, null);

        assertThat(first.multiDay()).isTrue();
        assertThat(first.dayNumber()).isEqualTo(1);
        assertThat(first.flightLetter()).isNull();
        assertThat(second.flightId()).isEqualTo("2");
        assertThat(FlightPatternDetector.detect("Spring Classic Flight 1A", null, null, null).flightId()).isEqualTo("1A");
        assertThat(FlightPatternDetector.baseName("Spring Classic Flight 2")).isEqualTo("Spring Classic");
    }

    @Test
    void finalTableIsMultiDay() {
        FlightPatternDetector.FlightInfo info = FlightPatternDetector.detect("Winter Classic Final Table", null, null, null);

        assertThat(info.multiDay()).isTrue();
        assertThat(info.finalDay()).isTrue();
        assertThat(info.flightId()).isEqualTo("FINAL");
    }

    @Test
    void explicitFieldsWinOverName() {
        FlightPatternDetector.FlightInfo info = FlightPatternDetector.detect("Main Event Day 1A", 2, "b", false);

        assertThat(info.dayNumber()).isEqualTo(2);
        assertThat(info.flightLetter()).isEqualTo("B");
    }

    @Test
    void moneySuffixIsNotAFlight() {
        assertThat(FlightPatternDetector.detect("$5K Guaranteed Freezeout", null, null, null).multiDay()).isFalse();
        assertThat(FlightPatternDetector.detect("Weekly Freezeout", null, null, null))
                .isEqualTo(FlightPatternDetector.FlightInfo.SINGLE);
    }

    @Test
    void baseNameStripsFlightAndSpeedMarkers() {
        assertThat(FlightPatternDetector.baseName("Friday Night NLHE Day 1")).isEqualTo("Friday Night NLHE");
        assertThat(FlightPatternDetector.baseName("Main Event - Day 1A")).isEqualTo("Main Event");
        assertThat(FlightPatternDetector.baseName("Sunday Turbo Final Table")).isEqualTo("Sunday");
        assertThat(FlightPatternDetector.baseName(null)).isEmpty();
    }
}
