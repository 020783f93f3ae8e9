package com.pokerpulse.enrichment.service;

import com.pokerpulse.enrichment.model.ConsolidationStrategy;
import com.pokerpulse.enrichment.util.NameNormalizer;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.temporal.IsoFields;

/**
 * Derives the key that groups the flights of one multi-day event. A pure function of its input:
 * the same name, venue and start always give the same key and strategy.
 */
@Component
public class ConsolidationKeyDeriver {

    private static final int MAX_SLUG = 150;

    public record KeyInput(String name,
                           Long seriesId,
                           Integer eventNumber,
                           Integer dayNumber,
                           String flightLetter,
                           Boolean finalDay,
                           Long venueId,
                           String venueName,
                           LocalDateTime start,
                           String sourceUrl) {}

    public record ConsolidationKey(String key, ConsolidationStrategy strategy,
                                   FlightPatternDetector.FlightInfo flight, String baseName) {

        public boolean isGrouped() {
            return strategy != ConsolidationStrategy.NONE;
        }
    }

    public ConsolidationKey derive(KeyInput in) {
        FlightPatternDetector.FlightInfo flight = FlightPatternDetector.detect(in.name(), in.dayNumber(), in.flightLetter(), in.finalDay());
        String baseName = FlightPatternDetector.baseName(in.name());
        if (flight.multiDay()) {
            if (in.seriesId() != null && in.eventNumber() != null) {
                return new ConsolidationKey("series:" + in.seriesId() + "|event:" + in.eventNumber(),
                        ConsolidationStrategy.SERIES_EVENT, flight, baseName);
            }
            String venuePart = venuePart(in);
            String slug = truncate(NameNormalizer.slug(baseName));
            if (!slug.isEmpty() && venuePart != null && in.start() != null) {
                return new ConsolidationKey(slug + "|" + venuePart + "|" + isoWeek(in.start()),
                        ConsolidationStrategy.NAME_PATTERN, flight, baseName);
            }
        }
        return new ConsolidationKey("record:" + in.sourceUrl(), ConsolidationStrategy.NONE, flight, baseName);
    }

    static String isoWeek(LocalDateTime start) {
        return start.get(IsoFields.WEEK_BASED_YEAR) + "-W" + String.format("%02d", start.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
    }

    private static String venuePart(KeyInput in) {
        if (in.venueId() != null) return String.valueOf(in.venueId());
        String slug = NameNormalizer.slug(in.venueName());
        return slug.isEmpty() ? null : "v:" + truncate(slug);
    }

    private static String truncate(String slug) {
        return slug.length() > MAX_SLUG ? slug.substring(0, MAX_SLUG) : slug;
    }
}
