package com.pokerpulse.enrichment.config;

import com.pokerpulse.enrichment.service.ThresholdPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Matching thresholds and caps. Field initializers hold the same defaults as the placeholders so that
 * a plain {@code new ResolutionSettings()} behaves like an unconfigured deployment.
 */
@Component
public class ResolutionSettings {

    @Value("${pokerpulse.venue.auto-threshold:0.85}")
    private double venueAutoThreshold = 0.85;
    @Value("${pokerpulse.venue.suggest-threshold:0.5}")
    private double venueSuggestThreshold = 0.5;
    @Value("${pokerpulse.venue.max-candidates:5}")
    private int venueMaxCandidates = 5;
    @Value("${pokerpulse.venue.max-scan:2000}")
    private int venueMaxScan = 2000;

    @Value("${pokerpulse.matching.ambiguity-band:0.02}")
    private double ambiguityBand = 0.02;

    @Value("${pokerpulse.series.title-threshold:0.9}")
    private double seriesTitleThreshold = 0.9;
    @Value("${pokerpulse.series.auto-threshold:0.85}")
    private double seriesAutoThreshold = 0.85;
    @Value("${pokerpulse.series.suggest-threshold:0.5}")
    private double seriesSuggestThreshold = 0.5;
    @Value("${pokerpulse.series.max-candidates:5}")
    private int seriesMaxCandidates = 5;
    @Value("${pokerpulse.series.auto-create-instance:false}")
    private boolean seriesAutoCreateInstance = false;

    @Value("${pokerpulse.recurring.auto-threshold:0.8}")
    private double recurringAutoThreshold = 0.8;
    @Value("${pokerpulse.recurring.suggest-threshold:0.5}")
    private double recurringSuggestThreshold = 0.5;
    @Value("${pokerpulse.recurring.max-candidates:5}")
    private int recurringMaxCandidates = 5;
    @Value("${pokerpulse.recurring.min-repetitions:3}")
    private int recurringMinRepetitions = 3;
    @Value("${pokerpulse.recurring.pattern-similarity:0.6}")
    private double recurringPatternSimilarity = 0.6;
    @Value("${pokerpulse.recurring.deviation-tolerance:0.25}")
    private double recurringDeviationTolerance = 0.25;
    @Value("${pokerpulse.recurring.lookback-weeks:12}")
    private int recurringLookbackWeeks = 12;

    @Value("${pokerpulse.social.auto-link-threshold:0.8}")
    private double socialAutoLinkThreshold = 0.8;
    @Value("${pokerpulse.social.secondary-floor:0.4}")
    private double socialSecondaryFloor = 0.4;
    @Value("${pokerpulse.social.date-window-days:3}")
    private int socialDateWindowDays = 3;
    @Value("${pokerpulse.social.max-candidates:50}")
    private int socialMaxCandidates = 50;
    @Value("${pokerpulse.social.cash-tolerance:1.00}")
    private double socialCashTolerance = 1.00;
    @Value("${pokerpulse.social.major-cash-absolute:100}")
    private double socialMajorCashAbsolute = 100;
    @Value("${pokerpulse.social.major-cash-percent:0.10}")
    private double socialMajorCashPercent = 0.10;

    @Value("${pokerpulse.consolidation.max-children:64}")
    private int consolidationMaxChildren = 64;

    @Value("${pokerpulse.enrichment.max-attempts:3}")
    private int enrichmentMaxAttempts = 3;
    @Value("${pokerpulse.enrichment.backoff-ms:100}")
    private long enrichmentBackoffMs = 100;

    public ThresholdPolicy venuePolicy() {
        return new ThresholdPolicy(venueAutoThreshold, venueSuggestThreshold, ambiguityBand, venueMaxCandidates);
    }

    public ThresholdPolicy seriesPolicy() {
        return new ThresholdPolicy(seriesAutoThreshold, seriesSuggestThreshold, ambiguityBand, seriesMaxCandidates);
    }

    public ThresholdPolicy recurringPolicy() {
        return new ThresholdPolicy(recurringAutoThreshold, recurringSuggestThreshold, ambiguityBand, recurringMaxCandidates);
    }

    public ThresholdPolicy socialPolicy() {
        return new ThresholdPolicy(socialAutoLinkThreshold, socialSecondaryFloor, ambiguityBand, socialMaxCandidates);
    }

    public double getVenueAutoThreshold() { return venueAutoThreshold; }
    public void setVenueAutoThreshold(double venueAutoThreshold) { this.venueAutoThreshold = venueAutoThreshold; }
    public double getVenueSuggestThreshold() { return venueSuggestThreshold; }
    public void setVenueSuggestThreshold(double venueSuggestThreshold) { this.venueSuggestThreshold = venueSuggestThreshold; }
    public int getVenueMaxCandidates() { return venueMaxCandidates; }
    public int getVenueMaxScan() { return venueMaxScan; }
    public double getAmbiguityBand() { return ambiguityBand; }
    public double getSeriesTitleThreshold() { return seriesTitleThreshold; }
    public void setSeriesTitleThreshold(double seriesTitleThreshold) { this.seriesTitleThreshold = seriesTitleThreshold; }
    public double getSeriesAutoThreshold() { return seriesAutoThreshold; }
    public void setSeriesAutoThreshold(double seriesAutoThreshold) { this.seriesAutoThreshold = seriesAutoThreshold; }
    public double getSeriesSuggestThreshold() { return seriesSuggestThreshold; }
    public boolean isSeriesAutoCreateInstance() { return seriesAutoCreateInstance; }
    public void setSeriesAutoCreateInstance(boolean seriesAutoCreateInstance) { this.seriesAutoCreateInstance = seriesAutoCreateInstance; }
    public double getRecurringAutoThreshold() { return recurringAutoThreshold; }
    public int getRecurringMinRepetitions() { return recurringMinRepetitions; }
    public void setRecurringMinRepetitions(int recurringMinRepetitions) { this.recurringMinRepetitions = recurringMinRepetitions; }
    public double getRecurringPatternSimilarity() { return recurringPatternSimilarity; }
    public double getRecurringDeviationTolerance() { return recurringDeviationTolerance; }
    public int getRecurringLookbackWeeks() { return recurringLookbackWeeks; }
    public int getRecurringMaxCandidates() { return recurringMaxCandidates; }
    public double getSocialAutoLinkThreshold() { return socialAutoLinkThreshold; }
    public double getSocialSecondaryFloor() { return socialSecondaryFloor; }
    public int getSocialDateWindowDays() { return socialDateWindowDays; }
    public int getSocialMaxCandidates() { return socialMaxCandidates; }
    public double getSocialCashTolerance() { return socialCashTolerance; }
    public double getSocialMajorCashAbsolute() { return socialMajorCashAbsolute; }
    public double getSocialMajorCashPercent() { return socialMajorCashPercent; }
    public int getConsolidationMaxChildren() { return consolidationMaxChildren; }
    public void setConsolidationMaxChildren(int consolidationMaxChildren) { this.consolidationMaxChildren = consolidationMaxChildren; }
    public int getEnrichmentMaxAttempts() { return enrichmentMaxAttempts; }
    public long getEnrichmentBackoffMs() { return enrichmentBackoffMs; }
    public void setEnrichmentBackoffMs(long enrichmentBackoffMs) { this.enrichmentBackoffMs = enrichmentBackoffMs; }
}
