package com.pokerpulse.enrichment.service;

import com.pokerpulse.enrichment.model.Venue;
import com.pokerpulse.enrichment.util.NameNormalizer;
import com.pokerpulse.enrichment.util.TextSimilarity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores raw venue text against a tenant's canonical venues and their aliases. Pure: no repository access.
 */
@Component
public class VenueMatcher {

    public enum Signal implements MatchSignal {
        NAME_TOKENS(0.40),
        NAME_EDIT(0.50),
        LOCATION(0.10);

        private final double weight;

        Signal(double weight) { this.weight = weight; }

        @Override
        public double defaultWeight() { return weight; }
    }

    private static final double NAME_WEIGHT_TOTAL = Signal.NAME_TOKENS.weight + Signal.NAME_EDIT.weight;

    public record VenueQuery(String name, String address, String city) {}

    /** A venue together with the normalized forms of its aliases. */
    public record VenueProfile(Venue venue, List<String> normalizedAliases) {}

    public List<ScoredCandidate<Venue>> score(VenueQuery query, List<VenueProfile> venues) {
        String name = NameNormalizer.normalizeForMatch(query.name());
        List<ScoredCandidate<Venue>> scored = new ArrayList<>();
        if (name.isEmpty()) return scored;
        for (VenueProfile profile : venues) {
            scored.add(scoreOne(name, query, profile));
        }
        return ConfidenceScorer.rank(scored);
    }

    public AssignmentOutcome<Venue> match(VenueQuery query, List<VenueProfile> venues, ThresholdPolicy policy) {
        if (query.name() == null || query.name().isBlank()) {
            return AssignmentOutcome.unassigned(0.0, "no venue text", null);
        }
        AssignmentOutcome<Venue> outcome = policy.decide(score(query, venues), "venue");
        return outcome.isAssigned() ? outcome : outcome.withSuggestedName(query.name().trim());
    }

    private ScoredCandidate<Venue> scoreOne(String name, VenueQuery query, VenueProfile profile) {
        Venue venue = profile.venue();
        double bestTokens = 0.0;
        double bestEdit = 0.0;
        double bestName = -1.0;
        List<String> variants = new ArrayList<>();
        variants.add(venue.getNormalizedName() != null ? venue.getNormalizedName() : NameNormalizer.normalizeForMatch(venue.getName()));
        variants.addAll(profile.normalizedAliases());
        for (String variant : variants) {
            double tokens = TextSimilarity.tokenJaccard(name, variant);
            double edit = TextSimilarity.editRatio(name, variant);
            double combined = tokens * Signal.NAME_TOKENS.weight + edit * Signal.NAME_EDIT.weight;
            if (combined > bestName) {
                bestName = combined;
                bestTokens = tokens;
                bestEdit = edit;
            }
        }

        List<SignalMatch> signals = new ArrayList<>();
        Double location = locationScore(query, venue);
        if (location == null) {
            // no comparable location on either side: name signals carry the full weight
            signals.add(new SignalMatch(Signal.NAME_TOKENS, bestTokens, Signal.NAME_TOKENS.weight / NAME_WEIGHT_TOTAL));
            signals.add(new SignalMatch(Signal.NAME_EDIT, bestEdit, Signal.NAME_EDIT.weight / NAME_WEIGHT_TOTAL));
        } else {
            signals.add(SignalMatch.of(Signal.NAME_TOKENS, bestTokens));
            signals.add(SignalMatch.of(Signal.NAME_EDIT, bestEdit));
            signals.add(SignalMatch.of(Signal.LOCATION, location));
        }
        return ScoredCandidate.of(venue, venue.getId(), venue.getName(), venue.getUpdatedAt(), signals);
    }

    private Double locationScore(VenueQuery query, Venue venue) {
        List<Double> parts = new ArrayList<>();
        if (notBlank(query.city()) && notBlank(venue.getCity())) {
            parts.add(NameNormalizer.normalizeForMatch(query.city()).equals(NameNormalizer.normalizeForMatch(venue.getCity())) ? 1.0 : 0.0);
        }
        if (notBlank(query.address()) && notBlank(venue.getAddress())) {
            parts.add(TextSimilarity.tokenJaccard(NameNormalizer.normalizeForMatch(query.address()),
                    NameNormalizer.normalizeForMatch(venue.getAddress())));
        }
        if (parts.isEmpty()) return null;
        return parts.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
