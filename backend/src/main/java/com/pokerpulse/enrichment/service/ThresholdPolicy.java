package com.pokerpulse.enrichment.service;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Turns a ranked candidate list into an outcome. Shared by every resolver so the
 * auto / suggest / no-match structure is implemented once.
 */
public record ThresholdPolicy(double autoThreshold, double suggestThreshold, double ambiguityBand, int maxCandidates) {

    public ThresholdPolicy {
        if (suggestThreshold > autoThreshold) {
            throw new IllegalArgumentException("suggest threshold " + suggestThreshold + " exceeds auto threshold " + autoThreshold);
        }
        if (maxCandidates < 1) throw new IllegalArgumentException("maxCandidates must be >= 1");
    }

    /**
     * @param ranked candidates already ordered by {@link ConfidenceScorer#RANKING}
     * @param dimension short label used in reasons, e.g. "venue"
     */
    public <T> AssignmentOutcome<T> decide(List<ScoredCandidate<T>> ranked, String dimension) {
        if (ranked == null || ranked.isEmpty()) {
            return AssignmentOutcome.unassigned(0.0, "no " + dimension + " candidates", null);
        }
        ScoredCandidate<T> top = ranked.get(0);
        List<AssignmentOutcome.Candidate> retained = retained(ranked);
        if (top.confidence() >= autoThreshold) {
            if (ranked.size() > 1) {
                ScoredCandidate<T> second = ranked.get(1);
                if (second.confidence() >= autoThreshold && top.confidence() - second.confidence() <= ambiguityBand) {
                    return AssignmentOutcome.pending(top.confidence(),
                            "ambiguous " + dimension + " match: " + fmt(top.confidence()) + " vs " + fmt(second.confidence()),
                            retained);
                }
            }
            return AssignmentOutcome.autoAssigned(top.id(), top.target(), top.confidence(), autoThreshold,
                    dimension + " matched '" + top.label() + "' at " + fmt(top.confidence()), retained, false);
        }
        if (top.confidence() >= suggestThreshold) {
            return AssignmentOutcome.pending(top.confidence(),
                    "best " + dimension + " candidate '" + top.label() + "' at " + fmt(top.confidence()) + " needs review",
                    retained);
        }
        return AssignmentOutcome.unassigned(top.confidence(),
                "best " + dimension + " candidate below " + fmt(suggestThreshold), null);
    }

    public <T> List<AssignmentOutcome.Candidate> retained(List<ScoredCandidate<T>> ranked) {
        return ranked.stream()
                .filter(c -> c.confidence() >= suggestThreshold)
                .limit(maxCandidates)
                .map(c -> new AssignmentOutcome.Candidate(c.id(), c.label(), c.confidence()))
                .collect(Collectors.toList());
    }

    static String fmt(double v) {
        return String.format(Locale.ROOT, "%.4f", v);
    }
}
