package com.pokerpulse.enrichment.service;

import java.time.Instant;
import java.util.List;

public record ScoredCandidate<T>(T target, Long id, String label, Instant updatedAt,
                                 double confidence, List<SignalMatch> signals) {

    public static <T> ScoredCandidate<T> of(T target, Long id, String label, Instant updatedAt, List<SignalMatch> signals) {
        return new ScoredCandidate<>(target, id, label, updatedAt, ConfidenceScorer.score(signals), List.copyOf(signals));
    }

    /** Same candidate with its confidence capped, e.g. for matches that must never auto-assign. */
    public ScoredCandidate<T> cappedAt(double max) {
        return confidence <= max ? this : new ScoredCandidate<>(target, id, label, updatedAt, max, signals);
    }
}
