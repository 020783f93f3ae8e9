package com.pokerpulse.enrichment.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted-sum scorer shared by all resolvers. Stateless; identical inputs always give identical output.
 */
public final class ConfidenceScorer {

    /** Highest confidence first, then most recently updated target, then lowest id. */
    public static final Comparator<ScoredCandidate<?>> RANKING = Comparator
            .comparingDouble((ScoredCandidate<?> c) -> c.confidence()).reversed()
            .thenComparing((ScoredCandidate<?> c) -> c.updatedAt(), Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing((ScoredCandidate<?> c) -> c.id(), Comparator.nullsLast(Comparator.<Long>naturalOrder()));

    private ConfidenceScorer() {}

    public static double score(Collection<SignalMatch> signals) {
        if (signals == null || signals.isEmpty()) return 0.0;
        double sum = 0.0;
        for (SignalMatch s : signals) {
            sum += s.contribution();
        }
        return round(Math.max(0.0, Math.min(1.0, sum)));
    }

    public static double score(Map<? extends MatchSignal, SignalMatch> signals) {
        return signals == null ? 0.0 : score(signals.values());
    }

    public static <T> List<ScoredCandidate<T>> rank(Collection<ScoredCandidate<T>> candidates) {
        List<ScoredCandidate<T>> sorted = new ArrayList<>(candidates);
        sorted.sort(RANKING);
        return sorted;
    }

    /** Signal name to sub-score, in declaration order. Used for metadata and link payloads. */
    public static Map<String, Double> describe(Collection<SignalMatch> signals) {
        Map<String, Double> out = new LinkedHashMap<>();
        for (SignalMatch s : signals) {
            out.put(s.signal().name(), round(s.subScore()));
        }
        return out;
    }

    static double round(double v) {
        return Math.round(v * 10_000d) / 10_000d;
    }
}
