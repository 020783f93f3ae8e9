package com.pokerpulse.enrichment.service;

/**
 * Sub-score of one signal for one candidate, with the weight it contributes under.
 */
public record SignalMatch(MatchSignal signal, double subScore, double weight) {

    public SignalMatch {
        if (signal == null) throw new IllegalArgumentException("signal is required");
        if (Double.isNaN(subScore)) subScore = 0.0;
        subScore = Math.max(0.0, Math.min(1.0, subScore));
        if (weight < 0) throw new IllegalArgumentException("weight must be >= 0 for " + signal.name());
    }

    public static SignalMatch of(MatchSignal signal, double subScore) {
        return new SignalMatch(signal, subScore, signal.defaultWeight());
    }

    public double contribution() {
        return subScore * weight;
    }
}
