package com.pokerpulse.enrichment.service;

/**
 * A named piece of matching evidence. Each resolver declares its signals as an enum implementing this
 * interface, so a resolver's signal set is closed and every signal carries its default weight.
 */
public interface MatchSignal {

    String name();

    double defaultWeight();
}
