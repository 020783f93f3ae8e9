package com.pokerpulse.enrichment.model;

public enum GameStatus {
    SCHEDULED,
    REGISTERING,
    RUNNING,
    CLOCK_STOPPED,
    FINISHED,
    CANCELLED;

    public boolean isInPlay() {
        return this == REGISTERING || this == RUNNING || this == CLOCK_STOPPED;
    }
}
