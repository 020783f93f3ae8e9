package com.pokerpulse.enrichment.model;

public enum TaskStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED,
    PARTIAL_SUCCESS;

    public boolean isTerminal() {
        return this != QUEUED && this != RUNNING;
    }
}
