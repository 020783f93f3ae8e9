package com.pokerpulse.enrichment.web;

import org.springframework.http.HttpStatus;

/** Persistence stayed unavailable after the bounded retries. Safe to retry later. */
public class TransientPersistenceException extends EnrichmentException {

    public TransientPersistenceException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "persistence_unavailable", message, cause);
    }
}
