package com.pokerpulse.enrichment.web;

import org.springframework.http.HttpStatus;

/** Fatal for the record being processed; never retried. */
public class InvariantViolationException extends EnrichmentException {

    public InvariantViolationException(String message) {
        super(HttpStatus.CONFLICT, "invariant_violation", message, null);
    }

    public static InvariantViolationException duplicateGroup(Long entityId, String key, int parents) {
        return new InvariantViolationException(
                "Consolidation key '" + key + "' of entity " + entityId + " is claimed by " + parents + " parents");
    }

    public static InvariantViolationException groupFull(String key, int max) {
        return new InvariantViolationException("Consolidation group '" + key + "' already holds " + max + " children");
    }
}
