package com.pokerpulse.enrichment.web;

import org.springframework.http.HttpStatus;

/** Base type for failures raised out of the enrichment core, carrying the HTTP mapping used by the API layer. */
public abstract class EnrichmentException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    protected EnrichmentException(HttpStatus status, String code, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.code = code;
    }

    public HttpStatus getStatus() { return status; }
    public String getCode() { return code; }
}
