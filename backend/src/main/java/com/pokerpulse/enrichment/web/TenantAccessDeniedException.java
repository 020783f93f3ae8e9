package com.pokerpulse.enrichment.web;

import org.springframework.http.HttpStatus;

public class TenantAccessDeniedException extends EnrichmentException {

    public TenantAccessDeniedException(String resource, Object id, Long entityId) {
        super(HttpStatus.FORBIDDEN, "tenant_access_denied",
                resource + " " + id + " does not belong to entity " + entityId, null);
    }

    /** Rejects when the row's tenant differs from the caller's. */
    public static void check(String resource, Object id, Long rowEntityId, Long callerEntityId) {
        if (rowEntityId == null || !rowEntityId.equals(callerEntityId)) {
            throw new TenantAccessDeniedException(resource, id, callerEntityId);
        }
    }
}
