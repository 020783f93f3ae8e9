package com.pokerpulse.enrichment.model;

public enum AssignmentStatus {
    AUTO_ASSIGNED,
    MANUALLY_ASSIGNED,
    PENDING_ASSIGNMENT,
    UNASSIGNED,
    NOT_APPLICABLE;

    public boolean isAssigned() {
        return this == AUTO_ASSIGNED || this == MANUALLY_ASSIGNED;
    }
}
