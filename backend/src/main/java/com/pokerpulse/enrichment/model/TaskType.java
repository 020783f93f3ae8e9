package com.pokerpulse.enrichment.model;

public enum TaskType {
    BULK_VENUE_REASSIGNMENT,
    BULK_RECURRING_DETECTION,
    BULK_SOCIAL_RECONCILIATION,
    REPROCESS_RAW_RECORDS,
    RECONSOLIDATE_GROUPS
}
