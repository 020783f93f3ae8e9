package com.pokerpulse.enrichment.model;

public enum RecurringInstanceStatus { CONFIRMED, DEVIATION_FLAGGED }
