package com.pokerpulse.enrichment.model;

public enum ConsolidationStrategy { SERIES_EVENT, NAME_PATTERN, NONE }
