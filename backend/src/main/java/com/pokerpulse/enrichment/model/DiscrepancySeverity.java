package com.pokerpulse.enrichment.model;

public enum DiscrepancySeverity { NONE, MINOR, MAJOR }
