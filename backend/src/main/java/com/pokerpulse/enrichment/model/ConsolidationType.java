package com.pokerpulse.enrichment.model;

public enum ConsolidationType { STANDALONE, PARENT, CHILD }
