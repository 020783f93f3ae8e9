package com.pokerpulse.enrichment.model;

public enum LinkType { AUTO, MANUAL }
