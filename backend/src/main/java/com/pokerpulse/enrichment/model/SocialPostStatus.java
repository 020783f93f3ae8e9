package com.pokerpulse.enrichment.model;

public enum SocialPostStatus { PENDING, LINKED, MANUAL_REVIEW, UNMATCHED }
