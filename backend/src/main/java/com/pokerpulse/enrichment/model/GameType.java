package com.pokerpulse.enrichment.model;

public enum GameType { TOURNAMENT, CASH_GAME }
