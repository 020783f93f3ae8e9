package com.pokerpulse.enrichment.dto;

public class SeriesConfirmationRequest {
    private String title;
    private Integer year;
    private Long venueId;
    private Long gameId; // optional: assign this game to the confirmed series

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public Integer getYear() { return year; }
    public void setYear(Integer year) { this.year = year; }
    public Long getVenueId() { return venueId; }
    public void setVenueId(Long venueId) { this.venueId = venueId; }
    public Long getGameId() { return gameId; }
    public void setGameId(Long gameId) { this.gameId = gameId; }
}
