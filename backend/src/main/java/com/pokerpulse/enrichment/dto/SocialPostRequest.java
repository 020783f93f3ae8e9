package com.pokerpulse.enrichment.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public class SocialPostRequest {
    private Long entityId;
    private String externalPostId;
    private Instant postedAt;
    private String venueName;
    private Long venueHintId;
    private LocalDate date;
    private BigDecimal buyIn;
    private List<Placement> placements = new ArrayList<>();

    public static class Placement {
        private Integer place;
        private String playerName;
        private BigDecimal cashPrize;
        private BigDecimal ticketValue;

        public Placement() {}

        public Placement(Integer place, String playerName, BigDecimal cashPrize, BigDecimal ticketValue) {
            this.place = place;
            this.playerName = playerName;
            this.cashPrize = cashPrize;
            this.ticketValue = ticketValue;
        }

        public Integer getPlace() { return place; }
        public void setPlace(Integer place) { this.place = place; }
        public String getPlayerName() { return playerName; }
        public void setPlayerName(String playerName) { this.playerName = playerName; }
        public BigDecimal getCashPrize() { return cashPrize; }
        public void setCashPrize(BigDecimal cashPrize) { this.cashPrize = cashPrize; }
        public BigDecimal getTicketValue() { return ticketValue; }
        public void setTicketValue(BigDecimal ticketValue) { this.ticketValue = ticketValue; }
    }

    public Long getEntityId() { return entityId; }
    public void setEntityId(Long entityId) { this.entityId = entityId; }
    public String getExternalPostId() { return externalPostId; }
    public void setExternalPostId(String externalPostId) { this.externalPostId = externalPostId; }
    public Instant getPostedAt() { return postedAt; }
    public void setPostedAt(Instant postedAt) { this.postedAt = postedAt; }
    public String getVenueName() { return venueName; }
    public void setVenueName(String venueName) { this.venueName = venueName; }
    public Long getVenueHintId() { return venueHintId; }
    public void setVenueHintId(Long venueHintId) { this.venueHintId = venueHintId; }
    public LocalDate getDate() { return date; }
    public void setDate(LocalDate date) { this.date = date; }
    public BigDecimal getBuyIn() { return buyIn; }
    public void setBuyIn(BigDecimal buyIn) { this.buyIn = buyIn; }
    public List<Placement> getPlacements() { return placements; }
    public void setPlacements(List<Placement> placements) { this.placements = placements; }
}
