package com.pokerpulse.enrichment.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.math.BigDecimal;

@Embeddable
public class SocialPlacement {

    @Column(name = "place_number")
    private Integer place;

    @Column(name = "player_name")
    private String playerName;

    @Column(name = "cash_prize", precision = 12, scale = 2)
    private BigDecimal cashPrize;

    // null when the placement did not include a ticket
    @Column(name = "ticket_value", precision = 12, scale = 2)
    private BigDecimal ticketValue;

    public SocialPlacement() {}

    public SocialPlacement(Integer place, String playerName, BigDecimal cashPrize, BigDecimal ticketValue) {
        this.place = place;
        this.playerName = playerName;
        this.cashPrize = cashPrize;
        this.ticketValue = ticketValue;
    }

    public boolean hasTicket() {
        return ticketValue != null && ticketValue.signum() > 0;
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
