package com.pokerpulse.enrichment.dto;

import com.pokerpulse.enrichment.model.GameStatus;
import com.pokerpulse.enrichment.model.GameType;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * One scraped game observation as delivered by the ingestion feed. Also the stored payload of a
 * {@link com.pokerpulse.enrichment.model.RawGameRecord}.
 */
public class RawGameRecordRequest {
    private Long entityId;
    private String externalId;
    private String sourceUrl;

    private String name;
    private GameType gameType;
    private String gameVariant;
    private GameStatus gameStatus;
    private OffsetDateTime startAt;
    private OffsetDateTime endAt;

    private BigDecimal buyIn;
    private BigDecimal rake;
    private BigDecimal guaranteeAmount;

    private String venueName;
    private String venueAddress;
    private String venueCity;
    private Long venueId; // explicit assignment from the source, validated against the tenant

    private String seriesName;
    private Integer seriesYear;
    private Integer eventNumber;
    private Integer dayNumber;
    private String flightLetter;
    private Boolean finalDay;

    private Integer totalInitialEntries;
    private Integer totalEntries;
    private Integer totalRebuys;
    private Integer totalAddons;
    private Integer totalUniquePlayers;
    private BigDecimal prizepoolPaid;
    private Integer numberOfTicketsPaid;
    private BigDecimal ticketValue;

    public RawGameRecordRequest() {}

    public RawGameRecordRequest(Long entityId, String sourceUrl, String name, String venueName, OffsetDateTime startAt) {
        this.entityId = entityId;
        this.sourceUrl = sourceUrl;
        this.name = name;
        this.venueName = venueName;
        this.startAt = startAt;
    }

    public Long getEntityId() { return entityId; }
    public void setEntityId(Long entityId) { this.entityId = entityId; }
    public String getExternalId() { return externalId; }
    public void setExternalId(String externalId) { this.externalId = externalId; }
    public String getSourceUrl() { return sourceUrl; }
    public void setSourceUrl(String sourceUrl) { this.sourceUrl = sourceUrl; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public GameType getGameType() { return gameType; }
    public void setGameType(GameType gameType) { this.gameType = gameType; }
    public String getGameVariant() { return gameVariant; }
    public void setGameVariant(String gameVariant) { this.gameVariant = gameVariant; }
    public GameStatus getGameStatus() { return gameStatus; }
    public void setGameStatus(GameStatus gameStatus) { this.gameStatus = gameStatus; }
    public OffsetDateTime getStartAt() { return startAt; }
    public void setStartAt(OffsetDateTime startAt) { this.startAt = startAt; }
    public OffsetDateTime getEndAt() { return endAt; }
    public void setEndAt(OffsetDateTime endAt) { this.endAt = endAt; }
    public BigDecimal getBuyIn() { return buyIn; }
    public void setBuyIn(BigDecimal buyIn) { this.buyIn = buyIn; }
    public BigDecimal getRake() { return rake; }
    public void setRake(BigDecimal rake) { this.rake = rake; }
    public BigDecimal getGuaranteeAmount() { return guaranteeAmount; }
    public void setGuaranteeAmount(BigDecimal guaranteeAmount) { this.guaranteeAmount = guaranteeAmount; }
    public String getVenueName() { return venueName; }
    public void setVenueName(String venueName) { this.venueName = venueName; }
    public String getVenueAddress() { return venueAddress; }
    public void setVenueAddress(String venueAddress) { this.venueAddress = venueAddress; }
    public String getVenueCity() { return venueCity; }
    public void setVenueCity(String venueCity) { this.venueCity = venueCity; }
    public Long getVenueId() { return venueId; }
    public void setVenueId(Long venueId) { this.venueId = venueId; }
    public String getSeriesName() { return seriesName; }
    public void setSeriesName(String seriesName) { this.seriesName = seriesName; }
    public Integer getSeriesYear() { return seriesYear; }
    public void setSeriesYear(Integer seriesYear) { this.seriesYear = seriesYear; }
    public Integer getEventNumber() { return eventNumber; }
    public void setEventNumber(Integer eventNumber) { this.eventNumber = eventNumber; }
    public Integer getDayNumber() { return dayNumber; }
    public void setDayNumber(Integer dayNumber) { this.dayNumber = dayNumber; }
    public String getFlightLetter() { return flightLetter; }
    public void setFlightLetter(String flightLetter) { this.flightLetter = flightLetter; }
    public Boolean getFinalDay() { return finalDay; }
    public void setFinalDay(Boolean finalDay) { this.finalDay = finalDay; }
    public Integer getTotalInitialEntries() { return totalInitialEntries; }
    public void setTotalInitialEntries(Integer totalInitialEntries) { this.totalInitialEntries = totalInitialEntries; }
    public Integer getTotalEntries() { return totalEntries; }
    public void setTotalEntries(Integer totalEntries) { this.totalEntries = totalEntries; }
    public Integer getTotalRebuys() { return totalRebuys; }
    public void setTotalRebuys(Integer totalRebuys) { this.totalRebuys = totalRebuys; }
    public Integer getTotalAddons() { return totalAddons; }
    public void setTotalAddons(Integer totalAddons) { this.totalAddons = totalAddons; }
    public Integer getTotalUniquePlayers() { return totalUniquePlayers; }
    public void setTotalUniquePlayers(Integer totalUniquePlayers) { this.totalUniquePlayers = totalUniquePlayers; }
    public BigDecimal getPrizepoolPaid() { return prizepoolPaid; }
    public void setPrizepoolPaid(BigDecimal prizepoolPaid) { this.prizepoolPaid = prizepoolPaid; }
    public Integer getNumberOfTicketsPaid() { return numberOfTicketsPaid; }
    public void setNumberOfTicketsPaid(Integer numberOfTicketsPaid) { this.numberOfTicketsPaid = numberOfTicketsPaid; }
    public BigDecimal getTicketValue() { return ticketValue; }
    public void setTicketValue(BigDecimal ticketValue) { this.ticketValue = ticketValue; }
}
