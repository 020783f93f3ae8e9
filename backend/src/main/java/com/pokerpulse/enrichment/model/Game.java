package com.pokerpulse.enrichment.model;

import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;

/**
 * Enriched game record. Raw fields are copied from the ingested record; assignment,
 * consolidation and financial fields are written by the enrichment pipeline.
 * Synthetic consolidation parents are stored as games too, with {@code hasIndependentData=false}.
 */
@Entity
@Table(name = "games", uniqueConstraints = {
        @UniqueConstraint(name = "uk_game_entity_source", columnNames = {"entity_id", "source_url"})
}, indexes = {
        @Index(name = "idx_game_entity_start", columnList = "entity_id, game_start"),
        @Index(name = "idx_game_consolidation_key", columnList = "entity_id, consolidation_key"),
        @Index(name = "idx_game_parent", columnList = "parent_game_id"),
        @Index(name = "idx_game_venue", columnList = "venue_id")
})
public class Game {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Version
    private Long version;

    @Column(name = "entity_id", nullable = false)
    private Long entityId;

    @Column(name = "external_id", length = 128)
    private String externalId;

    @Column(name = "source_url", nullable = false, length = 512)
    private String sourceUrl;

    @Column(name = "raw_record_id")
    private Long rawRecordId;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "game_type", length = 16)
    private GameType gameType;

    @Column(name = "game_variant", length = 32)
    private String gameVariant;

    @Enumerated(EnumType.STRING)
    @Column(name = "game_status", length = 24)
    private GameStatus gameStatus;

    @Column(name = "game_start")
    private LocalDateTime gameStartDateTime;

    @Column(name = "game_end")
    private LocalDateTime gameEndDateTime;

    @Column(name = "buy_in", precision = 12, scale = 2)
    private BigDecimal buyIn;

    @Column(precision = 12, scale = 2)
    private BigDecimal rake;

    @Column(name = "guarantee_amount", precision = 12, scale = 2)
    private BigDecimal guaranteeAmount;

    @Column(name = "total_initial_entries")
    private Integer totalInitialEntries;

    @Column(name = "total_entries")
    private Integer totalEntries;

    @Column(name = "total_rebuys")
    private Integer totalRebuys;

    @Column(name = "total_addons")
    private Integer totalAddons;

    @Column(name = "total_unique_players")
    private Integer totalUniquePlayers;

    @Column(name = "prizepool_paid", precision = 14, scale = 2)
    private BigDecimal prizepoolPaid;

    @Column(name = "number_of_tickets_paid")
    private Integer numberOfTicketsPaid;

    @Column(name = "ticket_value", precision = 12, scale = 2)
    private BigDecimal ticketValue;

    // raw venue and series text as received
    @Column(name = "venue_name")
    private String venueName;

    @Column(name = "venue_address", length = 512)
    private String venueAddress;

    @Column(name = "venue_city", length = 128)
    private String venueCity;

    @Column(name = "series_name")
    private String seriesName;

    @Column(name = "series_year")
    private Integer seriesYear;

    @Column(name = "event_number")
    private Integer eventNumber;

    @Column(name = "day_number")
    private Integer dayNumber;

    @Column(name = "flight_letter", length = 4)
    private String flightLetter;

    @Column(name = "final_day", nullable = false)
    private boolean finalDay;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "targetId", column = @Column(name = "venue_id")),
            @AttributeOverride(name = "status", column = @Column(name = "venue_assignment_status", length = 32)),
            @AttributeOverride(name = "confidence", column = @Column(name = "venue_assignment_confidence")),
            @AttributeOverride(name = "reason", column = @Column(name = "venue_assignment_reason"))
    })
    private Assignment venueAssignment = Assignment.unassigned();

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "targetId", column = @Column(name = "series_id")),
            @AttributeOverride(name = "status", column = @Column(name = "series_assignment_status", length = 32)),
            @AttributeOverride(name = "confidence", column = @Column(name = "series_assignment_confidence")),
            @AttributeOverride(name = "reason", column = @Column(name = "series_assignment_reason"))
    })
    private Assignment seriesAssignment = Assignment.unassigned();

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "targetId", column = @Column(name = "recurring_game_id")),
            @AttributeOverride(name = "status", column = @Column(name = "recurring_assignment_status", length = 32)),
            @AttributeOverride(name = "confidence", column = @Column(name = "recurring_assignment_confidence")),
            @AttributeOverride(name = "reason", column = @Column(name = "recurring_assignment_reason"))
    })
    private Assignment recurringAssignment = Assignment.unassigned();

    @Enumerated(EnumType.STRING)
    @Column(name = "recurring_instance_status", length = 24)
    private RecurringInstanceStatus recurringInstanceStatus;

    @Column(name = "recurring_deviation_notes", length = 1000)
    private String recurringDeviationNotes;

    @Column(name = "suggested_venue_name")
    private String suggestedVenueName;

    @Column(name = "suggested_series_name")
    private String suggestedSeriesName;

    // consolidation
    @Column(name = "consolidation_key", length = 255)
    private String consolidationKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "consolidation_strategy", length = 24)
    private ConsolidationStrategy consolidationStrategy;

    @Enumerated(EnumType.STRING)
    @Column(name = "consolidation_type", nullable = false, length = 16)
    private ConsolidationType consolidationType = ConsolidationType.STANDALONE;

    @Column(name = "parent_game_id")
    private Long parentGameId;

    @Column(name = "child_count")
    private Integer childCount;

    @Column(name = "is_partial_data", nullable = false)
    private boolean partialData;

    @Column(name = "missing_flight_count")
    private Integer missingFlightCount;

    @Column(name = "missing_flights", length = 255)
    private String missingFlights;

    @Column(name = "reopened_after_finish", nullable = false)
    private boolean reopenedAfterFinish;

    @Column(name = "has_independent_data", nullable = false)
    private boolean hasIndependentData = true;

    // derived financials
    @Column(name = "rake_revenue", precision = 14, scale = 2)
    private BigDecimal rakeRevenue;

    @Column(name = "total_buy_ins_collected", precision = 14, scale = 2)
    private BigDecimal totalBuyInsCollected;

    @Column(name = "prizepool_player_contributions", precision = 14, scale = 2)
    private BigDecimal prizepoolPlayerContributions;

    @Column(name = "guarantee_overlay_cost", precision = 14, scale = 2)
    private BigDecimal guaranteeOverlayCost;

    @Column(name = "prizepool_surplus", precision = 14, scale = 2)
    private BigDecimal prizepoolSurplus;

    @Column(name = "prizepool_calculated", precision = 14, scale = 2)
    private BigDecimal prizepoolCalculated;

    @Column(name = "game_profit", precision = 14, scale = 2)
    private BigDecimal gameProfit;

    @Lob
    @Column(name = "enrichment_metadata", columnDefinition = "TEXT")
    private String enrichmentMetadata;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    private void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    private void preUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isParent() { return consolidationType == ConsolidationType.PARENT; }
    public boolean isChild() { return consolidationType == ConsolidationType.CHILD; }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }
    public Long getEntityId() { return entityId; }
    public void setEntityId(Long entityId) { this.entityId = entityId; }
    public String getExternalId() { return externalId; }
    public void setExternalId(String externalId) { this.externalId = externalId; }
    public String getSourceUrl() { return sourceUrl; }
    public void setSourceUrl(String sourceUrl) { this.sourceUrl = sourceUrl; }
    public Long getRawRecordId() { return rawRecordId; }
    public void setRawRecordId(Long rawRecordId) { this.rawRecordId = rawRecordId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public GameType getGameType() { return gameType; }
    public void setGameType(GameType gameType) { this.gameType = gameType; }
    public String getGameVariant() { return gameVariant; }
    public void setGameVariant(String gameVariant) { this.gameVariant = gameVariant; }
    public GameStatus getGameStatus() { return gameStatus; }
    public void setGameStatus(GameStatus gameStatus) { this.gameStatus = gameStatus; }
    public LocalDateTime getGameStartDateTime() { return gameStartDateTime; }
    public void setGameStartDateTime(LocalDateTime gameStartDateTime) { this.gameStartDateTime = gameStartDateTime; }
    public LocalDateTime getGameEndDateTime() { return gameEndDateTime; }
    public void setGameEndDateTime(LocalDateTime gameEndDateTime) { this.gameEndDateTime = gameEndDateTime; }
    public BigDecimal getBuyIn() { return buyIn; }
    public void setBuyIn(BigDecimal buyIn) { this.buyIn = buyIn; }
    public BigDecimal getRake() { return rake; }
    public void setRake(BigDecimal rake) { this.rake = rake; }
    public BigDecimal getGuaranteeAmount() { return guaranteeAmount; }
    public void setGuaranteeAmount(BigDecimal guaranteeAmount) { this.guaranteeAmount = guaranteeAmount; }
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
    public String getVenueName() { return venueName; }
    public void setVenueName(String venueName) { this.venueName = venueName; }
    public String getVenueAddress() { return venueAddress; }
    public void setVenueAddress(String venueAddress) { this.venueAddress = venueAddress; }
    public String getVenueCity() { return venueCity; }
    public void setVenueCity(String venueCity) { this.venueCity = venueCity; }
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
    public boolean isFinalDay() { return finalDay; }
    public void setFinalDay(boolean finalDay) { this.finalDay = finalDay; }
    public Assignment getVenueAssignment() {
        if (venueAssignment == null) venueAssignment = Assignment.unassigned(); // all-null embeddable loads as null
        return venueAssignment;
    }
    public void setVenueAssignment(Assignment venueAssignment) { this.venueAssignment = venueAssignment; }
    public Assignment getSeriesAssignment() {
        if (seriesAssignment == null) seriesAssignment = Assignment.unassigned(); // all-null embeddable loads as null
        return seriesAssignment;
    }
    public void setSeriesAssignment(Assignment seriesAssignment) { this.seriesAssignment = seriesAssignment; }
    public Assignment getRecurringAssignment() {
        if (recurringAssignment == null) recurringAssignment = Assignment.unassigned(); // all-null embeddable loads as null
        return recurringAssignment;
    }
    public void setRecurringAssignment(Assignment recurringAssignment) { this.recurringAssignment = recurringAssignment; }
    public RecurringInstanceStatus getRecurringInstanceStatus() { return recurringInstanceStatus; }
    public void setRecurringInstanceStatus(RecurringInstanceStatus recurringInstanceStatus) { this.recurringInstanceStatus = recurringInstanceStatus; }
    public String getRecurringDeviationNotes() { return recurringDeviationNotes; }
    public void setRecurringDeviationNotes(String recurringDeviationNotes) { this.recurringDeviationNotes = recurringDeviationNotes; }
    public String getSuggestedVenueName() { return suggestedVenueName; }
    public void setSuggestedVenueName(String suggestedVenueName) { this.suggestedVenueName = suggestedVenueName; }
    public String getSuggestedSeriesName() { return suggestedSeriesName; }
    public void setSuggestedSeriesName(String suggestedSeriesName) { this.suggestedSeriesName = suggestedSeriesName; }
    public String getConsolidationKey() { return consolidationKey; }
    public void setConsolidationKey(String consolidationKey) { this.consolidationKey = consolidationKey; }
    public ConsolidationStrategy getConsolidationStrategy() { return consolidationStrategy; }
    public void setConsolidationStrategy(ConsolidationStrategy consolidationStrategy) { this.consolidationStrategy = consolidationStrategy; }
    public ConsolidationType getConsolidationType() { return consolidationType; }
    public void setConsolidationType(ConsolidationType consolidationType) { this.consolidationType = consolidationType; }
    public Long getParentGameId() { return parentGameId; }
    public void setParentGameId(Long parentGameId) { this.parentGameId = parentGameId; }
    public Integer getChildCount() { return childCount; }
    public void setChildCount(Integer childCount) { this.childCount = childCount; }
    public boolean isPartialData() { return partialData; }
    public void setPartialData(boolean partialData) { this.partialData = partialData; }
    public Integer getMissingFlightCount() { return missingFlightCount; }
    public void setMissingFlightCount(Integer missingFlightCount) { this.missingFlightCount = missingFlightCount; }
    public String getMissingFlights() { return missingFlights; }
    public void setMissingFlights(String missingFlights) { this.missingFlights = missingFlights; }
    public boolean isReopenedAfterFinish() { return reopenedAfterFinish; }
    public void setReopenedAfterFinish(boolean reopenedAfterFinish) { this.reopenedAfterFinish = reopenedAfterFinish; }
    public boolean isHasIndependentData() { return hasIndependentData; }
    public void setHasIndependentData(boolean hasIndependentData) { this.hasIndependentData = hasIndependentData; }
    public BigDecimal getRakeRevenue() { return rakeRevenue; }
    public void setRakeRevenue(BigDecimal rakeRevenue) { this.rakeRevenue = rakeRevenue; }
    public BigDecimal getTotalBuyInsCollected() { return totalBuyInsCollected; }
    public void setTotalBuyInsCollected(BigDecimal totalBuyInsCollected) { this.totalBuyInsCollected = totalBuyInsCollected; }
    public BigDecimal getPrizepoolPlayerContributions() { return prizepoolPlayerContributions; }
    public void setPrizepoolPlayerContributions(BigDecimal prizepoolPlayerContributions) { this.prizepoolPlayerContributions = prizepoolPlayerContributions; }
    public BigDecimal getGuaranteeOverlayCost() { return guaranteeOverlayCost; }
    public void setGuaranteeOverlayCost(BigDecimal guaranteeOverlayCost) { this.guaranteeOverlayCost = guaranteeOverlayCost; }
    public BigDecimal getPrizepoolSurplus() { return prizepoolSurplus; }
    public void setPrizepoolSurplus(BigDecimal prizepoolSurplus) { this.prizepoolSurplus = prizepoolSurplus; }
    public BigDecimal getPrizepoolCalculated() { return prizepoolCalculated; }
    public void setPrizepoolCalculated(BigDecimal prizepoolCalculated) { this.prizepoolCalculated = prizepoolCalculated; }
    public BigDecimal getGameProfit() { return gameProfit; }
    public void setGameProfit(BigDecimal gameProfit) { this.gameProfit = gameProfit; }
    public String getEnrichmentMetadata() { return enrichmentMetadata; }
    public void setEnrichmentMetadata(String enrichmentMetadata) { this.enrichmentMetadata = enrichmentMetadata; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
