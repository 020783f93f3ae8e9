package com.pokerpulse.enrichment.model;

import jakarta.persistence.*;
import org.hibernate.annotations.DynamicUpdate;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;

@Entity
@DynamicUpdate
@Table(name = "recurring_games", uniqueConstraints = {
        @UniqueConstraint(name = "uk_recurring_slot_name", columnNames = {"entity_id", "venue_id", "day_of_week", "normalized_name"})
}, indexes = {
        @Index(name = "idx_recurring_slot", columnList = "entity_id, venue_id, day_of_week")
})
public class RecurringGame {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Version
    private Long version;

    @Column(name = "entity_id", nullable = false)
    private Long entityId;

    @Column(name = "venue_id", nullable = false)
    private Long venueId;

    @Column(nullable = false)
    private String name;

    @Column(name = "normalized_name", nullable = false)
    private String normalizedName;

    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week", nullable = false, length = 16)
    private DayOfWeek dayOfWeek;

    @Column(name = "start_time")
    private LocalTime startTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "game_type", length = 16)
    private GameType gameType;

    @Column(name = "game_variant", length = 32)
    private String gameVariant;

    @Column(name = "typical_buy_in", precision = 12, scale = 2)
    private BigDecimal typicalBuyIn;

    @Column(name = "typical_guarantee", precision = 12, scale = 2)
    private BigDecimal typicalGuarantee;

    @Column(name = "game_count", nullable = false)
    private Integer gameCount = 0;

    @Column(name = "last_game_seen_at")
    private Instant lastGameSeenAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    private void touch() {
        this.updatedAt = Instant.now();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }
    public Long getEntityId() { return entityId; }
    public void setEntityId(Long entityId) { this.entityId = entityId; }
    public Long getVenueId() { return venueId; }
    public void setVenueId(Long venueId) { this.venueId = venueId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getNormalizedName() { return normalizedName; }
    public void setNormalizedName(String normalizedName) { this.normalizedName = normalizedName; }
    public DayOfWeek getDayOfWeek() { return dayOfWeek; }
    public void setDayOfWeek(DayOfWeek dayOfWeek) { this.dayOfWeek = dayOfWeek; }
    public LocalTime getStartTime() { return startTime; }
    public void setStartTime(LocalTime startTime) { this.startTime = startTime; }
    public GameType getGameType() { return gameType; }
    public void setGameType(GameType gameType) { this.gameType = gameType; }
    public String getGameVariant() { return gameVariant; }
    public void setGameVariant(String gameVariant) { this.gameVariant = gameVariant; }
    public BigDecimal getTypicalBuyIn() { return typicalBuyIn; }
    public void setTypicalBuyIn(BigDecimal typicalBuyIn) { this.typicalBuyIn = typicalBuyIn; }
    public BigDecimal getTypicalGuarantee() { return typicalGuarantee; }
    public void setTypicalGuarantee(BigDecimal typicalGuarantee) { this.typicalGuarantee = typicalGuarantee; }
    public Integer getGameCount() { return gameCount; }
    public void setGameCount(Integer gameCount) { this.gameCount = gameCount; }
    public Instant getLastGameSeenAt() { return lastGameSeenAt; }
    public void setLastGameSeenAt(Instant lastGameSeenAt) { this.lastGameSeenAt = lastGameSeenAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
