package com.pokerpulse.enrichment.model;

import jakarta.persistence.*;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;
import java.time.LocalDate;

/** A dated instance of a series title, e.g. "Sydney Championships 2024". */
@Entity
@DynamicUpdate
@Table(name = "tournament_series", uniqueConstraints = {
        @UniqueConstraint(name = "uk_series_title_year", columnNames = {"entity_id", "series_title_id", "series_year"})
}, indexes = {
        @Index(name = "idx_series_entity_year", columnList = "entity_id, series_year")
})
public class TournamentSeries {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Version
    private Long version;

    @Column(name = "entity_id", nullable = false)
    private Long entityId;

    @Column(name = "series_title_id", nullable = false)
    private Long seriesTitleId;

    @Column(nullable = false)
    private String name;

    @Column(name = "series_year", nullable = false)
    private Integer seriesYear;

    @Column(name = "venue_id")
    private Long venueId;

    @Column(name = "start_date")
    private LocalDate startDate;

    @Column(name = "end_date")
    private LocalDate endDate;

    @Column(name = "game_count", nullable = false)
    private Integer gameCount = 0;

    @Column(name = "last_game_seen_at")
    private Instant lastGameSeenAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public TournamentSeries() {}

    public TournamentSeries(Long entityId, Long seriesTitleId, String name, Integer seriesYear) {
        this.entityId = entityId;
        this.seriesTitleId = seriesTitleId;
        this.name = name;
        this.seriesYear = seriesYear;
    }

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
    public Long getSeriesTitleId() { return seriesTitleId; }
    public void setSeriesTitleId(Long seriesTitleId) { this.seriesTitleId = seriesTitleId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public Integer getSeriesYear() { return seriesYear; }
    public void setSeriesYear(Integer seriesYear) { this.seriesYear = seriesYear; }
    public Long getVenueId() { return venueId; }
    public void setVenueId(Long venueId) { this.venueId = venueId; }
    public LocalDate getStartDate() { return startDate; }
    public void setStartDate(LocalDate startDate) { this.startDate = startDate; }
    public LocalDate getEndDate() { return endDate; }
    public void setEndDate(LocalDate endDate) { this.endDate = endDate; }
    public Integer getGameCount() { return gameCount; }
    public void setGameCount(Integer gameCount) { this.gameCount = gameCount; }
    public Instant getLastGameSeenAt() { return lastGameSeenAt; }
    public void setLastGameSeenAt(Instant lastGameSeenAt) { this.lastGameSeenAt = lastGameSeenAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
