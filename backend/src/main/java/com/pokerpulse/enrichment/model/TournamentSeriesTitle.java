package com.pokerpulse.enrichment.model;

import jakarta.persistence.*;

import java.time.Instant;

/** Year-independent series identity, e.g. "Sydney Championships". */
@Entity
@Table(name = "tournament_series_titles", uniqueConstraints = {
        @UniqueConstraint(name = "uk_series_title_entity_normalized", columnNames = {"entity_id", "normalized_title"})
})
public class TournamentSeriesTitle {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "entity_id", nullable = false)
    private Long entityId;

    @Column(nullable = false)
    private String title;

    @Column(name = "normalized_title", nullable = false)
    private String normalizedTitle;

    @Column(name = "created_at")
    private Instant createdAt;

    public TournamentSeriesTitle() {}

    public TournamentSeriesTitle(Long entityId, String title, String normalizedTitle) {
        this.entityId = entityId;
        this.title = title;
        this.normalizedTitle = normalizedTitle;
    }

    @PrePersist
    private void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getEntityId() { return entityId; }
    public void setEntityId(Long entityId) { this.entityId = entityId; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public String getNormalizedTitle() { return normalizedTitle; }
    public void setNormalizedTitle(String normalizedTitle) { this.normalizedTitle = normalizedTitle; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
