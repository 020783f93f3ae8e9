package com.pokerpulse.enrichment.model;

import com.pokerpulse.enrichment.util.NameNormalizer;
import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "venue_alias", uniqueConstraints = {
        @UniqueConstraint(name = "uk_venue_alias", columnNames = {"normalized_alias", "venue_id"})
}, indexes = {
        @Index(name = "idx_venue_alias_entity", columnList = "entity_id, normalized_alias")
})
public class VenueAlias {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "entity_id", nullable = false)
    private Long entityId;

    @Column(name = "venue_id", nullable = false)
    private Long venueId;

    @Column(nullable = false)
    private String alias;

    @Column(name = "normalized_alias", nullable = false)
    private String normalizedAlias;

    @Column(length = 64)
    private String source; // MANUAL, IMPORT

    @Column(name = "created_at")
    private Instant createdAt;

    public VenueAlias() {}

    public VenueAlias(Long entityId, Long venueId, String alias, String source) {
        this.entityId = entityId;
        this.venueId = venueId;
        this.alias = alias;
        this.normalizedAlias = NameNormalizer.normalizeForMatch(alias);
        this.source = source;
    }

    @PrePersist
    private void prePersist() {
        this.normalizedAlias = NameNormalizer.normalizeForMatch(alias);
        if (createdAt == null) createdAt = Instant.now();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getEntityId() { return entityId; }
    public void setEntityId(Long entityId) { this.entityId = entityId; }
    public Long getVenueId() { return venueId; }
    public void setVenueId(Long venueId) { this.venueId = venueId; }
    public String getAlias() { return alias; }
    public void setAlias(String alias) { this.alias = alias; }
    public String getNormalizedAlias() { return normalizedAlias; }
    public void setNormalizedAlias(String normalizedAlias) { this.normalizedAlias = normalizedAlias; }
    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
