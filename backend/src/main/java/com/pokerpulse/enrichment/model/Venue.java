package com.pokerpulse.enrichment.model;

import com.pokerpulse.enrichment.util.NameNormalizer;
import jakarta.persistence.*;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;

@Entity
@DynamicUpdate
@Table(name = "venues", uniqueConstraints = {
        @UniqueConstraint(name = "uk_venue_entity_normalized", columnNames = {"entity_id", "normalized_name"})
}, indexes = {
        @Index(name = "idx_venue_entity", columnList = "entity_id")
})
public class Venue {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // rollup counters are adjusted by single-row updates in VenueRepository, never through the entity
    @Version
    private Long version;

    @Column(name = "entity_id", nullable = false)
    private Long entityId;

    @Column(nullable = false)
    private String name;

    @Column(name = "normalized_name", nullable = false)
    private String normalizedName;

    @Column(length = 512)
    private String address;

    @Column(length = 128)
    private String city;

    @Column(name = "game_count", nullable = false)
    private Integer gameCount = 0;

    @Column(name = "last_game_seen_at")
    private Instant lastGameSeenAt;

    @Column(name = "last_data_refreshed_at")
    private Instant lastDataRefreshedAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Venue() {}

    public Venue(Long entityId, String name) {
        this.entityId = entityId;
        this.name = name;
        this.normalizedName = NameNormalizer.normalizeForMatch(name);
    }

    @PrePersist
    @PreUpdate
    private void prePersistUpdate() {
        if (this.name != null) {
            this.name = this.name.trim();
        }
        this.normalizedName = NameNormalizer.normalizeForMatch(this.name);
        this.updatedAt = Instant.now();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }
    public Long getEntityId() { return entityId; }
    public void setEntityId(Long entityId) { this.entityId = entityId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getNormalizedName() { return normalizedName; }
    public void setNormalizedName(String normalizedName) { this.normalizedName = normalizedName; }
    public String getAddress() { return address; }
    public void setAddress(String address) { this.address = address; }
    public String getCity() { return city; }
    public void setCity(String city) { this.city = city; }
    public Integer getGameCount() { return gameCount; }
    public void setGameCount(Integer gameCount) { this.gameCount = gameCount; }
    public Instant getLastGameSeenAt() { return lastGameSeenAt; }
    public void setLastGameSeenAt(Instant lastGameSeenAt) { this.lastGameSeenAt = lastGameSeenAt; }
    public Instant getLastDataRefreshedAt() { return lastDataRefreshedAt; }
    public void setLastDataRefreshedAt(Instant lastDataRefreshedAt) { this.lastDataRefreshedAt = lastDataRefreshedAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
