package com.pokerpulse.enrichment.model;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "social_post_game_links", uniqueConstraints = {
        @UniqueConstraint(name = "uk_social_link_post_game", columnNames = {"social_post_id", "game_id"})
}, indexes = {
        @Index(name = "idx_social_link_game", columnList = "game_id")
})
public class SocialPostGameLink {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "entity_id", nullable = false)
    private Long entityId;

    @Column(name = "social_post_id", nullable = false)
    private Long socialPostId;

    @Column(name = "game_id", nullable = false)
    private Long gameId;

    @Column(name = "match_confidence")
    private Double matchConfidence;

    @Column(name = "is_primary_game", nullable = false)
    private boolean primaryGame;

    @Enumerated(EnumType.STRING)
    @Column(name = "link_type", nullable = false, length = 16)
    private LinkType linkType = LinkType.AUTO;

    @Column(name = "match_signals", columnDefinition = "TEXT")
    private String matchSignals;

    @Column(name = "created_at")
    private Instant createdAt;

    @PrePersist
    private void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getEntityId() { return entityId; }
    public void setEntityId(Long entityId) { this.entityId = entityId; }
    public Long getSocialPostId() { return socialPostId; }
    public void setSocialPostId(Long socialPostId) { this.socialPostId = socialPostId; }
    public Long getGameId() { return gameId; }
    public void setGameId(Long gameId) { this.gameId = gameId; }
    public Double getMatchConfidence() { return matchConfidence; }
    public void setMatchConfidence(Double matchConfidence) { this.matchConfidence = matchConfidence; }
    public boolean isPrimaryGame() { return primaryGame; }
    public void setPrimaryGame(boolean primaryGame) { this.primaryGame = primaryGame; }
    public LinkType getLinkType() { return linkType; }
    public void setLinkType(LinkType linkType) { this.linkType = linkType; }
    public String getMatchSignals() { return matchSignals; }
    public void setMatchSignals(String matchSignals) { this.matchSignals = matchSignals; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
