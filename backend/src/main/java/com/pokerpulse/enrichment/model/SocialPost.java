package com.pokerpulse.enrichment.model;

import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "social_posts", uniqueConstraints = {
        @UniqueConstraint(name = "uk_social_post_external", columnNames = {"entity_id", "external_post_id"})
})
public class SocialPost {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "entity_id", nullable = false)
    private Long entityId;

    @Column(name = "external_post_id", nullable = false, length = 128)
    private String externalPostId;

    @Column(name = "posted_at")
    private Instant postedAt;

    @Column(name = "extracted_venue_name")
    private String extractedVenueName;

    @Column(name = "venue_hint_id")
    private Long venueHintId;

    @Column(name = "extracted_date")
    private LocalDate extractedDate;

    @Column(name = "extracted_buy_in", precision = 12, scale = 2)
    private BigDecimal extractedBuyIn;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "social_post_placements", joinColumns = @JoinColumn(name = "social_post_id"))
    @OrderBy("place ASC")
    private List<SocialPlacement> placements = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_status", nullable = false, length = 24)
    private SocialPostStatus processingStatus = SocialPostStatus.PENDING;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    private void touch() {
        updatedAt = Instant.now();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getEntityId() { return entityId; }
    public void setEntityId(Long entityId) { this.entityId = entityId; }
    public String getExternalPostId() { return externalPostId; }
    public void setExternalPostId(String externalPostId) { this.externalPostId = externalPostId; }
    public Instant getPostedAt() { return postedAt; }
    public void setPostedAt(Instant postedAt) { this.postedAt = postedAt; }
    public String getExtractedVenueName() { return extractedVenueName; }
    public void setExtractedVenueName(String extractedVenueName) { this.extractedVenueName = extractedVenueName; }
    public Long getVenueHintId() { return venueHintId; }
    public void setVenueHintId(Long venueHintId) { this.venueHintId = venueHintId; }
    public LocalDate getExtractedDate() { return extractedDate; }
    public void setExtractedDate(LocalDate extractedDate) { this.extractedDate = extractedDate; }
    public BigDecimal getExtractedBuyIn() { return extractedBuyIn; }
    public void setExtractedBuyIn(BigDecimal extractedBuyIn) { this.extractedBuyIn = extractedBuyIn; }
    public List<SocialPlacement> getPlacements() { return placements; }
    public void setPlacements(List<SocialPlacement> placements) { this.placements = placements; }
    public SocialPostStatus getProcessingStatus() { return processingStatus; }
    public void setProcessingStatus(SocialPostStatus processingStatus) { this.processingStatus = processingStatus; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
