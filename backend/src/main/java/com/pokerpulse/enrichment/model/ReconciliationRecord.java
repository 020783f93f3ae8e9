package com.pokerpulse.enrichment.model;

import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;

/** Claimed-versus-recorded comparison for one (social post, game) pair. Differences are social minus game. */
@Entity
@Table(name = "reconciliation_records", uniqueConstraints = {
        @UniqueConstraint(name = "uk_reconciliation_post_game", columnNames = {"social_post_id", "game_id"})
}, indexes = {
        @Index(name = "idx_reconciliation_game", columnList = "game_id")
})
public class ReconciliationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "entity_id", nullable = false)
    private Long entityId;

    @Column(name = "social_post_id", nullable = false)
    private Long socialPostId;

    @Column(name = "game_id", nullable = false)
    private Long gameId;

    @Column(name = "social_total_cash_paid", precision = 14, scale = 2)
    private BigDecimal socialTotalCashPaid;

    @Column(name = "social_ticket_count")
    private Integer socialTicketCount;

    @Column(name = "social_ticket_value", precision = 12, scale = 2)
    private BigDecimal socialTicketValue;

    @Column(name = "game_prizepool_paid", precision = 14, scale = 2)
    private BigDecimal gamePrizepoolPaid;

    @Column(name = "game_ticket_count")
    private Integer gameTicketCount;

    @Column(name = "game_ticket_value", precision = 12, scale = 2)
    private BigDecimal gameTicketValue;

    @Column(name = "cash_difference", precision = 14, scale = 2)
    private BigDecimal cashDifference;

    @Column(name = "ticket_count_difference")
    private Integer ticketCountDifference;

    @Column(name = "ticket_value_difference", precision = 12, scale = 2)
    private BigDecimal ticketValueDifference;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private DiscrepancySeverity severity = DiscrepancySeverity.NONE;

    @Column(length = 1000)
    private String notes;

    @Column(name = "suggested_action", length = 32)
    private String suggestedAction;

    @Column(name = "computed_at")
    private Instant computedAt;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getEntityId() { return entityId; }
    public void setEntityId(Long entityId) { this.entityId = entityId; }
    public Long getSocialPostId() { return socialPostId; }
    public void setSocialPostId(Long socialPostId) { this.socialPostId = socialPostId; }
    public Long getGameId() { return gameId; }
    public void setGameId(Long gameId) { this.gameId = gameId; }
    public BigDecimal getSocialTotalCashPaid() { return socialTotalCashPaid; }
    public void setSocialTotalCashPaid(BigDecimal socialTotalCashPaid) { this.socialTotalCashPaid = socialTotalCashPaid; }
    public Integer getSocialTicketCount() { return socialTicketCount; }
    public void setSocialTicketCount(Integer socialTicketCount) { this.socialTicketCount = socialTicketCount; }
    public BigDecimal getSocialTicketValue() { return socialTicketValue; }
    public void setSocialTicketValue(BigDecimal socialTicketValue) { this.socialTicketValue = socialTicketValue; }
    public BigDecimal getGamePrizepoolPaid() { return gamePrizepoolPaid; }
    public void setGamePrizepoolPaid(BigDecimal gamePrizepoolPaid) { this.gamePrizepoolPaid = gamePrizepoolPaid; }
    public Integer getGameTicketCount() { return gameTicketCount; }
    public void setGameTicketCount(Integer gameTicketCount) { this.gameTicketCount = gameTicketCount; }
    public BigDecimal getGameTicketValue() { return gameTicketValue; }
    public void setGameTicketValue(BigDecimal gameTicketValue) { this.gameTicketValue = gameTicketValue; }
    public BigDecimal getCashDifference() { return cashDifference; }
    public void setCashDifference(BigDecimal cashDifference) { this.cashDifference = cashDifference; }
    public Integer getTicketCountDifference() { return ticketCountDifference; }
    public void setTicketCountDifference(Integer ticketCountDifference) { this.ticketCountDifference = ticketCountDifference; }
    public BigDecimal getTicketValueDifference() { return ticketValueDifference; }
    public void setTicketValueDifference(BigDecimal ticketValueDifference) { this.ticketValueDifference = ticketValueDifference; }
    public DiscrepancySeverity getSeverity() { return severity; }
    public void setSeverity(DiscrepancySeverity severity) { this.severity = severity; }
    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }
    public String getSuggestedAction() { return suggestedAction; }
    public void setSuggestedAction(String suggestedAction) { this.suggestedAction = suggestedAction; }
    public Instant getComputedAt() { return computedAt; }
    public void setComputedAt(Instant computedAt) { this.computedAt = computedAt; }
}
