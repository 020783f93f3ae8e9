package com.pokerpulse.enrichment.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;

/**
 * Assignment of a game to one resolution dimension (venue, series or recurring template).
 * The owning entity maps the columns with attribute overrides.
 */
@Embeddable
public class Assignment {

    @Column(name = "target_id")
    private Long targetId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 32)
    private AssignmentStatus status = AssignmentStatus.UNASSIGNED;

    @Column(name = "confidence")
    private Double confidence;

    @Column(name = "reason", length = 255)
    private String reason;

    public Assignment() {}

    public Assignment(Long targetId, AssignmentStatus status, Double confidence, String reason) {
        this.targetId = targetId;
        this.status = status;
        this.confidence = confidence;
        this.reason = reason;
    }

    public static Assignment unassigned() {
        return new Assignment(null, AssignmentStatus.UNASSIGNED, null, null);
    }

    public boolean isManual() {
        return status == AssignmentStatus.MANUALLY_ASSIGNED;
    }

    public Long getTargetId() { return targetId; }
    public void setTargetId(Long targetId) { this.targetId = targetId; }
    public AssignmentStatus getStatus() { return status == null ? AssignmentStatus.UNASSIGNED : status; }
    public void setStatus(AssignmentStatus status) { this.status = status; }
    public Double getConfidence() { return confidence; }
    public void setConfidence(Double confidence) { this.confidence = confidence; }
    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }
}
