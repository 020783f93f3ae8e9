package com.pokerpulse.enrichment.service;

import com.pokerpulse.enrichment.model.Assignment;
import com.pokerpulse.enrichment.model.AssignmentStatus;
import com.pokerpulse.enrichment.web.InvariantViolationException;

import java.util.List;

/**
 * Result of resolving one dimension (venue, series, recurring template) for one record.
 * Construction enforces the status invariants, so an outcome that exists is a valid one.
 *
 * @param <T> canonical entity type of the dimension
 */
public record AssignmentOutcome<T>(AssignmentStatus status,
                                   Long targetId,
                                   T target,
                                   double confidence,
                                   String reason,
                                   List<Candidate> candidates,
                                   boolean wasCreated,
                                   String suggestedName) {

    public record Candidate(Long id, String label, double confidence) {}

    public AssignmentOutcome {
        if (status == null) throw new InvariantViolationException("assignment status is required");
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new InvariantViolationException("confidence out of range: " + confidence);
        }
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        switch (status) {
            case AUTO_ASSIGNED, MANUALLY_ASSIGNED -> {
                if (targetId == null) throw new InvariantViolationException(status + " requires a target id");
            }
            case PENDING_ASSIGNMENT -> {
                if (candidates.isEmpty()) throw new InvariantViolationException("PENDING_ASSIGNMENT requires candidates");
                if (targetId != null) throw new InvariantViolationException("PENDING_ASSIGNMENT must not carry a target");
            }
            case UNASSIGNED, NOT_APPLICABLE -> {
                if (targetId != null) throw new InvariantViolationException(status + " must not carry a target");
            }
        }
    }

    public static <T> AssignmentOutcome<T> autoAssigned(Long targetId, T target, double confidence, double autoThreshold,
                                                        String reason, List<Candidate> candidates, boolean wasCreated) {
        if (confidence < autoThreshold) {
            throw new InvariantViolationException("AUTO_ASSIGNED at " + confidence + " is below threshold " + autoThreshold);
        }
        return new AssignmentOutcome<>(AssignmentStatus.AUTO_ASSIGNED, targetId, target, confidence, reason, candidates, wasCreated, null);
    }

    public static <T> AssignmentOutcome<T> manual(Long targetId, T target, String reason) {
        return new AssignmentOutcome<>(AssignmentStatus.MANUALLY_ASSIGNED, targetId, target, 1.0, reason, List.of(), false, null);
    }

    public static <T> AssignmentOutcome<T> pending(double confidence, String reason, List<Candidate> candidates) {
        return new AssignmentOutcome<>(AssignmentStatus.PENDING_ASSIGNMENT, null, null, confidence, reason, candidates, false, null);
    }

    public static <T> AssignmentOutcome<T> unassigned(double confidence, String reason, String suggestedName) {
        return new AssignmentOutcome<>(AssignmentStatus.UNASSIGNED, null, null, confidence, reason, List.of(), false, suggestedName);
    }

    public static <T> AssignmentOutcome<T> notApplicable(String reason) {
        return new AssignmentOutcome<>(AssignmentStatus.NOT_APPLICABLE, null, null, 0.0, reason, List.of(), false, null);
    }

    public AssignmentOutcome<T> withSuggestedName(String name) {
        return new AssignmentOutcome<>(status, targetId, target, confidence, reason, candidates, wasCreated, name);
    }

    public boolean isAssigned() {
        return status.isAssigned();
    }

    public Assignment toAssignment() {
        return new Assignment(targetId, status, confidence, reason);
    }
}
