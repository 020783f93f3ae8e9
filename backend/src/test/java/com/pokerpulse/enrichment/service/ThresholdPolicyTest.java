package com.pokerpulse.enrichment.service;

import com.pokerpulse.enrichment.model.AssignmentStatus;
import com.pokerpulse.enrichment.web.InvariantViolationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThresholdPolicyTest {

    private final ThresholdPolicy policy = new ThresholdPolicy(0.85, 0.5, 0.02, 2);

    private static ScoredCandidate<String> candidate(long id, double confidence) {
        return new ScoredCandidate<>("t" + id, id, "target " + id, null, confidence, List.of());
    }

    @Test
    void autoAssignsClearWinner() {
        AssignmentOutcome<String> outcome = policy.decide(List.of(candidate(1, 0.92), candidate(2, 0.6)), "venue");

        assertThat(outcome.status()).isEqualTo(AssignmentStatus.AUTO_ASSIGNED);
        assertThat(outcome.targetId()).isEqualTo(1L);
        assertThat(outcome.reason()).contains("venue matched 'target 1'");
        assertThat(outcome.candidates()).extracting(AssignmentOutcome.Candidate::id).containsExactly(1L, 2L);
    }

    @Test
    void twoNearEqualAutoCandidatesArePending() {
        AssignmentOutcome<String> outcome = policy.decide(List.of(candidate(1, 0.90), candidate(2, 0.89)), "venue");

        assertThat(outcome.status()).isEqualTo(AssignmentStatus.PENDING_ASSIGNMENT);
        assertThat(outcome.targetId()).isNull();
        assertThat(outcome.reason()).startsWith("ambiguous venue match");
    }

    @Test
    void suggestBandIsPendingAndBelowIsUnassigned() {
        AssignmentOutcome<String> pending = policy.decide(List.of(candidate(1, 0.7), candidate(2, 0.65), candidate(3, 0.55)), "series");
        assertThat(pending.status()).isEqualTo(AssignmentStatus.PENDING_ASSIGNMENT);
        assertThat(pending.candidates()).hasSize(2);

        AssignmentOutcome<String> none = policy.decide(List.of(candidate(1, 0.3)), "series");
        assertThat(none.status()).isEqualTo(AssignmentStatus.UNASSIGNED);
        assertThat(none.confidence()).isEqualTo(0.3);
        assertThat(none.candidates()).isEmpty();
    }

    @Test
    void emptyCandidateListIsUnassigned() {
        AssignmentOutcome<String> outcome = policy.decide(List.of(), "recurring game");
        assertThat(outcome.status()).isEqualTo(AssignmentStatus.UNASSIGNED);
        assertThat(outcome.reason()).isEqualTo("no recurring game candidates");
    }

    @Test
    void rejectsInvertedThresholds() {
        assertThatThrownBy(() -> new ThresholdPolicy(0.5, 0.8, 0.02, 5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void outcomeInvariantsAreEnforcedOnConstruction() {
        assertThatThrownBy(() -> AssignmentOutcome.autoAssigned(1L, "x", 0.7, 0.85, "low", List.of(), false))
                .isInstanceOf(InvariantViolationException.class);
        assertThatThrownBy(() -> AssignmentOutcome.pending(0.6, "no candidates", List.of()))
                .isInstanceOf(InvariantViolationException.class);
        assertThatThrownBy(() -> new AssignmentOutcome<>(AssignmentStatus.UNASSIGNED, 5L, "x", 0.1, "r", List.of(), false, null))
                .isInstanceOf(InvariantViolationException.class);
        assertThatThrownBy(() -> AssignmentOutcome.unassigned(1.5, "r", null))
                .isInstanceOf(InvariantViolationException.class);
    }
}
