package com.pokerpulse.enrichment.controller;

import com.pokerpulse.enrichment.model.ConsolidationStrategy;
import com.pokerpulse.enrichment.service.ConsolidationService;
import com.pokerpulse.enrichment.service.EnrichmentOrchestrator;
import com.pokerpulse.enrichment.service.ResolutionPreviewService;
import com.pokerpulse.enrichment.web.InvariantViolationException;
import com.pokerpulse.enrichment.web.TenantAccessDeniedException;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = ConsolidationController.class)
class ConsolidationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean private ResolutionPreviewService previewService;
    @MockBean private EnrichmentOrchestrator orchestrator;

    @Test
    void previewShowsTheGroupAFlightWouldJoin() throws Exception {
        when(previewService.consolidation(eq(1L), any())).thenReturn(new ResolutionPreviewService.ConsolidationPreview(
                "friday-night-nlhe|5|2024-W09", ConsolidationStrategy.NAME_PATTERN, true, 2, null, false,
                30L, false, List.of(31L), List.of(), false));

        mockMvc.perform(post("/api/consolidation/preview")
                        .header("X-Entity-Id", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Friday Night NLHE Day 2\",\"venueName\":\"Joe's Card Room\","
                                + "\"startAt\":\"2024-03-02T14:00:00Z\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.key").value("friday-night-nlhe|5|2024-W09"))
                .andExpect(jsonPath("$.existingParentId").value(30))
                .andExpect(jsonPath("$.wouldCreateParent").value(false))
                .andExpect(jsonPath("$.siblingIds[0]").value(31));
    }

    @Test
    void recalculationReturnsTheRebuiltAggregate() throws Exception {
        when(orchestrator.recalculateGroup(1L, 30L)).thenReturn(new ConsolidationService.RecomputeResult(2, true, List.of("FINAL")));

        mockMvc.perform(post("/api/consolidation/groups/30/recalculate").header("X-Entity-Id", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.childCount").value(2))
                .andExpect(jsonPath("$.partialData").value(true))
                .andExpect(jsonPath("$.missingFlights[0]").value("FINAL"));
    }

    @Test
    void unknownParentIsNotFound() throws Exception {
        when(orchestrator.recalculateGroup(1L, 30L)).thenThrow(new EntityNotFoundException("Game not found: 30"));

        mockMvc.perform(post("/api/consolidation/groups/30/recalculate").header("X-Entity-Id", "1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("not_found"));
    }

    @Test
    void parentOfAnotherEntityIsForbidden() throws Exception {
        when(orchestrator.recalculateGroup(2L, 30L)).thenThrow(new TenantAccessDeniedException("Game", 30L, 2L));

        mockMvc.perform(post("/api/consolidation/groups/30/recalculate").header("X-Entity-Id", "2"))
                .andExpect(status().isForbidden());
    }

    @Test
    void overfullGroupIsConflict() throws Exception {
        when(orchestrator.recalculateGroup(1L, 30L))
                .thenThrow(InvariantViolationException.groupFull("friday-night-nlhe|5|2024-W09", 50));

        mockMvc.perform(post("/api/consolidation/groups/30/recalculate").header("X-Entity-Id", "1"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("Consolidation group 'friday-night-nlhe|5|2024-W09' already holds 50 children"));
    }
}
