package com.pokerpulse.enrichment.controller;

import com.pokerpulse.enrichment.model.AssignmentStatus;
import com.pokerpulse.enrichment.service.AssignmentOutcome;
import com.pokerpulse.enrichment.service.ResolutionPreviewService;
import com.pokerpulse.enrichment.web.TenantAccessDeniedException;
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

@WebMvcTest(controllers = ResolutionController.class)
class ResolutionControllerTest {

    private static final String RECORD = "{\"sourceUrl\":\"https://example.test/1\",\"name\":\"Sydney Championships Event #3\","
            + "\"venueName\":\"The Star\",\"startAt\":\"2024-04-05T19:00:00Z\"}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean private ResolutionPreviewService previewService;

    @Test
    void venuePreviewListsCandidates() throws Exception {
        when(previewService.venue(eq(1L), any())).thenReturn(new ResolutionPreviewService.OutcomeView(
                AssignmentStatus.PENDING_ASSIGNMENT, null, 0.72, "best venue candidate 'The Star Sydney' at 0.7200 needs review",
                List.of(new AssignmentOutcome.Candidate(5L, "The Star Sydney", 0.72)), null));

        mockMvc.perform(post("/api/resolve/venue")
                        .header("X-Entity-Id", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(RECORD))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PENDING_ASSIGNMENT"))
                .andExpect(jsonPath("$.candidates[0].id").value(5))
                .andExpect(jsonPath("$.candidates[0].label").value("The Star Sydney"));
    }

    @Test
    void seriesPreviewSuggestsANameWhenNothingMatches() throws Exception {
        when(previewService.series(eq(1L), any())).thenReturn(new ResolutionPreviewService.OutcomeView(
                AssignmentStatus.UNASSIGNED, null, 0.0, "no known series title matches 'Sydney Championships'",
                List.of(), "Sydney Championships 2024"));

        mockMvc.perform(post("/api/resolve/series")
                        .header("X-Entity-Id", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(RECORD))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UNASSIGNED"))
                .andExpect(jsonPath("$.suggestedName").value("Sydney Championships 2024"));
    }

    @Test
    void explicitVenueOfAnotherEntityIsForbidden() throws Exception {
        when(previewService.venue(eq(1L), any())).thenThrow(new TenantAccessDeniedException("Venue", 99L, 1L));

        mockMvc.perform(post("/api/resolve/venue")
                        .header("X-Entity-Id", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Weekly\",\"venueId\":99}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("tenant_access_denied"))
                .andExpect(jsonPath("$.message").value("Venue 99 does not belong to entity 1"));
    }

    @Test
    void recurringPreviewWithoutAStartIsBadRequest() throws Exception {
        when(previewService.recurring(eq(1L), any())).thenThrow(new IllegalArgumentException("startAt is required"));

        mockMvc.perform(post("/api/resolve/recurring-game")
                        .header("X-Entity-Id", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Friday Night NLHE\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("startAt is required"));
    }
}
