package com.pokerpulse.enrichment.controller;

import com.pokerpulse.enrichment.dto.RawGameRecordRequest;
import com.pokerpulse.enrichment.dto.SocialPostRequest;
import com.pokerpulse.enrichment.model.LinkType;
import com.pokerpulse.enrichment.model.SocialPostStatus;
import com.pokerpulse.enrichment.service.IngestionService;
import com.pokerpulse.enrichment.service.SocialPostService;
import com.pokerpulse.enrichment.web.InvariantViolationException;
import com.pokerpulse.enrichment.web.TransientPersistenceException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = IngestionController.class)
class IngestionControllerTest {

    private static final String GAME = "{\"sourceUrl\":\"https://example.test/1\",\"name\":\"Friday Night NLHE\","
            + "\"venueName\":\"Joe's Card Room\",\"startAt\":\"2024-03-01T19:00:00Z\",\"buyIn\":100}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean private IngestionService ingestionService;
    @MockBean private SocialPostService socialPostService;

    @Test
    void gameIsHandedToIngestionForTheCallingEntity() throws Exception {
        mockMvc.perform(post("/api/ingest/games")
                        .header("X-Entity-Id", "7")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(GAME))
                .andExpect(status().isOk());

        verify(ingestionService).enrichAndSave(eq(7L),
                argThat((RawGameRecordRequest r) -> "https://example.test/1".equals(r.getSourceUrl())));
    }

    @Test
    void missingEntityHeaderIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/ingest/games")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(GAME))
                .andExpect(status().isBadRequest());
    }

    @Test
    void invalidRecordIsBadRequest() throws Exception {
        when(ingestionService.enrichAndSave(eq(7L), any())).thenThrow(new IllegalArgumentException("sourceUrl is required"));

        mockMvc.perform(post("/api/ingest/games")
                        .header("X-Entity-Id", "7")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Friday Night NLHE\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("bad_request"))
                .andExpect(jsonPath("$.message").value("sourceUrl is required"));
    }

    @Test
    void brokenConsolidationGroupIsConflict() throws Exception {
        when(ingestionService.enrichAndSave(eq(7L), any()))
                .thenThrow(InvariantViolationException.duplicateGroup(7L, "friday-night-nlhe|5|2024-W09", 2));

        mockMvc.perform(post("/api/ingest/games")
                        .header("X-Entity-Id", "7")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(GAME))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("invariant_violation"));
    }

    @Test
    void exhaustedRetriesAreServiceUnavailable() throws Exception {
        when(ingestionService.enrichAndSave(eq(7L), any()))
                .thenThrow(new TransientPersistenceException("enrich raw 3 failed after 3 attempts",
                        new CannotAcquireLockException("lock wait timeout")));

        mockMvc.perform(post("/api/ingest/games")
                        .header("X-Entity-Id", "7")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(GAME))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("persistence_unavailable"));
    }

    @Test
    void socialPostIsMatchedOnIngest() throws Exception {
        when(socialPostService.ingest(eq(7L), any(SocialPostRequest.class)))
                .thenReturn(new SocialPostService.ReconcileResult(40L, SocialPostStatus.LINKED,
                        List.of(new SocialPostService.LinkView(9L, 0.92, true, LinkType.AUTO)), null));

        mockMvc.perform(post("/api/ingest/social-posts")
                        .header("X-Entity-Id", "7")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"externalPostId\":\"fb-1\",\"date\":\"2024-03-02\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.postId").value(40))
                .andExpect(jsonPath("$.status").value("LINKED"))
                .andExpect(jsonPath("$.links[0].gameId").value(9))
                .andExpect(jsonPath("$.links[0].primary").value(true));
    }
}
