package com.pokerpulse.enrichment.controller;

import com.pokerpulse.enrichment.model.LinkType;
import com.pokerpulse.enrichment.model.SocialPostStatus;
import com.pokerpulse.enrichment.service.SocialPostService;
import com.pokerpulse.enrichment.web.TenantAccessDeniedException;
import com.pokerpulse.enrichment.web.TransientPersistenceException;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = SocialPostController.class)
class SocialPostControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean private SocialPostService socialPostService;

    @Test
    void manualLinkDefaultsToPrimary() throws Exception {
        when(socialPostService.manualLink(1L, 40L, 9L, true)).thenReturn(new SocialPostService.ReconcileResult(
                40L, SocialPostStatus.LINKED, List.of(new SocialPostService.LinkView(9L, 1.0, true, LinkType.MANUAL)), null));

        mockMvc.perform(post("/api/social-posts/40/links")
                        .header("X-Entity-Id", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"gameId\":9}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.links[0].linkType").value("MANUAL"))
                .andExpect(jsonPath("$.links[0].primary").value(true));
    }

    @Test
    void manualLinkNeedsAGameId() throws Exception {
        mockMvc.perform(post("/api/social-posts/40/links")
                        .header("X-Entity-Id", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"primary\":false}"))
                .andExpect(status().isBadRequest());

        verify(socialPostService, never()).manualLink(anyLong(), anyLong(), anyLong(), anyBoolean());
    }

    @Test
    void linkingAnotherEntitysGameIsForbidden() throws Exception {
        when(socialPostService.manualLink(1L, 40L, 9L, false)).thenThrow(new TenantAccessDeniedException("Game", 9L, 1L));

        mockMvc.perform(post("/api/social-posts/40/links")
                        .header("X-Entity-Id", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"gameId\":9,\"primary\":false}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("tenant_access_denied"));
    }

    @Test
    void reconcilingAnUnknownPostIsNotFound() throws Exception {
        when(socialPostService.reconcile(1L, 40L)).thenThrow(new EntityNotFoundException("Social post not found: 40"));

        mockMvc.perform(post("/api/social-posts/40/reconcile").header("X-Entity-Id", "1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Social post not found: 40"));
    }

    @Test
    void reconcileDuringAnOutageIsServiceUnavailable() throws Exception {
        when(socialPostService.reconcile(1L, 40L))
                .thenThrow(new TransientPersistenceException("database unavailable", null));

        mockMvc.perform(post("/api/social-posts/40/reconcile").header("X-Entity-Id", "1"))
                .andExpect(status().isServiceUnavailable());
    }
}
