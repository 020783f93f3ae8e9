package com.pokerpulse.enrichment.controller;

import com.pokerpulse.enrichment.dto.SocialLinkRequest;
import com.pokerpulse.enrichment.service.SocialPostService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/social-posts")
@CrossOrigin(origins = "*")
public class SocialPostController {

    private final SocialPostService socialPostService;

    public SocialPostController(SocialPostService socialPostService) {
        this.socialPostService = socialPostService;
    }

    @PostMapping("/{postId}/reconcile")
    public SocialPostService.ReconcileResult reconcile(@RequestHeader("X-Entity-Id") Long entityId, @PathVariable Long postId) {
        return socialPostService.reconcile(entityId, postId);
    }

    @PostMapping("/{postId}/links")
    public SocialPostService.ReconcileResult link(@RequestHeader("X-Entity-Id") Long entityId,
                                                  @PathVariable Long postId,
                                                  @RequestBody SocialLinkRequest body) {
        if (body.getGameId() == null) throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "gameId is required");
        return socialPostService.manualLink(entityId, postId, body.getGameId(), body.isPrimary());
    }
}
