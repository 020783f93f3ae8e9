package com.pokerpulse.enrichment.controller;

import com.pokerpulse.enrichment.dto.RawGameRecordRequest;
import com.pokerpulse.enrichment.dto.SocialPostRequest;
import com.pokerpulse.enrichment.service.EnrichmentOrchestrator;
import com.pokerpulse.enrichment.service.IngestionService;
import com.pokerpulse.enrichment.service.SocialPostService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/ingest")
@CrossOrigin(origins = "*")
public class IngestionController {
    private static final Logger log = LoggerFactory.getLogger(IngestionController.class);

    private final IngestionService ingestionService;
    private final SocialPostService socialPostService;

    public IngestionController(IngestionService ingestionService, SocialPostService socialPostService) {
        this.ingestionService = ingestionService;
        this.socialPostService = socialPostService;
    }

    @PostMapping("/games")
    public EnrichmentOrchestrator.EnrichmentResult ingestGame(@RequestHeader("X-Entity-Id") Long entityId,
                                                              @RequestBody RawGameRecordRequest request) {
        log.info("[Ingest][Game] entityId={} sourceUrl={}", entityId, request.getSourceUrl());
        return ingestionService.enrichAndSave(entityId, request);
    }

    @PostMapping("/social-posts")
    public SocialPostService.ReconcileResult ingestSocialPost(@RequestHeader("X-Entity-Id") Long entityId,
                                                              @RequestBody SocialPostRequest request) {
        log.info("[Ingest][SocialPost] entityId={} externalPostId={}", entityId, request.getExternalPostId());
        return socialPostService.ingest(entityId, request);
    }
}
