package com.pokerpulse.enrichment.controller;

import com.pokerpulse.enrichment.dto.RawGameRecordRequest;
import com.pokerpulse.enrichment.service.ConsolidationService;
import com.pokerpulse.enrichment.service.EnrichmentOrchestrator;
import com.pokerpulse.enrichment.service.ResolutionPreviewService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/consolidation")
@CrossOrigin(origins = "*")
public class ConsolidationController {
    private static final Logger log = LoggerFactory.getLogger(ConsolidationController.class);

    private final ResolutionPreviewService previewService;
    private final EnrichmentOrchestrator orchestrator;

    public ConsolidationController(ResolutionPreviewService previewService, EnrichmentOrchestrator orchestrator) {
        this.previewService = previewService;
        this.orchestrator = orchestrator;
    }

    @PostMapping("/preview")
    public ResolutionPreviewService.ConsolidationPreview preview(@RequestHeader("X-Entity-Id") Long entityId,
                                                                 @RequestBody RawGameRecordRequest request) {
        return previewService.consolidation(entityId, request);
    }

    @PostMapping("/groups/{parentId}/recalculate")
    public ConsolidationService.RecomputeResult recalculate(@RequestHeader("X-Entity-Id") Long entityId,
                                                            @PathVariable Long parentId) {
        log.info("[Consolidation][Recalculate] entityId={} parentId={}", entityId, parentId);
        return orchestrator.recalculateGroup(entityId, parentId);
    }
}
