package com.pokerpulse.enrichment.controller;

import com.pokerpulse.enrichment.dto.RawGameRecordRequest;
import com.pokerpulse.enrichment.service.ResolutionPreviewService;
import org.springframework.web.bind.annotation.*;

/** Dry-run resolution; nothing is created or assigned. */
@RestController
@RequestMapping("/api/resolve")
@CrossOrigin(origins = "*")
public class ResolutionController {

    private final ResolutionPreviewService previewService;

    public ResolutionController(ResolutionPreviewService previewService) {
        this.previewService = previewService;
    }

    @PostMapping("/venue")
    public ResolutionPreviewService.OutcomeView venue(@RequestHeader("X-Entity-Id") Long entityId,
                                                      @RequestBody RawGameRecordRequest request) {
        return previewService.venue(entityId, request);
    }

    @PostMapping("/series")
    public ResolutionPreviewService.OutcomeView series(@RequestHeader("X-Entity-Id") Long entityId,
                                                       @RequestBody RawGameRecordRequest request) {
        return previewService.series(entityId, request);
    }

    @PostMapping("/recurring-game")
    public ResolutionPreviewService.OutcomeView recurringGame(@RequestHeader("X-Entity-Id") Long entityId,
                                                              @RequestBody RawGameRecordRequest request) {
        return previewService.recurring(entityId, request);
    }
}
