package com.pokerpulse.enrichment.controller;

import com.pokerpulse.enrichment.dto.ReResolveRequest;
import com.pokerpulse.enrichment.dto.SeriesConfirmationRequest;
import com.pokerpulse.enrichment.dto.VenueRequest;
import com.pokerpulse.enrichment.model.TournamentSeries;
import com.pokerpulse.enrichment.model.Venue;
import com.pokerpulse.enrichment.service.EnrichmentOrchestrator;
import com.pokerpulse.enrichment.service.IdempotentCreator;
import com.pokerpulse.enrichment.service.VenueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;

/** Operator actions: manual venue assignment, re-resolution, deletion and series confirmation. */
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class GameAdminController {
    private static final Logger log = LoggerFactory.getLogger(GameAdminController.class);

    private final EnrichmentOrchestrator orchestrator;
    private final VenueService venueService;

    public GameAdminController(EnrichmentOrchestrator orchestrator, VenueService venueService) {
        this.orchestrator = orchestrator;
        this.venueService = venueService;
    }

    @PostMapping("/games/{id}/venue")
    public EnrichmentOrchestrator.EnrichmentResult assignVenue(@RequestHeader("X-Entity-Id") Long entityId,
                                                               @PathVariable Long id,
                                                               @RequestBody Map<String, Long> body) {
        Long venueId = body == null ? null : body.get("venueId");
        if (venueId == null) throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "venueId is required");
        log.info("[Admin][AssignVenue] entityId={} gameId={} venueId={}", entityId, id, venueId);
        return orchestrator.assignVenue(entityId, id, venueId);
    }

    @PostMapping("/games/{id}/re-resolve")
    public EnrichmentOrchestrator.EnrichmentResult reResolve(@RequestHeader("X-Entity-Id") Long entityId,
                                                             @PathVariable Long id,
                                                             @RequestBody(required = false) ReResolveRequest body) {
        ReResolveRequest req = body == null ? new ReResolveRequest() : body;
        return orchestrator.reResolve(entityId, id, req.getDimensions(), req.isClearManual());
    }

    @DeleteMapping("/games/{id}")
    public EnrichmentOrchestrator.DeleteResult delete(@RequestHeader("X-Entity-Id") Long entityId, @PathVariable Long id) {
        return orchestrator.deleteGame(entityId, id);
    }

    @PostMapping("/series/confirm")
    public Map<String, Object> confirmSeries(@RequestHeader("X-Entity-Id") Long entityId,
                                             @RequestBody SeriesConfirmationRequest body) {
        if (body.getTitle() == null || body.getTitle().isBlank() || body.getYear() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "title and year are required");
        }
        IdempotentCreator.Created<TournamentSeries> created =
                orchestrator.confirmSeries(entityId, body.getTitle(), body.getYear(), body.getVenueId(), body.getGameId());
        TournamentSeries s = created.entity();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("seriesId", s.getId());
        out.put("titleId", s.getSeriesTitleId());
        out.put("name", s.getName());
        out.put("year", s.getSeriesYear());
        out.put("wasCreated", created.wasCreated());
        return out;
    }

    @PostMapping("/venues")
    public Map<String, Object> createVenue(@RequestHeader("X-Entity-Id") Long entityId, @RequestBody VenueRequest body) {
        if (body.getName() == null || body.getName().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "name is required");
        }
        IdempotentCreator.Created<Venue> created = venueService.findOrCreateVenue(entityId, body.getName(), body.getAddress(), body.getCity());
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("venueId", created.entity().getId());
        out.put("name", created.entity().getName());
        out.put("wasCreated", created.wasCreated());
        return out;
    }
}
