package com.pokerpulse.enrichment.service;

import com.pokerpulse.enrichment.dto.RawGameRecordRequest;
import com.pokerpulse.enrichment.model.RawGameRecord;
import com.pokerpulse.enrichment.repository.RawGameRecordRepository;
import com.pokerpulse.enrichment.web.TenantAccessDeniedException;
import jakarta.persistence.EntityNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Entry point of the raw feed. Stores the observation as received (deduplicated by source URL and payload
 * hash) and hands it to the orchestrator. A failed enrichment leaves the raw row unconsumed for a retry.
 */
@Service
public class IngestionService {
    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final RawGameRecordRepository rawRepository;
    private final EnrichmentOrchestrator orchestrator;
    private final IdempotentCreator creator;
    private final JsonCodec json;

    public IngestionService(RawGameRecordRepository rawRepository, EnrichmentOrchestrator orchestrator,
                            IdempotentCreator creator, JsonCodec json) {
        this.rawRepository = rawRepository;
        this.orchestrator = orchestrator;
        this.creator = creator;
        this.json = json;
    }

    public EnrichmentOrchestrator.EnrichmentResult enrichAndSave(Long entityId, RawGameRecordRequest req) {
        RawGameRecord raw = store(entityId, req);
        return orchestrator.enrich(raw.getId());
    }

    public RawGameRecord store(Long entityId, RawGameRecordRequest req) {
        if (req.getSourceUrl() == null || req.getSourceUrl().isBlank()) {
            throw new IllegalArgumentException("sourceUrl is required");
        }
        if (req.getName() == null || req.getName().isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        req.setEntityId(entityId);
        String payload = json.write(req);
        String hash = sha256Hex(payload.getBytes(StandardCharsets.UTF_8));
        IdempotentCreator.Created<RawGameRecord> created = creator.findOrCreate(
                IdempotentCreator.key("raw", entityId, req.getSourceUrl() + "#" + hash),
                () -> rawRepository.findByEntityIdAndSourceUrlAndPayloadHash(entityId, req.getSourceUrl(), hash),
                () -> {
                    RawGameRecord r = new RawGameRecord();
                    r.setEntityId(entityId);
                    r.setExternalId(req.getExternalId());
                    r.setSourceUrl(req.getSourceUrl());
                    r.setPayloadHash(hash);
                    r.setPayload(payload);
                    return rawRepository.saveAndFlush(r);
                });
        log.info("[Ingest][Raw] entityId={} sourceUrl={} rawId={} new={}", entityId, req.getSourceUrl(),
                created.entity().getId(), created.wasCreated());
        return created.entity();
    }

    /** Re-runs enrichment of a stored raw record, e.g. one left unconsumed by a failure. */
    public EnrichmentOrchestrator.EnrichmentResult reprocess(Long entityId, Long rawRecordId) {
        RawGameRecord raw = rawRepository.findById(rawRecordId)
                .orElseThrow(() -> new EntityNotFoundException("Raw record not found: " + rawRecordId));
        TenantAccessDeniedException.check("RawRecord", rawRecordId, raw.getEntityId(), entityId);
        return orchestrator.enrich(rawRecordId);
    }

    static String sha256Hex(byte[] bytes) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(bytes);
            StringBuilder sb = new StringBuilder();
            for (byte b : digest) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
