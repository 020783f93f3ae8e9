package com.pokerpulse.enrichment.service;

import com.pokerpulse.enrichment.config.ResolutionSettings;
import com.pokerpulse.enrichment.dto.SocialPostRequest;
import com.pokerpulse.enrichment.model.Game;
import com.pokerpulse.enrichment.model.LinkType;
import com.pokerpulse.enrichment.model.ReconciliationRecord;
import com.pokerpulse.enrichment.model.SocialPlacement;
import com.pokerpulse.enrichment.model.SocialPost;
import com.pokerpulse.enrichment.model.SocialPostGameLink;
import com.pokerpulse.enrichment.model.SocialPostStatus;
import com.pokerpulse.enrichment.repository.GameRepository;
import com.pokerpulse.enrichment.repository.ReconciliationRecordRepository;
import com.pokerpulse.enrichment.repository.SocialPostGameLinkRepository;
import com.pokerpulse.enrichment.repository.SocialPostRepository;
import com.pokerpulse.enrichment.web.TenantAccessDeniedException;
import jakarta.persistence.EntityNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class SocialPostService {
    private static final Logger log = LoggerFactory.getLogger(SocialPostService.class);

    private final SocialPostRepository postRepository;
    private final SocialPostGameLinkRepository linkRepository;
    private final ReconciliationRecordRepository reconciliationRepository;
    private final GameRepository gameRepository;
    private final SocialPostReconciler reconciler;
    private final JsonCodec json;
    private final ResolutionSettings settings;

    public SocialPostService(SocialPostRepository postRepository, SocialPostGameLinkRepository linkRepository,
                             ReconciliationRecordRepository reconciliationRepository, GameRepository gameRepository,
                             SocialPostReconciler reconciler, JsonCodec json, ResolutionSettings settings) {
        this.postRepository = postRepository;
        this.linkRepository = linkRepository;
        this.reconciliationRepository = reconciliationRepository;
        this.gameRepository = gameRepository;
        this.reconciler = reconciler;
        this.json = json;
        this.settings = settings;
    }

    public record LinkView(Long gameId, double confidence, boolean primary, LinkType linkType) {}

    public record ReconcileResult(Long postId, SocialPostStatus status, List<LinkView> links,
                                  ReconciliationRecord reconciliation) {}

    /** Upserts the post by external id and matches it straight away. */
    @Transactional
    public ReconcileResult ingest(Long entityId, SocialPostRequest req) {
        if (req.getExternalPostId() == null || req.getExternalPostId().isBlank()) {
            throw new IllegalArgumentException("externalPostId is required");
        }
        SocialPost post = postRepository.findByEntityIdAndExternalPostId(entityId, req.getExternalPostId())
                .orElseGet(SocialPost::new);
        post.setEntityId(entityId);
        post.setExternalPostId(req.getExternalPostId());
        post.setPostedAt(req.getPostedAt());
        post.setExtractedVenueName(req.getVenueName());
        post.setVenueHintId(req.getVenueHintId());
        post.setExtractedDate(req.getDate());
        post.setExtractedBuyIn(req.getBuyIn());
        List<SocialPlacement> placements = new ArrayList<>();
        if (req.getPlacements() != null) {
            for (SocialPostRequest.Placement p : req.getPlacements()) {
                placements.add(new SocialPlacement(p.getPlace(), p.getPlayerName(), p.getCashPrize(), p.getTicketValue()));
            }
        }
        post.getPlacements().clear();
        post.getPlacements().addAll(placements);
        post.setProcessingStatus(SocialPostStatus.PENDING);
        post = postRepository.save(post);
        log.info("[Social][Ingest] entityId={} externalPostId={} postId={} placements={}",
                entityId, req.getExternalPostId(), post.getId(), placements.size());
        return reconcile(entityId, post.getId());
    }

    /**
     * Matches the post to games in its date window. AUTO links are recomputed; MANUAL links stay as they are
     * and a manual primary wins over any automatic one.
     */
    @Transactional
    public ReconcileResult reconcile(Long entityId, Long postId) {
        SocialPost post = loadPost(entityId, postId);
        LocalDate date = SocialPostReconciler.eventDate(post);
        List<ScoredCandidate<Game>> ranked = List.of();
        if (date != null) {
            ranked = reconciler.score(post, candidates(entityId, post, date));
        }

        Map<Long, SocialPostGameLink> existing = new LinkedHashMap<>();
        for (SocialPostGameLink l : linkRepository.findBySocialPostIdOrderByIdAsc(postId)) existing.put(l.getGameId(), l);
        boolean manualPrimary = existing.values().stream()
                .anyMatch(l -> l.getLinkType() == LinkType.MANUAL && l.isPrimaryGame());

        Map<Long, SocialPostGameLink> wanted = new HashMap<>();
        boolean primaryTaken = manualPrimary;
        for (ScoredCandidate<Game> c : ranked) {
            if (c.confidence() < settings.getSocialSecondaryFloor()) break;
            SocialPostGameLink link = existing.get(c.id());
            if (link != null && link.getLinkType() == LinkType.MANUAL) continue;
            boolean primary = !primaryTaken && c.confidence() >= settings.getSocialAutoLinkThreshold();
            if (primary) primaryTaken = true;
            if (link == null) {
                link = new SocialPostGameLink();
                link.setEntityId(entityId);
                link.setSocialPostId(postId);
                link.setGameId(c.id());
                link.setLinkType(LinkType.AUTO);
            }
            link.setMatchConfidence(c.confidence());
            link.setPrimaryGame(primary);
            link.setMatchSignals(json.write(ConfidenceScorer.describe(c.signals())));
            wanted.put(c.id(), linkRepository.save(link));
        }
        for (SocialPostGameLink l : existing.values()) {
            if (l.getLinkType() == LinkType.AUTO && !wanted.containsKey(l.getGameId())) linkRepository.delete(l);
        }
        return finish(post);
    }

    /**
     * Games in the post's date window, nearest day first, capped at the configured maximum. Games at the
     * hinted venue are taken before any other venue's.
     */
    List<Game> candidates(Long entityId, SocialPost post, LocalDate date) {
        int max = settings.getSocialMaxCandidates();
        Map<Long, Game> picked = new LinkedHashMap<>();
        if (post.getVenueHintId() != null) {
            collectNearest(entityId, post.getVenueHintId(), date, max, picked);
        }
        collectNearest(entityId, null, date, max, picked);
        log.debug("[Social][Candidates] postId={} date={} venueHint={} candidates={}",
                post.getId(), date, post.getVenueHintId(), picked.size());
        return new ArrayList<>(picked.values());
    }

    private void collectNearest(Long entityId, Long venueId, LocalDate date, int max, Map<Long, Game> picked) {
        int window = settings.getSocialDateWindowDays();
        for (int distance = 0; distance <= window; distance++) {
            List<LocalDate> days = distance == 0 ? List.of(date) : List.of(date.minusDays(distance), date.plusDays(distance));
            for (LocalDate day : days) {
                if (picked.size() >= max) return;
                for (Game g : gameRepository.findResultCandidates(entityId, venueId, day.atStartOfDay(),
                        day.plusDays(1).atStartOfDay(), PageRequest.of(0, max))) {
                    if (picked.size() >= max) return;
                    picked.putIfAbsent(g.getId(), g);
                }
            }
        }
    }

    /** Records an operator's link. A manual primary demotes every other primary link of the post. */
    @Transactional
    public ReconcileResult manualLink(Long entityId, Long postId, Long gameId, boolean primary) {
        SocialPost post = loadPost(entityId, postId);
        Game game = gameRepository.findById(gameId).orElseThrow(() -> new EntityNotFoundException("Game not found: " + gameId));
        TenantAccessDeniedException.check("Game", gameId, game.getEntityId(), entityId);
        if (primary) {
            for (SocialPostGameLink l : linkRepository.findBySocialPostIdOrderByIdAsc(postId)) {
                if (l.isPrimaryGame() && !l.getGameId().equals(gameId)) {
                    l.setPrimaryGame(false);
                    linkRepository.save(l);
                }
            }
        }
        SocialPostGameLink link = linkRepository.findBySocialPostIdAndGameId(postId, gameId).orElseGet(SocialPostGameLink::new);
        link.setEntityId(entityId);
        link.setSocialPostId(postId);
        link.setGameId(gameId);
        link.setLinkType(LinkType.MANUAL);
        link.setPrimaryGame(primary);
        link.setMatchConfidence(1.0);
        link.setMatchSignals(null);
        linkRepository.save(link);
        log.info("[Social][ManualLink] entityId={} postId={} gameId={} primary={}", entityId, postId, gameId, primary);
        return finish(post);
    }

    /** Recomputes the reconciliation of every post whose primary link points at this game. */
    public void recomputeForGame(Game game) {
        for (SocialPostGameLink link : linkRepository.findByGameId(game.getId())) {
            if (!link.isPrimaryGame()) continue;
            postRepository.findById(link.getSocialPostId()).ifPresent(post -> upsertReconciliation(post, game));
        }
    }

    /** Drops every link and reconciliation that points at a game about to be deleted. */
    public void forgetGame(Long gameId) {
        Set<Long> posts = new HashSet<>();
        for (SocialPostGameLink l : linkRepository.findByGameId(gameId)) posts.add(l.getSocialPostId());
        reconciliationRepository.deleteByGameId(gameId);
        linkRepository.deleteByGameId(gameId);
        for (Long postId : posts) {
            postRepository.findById(postId).ifPresent(p -> {
                p.setProcessingStatus(SocialPostStatus.PENDING);
                postRepository.save(p);
            });
        }
    }

    private ReconcileResult finish(SocialPost post) {
        List<SocialPostGameLink> links = linkRepository.findBySocialPostIdOrderByIdAsc(post.getId());
        SocialPostGameLink primary = links.stream().filter(SocialPostGameLink::isPrimaryGame).findFirst().orElse(null);
        ReconciliationRecord record = null;
        if (primary != null) {
            Game game = gameRepository.findById(primary.getGameId()).orElseThrow();
            record = upsertReconciliation(post, game);
        }
        for (ReconciliationRecord stale : reconciliationRepository.findBySocialPostId(post.getId())) {
            if (primary == null || !stale.getGameId().equals(primary.getGameId())) reconciliationRepository.delete(stale);
        }
        SocialPostStatus status;
        if (primary != null) status = SocialPostStatus.LINKED;
        else status = links.isEmpty() ? SocialPostStatus.UNMATCHED : SocialPostStatus.MANUAL_REVIEW;
        post.setProcessingStatus(status);
        postRepository.save(post);
        log.info("[Social][Reconcile] postId={} status={} links={} severity={}", post.getId(), status, links.size(),
                record == null ? null : record.getSeverity());
        List<LinkView> views = links.stream()
                .map(l -> new LinkView(l.getGameId(), l.getMatchConfidence() == null ? 0.0 : l.getMatchConfidence(),
                        l.isPrimaryGame(), l.getLinkType()))
                .toList();
        return new ReconcileResult(post.getId(), status, views, record);
    }

    private ReconciliationRecord upsertReconciliation(SocialPost post, Game game) {
        ReconciliationRecord record = reconciliationRepository.findBySocialPostIdAndGameId(post.getId(), game.getId())
                .orElseGet(ReconciliationRecord::new);
        reconciler.reconcile(post, game, record);
        record.setComputedAt(Instant.now());
        return reconciliationRepository.save(record);
    }

    private SocialPost loadPost(Long entityId, Long postId) {
        SocialPost post = postRepository.findById(postId)
                .orElseThrow(() -> new EntityNotFoundException("Social post not found: " + postId));
        TenantAccessDeniedException.check("SocialPost", postId, post.getEntityId(), entityId);
        return post;
    }
}
