package com.pokerpulse.enrichment.batch;

import com.pokerpulse.enrichment.dto.ReResolveRequest.Dimension;
import com.pokerpulse.enrichment.dto.TaskSubmissionRequest;
import com.pokerpulse.enrichment.model.SocialPostStatus;
import com.pokerpulse.enrichment.model.TaskType;
import com.pokerpulse.enrichment.repository.GameRepository;
import com.pokerpulse.enrichment.repository.RawGameRecordRepository;
import com.pokerpulse.enrichment.repository.SocialPostRepository;
import com.pokerpulse.enrichment.service.EnrichmentOrchestrator;
import com.pokerpulse.enrichment.service.IngestionService;
import com.pokerpulse.enrichment.service.SocialPostService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.domain.PageRequest;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.function.Supplier;

/** The handler of every {@link TaskType}. */
@Configuration
public class TaskHandlers {

    @Bean
    public TaskHandler venueReassignmentHandler(GameRepository games, EnrichmentOrchestrator orchestrator) {
        return new Handler(TaskType.BULK_VENUE_REASSIGNMENT) {
            @Override
            public List<Long> selectTargets(Long entityId, TaskSubmissionRequest r, int max) {
                if (r.getVenueId() != null || r.getFrom() != null || r.getTo() != null) {
                    return orExplicit(r, max, () -> games.findRecordIds(entityId, r.getVenueId(), start(r), end(r), PageRequest.of(0, max)));
                }
                return orExplicit(r, max, () -> games.findIdsWithOpenVenueAssignment(entityId, PageRequest.of(0, max)));
            }

            @Override
            public void process(Long entityId, Long gameId, TaskSubmissionRequest r) {
                if (r.getAssignVenueId() != null) orchestrator.assignVenue(entityId, gameId, r.getAssignVenueId());
                else orchestrator.reResolve(entityId, gameId, EnumSet.of(Dimension.VENUE), false);
            }
        };
    }

    @Bean
    public TaskHandler recurringDetectionHandler(GameRepository games, EnrichmentOrchestrator orchestrator) {
        return new Handler(TaskType.BULK_RECURRING_DETECTION) {
            @Override
            public List<Long> selectTargets(Long entityId, TaskSubmissionRequest r, int max) {
                return orExplicit(r, max, () -> games.findRecordIds(entityId, r.getVenueId(), start(r), end(r), PageRequest.of(0, max)));
            }

            @Override
            public void process(Long entityId, Long gameId, TaskSubmissionRequest r) {
                orchestrator.reResolve(entityId, gameId, EnumSet.of(Dimension.RECURRING), false);
            }
        };
    }

    @Bean
    public TaskHandler socialReconciliationHandler(SocialPostRepository posts, SocialPostService socialPostService) {
        return new Handler(TaskType.BULK_SOCIAL_RECONCILIATION) {
            @Override
            public List<Long> selectTargets(Long entityId, TaskSubmissionRequest r, int max) {
                return orExplicit(r, max, () -> posts.findIdsByStatus(entityId,
                        EnumSet.of(SocialPostStatus.PENDING, SocialPostStatus.UNMATCHED, SocialPostStatus.MANUAL_REVIEW),
                        PageRequest.of(0, max)));
            }

            @Override
            public void process(Long entityId, Long postId, TaskSubmissionRequest r) {
                socialPostService.reconcile(entityId, postId);
            }
        };
    }

    @Bean
    public TaskHandler rawReprocessingHandler(RawGameRecordRepository raws, IngestionService ingestionService) {
        return new Handler(TaskType.REPROCESS_RAW_RECORDS) {
            @Override
            public List<Long> selectTargets(Long entityId, TaskSubmissionRequest r, int max) {
                return orExplicit(r, max, () -> raws.findUnconsumedIds(entityId, PageRequest.of(0, max)));
            }

            @Override
            public void process(Long entityId, Long rawId, TaskSubmissionRequest r) {
                ingestionService.reprocess(entityId, rawId);
            }
        };
    }

    @Bean
    public TaskHandler reconsolidationHandler(GameRepository games, EnrichmentOrchestrator orchestrator) {
        return new Handler(TaskType.RECONSOLIDATE_GROUPS) {
            @Override
            public List<Long> selectTargets(Long entityId, TaskSubmissionRequest r, int max) {
                return orExplicit(r, max, () -> games.findParentIds(entityId, PageRequest.of(0, max)));
            }

            @Override
            public void process(Long entityId, Long parentId, TaskSubmissionRequest r) {
                orchestrator.recalculateGroup(entityId, parentId);
            }
        };
    }

    abstract static class Handler implements TaskHandler {
        private final TaskType type;

        Handler(TaskType type) {
            this.type = type;
        }

        @Override
        public TaskType type() {
            return type;
        }

        static List<Long> orExplicit(TaskSubmissionRequest r, int max, Supplier<List<Long>> query) {
            if (r.getIds() != null && !r.getIds().isEmpty()) {
                return r.getIds().stream().distinct().limit(max).toList();
            }
            return query.get();
        }

        static LocalDateTime start(TaskSubmissionRequest r) {
            return r.getFrom() == null ? null : r.getFrom().atStartOfDay();
        }

        static LocalDateTime end(TaskSubmissionRequest r) {
            return r.getTo() == null ? null : r.getTo().plusDays(1).atStartOfDay();
        }
    }
}
