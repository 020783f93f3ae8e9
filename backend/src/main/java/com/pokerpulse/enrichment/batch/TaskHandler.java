package com.pokerpulse.enrichment.batch;

import com.pokerpulse.enrichment.dto.TaskSubmissionRequest;
import com.pokerpulse.enrichment.model.TaskType;

import java.util.List;

/** Work of one task type: which ids it targets and what it does to each. */
public interface TaskHandler {

    TaskType type();

    /** Target ids in processing order, at most {@code max}. Explicit ids in the request win over filters. */
    List<Long> selectTargets(Long entityId, TaskSubmissionRequest request, int max);

    /** Processes one target. Throwing marks only this item as failed. */
    void process(Long entityId, Long targetId, TaskSubmissionRequest request);
}
