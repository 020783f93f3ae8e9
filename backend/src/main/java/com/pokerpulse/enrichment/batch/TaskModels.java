package com.pokerpulse.enrichment.batch;

import com.pokerpulse.enrichment.model.BackgroundTask;
import com.pokerpulse.enrichment.model.TaskStatus;
import com.pokerpulse.enrichment.model.TaskType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public class TaskModels {

    /** One target that failed without stopping the run. */
    public record ItemError(Long targetId, String error) {}

    /** Stored in {@code BackgroundTask.resultPayload}. */
    public static class TaskResult {
        public List<ItemError> errors = new ArrayList<>();
        public int droppedErrors; // failures beyond the retained cap

        public void add(ItemError e, int cap) {
            if (errors.size() < cap) errors.add(e);
            else droppedErrors++;
        }
    }

    public record TaskStatusResponse(String id,
                                     TaskType taskType,
                                     TaskStatus status,
                                     int targetCount,
                                     int processedCount,
                                     int successCount,
                                     int failedCount,
                                     int progressPercent,
                                     boolean cancelRequested,
                                     String resultPayload,
                                     String errorMessage,
                                     Instant createdAt,
                                     Instant startedAt,
                                     Instant finishedAt) {

        public static TaskStatusResponse of(BackgroundTask t) {
            return new TaskStatusResponse(t.getId(), t.getTaskType(), t.getStatus(), nz(t.getTargetCount()),
                    nz(t.getProcessedCount()), nz(t.getSuccessCount()), nz(t.getFailedCount()), nz(t.getProgressPercent()),
                    t.isCancelRequested(), t.getResultPayload(), t.getErrorMessage(), t.getCreatedAt(), t.getStartedAt(),
                    t.getFinishedAt());
        }

        private static int nz(Integer v) {
            return v == null ? 0 : v;
        }
    }
}
