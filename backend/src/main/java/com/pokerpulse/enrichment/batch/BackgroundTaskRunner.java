package com.pokerpulse.enrichment.batch;

import com.fasterxml.jackson.core.type.TypeReference;
import com.pokerpulse.enrichment.config.TaskSettings;
import com.pokerpulse.enrichment.dto.TaskSubmissionRequest;
import com.pokerpulse.enrichment.model.BackgroundTask;
import com.pokerpulse.enrichment.model.TaskStatus;
import com.pokerpulse.enrichment.model.TaskType;
import com.pokerpulse.enrichment.repository.BackgroundTaskRepository;
import com.pokerpulse.enrichment.service.JsonCodec;
import com.pokerpulse.enrichment.web.TaskQueueFullException;
import com.pokerpulse.enrichment.web.TenantAccessDeniedException;
import jakarta.persistence.EntityNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs bulk operations as persisted, resumable tasks. Targets are frozen at submission; the runner walks
 * them in batches, saving progress and a checkpoint after each batch and checking for cancellation and
 * timeout between batches only.
 */
@Service
public class BackgroundTaskRunner {
    private static final Logger log = LoggerFactory.getLogger(BackgroundTaskRunner.class);

    private final BackgroundTaskRepository taskRepository;
    private final Map<TaskType, TaskHandler> handlers = new EnumMap<>(TaskType.class);
    private final TaskExecutor executor;
    private final TaskSettings settings;
    private final JsonCodec json;

    public BackgroundTaskRunner(BackgroundTaskRepository taskRepository,
                                List<TaskHandler> handlers,
                                @Qualifier("backgroundTaskExecutor") TaskExecutor executor,
                                TaskSettings settings,
                                JsonCodec json) {
        this.taskRepository = taskRepository;
        for (TaskHandler h : handlers) this.handlers.put(h.type(), h);
        this.executor = executor;
        this.settings = settings;
        this.json = json;
    }

    public String submit(Long entityId, TaskSubmissionRequest request) {
        BackgroundTask task = createTask(entityId, request);
        dispatch(task.getId());
        return task.getId();
    }

    /** Freezes the target set and stores the task as QUEUED. */
    BackgroundTask createTask(Long entityId, TaskSubmissionRequest request) {
        if (request == null || request.getTaskType() == null) throw new IllegalArgumentException("taskType is required");
        TaskHandler handler = handlerFor(request.getTaskType());
        List<Long> targets = handler.selectTargets(entityId, request, settings.getMaxTargets());

        TaskSubmissionRequest selector = new TaskSubmissionRequest(request.getTaskType(), null);
        selector.setVenueId(request.getVenueId());
        selector.setFrom(request.getFrom());
        selector.setTo(request.getTo());
        selector.setAssignVenueId(request.getAssignVenueId());

        BackgroundTask task = new BackgroundTask();
        task.setId(UUID.randomUUID().toString());
        task.setEntityId(entityId);
        task.setTaskType(request.getTaskType());
        task.setStatus(TaskStatus.QUEUED);
        task.setTargetSelector(json.write(selector));
        task.setTargetIds(json.write(targets));
        task.setTargetCount(targets.size());
        task.setProcessedCount(0);
        task.setSuccessCount(0);
        task.setFailedCount(0);
        task.setProgressPercent(0);
        task.setCheckpointIndex(0);
        task = taskRepository.save(task);
        log.info("[Task][Submit] taskId={} entityId={} type={} targets={}", task.getId(), entityId, task.getTaskType(), targets.size());
        return task;
    }

    /** Hands the task to the executor. A full queue fails the stored task instead of leaving it QUEUED. */
    private void dispatch(String taskId) {
        try {
            executor.execute(() -> {
                try {
                    execute(taskId);
                } catch (RuntimeException e) {
                    log.error("[Task][Crash] taskId={} {}", taskId, e.getMessage(), e);
                    taskRepository.finish(taskId, TaskStatus.FAILED, truncate(e.getMessage()), Instant.now());
                }
            });
        } catch (TaskRejectedException e) {
            log.warn("[Task][Rejected] taskId={} {}", taskId, e.getMessage());
            finish(taskId, TaskStatus.FAILED, "task queue full");
            throw new TaskQueueFullException(taskId, e);
        }
    }

    public BackgroundTask get(Long entityId, String taskId) {
        BackgroundTask task = taskRepository.findById(taskId)
                .orElseThrow(() -> new EntityNotFoundException("Task not found: " + taskId));
        TenantAccessDeniedException.check("Task", taskId, task.getEntityId(), entityId);
        return task;
    }

    /** Flags the task; the runner stops before its next batch. Terminal tasks are left as they are. */
    public BackgroundTask cancel(Long entityId, String taskId) {
        get(entityId, taskId);
        int updated = taskRepository.requestCancel(taskId);
        log.info("[Task][Cancel] taskId={} accepted={}", taskId, updated > 0);
        return get(entityId, taskId);
    }

    /** Runs (or resumes from its checkpoint) one task on the calling thread. */
    void execute(String taskId) {
        BackgroundTask task = taskRepository.findById(taskId).orElse(null);
        if (task == null || task.getStatus().isTerminal()) return;
        TaskHandler handler = handlerFor(task.getTaskType());
        TaskSubmissionRequest selector = json.read(task.getTargetSelector(), TaskSubmissionRequest.class);
        List<Long> targets = json.read(task.getTargetIds(), new TypeReference<List<Long>>() {});
        TaskModels.TaskResult result = task.getResultPayload() == null
                ? new TaskModels.TaskResult() : json.read(task.getResultPayload(), TaskModels.TaskResult.class);

        Instant startedAt = task.getStartedAt() != null ? task.getStartedAt() : Instant.now();
        taskRepository.markRunning(taskId, startedAt);
        Instant deadline = startedAt.plus(settings.getMaxDuration());
        int index = nz(task.getCheckpointIndex());
        int processed = nz(task.getProcessedCount());
        int success = nz(task.getSuccessCount());
        int failed = nz(task.getFailedCount());
        int total = targets.size();
        if (index > 0) log.info("[Task][Resume] taskId={} from index={} of {}", taskId, index, total);

        if (index >= total && cancelRequested(taskId)) {
            finish(taskId, TaskStatus.CANCELLED, "cancelled after " + processed + " of " + total + " targets");
            return;
        }
        while (index < total) {
            if (cancelRequested(taskId)) {
                finish(taskId, TaskStatus.CANCELLED, "cancelled after " + processed + " of " + total + " targets");
                return;
            }
            if (Instant.now().isAfter(deadline)) {
                finish(taskId, TaskStatus.FAILED, "timed out after " + Duration.between(startedAt, Instant.now()).toMinutes() + " minutes");
                return;
            }
            List<Long> batch = targets.subList(index, Math.min(index + settings.getBatchSize(), total));
            for (Long targetId : batch) {
                try {
                    handler.process(task.getEntityId(), targetId, selector);
                    success++;
                } catch (RuntimeException e) {
                    if (isSystemic(e)) {
                        taskRepository.updateProgress(taskId, processed, success, failed, percent(processed, total), index, json.write(result));
                        log.error("[Task][Systemic] taskId={} target={} {}", taskId, targetId, e.getMessage());
                        finish(taskId, TaskStatus.FAILED, "persistence unavailable: " + e.getMessage());
                        return;
                    }
                    failed++;
                    result.add(new TaskModels.ItemError(targetId, e.getClass().getSimpleName() + ": " + e.getMessage()), settings.getMaxItemErrors());
                    log.warn("[Task][Item] taskId={} target={} failed: {}", taskId, targetId, e.getMessage());
                }
            }
            processed += batch.size();
            index += batch.size();
            taskRepository.updateProgress(taskId, processed, success, failed, percent(processed, total), index, json.write(result));
            log.info("[Task][Batch] taskId={} processed={}/{} success={} failed={}", taskId, processed, total, success, failed);
        }
        if (total == 0) {
            taskRepository.updateProgress(taskId, 0, 0, 0, 100, 0, json.write(result));
        }
        finish(taskId, failed > 0 ? TaskStatus.PARTIAL_SUCCESS : TaskStatus.COMPLETED, null);
    }

    private boolean cancelRequested(String taskId) {
        return Boolean.TRUE.equals(taskRepository.isCancelRequested(taskId));
    }

    private void finish(String taskId, TaskStatus status, String error) {
        taskRepository.finish(taskId, status, truncate(error), Instant.now());
        log.info("[Task][Finish] taskId={} status={}{}", taskId, status, error == null ? "" : " error=" + error);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void resumeInterrupted() {
        if (!settings.isResumeOnStartup()) return;
        List<BackgroundTask> open = taskRepository.findByStatusInOrderByCreatedAtAsc(EnumSet.of(TaskStatus.QUEUED, TaskStatus.RUNNING));
        for (BackgroundTask t : open) {
            log.info("[Task][Resume] taskId={} status={} checkpoint={}", t.getId(), t.getStatus(), t.getCheckpointIndex());
            try {
                dispatch(t.getId());
            } catch (TaskQueueFullException e) {
                log.warn("[Task][Resume] taskId={} not resumed: {}", t.getId(), e.getMessage());
            }
        }
    }

    @Scheduled(cron = "0 0 * * * *") // hourly cleanup
    public void purgeFinished() {
        Instant cutoff = Instant.now().minus(Duration.ofDays(settings.getRetentionDays()));
        int removed = taskRepository.purgeFinishedBefore(cutoff);
        if (removed > 0) log.info("[Task][Purge] removed={} finished before {}", removed, cutoff);
    }

    private TaskHandler handlerFor(TaskType type) {
        TaskHandler handler = handlers.get(type);
        if (handler == null) throw new IllegalArgumentException("No handler for task type " + type);
        return handler;
    }

    /** Persistence unreachable, as opposed to one bad item. */
    static boolean isSystemic(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof DataAccessResourceFailureException || t instanceof CannotCreateTransactionException) return true;
            if (t.getCause() == t) break;
        }
        return false;
    }

    private static int percent(int processed, int total) {
        return total == 0 ? 100 : (int) Math.min(100, (processed * 100L) / total);
    }

    private static int nz(Integer v) {
        return v == null ? 0 : v;
    }

    private static String truncate(String s) {
        if (s == null) return null;
        return s.length() > 1000 ? s.substring(0, 1000) : s;
    }
}
