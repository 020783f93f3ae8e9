package com.pokerpulse.enrichment.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pokerpulse.enrichment.config.TaskSettings;
import com.pokerpulse.enrichment.dto.TaskSubmissionRequest;
import com.pokerpulse.enrichment.model.BackgroundTask;
import com.pokerpulse.enrichment.model.TaskStatus;
import com.pokerpulse.enrichment.model.TaskType;
import com.pokerpulse.enrichment.repository.BackgroundTaskRepository;
import com.pokerpulse.enrichment.service.JsonCodec;
import com.pokerpulse.enrichment.web.TaskQueueFullException;
import com.pokerpulse.enrichment.web.TenantAccessDeniedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BackgroundTaskRunnerTest {

    private static final String TASK_ID = "task-1";

    @Mock private BackgroundTaskRepository repository;

    private final JsonCodec json = new JsonCodec(new ObjectMapper().findAndRegisterModules());
    private TaskSettings settings;
    private RecordingHandler handler;
    private BackgroundTaskRunner runner;

    /** Processes ids in order and fails the ones it is told to. */
    static class RecordingHandler implements TaskHandler {
        final List<Long> processed = new ArrayList<>();
        Set<Long> badTargets = Set.of();
        Long unreachableAt;

        @Override
        public TaskType type() { return TaskType.BULK_VENUE_REASSIGNMENT; }

        @Override
        public List<Long> selectTargets(Long entityId, TaskSubmissionRequest request, int max) {
            return request.getIds() == null ? List.of() : request.getIds().stream().limit(max).toList();
        }

        @Override
        public void process(Long entityId, Long targetId, TaskSubmissionRequest request) {
            if (targetId.equals(unreachableAt)) {
                throw new DataAccessResourceFailureException("connection refused");
            }
            if (badTargets.contains(targetId)) {
                throw new IllegalArgumentException("bad target " + targetId);
            }
            processed.add(targetId);
        }
    }

    @BeforeEach
    void setUp() {
        settings = new TaskSettings();
        settings.setBatchSize(2);
        handler = new RecordingHandler();
        runner = new BackgroundTaskRunner(repository, List.of(handler), new SyncTaskExecutor(), settings, json);
    }

    private BackgroundTask stored(List<Long> targets) {
        BackgroundTask task = new BackgroundTask();
        task.setId(TASK_ID);
        task.setEntityId(1L);
        task.setTaskType(TaskType.BULK_VENUE_REASSIGNMENT);
        task.setStatus(TaskStatus.QUEUED);
        task.setTargetSelector(json.write(new TaskSubmissionRequest(TaskType.BULK_VENUE_REASSIGNMENT, null)));
        task.setTargetIds(json.write(targets));
        task.setTargetCount(targets.size());
        when(repository.findById(TASK_ID)).thenReturn(Optional.of(task));
        return task;
    }

    @Test
    void submissionFreezesTargetsAndRunsThem() {
        AtomicReference<BackgroundTask> saved = new AtomicReference<>();
        when(repository.save(any(BackgroundTask.class))).thenAnswer(inv -> {
            saved.set(inv.getArgument(0));
            return saved.get();
        });
        when(repository.findById(anyString())).thenAnswer(inv -> Optional.ofNullable(saved.get()));

        String id = runner.submit(1L, new TaskSubmissionRequest(TaskType.BULK_VENUE_REASSIGNMENT, List.of(5L, 6L, 7L)));

        assertThat(saved.get().getId()).isEqualTo(id);
        assertThat(saved.get().getTargetIds()).isEqualTo("[5,6,7]");
        assertThat(saved.get().getTargetCount()).isEqualTo(3);
        assertThat(saved.get().getTargetSelector()).doesNotContain("ids\":[");
        assertThat(handler.processed).containsExactly(5L, 6L, 7L);
        verify(repository).finish(eq(id), eq(TaskStatus.COMPLETED), isNull(), any(Instant.class));
    }

    @Test
    void missingTaskTypeIsRejected() {
        assertThatThrownBy(() -> runner.submit(1L, new TaskSubmissionRequest()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("taskType is required");
    }

    @Test
    void itemFailuresEndAsPartialSuccess() {
        stored(List.of(1L, 2L, 3L));
        handler.badTargets = Set.of(2L);

        runner.execute(TASK_ID);

        assertThat(handler.processed).containsExactly(1L, 3L);
        verify(repository).updateProgress(eq(TASK_ID), eq(2), eq(1), eq(1), eq(66), eq(2),
                argThat(p -> p.contains("IllegalArgumentException: bad target 2")));
        verify(repository).updateProgress(eq(TASK_ID), eq(3), eq(2), eq(1), eq(100), eq(3), anyString());
        verify(repository).finish(eq(TASK_ID), eq(TaskStatus.PARTIAL_SUCCESS), isNull(), any(Instant.class));
    }

    @Test
    void cancellationStopsBeforeTheNextBatch() {
        stored(List.of(1L, 2L, 3L, 4L, 5L));
        when(repository.isCancelRequested(TASK_ID)).thenReturn(false, true);

        runner.execute(TASK_ID);

        assertThat(handler.processed).containsExactly(1L, 2L);
        verify(repository).finish(eq(TASK_ID), eq(TaskStatus.CANCELLED), eq("cancelled after 2 of 5 targets"), any(Instant.class));
    }

    @Test
    void unreachablePersistenceFailsTheWholeTask() {
        stored(List.of(1L, 2L, 3L));
        handler.unreachableAt = 2L;

        runner.execute(TASK_ID);

        assertThat(handler.processed).containsExactly(1L);
        verify(repository).finish(eq(TASK_ID), eq(TaskStatus.FAILED),
                argThat(m -> m.startsWith("persistence unavailable")), any(Instant.class));
        verify(repository, never()).finish(eq(TASK_ID), eq(TaskStatus.PARTIAL_SUCCESS), any(), any());
    }

    @Test
    void resumesFromCheckpoint() {
        BackgroundTask task = stored(List.of(1L, 2L, 3L, 4L));
        task.setStatus(TaskStatus.RUNNING);
        Instant startedAt = Instant.now().minusSeconds(30);
        task.setStartedAt(startedAt);
        task.setCheckpointIndex(2);
        task.setProcessedCount(2);
        task.setSuccessCount(2);
        task.setFailedCount(0);

        runner.execute(TASK_ID);

        assertThat(handler.processed).containsExactly(3L, 4L);
        verify(repository).markRunning(TASK_ID, startedAt);
        verify(repository).updateProgress(eq(TASK_ID), eq(4), eq(4), eq(0), eq(100), eq(4), anyString());
    }

    @Test
    void overrunningTaskTimesOut() {
        settings.setMaxDurationMinutes(1);
        BackgroundTask task = stored(List.of(1L, 2L));
        task.setStatus(TaskStatus.RUNNING);
        task.setStartedAt(Instant.now().minus(Duration.ofHours(2)));

        runner.execute(TASK_ID);

        assertThat(handler.processed).isEmpty();
        verify(repository).finish(eq(TASK_ID), eq(TaskStatus.FAILED), argThat(m -> m.startsWith("timed out after")), any(Instant.class));
    }

    @Test
    void emptyTargetSetCompletesAtFullProgress() {
        stored(List.of());

        runner.execute(TASK_ID);

        verify(repository).updateProgress(eq(TASK_ID), eq(0), eq(0), eq(0), eq(100), eq(0), anyString());
        verify(repository).finish(eq(TASK_ID), eq(TaskStatus.COMPLETED), isNull(), any(Instant.class));
    }

    @Test
    void cancelledEmptyTaskEndsCancelled() {
        stored(List.of());
        when(repository.isCancelRequested(TASK_ID)).thenReturn(true);

        runner.execute(TASK_ID);

        verify(repository).finish(eq(TASK_ID), eq(TaskStatus.CANCELLED), eq("cancelled after 0 of 0 targets"), any(Instant.class));
        verify(repository, never()).finish(eq(TASK_ID), eq(TaskStatus.COMPLETED), any(), any());
    }

    @Test
    void fullQueueFailsTheStoredTask() {
        BackgroundTaskRunner rejecting = new BackgroundTaskRunner(repository, List.of(handler),
                r -> { throw new TaskRejectedException("queue full"); }, settings, json);
        when(repository.save(any(BackgroundTask.class))).thenAnswer(inv -> inv.getArgument(0));

        assertThatThrownBy(() -> rejecting.submit(1L, new TaskSubmissionRequest(TaskType.BULK_VENUE_REASSIGNMENT, List.of(5L))))
                .isInstanceOf(TaskQueueFullException.class)
                .satisfies(e -> assertThat(((TaskQueueFullException) e).getStatus()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE));

        verify(repository).finish(anyString(), eq(TaskStatus.FAILED), eq("task queue full"), any(Instant.class));
        assertThat(handler.processed).isEmpty();
    }

    @Test
    void finishedTasksAreNotRunAgain() {
        BackgroundTask task = stored(List.of(1L));
        task.setStatus(TaskStatus.COMPLETED);

        runner.execute(TASK_ID);

        assertThat(handler.processed).isEmpty();
        verify(repository, never()).markRunning(anyString(), any());
        verify(repository, never()).updateProgress(anyString(), anyInt(), anyInt(), anyInt(), anyInt(), anyInt(), any());
    }

    @Test
    void tasksOfAnotherEntityAreHidden() {
        stored(List.of(1L));

        assertThatThrownBy(() -> runner.get(2L, TASK_ID)).isInstanceOf(TenantAccessDeniedException.class);
    }

    @Test
    void systemicFailureIsDetectedThroughTheCauseChain() {
        RuntimeException wrapped = new IllegalStateException("enrich failed", new DataAccessResourceFailureException("down"));

        assertThat(BackgroundTaskRunner.isSystemic(wrapped)).isTrue();
        assertThat(BackgroundTaskRunner.isSystemic(new IllegalArgumentException("bad"))).isFalse();
    }
}
