package com.pokerpulse.enrichment.repository;

import com.pokerpulse.enrichment.model.BackgroundTask;
import com.pokerpulse.enrichment.model.TaskStatus;
import com.pokerpulse.enrichment.model.TaskType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
class BackgroundTaskRepositoryTest {

    @Autowired private BackgroundTaskRepository repository;

    private BackgroundTask save(TaskStatus status) {
        BackgroundTask t = new BackgroundTask();
        t.setId(UUID.randomUUID().toString());
        t.setEntityId(1L);
        t.setTaskType(TaskType.RECONSOLIDATE_GROUPS);
        t.setStatus(status);
        t.setTargetIds("[1,2,3]");
        t.setTargetCount(3);
        return repository.saveAndFlush(t);
    }

    @Test
    void cancelIsOnlyAcceptedForOpenTasks() {
        BackgroundTask running = save(TaskStatus.RUNNING);
        BackgroundTask done = save(TaskStatus.COMPLETED);

        assertThat(repository.requestCancel(running.getId())).isEqualTo(1);
        assertThat(repository.requestCancel(done.getId())).isZero();
        assertThat(repository.isCancelRequested(running.getId())).isTrue();
        assertThat(repository.isCancelRequested(done.getId())).isFalse();
    }

    @Test
    void progressAndFinishAreWrittenInPlace() {
        BackgroundTask task = save(TaskStatus.QUEUED);
        Instant started = Instant.parse("2024-03-01T10:00:00Z");

        repository.markRunning(task.getId(), started);
        repository.updateProgress(task.getId(), 2, 1, 1, 66, 2, "{\"errors\":[]}");
        repository.finish(task.getId(), TaskStatus.PARTIAL_SUCCESS, null, started.plusSeconds(60));

        BackgroundTask reloaded = repository.findById(task.getId()).orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo(TaskStatus.PARTIAL_SUCCESS);
        assertThat(reloaded.getStartedAt()).isEqualTo(started);
        assertThat(reloaded.getProcessedCount()).isEqualTo(2);
        assertThat(reloaded.getCheckpointIndex()).isEqualTo(2);
        assertThat(reloaded.getProgressPercent()).isEqualTo(66);
        assertThat(reloaded.getResultPayload()).isEqualTo("{\"errors\":[]}");
    }

    @Test
    void openTasksAreFoundForResumeAndOldOnesPurged() {
        BackgroundTask queued = save(TaskStatus.QUEUED);
        BackgroundTask old = save(TaskStatus.COMPLETED);
        repository.finish(old.getId(), TaskStatus.COMPLETED, null, Instant.now().minus(Duration.ofDays(30)));

        assertThat(repository.findByStatusInOrderByCreatedAtAsc(EnumSet.of(TaskStatus.QUEUED, TaskStatus.RUNNING)))
                .extracting(BackgroundTask::getId).contains(queued.getId()).doesNotContain(old.getId());
        assertThat(repository.purgeFinishedBefore(Instant.now().minus(Duration.ofDays(7)))).isEqualTo(1);
        assertThat(repository.findById(old.getId())).isEmpty();
        assertThat(repository.findById(queued.getId())).isPresent();
    }
}
