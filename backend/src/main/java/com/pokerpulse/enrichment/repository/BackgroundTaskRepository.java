package com.pokerpulse.enrichment.repository;

import com.pokerpulse.enrichment.model.BackgroundTask;
import com.pokerpulse.enrichment.model.TaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface BackgroundTaskRepository extends JpaRepository<BackgroundTask, String> {

    List<BackgroundTask> findByStatusInOrderByCreatedAtAsc(Collection<TaskStatus> statuses);

    @Query("select t.cancelRequested from BackgroundTask t where t.id = :id")
    Boolean isCancelRequested(@Param("id") String id);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update BackgroundTask t set t.cancelRequested = true where t.id = :id " +
            "and t.status in (com.pokerpulse.enrichment.model.TaskStatus.QUEUED, com.pokerpulse.enrichment.model.TaskStatus.RUNNING)")
    int requestCancel(@Param("id") String id);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update BackgroundTask t set t.status = com.pokerpulse.enrichment.model.TaskStatus.RUNNING, " +
            "t.startedAt = :startedAt where t.id = :id")
    int markRunning(@Param("id") String id, @Param("startedAt") Instant startedAt);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update BackgroundTask t set t.processedCount = :processed, t.successCount = :success, " +
            "t.failedCount = :failed, t.progressPercent = :percent, t.checkpointIndex = :checkpoint, " +
            "t.resultPayload = :payload where t.id = :id")
    int updateProgress(@Param("id") String id,
                       @Param("processed") int processed,
                       @Param("success") int success,
                       @Param("failed") int failed,
                       @Param("percent") int percent,
                       @Param("checkpoint") int checkpoint,
                       @Param("payload") String payload);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update BackgroundTask t set t.status = :status, t.errorMessage = :error, t.finishedAt = :finishedAt " +
            "where t.id = :id")
    int finish(@Param("id") String id,
               @Param("status") TaskStatus status,
               @Param("error") String error,
               @Param("finishedAt") Instant finishedAt);

    @Transactional
    @Modifying
    @Query("delete from BackgroundTask t where t.finishedAt is not null and t.finishedAt < :cutoff")
    int purgeFinishedBefore(@Param("cutoff") Instant cutoff);
}
