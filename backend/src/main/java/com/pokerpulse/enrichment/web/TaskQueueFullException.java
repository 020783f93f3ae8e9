package com.pokerpulse.enrichment.web;

import org.springframework.http.HttpStatus;

/** The background executor had no room for another task. The task is stored as FAILED. */
public class TaskQueueFullException extends EnrichmentException {

    private final String taskId;

    public TaskQueueFullException(String taskId, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "task_queue_full", "Task queue is full, task " + taskId + " was not started", cause);
        this.taskId = taskId;
    }

    public String getTaskId() { return taskId; }
}
